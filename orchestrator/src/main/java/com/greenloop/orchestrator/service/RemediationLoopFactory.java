package com.greenloop.orchestrator.service;

import com.greenloop.orchestrator.collaborator.PatchGenerator;
import com.greenloop.orchestrator.config.LoopProperties;
import com.greenloop.orchestrator.config.ToolboxProperties;
import com.greenloop.orchestrator.loop.CompletionGate;
import com.greenloop.orchestrator.loop.LoopSettings;
import com.greenloop.orchestrator.loop.RemediationLoop;
import com.greenloop.orchestrator.loop.Sleeper;
import com.greenloop.orchestrator.loop.StateProbe;
import com.greenloop.orchestrator.loop.TriageController;
import com.greenloop.orchestrator.loop.WorkflowExecutor;
import com.greenloop.orchestrator.model.Run;
import com.greenloop.orchestrator.policy.PatchPolicy;
import com.greenloop.orchestrator.toolbox.ToolboxClient;
import com.greenloop.orchestrator.toolbox.ToolboxWorkspace;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Wires a fresh {@link RemediationLoop} for one run.
 *
 * Every run gets its own loop, gate and guard so that no history or
 * publication flag leaks from one run into the next.
 */
@Component
public class RemediationLoopFactory {

    private final ToolboxClient     toolbox;
    private final ToolboxProperties toolboxProperties;
    private final LoopProperties    loopProperties;
    private final PatchGenerator    generator;
    private final MeterRegistry     meterRegistry;

    public RemediationLoopFactory(ToolboxClient toolbox,
                                  ToolboxProperties toolboxProperties,
                                  LoopProperties loopProperties,
                                  PatchGenerator generator,
                                  MeterRegistry meterRegistry) {
        this.toolbox           = toolbox;
        this.toolboxProperties = toolboxProperties;
        this.loopProperties    = loopProperties;
        this.generator         = generator;
        this.meterRegistry     = meterRegistry;
    }

    public RemediationLoop create(Run run) {
        LoopSettings settings = loopProperties.toSettings();
        Clock clock = Clock.systemUTC();
        ToolboxWorkspace workspace = new ToolboxWorkspace(toolbox, run.getWorkspaceRef(),
                toolboxProperties.getRemote(), run.getBranch(), run.getBaseBranch());

        StateProbe probe = new StateProbe(workspace, workspace, workspace, workspace.coverageReporter());
        WorkflowExecutor executor = new WorkflowExecutor(workspace, workspace, generator, workspace,
                new PatchPolicy(loopProperties.getMaxChangedLines()), settings, clock);
        CompletionGate gate = new CompletionGate(workspace, settings, Sleeper.SYSTEM);

        return new RemediationLoop(probe, new TriageController(), executor, gate, workspace,
                settings, meterRegistry, clock);
    }
}
