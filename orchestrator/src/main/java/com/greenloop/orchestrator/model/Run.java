package com.greenloop.orchestrator.model;

import jakarta.persistence.*;
import org.hibernate.annotations.DynamicUpdate;
import java.time.Instant;
import java.util.UUID;

/**
 * One remediation run against a workspace.
 *
 * The scheduler claims PENDING runs one at a time; the loop's termination
 * is written back here when the run ends.
 *
 * DB table: runs  (created by Flyway V1 migration)
 */
@Entity
@DynamicUpdate
@Table(name = "runs")
public class Run {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    // Workspace on the toolbox service; already cloned and checked out.
    @Column(name = "workspace_ref", nullable = false)
    private String workspaceRef;

    // Branch the loop commits on and pushes.
    @Column(nullable = false)
    private String branch;

    // Pull request target.
    @Column(name = "base_branch", nullable = false)
    private String baseBranch = "main";

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private RunState state = RunState.PENDING;

    @Column(name = "cancel_requested", nullable = false)
    private boolean cancelRequested = false;

    @Column(name = "pass_count", nullable = false)
    private int passCount = 0;

    @Column(nullable = false)
    private boolean published = false;

    // HaltReason or error kind for BLOCKED/ABORTED runs.
    @Column(name = "termination_code")
    private String terminationCode;

    @Column(columnDefinition = "TEXT")
    private String diagnostic;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Run() {}   // required by JPA

    public Run(String workspaceRef, String branch, String baseBranch) {
        this.workspaceRef = workspaceRef;
        this.branch       = branch;
        this.baseBranch   = baseBranch;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID     getId()              { return id; }
    public String   getWorkspaceRef()    { return workspaceRef; }
    public String   getBranch()          { return branch; }
    public String   getBaseBranch()      { return baseBranch; }
    public RunState getState()           { return state; }
    public boolean  isCancelRequested()  { return cancelRequested; }
    public int      getPassCount()       { return passCount; }
    public boolean  isPublished()        { return published; }
    public String   getTerminationCode() { return terminationCode; }
    public String   getDiagnostic()      { return diagnostic; }
    public Instant  getCreatedAt()       { return createdAt; }
    public Instant  getUpdatedAt()       { return updatedAt; }
    public Instant  getStartedAt()       { return startedAt; }
    public Instant  getFinishedAt()      { return finishedAt; }

    public void setState(RunState state)              { this.state = state; }
    public void setCancelRequested(boolean v)         { this.cancelRequested = v; }
    public void setPassCount(int passCount)           { this.passCount = passCount; }
    public void setPublished(boolean published)       { this.published = published; }
    public void setTerminationCode(String code)       { this.terminationCode = code; }
    public void setDiagnostic(String diagnostic)      { this.diagnostic = diagnostic; }
    public void setStartedAt(Instant t)               { this.startedAt = t; }
    public void setFinishedAt(Instant t)              { this.finishedAt = t; }
}
