package com.greenloop.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * Persisted copy of one {@link IterationRecord}.
 *
 * Written as each pass is recorded; the run's in-memory history remains
 * the source of truth while the run is active.
 *
 * DB table: passes  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "passes")
public class Pass {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "run_id", nullable = false)
    private Run run;

    @Column(name = "pass_number", nullable = false)
    private int passNumber;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Workflow workflow;

    @Column(name = "target_key")
    private String targetKey;

    @Column(name = "target_label")
    private String targetLabel;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Outcome outcome;

    @Column(columnDefinition = "TEXT")
    private String detail;

    @Column(name = "recorded_at", nullable = false)
    private Instant recordedAt;

    protected Pass() {}   // required by JPA

    public Pass(Run run, IterationRecord record) {
        this.run         = run;
        this.passNumber  = record.pass();
        this.workflow    = record.workflow();
        this.targetKey   = record.targetKey();
        this.targetLabel = record.target() != null ? record.target().describe() : null;
        this.outcome     = record.outcome();
        this.detail      = record.detail();
        this.recordedAt  = record.timestamp();
    }

    public UUID     getId()          { return id; }
    public Run      getRun()         { return run; }
    public int      getPassNumber()  { return passNumber; }
    public Workflow getWorkflow()    { return workflow; }
    public String   getTargetKey()   { return targetKey; }
    public String   getTargetLabel() { return targetLabel; }
    public Outcome  getOutcome()     { return outcome; }
    public String   getDetail()      { return detail; }
    public Instant  getRecordedAt()  { return recordedAt; }
}
