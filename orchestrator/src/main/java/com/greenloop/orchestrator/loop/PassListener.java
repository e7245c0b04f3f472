package com.greenloop.orchestrator.loop;

import com.greenloop.orchestrator.model.IterationRecord;

import java.util.UUID;

/** Notified after every pass is recorded; the service uses it for the audit ledger. */
@FunctionalInterface
public interface PassListener {

    PassListener NONE = (runId, record) -> {};

    void onPass(UUID runId, IterationRecord record);
}
