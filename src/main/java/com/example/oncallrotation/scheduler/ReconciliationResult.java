package com.example.oncallrotation.scheduler;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Outcome of one trigger reconciliation
 */
@Value
@Builder
public class ReconciliationResult {

    /**
     * Name of the trigger created by this call, null when an existing one was kept
     */
    String createdTrigger;

    @Singular
    List<String> deletedTriggers;

    /**
     * Epoch second the system will wake up at next
     */
    long effectiveNextTimestampUtc;

    public boolean created() {
        return createdTrigger != null;
    }
}
