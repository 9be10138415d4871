package com.example.oncallrotation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Result of one rotation run
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RunSummary {

    private Instant startedAt;
    private int totalTasks;
    private int dueTasks;
    private int succeeded;
    private int failed;

    /**
     * Syncs that changed a group's membership
     */
    private int changed;

    /**
     * Next wake-up in epoch seconds, null when no task has a future occurrence
     */
    private Long nextWakeUpUtc;

    private String createdTrigger;
    private List<String> deletedTriggers;
}
