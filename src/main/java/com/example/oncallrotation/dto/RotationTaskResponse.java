package com.example.oncallrotation.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response DTO for rotation task data. Tokens are never exposed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RotationTaskResponse {

    private String team;
    private String taskId;
    private String cronExpression;
    private String timezone;
    private long nextOccurrenceUtc;
    private String nextOccurrenceLocal;
    private boolean retired;
    private String teamId;
    private String teamDomain;
    private String channelId;
    private String channelName;
    private String userGroupId;
    private String userGroupHandle;
    private String pagerDutyScheduleId;

    /**
     * Whether the task carries its own PagerDuty token
     */
    private boolean hasPagerDutyToken;

    private String createdByUserId;
    private String createdByUserName;
    private Instant createdAt;
    private Instant lastUpdatedAt;
}
