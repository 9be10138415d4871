package com.example.oncallrotation.domain.entity;

import com.example.oncallrotation.cron.CronEvaluator;
import com.example.oncallrotation.cron.CronOccurrence;
import com.example.oncallrotation.domain.converter.EncryptedTokenConverter;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.Optional;

/**
 * One team's rule for rotating a Slack user group from a PagerDuty schedule.
 * <p>
 * The task owns its cron state: {@code nextOccurrenceUtc} is the epoch second of the next run, or
 * {@link #RETIRED} once the expression has no future match. Retired tasks are never due and never
 * wake the system.
 */
@Entity
@IdClass(RotationTaskKey.class)
@Table(name = "rotation_tasks", indexes = {
        @Index(name = "idx_rotation_task_next_occurrence", columnList = "next_occurrence_utc"),
        @Index(name = "idx_rotation_task_channel", columnList = "team, channel_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString(exclude = "pagerDutyToken")
public class RotationTask {

    public static final long RETIRED = -1;

    /**
     * "{teamId}:{enterpriseId}"
     */
    @Id
    @Column(name = "team", nullable = false, length = 100)
    private String team;

    /**
     * "{channelName}:{channelId}:{userGroupHandle}:{userGroupId}:{pagerDutyScheduleId}"
     */
    @Id
    @Column(name = "task_id", nullable = false, length = 400)
    private String taskId;

    // === Schedule ===

    /**
     * Cron expression as entered by the user
     */
    @Column(name = "cron_expression", nullable = false, length = 100)
    private String cronExpression;

    /**
     * IANA timezone id the cron expression is evaluated in
     */
    @Column(name = "time_zone", nullable = false, length = 64)
    private String timezone;

    @Column(name = "next_occurrence_utc", nullable = false)
    private long nextOccurrenceUtc;

    /**
     * Next occurrence as an ISO-8601 offset date-time in {@link #timezone}, empty when retired
     */
    @Column(name = "next_occurrence_local", length = 40)
    private String nextOccurrenceLocal;

    // === Target ===

    @Column(name = "team_id", nullable = false, length = 32)
    private String teamId;

    @Column(name = "team_domain", length = 100)
    private String teamDomain;

    @Column(name = "enterprise_id", length = 32)
    private String enterpriseId;

    @Column(name = "enterprise_name", length = 100)
    private String enterpriseName;

    @Column(name = "enterprise_install", nullable = false)
    private boolean enterpriseInstall;

    @Column(name = "channel_id", nullable = false, length = 32)
    private String channelId;

    @Column(name = "channel_name", length = 100)
    private String channelName;

    @Column(name = "user_group_id", nullable = false, length = 32)
    private String userGroupId;

    @Column(name = "user_group_handle", nullable = false, length = 100)
    private String userGroupHandle;

    @Column(name = "pagerduty_schedule_id", nullable = false, length = 32)
    private String pagerDutyScheduleId;

    /**
     * Overrides the workspace PagerDuty token for this task only
     */
    @Convert(converter = EncryptedTokenConverter.class)
    @Column(name = "pagerduty_token", length = 512)
    private String pagerDutyToken;

    // === Audit ===

    @Column(name = "created_by_user_id", length = 32)
    private String createdByUserId;

    @Column(name = "created_by_user_name", length = 100)
    private String createdByUserName;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "last_updated_at", nullable = false)
    private Instant lastUpdatedAt;

    public static String teamScopeOf(String teamId, String enterpriseId) {
        return String.format("%s:%s", teamId, enterpriseId == null ? "" : enterpriseId);
    }

    public static String taskIdOf(String channelName, String channelId, String userGroupHandle,
                                  String userGroupId, String pagerDutyScheduleId) {
        return String.join(":", channelName, channelId, userGroupHandle, userGroupId, pagerDutyScheduleId);
    }

    public RotationTaskKey getKey() {
        return new RotationTaskKey(team, taskId);
    }

    public boolean isRetired() {
        return nextOccurrenceUtc <= 0;
    }

    public boolean isDue(Instant now) {
        return !isRetired() && nextOccurrenceUtc <= now.getEpochSecond();
    }

    public Optional<CronOccurrence> calculateNextOccurrence(Instant from) {
        return CronEvaluator.nextOccurrence(cronExpression, timezone, from);
    }

    /**
     * Moves the task to {@code occurrence}, or retires it when there is none.
     */
    public void advanceTo(Optional<CronOccurrence> occurrence, Instant now) {
        if (occurrence.isPresent()) {
            nextOccurrenceUtc = occurrence.get().getNextTimestampUtc();
            nextOccurrenceLocal = occurrence.get().formatLocal();
        } else {
            nextOccurrenceUtc = RETIRED;
            nextOccurrenceLocal = "";
        }
        lastUpdatedAt = now;
    }

    public String describe() {
        return String.format("%s/%s", team, taskId);
    }
}
