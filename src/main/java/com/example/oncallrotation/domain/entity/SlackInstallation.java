package com.example.oncallrotation.domain.entity;

import com.example.oncallrotation.domain.converter.EncryptedTokenConverter;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Credentials of a Slack workspace that installed the app
 */
@Entity
@Table(name = "slack_installations", indexes = {
        @Index(name = "idx_slack_installation_team_id", columnList = "team_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString(exclude = {"accessToken", "pagerDutyToken"})
public class SlackInstallation {

    /**
     * "{teamId}:{enterpriseId}"
     */
    @Id
    @Column(name = "id", nullable = false, length = 100)
    private String id;

    @Column(name = "team_id", nullable = false, length = 32)
    private String teamId;

    @Column(name = "team_name", length = 100)
    private String teamName;

    @Column(name = "enterprise_id", length = 32)
    private String enterpriseId;

    @Column(name = "enterprise_name", length = 100)
    private String enterpriseName;

    @Column(name = "enterprise_install", nullable = false)
    private boolean enterpriseInstall;

    /**
     * Slack bot token
     */
    @Convert(converter = EncryptedTokenConverter.class)
    @Column(name = "access_token", nullable = false, length = 512)
    private String accessToken;

    @Column(name = "token_type", length = 32)
    private String tokenType;

    @Column(name = "scope", length = 1000)
    private String scope;

    @Column(name = "authed_user_id", length = 32)
    private String authedUserId;

    @Column(name = "app_id", length = 32)
    private String appId;

    @Column(name = "bot_user_id", length = 32)
    private String botUserId;

    /**
     * Workspace-wide PagerDuty token, used when a task carries none
     */
    @Convert(converter = EncryptedTokenConverter.class)
    @Column(name = "pagerduty_token", length = 512)
    private String pagerDutyToken;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "last_updated_at", nullable = false)
    private Instant lastUpdatedAt;

    public static String idOf(String teamId, String enterpriseId) {
        return RotationTask.teamScopeOf(teamId, enterpriseId);
    }
}
