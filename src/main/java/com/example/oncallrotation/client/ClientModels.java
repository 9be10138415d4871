package com.example.oncallrotation.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Request/Response DTOs for external service clients
 */
public class ClientModels {
    private ClientModels() {
    }

    // === PagerDuty Models ===

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class OnCallUser {
        private String name;
        private String email;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ScheduleUsersResponse {
        private List<OnCallUser> users = new ArrayList<>();
    }

    // === Slack Models ===

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class UserGroup {
        private String id;
        private String name;
        private String handle;
    }

    /**
     * Result of the OAuth v2 code exchange
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class OAuthGrant {
        private String teamId;
        private String teamName;
        private String enterpriseId;
        private String enterpriseName;
        private boolean enterpriseInstall;
        private String accessToken;
        private String tokenType;
        private String scope;
        private String authedUserId;
        private String appId;
        private String botUserId;
    }
}
