package com.example.oncallrotation.client;

import com.example.oncallrotation.client.ClientModels.OAuthGrant;
import com.example.oncallrotation.client.ClientModels.UserGroup;
import com.example.oncallrotation.config.SlackProperties;
import com.example.oncallrotation.exception.ExternalServiceException;
import com.slack.api.Slack;
import com.slack.api.methods.SlackApiException;
import com.slack.api.methods.SlackApiTextResponse;
import com.slack.api.methods.request.chat.ChatPostMessageRequest;
import com.slack.api.methods.request.oauth.OAuthV2AccessRequest;
import com.slack.api.methods.request.usergroups.UsergroupsListRequest;
import com.slack.api.methods.request.usergroups.users.UsergroupsUsersListRequest;
import com.slack.api.methods.request.usergroups.users.UsergroupsUsersUpdateRequest;
import com.slack.api.methods.request.users.UsersInfoRequest;
import com.slack.api.methods.request.users.UsersLookupByEmailRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Client for the Slack Web API, on top of the Slack SDK.
 * <p>
 * Every call takes the workspace bot token. Transport failures and {@code ok=false} responses are
 * raised as {@link ExternalServiceException} carrying Slack's error code.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SlackApiClient {

    static final String SERVICE_NAME = "Slack";

    private static final String USERS_NOT_FOUND = "users_not_found";

    private final Slack slack;
    private final SlackProperties slackProperties;

    /**
     * @return the Slack user id, or empty if no member of the workspace has this email
     */
    public Optional<String> findUserByEmail(String token, String email) {
        var response = call("users.lookupByEmail", () -> slack.methods(token)
                .usersLookupByEmail(UsersLookupByEmailRequest.builder().email(email).build()));

        if (!response.isOk()) {
            if (USERS_NOT_FOUND.equals(response.getError())) {
                return Optional.empty();
            }
            throw new ExternalServiceException(SERVICE_NAME, "users.lookupByEmail", response.getError());
        }
        return Optional.of(response.getUser().getId());
    }

    /**
     * @return the user's display name, falling back to the account name
     */
    public Optional<String> findUserById(String token, String userId) {
        var response = checked("users.info", call("users.info", () -> slack.methods(token)
                .usersInfo(UsersInfoRequest.builder().user(userId).build())));

        var user = response.getUser();
        if (user == null) {
            return Optional.empty();
        }
        if (user.getProfile() != null && user.getProfile().getDisplayName() != null && !user.getProfile().getDisplayName().isBlank()) {
            return Optional.of(user.getProfile().getDisplayName());
        }
        return Optional.ofNullable(user.getName());
    }

    public List<UserGroup> listGroups(String token) {
        var response = checked("usergroups.list", call("usergroups.list", () -> slack.methods(token)
                .usergroupsList(UsergroupsListRequest.builder().build())));

        if (response.getUsergroups() == null) {
            return List.of();
        }
        return response.getUsergroups().stream()
                .map(group -> UserGroup.builder()
                        .id(group.getId())
                        .name(group.getName())
                        .handle(group.getHandle())
                        .build())
                .toList();
    }

    /**
     * First group whose name or handle equals {@code nameOrHandle}
     */
    public Optional<UserGroup> findGroupByNameOrHandle(String token, String nameOrHandle) {
        return listGroups(token).stream()
                .filter(group -> nameOrHandle.equals(group.getName()) || nameOrHandle.equals(group.getHandle()))
                .findFirst();
    }

    public List<String> listGroupMembers(String token, String userGroupId) {
        var response = checked("usergroups.users.list", call("usergroups.users.list", () -> slack.methods(token)
                .usergroupsUsersList(UsergroupsUsersListRequest.builder().usergroup(userGroupId).build())));

        return response.getUsers() == null ? List.of() : response.getUsers();
    }

    /**
     * Replace the members of a group
     */
    public void setGroupMembers(String token, String userGroupId, List<String> userIds) {
        checked("usergroups.users.update", call("usergroups.users.update", () -> slack.methods(token)
                .usergroupsUsersUpdate(UsergroupsUsersUpdateRequest.builder()
                        .usergroup(userGroupId)
                        .users(userIds)
                        .build())));

        log.info("Set members of user group {} to {}", userGroupId, userIds);
    }

    public void postMessage(String token, String channelId, String text) {
        checked("chat.postMessage", call("chat.postMessage", () -> slack.methods(token)
                .chatPostMessage(ChatPostMessageRequest.builder()
                        .channel(channelId)
                        .text(text)
                        .build())));
    }

    /**
     * Exchange a temporary OAuth code for a bot token
     */
    public OAuthGrant exchangeOAuthCode(String code) {
        var response = checked("oauth.v2.access", call("oauth.v2.access", () -> slack.methods()
                .oauthV2Access(OAuthV2AccessRequest.builder()
                        .clientId(slackProperties.getClientId())
                        .clientSecret(slackProperties.getClientSecret())
                        .code(code)
                        .build())));

        var grant = OAuthGrant.builder()
                .enterpriseInstall(response.isEnterpriseInstall())
                .accessToken(response.getAccessToken())
                .tokenType(response.getTokenType())
                .scope(response.getScope())
                .appId(response.getAppId())
                .botUserId(response.getBotUserId());

        if (response.getTeam() != null) {
            grant.teamId(response.getTeam().getId()).teamName(response.getTeam().getName());
        }
        if (response.getEnterprise() != null) {
            grant.enterpriseId(response.getEnterprise().getId()).enterpriseName(response.getEnterprise().getName());
        }
        if (response.getAuthedUser() != null) {
            grant.authedUserId(response.getAuthedUser().getId());
        }
        return grant.build();
    }

    private <T extends SlackApiTextResponse> T checked(String method, T response) {
        if (!response.isOk()) {
            log.warn("Slack {} returned error: {}", method, response.getError());
            throw new ExternalServiceException(SERVICE_NAME, method, response.getError());
        }
        return response;
    }

    private <T> T call(String method, SlackCall<T> slackCall) {
        try {
            return slackCall.execute();
        } catch (SlackApiException e) {
            log.error("Slack {} failed with HTTP {}: {}", method, e.getResponse().code(), e.getMessage());
            throw new ExternalServiceException(SERVICE_NAME, e.getResponse().code(), e.getResponseBody());
        } catch (IOException e) {
            log.error("Slack {} failed: {}", method, e.getMessage());
            throw new ExternalServiceException(SERVICE_NAME, method + " failed", e);
        }
    }

    @FunctionalInterface
    private interface SlackCall<T> {
        T execute() throws IOException, SlackApiException;
    }
}
