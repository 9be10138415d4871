package com.example.oncallrotation.service.sync;

import com.example.oncallrotation.client.ClientModels.OnCallUser;
import com.example.oncallrotation.client.PagerDutyClient;
import com.example.oncallrotation.client.SlackApiClient;
import com.example.oncallrotation.config.OncallRotationProperties;
import com.example.oncallrotation.config.OncallRotationProperties.OversizedGroupPolicy;
import com.example.oncallrotation.domain.entity.RotationTask;
import com.example.oncallrotation.exception.GroupNotFoundException;
import com.example.oncallrotation.exception.OversizedGroupException;
import com.example.oncallrotation.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Makes a Slack user group match the users currently on call in a PagerDuty schedule.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RosterSyncService {

    private final PagerDutyClient pagerDutyClient;
    private final SlackApiClient slackApiClient;
    private final OncallRotationProperties properties;

    /**
     * Replace the members of the task's user group with the users on call from {@code from}, and
     * announce the new roster in the task's channel when it changed.
     *
     * @return true if the membership changed
     * @throws ResourceNotFoundException  if an on-call user has no Slack account
     * @throws GroupNotFoundException     if the task's group does not exist
     * @throws OversizedGroupException    if the group is oversized and the policy is ABORT
     */
    public boolean sync(RotationTask task, String pagerDutyToken, String slackToken, Instant from) {
        var until = from.plus(Duration.ofMinutes(properties.getSyncWindowMinutes()));

        var onCallUsers = pagerDutyClient.getOnCallUsers(task.getPagerDutyScheduleId(), pagerDutyToken, from, until);
        log.info("Task {}: {} user(s) on call from {} to {}: {}", task.describe(), onCallUsers.size(), from, until,
                onCallUsers.stream().map(OnCallUser::getEmail).toList());

        var desired = new ArrayList<String>(onCallUsers.size());
        for (var user : onCallUsers) {
            var userId = slackApiClient.findUserByEmail(slackToken, user.getEmail())
                    .orElseThrow(() -> new ResourceNotFoundException("Slack user with email", user.getEmail()));
            desired.add(userId);
        }

        var group = slackApiClient.findGroupByNameOrHandle(slackToken, task.getUserGroupHandle())
                .orElseThrow(() -> new GroupNotFoundException(task.getUserGroupHandle()));

        var current = slackApiClient.listGroupMembers(slackToken, group.getId());
        if (log.isDebugEnabled()) {
            log.debug("Task {}: current members of {} are {}", task.describe(), group.getHandle(), describeMembers(slackToken, current));
        }

        checkGroupSize(task, group.getId(), current, desired);

        var changed = !desired.equals(current);
        slackApiClient.setGroupMembers(slackToken, group.getId(), desired);

        if (changed) {
            slackApiClient.postMessage(slackToken, task.getChannelId(), announcement(group.getId(), desired));
            log.info("Task {}: user group {} changed from {} to {}", task.describe(), group.getId(), current, desired);
        } else {
            log.info("Task {}: user group {} unchanged", task.describe(), group.getId());
        }
        return changed;
    }

    static String announcement(String userGroupId, List<String> userIds) {
        var mentions = userIds.stream().map(id -> "<@" + id + ">").collect(Collectors.joining(", "));
        return String.format("Updated support user group <!subteam^%s> to: %s", userGroupId, mentions);
    }

    private void checkGroupSize(RotationTask task, String userGroupId, List<String> current, List<String> desired) {
        if (current.size() <= desired.size() + properties.getOversizedGroupMargin()) {
            return;
        }

        log.warn("Task {}: user group {} has {} members but only {} are on call, is the group correct?",
                task.describe(), userGroupId, current.size(), desired.size());

        if (properties.getOversizedGroupPolicy() == OversizedGroupPolicy.ABORT) {
            throw new OversizedGroupException(userGroupId, current.size(), desired.size());
        }
    }

    private List<String> describeMembers(String slackToken, List<String> userIds) {
        return userIds.stream()
                .map(id -> slackApiClient.findUserById(slackToken, id).orElse(id))
                .toList();
    }
}
