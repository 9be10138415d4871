package com.example.oncallrotation.service.command;

import com.example.oncallrotation.cron.CronEvaluator;
import com.example.oncallrotation.domain.entity.RotationTask;
import com.example.oncallrotation.domain.entity.SlackInstallation;
import com.example.oncallrotation.domain.repository.RotationTaskRepository;
import com.example.oncallrotation.dto.SlackCommandRequest;
import com.example.oncallrotation.dto.SlackCommandResponse;
import com.example.oncallrotation.exception.InvalidInputException;
import com.example.oncallrotation.scheduler.TriggerReconciler;
import com.example.oncallrotation.service.SlackInstallationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import picocli.CommandLine;

import java.time.Clock;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Executes slash commands:
 * - {@code schedule} registers (or replaces) a rotation task and makes sure a wake-up exists for it
 * - {@code list-schedules} lists the tasks of the channel, or of the workspace with {@code --all}
 * - {@code setup-paging} stores the workspace PagerDuty token
 * - {@code new} shows how to create a schedule
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SlackCommandService {

    private static final Pattern GROUP_MENTION = Pattern.compile("<!subteam\\^(\\w+)\\|@([^>]+)>");

    private final RotationTaskRepository taskRepository;
    private final SlackInstallationService installationService;
    private final TriggerReconciler triggerReconciler;
    private final Clock clock;

    /**
     * @throws InvalidInputException if the text does not parse or carries invalid values
     */
    public SlackCommandResponse handle(SlackCommandRequest request) {
        var args = CommandTokenizer.tokenize(request.getText());
        var commandLine = new CommandLine(new OncallCommand());

        CommandLine.ParseResult parseResult;
        try {
            parseResult = commandLine.parseArgs(args.toArray(new String[0]));
        } catch (CommandLine.ParameterException e) {
            var usage = e.getCommandLine().getUsageMessage(CommandLine.Help.Ansi.OFF);
            throw new InvalidInputException("text", e.getMessage() + "\n```" + usage + "```");
        }

        if (!parseResult.hasSubcommand()) {
            return SlackCommandResponse.ephemeral(List.of("```" + commandLine.getUsageMessage(CommandLine.Help.Ansi.OFF) + "```"));
        }

        var subcommand = parseResult.subcommand().commandSpec().userObject();
        log.info("Slash command {} from {} in #{} ({})", parseResult.subcommand().commandSpec().name(),
                request.getUserName(), request.getChannelName(), request.getTeamId());

        if (subcommand instanceof ScheduleCommand schedule) {
            return schedule(request, schedule);
        }
        if (subcommand instanceof ListSchedulesCommand listSchedules) {
            return listSchedules(request, listSchedules);
        }
        if (subcommand instanceof SetupPagingCommand setupPaging) {
            return setupPaging(request, setupPaging);
        }
        return newScheduleHelp();
    }

    private SlackCommandResponse schedule(SlackCommandRequest request, ScheduleCommand command) {
        var matcher = GROUP_MENTION.matcher(command.getUserGroup());
        if (!matcher.find()) {
            throw new InvalidInputException("user-group", "Invalid user group: " + command.getUserGroup());
        }
        var userGroupId = matcher.group(1);
        var userGroupHandle = matcher.group(2);

        var now = clock.instant();
        var zone = CronEvaluator.parseZone(command.getTimezone());
        var occurrence = CronEvaluator.nextOccurrence(command.getCron(), zone, now)
                .orElseThrow(() -> new InvalidInputException("cron", "The cron has no future occurrence: " + command.getCron()));

        var team = RotationTask.teamScopeOf(request.getTeamId(), request.getEnterpriseId());
        var taskId = RotationTask.taskIdOf(request.getChannelName(), request.getChannelId(), userGroupHandle, userGroupId,
                command.getPagerDutySchedule());

        var task = RotationTask.builder()
                .team(team)
                .taskId(taskId)
                .cronExpression(command.getCron())
                .timezone(zone.getId())
                .nextOccurrenceUtc(occurrence.getNextTimestampUtc())
                .nextOccurrenceLocal(occurrence.formatLocal())
                .teamId(request.getTeamId())
                .teamDomain(request.getTeamDomain())
                .enterpriseId(request.getEnterpriseId())
                .enterpriseName(request.getEnterpriseName())
                .enterpriseInstall(request.isEnterpriseInstall())
                .channelId(request.getChannelId())
                .channelName(request.getChannelName())
                .userGroupId(userGroupId)
                .userGroupHandle(userGroupHandle)
                .pagerDutyScheduleId(command.getPagerDutySchedule())
                .pagerDutyToken(command.getPagerDutyApiKey())
                .createdByUserId(request.getUserId())
                .createdByUserName(request.getUserName())
                .createdAt(now)
                .lastUpdatedAt(now)
                .build();

        taskRepository.save(task);
        log.info("Saved rotation task {}, next run at {}", task.describe(), task.getNextOccurrenceLocal());

        triggerReconciler.reconcile(occurrence, now);

        return SlackCommandResponse.inChannel(List.of(String.format(
                "Update user group: %s|%s based on pagerduty schedule: %s, at: %s\nNext schedule: %s",
                userGroupId, userGroupHandle, task.getPagerDutyScheduleId(), task.getCronExpression(), task.getNextOccurrenceLocal())));
    }

    private SlackCommandResponse listSchedules(SlackCommandRequest request, ListSchedulesCommand command) {
        var team = RotationTask.teamScopeOf(request.getTeamId(), request.getEnterpriseId());
        var tasks = command.isAll()
                ? taskRepository.findByTeamOrderByTaskId(team)
                : taskRepository.findByTeamAndChannelIdOrderByTaskId(team, request.getChannelId());

        if (tasks.isEmpty()) {
            return SlackCommandResponse.ephemeral(List.of("No schedules found"));
        }

        return SlackCommandResponse.ephemeral(tasks.stream()
                .map(task -> String.format("*#%s*\nUpdate <!subteam^%s> on `%s` (%s)\nNext schedule: %s",
                        task.getChannelName(), task.getUserGroupId(), task.getCronExpression(), task.getTimezone(),
                        task.isRetired() ? "none, the cron has no future occurrence" : task.getNextOccurrenceLocal()))
                .toList());
    }

    private SlackCommandResponse setupPaging(SlackCommandRequest request, SetupPagingCommand command) {
        installationService.updatePagerDutyToken(SlackInstallation.idOf(request.getTeamId(), request.getEnterpriseId()),
                command.getPagerDutyApiKey());

        return SlackCommandResponse.ephemeral(List.of("Set up PagerDuty with the API key"));
    }

    private SlackCommandResponse newScheduleHelp() {
        var usage = new CommandLine(new ScheduleCommand()).getUsageMessage(CommandLine.Help.Ansi.OFF);
        return SlackCommandResponse.ephemeral(List.of(
                "To rotate a user group every weekday at 9am, run:\n"
                        + "`/oncall schedule --user-group @support --pagerduty-schedule PABC123 --cron \"0 9 ? * MON-FRI *\" --timezone Australia/Melbourne`",
                "```" + usage + "```"));
    }
}
