package com.example.oncallrotation.service.command;

import lombok.Getter;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Getter
@Command(name = "schedule", description = "Rotate a user group from a PagerDuty schedule on a cron schedule.")
public class ScheduleCommand {

    @Option(names = "--user-group", required = true, description = "User group to rotate, as a mention (@group)")
    private String userGroup;

    @Option(names = "--pagerduty-schedule", required = true, description = "PagerDuty schedule id")
    private String pagerDutySchedule;

    @Option(names = "--pagerduty-api-key", description = "PagerDuty API key for this schedule only")
    private String pagerDutyApiKey;

    @Option(names = "--cron", required = true, description = "When to rotate, e.g. \"0 9 ? * MON-FRI *\". Five fields use Unix weekday numbers (0 = Sunday), six or seven fields use 1 = Sunday")
    private String cron;

    @Option(names = "--timezone", defaultValue = "UTC", description = "IANA timezone of the cron (default: ${DEFAULT-VALUE})")
    private String timezone;
}
