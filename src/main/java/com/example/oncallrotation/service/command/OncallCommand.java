package com.example.oncallrotation.service.command;

import picocli.CommandLine.Command;

/**
 * Root of the slash command grammar
 */
@Command(name = "/oncall",
        description = "Keep a Slack user group in sync with a PagerDuty on-call schedule.",
        subcommands = {
                ScheduleCommand.class,
                ListSchedulesCommand.class,
                SetupPagingCommand.class,
                NewCommand.class
        })
public class OncallCommand {
}
