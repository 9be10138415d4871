package com.example.oncallrotation.service.command;

import lombok.Getter;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Getter
@Command(name = "setup-paging", aliases = "setup-pagerduty", description = "Store the PagerDuty API key used by every schedule of this workspace.")
public class SetupPagingCommand {

    @Option(names = "--pagerduty-api-key", required = true, description = "PagerDuty API key")
    private String pagerDutyApiKey;
}
