package com.example.oncallrotation.service.command;

import lombok.Getter;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Getter
@Command(name = "list-schedules", description = "List the schedules of this channel.")
public class ListSchedulesCommand {

    @Option(names = "--all", arity = "0..1", description = "List the schedules of every channel")
    private boolean all;
}
