package com.example.oncallrotation.service.command;

import picocli.CommandLine.Command;

@Command(name = "new", description = "Show how to create a schedule.")
public class NewCommand {
}
