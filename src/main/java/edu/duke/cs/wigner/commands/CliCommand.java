package edu.duke.cs.wigner.commands;

import com.beust.jcommander.JCommander;

import java.io.PrintStream;

public interface CliCommand {
    int run(JCommander commander, String[] args);

    String getCommandName();

    String getCommandDescription();

    default void printHelp(JCommander commander, PrintStream out) {
        var msg = String.format("%s: %s", getCommandName(), getCommandDescription());
        out.println(msg);
        out.println();
        var usage = new StringBuilder();
        commander.getUsageFormatter().usage(usage);
        out.print(usage);
    }
}
