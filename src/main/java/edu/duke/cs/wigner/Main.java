package edu.duke.cs.wigner;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.MissingCommandException;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import edu.duke.cs.wigner.commands.*;
import edu.duke.cs.wigner.symbols.WignerCalculator;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import static java.lang.System.exit;

public class Main {

    @Parameter(names = {"--help", "-h"}, help = true)
    private boolean help;

    public final static int Success = 0;
    public final static int Failure = 1;
    public final static String ProgramName = "wigner";

    private final BufferedReader in;
    private final PrintStream out;

    public Main(BufferedReader in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    public Main() {
        this(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out);
    }

    private void printErrorMessage(String msg) {
        out.println(msg);
        out.println();
        out.println("Use --help or <command> --help for more info.");
        out.println();
    }

    private void printUsage(JCommander commander) {
        var usage = new StringBuilder();
        commander.getUsageFormatter().usage(usage);
        out.print(usage);
    }

    public int run(String[] args) {

        // one factorial table for the whole run
        var calculator = new WignerCalculator();

        Map<String, CliCommand> commandMap = Map.of(
                CommandThreeJ.CommandName, new CommandThreeJ(calculator, out),
                CommandSixJ.CommandName, new CommandSixJ(calculator, out),
                CommandInteractive.CommandName, new CommandInteractive(calculator, in, out)
        );

        var builder = JCommander.newBuilder()
                .programName(ProgramName)
                .addObject(this);
        commandMap.forEach(builder::addCommand);
        var commander = builder.build();

        // with no arguments at all, prompt for everything
        if (args.length == 0) {
            args = new String[] { CommandInteractive.CommandName };
        }

        try {
            commander.parse(args);
        } catch (MissingCommandException ex) {
            printErrorMessage(String.format("Error: the command \"%s\" does not exist.", ex.getUnknownCommand()));
            printUsage(commander);
            return Failure;
        } catch (ParameterException ex) {
            printErrorMessage(String.format("Error: %s", ex.getMessage()));
            return Failure;
        }

        var parsedCommand = commander.getParsedCommand();
        if (this.help || parsedCommand == null) {
            printUsage(commander);
            return Success;
        }

        return commandMap.get(parsedCommand).run(commander.getCommands().get(parsedCommand), args);
    }

    public static void main(String[] args) {

        Thread.setDefaultUncaughtExceptionHandler((thread, throwable) -> {
            throwable.printStackTrace();
            exit(Failure);
        });

        exit(new Main().run(args));
    }
}
