package edu.duke.cs.wigner.commands;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameters;
import edu.duke.cs.wigner.Main;
import edu.duke.cs.wigner.io.InteractiveSession;
import edu.duke.cs.wigner.symbols.WignerCalculator;

import java.io.BufferedReader;
import java.io.EOFException;
import java.io.IOException;
import java.io.PrintStream;

@Parameters(commandDescription = CommandInteractive.CommandDescription, separators = "=")
public class CommandInteractive extends DelegatingCommand {

    public static final String CommandName = "interactive";
    public static final String CommandDescription = "Prompt for the symbol type and its quantum numbers, then print the value";

    private final BufferedReader in;

    public CommandInteractive(WignerCalculator calculator, BufferedReader in, PrintStream out) {
        super(calculator, out);
        this.in = in;
    }

    @Override
    public int run(JCommander commander, String[] args) {
        var help = processHelp(commander);
        if (help.isPresent()) {
            return help.get();
        }

        var session = new InteractiveSession(in, out, calculator, delegate.createFormatter());
        try {
            var value = session.run();
            explainIfInvalid(value);
            return Main.Success;
        } catch (EOFException ex) {
            out.println();
            printErrorMessage(String.format("Error: %s", ex.getMessage()));
            return Main.Failure;
        } catch (IOException ex) {
            throw new RuntimeException("can't read from input", ex);
        }
    }

    @Override
    public String getCommandName() {
        return CommandName;
    }

    @Override
    public String getCommandDescription() {
        return CommandDescription;
    }
}
