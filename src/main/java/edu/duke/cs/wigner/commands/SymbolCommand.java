package edu.duke.cs.wigner.commands;

import com.beust.jcommander.JCommander;
import edu.duke.cs.wigner.Main;
import edu.duke.cs.wigner.symbols.SymbolRequest;
import edu.duke.cs.wigner.symbols.WignerCalculator;

import java.io.PrintStream;

/**
 * Evaluates one symbol whose arguments were all given on the command line.
 */
public abstract class SymbolCommand extends DelegatingCommand {

    protected SymbolCommand(WignerCalculator calculator, PrintStream out) {
        super(calculator, out);
    }

    /** @throws IllegalArgumentException if a parsed value is outside its quantum number domain */
    protected abstract SymbolRequest buildRequest();

    @Override
    public int run(JCommander commander, String[] args) {
        var help = processHelp(commander);
        if (help.isPresent()) {
            return help.get();
        }

        SymbolRequest request;
        try {
            request = buildRequest();
        } catch (IllegalArgumentException ex) {
            printErrorMessage(String.format("Error: %s", ex.getMessage()));
            return Main.Failure;
        }

        var value = calculator.evaluate(request);
        out.print(delegate.createFormatter().formatResult(value));
        explainIfInvalid(value);
        return Main.Success;
    }
}
