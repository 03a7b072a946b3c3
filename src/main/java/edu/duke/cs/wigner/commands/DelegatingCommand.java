package edu.duke.cs.wigner.commands;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParametersDelegate;
import edu.duke.cs.wigner.Main;
import edu.duke.cs.wigner.symbols.SymbolValue;
import edu.duke.cs.wigner.symbols.WignerCalculator;
import edu.duke.cs.wigner.tools.Log;

import java.io.PrintStream;
import java.util.Optional;

public abstract class DelegatingCommand implements CliCommand {

    @ParametersDelegate
    protected OutputOptionsDelegate delegate = new OutputOptionsDelegate();

    protected final WignerCalculator calculator;
    protected final PrintStream out;

    protected DelegatingCommand(WignerCalculator calculator, PrintStream out) {
        this.calculator = calculator;
        this.out = out;
    }

    Optional<Integer> processHelp(JCommander commander) {
        if (delegate.help) {
            printHelp(commander, out);
            return Optional.of(Main.Success);
        }

        return Optional.empty();
    }

    void printErrorMessage(String msg) {
        out.println(msg);
        out.println();
        out.println("Use --help or <command> --help for more info.");
        out.println();
    }

    /** A vanishing symbol is a normal result; only say why when asked to. */
    void explainIfInvalid(SymbolValue value) {
        if (delegate.verbose) {
            value.getInvalidSymbol().ifPresent(invalid ->
                    Log.log(out, "The symbol vanishes by a selection rule. %s", invalid));
        }
    }
}
