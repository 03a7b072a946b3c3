package edu.duke.cs.wigner.commands;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import edu.duke.cs.wigner.symbols.SixJRequest;
import edu.duke.cs.wigner.symbols.SymbolRequest;
import edu.duke.cs.wigner.symbols.WignerCalculator;
import org.apache.commons.math3.fraction.BigFraction;

import java.io.PrintStream;

@Parameters(commandDescription = CommandSixJ.CommandDescription, separators = "=")
public class CommandSixJ extends SymbolCommand {

    public static final String CommandName = "6j";
    public static final String CommandDescription = "Compute the Wigner 6-j symbol {j1 j2 j3; j4 j5 j6}. Write values as --j1=1/2.";

    @Parameter(names = "--j1", required = true, converter = QuantumNumberConverter.class, description = "Angular momentum j1")
    BigFraction j1;

    @Parameter(names = "--j2", required = true, converter = QuantumNumberConverter.class, description = "Angular momentum j2")
    BigFraction j2;

    @Parameter(names = "--j3", required = true, converter = QuantumNumberConverter.class, description = "Angular momentum j3")
    BigFraction j3;

    @Parameter(names = "--j4", required = true, converter = QuantumNumberConverter.class, description = "Angular momentum j4")
    BigFraction j4;

    @Parameter(names = "--j5", required = true, converter = QuantumNumberConverter.class, description = "Angular momentum j5")
    BigFraction j5;

    @Parameter(names = "--j6", required = true, converter = QuantumNumberConverter.class, description = "Angular momentum j6")
    BigFraction j6;

    public CommandSixJ(WignerCalculator calculator, PrintStream out) {
        super(calculator, out);
    }

    @Override
    protected SymbolRequest buildRequest() {
        return new SixJRequest(j1, j2, j3, j4, j5, j6);
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
