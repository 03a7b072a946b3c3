package edu.duke.cs.wigner.commands;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import edu.duke.cs.wigner.symbols.SymbolRequest;
import edu.duke.cs.wigner.symbols.ThreeJRequest;
import edu.duke.cs.wigner.symbols.WignerCalculator;
import org.apache.commons.math3.fraction.BigFraction;

import java.io.PrintStream;

@Parameters(commandDescription = CommandThreeJ.CommandDescription, separators = "=")
public class CommandThreeJ extends SymbolCommand {

    public static final String CommandName = "3j";
    public static final String CommandDescription = "Compute the Wigner 3-j symbol (j1 j2 j3; m1 m2 m3). Write values as --m1=-1/2.";

    @Parameter(names = "--j1", required = true, converter = QuantumNumberConverter.class, description = "Angular momentum j1")
    BigFraction j1;

    @Parameter(names = "--j2", required = true, converter = QuantumNumberConverter.class, description = "Angular momentum j2")
    BigFraction j2;

    @Parameter(names = "--j3", required = true, converter = QuantumNumberConverter.class, description = "Angular momentum j3")
    BigFraction j3;

    @Parameter(names = "--m1", required = true, converter = QuantumNumberConverter.class, description = "Magnetic quantum number m1")
    BigFraction m1;

    @Parameter(names = "--m2", required = true, converter = QuantumNumberConverter.class, description = "Magnetic quantum number m2")
    BigFraction m2;

    @Parameter(names = "--m3", required = true, converter = QuantumNumberConverter.class, description = "Magnetic quantum number m3")
    BigFraction m3;

    public CommandThreeJ(WignerCalculator calculator, PrintStream out) {
        super(calculator, out);
    }

    @Override
    protected SymbolRequest buildRequest() {
        return new ThreeJRequest(j1, j2, j3, m1, m2, m3);
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
