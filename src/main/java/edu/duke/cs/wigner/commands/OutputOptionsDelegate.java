package edu.duke.cs.wigner.commands;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import edu.duke.cs.wigner.io.ResultFormatter;

@Parameters(separators = "=")
public class OutputOptionsDelegate {

    @Parameter(description = "Prints this help information", names = {"--help", "-h"}, help = true)
    boolean help;

    @Parameter(names = {"--digits", "-n"}, validateWith = DigitsValidation.class,
            description = "Number of fractional digits in the printed value.")
    int digits = ResultFormatter.DefaultDigits;

    @Parameter(names = "--exact", description = "Also print the exact value, eg -sqrt(1/6).")
    boolean exact;

    @Parameter(names = {"--verbose", "-v"}, description = "Explain which selection rule makes a symbol vanish.")
    boolean verbose;

    ResultFormatter createFormatter() {
        return new ResultFormatter(digits, exact);
    }
}
