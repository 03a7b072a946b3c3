package edu.duke.cs.wigner.commands;

import com.beust.jcommander.IParameterValidator;
import com.beust.jcommander.ParameterException;
import edu.duke.cs.wigner.io.ResultFormatter;

public class DigitsValidation implements IParameterValidator {

    @Override
    public void validate(String name, String value) throws ParameterException {
        int digits;
        try {
            digits = Integer.parseInt(value);
        } catch (NumberFormatException ex) {
            throw new ParameterException("Parameter " + name + " should be an integer (found " + value + ")", ex);
        }
        if (digits < 0 || digits > ResultFormatter.MaxDigits) {
            throw new ParameterException("Parameter " + name + " should be between 0 and " + ResultFormatter.MaxDigits + " (found " + value + ")");
        }
    }
}
