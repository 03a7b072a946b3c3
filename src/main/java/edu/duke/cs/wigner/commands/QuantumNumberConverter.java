package edu.duke.cs.wigner.commands;

import com.beust.jcommander.ParameterException;
import com.beust.jcommander.converters.BaseConverter;
import edu.duke.cs.wigner.io.QuantumNumberFormatException;
import edu.duke.cs.wigner.io.QuantumNumberParser;
import org.apache.commons.math3.fraction.BigFraction;

public class QuantumNumberConverter extends BaseConverter<BigFraction> {

    public QuantumNumberConverter(String optionName) {
        super(optionName);
    }

    @Override
    public BigFraction convert(String value) {
        try {
            return QuantumNumberParser.parse(value);
        } catch (QuantumNumberFormatException ex) {
            throw new ParameterException(getErrorString(value, "an integer or fraction like 1/2"), ex);
        }
    }
}
