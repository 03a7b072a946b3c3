/*
** This file is part of OSPREY 3.0
** 
** OSPREY Protein Redesign Software Version 3.0
** Copyright (C) 2001-2018 Bruce Donald Lab, Duke University
** 
** OSPREY is free software: you can redistribute it and/or modify
** it under the terms of the GNU General Public License version 2
** as published by the Free Software Foundation.
** 
** You should have received a copy of the GNU General Public License
** along with OSPREY.  If not, see <http://www.gnu.org/licenses/>.
** 
** OSPREY relies on grants for its development, and since visibility
** in the scientific literature is essential for our success, we
** ask that users of OSPREY cite our papers. See the CITING_OSPREY
** document in this distribution for more information.
** 
** Contact Info:
**    Bruce Donald
**    Duke University
**    Department of Computer Science
**    Levine Science Research Center (LSRC)
**    Durham
**    NC 27708-0129
**    USA
**    e-mail: www.cs.duke.edu/brd/
** 
** <signature of Bruce Donald>, Mar 1, 2018
** Bruce Donald, Professor of Computer Science
*/

package edu.duke.cs.wigner.io;

import edu.duke.cs.wigner.symbols.SymbolValue;
import edu.duke.cs.wigner.symbols.ThreeJRequest;
import edu.duke.cs.wigner.tools.Log;
import org.apache.commons.math3.fraction.BigFraction;

import java.math.MathContext;
import java.math.RoundingMode;
import java.util.List;
import java.util.stream.Collectors;


/**
 * Renders symbol values for the console.
 */
public class ResultFormatter {

	public static final int DefaultDigits = 8;
	public static final int MaxDigits = 30;

	public static final String Rule = "=".repeat(40);

	public final int digits;
	public final boolean showExact;

	public ResultFormatter(int digits, boolean showExact) {
		if (digits < 0 || digits > MaxDigits) {
			throw new IllegalArgumentException(String.format("digits must be in [0,%d], not %d", MaxDigits, digits));
		}
		this.digits = digits;
		this.showExact = showExact;
	}

	public ResultFormatter() {
		this(DefaultDigits, false);
	}

	/** the value with a fixed number of fractional digits, eg 0.40824829 */
	public String formatValue(SymbolValue value) {
		// symbols never exceed 1 in magnitude, so this many significant digits covers the fraction
		MathContext context = new MathContext(digits + 20, RoundingMode.HALF_EVEN);
		return value.toBigDecimal(context)
			.setScale(digits, RoundingMode.HALF_EVEN)
			.toPlainString();
	}

	/** eg "{ 1 1/2 3/2 }" */
	public static String formatRow(List<BigFraction> row) {
		return row.stream()
			.map(Log::formatFraction)
			.collect(Collectors.joining(" ", "{ ", " }"));
	}

	/** the result block printed after an evaluation */
	public String formatResult(SymbolValue value) {

		String title = String.format("Wigner %s symbol ", value.request.getSymbolName());

		// the second row has a fixed indent per symbol
		int indent = value.request instanceof ThreeJRequest ? 21 : 19;

		StringBuilder buf = new StringBuilder();
		Log.log(buf, Rule);
		Log.log(buf, "RESULT:");
		Log.log(buf, "%s%s", title, formatRow(value.request.getTopRow()));
		Log.log(buf, "%s%s", " ".repeat(indent), formatRow(value.request.getBottomRow()));
		Log.log(buf, "Value: %s", formatValue(value));
		if (showExact) {
			Log.log(buf, "Exact: %s", value.exact.toExactString());
		}
		Log.log(buf, Rule);
		return buf.toString();
	}
}
