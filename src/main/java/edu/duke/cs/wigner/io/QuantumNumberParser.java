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

import org.apache.commons.math3.fraction.BigFraction;

import java.math.BigInteger;


/**
 * Reads quantum numbers written as integers ("1", "-2") or fractions ("1/2", "-3/2").
 */
public class QuantumNumberParser {

	public static BigFraction parse(String text) {

		if (text == null) {
			throw new QuantumNumberFormatException("missing value", "");
		}

		String[] parts = text.trim().split("/", -1);
		if (parts.length > 2) {
			throw new QuantumNumberFormatException("too many '/'", text);
		}

		BigInteger num = parseInteger(parts[0], text);
		if (parts.length == 1) {
			return new BigFraction(num);
		}

		BigInteger den = parseInteger(parts[1], text);
		if (den.signum() == 0) {
			throw new QuantumNumberFormatException("zero denominator", text);
		}
		return new BigFraction(num, den);
	}

	private static BigInteger parseInteger(String part, String text) {
		try {
			return new BigInteger(part.trim());
		} catch (NumberFormatException ex) {
			throw new QuantumNumberFormatException("not an integer or fraction", text, ex);
		}
	}
}
