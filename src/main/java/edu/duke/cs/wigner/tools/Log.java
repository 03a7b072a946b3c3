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

package edu.duke.cs.wigner.tools;

import org.apache.commons.math3.fraction.BigFraction;

import java.io.PrintStream;
import java.math.BigInteger;


public class Log {

	/** write a line to the stream (a new line is appended) */
	public static void log(PrintStream out, String format, Object ... args) {
		out.println(String.format(format, args));
	}

	public static void log(StringBuilder buf, String format, Object ... args) {
		buf.append(String.format(format + "\n", args));
	}

	/** formats a quantum number the way physicists write it, eg 1/2, -3/2, or 1 */
	public static String formatFraction(BigFraction f) {
		if (f == null) {
			return "null";
		} else if (f.getDenominator().equals(BigInteger.ONE)) {
			return f.getNumerator().toString();
		} else {
			return f.getNumerator() + "/" + f.getDenominator();
		}
	}
}
