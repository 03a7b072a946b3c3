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

package edu.duke.cs.wigner.symbols;

import edu.duke.cs.wigner.tools.Log;
import edu.duke.cs.wigner.tools.MathTools;
import org.apache.commons.math3.fraction.BigFraction;


/**
 * Domain checks for the individual quantum numbers of a symbol.
 * Requests are built only from values that pass these checks.
 */
public class QuantumNumbers {

	/** angular momenta are non-negative integers or half-integers */
	public static boolean isAngularMomentum(BigFraction j) {
		return j != null && MathTools.signum(j) >= 0 && MathTools.isHalfInteger(j);
	}

	/** magnetic quantum numbers are integers or half-integers of either sign */
	public static boolean isMagnetic(BigFraction m) {
		return m != null && MathTools.isHalfInteger(m);
	}

	public static BigFraction checkAngularMomentum(String name, BigFraction j) {
		if (!isAngularMomentum(j)) {
			throw new IllegalArgumentException(String.format(
				"%s must be a non-negative integer or half-integer, not %s", name, Log.formatFraction(j)
			));
		}
		return j;
	}

	public static BigFraction checkMagnetic(String name, BigFraction m) {
		if (!isMagnetic(m)) {
			throw new IllegalArgumentException(String.format(
				"%s must be an integer or half-integer, not %s", name, Log.formatFraction(m)
			));
		}
		return m;
	}
}
