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

import java.math.BigInteger;


public class MathTools {

	private static final BigInteger Two = BigInteger.valueOf(2);

	public static boolean isZero(BigFraction f) {
		return f.getNumerator().signum() == 0;
	}

	public static boolean isInteger(BigFraction f) {
		return f.getDenominator().equals(BigInteger.ONE);
	}

	/** true for integers and odd multiples of 1/2 */
	public static boolean isHalfInteger(BigFraction f) {
		return isInteger(f) || f.getDenominator().equals(Two);
	}

	public static int signum(BigFraction f) {
		return f.getNumerator().signum();
	}

	/**
	 * Converts an integral fraction to an int.
	 * Factorial arguments always pass through here, so a non-integral value means a caller skipped validation.
	 */
	public static int toIntExact(BigFraction f) {
		if (!isInteger(f)) {
			throw new IllegalStateException("expected an integer, not " + Log.formatFraction(f));
		}
		try {
			return f.getNumerator().intValueExact();
		} catch (ArithmeticException ex) {
			throw new IllegalStateException("integer too large: " + f.getNumerator(), ex);
		}
	}

	/** returns (-1)^n */
	public static int phase(int n) {
		return (n & 1) == 0 ? 1 : -1;
	}

	/** returns the exact square root of n if n is a perfect square, or null if it isn't */
	public static BigInteger exactSqrt(BigInteger n) {
		if (n.signum() < 0) {
			return null;
		}
		BigInteger root = n.sqrt();
		return root.multiply(root).equals(n) ? root : null;
	}
}
