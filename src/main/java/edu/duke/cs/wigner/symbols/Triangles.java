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

import edu.duke.cs.wigner.tools.Factorials;
import edu.duke.cs.wigner.tools.Log;
import edu.duke.cs.wigner.tools.MathTools;
import org.apache.commons.math3.fraction.BigFraction;

import java.util.Optional;


/**
 * The triangle condition on three angular momenta, and the triangle coefficient built on it.
 */
public class Triangles {

	/**
	 * Checks |a - b| <= c <= a + b and that a + b + c is an integer.
	 * @param names labels for the three arguments, used in the diagnostic
	 */
	public static Optional<InvalidSymbol> check(BigFraction a, BigFraction b, BigFraction c, String names) {

		BigFraction sum = a.add(b);
		BigFraction diff = a.subtract(b).abs();
		if (c.compareTo(diff) < 0 || c.compareTo(sum) > 0) {
			return Optional.of(new InvalidSymbol(InvalidSymbol.Rule.TriangleInequality, describe(a, b, c, names)));
		}

		if (!MathTools.isInteger(sum.add(c))) {
			return Optional.of(new InvalidSymbol(InvalidSymbol.Rule.NonIntegerPerimeter, describe(a, b, c, names)));
		}

		return Optional.empty();
	}

	public static boolean isTriangle(BigFraction a, BigFraction b, BigFraction c) {
		return check(a, b, c, "(a,b,c)").isEmpty();
	}

	/**
	 * The squared triangle coefficient
	 * <pre>
	 * (a+b-c)! (a-b+c)! (-a+b+c)! / (a+b+c+1)!
	 * </pre>
	 * The arguments must satisfy the triangle condition.
	 */
	public static BigFraction deltaSquared(BigFraction a, BigFraction b, BigFraction c, Factorials factorials) {
		int abc = MathTools.toIntExact(a.add(b).subtract(c));
		int acb = MathTools.toIntExact(a.subtract(b).add(c));
		int bca = MathTools.toIntExact(b.add(c).subtract(a));
		int perimeter = MathTools.toIntExact(a.add(b).add(c));
		return new BigFraction(
			factorials.product(abc, acb, bca),
			factorials.get(perimeter + 1)
		);
	}

	/** the sum a + b + c, which is the lower summation bound contributed by this triad in a 6-j symbol */
	public static int perimeter(BigFraction a, BigFraction b, BigFraction c) {
		return MathTools.toIntExact(a.add(b).add(c));
	}

	private static String describe(BigFraction a, BigFraction b, BigFraction c, String names) {
		return String.format("%s = (%s,%s,%s)",
			names,
			Log.formatFraction(a),
			Log.formatFraction(b),
			Log.formatFraction(c)
		);
	}
}
