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

import java.util.Optional;


/**
 * Selection rules of the 3-j and 6-j symbols.
 *
 * A symbol that breaks any rule is exactly zero. The checks return the first rule broken,
 * or nothing when the symbol may be evaluated.
 */
public class SelectionRules {

	public static Optional<InvalidSymbol> validate3j(ThreeJRequest r) {

		Optional<InvalidSymbol> invalid = checkColumn(r.j1, r.m1, 1);
		if (invalid.isPresent()) {
			return invalid;
		}
		invalid = checkColumn(r.j2, r.m2, 2);
		if (invalid.isPresent()) {
			return invalid;
		}
		invalid = checkColumn(r.j3, r.m3, 3);
		if (invalid.isPresent()) {
			return invalid;
		}

		BigFraction msum = r.m1.add(r.m2).add(r.m3);
		if (!MathTools.isZero(msum)) {
			return Optional.of(new InvalidSymbol(
				InvalidSymbol.Rule.ProjectionsDoNotSumToZero,
				String.format("m1 + m2 + m3 = %s", Log.formatFraction(msum))
			));
		}

		return Triangles.check(r.j1, r.j2, r.j3, "(j1,j2,j3)");
	}

	public static Optional<InvalidSymbol> validate6j(SixJRequest r) {

		// the four triads of the symbol: (j1,j2,j3), (j1,j5,j6), (j4,j2,j6), (j4,j5,j3)
		Optional<InvalidSymbol> invalid = Triangles.check(r.j1, r.j2, r.j3, "(j1,j2,j3)");
		if (invalid.isPresent()) {
			return invalid;
		}
		invalid = Triangles.check(r.j1, r.j5, r.j6, "(j1,j5,j6)");
		if (invalid.isPresent()) {
			return invalid;
		}
		invalid = Triangles.check(r.j4, r.j2, r.j6, "(j4,j2,j6)");
		if (invalid.isPresent()) {
			return invalid;
		}
		return Triangles.check(r.j4, r.j5, r.j3, "(j4,j5,j3)");
	}

	private static Optional<InvalidSymbol> checkColumn(BigFraction j, BigFraction m, int col) {

		if (!MathTools.isInteger(j.subtract(m))) {
			return Optional.of(new InvalidSymbol(
				InvalidSymbol.Rule.ParityMismatch,
				String.format("(j%d,m%d) = (%s,%s)", col, col, Log.formatFraction(j), Log.formatFraction(m))
			));
		}

		if (m.abs().compareTo(j) > 0) {
			return Optional.of(new InvalidSymbol(
				InvalidSymbol.Rule.ProjectionOutOfRange,
				String.format("|m%d| = %s > j%d = %s", col, Log.formatFraction(m.abs()), col, Log.formatFraction(j))
			));
		}

		return Optional.empty();
	}
}
