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
import edu.duke.cs.wigner.tools.MathTools;
import org.apache.commons.math3.fraction.BigFraction;

import java.math.BigInteger;
import java.util.Optional;


/**
 * Evaluates Wigner 3-j symbols exactly with the Racah formula:
 * <pre>
 * (-1)^(j1-j2-m3) Delta(j1,j2,j3) sqrt[(j1+m1)!(j1-m1)!(j2+m2)!(j2-m2)!(j3+m3)!(j3-m3)!]
 *     * sum_k (-1)^k / [k!(j1+j2-j3-k)!(j1-m1-k)!(j2+m2-k)!(j3-j2+m1+k)!(j3-j1-m2+k)!]
 * </pre>
 * where k runs over all integers that keep every factorial argument non-negative.
 */
public class ThreeJSymbol {

	private final Factorials factorials;

	public ThreeJSymbol(Factorials factorials) {
		this.factorials = factorials;
	}

	public SymbolValue evaluate(ThreeJRequest r) {

		Optional<InvalidSymbol> invalid = SelectionRules.validate3j(r);
		if (invalid.isPresent()) {
			return SymbolValue.invalid(r, invalid.get());
		}

		// the validated selection rules make all of these integers
		int j1pm1 = MathTools.toIntExact(r.j1.add(r.m1));
		int j1mm1 = MathTools.toIntExact(r.j1.subtract(r.m1));
		int j2pm2 = MathTools.toIntExact(r.j2.add(r.m2));
		int j2mm2 = MathTools.toIntExact(r.j2.subtract(r.m2));
		int j3pm3 = MathTools.toIntExact(r.j3.add(r.m3));
		int j3mm3 = MathTools.toIntExact(r.j3.subtract(r.m3));
		int j12m3 = MathTools.toIntExact(r.j1.add(r.j2).subtract(r.j3));
		int j3m2pm1 = MathTools.toIntExact(r.j3.subtract(r.j2).add(r.m1));
		int j3m1mm2 = MathTools.toIntExact(r.j3.subtract(r.j1).subtract(r.m2));
		int phase = MathTools.phase(MathTools.toIntExact(r.j1.subtract(r.j2).subtract(r.m3)));

		// summation range, from the six factorial arguments in the denominator
		int kmin = Math.max(0, Math.max(-j3m2pm1, -j3m1mm2));
		int kmax = Math.min(j12m3, Math.min(j1mm1, j2pm2));

		BigFraction sum = BigFraction.ZERO;
		for (int k=kmin; k<=kmax; k++) {
			BigInteger denom = factorials.product(
				k,
				j12m3 - k,
				j1mm1 - k,
				j2pm2 - k,
				j3m2pm1 + k,
				j3m1mm2 + k
			);
			BigInteger num = BigInteger.valueOf(MathTools.phase(k));
			sum = sum.add(new BigFraction(num, denom));
		}

		BigFraction square = Triangles.deltaSquared(r.j1, r.j2, r.j3, factorials)
			.multiply(factorials.product(j1pm1, j1mm1, j2pm2, j2mm2, j3pm3, j3mm3));

		SignedSurd value = SignedSurd.of(sum, square);
		if (phase < 0) {
			value = value.negate();
		}
		return SymbolValue.of(r, value);
	}
}
