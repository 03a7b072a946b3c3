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
 * Evaluates Wigner 6-j symbols exactly with the Racah formula:
 * <pre>
 * Delta(j1,j2,j3) Delta(j1,j5,j6) Delta(j4,j2,j6) Delta(j4,j5,j3)
 *     * sum_k (-1)^k (k+1)! / [(k-a1)!(k-a2)!(k-a3)!(k-a4)!(b1-k)!(b2-k)!(b3-k)!]
 * </pre>
 * where a1..a4 are the perimeters of the four triads and
 * b1 = j1+j2+j4+j5, b2 = j2+j3+j5+j6, b3 = j3+j1+j6+j4.
 */
public class SixJSymbol {

	private final Factorials factorials;

	public SixJSymbol(Factorials factorials) {
		this.factorials = factorials;
	}

	public SymbolValue evaluate(SixJRequest r) {

		Optional<InvalidSymbol> invalid = SelectionRules.validate6j(r);
		if (invalid.isPresent()) {
			return SymbolValue.invalid(r, invalid.get());
		}

		int[] a = {
			Triangles.perimeter(r.j1, r.j2, r.j3),
			Triangles.perimeter(r.j1, r.j5, r.j6),
			Triangles.perimeter(r.j4, r.j2, r.j6),
			Triangles.perimeter(r.j4, r.j5, r.j3)
		};
		int[] b = {
			MathTools.toIntExact(r.j1.add(r.j2).add(r.j4).add(r.j5)),
			MathTools.toIntExact(r.j2.add(r.j3).add(r.j5).add(r.j6)),
			MathTools.toIntExact(r.j3.add(r.j1).add(r.j6).add(r.j4))
		};

		int kmin = Math.max(Math.max(a[0], a[1]), Math.max(a[2], a[3]));
		int kmax = Math.min(b[0], Math.min(b[1], b[2]));

		// an empty range is possible for valid triads, and the symbol is then zero
		BigFraction sum = BigFraction.ZERO;
		for (int k=kmin; k<=kmax; k++) {
			BigInteger denom = factorials.product(
				k - a[0], k - a[1], k - a[2], k - a[3],
				b[0] - k, b[1] - k, b[2] - k
			);
			BigInteger num = factorials.get(k + 1);
			if (MathTools.phase(k) < 0) {
				num = num.negate();
			}
			sum = sum.add(new BigFraction(num, denom));
		}

		BigFraction square = Triangles.deltaSquared(r.j1, r.j2, r.j3, factorials)
			.multiply(Triangles.deltaSquared(r.j1, r.j5, r.j6, factorials))
			.multiply(Triangles.deltaSquared(r.j4, r.j2, r.j6, factorials))
			.multiply(Triangles.deltaSquared(r.j4, r.j5, r.j3, factorials));

		return SymbolValue.of(r, SignedSurd.of(sum, square));
	}
}
