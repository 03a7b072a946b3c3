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

import static edu.duke.cs.wigner.TestBase.*;
import static org.hamcrest.Matchers.*;
import static org.hamcrest.MatcherAssert.*;

import org.apache.commons.math3.fraction.BigFraction;
import org.junit.jupiter.api.Test;


public class TestThreeJSymbol {

	private final WignerCalculator calc = new WignerCalculator();

	private SymbolValue threeJ(String j1, String j2, String j3, String m1, String m2, String m3) {
		return calc.evaluate(new ThreeJRequest(q(j1), q(j2), q(j3), q(m1), q(m2), q(m3)));
	}

	private static void assertExact(SymbolValue value, int sign, BigFraction square) {
		assertThat(value.isValid(), is(true));
		assertThat(value.exact, is(new SignedSurd(sign, square)));
	}

	@Test
	public void oneOneOne() {
		SymbolValue v = threeJ("1", "1", "1", "1", "-1", "0");
		assertExact(v, 1, new BigFraction(1, 6));
		assertThat(v.doubleValue(), isAbsolutely(1.0/Math.sqrt(6.0)));
	}

	@Test
	public void spinHalfSinglet() {

		SymbolValue up = threeJ("1/2", "1/2", "0", "1/2", "-1/2", "0");
		assertExact(up, 1, new BigFraction(1, 2));
		assertThat(up.doubleValue(), isAbsolutely(Math.sqrt(0.5)));

		SymbolValue down = threeJ("1/2", "1/2", "0", "-1/2", "1/2", "0");
		assertExact(down, -1, new BigFraction(1, 2));
		assertThat(down.doubleValue(), isAbsolutely(-Math.sqrt(0.5)));
	}

	@Test
	public void zeroCoupling() {
		// (j j 0; m -m 0) = (-1)^(j-m)/sqrt(2j+1)
		for (int twoJ=0; twoJ<=8; twoJ++) {
			for (int twoM=-twoJ; twoM<=twoJ; twoM+=2) {
				SymbolValue v = calc.evaluate(ThreeJRequest.ofDoubled(twoJ, twoJ, 0, twoM, -twoM, 0));
				int sign = ((twoJ - twoM)/2) % 2 == 0 ? 1 : -1;
				assertExact(v, sign, new BigFraction(1, twoJ + 1));
			}
		}
	}

	@Test
	public void knownValues() {
		assertExact(threeJ("2", "2", "2", "0", "0", "0"), -1, new BigFraction(2, 35));
		assertExact(threeJ("3/2", "1/2", "1", "1/2", "-1/2", "0"), -1, new BigFraction(1, 6));
		assertExact(threeJ("2", "1", "3", "1", "0", "-1"), 1, new BigFraction(8, 105));
	}

	@Test
	public void oddSumWithZeroProjections() {
		// (j1 j2 j3; 0 0 0) vanishes when j1+j2+j3 is odd, without breaking any selection rule
		SymbolValue v = threeJ("1", "1", "1", "0", "0", "0");
		assertThat(v.isValid(), is(true));
		assertThat(v.exact.isZero(), is(true));
		assertThat(v.doubleValue(), is(0.0));
	}

	@Test
	public void triangleRejection() {
		SymbolValue v = threeJ("1", "1", "3", "0", "0", "0");
		assertThat(v.isValid(), is(false));
		assertThat(v.getInvalidSymbol().get().rule, is(InvalidSymbol.Rule.TriangleInequality));
		assertThat(v.doubleValue(), is(0.0));
		assertThat(v.exact, is(SignedSurd.Zero));
	}

	@Test
	public void selectionRuleFailuresAreZero() {
		assertThat(threeJ("1", "1", "1", "1", "1", "0").getInvalidSymbol().get().rule, is(InvalidSymbol.Rule.ProjectionsDoNotSumToZero));
		assertThat(threeJ("1", "1", "1", "2", "-2", "0").getInvalidSymbol().get().rule, is(InvalidSymbol.Rule.ProjectionOutOfRange));
		assertThat(threeJ("1", "1", "1", "1/2", "-1/2", "0").getInvalidSymbol().get().rule, is(InvalidSymbol.Rule.ParityMismatch));
		assertThat(threeJ("1", "1/2", "1", "0", "1/2", "-1/2").getInvalidSymbol().get().rule, is(InvalidSymbol.Rule.ParityMismatch));
	}

	/** all valid 3-j symbols with j values up to 2 */
	private interface SymbolVisitor {
		void visit(int tj1, int tj2, int tj3, int tm1, int tm2, int tm3);
	}

	private static void forEachSymbol(SymbolVisitor visitor) {
		for (int tj1=0; tj1<=4; tj1++) {
			for (int tj2=0; tj2<=4; tj2++) {
				for (int tj3=Math.abs(tj1 - tj2); tj3<=tj1 + tj2; tj3+=2) {
					for (int tm1=-tj1; tm1<=tj1; tm1+=2) {
						for (int tm2=-tj2; tm2<=tj2; tm2+=2) {
							int tm3 = -tm1 - tm2;
							if (Math.abs(tm3) <= tj3) {
								visitor.visit(tj1, tj2, tj3, tm1, tm2, tm3);
							}
						}
					}
				}
			}
		}
	}

	private SignedSurd eval(int tj1, int tj2, int tj3, int tm1, int tm2, int tm3) {
		SymbolValue v = calc.evaluate(ThreeJRequest.ofDoubled(tj1, tj2, tj3, tm1, tm2, tm3));
		assertThat(v.isValid(), is(true));
		return v.exact;
	}

	@Test
	public void columnPermutations() {
		forEachSymbol((tj1, tj2, tj3, tm1, tm2, tm3) -> {

			SignedSurd v = eval(tj1, tj2, tj3, tm1, tm2, tm3);
			SignedSurd odd = ((tj1 + tj2 + tj3)/2) % 2 == 0 ? v : v.negate();

			// cyclic
			assertThat(eval(tj2, tj3, tj1, tm2, tm3, tm1), is(v));
			assertThat(eval(tj3, tj1, tj2, tm3, tm1, tm2), is(v));

			// anticyclic
			assertThat(eval(tj2, tj1, tj3, tm2, tm1, tm3), is(odd));
			assertThat(eval(tj1, tj3, tj2, tm1, tm3, tm2), is(odd));
		});
	}

	@Test
	public void projectionSignFlip() {
		forEachSymbol((tj1, tj2, tj3, tm1, tm2, tm3) -> {
			SignedSurd v = eval(tj1, tj2, tj3, tm1, tm2, tm3);
			SignedSurd flipped = ((tj1 + tj2 + tj3)/2) % 2 == 0 ? v : v.negate();
			assertThat(eval(tj1, tj2, tj3, -tm1, -tm2, -tm3), is(flipped));
		});
	}

	@Test
	public void orthogonality() {
		// sum over j3 of (2j3+1) (j1 j2 j3; m1 m2 m3)^2 = 1, exactly
		int[][] cases = {
			{ 4, 3, 2, -1 },
			{ 2, 2, 0, 0 },
			{ 5, 4, -3, 2 },
			{ 6, 6, 2, -4 }
		};
		for (int[] c : cases) {
			int tj1 = c[0];
			int tj2 = c[1];
			int tm1 = c[2];
			int tm2 = c[3];
			BigFraction sum = BigFraction.ZERO;
			for (int tj3=Math.abs(tj1 - tj2); tj3<=tj1 + tj2; tj3+=2) {
				BigFraction j3 = new BigFraction(tj3, 2);
				assertThat(Triangles.isTriangle(new BigFraction(tj1, 2), new BigFraction(tj2, 2), j3), is(true));
				SymbolValue v = calc.evaluate(ThreeJRequest.ofDoubled(tj1, tj2, tj3, tm1, tm2, -tm1 - tm2));
				sum = sum.add(v.exact.square.multiply(tj3 + 1));
			}
			assertThat(sum, is(BigFraction.ONE));
		}
	}

	@Test
	public void deterministic() {
		SymbolValue a = threeJ("7/2", "5/2", "3", "-3/2", "1/2", "1");
		SymbolValue b = new WignerCalculator().evaluate(new ThreeJRequest(q("7/2"), q("5/2"), q("3"), q("-3/2"), q("1/2"), q("1")));
		assertThat(a.exact, is(b.exact));
		assertThat(Double.doubleToRawLongBits(a.doubleValue()), is(Double.doubleToRawLongBits(b.doubleValue())));
	}

	@Test
	public void largeMomenta() {
		// needs factorials far beyond the range of a long
		SymbolValue v = threeJ("40", "40", "0", "13", "-13", "0");
		assertExact(v, -1, new BigFraction(1, 81));
	}
}
