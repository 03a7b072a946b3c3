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

import org.apache.commons.math3.fraction.BigFraction;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;


/**
 * Arguments of the 6-j symbol
 * <pre>
 * { j1 j2 j3 }
 * { j4 j5 j6 }
 * </pre>
 */
public class SixJRequest implements SymbolRequest {

	public static final String SymbolName = "6-j";

	public final BigFraction j1;
	public final BigFraction j2;
	public final BigFraction j3;
	public final BigFraction j4;
	public final BigFraction j5;
	public final BigFraction j6;

	/**
	 * @throws IllegalArgumentException if any j is negative or not an integer or half-integer
	 */
	public SixJRequest(BigFraction j1, BigFraction j2, BigFraction j3, BigFraction j4, BigFraction j5, BigFraction j6) {
		this.j1 = QuantumNumbers.checkAngularMomentum("j1", j1);
		this.j2 = QuantumNumbers.checkAngularMomentum("j2", j2);
		this.j3 = QuantumNumbers.checkAngularMomentum("j3", j3);
		this.j4 = QuantumNumbers.checkAngularMomentum("j4", j4);
		this.j5 = QuantumNumbers.checkAngularMomentum("j5", j5);
		this.j6 = QuantumNumbers.checkAngularMomentum("j6", j6);
	}

	/** all arguments are doubled, so 1 means 1/2 */
	public static SixJRequest ofDoubled(int twoJ1, int twoJ2, int twoJ3, int twoJ4, int twoJ5, int twoJ6) {
		return new SixJRequest(
			new BigFraction(twoJ1, 2), new BigFraction(twoJ2, 2), new BigFraction(twoJ3, 2),
			new BigFraction(twoJ4, 2), new BigFraction(twoJ5, 2), new BigFraction(twoJ6, 2)
		);
	}

	@Override
	public String getSymbolName() {
		return SymbolName;
	}

	@Override
	public List<BigFraction> getTopRow() {
		return Arrays.asList(j1, j2, j3);
	}

	@Override
	public List<BigFraction> getBottomRow() {
		return Arrays.asList(j4, j5, j6);
	}

	@Override
	public boolean equals(Object other) {
		if (other instanceof SixJRequest) {
			SixJRequest o = (SixJRequest)other;
			return getTopRow().equals(o.getTopRow())
				&& getBottomRow().equals(o.getBottomRow());
		}
		return false;
	}

	@Override
	public int hashCode() {
		return Objects.hash(j1, j2, j3, j4, j5, j6);
	}

	@Override
	public String toString() {
		return String.format("%s%s%s", SymbolName, getTopRow(), getBottomRow());
	}
}
