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
 * Arguments of the 3-j symbol
 * <pre>
 * ( j1 j2 j3 )
 * ( m1 m2 m3 )
 * </pre>
 */
public class ThreeJRequest implements SymbolRequest {

	public static final String SymbolName = "3-j";

	public final BigFraction j1;
	public final BigFraction j2;
	public final BigFraction j3;
	public final BigFraction m1;
	public final BigFraction m2;
	public final BigFraction m3;

	/**
	 * @throws IllegalArgumentException if any j is negative or any value is not an integer or half-integer
	 */
	public ThreeJRequest(BigFraction j1, BigFraction j2, BigFraction j3, BigFraction m1, BigFraction m2, BigFraction m3) {
		this.j1 = QuantumNumbers.checkAngularMomentum("j1", j1);
		this.j2 = QuantumNumbers.checkAngularMomentum("j2", j2);
		this.j3 = QuantumNumbers.checkAngularMomentum("j3", j3);
		this.m1 = QuantumNumbers.checkMagnetic("m1", m1);
		this.m2 = QuantumNumbers.checkMagnetic("m2", m2);
		this.m3 = QuantumNumbers.checkMagnetic("m3", m3);
	}

	/** all arguments are doubled, so 1 means 1/2 */
	public static ThreeJRequest ofDoubled(int twoJ1, int twoJ2, int twoJ3, int twoM1, int twoM2, int twoM3) {
		return new ThreeJRequest(
			new BigFraction(twoJ1, 2), new BigFraction(twoJ2, 2), new BigFraction(twoJ3, 2),
			new BigFraction(twoM1, 2), new BigFraction(twoM2, 2), new BigFraction(twoM3, 2)
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
		return Arrays.asList(m1, m2, m3);
	}

	@Override
	public boolean equals(Object other) {
		if (other instanceof ThreeJRequest) {
			ThreeJRequest o = (ThreeJRequest)other;
			return getTopRow().equals(o.getTopRow())
				&& getBottomRow().equals(o.getBottomRow());
		}
		return false;
	}

	@Override
	public int hashCode() {
		return Objects.hash(j1, j2, j3, m1, m2, m3);
	}

	@Override
	public String toString() {
		return String.format("%s%s%s", SymbolName, getTopRow(), getBottomRow());
	}
}
