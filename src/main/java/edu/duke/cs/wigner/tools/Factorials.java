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
import java.util.ArrayList;
import java.util.List;


/**
 * Memoized table of exact factorials.
 *
 * The table grows on demand up to the largest argument requested so far.
 * Growth is synchronized, so one instance can be shared by evaluators on different threads.
 */
public class Factorials {

	private final List<BigInteger> table;

	public Factorials() {
		table = new ArrayList<>();
		table.add(BigInteger.ONE);
	}

	/** returns n! */
	public synchronized BigInteger get(int n) {

		if (n < 0) {
			throw new IllegalArgumentException("factorial of negative number: " + n);
		}

		// extend the table from the last known value
		for (int i=table.size(); i<=n; i++) {
			table.add(table.get(i - 1).multiply(BigInteger.valueOf(i)));
		}

		return table.get(n);
	}

	/** returns n! as an integer-valued fraction */
	public BigFraction fraction(int n) {
		return new BigFraction(get(n));
	}

	/** returns the product of the factorials of all the arguments */
	public BigInteger product(int ... args) {
		BigInteger p = BigInteger.ONE;
		for (int n : args) {
			p = p.multiply(get(n));
		}
		return p;
	}

	/** the number of factorials currently memoized, including 0! */
	public synchronized int size() {
		return table.size();
	}
}
