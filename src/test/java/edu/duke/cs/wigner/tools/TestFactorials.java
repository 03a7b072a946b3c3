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

import static org.hamcrest.Matchers.*;
import static org.hamcrest.MatcherAssert.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.apache.commons.math3.fraction.BigFraction;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;


public class TestFactorials {

	@Test
	public void small() {

		Factorials f = new Factorials();

		assertThat(f.get(0), is(BigInteger.ONE));
		assertThat(f.get(1), is(BigInteger.ONE));
		assertThat(f.get(2), is(BigInteger.valueOf(2)));
		assertThat(f.get(3), is(BigInteger.valueOf(6)));
		assertThat(f.get(5), is(BigInteger.valueOf(120)));
		assertThat(f.get(10), is(BigInteger.valueOf(3628800)));
	}

	@Test
	public void beyondLong() {

		Factorials f = new Factorials();

		// 21! overflows a long
		assertThat(f.get(21), is(new BigInteger("51090942171709440000")));
		assertThat(f.get(30), is(new BigInteger("265252859812191058636308480000000")));
	}

	@Test
	public void memoized() {

		Factorials f = new Factorials();
		assertThat(f.size(), is(1));

		f.get(7);
		assertThat(f.size(), is(8));

		// smaller arguments don't grow the table
		f.get(3);
		assertThat(f.size(), is(8));
	}

	@Test
	public void outOfOrder() {

		Factorials f = new Factorials();
		BigInteger big = f.get(12);
		BigInteger small = f.get(4);

		assertThat(big, is(BigInteger.valueOf(479001600)));
		assertThat(small, is(BigInteger.valueOf(24)));
	}

	@Test
	public void fraction() {

		Factorials f = new Factorials();

		assertThat(f.fraction(0), is(BigFraction.ONE));
		assertThat(f.fraction(4), is(new BigFraction(24)));
	}

	@Test
	public void product() {

		Factorials f = new Factorials();

		assertThat(f.product(), is(BigInteger.ONE));
		assertThat(f.product(0, 0, 0), is(BigInteger.ONE));
		assertThat(f.product(2, 3, 4), is(BigInteger.valueOf(2*6*24)));
	}

	@Test
	public void negative() {
		Factorials f = new Factorials();
		assertThrows(IllegalArgumentException.class, () -> f.get(-1));
		assertThrows(IllegalArgumentException.class, () -> f.product(1, -2));
	}

	@Test
	public void concurrentGrowth()
	throws Exception {

		Factorials f = new Factorials();
		Factorials reference = new Factorials();

		ExecutorService pool = Executors.newFixedThreadPool(4);
		try {
			List<Future<BigInteger>> results = new ArrayList<>();
			for (int i=0; i<64; i++) {
				int n = 64 - i;
				results.add(pool.submit(() -> f.get(n)));
			}
			for (int i=0; i<64; i++) {
				assertThat(results.get(i).get(), is(reference.get(64 - i)));
			}
		} finally {
			pool.shutdown();
		}
	}
}
