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

package edu.duke.cs.wigner;

import edu.duke.cs.wigner.io.QuantumNumberParser;
import org.apache.commons.math3.fraction.BigFraction;
import org.hamcrest.BaseMatcher;
import org.hamcrest.Description;
import org.hamcrest.Matcher;


public class TestBase {

	private static final double DefaultEpsilon = 1e-14;

	/** shorthand for quantum numbers in tests, eg q("-1/2") */
	public static BigFraction q(String text) {
		return QuantumNumberParser.parse(text);
	}

	public static double getAbsoluteError(double expected, double observed) {
		if (expected == Double.POSITIVE_INFINITY && observed == Double.POSITIVE_INFINITY) {
			return 0;
		} else if (expected == Double.NEGATIVE_INFINITY && observed == Double.NEGATIVE_INFINITY) {
			return 0;
		} else if (Double.isInfinite(expected) || Double.isInfinite(observed)) {
			return Double.POSITIVE_INFINITY;
		}
		return Math.abs(expected - observed);
	}

	public static Matcher<Double> isAbsolutely(double expected) {
		return isAbsolutely(expected, DefaultEpsilon);
	}

	public static Matcher<Double> isAbsolutely(final double expected, final double epsilon) {
		return new BaseMatcher<Double>() {

			@Override
			public boolean matches(Object obj) {
				double observed = ((Double)obj).doubleValue();
				if (Double.isNaN(observed)) {
					return false;
				}
				return getAbsoluteError(expected, observed) <= epsilon;
			}

			@Override
			public void describeTo(Description desc) {
				desc.appendText("close to ").appendValue(expected);
			}

			@Override
			public void describeMismatch(Object obj, Description desc) {
				double observed = ((Double)obj).doubleValue();
				double absErr = getAbsoluteError(expected, observed);
				desc.appendText("value ").appendValue(observed)
					.appendText(" has absolute err ").appendValue(absErr)
					.appendText(" that's greater than epsilon ").appendValue(epsilon);
			}
		};
	}
}
