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


/**
 * Names the selection rule that makes a symbol vanish.
 *
 * An invalid symbol is not an error: its value is exactly zero.
 */
public class InvalidSymbol {

	public enum Rule {

		/** j - m is not an integer, ie one of j,m is an integer and the other isn't */
		ParityMismatch("j and m must both be integers or both be half-integers"),

		/** |m| > j */
		ProjectionOutOfRange("|m| must not exceed j"),

		/** m1 + m2 + m3 != 0 */
		ProjectionsDoNotSumToZero("m1 + m2 + m3 must be zero"),

		/** c < |a - b| or c > a + b */
		TriangleInequality("|a - b| <= c <= a + b must hold"),

		/** a + b + c is not an integer */
		NonIntegerPerimeter("a + b + c must be an integer");

		public final String description;

		Rule(String description) {
			this.description = description;
		}
	}

	public final Rule rule;

	/** which column or triad broke the rule, eg "(j1,j2,j3) = (1,1,3)" */
	public final String detail;

	public InvalidSymbol(Rule rule, String detail) {
		this.rule = rule;
		this.detail = detail;
	}

	@Override
	public String toString() {
		return String.format("%s: %s", rule.description, detail);
	}
}
