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


/**
 * Entry point for symbol evaluation.
 *
 * Evaluation is a pure function of the request. The only state is the factorial table,
 * which is shared by both evaluators and safe to use from several threads.
 */
public class WignerCalculator {

	public final Factorials factorials;

	private final ThreeJSymbol threeJ;
	private final SixJSymbol sixJ;

	public WignerCalculator() {
		this(new Factorials());
	}

	public WignerCalculator(Factorials factorials) {
		this.factorials = factorials;
		this.threeJ = new ThreeJSymbol(factorials);
		this.sixJ = new SixJSymbol(factorials);
	}

	public SymbolValue evaluate(SymbolRequest request) {
		if (request instanceof ThreeJRequest) {
			return threeJ.evaluate((ThreeJRequest)request);
		} else if (request instanceof SixJRequest) {
			return sixJ.evaluate((SixJRequest)request);
		} else {
			throw new IllegalArgumentException("unsupported symbol: " + request.getClass().getName());
		}
	}

	public SymbolValue threeJ(ThreeJRequest request) {
		return threeJ.evaluate(request);
	}

	public SymbolValue sixJ(SixJRequest request) {
		return sixJ.evaluate(request);
	}
}
