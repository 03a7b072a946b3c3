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

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Optional;


/**
 * The outcome of evaluating one symbol: either an exact value, or the selection rule that makes it vanish.
 * Either way the numeric value is well defined.
 */
public class SymbolValue {

	public final SymbolRequest request;

	/** exactly zero when the symbol is invalid */
	public final SignedSurd exact;

	private final InvalidSymbol invalid;

	private SymbolValue(SymbolRequest request, SignedSurd exact, InvalidSymbol invalid) {
		this.request = request;
		this.exact = exact;
		this.invalid = invalid;
	}

	public static SymbolValue of(SymbolRequest request, SignedSurd exact) {
		return new SymbolValue(request, exact, null);
	}

	public static SymbolValue invalid(SymbolRequest request, InvalidSymbol invalid) {
		return new SymbolValue(request, SignedSurd.Zero, invalid);
	}

	public boolean isValid() {
		return invalid == null;
	}

	public Optional<InvalidSymbol> getInvalidSymbol() {
		return Optional.ofNullable(invalid);
	}

	public double doubleValue() {
		return exact.doubleValue();
	}

	public BigDecimal toBigDecimal(MathContext context) {
		return exact.toBigDecimal(context);
	}

	@Override
	public String toString() {
		if (invalid != null) {
			return String.format("%s = 0 (%s)", request, invalid);
		}
		return String.format("%s = %s", request, exact.toExactString());
	}
}
