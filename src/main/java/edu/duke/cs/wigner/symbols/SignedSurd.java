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

import ch.obermuhlner.math.big.BigDecimalMath;
import edu.duke.cs.wigner.tools.Log;
import edu.duke.cs.wigner.tools.MathTools;
import org.apache.commons.math3.fraction.BigFraction;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Objects;


/**
 * An exact value of the form sign*sqrt(square), where square is a non-negative rational.
 *
 * Every 3-j and 6-j symbol has this form. The square root is only taken when a decimal value is requested.
 */
public class SignedSurd {

	/** enough digits that the conversion to double is correctly rounded for all practical inputs */
	public static final MathContext DefaultContext = new MathContext(40, RoundingMode.HALF_EVEN);

	public static final SignedSurd Zero = new SignedSurd(0, BigFraction.ZERO);

	/** -1, 0, or 1 */
	public final int sign;

	/** the square of the value, never negative */
	public final BigFraction square;

	public SignedSurd(int sign, BigFraction square) {

		if (MathTools.signum(square) < 0) {
			throw new IllegalArgumentException("square must not be negative: " + Log.formatFraction(square));
		}

		// normalize zeros
		if (sign == 0 || MathTools.isZero(square)) {
			this.sign = 0;
			this.square = BigFraction.ZERO;
		} else {
			this.sign = Integer.signum(sign);
			this.square = square;
		}
	}

	/** returns r*sqrt(square), with the sign of r */
	public static SignedSurd of(BigFraction r, BigFraction square) {
		return new SignedSurd(MathTools.signum(r), square.multiply(r.multiply(r)));
	}

	public boolean isZero() {
		return sign == 0;
	}

	public SignedSurd negate() {
		return new SignedSurd(-sign, square);
	}

	/** the exact square root of the square, if the value happens to be rational, otherwise null */
	public BigFraction toRational() {
		BigInteger num = MathTools.exactSqrt(square.getNumerator());
		BigInteger den = MathTools.exactSqrt(square.getDenominator());
		if (num == null || den == null) {
			return null;
		}
		BigFraction root = new BigFraction(num, den);
		return sign < 0 ? root.negate() : root;
	}

	public BigDecimal toBigDecimal(MathContext context) {
		if (isZero()) {
			return BigDecimal.ZERO;
		}
		BigDecimal sq = new BigDecimal(square.getNumerator())
			.divide(new BigDecimal(square.getDenominator()), context);
		BigDecimal root = BigDecimalMath.sqrt(sq, context);
		return sign < 0 ? root.negate() : root;
	}

	public double doubleValue() {
		return toBigDecimal(DefaultContext).doubleValue();
	}

	/** renders the exact form, eg -sqrt(1/6), or 1/6 when the value is rational */
	public String toExactString() {
		BigFraction rational = toRational();
		if (rational != null) {
			return Log.formatFraction(rational);
		}
		return String.format("%ssqrt(%s)", sign < 0 ? "-" : "", Log.formatFraction(square));
	}

	@Override
	public boolean equals(Object other) {
		if (other instanceof SignedSurd) {
			SignedSurd o = (SignedSurd)other;
			return sign == o.sign && square.equals(o.square);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return Objects.hash(sign, square);
	}

	@Override
	public String toString() {
		return toExactString();
	}
}
