/**
 * MIT License
 * <p>
 * Copyright (c) 2021 Justin Kunimune
 * <p>
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 * <p>
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 * <p>
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package quantity;

import java.math.BigInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * an exact fraction, used for the exponents of units so that things like the square root of
 * a meter come out right.  always stored in lowest terms with a positive denominator.
 * @author Justin Kunimune
 */
public final class Rational implements Comparable<Rational> {
	private static final Logger logger = Logger.getLogger(Rational.class.getName());

	/** the largest denominator that {@link #approximate(double)} will try */
	public static final int MAX_DENOMINATOR = 1000;

	/** 2^63; doubles at or beyond this don't fit in a long */
	private static final double LONG_RANGE = 0x1p63;

	public static final Rational ZERO = new Rational(0, 1);
	public static final Rational ONE = new Rational(1, 1);

	public final long numerator;
	public final long denominator;

	private Rational(long numerator, long denominator) {
		this.numerator = numerator;
		this.denominator = denominator;
	}

	public static Rational valueOf(long integer) {
		return new Rational(integer, 1);
	}

	public static Rational valueOf(long numerator, long denominator) {
		if (denominator == 0)
			throw new DivisionByZeroException("the denominator of " + numerator + "/0 is zero");
		if (denominator < 0) {
			if (numerator == Long.MIN_VALUE || denominator == Long.MIN_VALUE)
				throw new FractionalDimensionException(String.format(
					  "%d/%d does not fit in a long fraction", numerator, denominator));
			numerator = -numerator;
			denominator = -denominator;
		}
		long gcd = gcd(Math.abs(numerator), denominator);
		return new Rational(numerator/gcd, denominator/gcd);
	}

	/**
	 * find the fraction that is exactly equal to a floating point number, up to rounding
	 * error, trying every denominator up to {@link #MAX_DENOMINATOR}.
	 * @throws FractionalDimensionException if no such fraction exists
	 */
	public static Rational approximate(double x) {
		if (!Double.isFinite(x))
			throw new FractionalDimensionException(x + " is not a fraction");
		if (x == Math.rint(x)) {
			if (Math.abs(x) >= LONG_RANGE)
				throw new FractionalDimensionException(x + " is too large to be an exponent");
			return valueOf((long) x);
		}
		for (long d = 2; d <= MAX_DENOMINATOR; d ++) {
			double n = x*d;
			double rounded = Math.rint(n);
			if (Math.abs(n - rounded) <= 1e-9*Math.max(1, Math.abs(n))) {
				if (Math.abs(rounded) >= LONG_RANGE)
					throw new FractionalDimensionException(x + " is too large to be an exponent");
				Rational result = valueOf((long) rounded, d);
				if (logger.isLoggable(Level.FINE))
					logger.fine(String.format("read the exponent %s as %s", x, result));
				return result;
			}
		}
		throw new FractionalDimensionException(String.format(
			  "%s cannot be written as a fraction with a denominator of at most %d", x, MAX_DENOMINATOR));
	}

	private static long gcd(long a, long b) {
		while (b != 0) {
			long t = a%b;
			a = b;
			b = t;
		}
		return (a == 0) ? 1 : a;
	}

	public Rational plus(Rational that) {
		try {
			return valueOf(
				  Math.addExact(Math.multiplyExact(this.numerator, that.denominator),
				                Math.multiplyExact(that.numerator, this.denominator)),
				  Math.multiplyExact(this.denominator, that.denominator));
		} catch (FractionalDimensionException e) {
			throw e;
		} catch (ArithmeticException e) {
			throw overflow(this, "+", that, e);
		}
	}

	public Rational minus(Rational that) {
		return this.plus(that.neg());
	}

	public Rational times(Rational that) {
		try {
			return valueOf(
				  Math.multiplyExact(this.numerator, that.numerator),
				  Math.multiplyExact(this.denominator, that.denominator));
		} catch (FractionalDimensionException e) {
			throw e;
		} catch (ArithmeticException e) {
			throw overflow(this, "×", that, e);
		}
	}

	public Rational over(Rational that) {
		if (that.isZero())
			throw new DivisionByZeroException("cannot divide " + this + " by zero");
		try {
			return valueOf(
				  Math.multiplyExact(this.numerator, that.denominator),
				  Math.multiplyExact(this.denominator, that.numerator));
		} catch (FractionalDimensionException e) {
			throw e;
		} catch (ArithmeticException e) {
			throw overflow(this, "/", that, e);
		}
	}

	public Rational neg() {
		if (this.numerator == Long.MIN_VALUE)
			throw new FractionalDimensionException("-(" + this + ") does not fit in a long fraction");
		return new Rational(-this.numerator, this.denominator);
	}

	private static FractionalDimensionException overflow(Rational a, String operator, Rational b, ArithmeticException cause) {
		FractionalDimensionException e = new FractionalDimensionException(String.format(
			  "%s %s %s does not fit in a long fraction", a, operator, b));
		e.initCause(cause);
		return e;
	}

	public boolean isZero() {
		return this.numerator == 0;
	}

	public boolean isInteger() {
		return this.denominator == 1;
	}

	public double doubleValue() {
		return (double) this.numerator/this.denominator;
	}

	@Override
	public int compareTo(Rational that) {
		try {
			return Long.compare(Math.multiplyExact(this.numerator, that.denominator),
			                    Math.multiplyExact(that.numerator, this.denominator));
		} catch (ArithmeticException e) { // cross-multiply in full precision instead
			return BigInteger.valueOf(this.numerator).multiply(BigInteger.valueOf(that.denominator)).compareTo(
				  BigInteger.valueOf(that.numerator).multiply(BigInteger.valueOf(this.denominator)));
		}
	}

	@Override
	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (!(o instanceof Rational))
			return false;
		Rational that = (Rational) o;
		return this.numerator == that.numerator && this.denominator == that.denominator;
	}

	@Override
	public int hashCode() {
		return 31*Long.hashCode(this.numerator) + Long.hashCode(this.denominator);
	}

	@Override
	public String toString() {
		if (this.isInteger())
			return Long.toString(this.numerator);
		else
			return this.numerator + "/" + this.denominator;
	}
}
