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

import java.util.Arrays;
import java.util.Objects;

/**
 * a physical unit: a rational exponent for each of the SI base dimensions, and a scale
 * factor relative to the coherent SI unit with those exponents (so a kilometer is
 * L^1 with a scale of 1000).  two units can be added iff their exponents match; if their
 * scales differ, that's a conversion factor and not an error.
 * @author Justin Kunimune
 */
public final class Unit {
	private static final int NUM_DIMENSIONS = Dimension.values().length;

	/** the dimensionless unit with scale 1 */
	public static final Unit ONE = new Unit(zeros(), 1);

	/** the exponent of each base dimension, indexed by ordinal */
	private final Rational[] exponents;
	/** the size of this unit in coherent SI units */
	private final double scale;

	/**
	 * @param exponents the exponent of each base dimension, in the order of {@link Dimension}
	 * @param scale the size of this unit in terms of the coherent SI unit
	 */
	public Unit(Rational[] exponents, double scale) {
		if (exponents.length != NUM_DIMENSIONS)
			throw new IllegalArgumentException("a unit needs " + NUM_DIMENSIONS + " exponents, not " + exponents.length);
		for (Rational exponent: exponents)
			Objects.requireNonNull(exponent);
		if (!(scale > 0) || Double.isInfinite(scale))
			throw new IllegalArgumentException("the scale of a unit must be positive and finite, not " + scale);
		this.exponents = exponents.clone();
		this.scale = scale;
	}

	/**
	 * build a unit from integer exponents.
	 * @param scale the size of this unit in terms of the coherent SI unit
	 * @param exponents the exponent of each base dimension, in the order of {@link Dimension};
	 *                  any that are left off at the end are zero
	 */
	public static Unit of(double scale, int... exponents) {
		if (exponents.length > NUM_DIMENSIONS)
			throw new IllegalArgumentException("there are only " + NUM_DIMENSIONS + " base dimensions");
		Rational[] rationals = zeros();
		for (int i = 0; i < exponents.length; i ++)
			rationals[i] = Rational.valueOf(exponents[i]);
		return new Unit(rationals, scale);
	}

	/**
	 * the coherent SI unit of a single base dimension, like the meter or the second
	 */
	public static Unit base(Dimension dimension) {
		Rational[] exponents = zeros();
		exponents[dimension.ordinal()] = Rational.ONE;
		return new Unit(exponents, 1);
	}

	private static Rational[] zeros() {
		Rational[] zeros = new Rational[NUM_DIMENSIONS];
		Arrays.fill(zeros, Rational.ZERO);
		return zeros;
	}

	public Unit times(Unit that) {
		Rational[] sum = new Rational[NUM_DIMENSIONS];
		for (int i = 0; i < NUM_DIMENSIONS; i ++)
			sum[i] = this.exponents[i].plus(that.exponents[i]);
		return new Unit(sum, this.scale*that.scale);
	}

	public Unit over(Unit that) {
		Rational[] difference = new Rational[NUM_DIMENSIONS];
		for (int i = 0; i < NUM_DIMENSIONS; i ++)
			difference[i] = this.exponents[i].minus(that.exponents[i]);
		return new Unit(difference, this.scale/that.scale);
	}

	/**
	 * rescale this unit, the way a prefix does.  kilometer = meter.times(1000).
	 */
	public Unit times(double factor) {
		return new Unit(this.exponents, this.scale*factor);
	}

	public Unit inverse() {
		return ONE.over(this);
	}

	/**
	 * @throws IllegalArgumentException if the scale overflows to infinity or underflows to zero
	 */
	public Unit pow(int exponent) {
		return this.pow(Rational.valueOf(exponent));
	}

	/**
	 * @throws FractionalDimensionException if an exponent no longer fits in a long fraction
	 * @throws IllegalArgumentException if the scale overflows to infinity or underflows to zero
	 */
	public Unit pow(Rational exponent) {
		Rational[] product = new Rational[NUM_DIMENSIONS];
		for (int i = 0; i < NUM_DIMENSIONS; i ++)
			product[i] = this.exponents[i].times(exponent);
		return new Unit(product, Math.pow(this.scale, exponent.doubleValue()));
	}

	/**
	 * @throws FractionalDimensionException if the exponent isn't a fraction with a small
	 *                                      denominator
	 * @throws IllegalArgumentException if the scale overflows to infinity or underflows to zero
	 */
	public Unit pow(double exponent) {
		return this.pow(Rational.approximate(exponent));
	}

	public Unit sqrt() {
		return this.root(2);
	}

	public Unit root(int n) {
		if (n == 0)
			throw new DivisionByZeroException("there is no zeroth root of " + this);
		return this.pow(Rational.valueOf(1, n));
	}

	/**
	 * whether quantities in these two units can be added, which is when their
	 * dimensions are the same.  the scales don't matter.
	 */
	public boolean isCompatibleWith(Unit that) {
		return Arrays.equals(this.exponents, that.exponents);
	}

	public boolean isDimensionless() {
		for (Rational exponent: this.exponents)
			if (!exponent.isZero())
				return false;
		return true;
	}

	/**
	 * the number you multiply a value in this unit by to get the same value in that unit.
	 * @throws IncompatibleUnitsException if the units have different dimensions
	 */
	public double conversionFactorTo(Unit that) {
		if (!this.isCompatibleWith(that))
			throw new IncompatibleUnitsException(this, that);
		return this.scale/that.scale;
	}

	/**
	 * the unit with the same dimensions as this one and a scale of 1
	 */
	public Unit getCoherentUnit() {
		return new Unit(this.exponents, 1);
	}

	public Rational getExponent(Dimension dimension) {
		return this.exponents[dimension.ordinal()];
	}

	public Rational[] getExponents() {
		return this.exponents.clone();
	}

	public double getScale() {
		return this.scale;
	}

	/**
	 * units are equal when both their exponents and their scales are equal
	 */
	@Override
	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (!(o instanceof Unit))
			return false;
		Unit that = (Unit) o;
		return Double.compare(this.scale, that.scale) == 0 && Arrays.equals(this.exponents, that.exponents);
	}

	@Override
	public int hashCode() {
		return 31*Arrays.hashCode(this.exponents) + Double.hashCode(this.scale);
	}

	@Override
	public String toString() {
		StringBuilder s = new StringBuilder();
		if (this.scale != 1)
			s.append(String.format("%.6g", this.scale));
		for (Dimension dimension: Dimension.values()) {
			Rational exponent = this.getExponent(dimension);
			if (exponent.isZero())
				continue;
			if (s.length() > 0)
				s.append("·");
			s.append(dimension.symbol);
			if (!exponent.equals(Rational.ONE))
				s.append("^").append(exponent);
		}
		if (s.length() == 0)
			s.append("1");
		return "[" + s + "]";
	}
}
