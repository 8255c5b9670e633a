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

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * an uncertain real value with a physical unit.  the unit is checked (for sums and
 * comparisons) or combined (for products and powers) by {@link Unit}, and the uncertainty is
 * propagated by {@link UncertainValue}, so correlations from reusing the same measurement
 * come out right.
 * <p>
 * sums and differences are expressed in the unit of the left operand; the right operand is
 * converted into it first.
 * <p>
 * the natural ordering compares nominal values only, so it is <i>not consistent with
 * equals</i>, which stays identity: {@code a.compareTo(b) == 0} for two different measurements
 * of the same length.  a sorted set or map keyed on Quantities will treat those as duplicates.
 * @author Justin Kunimune
 */
public final class Quantity implements Comparable<Quantity> {
	private static final Logger logger = Logger.getLogger(Quantity.class.getName());

	/** the number of standard deviations in an expanded uncertainty, unless told otherwise */
	public static final double DEFAULT_COVERAGE_FACTOR = 2;

	private final UncertainValue value;
	private final Unit unit;

	public Quantity(UncertainValue value, Unit unit) {
		this.value = Objects.requireNonNull(value);
		this.unit = Objects.requireNonNull(unit);
	}

	/**
	 * a new measurement with its own fresh Component of uncertainty
	 * @throws InvalidUncertaintyException if the standard deviation is negative
	 */
	public static Quantity of(double nominal, double standardDeviation, Unit unit) {
		return new Quantity(UncertainValue.of(nominal, standardDeviation), unit);
	}

	public static Quantity exact(double value, Unit unit) {
		return new Quantity(UncertainValue.exact(value), unit);
	}

	public static Quantity fromComponent(double nominal, Component component, Unit unit) {
		return new Quantity(UncertainValue.fromComponent(nominal, component), unit);
	}

	/**
	 * express that in this's unit
	 * @throws IncompatibleUnitsException if the dimensions don't match
	 */
	private UncertainValue valueOf(Quantity that) {
		double factor = that.unit.conversionFactorTo(this.unit);
		if (factor == 1)
			return that.value;
		else
			return that.value.times(factor);
	}

	/**
	 * @throws IncompatibleUnitsException if the dimensions don't match
	 */
	public Quantity plus(Quantity that) {
		return new Quantity(this.value.plus(this.valueOf(that)), this.unit);
	}

	/**
	 * @throws IncompatibleUnitsException if the dimensions don't match
	 */
	public Quantity minus(Quantity that) {
		return new Quantity(this.value.minus(this.valueOf(that)), this.unit);
	}

	public Quantity times(double factor) {
		return new Quantity(this.value.times(factor), this.unit);
	}

	public Quantity times(Quantity that) {
		return new Quantity(this.value.times(that.value), this.unit.times(that.unit));
	}

	public Quantity over(double divisor) {
		return new Quantity(this.value.over(divisor), this.unit);
	}

	/**
	 * @throws DivisionByZeroException if that's nominal value is zero
	 */
	public Quantity over(Quantity that) {
		return new Quantity(this.value.over(that.value), this.unit.over(that.unit));
	}

	public Quantity neg() {
		return new Quantity(this.value.neg(), this.unit);
	}

	public Quantity inverse() {
		return new Quantity(UncertainValue.ONE.over(this.value), this.unit.inverse());
	}

	public Quantity pow(int exponent) {
		return new Quantity(this.value.pow(exponent), this.unit.pow(exponent));
	}

	/**
	 * @throws FractionalDimensionException if the unit can't be raised to this power
	 * @throws DomainException if the power isn't defined at the nominal value
	 */
	public Quantity pow(double exponent) {
		Unit unit = this.unit.pow(exponent);
		return new Quantity(this.value.pow(exponent), unit);
	}

	public Quantity sqrt() {
		return new Quantity(this.value.sqrt(), this.unit.sqrt());
	}

	public Quantity abs() {
		return new Quantity(this.value.abs(), this.unit);
	}

	public Quantity exp() {
		return new Quantity(this.dimensionlessValue().exp(), Unit.ONE);
	}

	public Quantity log() {
		return new Quantity(this.dimensionlessValue().log(), Unit.ONE);
	}

	public Quantity sin() {
		return new Quantity(this.dimensionlessValue().sin(), Unit.ONE);
	}

	public Quantity cos() {
		return new Quantity(this.dimensionlessValue().cos(), Unit.ONE);
	}

	public Quantity atan() {
		return new Quantity(this.dimensionlessValue().atan(), Unit.ONE);
	}

	/**
	 * the value as a pure number, for functions that only make sense on those.  a scaled
	 * dimensionless unit like percent gets converted to plain ones first.
	 */
	private UncertainValue dimensionlessValue() {
		if (!this.unit.isDimensionless())
			throw new IncompatibleUnitsException(this.unit, Unit.ONE);
		return this.convertTo(Unit.ONE).value;
	}

	/**
	 * express this quantity in a different unit with the same dimensions.  the nominal
	 * value and every sensitivity get multiplied by the conversion factor.
	 * @throws IncompatibleUnitsException if the dimensions don't match
	 */
	public Quantity convertTo(Unit target) {
		double factor = this.unit.conversionFactorTo(target);
		if (logger.isLoggable(Level.FINE))
			logger.fine(String.format("converting %s from %s to %s (×%.6g)", this.value, this.unit, target, factor));
		if (factor == 1)
			return new Quantity(this.value, target);
		else
			return new Quantity(this.value.times(factor), target);
	}

	/**
	 * @return the nominal value in the given unit
	 * @throws IncompatibleUnitsException if the dimensions don't match
	 */
	public double getValueIn(Unit target) {
		return this.nominal()*this.unit.conversionFactorTo(target);
	}

	public UncertainValue getValue() {
		return this.value;
	}

	public Unit getUnit() {
		return this.unit;
	}

	public double nominal() {
		return this.value.nominal;
	}

	public double variance() {
		return this.value.variance();
	}

	public double standardDeviation() {
		return this.value.standardDeviation();
	}

	/**
	 * @return the standard uncertainty as an exact quantity in the same unit
	 */
	public Quantity uncertainty() {
		return exact(this.standardDeviation(), this.unit);
	}

	public Quantity expandedUncertainty() {
		return this.expandedUncertainty(DEFAULT_COVERAGE_FACTOR);
	}

	/**
	 * @param coverageFactor the number of standard deviations
	 */
	public Quantity expandedUncertainty(double coverageFactor) {
		return exact(coverageFactor*this.standardDeviation(), this.unit);
	}

	/**
	 * the covariance of this and that, in units of this.unit·that.unit
	 */
	public double covarianceWith(Quantity that) {
		return this.value.covarianceWith(that.value);
	}

	public double correlationWith(Quantity that) {
		return this.value.correlationWith(that.value);
	}

	/**
	 * compare nominal values only; the uncertainty plays no part in the ordering.
	 * @throws IncompatibleUnitsException if the dimensions don't match
	 */
	@Override
	public int compareTo(Quantity that) {
		return Double.compare(this.nominal(), this.valueOf(that).nominal);
	}

	public boolean isLessThan(Quantity that) {
		return this.compareTo(that) < 0;
	}

	public boolean isGreaterThan(Quantity that) {
		return this.compareTo(that) > 0;
	}

	public boolean isEqualTo(Quantity that) {
		return this.compareTo(that) == 0;
	}

	public boolean agreesWith(Quantity that) {
		return this.agreesWith(that, DEFAULT_COVERAGE_FACTOR);
	}

	/**
	 * whether the two values are consistent within their uncertainty, that is whether
	 * |a - b| ≤ k·√(var a + var b - 2 cov(a, b)).  the correlation comes for free from the
	 * subtraction.
	 * @param coverageFactor k, the number of standard deviations to allow
	 * @throws IncompatibleUnitsException if the dimensions don't match
	 */
	public boolean agreesWith(Quantity that, double coverageFactor) {
		Quantity difference = this.minus(that);
		return Math.abs(difference.nominal()) <= coverageFactor*difference.standardDeviation();
	}

	public ComplexQuantity toComplex() {
		return new ComplexQuantity(this.value.toComplex(), this.unit);
	}

	@Override
	public String toString() {
		return String.format("(%s) %s", this.value, this.unit);
	}
}
