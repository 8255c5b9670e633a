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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * a real number that tracks its gradient with respect to every elementary Component of
 * uncertainty for the purpose of error bar determination.  all propagation is first order:
 * every operation differentiates at the nominal values and pushes the sensitivities through
 * the chain rule, which is exact for sums and scalar multiples.
 * @author Justin Kunimune
 */
public final class UncertainValue {
	public static final UncertainValue ZERO = exact(0);
	public static final UncertainValue ONE = exact(1);

	public final double nominal;
	public final SensitivityMap sensitivities;

	public UncertainValue(double nominal, SensitivityMap sensitivities) {
		this.nominal = nominal;
		this.sensitivities = Objects.requireNonNull(sensitivities);
	}

	/**
	 * a number with no uncertainty whatsoever
	 */
	public static UncertainValue exact(double nominal) {
		return new UncertainValue(nominal, SensitivityMap.EMPTY);
	}

	/**
	 * a new measurement, with its own fresh Component of uncertainty
	 * @param standardDeviation the standard uncertainty of the measurement
	 * @throws InvalidUncertaintyException if the standard deviation is negative
	 */
	public static UncertainValue of(double nominal, double standardDeviation) {
		return fromComponent(nominal, Component.withStandardDeviation(standardDeviation));
	}

	/**
	 * a value that depends on exactly one Component with unit sensitivity, so that its
	 * variance is that Component's variance.
	 */
	public static UncertainValue fromComponent(double nominal, Component component) {
		return new UncertainValue(nominal, SensitivityMap.fromComponent(component, 1));
	}

	public UncertainValue plus(double constant) {
		return new UncertainValue(this.nominal + constant, this.sensitivities);
	}

	public UncertainValue plus(UncertainValue that) {
		return new UncertainValue(
			  this.nominal + that.nominal,
			  this.sensitivities.plus(that.sensitivities));
	}

	public UncertainValue minus(double constant) {
		return this.plus(-constant);
	}

	public UncertainValue minus(UncertainValue that) {
		return this.plus(that.neg());
	}

	public UncertainValue subtractedFrom(double constant) {
		return this.minus(constant).neg();
	}

	public UncertainValue times(double factor) {
		return new UncertainValue(
			  this.nominal*factor,
			  this.sensitivities.times(factor));
	}

	public UncertainValue times(UncertainValue that) {
		return new UncertainValue(
			  this.nominal*that.nominal,
			  this.sensitivities.times(that.nominal).plus(that.sensitivities.times(this.nominal)));
	}

	public UncertainValue over(double divisor) {
		if (divisor == 0)
			throw new DivisionByZeroException("cannot divide " + this + " by zero");
		return this.times(1/divisor);
	}

	public UncertainValue over(UncertainValue that) {
		if (that.nominal == 0)
			throw new DivisionByZeroException("cannot divide " + this + " by " + that + ", whose nominal value is zero");
		return new UncertainValue(
			  this.nominal/that.nominal,
			  this.sensitivities.times(1/that.nominal).minus(
			  	  that.sensitivities.times(this.nominal/(that.nominal*that.nominal))));
	}

	public UncertainValue neg() {
		return new UncertainValue(
			  -this.nominal,
			  this.sensitivities.neg());
	}

	/**
	 * raise this to a real power.
	 * @throws DomainException if the exponent is fractional and the nominal value is negative,
	 *                         or if the derivative is infinite at zero
	 * @throws DivisionByZeroException if the exponent is negative and the nominal value is zero
	 */
	public UncertainValue pow(double exponent) {
		if (exponent == 0)
			return ONE;
		if (exponent == 1)
			return this;
		if (this.nominal < 0 && exponent != Math.rint(exponent))
			throw new DomainException(String.format(
				  "cannot raise the negative value %s to the non-integer power %s", this, exponent));
		if (this.nominal == 0) {
			if (exponent < 0)
				throw new DivisionByZeroException(String.format(
					  "cannot raise zero to the negative power %s", exponent));
			if (exponent < 1 && !this.sensitivities.isEmpty())
				throw new DomainException(String.format(
					  "the derivative of x^%s is infinite at x = 0", exponent));
		}
		return new UncertainValue(
			  Math.pow(this.nominal, exponent),
			  this.sensitivities.times(exponent*Math.pow(this.nominal, exponent - 1)));
	}

	public UncertainValue square() {
		return this.times(this);
	}

	public UncertainValue sqrt() {
		if (this.nominal < 0)
			throw new DomainException("cannot take the square root of the negative value " + this);
		return this.pow(1/2.);
	}

	public UncertainValue exp() {
		double exp = Math.exp(this.nominal);
		return new UncertainValue(exp, this.sensitivities.times(exp));
	}

	public UncertainValue log() {
		if (this.nominal <= 0)
			throw new DomainException("cannot take the logarithm of the nonpositive value " + this);
		return new UncertainValue(Math.log(this.nominal),
		                          this.sensitivities.times(1/this.nominal));
	}

	public UncertainValue sin() {
		return new UncertainValue(
			  Math.sin(this.nominal),
			  this.sensitivities.times(Math.cos(this.nominal)));
	}

	public UncertainValue cos() {
		return this.subtractedFrom(Math.PI/2).sin();
	}

	public UncertainValue tan() {
		double cos = Math.cos(this.nominal);
		return new UncertainValue(
			  Math.tan(this.nominal),
			  this.sensitivities.times(1/(cos*cos)));
	}

	public UncertainValue atan() {
		return new UncertainValue(
			  Math.atan(this.nominal),
			  this.sensitivities.times(1/(1 + this.nominal*this.nominal)));
	}

	/**
	 * the angle of the point (x, y), in (-π, π]
	 * @throws DomainException if both coordinates are zero and either is uncertain
	 */
	public static UncertainValue atan2(UncertainValue y, UncertainValue x) {
		double r2 = x.nominal*x.nominal + y.nominal*y.nominal;
		if (r2 == 0) {
			if (x.sensitivities.isEmpty() && y.sensitivities.isEmpty())
				return ZERO;
			throw new DomainException("the angle of an uncertain point at the origin has no derivative");
		}
		return new UncertainValue(
			  Math.atan2(y.nominal, x.nominal),
			  y.sensitivities.times(x.nominal/r2).minus(x.sensitivities.times(y.nominal/r2)));
	}

	public UncertainValue abs() {
		if (this.nominal < 0)
			return this.neg();
		else
			return this;
	}

	public double variance() {
		return this.sensitivities.variance();
	}

	public double standardDeviation() {
		return Math.sqrt(this.variance());
	}

	public double covarianceWith(UncertainValue that) {
		return this.sensitivities.covariance(that.sensitivities);
	}

	/**
	 * @return the Pearson correlation coefficient, or 0 if either value is exact
	 */
	public double correlationWith(UncertainValue that) {
		double denominator = this.standardDeviation()*that.standardDeviation();
		if (denominator == 0)
			return 0;
		return this.covarianceWith(that)/denominator;
	}

	/**
	 * the uncertainty budget: how much of the standard deviation each Component is
	 * responsible for, |∂x/∂c|·σ_c, ordered from largest to smallest.
	 */
	public Map<Component, Double> contributions() {
		List<Map.Entry<Component, Double>> entries = new ArrayList<>();
		for (Component c: this.sensitivities.nonzero())
			entries.add(Map.entry(c, Math.abs(this.sensitivities.get(c))*c.getStandardDeviation()));
		entries.sort(Map.Entry.<Component, Double>comparingByValue().reversed());
		Map<Component, Double> budget = new LinkedHashMap<>();
		for (Map.Entry<Component, Double> entry: entries)
			budget.put(entry.getKey(), entry.getValue());
		return budget;
	}

	public boolean isExact() {
		return this.sensitivities.isEmpty();
	}

	public boolean isNaN() {
		return Double.isNaN(this.nominal);
	}

	public ComplexUncertainValue toComplex() {
		return new ComplexUncertainValue(
			  new Complex(this.nominal, 0),
			  new ComplexSensitivityMap(this.sensitivities, SensitivityMap.EMPTY));
	}

	@Override
	public String toString() {
		return String.format("%.6g ± %.3g", this.nominal, this.standardDeviation());
	}
}
