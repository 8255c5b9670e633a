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

/**
 * a complex number that tracks its sensitivities to the elementary Components of
 * uncertainty.  the real and imaginary parts are two correlated real values over the same
 * Components; holomorphic operations scale the complex sensitivities by the complex
 * derivative, and the projections onto real numbers (magnitude, phase, real and imaginary
 * parts) use the chain rule on the two parts.
 * @author Justin Kunimune
 */
public final class ComplexUncertainValue {
	public static final ComplexUncertainValue ZERO = exact(Complex.ZERO);
	public static final ComplexUncertainValue ONE = exact(Complex.ONE);

	public final Complex nominal;
	public final ComplexSensitivityMap sensitivities;

	public ComplexUncertainValue(Complex nominal, ComplexSensitivityMap sensitivities) {
		this.nominal = Objects.requireNonNull(nominal);
		this.sensitivities = Objects.requireNonNull(sensitivities);
	}

	public static ComplexUncertainValue exact(Complex nominal) {
		return new ComplexUncertainValue(nominal, ComplexSensitivityMap.EMPTY);
	}

	/**
	 * a new complex measurement whose real and imaginary parts have independent errors
	 * @throws InvalidUncertaintyException if either standard deviation is negative
	 */
	public static ComplexUncertainValue of(Complex nominal, double realStandardDeviation, double imaginaryStandardDeviation) {
		return fromParts(UncertainValue.of(nominal.re, realStandardDeviation),
		                 UncertainValue.of(nominal.im, imaginaryStandardDeviation));
	}

	/**
	 * put a complex value together from its two (possibly correlated) parts
	 */
	public static ComplexUncertainValue fromParts(UncertainValue real, UncertainValue imaginary) {
		return new ComplexUncertainValue(
			  new Complex(real.nominal, imaginary.nominal),
			  new ComplexSensitivityMap(real.sensitivities, imaginary.sensitivities));
	}

	/**
	 * put a complex value together from its magnitude and phase
	 */
	public static ComplexUncertainValue fromPolar(UncertainValue magnitude, UncertainValue phase) {
		return fromParts(magnitude.times(phase.cos()), magnitude.times(phase.sin()));
	}

	public ComplexUncertainValue plus(ComplexUncertainValue that) {
		return new ComplexUncertainValue(
			  this.nominal.plus(that.nominal),
			  this.sensitivities.plus(that.sensitivities));
	}

	public ComplexUncertainValue plus(Complex constant) {
		return new ComplexUncertainValue(this.nominal.plus(constant), this.sensitivities);
	}

	public ComplexUncertainValue minus(ComplexUncertainValue that) {
		return this.plus(that.neg());
	}

	public ComplexUncertainValue minus(Complex constant) {
		return this.plus(constant.neg());
	}

	public ComplexUncertainValue times(double factor) {
		return new ComplexUncertainValue(
			  this.nominal.times(factor),
			  this.sensitivities.times(factor));
	}

	public ComplexUncertainValue times(Complex factor) {
		return new ComplexUncertainValue(
			  this.nominal.times(factor),
			  this.sensitivities.times(factor));
	}

	public ComplexUncertainValue times(ComplexUncertainValue that) {
		return new ComplexUncertainValue(
			  this.nominal.times(that.nominal),
			  this.sensitivities.times(that.nominal).plus(that.sensitivities.times(this.nominal)));
	}

	public ComplexUncertainValue over(Complex divisor) {
		if (divisor.isZero())
			throw new DivisionByZeroException("cannot divide " + this + " by zero");
		return this.times(Complex.ONE.over(divisor));
	}

	public ComplexUncertainValue over(ComplexUncertainValue that) {
		if (that.nominal.isZero())
			throw new DivisionByZeroException("cannot divide " + this + " by " + that + ", whose nominal value is zero");
		Complex inverse = Complex.ONE.over(that.nominal);
		Complex quotient = this.nominal.times(inverse);
		return new ComplexUncertainValue(
			  quotient,
			  this.sensitivities.times(inverse).minus(that.sensitivities.times(quotient.times(inverse))));
	}

	public ComplexUncertainValue neg() {
		return new ComplexUncertainValue(this.nominal.neg(), this.sensitivities.neg());
	}

	public ComplexUncertainValue conjugate() {
		return new ComplexUncertainValue(this.nominal.conjugate(), this.sensitivities.conjugate());
	}

	/**
	 * raise this to a real power on the principal branch.
	 * @throws DivisionByZeroException if the exponent is negative and the nominal value is zero
	 * @throws DomainException if the derivative is infinite at zero
	 */
	public ComplexUncertainValue pow(double exponent) {
		if (exponent == 0)
			return ONE;
		if (exponent == 1)
			return this;
		if (this.nominal.isZero()) {
			if (exponent < 0)
				throw new DivisionByZeroException(String.format(
					  "cannot raise zero to the negative power %s", exponent));
			if (exponent < 1 && !this.sensitivities.isEmpty())
				throw new DomainException(String.format(
					  "the derivative of z^%s is infinite at z = 0", exponent));
		}
		return new ComplexUncertainValue(
			  this.nominal.pow(exponent),
			  this.sensitivities.times(this.nominal.pow(exponent - 1).times(exponent)));
	}

	public ComplexUncertainValue exp() {
		Complex exp = Complex.exp(this.nominal);
		return new ComplexUncertainValue(exp, this.sensitivities.times(exp));
	}

	public UncertainValue real() {
		return new UncertainValue(this.nominal.re, this.sensitivities.re);
	}

	public UncertainValue imaginary() {
		return new UncertainValue(this.nominal.im, this.sensitivities.im);
	}

	/**
	 * @throws DomainException if the value is uncertain and its nominal value is zero, where
	 *                         the magnitude has no derivative
	 */
	public UncertainValue magnitude() {
		double r = this.nominal.abs();
		if (r == 0) {
			if (this.sensitivities.isEmpty())
				return UncertainValue.ZERO;
			throw new DomainException("the magnitude of an uncertain zero has no derivative");
		}
		return new UncertainValue(
			  r,
			  this.sensitivities.re.times(this.nominal.re/r).plus(this.sensitivities.im.times(this.nominal.im/r)));
	}

	public UncertainValue phase() {
		return UncertainValue.atan2(this.imaginary(), this.real());
	}

	/**
	 * @return the expected squared modulus of the error, var(re) + var(im)
	 */
	public double variance() {
		return this.sensitivities.variance();
	}

	public double standardDeviation() {
		return Math.sqrt(this.variance());
	}

	/**
	 * the Hermitian covariance E[δz·conj(δw)]
	 */
	public Complex covarianceWith(ComplexUncertainValue that) {
		return this.sensitivities.covariance(that.sensitivities);
	}

	/**
	 * the covariance matrix of the real and imaginary parts, [[var(re), cov(re, im)],
	 * [cov(im, re), var(im)]]
	 */
	public double[][] covarianceMatrix() {
		double covariance = this.sensitivities.re.covariance(this.sensitivities.im);
		return new double[][] {
			  {this.sensitivities.re.variance(), covariance},
			  {covariance, this.sensitivities.im.variance()}};
	}

	public boolean isExact() {
		return this.sensitivities.isEmpty();
	}

	@Override
	public String toString() {
		return String.format("(%s) ± %.3g", this.nominal, this.standardDeviation());
	}
}
