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
 * an uncertain complex value with a physical unit, following the same unit rules as
 * {@link Quantity}.
 * @author Justin Kunimune
 */
public final class ComplexQuantity {
	private final ComplexUncertainValue value;
	private final Unit unit;

	public ComplexQuantity(ComplexUncertainValue value, Unit unit) {
		this.value = Objects.requireNonNull(value);
		this.unit = Objects.requireNonNull(unit);
	}

	/**
	 * a new complex measurement whose real and imaginary parts have independent errors
	 */
	public static ComplexQuantity of(Complex nominal, double realStandardDeviation, double imaginaryStandardDeviation, Unit unit) {
		return new ComplexQuantity(
			  ComplexUncertainValue.of(nominal, realStandardDeviation, imaginaryStandardDeviation), unit);
	}

	public static ComplexQuantity exact(Complex value, Unit unit) {
		return new ComplexQuantity(ComplexUncertainValue.exact(value), unit);
	}

	/**
	 * combine a real part and an imaginary part, converting the imaginary part into the
	 * unit of the real part.
	 * @throws IncompatibleUnitsException if the dimensions don't match
	 */
	public static ComplexQuantity fromParts(Quantity real, Quantity imaginary) {
		Quantity im = imaginary.convertTo(real.getUnit());
		return new ComplexQuantity(
			  ComplexUncertainValue.fromParts(real.getValue(), im.getValue()), real.getUnit());
	}

	private ComplexUncertainValue valueOf(ComplexQuantity that) {
		double factor = that.unit.conversionFactorTo(this.unit);
		if (factor == 1)
			return that.value;
		else
			return that.value.times(factor);
	}

	public ComplexQuantity plus(ComplexQuantity that) {
		return new ComplexQuantity(this.value.plus(this.valueOf(that)), this.unit);
	}

	public ComplexQuantity minus(ComplexQuantity that) {
		return new ComplexQuantity(this.value.minus(this.valueOf(that)), this.unit);
	}

	public ComplexQuantity times(Complex factor) {
		return new ComplexQuantity(this.value.times(factor), this.unit);
	}

	public ComplexQuantity times(ComplexQuantity that) {
		return new ComplexQuantity(this.value.times(that.value), this.unit.times(that.unit));
	}

	public ComplexQuantity times(Quantity that) {
		return this.times(that.toComplex());
	}

	public ComplexQuantity over(ComplexQuantity that) {
		return new ComplexQuantity(this.value.over(that.value), this.unit.over(that.unit));
	}

	public ComplexQuantity over(Quantity that) {
		return this.over(that.toComplex());
	}

	public ComplexQuantity neg() {
		return new ComplexQuantity(this.value.neg(), this.unit);
	}

	public ComplexQuantity conjugate() {
		return new ComplexQuantity(this.value.conjugate(), this.unit);
	}

	public ComplexQuantity pow(double exponent) {
		Unit unit = this.unit.pow(exponent);
		return new ComplexQuantity(this.value.pow(exponent), unit);
	}

	public ComplexQuantity convertTo(Unit target) {
		double factor = this.unit.conversionFactorTo(target);
		return new ComplexQuantity(this.value.times(factor), target);
	}

	public Quantity real() {
		return new Quantity(this.value.real(), this.unit);
	}

	public Quantity imaginary() {
		return new Quantity(this.value.imaginary(), this.unit);
	}

	public Quantity magnitude() {
		return new Quantity(this.value.magnitude(), this.unit);
	}

	/**
	 * the phase angle in radians, which is dimensionless
	 */
	public Quantity phase() {
		return new Quantity(this.value.phase(), Unit.ONE);
	}

	public ComplexUncertainValue getValue() {
		return this.value;
	}

	public Unit getUnit() {
		return this.unit;
	}

	public Complex nominal() {
		return this.value.nominal;
	}

	public double standardDeviation() {
		return this.value.standardDeviation();
	}

	/**
	 * the Hermitian covariance of this and that, in units of this.unit·that.unit
	 */
	public Complex covarianceWith(ComplexQuantity that) {
		return this.value.covarianceWith(that.value);
	}

	@Override
	public String toString() {
		return String.format("(%s) %s", this.value, this.unit);
	}
}
