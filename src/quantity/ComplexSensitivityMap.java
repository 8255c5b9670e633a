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

import java.util.HashSet;
import java.util.Set;

/**
 * the sensitivities of a complex value, stored as one real SensitivityMap for the real part
 * and one for the imaginary part over the same Components.  the coefficient for a Component
 * c is the complex number re.get(c) + i·im.get(c).
 * @author Justin Kunimune
 */
public final class ComplexSensitivityMap {
	public static final ComplexSensitivityMap EMPTY = new ComplexSensitivityMap(
		  SensitivityMap.EMPTY, SensitivityMap.EMPTY);

	public final SensitivityMap re;
	public final SensitivityMap im;

	public ComplexSensitivityMap(SensitivityMap re, SensitivityMap im) {
		this.re = re;
		this.im = im;
	}

	public static ComplexSensitivityMap fromComponent(Component component, Complex coefficient) {
		return new ComplexSensitivityMap(
			  SensitivityMap.fromComponent(component, coefficient.re),
			  SensitivityMap.fromComponent(component, coefficient.im));
	}

	public ComplexSensitivityMap plus(ComplexSensitivityMap that) {
		return new ComplexSensitivityMap(this.re.plus(that.re), this.im.plus(that.im));
	}

	public ComplexSensitivityMap minus(ComplexSensitivityMap that) {
		return new ComplexSensitivityMap(this.re.minus(that.re), this.im.minus(that.im));
	}

	public ComplexSensitivityMap times(double scalar) {
		return new ComplexSensitivityMap(this.re.times(scalar), this.im.times(scalar));
	}

	/**
	 * multiply every coefficient by a complex scalar
	 */
	public ComplexSensitivityMap times(Complex scalar) {
		return new ComplexSensitivityMap(
			  this.re.times(scalar.re).minus(this.im.times(scalar.im)),
			  this.re.times(scalar.im).plus(this.im.times(scalar.re)));
	}

	public ComplexSensitivityMap neg() {
		return this.times(-1);
	}

	public ComplexSensitivityMap conjugate() {
		return new ComplexSensitivityMap(this.re, this.im.neg());
	}

	/**
	 * @return Σ |coef|² σ²
	 */
	public double variance() {
		return this.re.variance() + this.im.variance();
	}

	/**
	 * the Hermitian covariance Σ coef·conj(that.coef)·σ², summed over the Components the
	 * two maps share.
	 */
	public Complex covariance(ComplexSensitivityMap that) {
		return new Complex(
			  this.re.covariance(that.re) + this.im.covariance(that.im),
			  this.im.covariance(that.re) - this.re.covariance(that.im));
	}

	public Complex get(Component c) {
		return new Complex(this.re.get(c), this.im.get(c));
	}

	public Set<Component> nonzero() {
		Set<Component> union = new HashSet<>(this.re.nonzero());
		union.addAll(this.im.nonzero());
		return union;
	}

	public boolean isEmpty() {
		return this.re.isEmpty() && this.im.isEmpty();
	}

	@Override
	public String toString() {
		return "{re: " + this.re + ", im: " + this.im + "}";
	}
}
