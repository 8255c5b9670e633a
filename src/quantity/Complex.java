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

/**
 * an immutable complex number, used both as the nominal value of complex quantities and
 * as the coefficient of a complex sensitivity.
 * @author Justin Kunimune
 */
public final class Complex {
	public static final Complex ZERO = new Complex(0, 0);
	public static final Complex ONE = new Complex(1, 0);
	public static final Complex I = new Complex(0, 1);

	/** integer powers up to this size are done by multiplication instead of in polar form */
	private static final int MAX_EXACT_POWER = 64;

	/**
	 * the real component of the complex number
	 */
	public final double re;
	/**
	 * the imaginary component of the complex number
	 */
	public final double im;

	public Complex(double re, double im) {
		this.re = re;
		this.im = im;
	}

	/**
	 * build a complex number from its magnitude and phase
	 */
	public static Complex polar(double magnitude, double phase) {
		return new Complex(magnitude*Math.cos(phase),
		                   magnitude*Math.sin(phase));
	}

	public Complex plus(Complex that) {
		return new Complex(this.re + that.re,
		                   this.im + that.im);
	}

	public Complex plus(double that) {
		return new Complex(this.re + that,
		                   this.im);
	}

	public Complex minus(Complex that) {
		return new Complex(this.re - that.re,
		                   this.im - that.im);
	}

	public Complex times(Complex that) {
		return new Complex(this.re*that.re - this.im*that.im,
		                   this.re*that.im + this.im*that.re);
	}

	public Complex times(double that) {
		return new Complex(this.re*that, this.im*that);
	}

	public Complex over(Complex that) {
		return this.times(that.conjugate()).over(Complex.abs2(that));
	}

	public Complex over(double that) {
		return new Complex(this.re/that, this.im/that);
	}

	public Complex neg() {
		return new Complex(-this.re, -this.im);
	}

	public Complex conjugate() {
		return new Complex(this.re, -this.im);
	}

	/**
	 * raise to a real power on the principal branch
	 */
	public Complex pow(double exponent) {
		if (this.isZero())
			return (exponent == 0) ? ONE : ZERO;
		if (exponent == Math.rint(exponent) && Math.abs(exponent) <= MAX_EXACT_POWER) {
			Complex power = ONE; // square and multiply, so real bases stay real
			Complex base = this;
			for (long n = Math.abs((long) exponent); n > 0; n >>= 1) {
				if ((n & 1) == 1)
					power = power.times(base);
				base = base.times(base);
			}
			return (exponent < 0) ? ONE.over(power) : power;
		}
		return polar(Math.pow(this.abs(), exponent), this.arg()*exponent);
	}

	public double abs() {
		return Math.hypot(this.re, this.im);
	}

	/**
	 * @return the phase angle in (-π, π]
	 */
	public double arg() {
		return Math.atan2(this.im, this.re);
	}

	public boolean isZero() {
		return this.re == 0 && this.im == 0;
	}

	public boolean isReal() {
		return this.im == 0;
	}

	/**
	 * multiply a complex number by its conjugate
	 */
	public static double abs2(Complex z) {
		return z.re*z.re + z.im*z.im;
	}

	public static Complex exp(Complex z) {
		double magnitude = Math.exp(z.re);
		return new Complex(magnitude*Math.cos(z.im),
		                   magnitude*Math.sin(z.im));
	}

	@Override
	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (!(o instanceof Complex))
			return false;
		Complex that = (Complex) o;
		return Double.compare(this.re, that.re) == 0 && Double.compare(this.im, that.im) == 0;
	}

	@Override
	public int hashCode() {
		return 31*Double.hashCode(this.re) + Double.hashCode(this.im);
	}

	@Override
	public String toString() {
		if (im == 0 || Math.abs(im) < Math.abs(re)*1e-6)
			return String.format("%.6g", re);
		else if (re == 0 || Math.abs(re) < Math.abs(im)*1e-6)
			return String.format("%.6gi", im);
		else
			return String.format("%.6g%+.6gi", re, im);
	}
}
