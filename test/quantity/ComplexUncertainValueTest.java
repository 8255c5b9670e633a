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

import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class ComplexUncertainValueTest {

	@Test
	public void testVarianceIsTheSumOfBothParts() {
		ComplexUncertainValue z = ComplexUncertainValue.of(new Complex(3, 4), 0.1, 0.2);
		assertEquals(0.05, z.variance(), 1e-15);
		assertEquals(0.1, z.real().standardDeviation(), 1e-15);
		assertEquals(0.2, z.imaginary().standardDeviation(), 1e-15);
		assertEquals(0, z.real().covarianceWith(z.imaginary()), 0);
	}

	@Test
	public void testMagnitude() {
		ComplexUncertainValue z = ComplexUncertainValue.of(new Complex(3, 4), 0.1, 0.2);
		UncertainValue r = z.magnitude();
		assertEquals(5, r.nominal, 1e-15);
		assertEquals(0.36*0.01 + 0.64*0.04, r.variance(), 1e-12);
	}

	@Test
	public void testPhase() {
		ComplexUncertainValue z = ComplexUncertainValue.of(new Complex(3, 4), 0.1, 0.2);
		UncertainValue θ = z.phase();
		assertEquals(Math.atan2(4, 3), θ.nominal, 1e-15);
		assertEquals(0.0256*0.01 + 0.0144*0.04, θ.variance(), 1e-12);
	}

	@Test
	public void testTimesConjugateIsReal() {
		ComplexUncertainValue z = ComplexUncertainValue.of(new Complex(3, 4), 0.1, 0.2);
		ComplexUncertainValue square = z.times(z.conjugate());
		assertEquals(25, square.nominal.re, 1e-12);
		assertEquals(0, square.nominal.im, 1e-12);
		assertEquals(2.92, square.real().variance(), 1e-12);
		assertEquals(0, square.imaginary().variance(), 1e-12);
		// |z|² = |z|·|z|
		assertEquals(z.magnitude().square().variance(), square.real().variance(), 1e-12);
	}

	@Test
	public void testPowMatchesRepeatedProduct() {
		ComplexUncertainValue z = ComplexUncertainValue.of(new Complex(1, -2), 0.3, 0.1);
		ComplexUncertainValue square = z.pow(2);
		ComplexUncertainValue product = z.times(z);
		assertEquals(product.nominal.re, square.nominal.re, 1e-12);
		assertEquals(product.nominal.im, square.nominal.im, 1e-12);
		assertEquals(product.real().variance(), square.real().variance(), 1e-12);
		assertEquals(product.imaginary().variance(), square.imaginary().variance(), 1e-12);
		assertEquals(product.real().covarianceWith(product.imaginary()),
		             square.real().covarianceWith(square.imaginary()), 1e-12);
	}

	@Test
	public void testQuotientUndoesProduct() {
		ComplexUncertainValue z = ComplexUncertainValue.of(new Complex(1, -2), 0.3, 0.1);
		ComplexUncertainValue w = ComplexUncertainValue.of(new Complex(0.5, 1.5), 0.2, 0.2);
		ComplexUncertainValue ratio = z.times(w).over(w);
		assertEquals(1, ratio.nominal.re, 1e-12);
		assertEquals(-2, ratio.nominal.im, 1e-12);
		assertEquals(z.variance(), ratio.variance(), 1e-12);
		assertEquals(0, z.over(z).variance(), 1e-12);
	}

	@Test(expected = DivisionByZeroException.class)
	public void testDivideByZero() {
		ComplexUncertainValue.of(new Complex(1, 1), 0.1, 0.1).over(ComplexUncertainValue.ZERO);
	}

	@Test(expected = DomainException.class)
	public void testMagnitudeOfUncertainZero() {
		ComplexUncertainValue.of(Complex.ZERO, 0.1, 0.1).magnitude();
	}

	@Test
	public void testCovarianceWithSelf() {
		ComplexUncertainValue z = ComplexUncertainValue.of(new Complex(1, -2), 0.3, 0.1).exp();
		Complex covariance = z.covarianceWith(z);
		assertEquals(z.variance(), covariance.re, 1e-12);
		assertEquals(0, covariance.im, 1e-12);
	}

	@Test
	public void testCovarianceOfRotatedCopy() {
		ComplexUncertainValue z = ComplexUncertainValue.of(new Complex(1, -2), 0.3, 0.3);
		ComplexUncertainValue w = z.times(Complex.I);
		Complex covariance = w.covarianceWith(z);
		// δw = i·δz, so E[δw·conj(δz)] = i·E[|δz|²]
		assertEquals(0, covariance.re, 1e-12);
		assertEquals(z.variance(), covariance.im, 1e-12);
	}

	@Test
	public void testCovarianceMatrixOfCorrelatedParts() {
		UncertainValue x = UncertainValue.of(2, 0.5);
		ComplexUncertainValue z = ComplexUncertainValue.fromParts(x, x.times(-1));
		double[][] matrix = z.covarianceMatrix();
		assertEquals(0.25, matrix[0][0], 1e-15);
		assertEquals(-0.25, matrix[0][1], 1e-15);
		assertEquals(-0.25, matrix[1][0], 1e-15);
		assertEquals(0.25, matrix[1][1], 1e-15);
	}

	@Test
	public void testPolarRoundTrip() {
		ComplexUncertainValue z = ComplexUncertainValue.of(new Complex(3, 4), 0.1, 0.2);
		ComplexUncertainValue back = ComplexUncertainValue.fromPolar(z.magnitude(), z.phase());
		assertEquals(3, back.nominal.re, 1e-12);
		assertEquals(4, back.nominal.im, 1e-12);
		assertEquals(0.01, back.real().variance(), 1e-12);
		assertEquals(0.04, back.imaginary().variance(), 1e-12);
	}

	@Test
	public void testRealValuesEmbed() {
		UncertainValue x = UncertainValue.of(2, 0.5);
		ComplexUncertainValue z = x.toComplex();
		assertEquals(2, z.nominal.re, 0);
		assertEquals(0, z.nominal.im, 0);
		assertEquals(x.variance(), z.variance(), 1e-15);
		assertEquals(x.variance(), z.real().covarianceWith(x), 1e-15);
	}
}
