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
import static org.junit.Assert.assertTrue;

public class RationalTest {

	@Test
	public void testLowestTerms() {
		Rational r = Rational.valueOf(2, -4);
		assertEquals(-1, r.numerator);
		assertEquals(2, r.denominator);
		assertEquals(Rational.valueOf(-1, 2), r);
		assertEquals(Rational.ZERO, Rational.valueOf(0, 7));
		assertEquals("-1/2", r.toString());
		assertEquals("3", Rational.valueOf(6, 2).toString());
	}

	@Test
	public void testArithmetic() {
		Rational half = Rational.valueOf(1, 2);
		Rational third = Rational.valueOf(1, 3);
		assertEquals(Rational.valueOf(5, 6), half.plus(third));
		assertEquals(Rational.valueOf(1, 6), half.minus(third));
		assertEquals(Rational.valueOf(1, 6), half.times(third));
		assertEquals(Rational.valueOf(3, 2), half.over(third));
		assertEquals(Rational.ONE, half.plus(half));
		assertTrue(half.compareTo(third) > 0);
		assertTrue(half.times(Rational.valueOf(2)).isInteger());
		assertEquals(0.5, half.doubleValue(), 0);
	}

	@Test
	public void testApproximate() {
		assertEquals(Rational.valueOf(3), Rational.approximate(3.0));
		assertEquals(Rational.valueOf(-1, 2), Rational.approximate(-0.5));
		assertEquals(Rational.valueOf(1, 3), Rational.approximate(1/3.));
		assertEquals(Rational.valueOf(2, 7), Rational.approximate(2/7.));
		assertEquals(Rational.valueOf(1, 10), Rational.approximate(0.1));
	}

	@Test(expected = FractionalDimensionException.class)
	public void testIrrationalExponent() {
		Rational.approximate(Math.PI);
	}

	@Test(expected = FractionalDimensionException.class)
	public void testInfiniteExponent() {
		Rational.approximate(Double.POSITIVE_INFINITY);
	}

	@Test(expected = DivisionByZeroException.class)
	public void testZeroDenominator() {
		Rational.valueOf(1, 0);
	}

	@Test(expected = FractionalDimensionException.class)
	public void testExponentBeyondLongRange() {
		Rational.approximate(1e19);
	}

	@Test(expected = FractionalDimensionException.class)
	public void testNegativeExponentBeyondLongRange() {
		Rational.approximate(-0x1p63);
	}

	@Test
	public void testLargestIntegerExponent() {
		assertEquals(Rational.valueOf(1L << 62), Rational.approximate(0x1p62));
	}

	@Test(expected = FractionalDimensionException.class)
	public void testSumOverflow() {
		Rational.valueOf(Long.MAX_VALUE).plus(Rational.ONE);
	}

	@Test(expected = FractionalDimensionException.class)
	public void testProductOverflow() {
		Rational.valueOf(Long.MAX_VALUE/2).times(Rational.valueOf(3));
	}

	@Test(expected = FractionalDimensionException.class)
	public void testQuotientOverflow() {
		Rational.valueOf(1, Long.MAX_VALUE).over(Rational.valueOf(Long.MAX_VALUE));
	}

	@Test(expected = FractionalDimensionException.class)
	public void testNegationOverflow() {
		Rational.valueOf(Long.MIN_VALUE).neg();
	}

	@Test
	public void testCompareHugeFractions() {
		Rational big = Rational.valueOf(Long.MAX_VALUE, 3);
		Rational bigger = Rational.valueOf(Long.MAX_VALUE - 1, 2);
		assertTrue(big.compareTo(bigger) < 0);
		assertTrue(bigger.compareTo(big) > 0);
	}
}
