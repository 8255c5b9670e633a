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

import java.util.HashMap;
import java.util.Map;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class SensitivityMapTest {

	@Test
	public void testPlusMergesSharedComponents() {
		Component c1 = Component.newComponent(1);
		Component c2 = Component.newComponent(1);
		SensitivityMap a = SensitivityMap.fromComponent(c1, 2);
		Map<Component, Double> values = new HashMap<>();
		values.put(c1, 1.);
		values.put(c2, 3.);
		SensitivityMap b = SensitivityMap.of(values);
		SensitivityMap sum = a.plus(b);
		assertEquals(3, sum.get(c1), 0);
		assertEquals(3, sum.get(c2), 0);
		assertEquals(2, sum.size());
		// the operands are untouched
		assertEquals(2, a.get(c1), 0);
		assertEquals(1, a.size());
	}

	@Test
	public void testCancellationLeavesNothing() {
		SensitivityMap a = SensitivityMap.fromComponent(Component.newComponent(1), 1.5);
		assertTrue(a.minus(a).isEmpty());
		assertSame(SensitivityMap.EMPTY, a.times(0));
		assertSame(SensitivityMap.EMPTY, SensitivityMap.fromComponent(Component.newComponent(1), 0));
	}

	@Test
	public void testMissingComponentIsZero() {
		SensitivityMap a = SensitivityMap.fromComponent(Component.newComponent(1), 1.5);
		assertEquals(0, a.get(Component.newComponent(1)), 0);
	}

	@Test
	public void testVariance() {
		Component c1 = Component.newComponent(4);
		Component c2 = Component.newComponent(9);
		SensitivityMap a = SensitivityMap.fromComponent(c1, 2).plus(SensitivityMap.fromComponent(c2, -1));
		assertEquals(4*4 + 1*9, a.variance(), 1e-12);
		assertEquals(4 + 1, a.variance(c -> 1.), 1e-12);
	}

	@Test
	public void testCovarianceOnlyCountsSharedComponents() {
		Component c1 = Component.newComponent(4);
		Component c2 = Component.newComponent(9);
		SensitivityMap a = SensitivityMap.fromComponent(c1, 2).plus(SensitivityMap.fromComponent(c2, 1));
		SensitivityMap b = SensitivityMap.fromComponent(c2, 3);
		assertEquals(27, a.covariance(b), 1e-12);
		assertEquals(27, b.covariance(a), 1e-12);
		assertEquals(0, SensitivityMap.fromComponent(c1, 1).covariance(b), 0);
		assertEquals(a.variance(), a.covariance(a), 1e-12);
	}

	@Test
	public void testComplexCovarianceIsHermitian() {
		Component c = Component.newComponent(1);
		ComplexSensitivityMap z = ComplexSensitivityMap.fromComponent(c, new Complex(1, 2));
		ComplexSensitivityMap w = ComplexSensitivityMap.fromComponent(c, new Complex(3, -1));
		Complex covariance = z.covariance(w);
		assertEquals(1, covariance.re, 1e-12);
		assertEquals(7, covariance.im, 1e-12);
		Complex reverse = w.covariance(z);
		assertEquals(covariance.re, reverse.re, 1e-12);
		assertEquals(-covariance.im, reverse.im, 1e-12);
		assertEquals(5, z.variance(), 1e-12);
		assertEquals(5, z.covariance(z).re, 1e-12);
		assertEquals(0, z.covariance(z).im, 1e-12);
	}

	@Test
	public void testComplexScaling() {
		Component c = Component.newComponent(1);
		ComplexSensitivityMap z = ComplexSensitivityMap.fromComponent(c, new Complex(1, 2));
		Complex scaled = z.times(Complex.I).get(c);
		assertEquals(-2, scaled.re, 1e-15);
		assertEquals(1, scaled.im, 1e-15);
	}
}
