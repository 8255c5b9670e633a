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

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.ToDoubleFunction;

/**
 * the gradient of a real value with respect to every Component it depends on.  it runs much
 * faster than a dense vector because most values only depend on a handful of Components.
 * a Component that isn't in the map has a sensitivity of zero, and a map with nothing in it
 * belongs to an exact value.
 * @author Justin Kunimune
 */
public final class SensitivityMap {
	public static final SensitivityMap EMPTY = new SensitivityMap(Collections.emptyMap());

	private final Map<Component, Double> values;


	/**
	 * wrap a map that nobody else will ever modify.  zero entries must already be gone.
	 */
	private SensitivityMap(Map<Component, Double> values) {
		this.values = values;
	}

	/**
	 * build a SensitivityMap with a single nonzero element.
	 * @param component the Component on which the value depends
	 * @param coefficient the partial derivative with respect to that Component
	 */
	public static SensitivityMap fromComponent(Component component, double coefficient) {
		if (coefficient == 0)
			return EMPTY;
		return new SensitivityMap(Collections.singletonMap(component, coefficient));
	}

	/**
	 * build a SensitivityMap given every nonzero sensitivity.  the map is copied.
	 */
	public static SensitivityMap of(Map<Component, Double> values) {
		Map<Component, Double> copy = new HashMap<>(values.size());
		for (Map.Entry<Component, Double> entry: values.entrySet())
			if (entry.getValue() != 0)
				copy.put(entry.getKey(), entry.getValue());
		return wrap(copy);
	}

	private static SensitivityMap wrap(Map<Component, Double> values) {
		if (values.isEmpty())
			return EMPTY;
		return new SensitivityMap(Collections.unmodifiableMap(values));
	}

	/**
	 * sum the coefficients Component by Component.  Components that appear in only one
	 * of the maps pass through unchanged.
	 */
	public SensitivityMap plus(SensitivityMap that) {
		if (that.values.isEmpty())
			return this;
		if (this.values.isEmpty())
			return that;
		Map<Component, Double> sum = new HashMap<>(
			  this.values.size() + that.values.size()); // do this efficiently
		for (Component c: this.values.keySet())
			sum.put(c, this.get(c) + that.get(c));
		for (Component c: that.values.keySet())
			if (!sum.containsKey(c))
				sum.put(c, that.get(c));
		sum.values().removeIf(x -> x == 0);
		return wrap(sum);
	}

	public SensitivityMap minus(SensitivityMap that) {
		return this.plus(that.times(-1));
	}

	public SensitivityMap times(double scalar) {
		if (scalar == 0 || this.values.isEmpty())
			return EMPTY;
		if (scalar == 1)
			return this;
		Map<Component, Double> product = new HashMap<>(this.values.size());
		for (Component c: this.values.keySet())
			product.put(c, this.values.get(c)*scalar);
		return wrap(product);
	}

	public SensitivityMap neg() {
		return this.times(-1);
	}

	/**
	 * @return Σ coef² σ², using the variance that each Component carries
	 */
	public double variance() {
		return this.variance(Component::getVariance);
	}

	/**
	 * @param varianceOf the variance to assume for each Component
	 * @return Σ coef² varianceOf(c)
	 */
	public double variance(ToDoubleFunction<Component> varianceOf) {
		double sum = 0;
		for (Component c: this.values.keySet())
			sum += Math.pow(this.values.get(c), 2)*varianceOf.applyAsDouble(c);
		return sum;
	}

	/**
	 * the covariance between the value this describes and the value that describes.  only
	 * Components present in both maps contribute, so values with no common origin come out
	 * exactly uncorrelated.
	 */
	public double covariance(SensitivityMap that) {
		return this.covariance(that, Component::getVariance);
	}

	public double covariance(SensitivityMap that, ToDoubleFunction<Component> varianceOf) {
		if (this.values.size() > that.values.size()) // iterate over the smaller one
			return that.covariance(this, varianceOf);
		double sum = 0;
		for (Component c: this.values.keySet())
			if (that.values.containsKey(c))
				sum += this.values.get(c)*that.values.get(c)*varianceOf.applyAsDouble(c);
		return sum;
	}

	public Set<Component> nonzero() {
		return this.values.keySet();
	}

	public boolean isEmpty() {
		return this.values.isEmpty();
	}

	public int size() {
		return this.values.size();
	}

	public double get(Component c) {
		Double value = this.values.get(c);
		if (value != null)
			return value;
		else
			return 0;
	}

	public Map<Component, Double> asMap() {
		return this.values;
	}

	@Override
	public String toString() {
		StringBuilder s = new StringBuilder("{");
		for (Component c: this.values.keySet())
			s.append(String.format(" #%d: %8.4g", c.getId(), this.values.get(c)));
		s.append(" }");
		return s.toString();
	}
}
