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

import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * an independent elementary source of uncertainty.  every measurement that brings its own
 * error bar gets a new one of these, and derived values keep track of how sensitive they
 * are to each one.  two Components are never the same unless they are the same object,
 * even if they happen to have the same variance.
 * @author Justin Kunimune
 */
public final class Component {
	private static final Logger logger = Logger.getLogger(Component.class.getName());
	private static final AtomicLong counter = new AtomicLong();

	private final long id;
	private final double variance;
	private final String label;

	private Component(long id, double variance, String label) {
		this.id = id;
		this.variance = variance;
		this.label = label;
	}

	/**
	 * allocate a fresh source of uncertainty.
	 * @param variance the square of its standard deviation
	 * @throws InvalidUncertaintyException if the variance is negative or NaN
	 */
	public static Component newComponent(double variance) {
		return newComponent(variance, null);
	}

	/**
	 * allocate a fresh source of uncertainty with a name, for uncertainty budgets.
	 * @param variance the square of its standard deviation
	 * @param label a description of where the uncertainty comes from, or null
	 * @throws InvalidUncertaintyException if the variance is negative or NaN
	 */
	public static Component newComponent(double variance, String label) {
		if (!(variance >= 0))
			throw new InvalidUncertaintyException("a variance must be nonnegative, not " + variance);
		Component component = new Component(counter.incrementAndGet(), variance, label);
		if (logger.isLoggable(Level.FINE))
			logger.fine(String.format("allocated %s", component));
		return component;
	}

	public static Component withStandardDeviation(double standardDeviation) {
		return withStandardDeviation(standardDeviation, null);
	}

	public static Component withStandardDeviation(double standardDeviation, String label) {
		if (!(standardDeviation >= 0))
			throw new InvalidUncertaintyException("a standard deviation must be nonnegative, not " + standardDeviation);
		return newComponent(standardDeviation*standardDeviation, label);
	}

	public long getId() {
		return this.id;
	}

	public double getVariance() {
		return this.variance;
	}

	public double getStandardDeviation() {
		return Math.sqrt(this.variance);
	}

	public String getLabel() {
		return this.label;
	}

	@Override
	public int hashCode() {
		return Long.hashCode(this.id);
	}

	@Override
	public String toString() {
		if (this.label != null)
			return String.format("Component#%d(%s, σ=%.4g)", this.id, this.label, this.getStandardDeviation());
		else
			return String.format("Component#%d(σ=%.4g)", this.id, this.getStandardDeviation());
	}
}
