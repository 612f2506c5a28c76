/*
 * Kodkod -- Copyright (c) 2005-present, Emina Torlak
 * Pardinus -- Copyright (c) 2013-present, Nuno Macedo, INESC TEC
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package horizon.engine;

/**
 * Stores the statistics gathered while solving a temporal program.
 *
 * @specfield variables: int
 * @specfield clauses: int
 * @specfield horizon: int
 * @specfield iterations: int
 * @specfield groundingTime: long
 * @specfield solvingTime: long
 */
public final class Statistics {

	private int variables, clauses, horizon, iterations;
	private long groundingTime, solvingTime;

	Statistics() {
	}

	void grounded(int horizon, long time) {
		this.horizon = horizon;
		this.groundingTime += time;
	}

	void solved(int variables, int clauses, long time) {
		this.variables = variables;
		this.clauses = clauses;
		this.solvingTime += time;
		this.iterations++;
	}

	/**
	 * Returns the number of variables in the last solved problem.
	 */
	public int variables() {
		return variables;
	}

	/**
	 * Returns the number of clauses in the last solved problem.
	 */
	public int clauses() {
		return clauses;
	}

	/**
	 * Returns the largest step grounded.
	 */
	public int horizon() {
		return horizon;
	}

	/**
	 * Returns the number of solve calls.
	 */
	public int iterations() {
		return iterations;
	}

	/**
	 * Returns the time spent grounding and translating, in milliseconds.
	 */
	public long groundingTime() {
		return groundingTime;
	}

	/**
	 * Returns the time spent solving, in milliseconds.
	 */
	public long solvingTime() {
		return solvingTime;
	}

	@Override
	public String toString() {
		final StringBuilder ret = new StringBuilder();
		ret.append("p cnf ");
		ret.append(variables);
		ret.append(" ");
		ret.append(clauses);
		ret.append("\nhorizon: ");
		ret.append(horizon);
		ret.append("\niterations: ");
		ret.append(iterations);
		ret.append("\ngrounding time: ");
		ret.append(groundingTime);
		ret.append(" ms\nsolving time: ");
		ret.append(solvingTime);
		ret.append(" ms");
		return ret.toString();
	}
}
