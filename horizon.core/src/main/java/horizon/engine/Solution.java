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
 * Represents the full solution to a temporal program: the outcome of the last
 * solve call, the last model found, if any, and the statistics of the search.
 *
 * @specfield outcome: lone Outcome
 * @specfield model: lone Model
 * @specfield stats: Statistics
 * @specfield exhausted: boolean
 */
public final class Solution {

	private final Outcome outcome;
	private final Model model;
	private final Statistics stats;
	private final boolean exhausted;

	Solution(Outcome outcome, Model model, Statistics stats, boolean exhausted) {
		this.outcome = outcome;
		this.model = model;
		this.stats = stats;
		this.exhausted = exhausted;
	}

	/**
	 * Returns the outcome of the last solve call, or null if there was none.
	 */
	public Outcome outcome() {
		return outcome;
	}

	/**
	 * Returns true if the last solve call found a model.
	 */
	public boolean sat() {
		return outcome == Outcome.SAT;
	}

	/**
	 * Returns the last model found, or null if none was.
	 */
	public Model model() {
		return model;
	}

	/**
	 * Returns the length of the last model found, or -1 if none was.
	 */
	public int length() {
		return model == null ? -1 : model.length();
	}

	public Statistics stats() {
		return stats;
	}

	/**
	 * Returns true if the search ended because the schedule ran out of lengths.
	 */
	public boolean exhausted() {
		return exhausted;
	}

	@Override
	public String toString() {
		final StringBuilder b = new StringBuilder();
		b.append("---OUTCOME---\n");
		b.append(outcome);
		if (exhausted)
			b.append(" (schedule exhausted)");
		b.append("\n");
		if (model != null) {
			b.append("---MODEL---\n");
			b.append(model);
			b.append("\n");
		}
		b.append("---STATS---\n");
		b.append(stats);
		b.append("\n");
		return b.toString();
	}
}
