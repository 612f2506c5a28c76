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
package horizon.engine.config;

import java.util.List;

import horizon.engine.Outcome;

/**
 * Receives progress reports from the incremental solver and its scheduler.
 */
public interface Reporter {

	/**
	 * Called when the program parts are grounded at the given step.
	 */
	public void grounding(int step);

	/**
	 * Called when the temporal formulas are translated up to the given horizon.
	 *
	 * @param pending
	 *            the number of formulas waiting on the worklist
	 */
	public void translating(int horizon, int pending);

	/**
	 * Called when the given step is excluded from (skip = true) or included in
	 * (skip = false) the attempted length.
	 */
	public void skipping(int step, boolean skip);

	/**
	 * Called before the given length is solved.
	 */
	public void solving(int length, int vars, int clauses);

	/**
	 * Called after the given length was solved.
	 */
	public void solved(int length, Outcome outcome, long millis);

	/**
	 * Called after the scheduler decided on the next length, with the lengths
	 * queued for the current round and those waiting for a later one.
	 */
	public void scheduled(List<?> queue, List<?> pending);

	/**
	 * Called when the schedule is exhausted.
	 */
	public void exhausted();
}
