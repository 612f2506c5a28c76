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
package horizon.engine.schedule;

import horizon.engine.Outcome;

/**
 * Decides which horizon length to attempt next, given the outcome of the
 * previous attempt.
 *
 * The first call starts the schedule and ignores its argument. Every later
 * call reports the outcome of solving the length returned by the previous
 * call: {@link Outcome#SAT}, {@link Outcome#UNSAT}, {@link Outcome#UNKNOWN},
 * or null if the attempt gave no result at all. Once a scheduler returns
 * null the schedule is exhausted, and it keeps returning null.
 */
public interface Scheduler {

	/**
	 * Returns the next length to solve, or null if the schedule is exhausted.
	 */
	public Integer next(Outcome result);
}
