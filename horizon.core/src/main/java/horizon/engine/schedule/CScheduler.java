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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

import horizon.engine.Outcome;
import horizon.engine.config.Reporter;

/**
 * Algorithm C: lengths grow geometrically by the factor <code>inc</code>,
 * starting from <code>start</code>. Every conclusive attempt opens the next
 * length; the largest length opened so far is kept unrounded, and the length
 * attempted is its truncation, or the next integer if truncation would repeat
 * the previous length.
 *
 * @specfield runs: seq int
 * @specfield length: double
 * @specfield blocked: set int
 */
public final class CScheduler implements Scheduler {

	private final double inc;
	private final int limit;
	private final boolean propagateUnsat;
	private final Reporter reporter;
	private double length;
	private final List<Integer> runs = new ArrayList<Integer>();
	private final Set<Integer> blocked = new HashSet<Integer>();
	private boolean first = true;

	public CScheduler(int start, double inc, int limit, boolean propagateUnsat, Reporter reporter) {
		this.length = start;
		this.inc = inc;
		this.limit = limit;
		this.propagateUnsat = propagateUnsat;
		this.reporter = reporter;
	}

	public Integer next(Outcome result) {
		if (first) {
			if (length < 0 || limit < 0 || inc < 1 || length > limit)
				return null;
			runs.add((int) length);
			first = false;
		} else if (runs.isEmpty()) {
			return null;
		} else if (result == null) {
			final Integer current = runs.get(0);
			blocked.add(current);
			if (blocked.size() == runs.size())
				return null;
			runs.add(current);
			runs.remove(0);
		} else {
			final Integer current = runs.get(0);
			blocked.remove(current);
			double next = length * inc;
			if ((long) next == (long) length)
				next = length + 1;
			if ((long) next <= limit && blocked.isEmpty()) {
				runs.add((int) next);
				length = next;
			}
			if (result == Outcome.UNKNOWN) {
				runs.add(current);
			} else if (propagateUnsat) {
				for (Iterator<Integer> it = runs.iterator(); it.hasNext();)
					if (it.next() < current)
						it.remove();
			}
			runs.remove(0);
		}
		reporter.scheduled(Collections.unmodifiableList(runs), Collections.<Object>emptyList());
		return runs.isEmpty() ? null : runs.get(0);
	}

	@Override
	public String toString() {
		return "C(inc=" + inc + ", limit=" + limit + ") " + runs;
	}
}
