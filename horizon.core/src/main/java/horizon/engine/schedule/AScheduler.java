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
 * Algorithm A: a window of at most <code>size</code> lengths, spaced
 * <code>inc</code> apart from <code>start</code>.
 *
 * An unknown length is moved to the back of the window. A length solved
 * either way leaves the window and a new length is added at the back; with
 * propagation of unsatisfiability the smaller lengths leave too and the
 * window is refilled.
 *
 * @specfield runs: seq int
 * @specfield length: long
 * @specfield blocked: set int
 */
public final class AScheduler implements Scheduler {

	private final int inc, limit, size;
	private final boolean propagateUnsat;
	private final Reporter reporter;
	private long length;
	private final List<Integer> runs = new ArrayList<Integer>();
	private final Set<Integer> blocked = new HashSet<Integer>();
	private boolean first = true;

	public AScheduler(int start, int inc, int limit, int size, boolean propagateUnsat, Reporter reporter) {
		this.length = start;
		this.inc = inc;
		this.limit = limit;
		this.size = size;
		this.propagateUnsat = propagateUnsat;
		this.reporter = reporter;
	}

	public Integer next(Outcome result) {
		if (first) {
			if (length < 0 || limit < length || inc <= 0)
				return null;
			first = false;
			for (int i = 0; i < size; i++) {
				final long run = length + (long) i * inc;
				if (run <= limit && run >= length)
					runs.add((int) run);
			}
			if (!runs.isEmpty())
				length = runs.get(runs.size() - 1);
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
			if (result == Outcome.UNKNOWN) {
				runs.add(current);
			} else {
				if (propagateUnsat)
					dropBelow(current);
				final long next = length + inc;
				if (next <= limit && blocked.isEmpty()) {
					length = next;
					runs.add((int) next);
				}
				if (propagateUnsat) {
					long tmp = next;
					while (runs.size() <= size) {
						tmp += inc;
						if (tmp > limit)
							break;
						runs.add((int) tmp);
					}
					length = tmp;
				}
			}
			runs.remove(0);
		}
		reporter.scheduled(Collections.unmodifiableList(runs), Collections.<Object>emptyList());
		return runs.isEmpty() ? null : runs.get(0);
	}

	private void dropBelow(int current) {
		for (Iterator<Integer> it = runs.iterator(); it.hasNext();)
			if (it.next() < current)
				it.remove();
	}

	@Override
	public String toString() {
		return "A(size=" + size + ", inc=" + inc + ", limit=" + limit + ") " + runs;
	}
}
