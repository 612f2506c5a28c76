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
import java.util.List;
import java.util.Set;

import horizon.engine.Outcome;
import horizon.engine.config.Reporter;

/**
 * Algorithm B: lengths <code>start + i*inc</code> are attempted in rounds,
 * where the <code>i</code>-th length receives a share of the effort that
 * decays geometrically with <code>gamma</code>.
 *
 * If the smallest pending length has been attempted <code>t</code> times, a
 * length <code>k</code> positions further is attempted in the current round
 * only while its own effort is below <code>(t+1)*gamma^k + 0.5</code>. New
 * lengths are opened while <code>(t+1)*gamma^k</code> exceeds one half, up to
 * <code>size</code> lengths in a round.
 *
 * @specfield active: seq Run
 * @specfield pending: seq Run
 * @specfield index: int
 * @specfield blocked: set Run
 */
public final class BScheduler implements Scheduler {

	private final int start, inc, limit, size;
	private final boolean propagateUnsat;
	private final double gamma;
	private final Reporter reporter;
	private int index = 0;
	private List<Run> active = new ArrayList<Run>();
	private List<Run> pending = new ArrayList<Run>();
	private final Set<Run> blocked = new HashSet<Run>();
	private boolean first = true;

	public BScheduler(int start, int inc, int limit, int size, boolean propagateUnsat, double gamma,
			Reporter reporter) {
		this.start = start;
		this.inc = inc;
		this.limit = limit;
		this.size = size;
		this.propagateUnsat = propagateUnsat;
		this.gamma = gamma;
		this.reporter = reporter;
	}

	public Integer next(Outcome result) {
		if (first) {
			if (start < 0 || inc <= 0 || start > limit)
				return null;
			first = false;
		} else {
			if (active.isEmpty())
				return null;
			final Run current = active.get(0);
			if (result == null) {
				blocked.add(current);
				if (blocked.size() == active.size())
					return null;
				pending.add(current);
			} else {
				blocked.remove(current);
				if (result == Outcome.UNKNOWN) {
					current.effort++;
					pending.add(current);
				} else if (result == Outcome.UNSAT && propagateUnsat) {
					pending.clear();
				}
			}
			active.remove(0);
			while (!active.isEmpty() && !active.get(0).eligible)
				pending.add(active.remove(0));
		}

		if (active.isEmpty()) {
			final Run head;
			if (!pending.isEmpty()) {
				if (blocked.size() == pending.size())
					return null;
				head = pending.get(0);
				head.eligible = true;
				active = new ArrayList<Run>();
				active.add(head);
				for (Run run : pending.subList(1, pending.size())) {
					run.eligible = run.effort < (head.effort + 1) * Math.pow(gamma, run.index - head.index) + 0.5;
					active.add(run);
				}
			} else {
				if (active.size() >= size)
					return null;
				head = new Run(index, start + (long) inc * index);
				active.add(head);
				index++;
				if (head.length > limit)
					return null;
			}
			pending = new ArrayList<Run>();

			while (0.5 < (head.effort + 1) * Math.pow(gamma, index - head.index) && blocked.isEmpty()) {
				if (active.size() >= size)
					break;
				final long length = start + (long) inc * index;
				if (length > limit)
					break;
				active.add(new Run(index, length));
				index++;
			}
		}

		reporter.scheduled(Collections.unmodifiableList(active), Collections.unmodifiableList(pending));
		return (int) active.get(0).length;
	}

	@Override
	public String toString() {
		return "B(size=" + size + ", inc=" + inc + ", limit=" + limit + ", gamma=" + gamma + ") " + active + " "
				+ pending;
	}

	/**
	 * A length together with the number of times it was attempted without
	 * result. Runs are compared by identity.
	 */
	static final class Run {
		final int index;
		final long length;
		int effort = 0;
		boolean eligible = true;

		Run(int index, long length) {
			this.index = index;
			this.length = length;
		}

		@Override
		public String toString() {
			return "(" + index + "," + length + "," + effort + "," + eligible + ")";
		}
	}
}
