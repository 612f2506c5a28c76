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

import static horizon.engine.schedule.Schedules.NONE;
import static horizon.engine.schedule.Schedules.SAT;
import static horizon.engine.schedule.Schedules.UNKNOWN;
import static horizon.engine.schedule.Schedules.UNSAT;
import static horizon.engine.schedule.Schedules.b;
import static horizon.engine.schedule.Schedules.lengths;
import static horizon.engine.schedule.Schedules.results;
import static horizon.engine.schedule.Schedules.schedule;
import static org.junit.Assert.assertEquals;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import horizon.engine.Outcome;

/**
 * Sequences of lengths proposed by algorithm B, including the effect of the
 * decay rate.
 */
@RunWith(Parameterized.class)
public class BSchedulerTest {

	private final Schedules.Factory factory;
	private final List<Outcome> results;
	private final int imax;
	private final List<Integer> expected;

	public BSchedulerTest(String name, Schedules.Factory factory, List<Outcome> results, int imax,
			List<Integer> expected) {
		this.factory = factory;
		this.results = results;
		this.imax = imax;
		this.expected = expected;
	}

	@Parameters(name = "{0}")
	public static Collection<Object[]> data() {
		Object[][] data = new Object[][] {
			{ "B(0, 5, 30, 5, true, -2.0) UNKNOWN", b(0, 5, 30, 5, true, -2.0), results(1, UNKNOWN), 15, lengths(0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0) },
			{ "B(0, 5, 30, 5, true, -0.5) UNKNOWN", b(0, 5, 30, 5, true, -0.5), results(1, UNKNOWN), 15, lengths(0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0) },
			{ "B(0, 5, 30, 5, true, 0.0) UNKNOWN", b(0, 5, 30, 5, true, 0.0), results(1, UNKNOWN), 15, lengths(0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0) },
			{ "B(0, 5, 30, 5, true, 0.1) UNKNOWN", b(0, 5, 30, 5, true, 0.1), results(1, UNKNOWN), 15, lengths(0, 0, 0, 0, 0, 0, 5, 0, 5, 0, 0, 0, 0, 0, 0) },
			{ "B(0, 5, 30, 5, true, 0.5) UNKNOWN", b(0, 5, 30, 5, true, 0.5), results(1, UNKNOWN), 15, lengths(0, 0, 5, 0, 5, 10, 0, 5, 10, 0, 15, 0, 5, 15, 0) },
			{ "B(0, 5, 30, 5, true, 0.25) UNKNOWN", b(0, 5, 30, 5, true, 0.25), results(1, UNKNOWN), 15, lengths(0, 0, 0, 5, 0, 5, 0, 0, 0, 5, 0, 0, 10, 0, 10) },
			{ "B(0, 5, 30, 5, true, 0.75) UNKNOWN", b(0, 5, 30, 5, true, 0.75), results(1, UNKNOWN), 15, lengths(0, 5, 10, 0, 5, 10, 15, 20, 0, 5, 10, 15, 20, 0, 5) },
			{ "B(0, 5, 30, 5, true, 1.0) UNKNOWN", b(0, 5, 30, 5, true, 1.0), results(1, UNKNOWN), 15, lengths(0, 5, 10, 15, 20, 0, 5, 10, 15, 20, 0, 5, 10, 15, 20) },
			{ "B(0, 5, 100, 10, true, 1.0) UNKNOWN", b(0, 5, 100, 10, true, 1.0), results(1, UNKNOWN), 15, lengths(0, 5, 10, 15, 20, 25, 30, 35, 40, 45, 0, 5, 10, 15, 20) },
			{ "B(0, 5, 100, 10, true, 2.0) UNKNOWN", b(0, 5, 100, 10, true, 2.0), results(1, UNKNOWN), 15, lengths(0, 5, 10, 15, 20, 25, 30, 35, 40, 45, 0, 5, 10, 15, 20) },
			{ "B(0, 5, 30, 4, true, 0.5) SAT", b(0, 5, 30, 4, true, 0.5), results(1, SAT), 10, lengths(0, 5, 10, 15, 20, 25, 30) },
			{ "B(0, 5, 30, 4, true, 0.5) UNSAT", b(0, 5, 30, 4, true, 0.5), results(1, UNSAT), 10, lengths(0, 5, 10, 15, 20, 25, 30) },
			{ "B(0, 5, 30, 4, true, 0.5) UNKNOWN", b(0, 5, 30, 4, true, 0.5), results(1, UNKNOWN), 10, lengths(0, 0, 5, 0, 5, 10, 0, 5, 10, 0) },
			{ "B(0, 5, 30, 0, true, 0.5) SAT", b(0, 5, 30, 0, true, 0.5), results(1, SAT), 10, lengths() },
			{ "B(0, 5, 30, 0, true, 0.5) UNSAT", b(0, 5, 30, 0, true, 0.5), results(1, UNSAT), 10, lengths() },
			{ "B(0, 5, 30, 0, true, 0.5) UNKNOWN", b(0, 5, 30, 0, true, 0.5), results(1, UNKNOWN), 10, lengths() },
			{ "B(0, 5, 30, -4, true, 0.5) SAT", b(0, 5, 30, -4, true, 0.5), results(1, SAT), 10, lengths() },
			{ "B(0, 5, 30, -4, true, 0.5) UNSAT", b(0, 5, 30, -4, true, 0.5), results(1, UNSAT), 10, lengths() },
			{ "B(0, 5, 30, -4, true, 0.5) UNKNOWN", b(0, 5, 30, -4, true, 0.5), results(1, UNKNOWN), 10, lengths() },
			{ "B(0, 5, 10, 4, true, 0.5) SAT", b(0, 5, 10, 4, true, 0.5), results(1, SAT), 10, lengths(0, 5, 10) },
			{ "B(0, 5, 10, 4, true, 0.5) UNSAT", b(0, 5, 10, 4, true, 0.5), results(1, UNSAT), 10, lengths(0, 5, 10) },
			{ "B(0, 5, 10, 4, true, 0.5) UNKNOWN", b(0, 5, 10, 4, true, 0.5), results(1, UNKNOWN), 15, lengths(0, 0, 5, 0, 5, 10, 0, 5, 10, 0, 0, 5, 0, 10, 0) },
			{ "B(0, 1, 30, 4, true, 0.5) UNKNOWN/UNSAT", b(0, 1, 30, 4, true, 0.5), results(1, UNKNOWN, 1, UNSAT), 10, lengths(0, 0, 1, 1, 2, 2, 3, 3, 4, 4) },
			{ "B(0, 1, 30, 4, true, 0.5) 2xUNKNOWN/UNSAT", b(0, 1, 30, 4, true, 0.5), results(2, UNKNOWN, 1, UNSAT), 10, lengths(0, 0, 1, 2, 2, 3, 4, 4, 5, 6) },
			{ "B(0, 1, 30, 4, true, 0.5) 5xUNKNOWN/UNSAT/6xUNKNOWN", b(0, 1, 30, 4, true, 0.5), results(5, UNKNOWN, 1, UNSAT, 6, UNKNOWN), 12, lengths(0, 0, 1, 0, 1, 2, 3, 3, 4, 3, 4, 5) },
			{ "B(0, 1, 30, 4, true, 0.5) 11xUNKNOWN/UNSAT/8xUNKNOWN", b(0, 1, 30, 4, true, 0.5), results(11, UNKNOWN, 1, UNSAT, 8, UNKNOWN), 20, lengths(0, 0, 1, 0, 1, 2, 0, 1, 2, 0, 3, 0, 1, 3, 1, 2, 4, 1, 2, 4) },
			{ "B(0, 1, 30, 4, false, 0.5) UNKNOWN/UNSAT", b(0, 1, 30, 4, false, 0.5), results(1, UNKNOWN, 1, UNSAT), 10, lengths(0, 0, 1, 1, 2, 2, 3, 3, 4, 4) },
			{ "B(0, 1, 30, 4, false, 0.5) 2xUNKNOWN/UNSAT", b(0, 1, 30, 4, false, 0.5), results(2, UNKNOWN, 1, UNSAT), 10, lengths(0, 0, 1, 0, 2, 0, 2, 2, 3, 4) },
			{ "B(0, 1, 30, 4, false, 0.5) 5xUNKNOWN/UNSAT/6xUNKNOWN", b(0, 1, 30, 4, false, 0.5), results(5, UNKNOWN, 1, UNSAT, 6, UNKNOWN), 12, lengths(0, 0, 1, 0, 1, 2, 0, 1, 0, 3, 0, 1) },
			{ "B(0, 1, 30, 4, false, 0.5) 11xUNKNOWN/UNSAT/8xUNKNOWN", b(0, 1, 30, 4, false, 0.5), results(11, UNKNOWN, 1, UNSAT, 8, UNKNOWN), 20, lengths(0, 0, 1, 0, 1, 2, 0, 1, 2, 0, 3, 0, 1, 3, 1, 2, 4, 1, 2, 4) },
			{ "B(0, 5, 10, 4, true, 0.5) 5xUNKNOWN/UNSAT", b(0, 5, 10, 4, true, 0.5), results(5, UNKNOWN, 1, UNSAT), 10, lengths(0, 0, 5, 0, 5, 10) },
			{ "B(0, 5, 10, 4, false, 0.5) 5xUNKNOWN/UNSAT", b(0, 5, 10, 4, false, 0.5), results(5, UNKNOWN, 1, UNSAT), 10, lengths(0, 0, 5, 0, 5, 10, 0, 5, 0, 0) },
			{ "B(0, 5, 10, 4, false, 0.5) 5xUNKNOWN/2xUNSAT", b(0, 5, 10, 4, false, 0.5), results(5, UNKNOWN, 2, UNSAT), 10, lengths(0, 0, 5, 0, 5, 10, 0, 5, 5, 5) },
			{ "B(0, 5, 30, 5, true, 0.5) SAT", b(0, 5, 30, 5, true, 0.5), results(1, SAT), 10, lengths(0, 5, 10, 15, 20, 25, 30) },
			{ "B(0, 5, 30, 5, true, 0.5) UNSAT", b(0, 5, 30, 5, true, 0.5), results(1, UNSAT), 10, lengths(0, 5, 10, 15, 20, 25, 30) },
			{ "B(0, 5, 30, 5, true, 0.5) NONE", b(0, 5, 30, 5, true, 0.5), results(1, NONE), 10, lengths(0) },
			{ "B(30, 5, 30, 4, true, 0.5) SAT", b(30, 5, 30, 4, true, 0.5), results(1, SAT), 10, lengths(30) },
			{ "B(30, 5, 30, 4, true, 0.5) UNSAT", b(30, 5, 30, 4, true, 0.5), results(1, UNSAT), 10, lengths(30) },
			{ "B(30, 5, 30, 4, true, 0.5) UNKNOWN", b(30, 5, 30, 4, true, 0.5), results(1, UNKNOWN), 10, lengths(30, 30, 30, 30, 30, 30, 30, 30, 30, 30) },
			{ "B(25, 5, 30, 4, true, 0.5) SAT", b(25, 5, 30, 4, true, 0.5), results(1, SAT), 10, lengths(25, 30) },
			{ "B(25, 5, 30, 4, true, 0.5) UNSAT", b(25, 5, 30, 4, true, 0.5), results(1, UNSAT), 10, lengths(25, 30) },
			{ "B(25, 5, 30, 4, true, 0.5) UNKNOWN", b(25, 5, 30, 4, true, 0.5), results(1, UNKNOWN), 10, lengths(25, 25, 30, 25, 30, 25, 30, 25, 25, 30) },
			{ "B(-5, 5, 30, 4, true, 0.5) SAT", b(-5, 5, 30, 4, true, 0.5), results(1, SAT), 10, lengths() },
			{ "B(-5, 5, 30, 4, true, 0.5) UNSAT", b(-5, 5, 30, 4, true, 0.5), results(1, UNSAT), 10, lengths() },
			{ "B(-5, 5, 30, 4, true, 0.5) UNKNOWN", b(-5, 5, 30, 4, true, 0.5), results(1, UNKNOWN), 10, lengths() },
			{ "B(35, 5, 30, 4, true, 0.5) SAT", b(35, 5, 30, 4, true, 0.5), results(1, SAT), 10, lengths() },
			{ "B(35, 5, 30, 4, true, 0.5) UNSAT", b(35, 5, 30, 4, true, 0.5), results(1, UNSAT), 10, lengths() },
			{ "B(35, 5, 30, 4, true, 0.5) UNKNOWN", b(35, 5, 30, 4, true, 0.5), results(1, UNKNOWN), 10, lengths() },
			{ "B(0, 5, 0, 4, true, 0.5) SAT", b(0, 5, 0, 4, true, 0.5), results(1, SAT), 10, lengths(0) },
			{ "B(0, 5, 0, 4, true, 0.5) UNSAT", b(0, 5, 0, 4, true, 0.5), results(1, UNSAT), 10, lengths(0) },
			{ "B(0, 5, 0, 4, true, 0.5) UNKNOWN", b(0, 5, 0, 4, true, 0.5), results(1, UNKNOWN), 10, lengths(0, 0, 0, 0, 0, 0, 0, 0, 0, 0) },
			{ "B(0, 5, 5, 4, true, 0.5) SAT", b(0, 5, 5, 4, true, 0.5), results(1, SAT), 10, lengths(0, 5) },
			{ "B(0, 5, 5, 4, true, 0.5) UNSAT", b(0, 5, 5, 4, true, 0.5), results(1, UNSAT), 10, lengths(0, 5) },
			{ "B(0, 5, 5, 4, true, 0.5) UNKNOWN", b(0, 5, 5, 4, true, 0.5), results(1, UNKNOWN), 10, lengths(0, 0, 5, 0, 5, 0, 5, 0, 0, 5) },
			{ "B(0, 5, -5, 4, true, 0.5) SAT", b(0, 5, -5, 4, true, 0.5), results(1, SAT), 10, lengths() },
			{ "B(0, 5, -5, 4, true, 0.5) UNSAT", b(0, 5, -5, 4, true, 0.5), results(1, UNSAT), 10, lengths() },
			{ "B(0, 5, -5, 4, true, 0.5) UNKNOWN", b(0, 5, -5, 4, true, 0.5), results(1, UNKNOWN), 10, lengths() },
			{ "B(0, 0, 5, 4, true, 0.5) SAT", b(0, 0, 5, 4, true, 0.5), results(1, SAT), 10, lengths() },
			{ "B(0, 0, 5, 4, true, 0.5) UNSAT", b(0, 0, 5, 4, true, 0.5), results(1, UNSAT), 10, lengths() },
			{ "B(0, 0, 5, 4, true, 0.5) UNKNOWN", b(0, 0, 5, 4, true, 0.5), results(1, UNKNOWN), 10, lengths() },
			{ "B(0, 11, 30, 4, true, 0.5) SAT", b(0, 11, 30, 4, true, 0.5), results(1, SAT), 10, lengths(0, 11, 22) },
			{ "B(0, 11, 30, 4, true, 0.5) UNSAT", b(0, 11, 30, 4, true, 0.5), results(1, UNSAT), 10, lengths(0, 11, 22) },
			{ "B(0, 11, 30, 4, true, 0.5) UNKNOWN", b(0, 11, 30, 4, true, 0.5), results(1, UNKNOWN), 10, lengths(0, 0, 11, 0, 11, 22, 0, 11, 22, 0) },
			{ "B(0, -11, 30, 4, true, 0.5) SAT", b(0, -11, 30, 4, true, 0.5), results(1, SAT), 10, lengths() },
			{ "B(0, -11, 30, 4, true, 0.5) UNSAT", b(0, -11, 30, 4, true, 0.5), results(1, UNSAT), 10, lengths() },
			{ "B(0, -11, 30, 4, true, 0.5) UNKNOWN", b(0, -11, 30, 4, true, 0.5), results(1, UNKNOWN), 10, lengths() },
			{ "B(0, -11, -30, 4, true, 0.5) SAT", b(0, -11, -30, 4, true, 0.5), results(1, SAT), 10, lengths() },
			{ "B(0, -11, -30, 4, true, 0.5) UNSAT", b(0, -11, -30, 4, true, 0.5), results(1, UNSAT), 10, lengths() },
			{ "B(0, -11, -30, 4, true, 0.5) UNKNOWN", b(0, -11, -30, 4, true, 0.5), results(1, UNKNOWN), 10, lengths() },
			{ "B(0, 1<<30, MAX, 4, true, 1.0) SAT", b(0, 1 << 30, Integer.MAX_VALUE, 4, true, 1.0), results(1, SAT), 10, lengths(0, 1073741824) },
			{ "B(0, 1<<30, MAX, 4, true, 1.0) UNSAT", b(0, 1 << 30, Integer.MAX_VALUE, 4, true, 1.0), results(1, UNSAT), 10, lengths(0, 1073741824) },
		};
		return Arrays.asList(data);
	}

	@Test
	public void test() {
		assertEquals(expected, schedule(factory.create(), results, imax));
	}
}
