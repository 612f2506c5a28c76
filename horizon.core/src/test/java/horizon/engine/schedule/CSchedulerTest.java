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
import static horizon.engine.schedule.Schedules.c;
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
 * Sequences of lengths proposed by algorithm C.
 */
@RunWith(Parameterized.class)
public class CSchedulerTest {

	private final Schedules.Factory factory;
	private final List<Outcome> results;
	private final int imax;
	private final List<Integer> expected;

	public CSchedulerTest(String name, Schedules.Factory factory, List<Outcome> results, int imax,
			List<Integer> expected) {
		this.factory = factory;
		this.results = results;
		this.imax = imax;
		this.expected = expected;
	}

	@Parameters(name = "{0}")
	public static Collection<Object[]> data() {
		Object[][] data = new Object[][] {
			{ "C(0, 1.5, 30, true) UNKNOWN/UNSAT", c(0, 1.5, 30, true), results(1, UNKNOWN, 1, UNSAT), 11, lengths(0, 1, 2, 3, 4, 6, 10, 15, 22, 22) },
			{ "C(0, 1.5, 30, true) 2xUNKNOWN/UNSAT", c(0, 1.5, 30, true), results(2, UNKNOWN, 1, UNSAT), 10, lengths(0, 1, 0, 2, 1, 3, 4, 6, 10, 15) },
			{ "C(0, 1.5, 30, true) 5xUNKNOWN/UNSAT", c(0, 1.5, 30, true), results(5, UNKNOWN, 1, UNSAT), 12, lengths(0, 1, 0, 2, 1, 3, 4, 6, 10, 15, 4, 22) },
			{ "C(0, 1.5, 30, false) UNKNOWN/UNSAT", c(0, 1.5, 30, false), results(1, UNKNOWN, 1, UNSAT), 11, lengths(0, 1, 0, 2, 3, 0, 4, 6, 3, 10, 15) },
			{ "C(0, 1.5, 30, false) 2xUNKNOWN/UNSAT", c(0, 1.5, 30, false), results(2, UNKNOWN, 1, UNSAT), 10, lengths(0, 1, 0, 2, 1, 3, 4, 2, 6, 1) },
			{ "C(0, 1.5, 30, false) 5xUNKNOWN/UNSAT", c(0, 1.5, 30, false), results(5, UNKNOWN, 1, UNSAT), 12, lengths(0, 1, 0, 2, 1, 3, 0, 4, 2, 6, 1, 10) },
			{ "C(0, 1.5, 3, true) 5xUNKNOWN/UNSAT", c(0, 1.5, 3, true), results(5, UNKNOWN, 1, UNSAT), 10, lengths(0, 1, 0, 2, 1, 3) },
			{ "C(0, 1.5, 3, false) 5xUNKNOWN/UNSAT", c(0, 1.5, 3, false), results(5, UNKNOWN, 1, UNSAT), 10, lengths(0, 1, 0, 2, 1, 3, 0, 2, 1, 0) },
			{ "C(0, 1.5, 30, true) SAT", c(0, 1.5, 30, true), results(1, SAT), 10, lengths(0, 1, 2, 3, 4, 6, 10, 15, 22) },
			{ "C(0, 1.5, 30, true) UNSAT", c(0, 1.5, 30, true), results(1, UNSAT), 10, lengths(0, 1, 2, 3, 4, 6, 10, 15, 22) },
			{ "C(0, 1.5, 30, true) UNKNOWN", c(0, 1.5, 30, true), results(1, UNKNOWN), 10, lengths(0, 1, 0, 2, 1, 3, 0, 4, 2, 6) },
			{ "C(0, 1.5, 30, true) NONE", c(0, 1.5, 30, true), results(1, NONE), 10, lengths(0) },
			{ "C(4, 1.5, 30, true) SAT", c(4, 1.5, 30, true), results(1, SAT), 10, lengths(4, 6, 9, 13, 20, 30) },
			{ "C(4, 1.5, 30, true) UNSAT", c(4, 1.5, 30, true), results(1, UNSAT), 10, lengths(4, 6, 9, 13, 20, 30) },
			{ "C(4, 1.5, 30, true) UNKNOWN", c(4, 1.5, 30, true), results(1, UNKNOWN), 10, lengths(4, 6, 4, 9, 6, 13, 4, 20, 9, 30) },
			{ "C(30, 1.5, 30, true) SAT", c(30, 1.5, 30, true), results(1, SAT), 10, lengths(30) },
			{ "C(30, 1.5, 30, true) UNSAT", c(30, 1.5, 30, true), results(1, UNSAT), 10, lengths(30) },
			{ "C(30, 1.5, 30, true) UNKNOWN", c(30, 1.5, 30, true), results(1, UNKNOWN), 10, lengths(30, 30, 30, 30, 30, 30, 30, 30, 30, 30) },
			{ "C(-5, 1.5, 30, true) SAT", c(-5, 1.5, 30, true), results(1, SAT), 10, lengths() },
			{ "C(-5, 1.5, 30, true) UNSAT", c(-5, 1.5, 30, true), results(1, UNSAT), 10, lengths() },
			{ "C(-5, 1.5, 30, true) UNKNOWN", c(-5, 1.5, 30, true), results(1, UNKNOWN), 10, lengths() },
			{ "C(35, 1.5, 30, true) SAT", c(35, 1.5, 30, true), results(1, SAT), 10, lengths() },
			{ "C(35, 1.5, 30, true) UNSAT", c(35, 1.5, 30, true), results(1, UNSAT), 10, lengths() },
			{ "C(35, 1.5, 30, true) UNKNOWN", c(35, 1.5, 30, true), results(1, UNKNOWN), 10, lengths() },
			{ "C(0, 1.5, 0, true) SAT", c(0, 1.5, 0, true), results(1, SAT), 10, lengths(0) },
			{ "C(0, 1.5, 0, true) UNSAT", c(0, 1.5, 0, true), results(1, UNSAT), 10, lengths(0) },
			{ "C(0, 1.5, 0, true) UNKNOWN", c(0, 1.5, 0, true), results(1, UNKNOWN), 10, lengths(0, 0, 0, 0, 0, 0, 0, 0, 0, 0) },
			{ "C(0, 1.5, 5, true) SAT", c(0, 1.5, 5, true), results(1, SAT), 10, lengths(0, 1, 2, 3, 4) },
			{ "C(0, 1.5, 5, true) UNSAT", c(0, 1.5, 5, true), results(1, UNSAT), 10, lengths(0, 1, 2, 3, 4) },
			{ "C(0, 1.5, 5, true) UNKNOWN", c(0, 1.5, 5, true), results(1, UNKNOWN), 10, lengths(0, 1, 0, 2, 1, 3, 0, 4, 2, 1) },
			{ "C(0, 1.5, 1, true) SAT", c(0, 1.5, 1, true), results(1, SAT), 10, lengths(0, 1) },
			{ "C(0, 1.5, 1, true) UNSAT", c(0, 1.5, 1, true), results(1, UNSAT), 10, lengths(0, 1) },
			{ "C(0, 1.5, 1, true) UNKNOWN", c(0, 1.5, 1, true), results(1, UNKNOWN), 10, lengths(0, 1, 0, 1, 0, 1, 0, 1, 0, 1) },
			{ "C(0, 1.5, -5, true) SAT", c(0, 1.5, -5, true), results(1, SAT), 10, lengths() },
			{ "C(0, 1.5, -5, true) UNSAT", c(0, 1.5, -5, true), results(1, UNSAT), 10, lengths() },
			{ "C(0, 1.5, -5, true) UNKNOWN", c(0, 1.5, -5, true), results(1, UNKNOWN), 10, lengths() },
			{ "C(0, 1.0, 30, true) SAT", c(0, 1.0, 30, true), results(1, SAT), 10, lengths(0, 1, 2, 3, 4, 5, 6, 7, 8, 9) },
			{ "C(0, 1.0, 30, true) UNSAT", c(0, 1.0, 30, true), results(1, UNSAT), 10, lengths(0, 1, 2, 3, 4, 5, 6, 7, 8, 9) },
			{ "C(0, 1.0, 30, true) UNKNOWN", c(0, 1.0, 30, true), results(1, UNKNOWN), 10, lengths(0, 1, 0, 2, 1, 3, 0, 4, 2, 5) },
			{ "C(4, 1.0, 30, true) SAT", c(4, 1.0, 30, true), results(1, SAT), 10, lengths(4, 5, 6, 7, 8, 9, 10, 11, 12, 13) },
			{ "C(4, 1.0, 30, true) UNSAT", c(4, 1.0, 30, true), results(1, UNSAT), 10, lengths(4, 5, 6, 7, 8, 9, 10, 11, 12, 13) },
			{ "C(4, 1.0, 30, true) UNKNOWN", c(4, 1.0, 30, true), results(1, UNKNOWN), 10, lengths(4, 5, 4, 6, 5, 7, 4, 8, 6, 9) },
			{ "C(0, 11.0, 30, true) SAT", c(0, 11.0, 30, true), results(1, SAT), 10, lengths(0, 1, 11) },
			{ "C(0, 11.0, 30, true) UNSAT", c(0, 11.0, 30, true), results(1, UNSAT), 10, lengths(0, 1, 11) },
			{ "C(0, 11.0, 30, true) UNKNOWN", c(0, 11.0, 30, true), results(1, UNKNOWN), 10, lengths(0, 1, 0, 11, 1, 0, 11, 1, 0, 11) },
			{ "C(0, 11.0, -30, true) SAT", c(0, 11.0, -30, true), results(1, SAT), 10, lengths() },
			{ "C(0, 11.0, -30, true) UNSAT", c(0, 11.0, -30, true), results(1, UNSAT), 10, lengths() },
			{ "C(0, 11.0, -30, true) UNKNOWN", c(0, 11.0, -30, true), results(1, UNKNOWN), 10, lengths() },
			{ "C(0, -11.0, 30, true) SAT", c(0, -11.0, 30, true), results(1, SAT), 10, lengths() },
			{ "C(0, -11.0, 30, true) UNSAT", c(0, -11.0, 30, true), results(1, UNSAT), 10, lengths() },
			{ "C(0, -11.0, 30, true) UNKNOWN", c(0, -11.0, 30, true), results(1, UNKNOWN), 10, lengths() },
			{ "C(0, -11.0, -30, true) SAT", c(0, -11.0, -30, true), results(1, SAT), 10, lengths() },
			{ "C(0, -11.0, -30, true) UNSAT", c(0, -11.0, -30, true), results(1, UNSAT), 10, lengths() },
			{ "C(0, -11.0, -30, true) UNKNOWN", c(0, -11.0, -30, true), results(1, UNKNOWN), 10, lengths() },
			{ "C(0, 0.5, 30, true) SAT", c(0, 0.5, 30, true), results(1, SAT), 10, lengths() },
			{ "C(0, 0.5, 30, true) UNSAT", c(0, 0.5, 30, true), results(1, UNSAT), 10, lengths() },
			{ "C(0, 0.5, 30, true) UNKNOWN", c(0, 0.5, 30, true), results(1, UNKNOWN), 10, lengths() },
			{ "C(0, 0.0, 30, true) SAT", c(0, 0.0, 30, true), results(1, SAT), 10, lengths() },
			{ "C(0, 0.0, 30, true) UNSAT", c(0, 0.0, 30, true), results(1, UNSAT), 10, lengths() },
			{ "C(0, 0.0, 30, true) UNKNOWN", c(0, 0.0, 30, true), results(1, UNKNOWN), 10, lengths() },
			{ "C(0, 2.0, MAX, true) SAT", c(0, 2.0, Integer.MAX_VALUE, true), results(1, SAT), 40, lengths(0, 1, 2, 4, 8, 16, 32, 64, 128, 256, 512, 1024, 2048, 4096, 8192, 16384, 32768, 65536, 131072, 262144, 524288, 1048576, 2097152, 4194304, 8388608, 16777216, 33554432, 67108864, 134217728, 268435456, 536870912, 1073741824) },
			{ "C(2147483000, 2.0, MAX, true) SAT", c(2147483000, 2.0, Integer.MAX_VALUE, true), results(1, SAT), 10, lengths(2147483000) },
		};
		return Arrays.asList(data);
	}

	@Test
	public void test() {
		assertEquals(expected, schedule(factory.create(), results, imax));
	}
}
