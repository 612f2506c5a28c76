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
 * An implementation of the reporter interface that prints messages to the
 * standard output stream.
 */
public final class ConsoleReporter implements Reporter {

	public void grounding(int step) {
		System.out.println("grounding step " + step + " ...");
	}

	public void translating(int horizon, int pending) {
		System.out.println("translating " + pending + " temporal formulas at horizon " + horizon + " ...");
	}

	public void skipping(int step, boolean skip) {
		System.out.println((skip ? "blocking" : "unblocking") + " step " + step);
	}

	public void solving(int length, int vars, int clauses) {
		System.out.println("solving length " + length + " (" + vars + " vars, " + clauses + " clauses) ...");
	}

	public void solved(int length, Outcome outcome, long millis) {
		System.out.println("length " + length + ": " + outcome + " in " + millis + " ms");
	}

	public void scheduled(List<?> queue, List<?> pending) {
		System.out.println("Queue:\t\t " + queue);
		if (!pending.isEmpty())
			System.out.println("Pending:\t " + pending);
	}

	public void exhausted() {
		System.out.println("no plan found");
	}

	@Override
	public String toString() {
		return "ConsoleReporter";
	}
}
