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
package horizon.engine.tel2sat;

import horizon.engine.ground.Backend;

/**
 * Clause patterns shared by the translation of formulas.
 */
final class Clauses {

	private Clauses() {
	}

	/**
	 * Adds the clauses for a &lt;=&gt; b.
	 */
	static void equal(Backend backend, int a, int b) {
		backend.addClause(-a, b);
		backend.addClause(a, -b);
	}

	/**
	 * Adds the clauses for e &lt;=&gt; a | b.
	 */
	static void disjunction(Backend backend, int e, int a, int b) {
		backend.addClause(-e, a, b);
		backend.addClause(e, -a);
		backend.addClause(e, -b);
	}
}
