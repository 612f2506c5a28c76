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

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

import horizon.ast.Symbol;

/**
 * A model of a temporal program for a given length: the symbols true in it,
 * each carrying its time step as last argument.
 *
 * @specfield length: int
 * @specfield symbols: set Symbol
 * @invariant all s: symbols | s.step() = null || s.step() <= length
 */
public final class Model {

	private final int length;
	private final Set<Symbol> symbols;

	Model(int length, Set<Symbol> symbols) {
		this.length = length;
		this.symbols = Collections.unmodifiableSet(new TreeSet<Symbol>(symbols));
	}

	/**
	 * Returns the length of the trace this model describes. Its steps range
	 * over [0..length].
	 */
	public int length() {
		return length;
	}

	/**
	 * Returns the true symbols, in ascending order.
	 */
	public Set<Symbol> symbols() {
		return symbols;
	}

	public boolean contains(Symbol symbol) {
		return symbols.contains(symbol);
	}

	/**
	 * Returns the true symbols at the given step.
	 */
	public Set<Symbol> at(int step) {
		final Set<Symbol> ret = new TreeSet<Symbol>();
		for (Symbol s : symbols) {
			final Integer t = s.step();
			if (t != null && t == step)
				ret.add(s);
		}
		return ret;
	}

	@Override
	public String toString() {
		return "Model(" + length + ") " + symbols;
	}
}
