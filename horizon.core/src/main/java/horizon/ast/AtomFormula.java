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
package horizon.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A reference to a predicate at the step the formula is evaluated at. The
 * step is appended to the arguments when the atom is looked up.
 */
public final class AtomFormula extends Formula {

	private final String name;
	private final List<Symbol> args;
	private final boolean positive;

	/**
	 * Constructs a new atom.
	 *
	 * @throws MalformedFormulaException
	 *             name starts or ends with a prime
	 */
	public AtomFormula(String name, List<Symbol> args, boolean positive) {
		if (name == null)
			throw new NullPointerException("name");
		if (name.startsWith("'"))
			throw new MalformedFormulaException("temporal formulas use < instead of leading primes: " + name);
		if (name.endsWith("'"))
			throw new MalformedFormulaException("temporal formulas use > instead of trailing primes: " + name);
		this.name = name;
		this.args = Collections.unmodifiableList(new ArrayList<Symbol>(args));
		this.positive = positive;
	}

	public String name() {
		return name;
	}

	public List<Symbol> arguments() {
		return args;
	}

	public boolean positive() {
		return positive;
	}

	/**
	 * Returns the symbol this atom denotes at the given step.
	 */
	public Symbol at(int step) {
		final List<Symbol> timed = new ArrayList<Symbol>(args);
		timed.add(Symbol.number(step));
		return Symbol.function(name, timed, positive);
	}

	@Override
	public Kind kind() {
		return Kind.ATOM;
	}

	@Override
	public List<Object> key() {
		return Arrays.<Object>asList(Kind.ATOM, name, args, positive);
	}

	@Override
	public String toString() {
		final StringBuilder b = new StringBuilder("(");
		if (!positive)
			b.append('-');
		b.append(name).append('(');
		for (int i = 0; i < args.size(); i++) {
			if (i > 0)
				b.append(',');
			b.append(args.get(i));
		}
		return b.append("))").toString();
	}
}
