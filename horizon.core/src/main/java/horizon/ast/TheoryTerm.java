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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A raw theory term as handed over by the front end, before it is elaborated
 * into a {@link Formula}. Operators appear as functions named after their
 * symbol, e.g. <code>&amp;(a, b)</code> or <code>&lt;?(a, b)</code>.
 */
public final class TheoryTerm {

	public static enum Type {
		NUMBER, SYMBOL, FUNCTION, TUPLE, LIST, SET
	}

	private final Type type;
	private final String name;
	private final int number;
	private final List<TheoryTerm> args;

	private TheoryTerm(Type type, String name, int number, List<TheoryTerm> args) {
		this.type = type;
		this.name = name;
		this.number = number;
		this.args = args;
	}

	public static TheoryTerm number(int value) {
		return new TheoryTerm(Type.NUMBER, null, value, Collections.<TheoryTerm>emptyList());
	}

	public static TheoryTerm symbol(String name) {
		if (name == null)
			throw new NullPointerException("name");
		return new TheoryTerm(Type.SYMBOL, name, 0, Collections.<TheoryTerm>emptyList());
	}

	public static TheoryTerm function(String name, TheoryTerm... args) {
		if (name == null)
			throw new NullPointerException("name");
		return new TheoryTerm(Type.FUNCTION, name, 0, Collections.unmodifiableList(Arrays.asList(args.clone())));
	}

	public static TheoryTerm tuple(TheoryTerm... args) {
		return new TheoryTerm(Type.TUPLE, null, 0, Collections.unmodifiableList(Arrays.asList(args.clone())));
	}

	public static TheoryTerm list(TheoryTerm... args) {
		return new TheoryTerm(Type.LIST, null, 0, Collections.unmodifiableList(Arrays.asList(args.clone())));
	}

	public static TheoryTerm set(TheoryTerm... args) {
		return new TheoryTerm(Type.SET, null, 0, Collections.unmodifiableList(Arrays.asList(args.clone())));
	}

	public Type type() {
		return type;
	}

	/**
	 * Returns the name of this symbol or function; null for other types.
	 */
	public String name() {
		return name;
	}

	/**
	 * @throws IllegalStateException
	 *             this.type != NUMBER
	 */
	public int number() {
		if (type != Type.NUMBER)
			throw new IllegalStateException(this + " is not a number");
		return number;
	}

	public List<TheoryTerm> arguments() {
		return args;
	}

	@Override
	public String toString() {
		switch (type) {
		case NUMBER:
			return Integer.toString(number);
		case SYMBOL:
			return name;
		case FUNCTION:
			return name + join("(", ")");
		case TUPLE:
			return join("(", args.size() == 1 ? ",)" : ")");
		case LIST:
			return join("[", "]");
		default:
			return join("{", "}");
		}
	}

	private String join(String open, String close) {
		final StringBuilder b = new StringBuilder(open);
		for (int i = 0; i < args.size(); i++) {
			if (i > 0)
				b.append(',');
			b.append(args.get(i));
		}
		return b.append(close).toString();
	}
}
