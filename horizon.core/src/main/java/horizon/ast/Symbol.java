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
 * A ground symbol: a number, a string, the infimum or supremum, or a
 * (possibly classically negated) function term. Tuples are functions with
 * an empty name.
 *
 * Symbols are compared structurally.
 */
public final class Symbol implements Comparable<Symbol> {

	/** Symbol types, in ascending order. */
	public static enum Type {
		INFIMUM, NUMBER, FUNCTION, STRING, SUPREMUM
	}

	public static final Symbol INFIMUM = new Symbol(Type.INFIMUM, "#inf", 0, Collections.<Symbol>emptyList(), true);
	public static final Symbol SUPREMUM = new Symbol(Type.SUPREMUM, "#sup", 0, Collections.<Symbol>emptyList(), true);

	private final Type type;
	private final String name;
	private final int number;
	private final List<Symbol> args;
	private final boolean positive;
	private final int hash;

	private Symbol(Type type, String name, int number, List<Symbol> args, boolean positive) {
		this.type = type;
		this.name = name;
		this.number = number;
		this.args = args;
		this.positive = positive;
		this.hash = Arrays.hashCode(new Object[] { type, name, number, args, positive });
	}

	/**
	 * Returns the number symbol with the given value.
	 */
	public static Symbol number(int value) {
		return new Symbol(Type.NUMBER, null, value, Collections.<Symbol>emptyList(), true);
	}

	/**
	 * Returns the string symbol with the given (unquoted) value.
	 */
	public static Symbol string(String value) {
		if (value == null)
			throw new NullPointerException("value");
		return new Symbol(Type.STRING, value, 0, Collections.<Symbol>emptyList(), true);
	}

	/**
	 * Returns the function symbol with the given name, arguments and sign.
	 */
	public static Symbol function(String name, List<Symbol> args, boolean positive) {
		if (name == null)
			throw new NullPointerException("name");
		if (!positive && name.isEmpty())
			throw new IllegalArgumentException("tuples cannot be negated");
		return new Symbol(Type.FUNCTION, name, 0, Collections.unmodifiableList(new ArrayList<Symbol>(args)), positive);
	}

	/**
	 * Returns the positive function symbol with the given name and arguments.
	 */
	public static Symbol function(String name, Symbol... args) {
		return function(name, Arrays.asList(args), true);
	}

	/**
	 * Returns the tuple with the given elements.
	 */
	public static Symbol tuple(List<Symbol> args) {
		return function("", args, true);
	}

	public Type type() {
		return type;
	}

	/**
	 * Returns the name of this function or the value of this string.
	 */
	public String name() {
		return name;
	}

	/**
	 * Returns the value of this number.
	 *
	 * @throws IllegalStateException
	 *             this.type != NUMBER
	 */
	public int number() {
		if (type != Type.NUMBER)
			throw new IllegalStateException(this + " is not a number");
		return number;
	}

	public List<Symbol> arguments() {
		return args;
	}

	public int arity() {
		return args.size();
	}

	public boolean positive() {
		return positive;
	}

	/**
	 * Returns the value of the last argument of this function if it is a number,
	 * which is where time steps are stored, or null otherwise.
	 */
	public Integer step() {
		if (type != Type.FUNCTION || args.isEmpty())
			return null;
		final Symbol last = args.get(args.size() - 1);
		return last.type == Type.NUMBER ? last.number : null;
	}

	@Override
	public int compareTo(Symbol other) {
		if (type != other.type)
			return type.compareTo(other.type);
		switch (type) {
		case NUMBER:
			return Integer.compare(number, other.number);
		case STRING:
			return name.compareTo(other.name);
		case FUNCTION:
			if (positive != other.positive)
				return positive ? -1 : 1;
			if (args.size() != other.args.size())
				return Integer.compare(args.size(), other.args.size());
			int cmp = name.compareTo(other.name);
			for (int i = 0; cmp == 0 && i < args.size(); i++)
				cmp = args.get(i).compareTo(other.args.get(i));
			return cmp;
		default:
			return 0;
		}
	}

	@Override
	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (!(o instanceof Symbol))
			return false;
		final Symbol s = (Symbol) o;
		return hash == s.hash && type == s.type && number == s.number && positive == s.positive
				&& (name == null ? s.name == null : name.equals(s.name)) && args.equals(s.args);
	}

	@Override
	public int hashCode() {
		return hash;
	}

	@Override
	public String toString() {
		switch (type) {
		case NUMBER:
			return Integer.toString(number);
		case STRING:
			return "\"" + name + "\"";
		case FUNCTION:
			final StringBuilder b = new StringBuilder();
			if (!positive)
				b.append('-');
			b.append(name);
			if (!args.isEmpty() || name.isEmpty()) {
				b.append('(');
				for (int i = 0; i < args.size(); i++) {
					if (i > 0)
						b.append(',');
					b.append(args.get(i));
				}
				if (name.isEmpty() && args.size() == 1)
					b.append(',');
				b.append(')');
			}
			return b.toString();
		default:
			return name;
		}
	}
}
