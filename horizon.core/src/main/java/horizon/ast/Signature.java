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

/**
 * A predicate signature: name, arity and sign. The arity counts the time
 * argument.
 */
public final class Signature {

	private final String name;
	private final int arity;
	private final boolean positive;

	public Signature(String name, int arity, boolean positive) {
		if (name == null)
			throw new NullPointerException("name");
		if (arity < 0)
			throw new IllegalArgumentException("arity < 0: " + arity);
		this.name = name;
		this.arity = arity;
		this.positive = positive;
	}

	public Signature(String name, int arity) {
		this(name, arity, true);
	}

	public String name() {
		return name;
	}

	public int arity() {
		return arity;
	}

	public boolean positive() {
		return positive;
	}

	/**
	 * Returns true if the given symbol is a function with this signature.
	 */
	public boolean matches(Symbol symbol) {
		return symbol.type() == Symbol.Type.FUNCTION && symbol.positive() == positive && symbol.arity() == arity
				&& symbol.name().equals(name);
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof Signature))
			return false;
		final Signature s = (Signature) o;
		return name.equals(s.name) && arity == s.arity && positive == s.positive;
	}

	@Override
	public int hashCode() {
		return (name.hashCode() * 31 + arity) * 2 + (positive ? 1 : 0);
	}

	@Override
	public String toString() {
		return (positive ? "" : "-") + name + "/" + arity;
	}
}
