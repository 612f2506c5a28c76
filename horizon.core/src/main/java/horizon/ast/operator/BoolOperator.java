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
package horizon.ast.operator;

/**
 * Enumerates the binary boolean connectives.
 */
public enum BoolOperator {
	/** Conjunction operator. */
	AND("&"),
	/** Disjunction operator. */
	OR("|"),
	/** Bi-implication operator. */
	IFF("<>"),
	/** Implication with the premise on the right, <code>lhs &lt;- rhs</code>. */
	LEFT_IMPLIES("<-"),
	/** Implication with the premise on the left, <code>lhs -&gt; rhs</code>. */
	RIGHT_IMPLIES("->");

	private final String symbol;

	private BoolOperator(String symbol) {
		this.symbol = symbol;
	}

	/**
	 * Returns the textual symbol of this operator.
	 */
	public String symbol() {
		return symbol;
	}

	/**
	 * Returns the operator with the given symbol, or null if there is none.
	 */
	public static BoolOperator forSymbol(String symbol) {
		for (BoolOperator op : values())
			if (op.symbol.equals(symbol))
				return op;
		return null;
	}

	public String toString() {
		return symbol;
	}
}
