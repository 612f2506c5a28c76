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
 * Enumerates the binary temporal operators. Each operator exists in a past
 * and a future direction.
 */
public enum TemporalOperator {
	/** <code>lhs since rhs</code>, or <code>lhs until rhs</code> in the future. */
	SINCE('?'),
	/** <code>lhs trigger rhs</code>, or <code>lhs release rhs</code> in the future. */
	TRIGGER('*');

	private final char mark;

	private TemporalOperator(char mark) {
		this.mark = mark;
	}

	/**
	 * Returns the textual symbol of this operator in the given direction.
	 */
	public String symbol(boolean past) {
		return (past ? "<" : ">") + mark;
	}
}
