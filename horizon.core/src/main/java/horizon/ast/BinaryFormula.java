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
import java.util.List;

import horizon.ast.operator.BoolOperator;

/**
 * A binary boolean formula.
 */
public final class BinaryFormula extends Formula {

	private final BoolOperator op;
	private final Formula left, right;

	public BinaryFormula(BoolOperator op, Formula left, Formula right) {
		if (op == null)
			throw new NullPointerException("op");
		handleOf(left);
		handleOf(right);
		this.op = op;
		this.left = left;
		this.right = right;
	}

	public BoolOperator op() {
		return op;
	}

	public Formula left() {
		return left;
	}

	public Formula right() {
		return right;
	}

	@Override
	public Kind kind() {
		return Kind.BINARY;
	}

	@Override
	public List<Object> key() {
		return Arrays.<Object>asList(Kind.BINARY, op, left.handle(), right.handle());
	}

	@Override
	public String toString() {
		return "(" + left + op.symbol() + right + ")";
	}
}
