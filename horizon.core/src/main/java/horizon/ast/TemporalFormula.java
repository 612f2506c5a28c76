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

import horizon.ast.operator.TemporalOperator;

/**
 * A binary temporal formula, looking either into the past (since, trigger) or
 * into the future (until, release). The left operand is optional; without it
 * the formula degenerates to once/historically or eventually/always.
 *
 * A future formula refers to its own value at the next step through a paired
 * {@link NextFormula}, recorded here by handle once both are interned.
 *
 * @specfield op: TemporalOperator
 * @specfield past: boolean
 * @specfield left: lone Formula
 * @specfield right: Formula
 * @specfield future: int
 */
public final class TemporalFormula extends Formula {

	private final TemporalOperator op;
	private final boolean past;
	private final Formula left, right;
	private int future = -1;

	/**
	 * Constructs a new temporal formula.
	 *
	 * @requires right.interned() && (left = null || left.interned())
	 */
	public TemporalFormula(TemporalOperator op, boolean past, Formula left, Formula right) {
		if (op == null)
			throw new NullPointerException("op");
		if (left != null)
			handleOf(left);
		handleOf(right);
		this.op = op;
		this.past = past;
		this.left = left;
		this.right = right;
	}

	public TemporalOperator op() {
		return op;
	}

	public boolean past() {
		return past;
	}

	/**
	 * Returns the left operand, or null if there is none.
	 */
	public Formula left() {
		return left;
	}

	public Formula right() {
		return right;
	}

	/**
	 * Returns the handle of the paired next formula, or -1 if none is linked.
	 */
	public int future() {
		return future;
	}

	/**
	 * Links the paired next formula of this future formula.
	 *
	 * @throws IllegalStateException
	 *             this.past || this.future >= 0
	 */
	public void setFuture(int handle) {
		if (past)
			throw new IllegalStateException("past formulas have no future: " + this);
		if (future >= 0)
			throw new IllegalStateException("future already linked: " + this);
		if (handle < 0)
			throw new IllegalArgumentException("handle < 0: " + handle);
		this.future = handle;
	}

	@Override
	public Kind kind() {
		return past ? Kind.PAST : Kind.FUTURE;
	}

	@Override
	public List<Object> key() {
		return Arrays.<Object>asList(kind(), op, left == null ? -1 : left.handle(), right.handle());
	}

	@Override
	public String toString() {
		return "(" + (left == null ? "" : left.toString()) + op.symbol(past) + right + ")";
	}
}
