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

import java.util.List;

/**
 * A temporal formula node.
 *
 * Formulas are immutable apart from their <i>handle</i>, the position they
 * receive when they are interned into a formula store. A formula can only be
 * built from children that are already interned, and two formulas with equal
 * {@link #key() keys} denote the same formula, so a store keeps exactly one
 * node per key.
 *
 * @specfield handle: int
 * @specfield children: set Formula
 * @invariant all c: children | c.handle >= 0
 */
public abstract class Formula {

	/** The kinds of formula nodes. */
	public static enum Kind {
		ATOM, CONSTANT, NOT, BINARY, PREVIOUS, INITIALLY, NEXT, PAST, FUTURE
	}

	private int handle = -1;

	Formula() {
	}

	/**
	 * Returns the kind of this formula.
	 */
	public abstract Kind kind();

	/**
	 * Returns the structural key of this formula: its kind, operator, flags and
	 * the handles of its children.
	 */
	public abstract List<Object> key();

	/**
	 * Returns the handle of this formula, or -1 if it has not been interned.
	 */
	public final int handle() {
		return handle;
	}

	/**
	 * Returns true if this formula has been interned.
	 */
	public final boolean interned() {
		return handle >= 0;
	}

	/**
	 * Binds this formula to the given handle.
	 *
	 * @requires handle >= 0
	 * @ensures this.handle' = handle
	 * @throws IllegalStateException
	 *             this.handle >= 0
	 */
	public final void bind(int handle) {
		if (handle < 0)
			throw new IllegalArgumentException("handle < 0: " + handle);
		if (this.handle >= 0)
			throw new IllegalStateException(this + " is already bound to " + this.handle);
		this.handle = handle;
	}

	/**
	 * Returns the handle of the given child.
	 *
	 * @throws IllegalArgumentException
	 *             child has not been interned
	 */
	static int handleOf(Formula child) {
		if (!child.interned())
			throw new IllegalArgumentException("child formula is not interned: " + child);
		return child.handle;
	}
}
