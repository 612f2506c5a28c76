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
package horizon.engine.tel2sat;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

import horizon.engine.ground.Backend;

/**
 * The translation state of one formula at one step.
 *
 * @specfield literal: int
 * @specfield linked: set int
 * @specfield pending: seq int
 * @specfield resolved: boolean
 * @invariant pending.elems in linked
 */
final class TranslationCache {

	/** 0 until the formula has been translated at this step. */
	int literal = 0;
	/** False while a next formula at the horizon stands for an unknown step. */
	boolean resolved = true;
	private final TreeSet<Integer> linked = new TreeSet<Integer>();
	private final List<Integer> pending = new ArrayList<Integer>();

	/**
	 * Returns true if the formula has a literal at this step.
	 */
	boolean translated() {
		return literal != 0;
	}

	/**
	 * Records that the given theory literal is equivalent to the formula at
	 * this step.
	 */
	void link(int atom) {
		if (linked.add(atom))
			pending.add(atom);
	}

	/**
	 * Assigns a literal: the smallest linked one, which needs no equality
	 * clauses, or a fresh atom.
	 *
	 * @requires !translated()
	 */
	int assign(Backend backend) {
		assert literal == 0;
		if (linked.isEmpty()) {
			literal = backend.addAtom();
		} else {
			literal = linked.pollFirst();
			pending.remove(Integer.valueOf(literal));
		}
		return literal;
	}

	/**
	 * Makes every pending linked literal equal to this.literal.
	 *
	 * @requires translated()
	 */
	void drain(Backend backend) {
		for (int atom : pending) {
			if (atom != literal)
				Clauses.equal(backend, atom, literal);
		}
		pending.clear();
	}

	@Override
	public String toString() {
		return "[literal=" + literal + ", linked=" + linked + ", pending=" + pending + ", resolved=" + resolved + "]";
	}
}
