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
package horizon.engine.ground;

import java.util.Arrays;

/**
 * A part of a temporal program that knows how to ground itself at a time
 * step. Each part has a root deciding at which steps it applies, and a list
 * of offsets: at step <code>t</code> the part is grounded once for every
 * offset <code>i</code> its root admits, with base <code>t - i</code>.
 *
 * @specfield name: String
 * @specfield root: Root
 * @specfield offsets: seq int
 */
public abstract class ProgramPart {

	/** When a part applies, relative to its base step. */
	public static enum Root {
		/** Only at the base step 0. */
		INITIAL {
			@Override
			public boolean admits(int base) {
				return base == 0;
			}
		},
		/** At every step. */
		ALWAYS {
			@Override
			public boolean admits(int base) {
				return base >= 0;
			}
		},
		/** At every step but the first. */
		DYNAMIC {
			@Override
			public boolean admits(int base) {
				return base > 0;
			}
		};

		/**
		 * Returns true if a part with this root applies at the given base step.
		 */
		public abstract boolean admits(int base);
	}

	private final String name;
	private final Root root;
	private final int[] offsets;

	/**
	 * Constructs a part with the given name, root and offsets.
	 *
	 * @throws IllegalArgumentException
	 *             some offset < 0
	 */
	protected ProgramPart(String name, Root root, int... offsets) {
		if (name == null)
			throw new NullPointerException("name");
		if (root == null)
			throw new NullPointerException("root");
		for (int i : offsets)
			if (i < 0)
				throw new IllegalArgumentException("negative offset: " + i);
		this.name = name;
		this.root = root;
		this.offsets = offsets.length == 0 ? new int[] { 0 } : offsets.clone();
	}

	public String name() {
		return name;
	}

	public Root root() {
		return root;
	}

	public int[] offsets() {
		return offsets.clone();
	}

	/**
	 * Grounds this part at the given step for every offset the root admits.
	 */
	final void groundAt(Backend backend, int step) {
		for (int i : offsets) {
			if (root.admits(step - i))
				ground(backend, step - i, step);
		}
	}

	/**
	 * Emits the symbols, clauses and theory atoms of this part for the given
	 * base and step.
	 *
	 * @requires root.admits(base) && base <= step
	 */
	protected abstract void ground(Backend backend, int base, int step);

	@Override
	public String toString() {
		return name + "(" + root.name().toLowerCase() + ", " + Arrays.toString(offsets) + ")";
	}
}
