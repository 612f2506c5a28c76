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
import java.util.Collections;
import java.util.List;

import horizon.ast.TheoryTerm;

/**
 * A theory atom registered with a backend: a head term such as
 * <code>tel(3)</code>, its element terms, and the literal standing for it.
 */
public final class TheoryAtom {

	private final TheoryTerm term;
	private final List<TheoryTerm> elements;
	private final int literal;

	TheoryAtom(TheoryTerm term, TheoryTerm[] elements, int literal) {
		this.term = term;
		this.elements = Collections.unmodifiableList(Arrays.asList(elements.clone()));
		this.literal = literal;
	}

	public TheoryTerm term() {
		return term;
	}

	public List<TheoryTerm> elements() {
		return elements;
	}

	public int literal() {
		return literal;
	}

	@Override
	public String toString() {
		final StringBuilder b = new StringBuilder("&").append(term).append('{');
		for (int i = 0; i < elements.size(); i++) {
			if (i > 0)
				b.append(';');
			b.append(elements.get(i));
		}
		return b.append('}').toString();
	}
}
