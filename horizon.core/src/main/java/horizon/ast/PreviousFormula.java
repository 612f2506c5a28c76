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

/**
 * The value of a formula at the previous step. At step 0 a strong previous is
 * false and a weak one is true.
 */
public final class PreviousFormula extends Formula {

	private final Formula formula;
	private final boolean weak;

	public PreviousFormula(Formula formula, boolean weak) {
		handleOf(formula);
		this.formula = formula;
		this.weak = weak;
	}

	public Formula formula() {
		return formula;
	}

	public boolean weak() {
		return weak;
	}

	@Override
	public Kind kind() {
		return Kind.PREVIOUS;
	}

	@Override
	public List<Object> key() {
		return Arrays.<Object>asList(Kind.PREVIOUS, weak, formula.handle());
	}

	@Override
	public String toString() {
		return (weak ? "(<:" : "(<") + formula + ")";
	}
}
