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

import java.util.List;
import java.util.Map;
import java.util.Set;

import horizon.ast.Signature;
import horizon.ast.Symbol;
import horizon.ast.TheoryTerm;
import horizon.engine.Outcome;

/**
 * The primitives a grounding and solving backend offers to the incremental
 * solver, the theory translation and the program parts.
 *
 * Literals are DIMACS style integers; the negation of a literal is its
 * arithmetic negation. An <i>external</i> atom is an atom whose truth value is
 * assumed by every solve call until it is released or set free.
 *
 * @specfield atoms: set int
 * @specfield clauses: set int[]
 * @specfield symbols: Symbol lone -> one atoms
 * @specfield externals: atoms -> one TruthValue
 * @specfield theory: seq TheoryAtom
 */
public interface Backend {

	/**
	 * Adds a fresh atom and returns it.
	 *
	 * @ensures one a: int - this.atoms | this.atoms' = this.atoms + a
	 */
	public int addAtom();

	/**
	 * Adds the disjunction of the given literals.
	 *
	 * @ensures this.clauses' = this.clauses + lits
	 */
	public void addClause(int... lits);

	/**
	 * Returns the atom of the given symbol, adding a fresh one if the symbol is
	 * not yet known.
	 */
	public int addSymbol(Symbol symbol);

	/**
	 * Adds the given symbol and forces it true.
	 */
	public int addFact(Symbol symbol);

	/**
	 * Returns the atom of the given symbol, or null if it is unknown.
	 */
	public Integer lookup(Symbol symbol);

	/**
	 * Returns the known symbols with the given signature, mapped to their atoms,
	 * in order of addition.
	 */
	public Map<Symbol,Integer> symbols(Signature signature);

	/**
	 * Registers a theory atom and returns its literal. Registering an atom
	 * equal to a known one returns the known literal.
	 */
	public int addTheoryAtom(TheoryTerm term, TheoryTerm... elements);

	/**
	 * Returns the theory atoms registered since the last call.
	 */
	public List<TheoryAtom> newTheoryAtoms();

	/**
	 * Makes the given atom external with the given value.
	 *
	 * @ensures this.externals' = this.externals ++ atom -> value
	 */
	public void setExternal(int atom, TruthValue value);

	/**
	 * Assigns a truth value to an external atom. Has no effect on atoms that
	 * are not external.
	 */
	public void assignExternal(int atom, boolean value);

	/**
	 * Releases the given atom from external control; from now on only the
	 * clauses decide its value.
	 *
	 * @ensures this.externals' = this.externals - atom -> TruthValue
	 */
	public void releaseExternal(int atom);

	/**
	 * Returns true if the given atom is under external control.
	 */
	public boolean isExternal(int atom);

	/**
	 * Returns the value the given external atom is assumed to have, or null if
	 * it is not external.
	 */
	public TruthValue external(int atom);

	/**
	 * Solves the clauses under the current external assignment and the given
	 * assumptions.
	 */
	public Outcome solve(int[] assumptions);

	/**
	 * Returns the symbols true in the model found by the last solve call.
	 *
	 * @throws IllegalStateException
	 *             the last solve call did not find a model
	 */
	public Set<Symbol> model();

	/**
	 * Bounds the work of each solve call, in restarts and conflicts per restart.
	 * A conflict count of 0 leaves solve calls unbounded.
	 */
	public void setBudget(int restartsPerSolve, int conflictsPerRestart);

	public int numberOfVariables();

	public int numberOfClauses();
}
