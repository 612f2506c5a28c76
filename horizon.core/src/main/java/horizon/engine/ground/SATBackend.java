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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import horizon.ast.Signature;
import horizon.ast.Symbol;
import horizon.ast.TheoryTerm;
import horizon.engine.Outcome;
import horizon.engine.satlab.SATAbortedException;
import horizon.engine.satlab.SATSolver;

/**
 * A {@link Backend} on top of an incremental {@link SATSolver}. External atoms
 * are realised as assumptions passed to every solve call.
 */
public final class SATBackend implements Backend {

	private final SATSolver solver;
	private final Map<Symbol,Integer> symbols = new LinkedHashMap<Symbol,Integer>();
	private final Map<Integer,TruthValue> externals = new LinkedHashMap<Integer,TruthValue>();
	private final Map<String,Integer> theoryLiterals = new HashMap<String,Integer>();
	private final List<TheoryAtom> theoryAtoms = new ArrayList<TheoryAtom>();
	private int theoryCursor = 0;
	private boolean sat = false;

	/**
	 * Constructs a backend over the given solver.
	 *
	 * @requires solver.numberOfVariables() = 0
	 */
	public SATBackend(SATSolver solver) {
		if (solver == null)
			throw new NullPointerException("solver");
		this.solver = solver;
	}

	/**
	 * {@inheritDoc}
	 *
	 * @see horizon.engine.ground.Backend#addAtom()
	 */
	public int addAtom() {
		solver.addVariables(1);
		return solver.numberOfVariables();
	}

	/**
	 * {@inheritDoc}
	 *
	 * @see horizon.engine.ground.Backend#addClause(int[])
	 */
	public void addClause(int... lits) {
		solver.addClause(lits);
	}

	/**
	 * {@inheritDoc}
	 *
	 * @see horizon.engine.ground.Backend#addSymbol(horizon.ast.Symbol)
	 */
	public int addSymbol(Symbol symbol) {
		final Integer atom = symbols.get(symbol);
		if (atom != null)
			return atom;
		final int fresh = addAtom();
		symbols.put(symbol, fresh);
		return fresh;
	}

	/**
	 * {@inheritDoc}
	 *
	 * @see horizon.engine.ground.Backend#addFact(horizon.ast.Symbol)
	 */
	public int addFact(Symbol symbol) {
		final int atom = addSymbol(symbol);
		addClause(atom);
		return atom;
	}

	/**
	 * {@inheritDoc}
	 *
	 * @see horizon.engine.ground.Backend#lookup(horizon.ast.Symbol)
	 */
	public Integer lookup(Symbol symbol) {
		return symbols.get(symbol);
	}

	/**
	 * {@inheritDoc}
	 *
	 * @see horizon.engine.ground.Backend#symbols(horizon.ast.Signature)
	 */
	public Map<Symbol,Integer> symbols(Signature signature) {
		final Map<Symbol,Integer> ret = new LinkedHashMap<Symbol,Integer>();
		for (Map.Entry<Symbol,Integer> e : symbols.entrySet())
			if (signature.matches(e.getKey()))
				ret.put(e.getKey(), e.getValue());
		return ret;
	}

	/**
	 * {@inheritDoc}
	 *
	 * @see horizon.engine.ground.Backend#addTheoryAtom(horizon.ast.TheoryTerm,
	 *      horizon.ast.TheoryTerm[])
	 */
	public int addTheoryAtom(TheoryTerm term, TheoryTerm... elements) {
		final TheoryAtom candidate = new TheoryAtom(term, elements, 0);
		final String key = candidate.toString();
		final Integer known = theoryLiterals.get(key);
		if (known != null)
			return known;
		final int literal = addAtom();
		theoryLiterals.put(key, literal);
		theoryAtoms.add(new TheoryAtom(term, elements, literal));
		return literal;
	}

	/**
	 * {@inheritDoc}
	 *
	 * @see horizon.engine.ground.Backend#newTheoryAtoms()
	 */
	public List<TheoryAtom> newTheoryAtoms() {
		final List<TheoryAtom> ret = new ArrayList<TheoryAtom>(theoryAtoms.subList(theoryCursor, theoryAtoms.size()));
		theoryCursor = theoryAtoms.size();
		return ret;
	}

	/**
	 * {@inheritDoc}
	 *
	 * @see horizon.engine.ground.Backend#setExternal(int,
	 *      horizon.engine.ground.TruthValue)
	 */
	public void setExternal(int atom, TruthValue value) {
		if (atom < 1 || atom > solver.numberOfVariables())
			throw new IllegalArgumentException("not an atom: " + atom);
		if (value == null)
			throw new NullPointerException("value");
		externals.put(atom, value);
	}

	/**
	 * {@inheritDoc}
	 *
	 * @see horizon.engine.ground.Backend#assignExternal(int, boolean)
	 */
	public void assignExternal(int atom, boolean value) {
		if (externals.containsKey(atom))
			externals.put(atom, TruthValue.of(value));
	}

	/**
	 * {@inheritDoc}
	 *
	 * @see horizon.engine.ground.Backend#releaseExternal(int)
	 */
	public void releaseExternal(int atom) {
		externals.remove(atom);
	}

	/**
	 * {@inheritDoc}
	 *
	 * @see horizon.engine.ground.Backend#isExternal(int)
	 */
	public boolean isExternal(int atom) {
		return externals.containsKey(atom);
	}

	/**
	 * {@inheritDoc}
	 *
	 * @see horizon.engine.ground.Backend#external(int)
	 */
	public TruthValue external(int atom) {
		return externals.get(atom);
	}

	/**
	 * {@inheritDoc}
	 *
	 * @see horizon.engine.ground.Backend#solve(int[])
	 */
	public Outcome solve(int[] assumptions) {
		final List<Integer> all = new ArrayList<Integer>(externals.size() + assumptions.length);
		for (Map.Entry<Integer,TruthValue> e : externals.entrySet()) {
			if (e.getValue() == TruthValue.TRUE)
				all.add(e.getKey());
			else if (e.getValue() == TruthValue.FALSE)
				all.add(-e.getKey());
		}
		for (int lit : assumptions)
			all.add(lit);
		final int[] lits = new int[all.size()];
		for (int i = 0; i < lits.length; i++)
			lits[i] = all.get(i);
		try {
			sat = solver.solve(lits);
			return sat ? Outcome.SAT : Outcome.UNSAT;
		} catch (SATAbortedException e) {
			sat = false;
			return Outcome.UNKNOWN;
		}
	}

	/**
	 * {@inheritDoc}
	 *
	 * @see horizon.engine.ground.Backend#model()
	 */
	public Set<Symbol> model() {
		if (!sat)
			throw new IllegalStateException("no model available");
		final Set<Symbol> ret = new TreeSet<Symbol>();
		for (Map.Entry<Symbol,Integer> e : symbols.entrySet())
			if (solver.valueOf(e.getValue()))
				ret.add(e.getKey());
		return Collections.unmodifiableSet(ret);
	}

	/**
	 * {@inheritDoc}
	 *
	 * @see horizon.engine.ground.Backend#setBudget(int, int)
	 */
	public void setBudget(int restartsPerSolve, int conflictsPerRestart) {
		if (conflictsPerRestart == 0 || restartsPerSolve == 0)
			solver.setConflictBudget(0);
		else
			solver.setConflictBudget((int) Math.min(Integer.MAX_VALUE, (long) restartsPerSolve * conflictsPerRestart));
	}

	public int numberOfVariables() {
		return solver.numberOfVariables();
	}

	public int numberOfClauses() {
		return solver.numberOfClauses();
	}

	/**
	 * Frees the underlying solver.
	 */
	public void free() {
		solver.free();
	}

	@Override
	public String toString() {
		return "SATBackend(" + symbols.size() + " symbols, " + externals.size() + " externals, " + solver + ")";
	}
}
