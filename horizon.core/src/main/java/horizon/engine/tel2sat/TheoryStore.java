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
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import horizon.ast.AtomFormula;
import horizon.ast.BinaryFormula;
import horizon.ast.ConstantFormula;
import horizon.ast.Formula;
import horizon.ast.InitiallyFormula;
import horizon.ast.NextFormula;
import horizon.ast.NotFormula;
import horizon.ast.PreviousFormula;
import horizon.ast.Symbol;
import horizon.ast.TemporalFormula;
import horizon.ast.TheoryTerm;
import horizon.ast.operator.BoolOperator;
import horizon.ast.operator.TemporalOperator;
import horizon.engine.ground.Backend;
import horizon.engine.ground.TheoryAtom;

/**
 * The formulas of one solving session together with their translation state.
 *
 * A store interns formulas, so that structurally equal formulas share one node
 * and one translation, and keeps a worklist of formulas that must be
 * (re)translated once the horizon grows: formulas introduced by theory atoms,
 * and next formulas that were translated at the horizon.
 *
 * @specfield formulas: seq Formula
 * @specfield caches: formulas -> int -> lone TranslationCache
 * @specfield falseLiteral: int
 * @specfield worklist: seq (int -> Formula)
 * @invariant all i: formulas.inds | formulas[i].handle = i
 */
public final class TheoryStore {

	/** The name of the theory atoms holding temporal formulas. */
	public static final String THEORY = "tel";

	private final List<Formula> formulas = new ArrayList<Formula>();
	private final Map<List<Object>,Formula> keys = new HashMap<List<Object>,Formula>();
	private final List<Map<Integer,TranslationCache>> caches = new ArrayList<Map<Integer,TranslationCache>>();
	private final TermElaborator elaborator = new TermElaborator(this);
	private int falseLiteral = 0;
	private List<Work> worklist = new ArrayList<Work>();
	private Set<Work> scheduled = new HashSet<Work>();

	/**
	 * Returns the interned formula with the same key as the given one,
	 * interning the given formula if there is none.
	 *
	 * @ensures formula.key() !in this.formulas.key() => this.formulas' =
	 *          this.formulas.add(formula)
	 * @return this.formulas[i] such that this.formulas[i].key() = formula.key()
	 * @throws IllegalStateException
	 *             formula is bound to a different store
	 */
	public Formula intern(Formula formula) {
		final List<Object> key = formula.key();
		final Formula known = keys.get(key);
		if (known != null)
			return known;
		formula.bind(formulas.size());
		formulas.add(formula);
		caches.add(new LinkedHashMap<Integer,TranslationCache>());
		keys.put(key, formula);
		return formula;
	}

	/**
	 * Returns the formula with the given handle.
	 */
	public Formula formula(int handle) {
		return formulas.get(handle);
	}

	/**
	 * Returns the number of interned formulas.
	 */
	public int size() {
		return formulas.size();
	}

	public AtomFormula atom(String name, List<Symbol> args, boolean positive) {
		return (AtomFormula) intern(new AtomFormula(name, args, positive));
	}

	public AtomFormula atom(String name, Symbol... args) {
		return atom(name, Arrays.asList(args), true);
	}

	public ConstantFormula constant(boolean value) {
		return (ConstantFormula) intern(new ConstantFormula(value));
	}

	public NotFormula not(Formula formula) {
		return (NotFormula) intern(new NotFormula(formula));
	}

	public BinaryFormula binary(BoolOperator op, Formula left, Formula right) {
		return (BinaryFormula) intern(new BinaryFormula(op, left, right));
	}

	public PreviousFormula previous(Formula formula, boolean weak) {
		return (PreviousFormula) intern(new PreviousFormula(formula, weak));
	}

	public InitiallyFormula initially(Formula formula) {
		return (InitiallyFormula) intern(new InitiallyFormula(formula));
	}

	public NextFormula next(Formula formula, boolean weak) {
		return (NextFormula) intern(new NextFormula(formula, weak));
	}

	/**
	 * Returns the past formula with the given operator and operands.
	 *
	 * @requires left may be null
	 */
	public TemporalFormula past(TemporalOperator op, Formula left, Formula right) {
		return (TemporalFormula) intern(new TemporalFormula(op, true, left, right));
	}

	/**
	 * Returns the future formula with the given operator and operands, linked
	 * to the next formula that refers to it at the following step. The next
	 * formula is weak for trigger and strong for since.
	 *
	 * @requires left may be null
	 */
	public TemporalFormula future(TemporalOperator op, Formula left, Formula right) {
		final TemporalFormula formula = (TemporalFormula) intern(new TemporalFormula(op, false, left, right));
		if (formula.future() < 0)
			formula.setFuture(next(formula, op == TemporalOperator.TRIGGER).handle());
		return formula;
	}

	/**
	 * Returns the cache of the given formula at the given step, creating it if
	 * necessary.
	 */
	TranslationCache cache(Formula formula, int step) {
		final Map<Integer,TranslationCache> perStep = caches.get(formula.handle());
		TranslationCache cache = perStep.get(step);
		if (cache == null) {
			cache = new TranslationCache();
			perStep.put(step, cache);
		}
		return cache;
	}

	/**
	 * Returns the literal of the given formula at the given step, or 0 if it
	 * has not been translated there.
	 */
	public int literal(Formula formula, int step) {
		final TranslationCache cache = caches.get(formula.handle()).get(step);
		return cache == null ? 0 : cache.literal;
	}

	/**
	 * Returns true if the given formula has been translated at the given step
	 * and its literal does not stand for a step beyond the horizon.
	 */
	public boolean resolved(Formula formula, int step) {
		final TranslationCache cache = caches.get(formula.handle()).get(step);
		return cache != null && cache.translated() && cache.resolved;
	}

	/**
	 * Returns the literal that is false in every model, allocating it on first
	 * use.
	 */
	int falseLiteral(Backend backend) {
		if (falseLiteral == 0) {
			falseLiteral = backend.addAtom();
			backend.addClause(-falseLiteral);
		}
		return falseLiteral;
	}

	/**
	 * Records that the given literal is equivalent to the given formula at the
	 * given step and schedules the formula for translation there.
	 */
	public void link(Formula formula, int literal, int step) {
		cache(formula, step).link(literal);
		schedule(formula, step);
	}

	/**
	 * Adds the given formula at the given step to the worklist unless it is
	 * already there.
	 */
	void schedule(Formula formula, int step) {
		final Work work = new Work(step, formula);
		if (scheduled.add(work))
			worklist.add(work);
	}

	/**
	 * Returns the number of formulas waiting for translation.
	 */
	public int pending() {
		return worklist.size();
	}

	/**
	 * Elaborates the temporal theory atoms the backend received since the last
	 * call, links their literals, and translates every formula on the worklist
	 * with the given horizon. Formulas scheduled during the translation stay on
	 * the worklist for the next call.
	 *
	 * @requires horizon >= all steps of the theory atoms
	 * @throws MalformedFormulaException
	 *             some theory atom is malformed; no clause has been added for
	 *             the atoms of this call
	 */
	public void translate(int horizon, Backend backend) {
		final List<TheoryAtom> atoms = new ArrayList<TheoryAtom>();
		final List<Formula> elaborated = new ArrayList<Formula>();
		for (TheoryAtom atom : backend.newTheoryAtoms()) {
			final TheoryTerm term = atom.term();
			if (THEORY.equals(term.name()) && term.arguments().size() == 1 && !atom.elements().isEmpty()) {
				atoms.add(atom);
				elaborated.add(elaborator.elaborate(atom.elements().get(0)));
			}
		}
		for (int i = 0; i < atoms.size(); i++)
			link(elaborated.get(i), atoms.get(i).literal(), atoms.get(i).term().arguments().get(0).number());

		if (worklist.isEmpty())
			return;
		final List<Work> todo = worklist;
		worklist = new ArrayList<Work>();
		scheduled = new HashSet<Work>();
		final FormulaTranslator translator = translator(backend, horizon);
		for (Work work : todo)
			translator.translate(work.formula, work.step);
	}

	/**
	 * Returns a translator of the formulas in this store for the given horizon.
	 */
	public FormulaTranslator translator(Backend backend, int horizon) {
		return new FormulaTranslator(this, backend, horizon);
	}

	/**
	 * Returns the elaborator of raw theory terms into formulas of this store.
	 */
	public TermElaborator elaborator() {
		return elaborator;
	}

	@Override
	public String toString() {
		return "TheoryStore(" + formulas.size() + " formulas, " + worklist.size() + " pending)";
	}

	/**
	 * A formula waiting for translation at a step.
	 */
	private static final class Work {
		final int step;
		final Formula formula;

		Work(int step, Formula formula) {
			this.step = step;
			this.formula = formula;
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof Work))
				return false;
			final Work w = (Work) o;
			return step == w.step && formula.handle() == w.formula.handle();
		}

		@Override
		public int hashCode() {
			return step * 31 + formula.handle();
		}
	}
}
