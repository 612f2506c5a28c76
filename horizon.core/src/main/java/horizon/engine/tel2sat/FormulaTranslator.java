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

import horizon.ast.AtomFormula;
import horizon.ast.BinaryFormula;
import horizon.ast.ConstantFormula;
import horizon.ast.Formula;
import horizon.ast.InitiallyFormula;
import horizon.ast.NextFormula;
import horizon.ast.NotFormula;
import horizon.ast.PreviousFormula;
import horizon.ast.TemporalFormula;
import horizon.ast.operator.TemporalOperator;
import horizon.engine.ground.Backend;
import horizon.engine.ground.TruthValue;

/**
 * Translates the formulas of a {@link TheoryStore} into clauses, step by step,
 * for a fixed horizon. Each formula receives one literal per step; the clauses
 * added make the literal equivalent to the formula at that step, except for
 * next formulas at the horizon, whose literal is an external placeholder
 * until the horizon grows past it.
 *
 * Translation is memoized in the store, so translating a formula twice at the
 * same step adds clauses only for theory literals linked in between, or for a
 * placeholder that can now be resolved.
 *
 * @specfield store: TheoryStore
 * @specfield backend: Backend
 * @specfield horizon: int
 */
public final class FormulaTranslator {

	private final TheoryStore store;
	private final Backend backend;
	private final int horizon;

	FormulaTranslator(TheoryStore store, Backend backend, int horizon) {
		if (horizon < 0)
			throw new IllegalArgumentException("horizon < 0: " + horizon);
		this.store = store;
		this.backend = backend;
		this.horizon = horizon;
	}

	public int horizon() {
		return horizon;
	}

	/**
	 * Returns the literal of the given formula at the given step, adding the
	 * clauses defining it.
	 *
	 * @requires formula in store.formulas
	 * @throws IllegalArgumentException
	 *             step !in [0..horizon]
	 */
	public int translate(Formula formula, int step) {
		if (step < 0 || step > horizon)
			throw new IllegalArgumentException("step " + step + " outside [0.." + horizon + "]");
		final TranslationCache cache = store.cache(formula, step);
		if (!cache.translated()) {
			switch (formula.kind()) {
			case ATOM:
				final AtomFormula atom = (AtomFormula) formula;
				final Integer known = backend.lookup(atom.at(step));
				cache.literal = known != null ? known : falseLiteral();
				break;
			case CONSTANT:
				cache.literal = ((ConstantFormula) formula).value() ? -falseLiteral() : falseLiteral();
				break;
			case NOT:
				cache.literal = -translate(((NotFormula) formula).formula(), step);
				break;
			case BINARY:
				binary((BinaryFormula) formula, step, cache);
				break;
			case PREVIOUS:
				final PreviousFormula previous = (PreviousFormula) formula;
				if (step > 0)
					cache.literal = translate(previous.formula(), step - 1);
				else
					cache.literal = previous.weak() ? -falseLiteral() : falseLiteral();
				break;
			case INITIALLY:
				cache.literal = translate(((InitiallyFormula) formula).formula(), 0);
				break;
			case NEXT:
				next((NextFormula) formula, step, cache);
				break;
			case PAST:
				final TemporalFormula past = (TemporalFormula) formula;
				if (step == 0) {
					cache.literal = translate(past.right(), 0);
				} else {
					int low = step - 1;
					while (low > 0 && !store.cache(past, low).translated())
						low--;
					for (int t = low; t < step - 1; t++)
						translate(past, t);
					temporal(past, step, cache, translate(past, step - 1));
				}
				break;
			case FUTURE:
				final TemporalFormula future = (TemporalFormula) formula;
				if (future.future() < 0)
					throw new IllegalStateException("future formula without next link: " + future);
				int high = step + 1;
				while (high < horizon && !store.cache(future, high).translated())
					high++;
				for (int t = high; t > step + 1; t--)
					translate(future, t);
				temporal(future, step, cache, translate(store.formula(future.future()), step));
				break;
			default:
				throw new AssertionError("unreachable: " + formula.kind());
			}
		} else if (formula.kind() == Formula.Kind.NEXT && !cache.resolved) {
			next((NextFormula) formula, step, cache);
		}
		cache.drain(backend);
		return cache.literal;
	}

	private int falseLiteral() {
		return store.falseLiteral(backend);
	}

	private void binary(BinaryFormula formula, int step, TranslationCache cache) {
		int lhs = translate(formula.left(), step);
		int rhs = translate(formula.right(), step);
		int lit = cache.assign(backend);
		switch (formula.op()) {
		case IFF:
			backend.addClause(-lit, -lhs, rhs);
			backend.addClause(-lit, lhs, -rhs);
			backend.addClause(lit, lhs, rhs);
			backend.addClause(lit, -lhs, -rhs);
			return;
		case AND:
			lit = -lit;
			lhs = -lhs;
			rhs = -rhs;
			break;
		case LEFT_IMPLIES:
			rhs = -rhs;
			break;
		case RIGHT_IMPLIES:
			lhs = -lhs;
			break;
		default:
			break;
		}
		Clauses.disjunction(backend, lit, lhs, rhs);
	}

	/**
	 * Translates a next formula. Below the horizon its literal is the one of its
	 * operand at the following step; at the horizon it is a placeholder whose
	 * value is assumed (true if weak) until a later translation, with a greater
	 * horizon, ties it to the operand.
	 */
	private void next(NextFormula formula, int step, TranslationCache cache) {
		if (!cache.translated()) {
			if (step < horizon) {
				cache.literal = translate(formula.formula(), step + 1);
				cache.resolved = true;
			} else {
				cache.literal = backend.addAtom();
				backend.setExternal(cache.literal, TruthValue.of(formula.weak()));
				cache.resolved = false;
				store.schedule(formula, step);
			}
		} else if (step < horizon) {
			Clauses.equal(backend, cache.literal, translate(formula.formula(), step + 1));
			backend.releaseExternal(cache.literal);
			cache.resolved = true;
		} else {
			store.schedule(formula, step);
		}
	}

	/**
	 * Adds the clauses making lit equivalent to rhs | (lhs &amp; pre) for since,
	 * or rhs &amp; (lhs | pre) for trigger, where a missing lhs is true for
	 * since and false for trigger.
	 */
	private void temporal(TemporalFormula formula, int step, TranslationCache cache, int pre) {
		final boolean trigger = formula.op() == TemporalOperator.TRIGGER;
		int lhs = formula.left() == null ? 0 : translate(formula.left(), step);
		int rhs = translate(formula.right(), step);
		int lit = cache.assign(backend);
		if (trigger) {
			lit = -lit;
			rhs = -rhs;
			pre = -pre;
			lhs = -lhs;
		}
		backend.addClause(lit, -rhs);
		backend.addClause(rhs, pre, -lit);
		if (lhs != 0) {
			backend.addClause(lit, -lhs, -pre);
			backend.addClause(rhs, lhs, -lit);
		} else {
			backend.addClause(lit, -pre);
		}
	}

	@Override
	public String toString() {
		return "FormulaTranslator(horizon=" + horizon + ", " + store + ")";
	}
}
