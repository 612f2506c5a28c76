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
package horizon.engine;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import horizon.ast.Signature;
import horizon.ast.Symbol;
import horizon.engine.config.Options;
import horizon.engine.config.Reporter;
import horizon.engine.ground.Program;
import horizon.engine.ground.SATBackend;
import horizon.engine.ground.TruthValue;
import horizon.engine.schedule.Scheduler;
import horizon.engine.tel2sat.TermElaborator;
import horizon.engine.tel2sat.TheoryStore;

/**
 * A computational engine for searching bounded models of temporal programs.
 * The solver grounds the program step by step, translates its temporal
 * formulas into clauses as the horizon grows, and attempts the lengths its
 * {@link Scheduler} proposes until the stop condition of its {@link Options}
 * holds or the schedule is exhausted.
 *
 * Steps beyond the attempted length are switched off through the external
 * atoms <code>__skip(t)</code>, and the last step is marked by the external
 * atom <code>__final(t)</code>. The first step is marked by the fact
 * <code>__initial(0)</code>.
 *
 * @specfield options: Options
 */
public final class IncrementalSolver {

	/** Prefix of the symbols used internally; they never appear in models. */
	public static final String INTERNAL = "__";
	public static final String SKIP = "__skip";

	private final Options options;

	/**
	 * Constructs a new Solver with the default options.
	 *
	 * @ensures this.options' = new Options()
	 */
	public IncrementalSolver() {
		this.options = new Options();
	}

	/**
	 * Constructs a new Solver with the given options.
	 *
	 * @ensures this.options' = options
	 * @throws NullPointerException
	 *             options = null
	 */
	public IncrementalSolver(Options options) {
		if (options == null)
			throw new NullPointerException();
		this.options = options;
	}

	/**
	 * Returns the Options object used by this Solver.
	 *
	 * @return this.options
	 */
	public Options options() {
		return options;
	}

	/**
	 * Searches for a model of the given program.
	 *
	 * @see #solve(Program, ModelListener)
	 */
	public Solution solve(Program program) {
		return solve(program, null);
	}

	/**
	 * Searches for a model of the given program, passing every model found to
	 * the given listener, if any.
	 *
	 * @return the outcome of the last attempt, together with the last model
	 * @throws SchedulerConfigurationException
	 *             this.options selects more than one scheduling algorithm; no
	 *             step has been grounded
	 * @throws horizon.ast.MalformedFormulaException
	 *             the program contains a malformed temporal formula
	 */
	public Solution solve(Program program, ModelListener listener) {
		options.validate();
		final Scheduler scheduler = options.scheduler();
		final Session session = new Session(program);
		try {
			session.start();
			Outcome last = null;
			Model model = null;
			boolean exhausted = false;
			final Integer max = options.maxIterations();
			int iteration = 0;
			while ((max == null || iteration < max)
					&& (iteration == 0 || iteration < options.minIterations() || last != options.stopOn())) {
				final Integer length = scheduler.next(last);
				if (length == null) {
					options.reporter().exhausted();
					exhausted = true;
					break;
				}
				last = session.attempt(length);
				if (last == Outcome.SAT) {
					model = session.model(length);
					if (listener != null)
						listener.model(model);
				}
				iteration++;
			}
			return new Solution(last, model, session.stats, exhausted);
		} finally {
			session.free();
		}
	}

	/**
	 * {@inheritDoc}
	 *
	 * @see java.lang.Object#toString()
	 */
	public String toString() {
		return options.toString();
	}

	/**
	 * The state of one search: the backend, the formula store, and the steps
	 * grounded and attempted so far.
	 */
	private final class Session {
		final Program program;
		final SATBackend backend;
		final TheoryStore store = new TheoryStore();
		final Statistics stats = new Statistics();
		final Reporter reporter = options.reporter();
		final Signature actions = new Signature(options.actionPredicate(), 2);
		int grounded = -1, attempted = 0, finalStep = 0;

		Session(Program program) {
			this.program = program;
			this.backend = new SATBackend(options.solver().instance());
			this.backend.setBudget(options.restartsPerSolve(), options.conflictsPerRestart());
		}

		/**
		 * Grounds the first step and marks it final.
		 */
		void start() {
			groundTo(0);
		}

		/**
		 * Grounds the steps up to the given length, switches the steps beyond it
		 * off, and solves.
		 */
		Outcome attempt(int length) {
			if (grounded < length)
				groundTo(length);

			if (length < attempted) {
				for (int t = length + 1; t <= attempted; t++)
					skip(t, true);
			} else if (attempted < length) {
				for (int t = attempted + 1; t <= length; t++)
					skip(t, false);
			}
			if (options.moveFinal())
				moveFinal(length);

			final List<Integer> assumptions = new ArrayList<Integer>();
			for (Signature sig : program.futureSignatures()) {
				for (Map.Entry<Symbol,Integer> e : backend.symbols(sig).entrySet()) {
					final Integer step = e.getKey().step();
					if (step != null && step > length)
						assumptions.add(-e.getValue());
				}
			}
			final int[] lits = new int[assumptions.size()];
			for (int i = 0; i < lits.length; i++)
				lits[i] = assumptions.get(i);

			reporter.solving(length, backend.numberOfVariables(), backend.numberOfClauses());
			final long startSolve = System.currentTimeMillis();
			final Outcome outcome = backend.solve(lits);
			final long endSolve = System.currentTimeMillis();
			reporter.solved(length, outcome, endSolve - startSolve);
			stats.solved(backend.numberOfVariables(), backend.numberOfClauses(), endSolve - startSolve);
			attempted = length;
			return outcome;
		}

		/**
		 * Returns the model found by the last attempt, without internal symbols
		 * and symbols beyond the given length.
		 */
		Model model(int length) {
			final Set<Symbol> symbols = new HashSet<Symbol>();
			for (Symbol s : backend.model()) {
				if (s.type() == Symbol.Type.FUNCTION && s.name().startsWith(INTERNAL))
					continue;
				final Integer step = s.step();
				if (step == null || step <= length)
					symbols.add(s);
			}
			return new Model(length, symbols);
		}

		private void groundTo(int length) {
			final long startGround = System.currentTimeMillis();
			for (int t = grounded + 1; t <= length; t++) {
				reporter.grounding(t);
				if (t == 0)
					backend.addFact(Symbol.function(TermElaborator.INITIAL, Symbol.number(0)));
				final int fin = backend.addSymbol(finalSymbol(t));
				backend.setExternal(fin, TruthValue.FALSE);
				if (t > 0)
					backend.setExternal(backend.addSymbol(skipSymbol(t)), TruthValue.FALSE);
				program.ground(backend, t);
				if (t > 0)
					actions(t);
			}
			reporter.translating(length, store.pending());
			store.translate(length, backend);
			if (!options.moveFinal() || grounded < 0) {
				if (grounded >= 0)
					backend.assignExternal(backend.lookup(finalSymbol(grounded)), false);
				backend.assignExternal(backend.lookup(finalSymbol(length)), true);
				finalStep = length;
			}
			grounded = length;
			stats.grounded(grounded, System.currentTimeMillis() - startGround);
		}

		/**
		 * Adds the clauses forbidding actions at a switched off step, or
		 * requiring one at a step that is on.
		 */
		private void actions(int step) {
			if (!options.forbidActions() && !options.forceActions())
				return;
			final int skip = backend.lookup(skipSymbol(step));
			final List<Integer> occurs = new ArrayList<Integer>();
			for (Map.Entry<Symbol,Integer> e : backend.symbols(actions).entrySet()) {
				final Integer t = e.getKey().step();
				if (t != null && t == step)
					occurs.add(e.getValue());
			}
			if (options.forbidActions()) {
				for (int occ : occurs)
					backend.addClause(-occ, -skip);
			}
			if (options.forceActions()) {
				final int[] clause = new int[occurs.size() + 1];
				clause[0] = skip;
				for (int i = 0; i < occurs.size(); i++)
					clause[i + 1] = occurs.get(i);
				backend.addClause(clause);
			}
		}

		private void skip(int step, boolean value) {
			reporter.skipping(step, value);
			backend.assignExternal(backend.lookup(skipSymbol(step)), value);
		}

		private void moveFinal(int length) {
			if (finalStep == length)
				return;
			backend.assignExternal(backend.lookup(finalSymbol(finalStep)), false);
			backend.assignExternal(backend.lookup(finalSymbol(length)), true);
			finalStep = length;
		}

		void free() {
			backend.free();
		}
	}

	private static Symbol finalSymbol(int step) {
		return Symbol.function(TermElaborator.FINAL, Symbol.number(step));
	}

	private static Symbol skipSymbol(int step) {
		return Symbol.function(SKIP, Symbol.number(step));
	}
}
