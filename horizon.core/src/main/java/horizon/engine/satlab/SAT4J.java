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
package horizon.engine.satlab;

import org.sat4j.core.VecInt;
import org.sat4j.specs.ContradictionException;
import org.sat4j.specs.ISolver;
import org.sat4j.specs.TimeoutException;

/**
 * A wrapper class that provides access to the basic functionality of the
 * SAT4J solvers.
 */
final class SAT4J implements SATSolver {

	private ISolver solver;
	private Boolean sat;
	private boolean inconsistent;
	private int vars, clauses;

	/**
	 * Constructs a wrapper for the given instance of ISolver.
	 *
	 * @throws NullPointerException
	 *             solver = null
	 */
	SAT4J(ISolver solver) {
		if (solver == null)
			throw new NullPointerException("solver");
		this.solver = solver;
		this.sat = null;
		this.inconsistent = false;
		this.vars = this.clauses = 0;
	}

	/**
	 * {@inheritDoc}
	 *
	 * @see horizon.engine.satlab.SATSolver#numberOfVariables()
	 */
	public int numberOfVariables() {
		return vars;
	}

	/**
	 * {@inheritDoc}
	 *
	 * @see horizon.engine.satlab.SATSolver#numberOfClauses()
	 */
	public int numberOfClauses() {
		return clauses;
	}

	/**
	 * {@inheritDoc}
	 *
	 * @see horizon.engine.satlab.SATSolver#addVariables(int)
	 */
	public void addVariables(int numVars) {
		checkFree();
		if (numVars < 0)
			throw new IllegalArgumentException("numVars < 0: " + numVars);
		else if (numVars > 0) {
			vars += numVars;
			solver.newVar(vars);
		}
	}

	/**
	 * {@inheritDoc}
	 *
	 * @see horizon.engine.satlab.SATSolver#addClause(int[])
	 */
	public boolean addClause(int[] lits) {
		checkFree();
		for (int lit : lits)
			if (lit == 0 || Math.abs(lit) > vars)
				throw new IllegalArgumentException(lit + " !in [1.." + vars + "]");
		if (inconsistent)
			return false;
		try {
			clauses++;
			solver.addClause(new VecInt(lits.clone()));
			return true;
		} catch (ContradictionException e) {
			inconsistent = true;
			return false;
		}
	}

	/**
	 * {@inheritDoc}
	 *
	 * @see horizon.engine.satlab.SATSolver#solve(int[])
	 */
	public boolean solve(int[] assumptions) throws SATAbortedException {
		checkFree();
		if (inconsistent) {
			sat = Boolean.FALSE;
			return false;
		}
		try {
			sat = Boolean.valueOf(solver.isSatisfiable(new VecInt(assumptions.clone())));
			return sat;
		} catch (TimeoutException e) {
			sat = null;
			throw new SATAbortedException("conflict budget exhausted", e);
		}
	}

	/**
	 * {@inheritDoc}
	 *
	 * @see horizon.engine.satlab.SATSolver#valueOf(int)
	 */
	public boolean valueOf(int variable) {
		checkFree();
		if (!Boolean.TRUE.equals(sat))
			throw new IllegalStateException();
		if (variable < 1 || variable > vars)
			throw new IllegalArgumentException(variable + " !in [1.." + vars + "]");
		return solver.model(variable);
	}

	/**
	 * {@inheritDoc}
	 *
	 * @see horizon.engine.satlab.SATSolver#setConflictBudget(int)
	 */
	public void setConflictBudget(int conflicts) {
		checkFree();
		solver.setTimeoutOnConflicts(conflicts > 0 ? conflicts : Integer.MAX_VALUE);
	}

	/**
	 * {@inheritDoc}
	 *
	 * @see horizon.engine.satlab.SATSolver#free()
	 */
	public synchronized void free() {
		solver = null;
	}

	private void checkFree() {
		if (solver == null)
			throw new IllegalStateException("solver has been freed");
	}

	/**
	 * {@inheritDoc}
	 *
	 * @see java.lang.Object#toString()
	 */
	public String toString() {
		return "SAT4J(" + vars + " vars, " + clauses + " clauses)";
	}
}
