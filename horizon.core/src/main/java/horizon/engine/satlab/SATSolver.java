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

/**
 * Provides an interface to an incremental SAT solver.
 *
 * Literals are DIMACS style integers: a positive integer <i>v</i> denotes the
 * variable <i>v</i>, its negation denotes the negated variable. Clauses may be
 * added between calls to {@link #solve(int[])}.
 *
 * @specfield variables: set [1..)
 * @specfield clauses: set Clause
 * @invariant all i: [2..) | i in variables => i-1 in variables
 */
public interface SATSolver {

	/**
	 * Returns the size of this solver's vocabulary.
	 *
	 * @return #this.variables
	 */
	public abstract int numberOfVariables();

	/**
	 * Returns the number of clauses added to the solver so far.
	 *
	 * @return #this.clauses
	 */
	public abstract int numberOfClauses();

	/**
	 * Adds the specified number of new variables to the solver's vocabulary.
	 *
	 * @requires numVars >= 0
	 * @ensures this.variables' = [1..#this.variables + numVars]
	 * @throws IllegalArgumentException
	 *             numVars < 0
	 */
	public abstract void addVariables(int numVars);

	/**
	 * Ensures that the given clause is in this.clauses. Returns false if the
	 * solver detected that the clause set has become trivially unsatisfiable.
	 *
	 * @requires all i: [0..lits.length) | lits[i] != 0 && |lits[i]| <= #this.variables
	 * @ensures this.clauses' = this.clauses + lits
	 * @return true if the clause was accepted
	 */
	public abstract boolean addClause(int[] lits);

	/**
	 * Returns true if there is a satisfying assignment for this.clauses that is
	 * consistent with the given assumptions. Assumptions only hold for this
	 * call.
	 *
	 * @return true if this.clauses are satisfiable under the assumptions
	 * @throws SATAbortedException
	 *             the conflict budget was exhausted before the call completed
	 */
	public abstract boolean solve(int[] assumptions) throws SATAbortedException;

	/**
	 * Returns the boolean value assigned to the given variable by the last
	 * successful call to {@link #solve(int[])}.
	 *
	 * @requires the last call to solve returned true
	 * @throws IllegalArgumentException
	 *             variable !in this.variables
	 * @throws IllegalStateException
	 *             the last call to solve did not return true
	 */
	public abstract boolean valueOf(int variable);

	/**
	 * Limits the number of conflicts a single call to {@link #solve(int[])} may
	 * spend. A budget of 0 or less lifts the limit.
	 */
	public abstract void setConflictBudget(int conflicts);

	/**
	 * Frees the memory used by this solver. Once free() is called, all
	 * subsequent calls to this solver's methods throw an IllegalStateException.
	 */
	public abstract void free();
}
