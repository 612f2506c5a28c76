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
package horizon.engine.config;

import horizon.engine.Outcome;
import horizon.engine.SchedulerConfigurationException;
import horizon.engine.satlab.SATFactory;
import horizon.engine.schedule.AScheduler;
import horizon.engine.schedule.BScheduler;
import horizon.engine.schedule.CScheduler;
import horizon.engine.schedule.Scheduler;

/**
 * Stores information about various user-level incremental solving options. It
 * can be used to choose the SAT solver and the scheduling algorithm, to bound
 * the lengths and the solver effort, and to control the encoding of the
 * attempted length.
 *
 * At most one of the scheduling algorithms A, B and C may be selected. If none
 * is, algorithm A with a window of 5 lengths is used.
 *
 * @specfield solver: SATFactory // SAT solver factory to use
 * @specfield reporter: Reporter // reporter to use
 * @specfield algorithmA: lone int // window size of algorithm A
 * @specfield algorithmB: lone double // decay rate of algorithm B
 * @specfield algorithmC: lone double // growth factor of algorithm C
 * @specfield inc: int // length increment of algorithms A and B
 * @specfield processes: int // maximum lengths per round of algorithm B
 * @specfield start: int // first length
 * @specfield limit: int // maximum length
 * @specfield restartsPerSolve: int
 * @specfield conflictsPerRestart: int // 0 for no bound
 * @specfield propagateUnsat: boolean // drop smaller lengths when a length is unsatisfiable
 * @specfield forbidActions: boolean // no action past the attempted length
 * @specfield forceActions: boolean // some action at every step of the attempted length
 * @specfield actionPredicate: String
 * @specfield moveFinal: boolean // final marker at the attempted length, or at the grounded horizon
 * @specfield minIterations: int
 * @specfield maxIterations: lone int
 * @specfield stopOn: Outcome
 */
public final class Options implements Cloneable {

	/** Window size of algorithm A when no algorithm is selected. */
	public static final int DEFAULT_SIZE = 5;

	private SATFactory solver = SATFactory.DefaultSAT4J;
	private Reporter reporter = new AbstractReporter() {
	};
	private Integer algorithmA = null;
	private Double algorithmB = null;
	private Double algorithmC = null;
	private int inc = 5;
	private int processes = 20;
	private int start = 0;
	private int limit = 3000;
	private int restartsPerSolve = 100;
	private int conflictsPerRestart = 60;
	private boolean propagateUnsat = true;
	private boolean forbidActions = false;
	private boolean forceActions = false;
	private String actionPredicate = "occurs";
	private boolean moveFinal = true;
	private int minIterations = 0;
	private Integer maxIterations = null;
	private Outcome stopOn = Outcome.SAT;

	/**
	 * Constructs an Options object initialized with default values.
	 */
	public Options() {
	}

	/**
	 * Returns the value of the solver options. The default is
	 * SATFactory.DefaultSAT4J.
	 *
	 * @return this.solver
	 */
	public SATFactory solver() {
		return solver;
	}

	/**
	 * Sets the solver option to the given value.
	 *
	 * @ensures this.solver' = solver
	 * @throws NullPointerException
	 *             solver = null
	 */
	public void setSolver(final SATFactory solver) {
		if (solver == null)
			throw new NullPointerException();
		this.solver = solver;
	}

	/**
	 * Returns this.reporter.
	 *
	 * @return this.reporter
	 */
	public Reporter reporter() {
		return reporter;
	}

	/**
	 * Sets this.reporter to the given reporter.
	 *
	 * @requires reporter != null
	 * @ensures this.reporter' = reporter
	 * @throws NullPointerException
	 *             reporter = null
	 */
	public void setReporter(Reporter reporter) {
		if (reporter == null)
			throw new NullPointerException();
		this.reporter = reporter;
	}

	/**
	 * Returns the window size of algorithm A, or null if A is not selected.
	 */
	public Integer algorithmA() {
		return algorithmA;
	}

	/**
	 * Selects algorithm A with the given window size, or deselects it if size
	 * is null. Invalid sizes yield an exhausted schedule.
	 */
	public void setAlgorithmA(Integer size) {
		this.algorithmA = size;
	}

	/**
	 * Returns the decay rate of algorithm B, or null if B is not selected.
	 */
	public Double algorithmB() {
		return algorithmB;
	}

	/**
	 * Selects algorithm B with the given decay rate, or deselects it if gamma is
	 * null.
	 */
	public void setAlgorithmB(Double gamma) {
		this.algorithmB = gamma;
	}

	/**
	 * Returns the growth factor of algorithm C, or null if C is not selected.
	 */
	public Double algorithmC() {
		return algorithmC;
	}

	/**
	 * Selects algorithm C with the given growth factor, or deselects it if
	 * factor is null. Factors below 1 yield an exhausted schedule.
	 */
	public void setAlgorithmC(Double factor) {
		this.algorithmC = factor;
	}

	/**
	 * Returns the length increment of algorithms A and B. The default is 5.
	 */
	public int inc() {
		return inc;
	}

	/**
	 * Sets the length increment. Increments below 1 yield an exhausted
	 * schedule.
	 */
	public void setInc(int inc) {
		this.inc = inc;
	}

	/**
	 * Returns the maximum number of lengths in a round of algorithm B. The
	 * default is 20.
	 */
	public int processes() {
		return processes;
	}

	public void setProcesses(int processes) {
		this.processes = processes;
	}

	/**
	 * Returns the first length to attempt. The default is 0.
	 */
	public int start() {
		return start;
	}

	public void setStart(int start) {
		this.start = start;
	}

	/**
	 * Returns the maximum length to attempt. The default is 3000.
	 */
	public int limit() {
		return limit;
	}

	public void setLimit(int limit) {
		this.limit = limit;
	}

	/**
	 * Returns the number of restarts allowed per solve call. The default is
	 * 100.
	 */
	public int restartsPerSolve() {
		return restartsPerSolve;
	}

	/**
	 * @throws IllegalArgumentException
	 *             restartsPerSolve < 0
	 */
	public void setRestartsPerSolve(int restartsPerSolve) {
		checkRange(restartsPerSolve, 0, Integer.MAX_VALUE);
		this.restartsPerSolve = restartsPerSolve;
	}

	/**
	 * Returns the number of conflicts allowed per restart; 0 leaves solve calls
	 * unbounded. The default is 60.
	 */
	public int conflictsPerRestart() {
		return conflictsPerRestart;
	}

	/**
	 * @throws IllegalArgumentException
	 *             conflictsPerRestart < 0
	 */
	public void setConflictsPerRestart(int conflictsPerRestart) {
		checkRange(conflictsPerRestart, 0, Integer.MAX_VALUE);
		this.conflictsPerRestart = conflictsPerRestart;
	}

	/**
	 * Returns whether lengths below an unsatisfiable length are dropped from
	 * the schedule. The default is true.
	 */
	public boolean propagateUnsat() {
		return propagateUnsat;
	}

	public void setPropagateUnsat(boolean propagateUnsat) {
		this.propagateUnsat = propagateUnsat;
	}

	/**
	 * Returns whether actions are forbidden at steps beyond the attempted
	 * length. The default is false.
	 */
	public boolean forbidActions() {
		return forbidActions;
	}

	public void setForbidActions(boolean forbidActions) {
		this.forbidActions = forbidActions;
	}

	/**
	 * Returns whether some action is required at every step of the attempted
	 * length but the first. The default is false.
	 */
	public boolean forceActions() {
		return forceActions;
	}

	public void setForceActions(boolean forceActions) {
		this.forceActions = forceActions;
	}

	/**
	 * Returns the name of the action predicate. The default is "occurs".
	 */
	public String actionPredicate() {
		return actionPredicate;
	}

	/**
	 * @throws NullPointerException
	 *             actionPredicate = null
	 */
	public void setActionPredicate(String actionPredicate) {
		if (actionPredicate == null)
			throw new NullPointerException();
		this.actionPredicate = actionPredicate;
	}

	/**
	 * Returns whether the final marker moves to the attempted length (true) or
	 * stays at the grounded horizon (false). The default is true.
	 */
	public boolean moveFinal() {
		return moveFinal;
	}

	public void setMoveFinal(boolean moveFinal) {
		this.moveFinal = moveFinal;
	}

	/**
	 * Returns the minimum number of solve calls. The default is 0.
	 */
	public int minIterations() {
		return minIterations;
	}

	/**
	 * @throws IllegalArgumentException
	 *             minIterations < 0
	 */
	public void setMinIterations(int minIterations) {
		checkRange(minIterations, 0, Integer.MAX_VALUE);
		this.minIterations = minIterations;
	}

	/**
	 * Returns the maximum number of solve calls, or null if there is none. The
	 * default is null.
	 */
	public Integer maxIterations() {
		return maxIterations;
	}

	/**
	 * @throws IllegalArgumentException
	 *             maxIterations < 0
	 */
	public void setMaxIterations(Integer maxIterations) {
		if (maxIterations != null)
			checkRange(maxIterations, 0, Integer.MAX_VALUE);
		this.maxIterations = maxIterations;
	}

	/**
	 * Returns the outcome that ends the search once the minimum number of
	 * iterations is reached. The default is SAT.
	 */
	public Outcome stopOn() {
		return stopOn;
	}

	/**
	 * @throws NullPointerException
	 *             stopOn = null
	 */
	public void setStopOn(Outcome stopOn) {
		if (stopOn == null)
			throw new NullPointerException();
		this.stopOn = stopOn;
	}

	/**
	 * Returns true if exactly one scheduling algorithm is selected, false if
	 * none is.
	 *
	 * @throws SchedulerConfigurationException
	 *             more than one algorithm is selected
	 */
	public boolean singleScheduler() {
		int selected = 0;
		if (algorithmA != null)
			selected++;
		if (algorithmB != null)
			selected++;
		if (algorithmC != null)
			selected++;
		if (selected > 1)
			throw new SchedulerConfigurationException("Please, choose only one Scheduler: A, B, or C");
		return selected == 1;
	}

	/**
	 * Checks that these options are consistent.
	 *
	 * @throws SchedulerConfigurationException
	 *             more than one algorithm is selected
	 */
	public void validate() {
		singleScheduler();
	}

	/**
	 * Returns a fresh scheduler for these options.
	 *
	 * @throws SchedulerConfigurationException
	 *             more than one algorithm is selected
	 */
	public Scheduler scheduler() {
		if (singleScheduler()) {
			if (algorithmA != null)
				return new AScheduler(start, inc, limit, algorithmA, propagateUnsat, reporter);
			if (algorithmB != null)
				return new BScheduler(start, inc, limit, processes, propagateUnsat, algorithmB, reporter);
			return new CScheduler(start, algorithmC, limit, propagateUnsat, reporter);
		}
		return new AScheduler(start, inc, limit, DEFAULT_SIZE, propagateUnsat, reporter);
	}

	/**
	 * @throws IllegalArgumentException
	 *             value !in [min..max]
	 */
	private void checkRange(int value, int min, int max) {
		if (value < min || value > max)
			throw new IllegalArgumentException("value out of range [" + min + ", " + max + "]: " + value);
	}

	/**
	 * Returns a shallow copy of this Options object. In particular, the returned
	 * value shares this.solver and this.reporter.
	 *
	 * @return a shallow copy of this Options object.
	 */
	@Override
	public Options clone() {
		try {
			return (Options) super.clone();
		} catch (CloneNotSupportedException e) {
			throw new AssertionError(e);
		}
	}

	/**
	 * Returns a string representation of this Options object.
	 *
	 * @return a string representation of this Options object.
	 */
	@Override
	public String toString() {
		StringBuilder b = new StringBuilder();
		b.append("Options:");
		b.append("\n solver: ");
		b.append(solver);
		b.append("\n reporter: ");
		b.append(reporter);
		b.append("\n A: ");
		b.append(algorithmA);
		b.append("\n B: ");
		b.append(algorithmB);
		b.append("\n C: ");
		b.append(algorithmC);
		b.append("\n inc: ");
		b.append(inc);
		b.append("\n processes: ");
		b.append(processes);
		b.append("\n start: ");
		b.append(start);
		b.append("\n limit: ");
		b.append(limit);
		b.append("\n restartsPerSolve: ");
		b.append(restartsPerSolve);
		b.append("\n conflictsPerRestart: ");
		b.append(conflictsPerRestart);
		b.append("\n propagateUnsat: ");
		b.append(propagateUnsat);
		b.append("\n forbidActions: ");
		b.append(forbidActions);
		b.append("\n forceActions: ");
		b.append(forceActions);
		b.append("\n actionPredicate: ");
		b.append(actionPredicate);
		b.append("\n moveFinal: ");
		b.append(moveFinal);
		b.append("\n minIterations: ");
		b.append(minIterations);
		b.append("\n maxIterations: ");
		b.append(maxIterations);
		b.append("\n stopOn: ");
		b.append(stopOn);
		return b.toString();
	}
}
