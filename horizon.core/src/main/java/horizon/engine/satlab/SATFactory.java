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

import org.sat4j.minisat.SolverFactory;

/**
 * A factory for generating SATSolver instances of a given type.
 */
public abstract class SATFactory {

	/**
	 * Constructs a new instance of SATFactory.
	 */
	protected SATFactory() {
	}

	/**
	 * The factory that produces instances of the default sat4j solver.
	 *
	 * @see org.sat4j.specs.ISolver
	 */
	public static final SATFactory DefaultSAT4J = new SATFactory() {

		public SATSolver instance() {
			return new SAT4J(SolverFactory.newDefault());
		}

		public String toString() {
			return "DefaultSAT4J";
		}
	};

	/**
	 * The factory that produces instances of the "light" sat4j solver. The light
	 * solver is suitable for solving many small instances of SAT problems.
	 *
	 * @see org.sat4j.specs.ISolver
	 */
	public static final SATFactory LightSAT4J = new SATFactory() {

		public SATSolver instance() {
			return new SAT4J(SolverFactory.newLight());
		}

		public String toString() {
			return "LightSAT4J";
		}
	};

	/**
	 * Returns an instance of a SATSolver produced by this factory.
	 *
	 * @return a SATSolver instance
	 */
	public abstract SATSolver instance();
}
