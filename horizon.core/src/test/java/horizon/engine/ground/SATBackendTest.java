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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.Before;
import org.junit.Test;

import horizon.ast.Signature;
import horizon.ast.Symbol;
import horizon.ast.TheoryTerm;
import horizon.engine.Outcome;
import horizon.engine.satlab.SATFactory;

public class SATBackendTest {

	private SATBackend backend;

	@Before
	public void setUp() {
		backend = new SATBackend(SATFactory.DefaultSAT4J.instance());
	}

	@Test
	public void testSymbols() {
		final Symbol p1 = Symbol.function("p", Symbol.number(1));
		final int a = backend.addSymbol(p1);
		assertEquals(a, backend.addSymbol(p1));
		assertEquals(Integer.valueOf(a), backend.lookup(p1));
		assertNull(backend.lookup(Symbol.function("p", Symbol.number(2))));
		assertEquals(1, backend.numberOfVariables());

		backend.addSymbol(Symbol.function("p", Symbol.number(2)));
		backend.addSymbol(Symbol.function("p"));
		final Map<Symbol,Integer> ps = backend.symbols(new Signature("p", 1));
		assertEquals(2, ps.size());
		assertTrue(ps.containsKey(p1));
	}

	@Test
	public void testFactsAndModel() {
		final Symbol p = Symbol.function("p"), q = Symbol.function("q"), r = Symbol.function("r");
		backend.addFact(p);
		final int b = backend.addSymbol(q);
		backend.addSymbol(r);
		assertEquals(Outcome.SAT, backend.solve(new int[] { b }));
		final Set<Symbol> model = backend.model();
		assertTrue(model.contains(p));
		assertTrue(model.contains(q));
		assertEquals(Outcome.UNSAT, backend.solve(new int[] { -backend.lookup(p) }));
	}

	@Test(expected = IllegalStateException.class)
	public void testNoModelBeforeSolve() {
		backend.addSymbol(Symbol.function("p"));
		backend.model();
	}

	@Test(expected = IllegalStateException.class)
	public void testNoModelAfterUnsat() {
		final int a = backend.addFact(Symbol.function("p"));
		assertEquals(Outcome.UNSAT, backend.solve(new int[] { -a }));
		backend.model();
	}

	@Test
	public void testExternals() {
		final int a = backend.addAtom();
		backend.setExternal(a, TruthValue.FALSE);
		assertTrue(backend.isExternal(a));
		assertEquals(Outcome.UNSAT, backend.solve(new int[] { a }));

		backend.assignExternal(a, true);
		assertEquals(TruthValue.TRUE, backend.external(a));
		assertEquals(Outcome.UNSAT, backend.solve(new int[] { -a }));

		backend.setExternal(a, TruthValue.FREE);
		assertEquals(Outcome.SAT, backend.solve(new int[] { a }));
		assertEquals(Outcome.SAT, backend.solve(new int[] { -a }));

		backend.assignExternal(a, false);
		backend.releaseExternal(a);
		assertFalse(backend.isExternal(a));
		assertEquals(Outcome.SAT, backend.solve(new int[] { a }));
	}

	@Test
	public void testAssignNonExternal() {
		final int a = backend.addAtom();
		backend.assignExternal(a, false);
		assertFalse(backend.isExternal(a));
		assertNull(backend.external(a));
		assertEquals(Outcome.SAT, backend.solve(new int[] { a }));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testExternalUnknownAtom() {
		backend.setExternal(3, TruthValue.TRUE);
	}

	@Test
	public void testTheoryAtoms() {
		final TheoryTerm tel0 = TheoryTerm.function("tel", TheoryTerm.number(0));
		final int a = backend.addTheoryAtom(tel0, TheoryTerm.symbol("p"));
		assertEquals(a, backend.addTheoryAtom(TheoryTerm.function("tel", TheoryTerm.number(0)), TheoryTerm.symbol("p")));
		final int b = backend.addTheoryAtom(tel0, TheoryTerm.symbol("q"));
		assertTrue(a != b);

		final List<TheoryAtom> atoms = backend.newTheoryAtoms();
		assertEquals(2, atoms.size());
		assertEquals(a, atoms.get(0).literal());
		assertEquals("p", atoms.get(0).elements().get(0).toString());
		assertEquals("&tel(0){p}", atoms.get(0).toString());
		assertTrue(backend.newTheoryAtoms().isEmpty());

		backend.addTheoryAtom(tel0, TheoryTerm.symbol("q"));
		assertTrue(backend.newTheoryAtoms().isEmpty());
		backend.addTheoryAtom(tel0, TheoryTerm.symbol("r"));
		assertEquals(1, backend.newTheoryAtoms().size());
	}

	@Test
	public void testBudget() {
		final int a = backend.addAtom(), b = backend.addAtom();
		backend.addClause(a, b);
		backend.setBudget(0, 60);
		assertEquals(Outcome.SAT, backend.solve(new int[0]));
		backend.setBudget(100, 60);
		assertEquals(Outcome.UNSAT, backend.solve(new int[] { -a, -b }));
	}
}
