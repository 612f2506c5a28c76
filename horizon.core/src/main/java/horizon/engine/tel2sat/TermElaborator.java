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
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import horizon.ast.Formula;
import horizon.ast.MalformedFormulaException;
import horizon.ast.Symbol;
import horizon.ast.TheoryTerm;
import horizon.ast.operator.BoolOperator;
import horizon.ast.operator.TemporalOperator;

/**
 * Elaborates raw theory terms into formulas of a {@link TheoryStore}.
 *
 * Operators are functions named after their symbol. Temporal operators take
 * one or two arguments; with one argument the left operand is missing.
 * <pre>
 *   &amp; | &lt;&gt; &lt;- -&gt;     boolean connectives
 *   ~                  negation
 *   &lt; &lt;:               previous, weak previous
 *   &lt;&lt;                 initially
 *   &lt;? &lt;*             since, trigger
 *   &gt; &gt;:               next, weak next
 *   &gt;? &gt;*             until, release
 *   &gt;&gt;                 finally
 *   &amp;initial &amp;final   first and last step
 *   &amp;true &amp;false     constants
 * </pre>
 * Anything else names an atom; a leading <code>-</code> negates it
 * classically.
 *
 * @specfield store: TheoryStore
 */
public final class TermElaborator {

	/** The atom that holds exactly at the first step. */
	public static final String INITIAL = "__initial";
	/** The atom that holds exactly at the last step. */
	public static final String FINAL = "__final";

	private static final Set<String> TEMPORAL = Collections.unmodifiableSet(new HashSet<String>(
			Arrays.asList("<", ">", "<:", ">:", "<*", ">*", ">?", "<?", ">>", "<<")));

	private final TheoryStore store;

	TermElaborator(TheoryStore store) {
		this.store = store;
	}

	/**
	 * Returns true if the given name is reserved for an operator.
	 */
	private static boolean operator(String name) {
		return BoolOperator.forSymbol(name) != null || "~".equals(name) || TEMPORAL.contains(name);
	}

	/**
	 * Returns the interned formula denoted by the given term.
	 *
	 * @throws MalformedFormulaException
	 *             the term does not denote a formula
	 */
	public Formula elaborate(TheoryTerm term) {
		switch (term.type()) {
		case SYMBOL:
			return atom(term, true);
		case FUNCTION:
			final String name = term.name();
			final List<TheoryTerm> args = term.arguments();
			final BoolOperator op = BoolOperator.forSymbol(name);
			if (op != null && args.size() == 2)
				return store.binary(op, elaborate(args.get(0)), elaborate(args.get(1)));
			if ("~".equals(name) && args.size() == 1)
				return store.not(elaborate(args.get(0)));
			if (TEMPORAL.contains(name))
				return temporal(term);
			if ("&".equals(name))
				return special(term);
			return atom(term, true);
		default:
			throw new MalformedFormulaException("invalid temporal formula: " + term);
		}
	}

	private Formula temporal(TheoryTerm term) {
		final String name = term.name();
		final List<TheoryTerm> args = term.arguments();
		if (args.size() < 1 || args.size() > 2)
			throw new MalformedFormulaException("invalid temporal formula: " + term);
		final Formula lhs = args.size() == 1 ? null : elaborate(args.get(0));
		final Formula rhs = elaborate(args.get(args.size() - 1));
		if ("<".equals(name) || "<:".equals(name))
			return store.previous(rhs, "<:".equals(name));
		if ("<<".equals(name))
			return store.initially(rhs);
		if ("<?".equals(name))
			return store.past(TemporalOperator.SINCE, lhs, rhs);
		if ("<*".equals(name))
			return store.past(TemporalOperator.TRIGGER, lhs, rhs);
		if (">".equals(name) || ">:".equals(name))
			return store.next(rhs, ">:".equals(name));
		if (">?".equals(name))
			return store.future(TemporalOperator.SINCE, lhs, rhs);
		if (">*".equals(name))
			return store.future(TemporalOperator.TRIGGER, lhs, rhs);
		assert ">>".equals(name);
		final Formula notFinal = store.not(store.atom(FINAL));
		return store.future(TemporalOperator.TRIGGER, null, store.binary(BoolOperator.OR, notFinal, rhs));
	}

	private Formula special(TheoryTerm term) {
		final TheoryTerm arg = term.arguments().isEmpty() ? null : term.arguments().get(0);
		if (arg == null || arg.type() != TheoryTerm.Type.SYMBOL)
			throw new MalformedFormulaException("invalid temporal formula: " + term);
		if ("initial".equals(arg.name()))
			return store.atom(INITIAL);
		if ("final".equals(arg.name()))
			return store.atom(FINAL);
		if ("true".equals(arg.name()) || "false".equals(arg.name()))
			return store.constant("true".equals(arg.name()));
		throw new MalformedFormulaException("unknown identifier: " + term);
	}

	private Formula atom(TheoryTerm term, boolean positive) {
		if (term.type() == TheoryTerm.Type.SYMBOL)
			return store.atom(term.name(), Collections.<Symbol>emptyList(), positive);
		if (term.type() == TheoryTerm.Type.FUNCTION) {
			if ("-".equals(term.name()) && term.arguments().size() == 1)
				return atom(term.arguments().get(0), !positive);
			if (!operator(term.name())) {
				final List<Symbol> args = new ArrayList<Symbol>();
				for (TheoryTerm arg : term.arguments())
					args.add(symbol(arg));
				return store.atom(term.name(), args, positive);
			}
		}
		throw new MalformedFormulaException("invalid atom: " + term);
	}

	/**
	 * Returns the ground symbol denoted by the given term.
	 *
	 * @throws MalformedFormulaException
	 *             the term is a list, a set or an operator
	 */
	public static Symbol symbol(TheoryTerm term) {
		switch (term.type()) {
		case NUMBER:
			return Symbol.number(term.number());
		case LIST:
		case SET:
			throw new MalformedFormulaException("invalid symbol: " + term);
		default:
			final String name = term.type() == TheoryTerm.Type.TUPLE ? "" : term.name();
			if (operator(name))
				throw new MalformedFormulaException("invalid symbol: " + term);
			final List<TheoryTerm> args = term.type() == TheoryTerm.Type.SYMBOL
					? Collections.<TheoryTerm>emptyList() : term.arguments();
			if (args.isEmpty()) {
				if ("#inf".equals(name))
					return Symbol.INFIMUM;
				if ("#sup".equals(name))
					return Symbol.SUPREMUM;
				if (name.length() > 1 && name.startsWith("\"") && name.endsWith("\""))
					return Symbol.string(name.substring(1, name.length() - 1));
			}
			if ("-".equals(name) && args.size() == 1) {
				final Symbol negated = symbol(args.get(0));
				if (negated.type() == Symbol.Type.NUMBER)
					return Symbol.number(-negated.number());
				if (negated.type() == Symbol.Type.FUNCTION && !negated.name().isEmpty())
					return Symbol.function(negated.name(), negated.arguments(), !negated.positive());
				throw new MalformedFormulaException("invalid symbol: " + term);
			}
			final List<Symbol> symbols = new ArrayList<Symbol>();
			for (TheoryTerm arg : args)
				symbols.add(symbol(arg));
			return Symbol.function(name, symbols, true);
		}
	}

	@Override
	public String toString() {
		return "TermElaborator(" + store + ")";
	}
}
