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
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import horizon.ast.Signature;

/**
 * A temporal program: the parts that ground it, step by step, and the
 * signatures of the predicates that refer to future steps. Atoms of a future
 * signature whose time argument lies beyond the attempted length are assumed
 * false.
 *
 * @specfield parts: seq ProgramPart
 * @specfield futureSignatures: set Signature
 */
public final class Program {

	private final List<ProgramPart> parts;
	private final Set<Signature> futureSignatures;

	public Program(List<? extends ProgramPart> parts, Set<Signature> futureSignatures) {
		this.parts = Collections.unmodifiableList(new ArrayList<ProgramPart>(parts));
		this.futureSignatures = Collections.unmodifiableSet(new LinkedHashSet<Signature>(futureSignatures));
	}

	public Program(ProgramPart... parts) {
		this(Arrays.asList(parts), Collections.<Signature>emptySet());
	}

	public List<ProgramPart> parts() {
		return parts;
	}

	public Set<Signature> futureSignatures() {
		return futureSignatures;
	}

	/**
	 * Grounds every part of this program at the given step.
	 */
	public void ground(Backend backend, int step) {
		for (ProgramPart part : parts)
			part.groundAt(backend, step);
	}

	@Override
	public String toString() {
		return "Program" + parts + " future " + futureSignatures;
	}
}
