// Copyright 2020 The Whiley Project Developers
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package wyheap.io;

import static org.junit.jupiter.api.Assertions.*;
import static wyheap.core.Program.*;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

import wyheap.core.Program.Decl;
import wyheap.core.Program.Type;

public class AssertionPrinterTests {
	private static final Decl.Field F = new Decl.Field("f", Type.Int);
	private static final Decl.Parameter X = new Decl.Parameter("x", Type.Ref);
	private static final Decl.Parameter B = new Decl.Parameter("b", Type.Bool);

	@Test
	public void test_implication() {
		assertEquals("b ==> acc(x.f, 1 / 2)",
				AssertionPrinter.toString(IMPLIES(VAR(B), ACC(FIELD(VAR(X), F), FRACTION(1, 2)))));
	}

	@Test
	public void test_unfolding() {
		assertEquals("unfolding acc(P(x), write) in x.f > 0", AssertionPrinter
				.toString(UNFOLDING(ACC(PREDICATE("P", VAR(X)), WRITE()), GT(FIELD(VAR(X), F), CONST(0)))));
	}

	@Test
	public void test_let_and_inhale_exhale() {
		assertEquals("let x == (null) in [x == null, true]",
				AssertionPrinter.toString(LET(X, NULL(), INHALE_EXHALE(EQ(VAR(X), NULL()), CONST(true)))));
	}

	@Test
	public void test_invoke_and_perm() {
		assertEquals("g(x, perm(x.f))", AssertionPrinter
				.toString(INVOKE("g", Arrays.asList(VAR(X), PERM(FIELD(VAR(X), F))), Type.Int)));
	}
}
