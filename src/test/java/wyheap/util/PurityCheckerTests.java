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
package wyheap.util;

import static org.junit.jupiter.api.Assertions.*;
import static wyheap.core.Program.*;

import java.util.Arrays;
import java.util.stream.Stream;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import wyheap.core.Program.Decl;
import wyheap.core.Program.Expr;
import wyheap.core.Program.Type;

public class PurityCheckerTests {
	private static final Decl.Field F = new Decl.Field("f", Type.Int);
	private static final Decl.Parameter X = new Decl.Parameter("x", Type.Ref);
	private static final Decl.Parameter B = new Decl.Parameter("b", Type.Bool);

	private static Expr acc() {
		return ACC(FIELD(VAR(X), F), WRITE());
	}

	private static Stream<Expr> pure() {
		return Stream.of(CONST(true), GT(FIELD(VAR(X), F), CONST(0)), IMPLIES(VAR(B), NEQ(VAR(X), NULL())),
				EQ(PERM(FIELD(VAR(X), F)), WRITE()), INVOKE("g", VAR(X), Type.Int),
				UNFOLDING(ACC(PREDICATE("P", VAR(X)), WRITE()), FIELD(VAR(X), F)),
				APPLYING(WAND(acc(), acc()), CONST(true)), FORALL(X, NEQ(VAR(X), NULL())),
				LET(X, NULL(), EQ(VAR(X), NULL())), INHALE_EXHALE(CONST(true), VAR(B)));
	}

	private static Stream<Expr> impure() {
		return Stream.of(acc(), ACC(PREDICATE("P", Arrays.asList((Expr) VAR(X))), FRACTION(1, 2)),
				WAND(acc(), CONST(true)), IMPLIES(VAR(B), acc()), ITE(VAR(B), CONST(true), acc()),
				AND(CONST(true), acc()), FORALL(X, acc()), LET(X, NULL(), acc()), INHALE_EXHALE(acc(), CONST(true)),
				INHALE_EXHALE(CONST(true), acc()));
	}

	@ParameterizedTest
	@MethodSource("pure")
	public void test_pure(Expr e) {
		assertTrue(PurityChecker.isPure(e));
	}

	@ParameterizedTest
	@MethodSource("impure")
	public void test_impure(Expr e) {
		assertFalse(PurityChecker.isPure(e));
	}
}
