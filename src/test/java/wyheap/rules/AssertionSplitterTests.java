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
package wyheap.rules;

import static org.junit.jupiter.api.Assertions.*;
import static wyheap.core.Program.*;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import wyheap.core.Program.Decl;
import wyheap.core.Program.Expr;
import wyheap.core.Program.Type;

public class AssertionSplitterTests {
	private static final Decl.Parameter B = new Decl.Parameter("b", Type.Bool);
	private static final Decl.Parameter C = new Decl.Parameter("c", Type.Bool);
	private static final Decl.Parameter D = new Decl.Parameter("d", Type.Bool);

	@Test
	public void test_nested_conjunctions() {
		Expr b = VAR(B), c = VAR(C), d = VAR(D);
		List<Expr> conjuncts = AssertionSplitter.split(AND(AND(b, c), d));
		assertEquals(3, conjuncts.size());
		assertSame(b, conjuncts.get(0));
		assertSame(c, conjuncts.get(1));
		assertSame(d, conjuncts.get(2));
	}

	@Test
	public void test_disjunction_not_split() {
		Expr e = OR(VAR(B), VAR(C));
		assertEquals(Arrays.asList(e), AssertionSplitter.split(e));
	}

	@Test
	public void test_inhale_exhale_kept_by_split() {
		Expr ie = INHALE_EXHALE(VAR(B), VAR(C));
		assertSame(ie, AssertionSplitter.split(ie).get(0));
	}

	@Test
	public void test_inhale_exhale_when_inhaling() {
		Expr b = VAR(B), c = VAR(C), d = VAR(D);
		List<Expr> conjuncts = AssertionSplitter.splitWhenInhaling(AND(INHALE_EXHALE(AND(b, c), VAR(D)), d));
		assertEquals(3, conjuncts.size());
		assertSame(b, conjuncts.get(0));
		assertSame(c, conjuncts.get(1));
		assertSame(d, conjuncts.get(2));
	}

	@Test
	public void test_nested_inhale_exhale_untouched() {
		Expr i = IMPLIES(VAR(B), INHALE_EXHALE(VAR(C), VAR(D)));
		assertSame(i, AssertionSplitter.splitWhenInhaling(i).get(0));
	}
}
