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
package wyheap.core;

import static org.junit.jupiter.api.Assertions.*;
import static wyheap.core.Logic.*;

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Test;

import wyheap.core.Logic.Sort;
import wyheap.core.Logic.Term;

public class LogicTests {
	private static final Term A = VAR("a", Sort.Bool);
	private static final Term B = VAR("b", Sort.Bool);
	private static final Term P = VAR("p", Sort.Perm);

	@Test
	public void test_conjunction() {
		assertSame(TRUE, AND());
		assertSame(A, AND(TRUE, A));
		assertSame(FALSE, AND(A, FALSE));
		Term ab = AND(A, B);
		assertEquals(Arrays.asList(A, B, A), AND(ab, TRUE, A).getOperands());
	}

	@Test
	public void test_negation() {
		assertSame(FALSE, NOT(CONST(true)));
		assertSame(A, NOT(NOT(A)));
	}

	@Test
	public void test_implication() {
		assertSame(A, IMPLIES(TRUE, A));
		assertSame(TRUE, IMPLIES(A, TRUE));
		assertSame(B, ITE(TRUE, B, A));
	}

	@Test
	public void test_permissions() {
		assertSame(P, PERM_TIMES(FULL, P));
		assertSame(P, PERM_TIMES(P, FULL));
		assertSame(NONE, PERM_TIMES(P, NONE));
		assertSame(P, PERM_PLUS(NONE, P));
		assertSame(P, PERM_MINUS(P, NONE));
		assertEquals(PERM_TIMES(FRACTION(1, 2), P), PERM_TIMES(FRACTION(1, 2), P));
		assertNotEquals(PERM_TIMES(FRACTION(1, 2), P), PERM_TIMES(FRACTION(1, 3), P));
	}

	@Test
	public void test_sorts() {
		assertThrows(IllegalArgumentException.class, () -> EQ(A, P));
		assertEquals(Sort.Ref, NULL.getSort());
		assertEquals(Sort.PHeap, COMBINE(VAR("h", Sort.PHeap), VAR("g", Sort.PHeap)).getSort());
		assertEquals(new Sort.FieldValueFunction(Sort.Int), new Sort.FieldValueFunction(Sort.Int));
		assertNotEquals(new Sort.FieldValueFunction(Sort.Int), new Sort.FieldValueFunction(Sort.Bool));
	}

	@Test
	public void test_convert() {
		Term h = VAR("h", Sort.PHeap);
		assertSame(h, CONVERT(h, Sort.PHeap));
		Term s = CONVERT(h, Sort.Snap);
		assertTrue(s instanceof Term.SortWrapper);
		assertEquals(Sort.Snap, s.getSort());
	}

	@Test
	public void test_quantifiers() {
		assertSame(A, FORALL(Collections.emptyList(), A, Collections.emptyList()));
		assertSame(TRUE, FORALL(Arrays.asList(VAR("x", Sort.Int)), TRUE, Collections.emptyList()));
		Term.Var x = VAR("x", Sort.Ref);
		Term lookup = LOOKUP_FIELD("f", Sort.Int, VAR("h", Sort.PHeap), x);
		Term q = FORALL(Arrays.asList(x), EQ(lookup, CONST(1)), Arrays.asList(TRIGGER(lookup)));
		assertEquals(Arrays.asList(EQ(lookup, CONST(1)), lookup), q.getOperands());
		Term r = FORALL(Arrays.asList(x), EQ(lookup, CONST(1)), Collections.emptyList());
		assertNotEquals(q, r);
	}

	@Test
	public void test_limited_symbol() {
		Fun f = new Fun("f", Arrays.asList(Sort.PHeap, Sort.Ref), Sort.Int);
		assertFalse(f.isLimited());
		Fun g = f.limited();
		assertTrue(g.isLimited());
		assertEquals("f%limited", g.getName());
		assertEquals(f.getParameters(), g.getParameters());
		assertNotEquals(APP(f, VAR("h", Sort.PHeap), VAR("x", Sort.Ref)),
				APP(g, VAR("h", Sort.PHeap), VAR("x", Sort.Ref)));
	}

	@Test
	public void test_to_sort() {
		assertEquals(Sort.Int, toSort(Program.Type.Int));
		assertEquals(Sort.Ref, toSort(Program.Type.Ref));
		assertEquals(Sort.Perm, toSort(Program.Type.Perm));
		assertEquals(Sort.Bool, toSort(Program.Type.Bool));
	}
}
