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
package wyheap.functions;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

import wyheap.core.Logic;
import wyheap.core.Logic.Sort;
import wyheap.core.Logic.Term;
import wyheap.io.TermPrinter;

public class SnapshotAxiomsTests {

	@Test
	public void test_field_axiom() {
		Term.Quantification q = (Term.Quantification) SnapshotAxioms.forField("f", Sort.Int);
		assertTrue(q.isUniversal());
		assertEquals(Arrays.asList(Logic.VAR("r", Sort.Ref), Logic.VAR("v", Sort.Int), Logic.VAR("h", Sort.PHeap)),
				q.getVariables());
		assertEquals(1, q.getTriggers().size());
		assertEquals("forall r: Ref, v: Int, h: PHeap :: { PHeap.lookup_f(PHeap.combine(PHeap.singleton_f(r, v), h), r) } "
				+ "PHeap.lookup_f(PHeap.combine(PHeap.singleton_f(r, v), h), r) == v", TermPrinter.toString(q));
	}

	@Test
	public void test_predicate_axiom() {
		Term.Quantification q = (Term.Quantification) SnapshotAxioms.forPredicate("P",
				Arrays.asList(Sort.Ref, Sort.Int));
		assertEquals(4, q.getVariables().size());
		Term.Equals body = (Term.Equals) q.getBody();
		assertTrue(body.getLeftHandSide() instanceof Term.LookupPredicate);
		assertEquals(Logic.VAR("v", Sort.PHeap), body.getRightHandSide());
	}

	@Test
	public void test_combine_associativity() {
		Term.Quantification q = (Term.Quantification) SnapshotAxioms.combineAssociativity();
		assertEquals(3, q.getVariables().size());
		assertEquals("forall a: PHeap, b: PHeap, c: PHeap :: { PHeap.combine(a, PHeap.combine(b, c)) } "
				+ "PHeap.combine(a, PHeap.combine(b, c)) == PHeap.combine(PHeap.combine(a, b), c)",
				TermPrinter.toString(q));
	}
}
