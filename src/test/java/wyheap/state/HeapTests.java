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
package wyheap.state;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Test;

import wyheap.core.Logic;
import wyheap.core.Logic.Sort;
import wyheap.core.Logic.Term;

public class HeapTests {
	private static final Term X = Logic.VAR("x", Sort.Ref);
	private static final Term Y = Logic.VAR("y", Sort.Ref);

	private static Chunk.Basic field(String name, Term receiver, Term perm) {
		return new Chunk.Basic(Chunk.Kind.FIELD, name, Arrays.asList(receiver), Logic.VAR("v", Sort.Int), perm);
	}

	@Test
	public void test_add_is_persistent() {
		Chunk c = field("f", X, Logic.FULL);
		Heap h = Heap.EMPTY.add(c);
		assertTrue(Heap.EMPTY.isEmpty());
		assertEquals(Arrays.asList(c), h.values());
	}

	@Test
	public void test_replace_keeps_position() {
		Chunk.Basic a = field("f", X, Logic.FRACTION(1, 2));
		Chunk.Basic b = field("g", Y, Logic.FULL);
		Heap h = Heap.EMPTY.add(a).add(b);
		Chunk.Basic merged = a.withPermission(Logic.FULL);
		assertEquals(Arrays.asList(merged, b), h.replace(a, merged).values());
		assertEquals(Arrays.asList(a, b), h.values());
	}

	@Test
	public void test_same_identity() {
		Chunk.Basic a = field("f", X, Logic.FULL);
		assertTrue(a.hasSameIdentity(field("f", X, Logic.NONE)));
		assertFalse(a.hasSameIdentity(field("f", Y, Logic.FULL)));
		assertFalse(a.hasSameIdentity(field("g", X, Logic.FULL)));
		assertFalse(a.hasSameIdentity(
				new Chunk.Basic(Chunk.Kind.PREDICATE, "f", Arrays.asList(X), Logic.VAR("s", Sort.PHeap), Logic.FULL)));
	}

	@Test
	public void test_filter() {
		Chunk.Quantified q = new Chunk.Quantified(Chunk.Kind.FIELD, "f",
				Collections.singletonList(Logic.VAR("r", Sort.Ref)), Logic.VAR("sm", new Sort.FieldValueFunction(Sort.Int)),
				Logic.TRUE, Logic.FULL, null);
		Heap h = Heap.EMPTY.add(field("f", X, Logic.FULL)).add(q);
		assertEquals(Arrays.asList(q), h.filter(Chunk.Quantified.class));
		assertEquals(1, h.filter(Chunk.Basic.class).size());
		assertFalse(q.isSingleton());
	}
}
