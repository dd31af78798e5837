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
import static wyheap.core.Program.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import wyheap.core.Program.Decl;
import wyheap.core.Program.Expr;
import wyheap.core.Program.Type;

public class MagicWandIdentifierTests {
	private static final Decl.Field F = new Decl.Field("f", Type.Int);
	private static final Decl.Field G = new Decl.Field("g", Type.Int);
	private static final Decl.Parameter X = new Decl.Parameter("x", Type.Ref);
	private static final Decl.Parameter Y = new Decl.Parameter("y", Type.Ref);
	private static final Decl.Parameter R = new Decl.Parameter("r", Type.Ref);

	@Test
	public void test_abstracts_free_variables() {
		MagicWandIdentifier id = MagicWandIdentifier.of(WAND(ACC(FIELD(VAR(X), F), WRITE()),
				ACC(FIELD(VAR(Y), G), FRACTION(1, 2))));
		assertEquals("acc($0.f, write) --* acc($1.g, 1 / 2)", id.getName());
		List<Expr> subexpressions = id.getSubexpressions();
		assertEquals(2, subexpressions.size());
		assertEquals("x", ((Expr.VariableAccess) subexpressions.get(0)).getVariable());
		assertEquals("y", ((Expr.VariableAccess) subexpressions.get(1)).getVariable());
	}

	@Test
	public void test_repeated_variable_shares_placeholder() {
		MagicWandIdentifier id = MagicWandIdentifier.of(WAND(ACC(FIELD(VAR(X), F), WRITE()),
				ACC(FIELD(VAR(X), G), WRITE())));
		assertEquals("acc($0.f, write) --* acc($0.g, write)", id.getName());
		assertEquals(1, id.getSubexpressions().size());
	}

	@Test
	public void test_same_shape_same_identity() {
		MagicWandIdentifier a = MagicWandIdentifier.of(WAND(ACC(FIELD(VAR(X), F), WRITE()), CONST(true)));
		MagicWandIdentifier b = MagicWandIdentifier.of(WAND(ACC(FIELD(VAR(Y), F), WRITE()), CONST(true)));
		MagicWandIdentifier c = MagicWandIdentifier.of(WAND(ACC(FIELD(VAR(Y), G), WRITE()), CONST(true)));
		assertEquals(a, b);
		assertEquals(a.hashCode(), b.hashCode());
		assertNotEquals(a, c);
	}

	@Test
	public void test_bound_variables_kept() {
		MagicWandIdentifier id = MagicWandIdentifier.of(WAND(CONST(true),
				FORALL(R, IMPLIES(EQ(VAR(R), VAR(X)), ACC(FIELD(VAR(R), F), WRITE())))));
		assertEquals("true --* (forall r :: (r == $0) ==> acc(r.f, write))", id.getName());
		assertEquals(1, id.getSubexpressions().size());
	}
}
