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

import wyheap.core.Program;
import wyheap.core.Program.Expr;

/**
 * A universal quantifier whose body is either a resource (i.e. an access
 * predicate or magic wand) or an implication whose right-hand side is a
 * resource. For example, <code>forall i :: 0 <= i && i < n ==> acc(a[i].f)</code>.
 *
 * @author David J. Pearce
 *
 */
public class QuantifiedPermissionAssertion {
	private final Expr.UniversalQuantifier quantifier;
	private final Expr condition;
	private final Expr resource;

	private QuantifiedPermissionAssertion(Expr.UniversalQuantifier quantifier, Expr condition, Expr resource) {
		this.quantifier = quantifier;
		this.condition = condition;
		this.resource = resource;
	}

	public Expr.UniversalQuantifier getQuantifier() {
		return quantifier;
	}

	public Expr getCondition() {
		return condition;
	}

	public Expr getResource() {
		return resource;
	}

	/**
	 * Attempt to match a given assertion as a quantified permission assertion.
	 *
	 * @param assertion
	 * @return The match, or <code>null</code> if the assertion does not have
	 *         the required shape.
	 */
	public static QuantifiedPermissionAssertion match(Expr assertion) {
		if (assertion instanceof Expr.UniversalQuantifier) {
			Expr.UniversalQuantifier q = (Expr.UniversalQuantifier) assertion;
			Expr body = q.getBody();
			if (isResource(body)) {
				return new QuantifiedPermissionAssertion(q, Program.CONST(true), body);
			} else if (body instanceof Expr.Implies && isResource(((Expr.Implies) body).getRightHandSide())) {
				Expr.Implies i = (Expr.Implies) body;
				return new QuantifiedPermissionAssertion(q, i.getLeftHandSide(), i.getRightHandSide());
			}
		}
		return null;
	}

	private static boolean isResource(Expr e) {
		return e instanceof Expr.AccessPredicate || e instanceof Expr.MagicWand;
	}
}
