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

import java.util.ArrayList;
import java.util.List;

import wyheap.core.Program.Expr;

/**
 * Decomposes assertions into their top-level conjuncts, preserving their
 * order from left to right. For example, <code>(a && b) && (c ==> d)</code>
 * splits into <code>a</code>, <code>b</code> and <code>c ==> d</code>.
 *
 * @author David J. Pearce
 *
 */
public class AssertionSplitter {

	public static List<Expr> split(Expr assertion) {
		ArrayList<Expr> conjuncts = new ArrayList<>();
		split(assertion, conjuncts);
		return conjuncts;
	}

	/**
	 * Split an assertion as seen when inhaling it, where any top-level
	 * inhale-exhale assertion behaves as its inhale part.
	 *
	 * @param assertion
	 * @return
	 */
	public static List<Expr> splitWhenInhaling(Expr assertion) {
		ArrayList<Expr> conjuncts = new ArrayList<>();
		for (Expr conjunct : split(assertion)) {
			if (conjunct instanceof Expr.InhaleExhale) {
				conjuncts.addAll(splitWhenInhaling(((Expr.InhaleExhale) conjunct).getInhale()));
			} else {
				conjuncts.add(conjunct);
			}
		}
		return conjuncts;
	}

	private static void split(Expr assertion, List<Expr> conjuncts) {
		if (assertion instanceof Expr.LogicalAnd) {
			Expr.LogicalAnd e = (Expr.LogicalAnd) assertion;
			split(e.getLeftHandSide(), conjuncts);
			split(e.getRightHandSide(), conjuncts);
		} else {
			conjuncts.add(assertion);
		}
	}
}
