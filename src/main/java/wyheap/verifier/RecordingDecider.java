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
package wyheap.verifier;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;

import wyheap.core.Logic;
import wyheap.core.Logic.Sort;
import wyheap.core.Logic.SuffixedIdentifier;
import wyheap.core.Logic.Term;

/**
 * A decider which performs no real reasoning, but simply records the facts
 * assumed along the current path. Fresh symbols are numbered from a single
 * counter, so all names are distinct regardless of prefix. Checks succeed
 * only for facts which were assumed verbatim, for comparisons between
 * constant permission amounts, and on paths which are trivially infeasible
 * (i.e. which assume <code>false</code>, a false constant comparison, or
 * both a fact and its negation).
 *
 * @author David J. Pearce
 *
 */
public class RecordingDecider implements Decider {
	private final ArrayList<ArrayList<Term>> scopes = new ArrayList<>();
	private int counter;

	public RecordingDecider() {
		scopes.add(new ArrayList<>());
	}

	@Override
	public void assume(Term fact) {
		if (fact != Logic.TRUE) {
			scopes.get(scopes.size() - 1).add(fact);
		}
	}

	@Override
	public void assume(List<Term> facts) {
		for (Term fact : facts) {
			assume(fact);
		}
	}

	@Override
	public boolean check(Term fact) {
		List<Term> pcs = getPathConditions();
		if (isInfeasible(pcs) || fact == Logic.TRUE || pcs.contains(fact)) {
			return true;
		} else if (fact instanceof Term.And) {
			for (Term conjunct : fact.getOperands()) {
				if (!check(conjunct)) {
					return false;
				}
			}
			return true;
		}
		return evaluate(fact) == Boolean.TRUE;
	}

	@Override
	public Term.Var fresh(String prefix, Sort sort) {
		return Logic.VAR(new SuffixedIdentifier(prefix, Integer.toString(counter++)), sort);
	}

	@Override
	public void pushScope() {
		scopes.add(new ArrayList<>());
	}

	@Override
	public void popScope() {
		if (scopes.size() == 1) {
			throw new IllegalStateException("no scope to pop");
		}
		scopes.remove(scopes.size() - 1);
	}

	@Override
	public List<Term> getPathConditions() {
		ArrayList<Term> result = new ArrayList<>();
		for (List<Term> scope : scopes) {
			result.addAll(scope);
		}
		return Collections.unmodifiableList(result);
	}

	private static boolean isInfeasible(List<Term> pcs) {
		HashSet<Term> facts = new HashSet<>(pcs);
		for (Term pc : pcs) {
			if (pc == Logic.FALSE || evaluate(pc) == Boolean.FALSE || facts.contains(Logic.NOT(pc))) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Evaluate a comparison between constant permission amounts.
	 *
	 * @param fact
	 * @return The truth value of the fact, or <code>null</code> if this is not
	 *         a comparison of constants.
	 */
	private static Boolean evaluate(Term fact) {
		if (fact instanceof Term.Not) {
			Boolean b = evaluate(((Term.Not) fact).getOperand());
			return b == null ? null : !b;
		} else if (fact instanceof Term.PermLess || fact instanceof Term.PermAtMost) {
			BigInteger[] lhs = permission(fact.getOperands().get(0));
			BigInteger[] rhs = permission(fact.getOperands().get(1));
			if (lhs == null || rhs == null) {
				return null;
			}
			int c = lhs[0].multiply(rhs[1]).compareTo(rhs[0].multiply(lhs[1]));
			return fact instanceof Term.PermLess ? c < 0 : c <= 0;
		}
		return null;
	}

	/**
	 * Determine the value of a constant permission amount as a fraction with a
	 * positive denominator.
	 *
	 * @param t
	 * @return
	 */
	private static BigInteger[] permission(Term t) {
		if (t instanceof Term.FullPerm) {
			return new BigInteger[] { BigInteger.ONE, BigInteger.ONE };
		} else if (t instanceof Term.NoPerm) {
			return new BigInteger[] { BigInteger.ZERO, BigInteger.ONE };
		} else if (t instanceof Term.FractionPerm) {
			Term.FractionPerm f = (Term.FractionPerm) t;
			if (!(f.getNumerator() instanceof Term.IntLiteral) || !(f.getDenominator() instanceof Term.IntLiteral)) {
				return null;
			}
			BigInteger n = ((Term.IntLiteral) f.getNumerator()).getValue();
			BigInteger d = ((Term.IntLiteral) f.getDenominator()).getValue();
			if (d.signum() == 0) {
				return null;
			}
			return d.signum() < 0 ? new BigInteger[] { n.negate(), d.negate() } : new BigInteger[] { n, d };
		} else if (t instanceof Term.PermTimes || t instanceof Term.PermPlus || t instanceof Term.PermMinus) {
			BigInteger[] l = permission(t.getOperands().get(0));
			BigInteger[] r = permission(t.getOperands().get(1));
			if (l == null || r == null) {
				return null;
			} else if (t instanceof Term.PermTimes) {
				return new BigInteger[] { l[0].multiply(r[0]), l[1].multiply(r[1]) };
			}
			BigInteger n = r[0].multiply(l[1]);
			n = t instanceof Term.PermPlus ? n : n.negate();
			return new BigInteger[] { l[0].multiply(r[1]).add(n), l[1].multiply(r[1]) };
		}
		return null;
	}
}
