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

import static wyheap.core.Logic.*;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import wyheap.core.Logic.Fun;
import wyheap.core.Logic.Sort;
import wyheap.core.Logic.Term;
import wyheap.core.Logic.Term.Arithmetic.Operator;
import wyheap.core.Program.Decl;
import wyheap.core.Program.Expr;
import wyheap.state.Chunk;
import wyheap.state.State;
import wyheap.state.Store;
import wyheap.util.PurityChecker;
import wyheap.util.Util;
import wyheap.util.VariableSubstitution;
import wyheap.verifier.Decider;
import wyheap.verifier.ErrorDescriptor;
import wyheap.verifier.VerificationError;
import wyheap.verifier.VerificationResult;
import wyheap.verifier.Verifier;

/**
 * Evaluates pure expressions against the current state. Field reads are
 * resolved against the chunks of the current heap, whilst function
 * applications are left uninterpreted over a fresh heap snapshot.
 *
 * @author David J. Pearce
 *
 */
public class ExpressionEvaluator implements Evaluator {
	private final Verifier verifier;

	public ExpressionEvaluator(Verifier verifier) {
		this.verifier = verifier;
	}

	@Override
	public VerificationResult eval(State s, Expr e, ErrorDescriptor pve, Continuation.OfTerm Q) {
		if (e instanceof Expr.Boolean) {
			return Q.apply(s, CONST(((Expr.Boolean) e).getValue()));
		} else if (e instanceof Expr.Integer) {
			return Q.apply(s, CONST(((Expr.Integer) e).getValue()));
		} else if (e instanceof Expr.Null) {
			return Q.apply(s, NULL);
		} else if (e instanceof Expr.FullPermission) {
			return Q.apply(s, FULL);
		} else if (e instanceof Expr.NoPermission) {
			return Q.apply(s, NONE);
		} else if (e instanceof Expr.WildcardPermission) {
			return evalWildcard(s, Q);
		} else if (e instanceof Expr.VariableAccess) {
			return evalVariable(s, e, ((Expr.VariableAccess) e).getVariable(), pve, Q);
		} else if (e instanceof Expr.Result) {
			return evalVariable(s, e, "result", pve, Q);
		} else if (e instanceof Expr.FieldAccess) {
			return evalFieldAccess(s, (Expr.FieldAccess) e, pve, Q);
		} else if (e instanceof Expr.CurrentPermission) {
			return evalCurrentPermission(s, (Expr.CurrentPermission) e, pve, Q);
		} else if (e instanceof Expr.AccessPredicate || e instanceof Expr.MagicWand || !PurityChecker.isPure(e)) {
			return failure(pve, e, "cannot evaluate impure assertion");
		} else if (e instanceof Expr.LogicalAnd || e instanceof Expr.LogicalOr || e instanceof Expr.Implies) {
			return evalShortCircuit(s, (Expr.BinaryOperator) e, pve, Q);
		} else if (e instanceof Expr.BinaryOperator) {
			Expr.BinaryOperator b = (Expr.BinaryOperator) e;
			return evals(s, Arrays.asList(b.getLeftHandSide(), b.getRightHandSide()), pve,
					(s1, ts) -> evalBinaryOperator(s1, b, ts.get(0), ts.get(1), pve, Q));
		} else if (e instanceof Expr.Negation) {
			return eval(s, ((Expr.Negation) e).getOperand(), pve, (s1, t) -> {
				if (t.getSort().equals(Sort.Perm)) {
					return Q.apply(s1, PERM_MINUS(NONE, t));
				}
				return Q.apply(s1, ARITH(Operator.MINUS, CONST(0), t));
			});
		} else if (e instanceof Expr.LogicalNot) {
			return eval(s, ((Expr.LogicalNot) e).getOperand(), pve, (s1, t) -> Q.apply(s1, NOT(t)));
		} else if (e instanceof Expr.Conditional) {
			return evalConditional(s, (Expr.Conditional) e, pve, Q);
		} else if (e instanceof Expr.Let) {
			return evalLet(s, (Expr.Let) e, pve, Q);
		} else if (e instanceof Expr.Quantifier) {
			Expr.Quantifier q = (Expr.Quantifier) e;
			boolean universal = q instanceof Expr.UniversalQuantifier;
			List<Expr.Trigger> triggers = universal ? ((Expr.UniversalQuantifier) q).getTriggers()
					: Collections.emptyList();
			return evalQuantified(s, universal, q.getParameters(), Collections.emptyList(),
					Collections.singletonList(q.getBody()), triggers, pve, (s1, vars, conds, bodies, tTriggers) -> {
						Term body = bodies.get(0);
						return Q.apply(s1, universal ? FORALL(vars, body, tTriggers) : EXISTS(vars, body, tTriggers));
					});
		} else if (e instanceof Expr.Unfolding) {
			return eval(s, ((Expr.Unfolding) e).getBody(), pve, Q);
		} else if (e instanceof Expr.Applying) {
			return eval(s, ((Expr.Applying) e).getBody(), pve, Q);
		} else if (e instanceof Expr.InhaleExhale) {
			return eval(s, ((Expr.InhaleExhale) e).getInhale(), pve, Q);
		} else if (e instanceof Expr.Invoke) {
			return evalInvoke(s, (Expr.Invoke) e, pve, Q);
		} else {
			throw new IllegalArgumentException("unknown expression encountered (" + e.getClass().getName() + ")");
		}
	}

	@Override
	public VerificationResult evals(State s, List<Expr> es, ErrorDescriptor pve, Continuation.OfTerms Q) {
		return evals(s, es, 0, Collections.emptyList(), pve, Q);
	}

	private VerificationResult evals(State s, List<Expr> es, int index, List<Term> ts, ErrorDescriptor pve,
			Continuation.OfTerms Q) {
		if (index == es.size()) {
			return Q.apply(s, ts);
		}
		return eval(s, es.get(index), pve, (s1, t) -> evals(s1, es, index + 1, Util.append(ts, t), pve, Q));
	}

	@Override
	public VerificationResult evalQuantified(State s, boolean universal, List<Decl.Parameter> variables,
			List<Expr> conditions, List<Expr> bodies, List<Expr.Trigger> triggers, ErrorDescriptor pve,
			Continuation.OfQuantified Q) {
		Decider decider = verifier.getDecider();
		Store original = s.getStore();
		Store store = original;
		ArrayList<Term.Var> vars = new ArrayList<>();
		for (Decl.Parameter p : variables) {
			Term.Var v = decider.fresh(p.getName(), toSort(p.getType()));
			vars.add(v);
			store = store.put(p.getName(), v);
		}
		return evals(s.withStore(store), conditions, pve,
				(s1, tConds) -> evals(s1, bodies, pve,
						(s2, tBodies) -> evalTriggers(s2, triggers, 0, Collections.emptyList(), pve,
								(s3, tTriggers) -> Q.apply(s3.withStore(original), vars, tConds, tBodies,
										tTriggers))));
	}

	private interface TriggerContinuation {
		VerificationResult apply(State state, List<Term.Trigger> triggers);
	}

	private VerificationResult evalTriggers(State s, List<Expr.Trigger> triggers, int index,
			List<Term.Trigger> tTriggers, ErrorDescriptor pve, TriggerContinuation Q) {
		if (index == triggers.size()) {
			return Q.apply(s, tTriggers);
		}
		return evals(s, triggers.get(index).getExpressions(), pve, (s1, ts) -> evalTriggers(s1, triggers,
				index + 1, Util.append(tTriggers, new Term.Trigger(ts)), pve, Q));
	}

	private VerificationResult evalWildcard(State s, Continuation.OfTerm Q) {
		Term.Var w = verifier.getDecider().fresh("wildcard", Sort.Perm);
		verifier.getDecider().assume(PERM_LESS(NONE, w));
		return Q.apply(s, w);
	}

	private VerificationResult evalVariable(State s, Expr e, String name, ErrorDescriptor pve,
			Continuation.OfTerm Q) {
		Term t = s.getStore().get(name);
		if (t == null) {
			return failure(pve, e, "unknown variable " + name);
		}
		return Q.apply(s, t);
	}

	private VerificationResult evalFieldAccess(State s, Expr.FieldAccess e, ErrorDescriptor pve,
			Continuation.OfTerm Q) {
		Sort sort = toSort(e.getField().getType());
		return eval(s, e.getReceiver(), pve, (s1, rcv) -> {
			List<Term> args = Collections.singletonList(rcv);
			for (Chunk c : s1.getHeap()) {
				if (c.getKind() != Chunk.Kind.FIELD || !c.getName().equals(e.getName())) {
					continue;
				} else if (c instanceof Chunk.Basic && ((Chunk.Basic) c).getArguments().equals(args)) {
					return Q.apply(s1, ((Chunk.Basic) c).getSnapshot());
				} else if (c instanceof Chunk.Quantified) {
					return Q.apply(s1, LOOKUP(sort, ((Chunk.Quantified) c).getSnapshotMap(), args));
				}
			}
			return failure(pve, e, "insufficient permission to access " + e.getName());
		});
	}

	private VerificationResult evalCurrentPermission(State s, Expr.CurrentPermission e, ErrorDescriptor pve,
			Continuation.OfTerm Q) {
		Expr.Location loc = e.getLocation();
		List<Expr> args;
		Chunk.Kind kind;
		if (loc instanceof Expr.FieldAccess) {
			args = Collections.singletonList(((Expr.FieldAccess) loc).getReceiver());
			kind = Chunk.Kind.FIELD;
		} else {
			args = ((Expr.PredicateAccess) loc).getArguments();
			kind = Chunk.Kind.PREDICATE;
		}
		return evals(s, args, pve, (s1, ts) -> {
			Term perm = NONE;
			for (Chunk c : s1.getHeap()) {
				if (c.getKind() != kind || !c.getName().equals(loc.getName())) {
					continue;
				} else if (c instanceof Chunk.Basic && ((Chunk.Basic) c).getArguments().equals(ts)) {
					perm = PERM_PLUS(perm, c.getPermission());
				} else if (c instanceof Chunk.Quantified) {
					Chunk.Quantified qc = (Chunk.Quantified) c;
					perm = PERM_PLUS(perm, new VariableSubstitution(qc.getFormals(), ts).transform(qc.getPermission()));
				}
			}
			return Q.apply(s1, perm);
		});
	}

	private VerificationResult evalBinaryOperator(State s, Expr.BinaryOperator e, Term l, Term r,
			ErrorDescriptor pve, Continuation.OfTerm Q) {
		boolean perm = l.getSort().equals(Sort.Perm) || r.getSort().equals(Sort.Perm);
		if (e instanceof Expr.FractionalPermission) {
			return isZero(r) ? failure(pve, e, "division by zero") : Q.apply(s, FRACTION(l, r));
		} else if (e instanceof Expr.Equals) {
			return Q.apply(s, EQ(l, r));
		} else if (e instanceof Expr.NotEquals) {
			return Q.apply(s, NOT(EQ(l, r)));
		} else if (e instanceof Expr.LessThan) {
			return Q.apply(s, perm ? PERM_LESS(l, r) : ARITH(Operator.LESS, l, r));
		} else if (e instanceof Expr.LessThanOrEqual) {
			return Q.apply(s, perm ? PERM_ATMOST(l, r) : ARITH(Operator.ATMOST, l, r));
		} else if (e instanceof Expr.GreaterThan) {
			return Q.apply(s, perm ? PERM_LESS(r, l) : ARITH(Operator.GREATER, l, r));
		} else if (e instanceof Expr.GreaterThanOrEqual) {
			return Q.apply(s, perm ? PERM_ATMOST(r, l) : ARITH(Operator.ATLEAST, l, r));
		} else if (e instanceof Expr.Addition) {
			return Q.apply(s, perm ? PERM_PLUS(l, r) : ARITH(Operator.PLUS, l, r));
		} else if (e instanceof Expr.Subtraction) {
			return Q.apply(s, perm ? PERM_MINUS(l, r) : ARITH(Operator.MINUS, l, r));
		} else if (e instanceof Expr.Multiplication) {
			return Q.apply(s, perm ? PERM_TIMES(l, r) : ARITH(Operator.TIMES, l, r));
		} else if (e instanceof Expr.Division) {
			if (isZero(r)) {
				return failure(pve, e, "division by zero");
			}
			return Q.apply(s, perm ? PERM_TIMES(l, FRACTION(CONST(1), r)) : ARITH(Operator.DIV, l, r));
		} else if (e instanceof Expr.Remainder) {
			return isZero(r) ? failure(pve, e, "division by zero") : Q.apply(s, ARITH(Operator.MOD, l, r));
		} else {
			throw new IllegalArgumentException("unknown expression encountered (" + e.getClass().getName() + ")");
		}
	}

	/**
	 * Evaluate a logical connective, where the right-hand side is evaluated
	 * only under the condition that the left-hand side does not already
	 * determine the outcome. For example, in <code>x != null ==> x.f > 0</code>
	 * the field read happens only when <code>x != null</code>.
	 *
	 * @param s
	 * @param e
	 * @param pve
	 * @param Q
	 * @return
	 */
	private VerificationResult evalShortCircuit(State s, Expr.BinaryOperator e, ErrorDescriptor pve,
			Continuation.OfTerm Q) {
		boolean or = e instanceof Expr.LogicalOr;
		return eval(s, e.getLeftHandSide(), pve, (s1, l) -> evalGuarded(s1, or ? NOT(l) : l,
				e.getRightHandSide(), pve, (s2, r) -> {
					if (e instanceof Expr.LogicalAnd) {
						return Q.apply(s2, r == null ? FALSE : AND(l, r));
					} else if (or) {
						return Q.apply(s2, r == null ? TRUE : OR(l, r));
					} else {
						return Q.apply(s2, r == null ? TRUE : IMPLIES(l, r));
					}
				}));
	}

	private VerificationResult evalConditional(State s, Expr.Conditional e, ErrorDescriptor pve,
			Continuation.OfTerm Q) {
		return eval(s, e.getCondition(), pve,
				(s1, c) -> evalGuarded(s1, c, e.getTrueBranch(), pve,
						(s2, t) -> evalGuarded(s2, NOT(c), e.getFalseBranch(), pve, (s3, f) -> {
							if (t == null && f == null) {
								// infeasible path
								return VerificationResult.SUCCESS;
							}
							return Q.apply(s3, t == null ? f : f == null ? t : ITE(c, t, f));
						})));
	}

	/**
	 * Evaluate an expression within its own scope of the decider, under the
	 * assumption that a given guard holds. When the guard is known not to hold,
	 * the expression is not evaluated and the continuation receives
	 * <code>null</code>. Facts assumed during the evaluation are retained
	 * afterwards only under the guard.
	 *
	 * @param s
	 * @param guard
	 * @param e
	 * @param pve
	 * @param Q
	 * @return
	 */
	private VerificationResult evalGuarded(State s, Term guard, Expr e, ErrorDescriptor pve,
			Continuation.OfTerm Q) {
		Decider decider = verifier.getDecider();
		State[] state = { s };
		Term[] term = new Term[1];
		ArrayList<Term> facts = new ArrayList<>();
		VerificationResult r = null;
		decider.pushScope();
		try {
			decider.assume(guard);
			if (!decider.check(FALSE)) {
				final int n = decider.getPathConditions().size();
				r = eval(s, e, pve, (s1, t) -> {
					List<Term> pcs = decider.getPathConditions();
					facts.addAll(pcs.subList(n, pcs.size()));
					state[0] = s1;
					term[0] = t;
					return VerificationResult.SUCCESS;
				});
			}
		} finally {
			decider.popScope();
		}
		if (r == null) {
			return Q.apply(s, null);
		} else if (r.isFatal()) {
			return r;
		}
		decider.assume(IMPLIES(guard, AND(facts)));
		return Q.apply(state[0], term[0]);
	}

	private VerificationResult evalLet(State s, Expr.Let e, ErrorDescriptor pve, Continuation.OfTerm Q) {
		Store original = s.getStore();
		return eval(s, e.getInitialiser(), pve, (s1, t) -> {
			State s2 = s1.withStore(s1.getStore().put(e.getVariable().getName(), t));
			return eval(s2, e.getBody(), pve, (s3, body) -> Q.apply(s3.withStore(original), body));
		});
	}

	private VerificationResult evalInvoke(State s, Expr.Invoke e, ErrorDescriptor pve, Continuation.OfTerm Q) {
		return evals(s, e.getArguments(), pve, (s1, args) -> {
			ArrayList<Sort> parameters = new ArrayList<>();
			parameters.add(Sort.PHeap);
			for (Term arg : args) {
				parameters.add(arg.getSort());
			}
			Fun fn = new Fun(e.getName(), parameters, toSort(e.getReturns()));
			Term snapshot = verifier.getDecider().fresh("s", Sort.PHeap);
			return Q.apply(s1, APP(fn, Util.append(snapshot, args)));
		});
	}

	private static boolean isZero(Term t) {
		return t instanceof Term.IntLiteral && ((Term.IntLiteral) t).getValue().equals(BigInteger.ZERO);
	}

	private static VerificationResult failure(ErrorDescriptor pve, Expr e, String reason) {
		VerificationError error = new VerificationError(VerificationError.EVALUATION_FAILURE,
				pve.getDescription() + " " + reason, e);
		return VerificationResult.failure(error);
	}
}
