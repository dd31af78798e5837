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

import static wyheap.core.Logic.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import wyheap.core.Logic.Fun;
import wyheap.core.Logic.Sort;
import wyheap.core.Logic.SimpleIdentifier;
import wyheap.core.Logic.SuffixedIdentifier;
import wyheap.core.Logic.Term;
import wyheap.core.Logic.Term.Arithmetic.Operator;
import wyheap.core.Program;
import wyheap.core.Program.Decl;
import wyheap.core.Program.Expr;
import wyheap.util.AbstractTermTransform;
import wyheap.util.PurityChecker;

/**
 * <p>
 * Translates the bodies and specifications of functions into terms over heap
 * snapshots, for use in function axioms. Every heap access is translated as a
 * lookup in the snapshot currently in scope. An unfolding narrows the
 * snapshot in scope whilst its body is translated. Function applications are
 * passed the snapshot in scope restricted to the callee.
 * </p>
 * <p>
 * To prevent function axioms from instantiating each other indefinitely, a
 * call to a function whose height is not strictly greater than the caller's
 * (i.e. which may be recursive) uses the <i>limited</i> symbol of the callee.
 * </p>
 *
 * @author David J. Pearce
 *
 */
public class HeapAccessTranslator {
	private static final Fun FRESH_WILDCARD = new Fun("freshWildcard", Collections.singletonList(Sort.Int),
			Sort.Perm);

	private final Map<String, FunctionData> functions;
	private final ResolutionFallback fallback;

	public HeapAccessTranslator(Map<String, FunctionData> functions, ResolutionFallback fallback) {
		this.functions = functions;
		this.fallback = fallback;
	}

	/**
	 * Translate the body of a given function.
	 *
	 * @param program
	 * @param function
	 * @param data
	 * @return The translated body, or nothing if the function has no body or
	 *         an unresolved subexpression was fatal.
	 */
	public Optional<Term> translate(Program program, Decl.Function function, FunctionData data) {
		TranslationContext context = new TranslationContext(program, data, functions, data.getFormalSnapshot(),
				false, false);
		if (function.getBody() == null) {
			return Optional.empty();
		}
		Term body = translate(context, function.getBody());
		return context.getOutcome().isFailed() ? Optional.empty() : Optional.of(body);
	}

	public Optional<List<Term>> translatePostcondition(Program program, List<Expr> posts, FunctionData data) {
		TranslationContext context = new TranslationContext(program, data, functions, data.getFormalSnapshot(),
				false, false);
		return translateAll(context, posts);
	}

	/**
	 * Translate a function's preconditions on behalf of a caller, where access
	 * predicates translate as <code>true</code>.
	 *
	 * @param program
	 * @param pres
	 * @param data
	 * @return
	 */
	public Optional<List<Term>> translatePrecondition(Program program, List<Expr> pres, FunctionData data) {
		TranslationContext context = new TranslationContext(program, data, functions, data.getFormalSnapshot(),
				true, true);
		return translateAll(context, pres);
	}

	private Optional<List<Term>> translateAll(TranslationContext context, List<Expr> exprs) {
		ArrayList<Term> terms = new ArrayList<>();
		for (Expr e : exprs) {
			terms.add(translate(context, e));
		}
		return context.getOutcome().isFailed() ? Optional.empty() : Optional.of(terms);
	}

	public Term translate(TranslationContext context, Expr expr) {
		FunctionData data = context.getData();
		if (expr instanceof Expr.AccessPredicate || expr instanceof Expr.MagicWand) {
			if (context.isIgnoringAccessPredicates()) {
				return TRUE;
			}
			throw new IllegalArgumentException("cannot translate resource " + expr);
		} else if (expr instanceof Expr.Quantifier && context.isIgnoringAccessPredicates()
				&& !PurityChecker.isPure(expr)) {
			return TRUE;
		} else if (expr instanceof Expr.Boolean) {
			return CONST(((Expr.Boolean) expr).getValue());
		} else if (expr instanceof Expr.Integer) {
			return CONST(((Expr.Integer) expr).getValue());
		} else if (expr instanceof Expr.Null) {
			return NULL;
		} else if (expr instanceof Expr.FullPermission) {
			return FULL;
		} else if (expr instanceof Expr.NoPermission) {
			return NONE;
		} else if (expr instanceof Expr.WildcardPermission) {
			Program.Position p = expr.getPosition();
			return APP(FRESH_WILDCARD, CONST(p == null ? 0 : p.getLine()));
		} else if (expr instanceof Expr.Result) {
			return data.getFormalResult();
		} else if (expr instanceof Expr.VariableAccess) {
			Expr.VariableAccess v = (Expr.VariableAccess) expr;
			Term.Var formal = data.getFormalArgs().get(v.getVariable());
			return formal != null ? formal : VAR(v.getVariable(), toSort(v.getType()));
		} else if (expr instanceof Expr.FieldAccess) {
			Expr.FieldAccess f = (Expr.FieldAccess) expr;
			return LOOKUP_FIELD(f.getName(), toSort(f.getField().getType()), context.getSnapshot(),
					translate(context, f.getReceiver()));
		} else if (expr instanceof Expr.CurrentPermission) {
			return resolve(context, expr, Sort.Perm);
		} else if (expr instanceof Expr.Quantifier) {
			return translateQuantifier(context, (Expr.Quantifier) expr);
		} else if (expr instanceof Expr.Unfolding) {
			return translateUnfolding(context, (Expr.Unfolding) expr);
		} else if (expr instanceof Expr.Applying) {
			return translate(context, ((Expr.Applying) expr).getBody());
		} else if (expr instanceof Expr.InhaleExhale) {
			Expr.InhaleExhale ie = (Expr.InhaleExhale) expr;
			return translate(context, context.isExhaling() ? ie.getExhale() : ie.getInhale());
		} else if (expr instanceof Expr.Invoke) {
			return translateInvoke(context, (Expr.Invoke) expr);
		} else if (expr instanceof Expr.Let) {
			Expr.Let l = (Expr.Let) expr;
			Decl.Parameter v = l.getVariable();
			return LET(VAR(v.getName(), toSort(v.getType())), translate(context, l.getInitialiser()),
					translate(context, l.getBody()));
		} else if (expr instanceof Expr.Conditional) {
			Expr.Conditional c = (Expr.Conditional) expr;
			return ITE(translate(context, c.getCondition()), translate(context, c.getTrueBranch()),
					translate(context, c.getFalseBranch()));
		} else if (expr instanceof Expr.Negation) {
			Term t = translate(context, ((Expr.Negation) expr).getOperand());
			return t.getSort().equals(Sort.Perm) ? PERM_MINUS(NONE, t) : ARITH(Operator.MINUS, CONST(0), t);
		} else if (expr instanceof Expr.LogicalNot) {
			return NOT(translate(context, ((Expr.LogicalNot) expr).getOperand()));
		} else if (expr instanceof Expr.BinaryOperator) {
			Expr.BinaryOperator b = (Expr.BinaryOperator) expr;
			return translateBinary(b, translate(context, b.getLeftHandSide()),
					translate(context, b.getRightHandSide()));
		} else {
			throw new IllegalArgumentException("unknown expression encountered (" + expr.getClass().getName() + ")");
		}
	}

	private Term translateBinary(Expr.BinaryOperator e, Term l, Term r) {
		boolean perm = l.getSort().equals(Sort.Perm) || r.getSort().equals(Sort.Perm);
		if (e instanceof Expr.FractionalPermission) {
			return FRACTION(l, r);
		} else if (e instanceof Expr.Equals) {
			return EQ(l, r);
		} else if (e instanceof Expr.NotEquals) {
			return NOT(EQ(l, r));
		} else if (e instanceof Expr.LessThan) {
			return perm ? PERM_LESS(l, r) : ARITH(Operator.LESS, l, r);
		} else if (e instanceof Expr.LessThanOrEqual) {
			return perm ? PERM_ATMOST(l, r) : ARITH(Operator.ATMOST, l, r);
		} else if (e instanceof Expr.GreaterThan) {
			return perm ? PERM_LESS(r, l) : ARITH(Operator.GREATER, l, r);
		} else if (e instanceof Expr.GreaterThanOrEqual) {
			return perm ? PERM_ATMOST(r, l) : ARITH(Operator.ATLEAST, l, r);
		} else if (e instanceof Expr.Addition) {
			return perm ? PERM_PLUS(l, r) : ARITH(Operator.PLUS, l, r);
		} else if (e instanceof Expr.Subtraction) {
			return perm ? PERM_MINUS(l, r) : ARITH(Operator.MINUS, l, r);
		} else if (e instanceof Expr.Multiplication) {
			return perm ? PERM_TIMES(l, r) : ARITH(Operator.TIMES, l, r);
		} else if (e instanceof Expr.Division) {
			return perm ? PERM_TIMES(l, FRACTION(CONST(1), r)) : ARITH(Operator.DIV, l, r);
		} else if (e instanceof Expr.Remainder) {
			return ARITH(Operator.MOD, l, r);
		} else if (e instanceof Expr.LogicalAnd) {
			return AND(l, r);
		} else if (e instanceof Expr.LogicalOr) {
			return OR(l, r);
		} else if (e instanceof Expr.Implies) {
			return IMPLIES(l, r);
		} else {
			throw new IllegalArgumentException("unknown expression encountered (" + e.getClass().getName() + ")");
		}
	}

	/**
	 * Translate a quantifier. Terms recorded during verification refer to
	 * quantified variables by their suffixed names (e.g. <code>x@3</code>),
	 * which are renamed here to the plain names bound by the translated
	 * quantifier.
	 */
	private Term translateQuantifier(TranslationContext context, Expr.Quantifier q) {
		ArrayList<Term.Var> vars = new ArrayList<>();
		Set<String> names = new HashSet<>();
		for (Decl.Parameter p : q.getParameters()) {
			vars.add(VAR(p.getName(), toSort(p.getType())));
			names.add(p.getName());
		}
		Term body = translate(context, q.getBody());
		Term result;
		if (q instanceof Expr.UniversalQuantifier) {
			ArrayList<Term.Trigger> triggers = new ArrayList<>();
			for (Expr.Trigger t : ((Expr.UniversalQuantifier) q).getTriggers()) {
				ArrayList<Term> terms = new ArrayList<>();
				for (Expr e : t.getExpressions()) {
					terms.add(translate(context, e));
				}
				triggers.add(new Term.Trigger(terms));
			}
			result = FORALL(vars, body, triggers);
		} else {
			result = EXISTS(vars, body, Collections.emptyList());
		}
		return new AbstractTermTransform() {
			@Override
			protected Term rewrite(Term term) {
				if (term instanceof Term.Var && ((Term.Var) term).getId() instanceof SuffixedIdentifier) {
					SuffixedIdentifier id = (SuffixedIdentifier) ((Term.Var) term).getId();
					if (names.contains(id.getPrefix())) {
						return VAR(new SimpleIdentifier(id.getPrefix()), term.getSort());
					}
				}
				return term;
			}
		}.transform(result);
	}

	private Term translateUnfolding(TranslationContext context, Expr.Unfolding u) {
		Expr.PredicateAccess p = u.getPredicate().getLocation();
		ArrayList<Term> args = new ArrayList<>();
		for (Expr arg : p.getArguments()) {
			args.add(translate(context, arg));
		}
		Term snapshot = context.getSnapshot();
		Term narrowed = COMBINE(LOOKUP_PREDICATE(p.getName(), snapshot, args),
				REMOVE_PREDICATE(p.getName(), snapshot, args));
		return translate(context.withSnapshot(narrowed), u.getBody());
	}

	private Term translateInvoke(TranslationContext context, Expr.Invoke e) {
		FunctionData caller = context.getData();
		FunctionData callee = context.getFunctions().get(e.getName());
		if (callee == null) {
			throw new IllegalArgumentException("unknown function \"" + e.getName() + "\"");
		}
		ArrayList<Term> args = new ArrayList<>();
		for (Expr arg : e.getArguments()) {
			args.add(translate(context, arg));
		}
		Term snapshot = RESTRICT(e.getName(), context.getSnapshot(), args);
		if (caller.getHeight() < callee.getHeight()) {
			return APP(callee.getSymbol(), prepend(snapshot, args));
		}
		for (String p : caller.getPredicateTriggers().keySet()) {
			Fun tag = new Fun("PHeap.funTrigger_" + p, Collections.singletonList(Sort.PHeap), Sort.PHeap);
			snapshot = APP(tag, snapshot);
		}
		return APP(callee.getLimitedSymbol(), prepend(snapshot, args));
	}

	private Term resolve(TranslationContext context, Expr expr, Sort sort) {
		Term recorded = context.getData().getRecordedTerms().get(expr);
		if (recorded != null) {
			return CONVERT(recorded, sort);
		}
		return fallback.resolve(context, expr, sort);
	}

	private static List<Term> prepend(Term head, List<Term> tail) {
		ArrayList<Term> r = new ArrayList<>();
		r.add(head);
		r.addAll(tail);
		return r;
	}
}
