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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import wyheap.core.Logic.Sort;
import wyheap.core.Logic.Term;
import wyheap.core.Program.Decl;
import wyheap.core.Program.Expr;
import wyheap.io.AssertionPrinter;
import wyheap.state.Chunk;
import wyheap.state.Heap;
import wyheap.state.MagicWandIdentifier;
import wyheap.state.SnapshotMapDefinition;
import wyheap.state.State;
import wyheap.util.Pair;
import wyheap.util.PurityChecker;
import wyheap.util.Util;
import wyheap.verifier.Decider;
import wyheap.verifier.ErrorDescriptor;
import wyheap.verifier.VerificationError;
import wyheap.verifier.VerificationResult;
import wyheap.verifier.Verifier;

/**
 * <p>
 * Responsible for producing (i.e. inhaling) assertions. Producing an
 * assertion adds the resources it describes to the heap of the current state,
 * and assumes the logical facts it contains. The snapshot of the produced
 * assertion is obtained from a {@link SnapshotSupplier}, and is partitioned
 * amongst the top-level conjuncts of the assertion.
 * </p>
 * <p>
 * The methods <code>produce()</code> and <code>produces()</code> are the entry
 * points for clients. Every assertion produced, including those produced
 * recursively (e.g. the branches of a conditional assertion), is split into
 * top-level conjuncts with any inhale-exhale expression replaced by its
 * inhale part. Every top-level conjunct passes through
 * <code>wrappedProduceTlc()</code>, which records its span, before being
 * handled by <code>produceTlc()</code>.
 * </p>
 *
 * @author David J. Pearce
 *
 */
public class Producer {
	private static final Logger LOGGER = LoggerFactory.getLogger(Producer.class);
	private static final String SPAN = "produce";

	private final Verifier verifier;
	private final Decider decider;
	private final Evaluator evaluator;
	private final Brancher brancher;
	private final ChunkSupporter chunkSupporter;
	private final QuantifiedChunkSupporter quantifiedChunkSupporter;
	private final MagicWandSupporter magicWandSupporter;

	public Producer(Verifier verifier) {
		this(verifier, new ExpressionEvaluator(verifier));
	}

	private Producer(Verifier verifier, Evaluator evaluator) {
		this(verifier, evaluator, new DefaultBrancher(verifier.getDecider()),
				new DefaultChunkSupporter(verifier.getDecider()),
				new DefaultQuantifiedChunkSupporter(verifier.getDecider()), new DefaultMagicWandSupporter(evaluator));
	}

	public Producer(Verifier verifier, Evaluator evaluator, Brancher brancher, ChunkSupporter chunkSupporter,
			QuantifiedChunkSupporter quantifiedChunkSupporter, MagicWandSupporter magicWandSupporter) {
		this.verifier = verifier;
		this.decider = verifier.getDecider();
		this.evaluator = evaluator;
		this.brancher = brancher;
		this.chunkSupporter = chunkSupporter;
		this.quantifiedChunkSupporter = quantifiedChunkSupporter;
		this.magicWandSupporter = magicWandSupporter;
	}

	/**
	 * Produce a given assertion.
	 *
	 * @param s            The state to produce into.
	 * @param sf           Supplies the snapshot of the assertion being produced.
	 * @param a            The assertion to produce.
	 * @param pve          Describes failures arising from this production.
	 * @param continuation Invoked with the resulting state(s).
	 * @return
	 */
	public VerificationResult produce(State s, SnapshotSupplier sf, Expr a, ErrorDescriptor pve,
			Continuation continuation) {
		List<Expr> tlcs = AssertionSplitter.splitWhenInhaling(a);
		return produceTlcs(s, sf, tlcs, Collections.nCopies(tlcs.size(), pve), continuation);
	}

	/**
	 * Produce a sequence of assertions, which is equivalent to producing their
	 * conjunction except that each has its own error descriptor.
	 *
	 * @param s
	 * @param sf
	 * @param as
	 * @param pvef
	 * @param continuation
	 * @return
	 */
	public VerificationResult produces(State s, SnapshotSupplier sf, List<Expr> as,
			Function<Expr, ErrorDescriptor> pvef, Continuation continuation) {
		ArrayList<Expr> tlcs = new ArrayList<>();
		ArrayList<ErrorDescriptor> pves = new ArrayList<>();
		for (Expr a : as) {
			List<Expr> ith = AssertionSplitter.splitWhenInhaling(a);
			tlcs.addAll(ith);
			pves.addAll(Collections.nCopies(ith.size(), pvef.apply(a)));
		}
		return produceTlcs(s, sf, tlcs, pves, continuation);
	}

	private VerificationResult produceTlcs(State s, SnapshotSupplier sf, List<Expr> as, List<ErrorDescriptor> pves,
			Continuation Q) {
		if (as.isEmpty()) {
			return Q.apply(s);
		} else if (as.size() == 1) {
			return wrappedProduceTlc(s, sf, as.get(0), pves.get(0), Q);
		} else {
			Term.Var h0 = decider.fresh("h", Sort.PHeap);
			Term.Var h1 = decider.fresh("h", Sort.PHeap);
			decider.assume(EQ(sf.get(Sort.PHeap), COMBINE(h0, h1)));
			List<Expr> rest = as.subList(1, as.size());
			List<ErrorDescriptor> restPves = pves.subList(1, pves.size());
			return wrappedProduceTlc(s, partition(h0), as.get(0), pves.get(0),
					s1 -> produceTlcs(s1, partition(h1), rest, restPves, Q));
		}
	}

	private VerificationResult produceR(State s, SnapshotSupplier sf, Expr a, ErrorDescriptor pve, Continuation Q) {
		List<Expr> tlcs = AssertionSplitter.splitWhenInhaling(a);
		return produceTlcs(s, sf, tlcs, Collections.nCopies(tlcs.size(), pve), Q);
	}

	private VerificationResult wrappedProduceTlc(State s, SnapshotSupplier sf, Expr a, ErrorDescriptor pve,
			Continuation Q) {
		verifier.getSpanRecorder().enter(SPAN, a);
		return produceTlc(s, sf, a, pve, s1 -> {
			verifier.getSpanRecorder().leave(SPAN, a);
			return Q.apply(s1);
		});
	}

	private VerificationResult produceTlc(State s, SnapshotSupplier sf, Expr a, ErrorDescriptor pve,
			Continuation continuation) {
		if (verifier.getConfig().getDebug()) {
			LOGGER.debug("PRODUCE {}: {}", a.getPosition(), AssertionPrinter.toString(a));
			LOGGER.debug("HEAP {}", s.getHeap());
		}
		Continuation Q = s1 -> continuation.apply(s1.isExhaleExt() ? trackReserveHeap(s1) : s1);
		boolean pure = PurityChecker.isPure(a);
		QuantifiedPermissionAssertion qpa = QuantifiedPermissionAssertion.match(a);
		//
		if (a instanceof Expr.Implies && !pure) {
			Expr.Implies i = (Expr.Implies) a;
			return evaluator.eval(s, i.getLeftHandSide(), pve, (s1, t0) -> brancher.branch(s1, t0,
					s2 -> produceR(s2, sf, i.getRightHandSide(), pve, Q), s2 -> Q.apply(s2)));
		} else if (a instanceof Expr.Conditional && !pure) {
			Expr.Conditional c = (Expr.Conditional) a;
			return evaluator.eval(s, c.getCondition(), pve,
					(s1, t0) -> brancher.branch(s1, t0, s2 -> produceR(s2, sf, c.getTrueBranch(), pve, Q),
							s2 -> produceR(s2, sf, c.getFalseBranch(), pve, Q)));
		} else if (a instanceof Expr.Let && !pure) {
			return produceLet(s, sf, (Expr.Let) a, pve, Q);
		} else if (a instanceof Expr.FieldAccessPredicate) {
			return produceFieldAccessPredicate(s, sf, (Expr.FieldAccessPredicate) a, pve, Q);
		} else if (a instanceof Expr.PredicateAccessPredicate) {
			return producePredicateAccessPredicate(s, sf, (Expr.PredicateAccessPredicate) a, pve, Q);
		} else if (a instanceof Expr.MagicWand) {
			return produceMagicWand(s, sf, (Expr.MagicWand) a, pve, Q);
		} else if (qpa != null) {
			return produceQuantifiedPermission(s, sf, qpa, pve, Q);
		} else if (!pure && quantifiedInhaleExhale(a) != null) {
			Expr ie = quantifiedInhaleExhale(a);
			return VerificationResult.failure(new VerificationError(VerificationError.MALFORMED_ASSERTION,
					"unexpected inhale-exhale expression " + AssertionPrinter.toString(ie), ie));
		} else {
			return evaluator.eval(s, a, pve, (s1, t) -> {
				decider.assume(t);
				return Q.apply(s1);
			});
		}
	}

	private VerificationResult produceLet(State s, SnapshotSupplier sf, Expr.Let a, ErrorDescriptor pve,
			Continuation Q) {
		String name = a.getVariable().getName();
		return evaluator.eval(s, a.getInitialiser(), pve, (s1, t) -> {
			State s2 = s1.withStore(s1.getStore().put(name, t));
			return produceR(s2, sf, a.getBody(), pve, s3 -> Q.apply(s3.withStore(s1.getStore())));
		});
	}

	private VerificationResult produceFieldAccessPredicate(State s, SnapshotSupplier sf, Expr.FieldAccessPredicate a,
			ErrorDescriptor pve, Continuation Q) {
		Decl.Field field = a.getLocation().getField();
		String name = field.getName();
		return evaluator.eval(s, a.getLocation().getReceiver(), pve,
				(s1, tRcvr) -> evaluator.eval(s1, a.getPermission(), pve, (s2, tPerm) -> {
					Term hGiven = sf.get(Sort.PHeap);
					Term snap = decider.fresh(name, toSort(field.getType()));
					// The given snapshot consists solely of this field
					decider.assume(EQ(hGiven, SINGLETON(name, tRcvr, snap)));
					Term gain = PERM_TIMES(tPerm, s2.getPermissionScalingFactor());
					if (!assumeNonNegative(gain)) {
						return negativePermission(a, pve);
					}
					List<Term> args = Collections.singletonList(tRcvr);
					if (s2.getQpFields().contains(name)) {
						List<Term.Var> formals = Collections.singletonList(VAR("r", Sort.Ref));
						return quantifiedChunkSupporter.produceSingleLocation(s2, name, Chunk.Kind.FIELD, formals,
								args, snap, gain, sm -> RESOURCE_TRIGGER(name, sm, args), Q);
					} else {
						Chunk.Basic ch = new Chunk.Basic(Chunk.Kind.FIELD, name, args, snap, gain);
						return chunkSupporter.produce(s2, s2.getHeap(), ch, (s3, h3) -> Q.apply(s3.withHeap(h3)));
					}
				}));
	}

	private VerificationResult producePredicateAccessPredicate(State s, SnapshotSupplier sf,
			Expr.PredicateAccessPredicate a, ErrorDescriptor pve, Continuation Q) {
		String name = a.getLocation().getName();
		return evaluator.evals(s, a.getLocation().getArguments(), pve,
				(s1, tArgs) -> evaluator.eval(s1, a.getPermission(), pve, (s2, tPerm) -> {
					Term hGiven = sf.get(Sort.PHeap);
					Term snap = decider.fresh(name, Sort.PHeap);
					decider.assume(EQ(hGiven, SINGLETON_PREDICATE(name, tArgs, snap)));
					Term gain = PERM_TIMES(tPerm, s2.getPermissionScalingFactor());
					if (!assumeNonNegative(gain)) {
						return negativePermission(a, pve);
					}
					if (s2.getQpPredicates().contains(name)) {
						return quantifiedChunkSupporter.produceSingleLocation(s2, name, Chunk.Kind.PREDICATE,
								predicateFormals(s2, name), tArgs, snap, gain,
								sm -> RESOURCE_TRIGGER(name, sm, tArgs), Q);
					} else {
						Chunk.Basic ch = new Chunk.Basic(Chunk.Kind.PREDICATE, name, tArgs, snap, gain);
						return chunkSupporter.produce(s2, s2.getHeap(), ch, (s3, h3) -> {
							if (verifier.getConfig().getPredicateTriggers() && !s3.getFunctionRecorder().isActive()) {
								decider.assume(APP(verifier.predicateTrigger(name), Util.append(snap, tArgs)));
							}
							return Q.apply(s3.withHeap(h3));
						});
					}
				}));
	}

	private VerificationResult produceMagicWand(State s, SnapshotSupplier sf, Expr.MagicWand wand,
			ErrorDescriptor pve, Continuation Q) {
		MagicWandIdentifier id = MagicWandIdentifier.of(wand);
		if (!s.getQpMagicWands().contains(id.getName())) {
			Term snap = sf.get(Sort.Snap);
			return magicWandSupporter.createChunk(s, wand, WAND_SNAPSHOT(snap), pve,
					(s1, ch) -> chunkSupporter.produce(s1, s1.getHeap(), ch, (s2, h2) -> Q.apply(s2.withHeap(h2))));
		}
		String name = id.getName();
		return evaluator.evals(s, id.getSubexpressions(), pve, (s1, args) -> {
			List<Term.Var> formals = wandFormals(args);
			Pair<Term, Term> p = quantifiedChunkSupporter.singletonSnapshotMap(s1, name, Chunk.Kind.WAND, args,
					sf.get(Sort.Snap));
			Term sm = p.first();
			Term smValueDef = p.second();
			decider.assume(smValueDef);
			Chunk.Quantified ch = quantifiedChunkSupporter.createSingletonQuantifiedChunk(formals, name,
					Chunk.Kind.WAND, args, FULL, sm);
			Heap h2 = s1.getHeap().add(ch);
			List<Chunk.Quantified> relevant = quantifiedChunkSupporter.splitHeap(h2, name).first();
			Pair<State, SnapshotMapDefinition> summary = quantifiedChunkSupporter.summarisingSnapshotMap(s1, name,
					formals, relevant);
			decider.assume(RESOURCE_TRIGGER(name, summary.second().getSnapshotMap(), args));
			SnapshotMapDefinition smDef = new SnapshotMapDefinition(name, sm, Collections.singletonList(smValueDef),
					Collections.emptyList());
			State s2 = summary.first().withHeap(h2)
					.withFunctionRecorder(s1.getFunctionRecorder().recordSnapshotMap(smDef));
			return Q.apply(s2);
		});
	}

	private VerificationResult produceQuantifiedPermission(State s, SnapshotSupplier sf,
			QuantifiedPermissionAssertion qpa, ErrorDescriptor pve, Continuation Q) {
		Expr.UniversalQuantifier forall = qpa.getQuantifier();
		List<Decl.Parameter> params = forall.getParameters();
		List<Expr> conditions = Collections.singletonList(qpa.getCondition());
		Expr resource = qpa.getResource();
		if (resource instanceof Expr.FieldAccessPredicate) {
			Expr.FieldAccessPredicate acc = (Expr.FieldAccessPredicate) resource;
			Decl.Field field = acc.getLocation().getField();
			List<Expr> bodies = Arrays.asList(acc.getLocation().getReceiver(), acc.getPermission());
			return evaluator.evalQuantified(s, true, params, conditions, bodies, forall.getTriggers(), pve,
					(s1, qvars, tConds, tBodies, tTriggers) -> {
						Term tSnap = sf.get(new Sort.FieldValueFunction(toSort(field.getType())));
						Term gain = PERM_TIMES(tBodies.get(1), s1.getPermissionScalingFactor());
						if (isNegative(gain)) {
							return negativePermission(acc, pve);
						}
						return quantifiedChunkSupporter.produce(s1, qvars, tConds.get(0), field.getName(),
								Chunk.Kind.FIELD, Collections.singletonList(VAR("r", Sort.Ref)),
								Collections.singletonList(tBodies.get(0)), tSnap, gain, tTriggers, Q);
					});
		} else if (resource instanceof Expr.PredicateAccessPredicate) {
			Expr.PredicateAccessPredicate acc = (Expr.PredicateAccessPredicate) resource;
			String name = acc.getLocation().getName();
			List<Expr> bodies = Util.append(acc.getPermission(), acc.getLocation().getArguments());
			return evaluator.evalQuantified(s, true, params, conditions, bodies, forall.getTriggers(), pve,
					(s1, qvars, tConds, tBodies, tTriggers) -> {
						Term tSnap = sf.get(Sort.PredicateSnapFunction);
						Term gain = PERM_TIMES(tBodies.get(0), s1.getPermissionScalingFactor());
						if (isNegative(gain)) {
							return negativePermission(acc, pve);
						}
						List<Term> tArgs = tBodies.subList(1, tBodies.size());
						return quantifiedChunkSupporter.produce(s1, qvars, tConds.get(0), name,
								Chunk.Kind.PREDICATE, predicateFormals(s1, name), tArgs, tSnap, gain, tTriggers, Q);
					});
		} else {
			MagicWandIdentifier id = MagicWandIdentifier.of((Expr.MagicWand) resource);
			return evaluator.evalQuantified(s, true, params, conditions, id.getSubexpressions(),
					forall.getTriggers(), pve, (s1, qvars, tConds, tArgs, tTriggers) -> {
						Term tSnap = sf.get(Sort.PredicateSnapFunction);
						return quantifiedChunkSupporter.produce(s1, qvars, tConds.get(0), id.getName(),
								Chunk.Kind.WAND, wandFormals(tArgs), tArgs, tSnap, FULL, tTriggers, Q);
					});
		}
	}

	/**
	 * Find an inhale-exhale expression used as the resource of a quantified
	 * assertion, such as <code>forall x :: c ==> [acc(x.f), true]</code>.
	 * Normalisation never reaches inside a quantifier.
	 *
	 * @param a
	 * @return
	 */
	private static Expr quantifiedInhaleExhale(Expr a) {
		if (a instanceof Expr.UniversalQuantifier) {
			Expr body = ((Expr.UniversalQuantifier) a).getBody();
			if (body instanceof Expr.Implies) {
				body = ((Expr.Implies) body).getRightHandSide();
			}
			if (body instanceof Expr.InhaleExhale) {
				return body;
			}
		}
		return null;
	}

	/**
	 * Assume that a permission amount being gained is non-negative, unless it
	 * is known to be negative.
	 *
	 * @param gain
	 * @return <code>false</code> if the amount is known to be negative, in
	 *         which case nothing is assumed.
	 */
	private boolean assumeNonNegative(Term gain) {
		if (isNegative(gain)) {
			return false;
		}
		decider.assume(PERM_ATMOST(NONE, gain));
		return true;
	}

	private boolean isNegative(Term gain) {
		return !decider.check(FALSE) && decider.check(PERM_LESS(gain, NONE));
	}

	private static VerificationResult negativePermission(Expr.AccessPredicate a, ErrorDescriptor pve) {
		String reason = "negative permission " + AssertionPrinter.toString(a.getPermission());
		return VerificationResult.failure(pve.dueTo(VerificationError.EVALUATION_FAILURE, reason));
	}

	/**
	 * Supply snapshots derived from a given heap snapshot, as used for the
	 * parts of a partitioned snapshot.
	 */
	private static SnapshotSupplier partition(Term.Var h) {
		return sort -> CONVERT(h, sort);
	}

	/**
	 * Make the top reserve heap reflect the current heap.
	 */
	private static State trackReserveHeap(State s) {
		List<Heap> reserves = s.getReserveHeaps();
		List<Heap> tail = reserves.isEmpty() ? reserves : reserves.subList(1, reserves.size());
		return s.withReserveHeaps(Util.append(s.getHeap(), tail));
	}

	private List<Term.Var> predicateFormals(State s, String name) {
		List<Term.Var> formals = s.getPredicateFormalVariables().get(name);
		if (formals == null) {
			formals = new ArrayList<>();
			for (Decl.Parameter p : verifier.getProgram().findPredicate(name).getParameters()) {
				formals.add(VAR(p.getName(), toSort(p.getType())));
			}
		}
		return formals;
	}

	private static List<Term.Var> wandFormals(List<Term> args) {
		ArrayList<Term.Var> formals = new ArrayList<>();
		for (int i = 0; i != args.size(); ++i) {
			formals.add(VAR("x" + i, args.get(i).getSort()));
		}
		return formals;
	}
}
