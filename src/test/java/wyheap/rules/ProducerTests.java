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

import static org.junit.jupiter.api.Assertions.*;
import static wyheap.core.Program.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import wyheap.core.Logic;
import wyheap.core.Logic.Sort;
import wyheap.core.Logic.Term;
import wyheap.core.Program;
import wyheap.core.Program.Decl;
import wyheap.core.Program.Expr;
import wyheap.core.Program.Type;
import wyheap.io.AssertionPrinter;
import wyheap.state.Chunk;
import wyheap.state.FunctionRecorder;
import wyheap.state.Heap;
import wyheap.state.State;
import wyheap.state.Store;
import wyheap.verifier.Config;
import wyheap.verifier.ErrorDescriptor;
import wyheap.verifier.RecordingDecider;
import wyheap.verifier.Reporter;
import wyheap.verifier.SpanRecorder;
import wyheap.verifier.VerificationError;
import wyheap.verifier.VerificationResult;
import wyheap.verifier.Verifier;

/**
 * Tests for producing assertions into a symbolic state.
 *
 * @author David J. Pearce
 *
 */
public class ProducerTests {
	private static final Decl.Field F = new Decl.Field("f", Type.Int);
	private static final Decl.Field G = new Decl.Field("g", Type.Int);
	private static final Decl.Parameter X = new Decl.Parameter("x", Type.Ref);
	private static final Decl.Parameter Y = new Decl.Parameter("y", Type.Ref);
	private static final Decl.Parameter B = new Decl.Parameter("b", Type.Bool);
	private static final Decl.Predicate P = new Decl.Predicate("P", Arrays.asList(X), ACC(FIELD(VAR(X), F), WRITE()));
	private static final Program PROGRAM = new Program(Arrays.asList(F, G), Arrays.asList(P),
			Collections.emptyList());

	private static final Term.Var SNAPSHOT = Logic.VAR("s", Sort.PHeap);
	private static final SnapshotSupplier SF = sort -> Logic.CONVERT(SNAPSHOT, sort);

	private static final Term.Var TX = Logic.VAR("x", Sort.Ref);
	private static final Term.Var TY = Logic.VAR("y", Sort.Ref);
	private static final Term.Var TB = Logic.VAR("b", Sort.Bool);
	private static final State INITIAL = State.initial()
			.withStore(Store.EMPTY.put("x", TX).put("y", TY).put("b", TB));

	private static Expr.FieldAccessPredicate accXF() {
		return ACC(FIELD(VAR(X), F), WRITE());
	}

	private static Expr.FieldAccessPredicate accYG() {
		return ACC(FIELD(VAR(Y), G), WRITE());
	}

	/**
	 * Runs productions, recording every state passed to the final continuation.
	 */
	private static class Harness {
		private final RecordingDecider decider = new RecordingDecider();
		private final ArrayList<State> states = new ArrayList<>();
		private final ArrayList<String> spans = new ArrayList<>();
		private final Producer producer;

		public Harness() {
			this(new Config());
		}

		public Harness(Config config) {
			SpanRecorder recorder = new SpanRecorder() {
				@Override
				public void enter(String kind, Expr assertion) {
					spans.add("enter " + AssertionPrinter.toString(assertion));
				}

				@Override
				public void leave(String kind, Expr assertion) {
					spans.add("leave " + AssertionPrinter.toString(assertion));
				}
			};
			this.producer = new Producer(new Verifier(PROGRAM, decider, config, Reporter.NULL, recorder));
		}

		public VerificationResult produce(State state, Expr assertion) {
			return producer.produce(state, SF, assertion, new ErrorDescriptor("production failed", assertion),
					this::record);
		}

		public VerificationResult produces(State state, List<Expr> assertions) {
			return producer.produces(state, SF, assertions, a -> new ErrorDescriptor("production failed", a),
					this::record);
		}

		private VerificationResult record(State state) {
			states.add(state);
			return VerificationResult.SUCCESS;
		}

		public List<Term> facts() {
			return decider.getPathConditions();
		}
	}

	private static Chunk.Basic onlyBasicChunk(State state) {
		assertEquals(1, state.getHeap().size());
		return (Chunk.Basic) state.getHeap().values().get(0);
	}

	@Test
	public void test_field_on_empty_heap() {
		Harness h = new Harness();
		VerificationResult r = h.produce(INITIAL, accXF());
		assertFalse(r.isFatal());
		assertEquals(1, h.states.size());
		Chunk.Basic c = onlyBasicChunk(h.states.get(0));
		assertEquals(Chunk.Kind.FIELD, c.getKind());
		assertEquals("f", c.getName());
		assertEquals(Arrays.asList(TX), c.getArguments());
		assertEquals(Logic.FULL, c.getPermission());
		assertTrue(h.facts().contains(Logic.EQ(SNAPSHOT, Logic.SINGLETON("f", TX, c.getSnapshot()))));
	}

	@Test
	public void test_implication_branches() {
		Harness h = new Harness();
		VerificationResult r = h.produce(INITIAL, IMPLIES(VAR(B), accXF()));
		assertFalse(r.isFatal());
		assertEquals(2, h.states.size());
		assertEquals(1, h.states.get(0).getHeap().size());
		assertEquals(0, h.states.get(1).getHeap().size());
		// branch conditions are scoped
		assertFalse(h.facts().contains(TB));
		assertFalse(h.facts().contains(Logic.NOT(TB)));
	}

	@Test
	public void test_conditional_branches() {
		Harness h = new Harness();
		VerificationResult r = h.produce(INITIAL, ITE(VAR(B), accXF(), accYG()));
		assertFalse(r.isFatal());
		assertEquals(2, h.states.size());
		assertEquals("f", onlyBasicChunk(h.states.get(0)).getName());
		assertEquals("g", onlyBasicChunk(h.states.get(1)).getName());
	}

	@Test
	public void test_snapshot_partitioning() {
		Harness h = new Harness();
		VerificationResult r = h.produce(INITIAL, AND(accXF(), accYG()));
		assertFalse(r.isFatal());
		Term h0 = null, h1 = null;
		int splits = 0;
		for (Term t : h.facts()) {
			if (t instanceof Term.Equals && ((Term.Equals) t).getRightHandSide() instanceof Term.Combine) {
				assertEquals(SNAPSHOT, ((Term.Equals) t).getLeftHandSide());
				Term.Combine c = (Term.Combine) ((Term.Equals) t).getRightHandSide();
				h0 = c.getLeftHandSide();
				h1 = c.getRightHandSide();
				splits = splits + 1;
			}
		}
		assertEquals(1, splits);
		assertEquals("f", singletonFieldOf(h.facts(), h0));
		assertEquals("g", singletonFieldOf(h.facts(), h1));
		Heap heap = h.states.get(0).getHeap();
		assertEquals(2, heap.size());
		assertEquals("f", heap.values().get(0).getName());
		assertEquals("g", heap.values().get(1).getName());
	}

	private static String singletonFieldOf(List<Term> facts, Term snapshot) {
		for (Term t : facts) {
			if (t instanceof Term.Equals && ((Term.Equals) t).getLeftHandSide().equals(snapshot)
					&& ((Term.Equals) t).getRightHandSide() instanceof Term.SingletonField) {
				return ((Term.SingletonField) ((Term.Equals) t).getRightHandSide()).getField();
			}
		}
		return null;
	}

	@Test
	public void test_trivial_assertion() {
		Harness h = new Harness();
		VerificationResult r = h.produce(INITIAL, CONST(true));
		assertFalse(r.isFatal());
		assertEquals(1, h.states.size());
		assertTrue(h.facts().isEmpty());
	}

	private static Stream<Arguments> conjunctPairs() {
		return Stream.of(Arguments.of(accXF(), accYG()), Arguments.of(NEQ(VAR(X), NULL()), accXF()),
				Arguments.of(accXF(), NEQ(VAR(Y), NULL())), Arguments.of(accXF(), IMPLIES(VAR(B), accYG())),
				Arguments.of(ACC(FIELD(VAR(X), F), FRACTION(1, 2)), ACC(FIELD(VAR(X), F), FRACTION(1, 2))));
	}

	@ParameterizedTest
	@MethodSource("conjunctPairs")
	public void test_conjunct_order_transparency(Expr a, Expr b) {
		Harness conjoined = new Harness();
		Harness sequenced = new Harness();
		VerificationResult r1 = conjoined.produce(INITIAL, AND(a, b));
		VerificationResult r2 = sequenced.produces(INITIAL, Arrays.asList(a, b));
		assertEquals(r1.isFatal(), r2.isFatal());
		assertEquals(shapes(conjoined.states), shapes(sequenced.states));
	}

	private static List<List<String>> shapes(List<State> states) {
		ArrayList<List<String>> result = new ArrayList<>();
		for (State s : states) {
			ArrayList<String> chunks = new ArrayList<>();
			for (Chunk c : s.getHeap()) {
				Chunk.NonQuantified n = (Chunk.NonQuantified) c;
				chunks.add(n.getKind() + " " + n.getName() + n.getArguments() + " " + n.getPermission());
			}
			result.add(chunks);
		}
		return result;
	}

	private static Stream<Expr> pureAssertions() {
		return Stream.of(NEQ(VAR(X), NULL()), EQ(ADD(CONST(1), CONST(2)), CONST(3)), IMPLIES(VAR(B), NEQ(VAR(X), NULL())),
				ITE(VAR(B), LT(CONST(1), CONST(2)), CONST(true)), LET(Y, VAR(X), NEQ(VAR(Y), NULL())),
				FORALL(Y, NEQ(VAR(Y), VAR(X))), EQ(PERM(FIELD(VAR(X), F)), NONE()));
	}

	@ParameterizedTest
	@MethodSource("pureAssertions")
	public void test_pure_assertions_add_no_chunks(Expr assertion) {
		for (State s : Arrays.asList(INITIAL, withChunk(INITIAL))) {
			Harness h = new Harness();
			VerificationResult r = h.produce(s, assertion);
			assertFalse(r.isFatal());
			for (State after : h.states) {
				assertEquals(s.getHeap(), after.getHeap());
			}
		}
	}

	private static State withChunk(State s) {
		Chunk c = new Chunk.Basic(Chunk.Kind.FIELD, "g", Arrays.asList(TY), Logic.VAR("v", Sort.Int), Logic.FULL);
		return s.withHeap(s.getHeap().add(c));
	}

	private static Stream<Arguments> permissionGrid() {
		ArrayList<Arguments> args = new ArrayList<>();
		for (Term factor : Arrays.asList(Logic.FULL, Logic.FRACTION(1, 2), Logic.VAR("p", Sort.Perm))) {
			for (String perm : Arrays.asList("write", "none", "wildcard")) {
				args.add(Arguments.of(factor, perm));
			}
		}
		return args.stream();
	}

	@ParameterizedTest
	@MethodSource("permissionGrid")
	public void test_gain_is_scaled_permission(Term factor, String perm) {
		Expr permission;
		if (perm.equals("write")) {
			permission = WRITE();
		} else if (perm.equals("none")) {
			permission = NONE();
		} else {
			permission = WILDCARD();
		}
		Harness h = new Harness();
		VerificationResult r = h.produce(INITIAL.withPermissionScalingFactor(factor),
				ACC(FIELD(VAR(X), F), permission));
		assertFalse(r.isFatal());
		Term base;
		if (perm.equals("write")) {
			base = Logic.FULL;
		} else if (perm.equals("none")) {
			base = Logic.NONE;
		} else {
			base = wildcardOf(h.facts());
		}
		Term gain = Logic.PERM_TIMES(base, factor);
		assertEquals(gain, onlyBasicChunk(h.states.get(0)).getPermission());
		assertTrue(h.facts().contains(Logic.PERM_ATMOST(Logic.NONE, gain)));
	}

	private static Term wildcardOf(List<Term> facts) {
		for (Term t : facts) {
			if (t instanceof Term.PermLess && t.getOperands().get(0) == Logic.NONE) {
				return t.getOperands().get(1);
			}
		}
		fail("no wildcard found");
		return null;
	}

	@Test
	public void test_predicate_scaled() {
		Harness h = new Harness();
		Term half = Logic.FRACTION(1, 2);
		VerificationResult r = h.produce(INITIAL.withPermissionScalingFactor(half),
				ACC(PREDICATE("P", VAR(X)), WRITE()));
		assertFalse(r.isFatal());
		Chunk.Basic c = onlyBasicChunk(h.states.get(0));
		assertEquals(Chunk.Kind.PREDICATE, c.getKind());
		assertEquals(half, c.getPermission());
		assertTrue(h.facts().contains(Logic.EQ(SNAPSHOT, Logic.SINGLETON_PREDICATE("P", Arrays.asList(TX), c.getSnapshot()))));
	}

	@Test
	public void test_predicate_triggers() {
		Harness enabled = new Harness(new Config().setPredicateTriggers(true));
		enabled.produce(INITIAL, ACC(PREDICATE("P", VAR(X)), WRITE()));
		assertTrue(hasTrigger(enabled.facts()));
		//
		Harness disabled = new Harness();
		disabled.produce(INITIAL, ACC(PREDICATE("P", VAR(X)), WRITE()));
		assertFalse(hasTrigger(disabled.facts()));
		//
		Harness recording = new Harness(new Config().setPredicateTriggers(true));
		recording.produce(INITIAL.withFunctionRecorder(new FunctionRecorder.Recording()),
				ACC(PREDICATE("P", VAR(X)), WRITE()));
		assertFalse(hasTrigger(recording.facts()));
	}

	private static boolean hasTrigger(List<Term> facts) {
		for (Term t : facts) {
			if (t instanceof Term.App && ((Term.App) t).getFunction().getName().equals("P%trigger")) {
				return true;
			}
		}
		return false;
	}

	@Test
	public void test_same_location_merged() {
		Harness h = new Harness();
		Expr half = FRACTION(1, 2);
		VerificationResult r = h.produce(INITIAL, AND(ACC(FIELD(VAR(X), F), half), ACC(FIELD(VAR(X), F), half)));
		assertFalse(r.isFatal());
		Chunk.Basic c = onlyBasicChunk(h.states.get(0));
		Term merged = Logic.PERM_PLUS(Logic.FRACTION(1, 2), Logic.FRACTION(1, 2));
		assertEquals(merged, c.getPermission());
		assertTrue(h.facts().contains(Logic.PERM_ATMOST(merged, Logic.FULL)));
	}

	@Test
	public void test_let_binding() {
		Harness h = new Harness();
		VerificationResult r = h.produce(State.initial().withStore(Store.EMPTY.put("x", TX)),
				LET(Y, VAR(X), ACC(FIELD(VAR(Y), F), WRITE())));
		assertFalse(r.isFatal());
		State s = h.states.get(0);
		assertEquals(Arrays.asList(TX), onlyBasicChunk(s).getArguments());
		assertFalse(s.getStore().contains("y"));
	}

	@Test
	public void test_top_level_inhale_exhale() {
		Harness h = new Harness();
		VerificationResult r = h.produce(INITIAL, INHALE_EXHALE(accXF(), CONST(true)));
		assertFalse(r.isFatal());
		assertEquals("f", onlyBasicChunk(h.states.get(0)).getName());
	}

	@Test
	public void test_inhale_exhale_under_implication() {
		Harness h = new Harness();
		VerificationResult r = h.produce(INITIAL, IMPLIES(VAR(B), INHALE_EXHALE(accXF(), CONST(true))));
		assertFalse(r.isFatal());
		assertEquals(2, h.states.size());
		assertEquals("f", onlyBasicChunk(h.states.get(0)).getName());
		assertTrue(h.states.get(1).getHeap().isEmpty());
	}

	@Test
	public void test_inhale_exhale_under_conditional_and_let() {
		Harness h = new Harness();
		Expr thenPart = INHALE_EXHALE(AND(accXF(), accYG()), CONST(true));
		Expr elsePart = LET(Y, VAR(X), INHALE_EXHALE(ACC(FIELD(VAR(Y), G), WRITE()), accXF()));
		VerificationResult r = h.produce(INITIAL, ITE(VAR(B), thenPart, elsePart));
		assertFalse(r.isFatal());
		assertEquals(2, h.states.size());
		assertEquals(2, h.states.get(0).getHeap().size());
		Chunk.Basic c = onlyBasicChunk(h.states.get(1));
		assertEquals("g", c.getName());
		assertEquals(Arrays.asList(TX), c.getArguments());
	}

	@Test
	public void test_quantified_inhale_exhale_malformed() {
		Harness h = new Harness();
		Decl.Parameter r = new Decl.Parameter("r", Type.Ref);
		Expr ie = INHALE_EXHALE(ACC(FIELD(VAR(r), F), WRITE()), CONST(true), POSITION(7, 3));
		VerificationResult result = h.produce(INITIAL, FORALL(r, IMPLIES(NEQ(VAR(r), NULL()), ie)));
		assertTrue(result.isFatal());
		assertEquals(1, result.getErrors().size());
		VerificationError e = result.getErrors().get(0);
		assertEquals(VerificationError.MALFORMED_ASSERTION, e.getCode());
		assertEquals(new Program.Position(7, 3), e.getPosition());
		assertTrue(h.states.isEmpty());
	}

	@Test
	public void test_negative_permission_rejected() {
		Harness h = new Harness();
		VerificationResult r = h.produce(INITIAL, ACC(FIELD(VAR(X), F), NEG(FRACTION(CONST(1), CONST(2)))));
		assertTrue(r.isFatal());
		assertEquals(1, r.getErrors().size());
		assertEquals(VerificationError.EVALUATION_FAILURE, r.getErrors().get(0).getCode());
		assertTrue(r.getErrors().get(0).getMessage().contains("negative permission"));
		assertTrue(h.states.isEmpty());
		for (Term fact : h.facts()) {
			assertFalse(fact instanceof Term.PermAtMost);
		}
	}

	@Test
	public void test_negative_predicate_permission_rejected() {
		Harness h = new Harness();
		Expr acc = ACC(PREDICATE("P", VAR(X)), SUB(FRACTION(CONST(1), CONST(4)), WRITE()));
		VerificationResult r = h.produce(INITIAL, acc);
		assertTrue(r.isFatal());
		assertEquals(VerificationError.EVALUATION_FAILURE, r.getErrors().get(0).getCode());
		assertTrue(h.states.isEmpty());
	}

	@Test
	public void test_negative_quantified_permission_rejected() {
		Harness h = new Harness();
		Decl.Parameter r = new Decl.Parameter("r", Type.Ref);
		Expr qp = FORALL(r, IMPLIES(NEQ(VAR(r), NULL()), ACC(FIELD(VAR(r), F), NEG(WRITE()))));
		VerificationResult result = h.produce(INITIAL, qp);
		assertTrue(result.isFatal());
		assertEquals(VerificationError.EVALUATION_FAILURE, result.getErrors().get(0).getCode());
		assertTrue(h.states.isEmpty());
	}

	@Test
	public void test_symbolic_permission_assumed_non_negative() {
		Harness h = new Harness();
		Decl.Parameter q = new Decl.Parameter("q", Type.Perm);
		Term tq = Logic.VAR("q", Sort.Perm);
		VerificationResult r = h.produce(INITIAL.withStore(INITIAL.getStore().put("q", tq)),
				ACC(FIELD(VAR(X), F), VAR(q)));
		assertFalse(r.isFatal());
		assertEquals(tq, onlyBasicChunk(h.states.get(0)).getPermission());
		assertTrue(h.facts().contains(Logic.PERM_ATMOST(Logic.NONE, tq)));
	}

	@Test
	public void test_guarded_field_read() {
		Harness h = new Harness();
		Expr read = ITE(VAR(B), FIELD(VAR(X), F), CONST(0));
		VerificationResult r = h.produce(INITIAL, AND(IMPLIES(VAR(B), accXF()), EQ(read, CONST(0))));
		assertFalse(r.isFatal());
		assertEquals(2, h.states.size());
		assertEquals(1, h.states.get(0).getHeap().size());
		assertTrue(h.states.get(1).getHeap().isEmpty());
	}

	@Test
	public void test_evaluation_failure_short_circuits() {
		Harness h = new Harness();
		VerificationResult r = h.produce(INITIAL,
				AND(accYG(), ACC(FIELD(VAR(X), F), FRACTION(CONST(1), CONST(0)))));
		assertTrue(r.isFatal());
		assertEquals(VerificationError.EVALUATION_FAILURE, r.getErrors().get(0).getCode());
		assertTrue(h.states.isEmpty());
	}

	@Test
	public void test_unknown_variable() {
		Harness h = new Harness();
		VerificationResult r = h.produce(INITIAL, NEQ(VAR("z", Type.Ref), NULL()));
		assertTrue(r.isFatal());
		assertEquals(VerificationError.EVALUATION_FAILURE, r.getErrors().get(0).getCode());
	}

	@Test
	public void test_magic_wand() {
		Harness h = new Harness();
		Expr.MagicWand wand = WAND(accXF(), ACC(FIELD(VAR(X), G), WRITE()));
		VerificationResult r = h.produce(INITIAL, wand);
		assertFalse(r.isFatal());
		Heap heap = h.states.get(0).getHeap();
		assertEquals(1, heap.size());
		Chunk.MagicWand c = (Chunk.MagicWand) heap.values().get(0);
		assertEquals("acc($0.f, write) --* acc($0.g, write)", c.getName());
		assertEquals(Arrays.asList(TX), c.getArguments());
		assertEquals(Logic.WAND_SNAPSHOT(Logic.CONVERT(SNAPSHOT, Sort.Snap)), c.getSnapshot());
		assertEquals(Logic.FULL, c.getPermission());
	}

	@Test
	public void test_quantified_magic_wand() {
		Harness h = new Harness();
		Expr.MagicWand wand = WAND(accXF(), ACC(FIELD(VAR(X), G), WRITE()));
		State s = INITIAL.withQuantifiedResources(Collections.emptySet(), Collections.emptySet(),
				new HashSet<>(Arrays.asList("acc($0.f, write) --* acc($0.g, write)")));
		s = s.withFunctionRecorder(new FunctionRecorder.Recording());
		VerificationResult r = h.produce(s, wand);
		assertFalse(r.isFatal());
		State after = h.states.get(0);
		Chunk.Quantified c = (Chunk.Quantified) after.getHeap().values().get(0);
		assertEquals(Chunk.Kind.WAND, c.getKind());
		assertTrue(c.isSingleton());
		assertEquals(Arrays.asList(TX), c.getSingletonArguments());
		assertEquals(1, after.getFunctionRecorder().getSnapshotMaps().size());
		assertEquals(1, after.getSnapshotMapCache().size());
	}

	@Test
	public void test_quantified_field_single_location() {
		Harness h = new Harness();
		State s = INITIAL.withQuantifiedResources(new HashSet<>(Arrays.asList("f")), Collections.emptySet(),
				Collections.emptySet());
		VerificationResult r = h.produce(s, accXF());
		assertFalse(r.isFatal());
		Chunk.Quantified c = (Chunk.Quantified) h.states.get(0).getHeap().values().get(0);
		assertEquals("f", c.getName());
		assertEquals(Arrays.asList(TX), c.getSingletonArguments());
		boolean triggered = false;
		for (Term t : h.facts()) {
			triggered |= t instanceof Term.ResourceTrigger && ((Term.ResourceTrigger) t).getResource().equals("f");
		}
		assertTrue(triggered);
	}

	@Test
	public void test_quantified_permission_assertion() {
		Harness h = new Harness();
		Decl.Parameter r = new Decl.Parameter("r", Type.Ref);
		Expr qp = FORALL(r, IMPLIES(NEQ(VAR(r), NULL()), ACC(FIELD(VAR(r), F), WRITE())));
		VerificationResult result = h.produce(INITIAL, qp);
		assertFalse(result.isFatal());
		Heap heap = h.states.get(0).getHeap();
		assertEquals(1, heap.size());
		Chunk.Quantified c = (Chunk.Quantified) heap.values().get(0);
		assertEquals(Chunk.Kind.FIELD, c.getKind());
		assertFalse(c.isSingleton());
		assertEquals(Arrays.asList(Logic.VAR("r", Sort.Ref)), c.getFormals());
		assertEquals(Logic.CONVERT(SNAPSHOT, new Sort.FieldValueFunction(Sort.Int)), c.getSnapshotMap());
	}

	@Test
	public void test_quantified_predicate_assertion() {
		Harness h = new Harness();
		Decl.Parameter r = new Decl.Parameter("r", Type.Ref);
		Expr qp = FORALL(r, ACC(PREDICATE("P", VAR(r)), FRACTION(1, 2)));
		VerificationResult result = h.produce(INITIAL, qp);
		assertFalse(result.isFatal());
		Chunk.Quantified c = (Chunk.Quantified) h.states.get(0).getHeap().values().get(0);
		assertEquals(Chunk.Kind.PREDICATE, c.getKind());
		assertEquals("P", c.getName());
		assertEquals(Arrays.asList(Logic.VAR("x", Sort.Ref)), c.getFormals());
	}

	@Test
	public void test_exhale_extension_tracks_reserve_heap() {
		Harness h = new Harness();
		State s = INITIAL.withExhaleExt(true).withReserveHeaps(Arrays.asList(Heap.EMPTY, Heap.EMPTY));
		h.produce(s, accXF());
		State after = h.states.get(0);
		assertEquals(2, after.getReserveHeaps().size());
		assertEquals(after.getHeap(), after.getReserveHeaps().get(0));
		assertEquals(Heap.EMPTY, after.getReserveHeaps().get(1));
	}

	@Test
	public void test_spans_per_conjunct() {
		Harness h = new Harness();
		h.produce(INITIAL, AND(accXF(), NEQ(VAR(Y), NULL())));
		assertEquals(Arrays.asList("enter acc(x.f, write)", "leave acc(x.f, write)", "enter y != null",
				"leave y != null"), h.spans);
	}
}
