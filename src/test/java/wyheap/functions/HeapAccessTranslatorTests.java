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
import static wyheap.core.Program.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import wyheap.core.Logic;
import wyheap.core.Logic.Fun;
import wyheap.core.Logic.Sort;
import wyheap.core.Logic.SuffixedIdentifier;
import wyheap.core.Logic.Term;
import wyheap.core.Program;
import wyheap.core.Program.Decl;
import wyheap.core.Program.Expr;
import wyheap.core.Program.Type;
import wyheap.verifier.RecordingDecider;
import wyheap.verifier.VerificationError;
import wyheap.verifier.Verifier;

public class HeapAccessTranslatorTests {
	private static final Decl.Field F = new Decl.Field("f", Type.Int);
	private static final Decl.Parameter X = new Decl.Parameter("x", Type.Ref);
	private static final Decl.Parameter R = new Decl.Parameter("r", Type.Ref);
	private static final Decl.Predicate P = new Decl.Predicate("P", Arrays.asList(X), ACC(FIELD(VAR(X), F), WRITE()));

	private static final Term.Var HEAP = Logic.VAR("$heap", Sort.PHeap);
	private static final Term.Var TX = Logic.VAR("x", Sort.Ref);

	private final ArrayList<String> warnings = new ArrayList<>();

	private static Decl.Function function(String name, Expr body) {
		return new Decl.Function(name, Arrays.asList(X), Type.Int, Collections.emptyList(), Collections.emptyList(),
				body);
	}

	private static Program program(Decl.Function... functions) {
		return new Program(Arrays.asList(F), Arrays.asList(P), Arrays.asList(functions));
	}

	private HeapAccessTranslator translator(Map<String, FunctionData> functions, boolean fatal) {
		ResolutionFallback fallback = new ResolutionFallback(new RecordingDecider(), (p, d) -> fatal,
				(p, d) -> "unresolved heap reference in " + d.getFunction().getName(), warnings::add);
		return new HeapAccessTranslator(functions, fallback);
	}

	private static TranslationContext context(Program program, FunctionData data, boolean ignore, boolean exhaling) {
		Map<String, FunctionData> functions = Collections.singletonMap(data.getFunction().getName(), data);
		return new TranslationContext(program, data, functions, data.getFormalSnapshot(), ignore, exhaling);
	}

	@Test
	public void test_field_lookup() {
		Decl.Function f = function("f", FIELD(VAR(X), F));
		Program program = program(f);
		Map<String, FunctionData> functions = FunctionData.forProgram(program);
		Optional<Term> body = translator(functions, true).translate(program, f, functions.get("f"));
		assertEquals(Optional.of(Logic.LOOKUP_FIELD("f", Sort.Int, HEAP, TX)), body);
	}

	@Test
	public void test_unfolding_narrows_snapshot() {
		Decl.Function f = function("f", UNFOLDING(ACC(PREDICATE("P", VAR(X)), WRITE()), FIELD(VAR(X), F)));
		Program program = program(f);
		Map<String, FunctionData> functions = FunctionData.forProgram(program);
		Term body = translator(functions, true).translate(program, f, functions.get("f")).get();
		List<Term> args = Arrays.asList(TX);
		Term narrowed = Logic.COMBINE(Logic.LOOKUP_PREDICATE("P", HEAP, args),
				Logic.REMOVE_PREDICATE("P", HEAP, args));
		assertEquals(Logic.LOOKUP_FIELD("f", Sort.Int, narrowed, TX), body);
	}

	@Test
	public void test_no_body() {
		Decl.Function f = function("f", null);
		Program program = program(f);
		Map<String, FunctionData> functions = FunctionData.forProgram(program);
		assertFalse(translator(functions, true).translate(program, f, functions.get("f")).isPresent());
	}

	@Test
	public void test_call_to_greater_height() {
		Decl.Function f = function("f", INVOKE("g", VAR(X), Type.Int));
		Decl.Function g = function("g", CONST(1));
		Map<String, FunctionData> functions = heights(f, 0, g, 1);
		Term body = translator(functions, true).translate(program(f, g), f, functions.get("f")).get();
		Fun symbol = functions.get("g").getSymbol();
		assertEquals("g", symbol.getName());
		assertEquals(Logic.APP(symbol, Logic.RESTRICT("g", HEAP, Arrays.asList(TX)), TX), body);
	}

	@Test
	public void test_call_to_lesser_height_is_limited() {
		Decl.Function f = function("f", CONST(1));
		Decl.Function g = function("g", UNFOLDING(ACC(PREDICATE("P", VAR(X)), WRITE()), INVOKE("f", VAR(X), Type.Int)));
		Map<String, FunctionData> functions = heights(f, 0, g, 1);
		Term body = translator(functions, true).translate(program(f, g), g, functions.get("g")).get();
		List<Term> args = Arrays.asList(TX);
		Term narrowed = Logic.COMBINE(Logic.LOOKUP_PREDICATE("P", HEAP, args),
				Logic.REMOVE_PREDICATE("P", HEAP, args));
		Fun tag = new Fun("PHeap.funTrigger_P", Arrays.asList(Sort.PHeap), Sort.PHeap);
		Term snapshot = Logic.APP(tag, Logic.RESTRICT("f", narrowed, args));
		Fun limited = functions.get("f").getLimitedSymbol();
		assertEquals("f%limited", limited.getName());
		assertEquals(Logic.APP(limited, snapshot, TX), body);
	}

	@Test
	public void test_self_recursion_is_limited() {
		Decl.Function f = function("f", INVOKE("f", VAR(X), Type.Int));
		Program program = program(f);
		Map<String, FunctionData> functions = FunctionData.forProgram(program);
		Term body = translator(functions, true).translate(program, f, functions.get("f")).get();
		assertTrue(((Term.App) body).getFunction().isLimited());
	}

	@Test
	public void test_unknown_callee() {
		Decl.Function f = function("f", INVOKE("h", VAR(X), Type.Int));
		Program program = program(f);
		Map<String, FunctionData> functions = FunctionData.forProgram(program);
		assertThrows(IllegalArgumentException.class,
				() -> translator(functions, true).translate(program, f, functions.get("f")));
	}

	private static Map<String, FunctionData> heights(Decl.Function f, int fh, Decl.Function g, int gh) {
		Program program = program(f, g);
		Fun trigger = Verifier.predicateTrigger(program, "P");
		LinkedHashMap<String, FunctionData> functions = new LinkedHashMap<>();
		functions.put(f.getName(), new FunctionData(f, fh, Collections.singletonMap("P", trigger)));
		functions.put(g.getName(), new FunctionData(g, gh, Collections.singletonMap("P", trigger)));
		return functions;
	}

	@Test
	public void test_wildcard_is_deterministic() {
		Decl.Function f = function("f", null);
		Program program = program(f);
		FunctionData data = new FunctionData(f, 0, Collections.emptyMap());
		HeapAccessTranslator translator = translator(Collections.singletonMap("f", data), true);
		Fun fresh = new Fun("freshWildcard", Arrays.asList(Sort.Int), Sort.Perm);
		Term t1 = translator.translate(context(program, data, false, false), WILDCARD(POSITION(5, 1)));
		Term t2 = translator.translate(context(program, data, false, false), WILDCARD(POSITION(5, 1)));
		assertEquals(Logic.APP(fresh, Logic.CONST(5)), t1);
		assertEquals(t1, t2);
		Term t3 = translator.translate(context(program, data, false, false), WILDCARD(POSITION(6, 1)));
		assertEquals(Logic.APP(fresh, Logic.CONST(6)), t3);
		assertNotEquals(t1, t3);
		assertEquals(Logic.APP(fresh, Logic.CONST(0)),
				translator.translate(context(program, data, false, false), WILDCARD()));
	}

	@Test
	public void test_quantified_variables_renamed() {
		Expr.CurrentPermission perm = PERM(FIELD(VAR(R), F));
		Expr forall = FORALL(R, EQ(perm, WRITE()));
		Decl.Function f = function("f", null);
		Program program = program(f);
		Fun permOf = new Fun("permOf", Arrays.asList(Sort.Ref), Sort.Perm);
		Map<Expr, Term> recorded = new IdentityHashMap<>();
		recorded.put(perm, Logic.APP(permOf, Logic.VAR(new SuffixedIdentifier("r", "7"), Sort.Ref)));
		FunctionData data = new FunctionData(f, 0, Collections.emptyMap()).withRecordedTerms(recorded);
		Term t = translator(Collections.singletonMap("f", data), true).translate(context(program, data, false, false),
				forall);
		Term.Var r = Logic.VAR("r", Sort.Ref);
		Term expected = Logic.FORALL(Arrays.asList(r), Logic.EQ(Logic.APP(permOf, r), Logic.FULL),
				Collections.emptyList());
		assertEquals(expected, t);
		assertTrue(warnings.isEmpty());
	}

	@Test
	public void test_unresolved_fatal() {
		Decl.Function f = function("f", LT(PERM(FIELD(VAR(X), F)), WRITE()));
		Program program = program(f);
		Map<String, FunctionData> functions = FunctionData.forProgram(program);
		assertFalse(translator(functions, true).translate(program, f, functions.get("f")).isPresent());
		assertEquals(Arrays.asList("unresolved heap reference in f"), warnings);
	}

	@Test
	public void test_unresolved_warns_once() {
		Decl.Function f = function("f", EQ(PERM(FIELD(VAR(X), F)), PERM(FIELD(VAR(X), F))));
		Program program = program(f);
		Map<String, FunctionData> functions = FunctionData.forProgram(program);
		Optional<Term> body = translator(functions, false).translate(program, f, functions.get("f"));
		assertTrue(body.isPresent());
		assertEquals(1, warnings.size());
		Term.Equals eq = (Term.Equals) body.get();
		assertNotEquals(eq.getLeftHandSide(), eq.getRightHandSide());
		assertEquals(Sort.Perm, eq.getLeftHandSide().getSort());
	}

	@Test
	public void test_unresolved_silent_after_failures() {
		Decl.Function f = function("f", LT(PERM(FIELD(VAR(X), F)), WRITE()));
		Program program = program(f);
		VerificationError error = new VerificationError(VerificationError.EVALUATION_FAILURE, "failed", f);
		FunctionData data = FunctionData.forProgram(program).get("f")
				.withVerificationFailures(Arrays.asList(error));
		Optional<Term> body = translator(Collections.singletonMap("f", data), true).translate(program, f, data);
		assertFalse(body.isPresent());
		assertTrue(warnings.isEmpty());
	}

	@Test
	public void test_precondition_ignores_access_predicates() {
		Decl.Function f = function("f", null);
		Program program = program(f);
		Map<String, FunctionData> functions = FunctionData.forProgram(program);
		Expr pre = AND(ACC(FIELD(VAR(X), F), WRITE()), GT(FIELD(VAR(X), F), CONST(0)));
		Expr qp = FORALL(R, ACC(FIELD(VAR(R), F), FRACTION(1, 2)));
		List<Term> terms = translator(functions, true)
				.translatePrecondition(program, Arrays.asList(pre, qp), functions.get("f")).get();
		Term expected = Logic.ARITH(Term.Arithmetic.Operator.GREATER, Logic.LOOKUP_FIELD("f", Sort.Int, HEAP, TX),
				Logic.CONST(0));
		assertEquals(Arrays.asList(expected, Logic.TRUE), terms);
	}

	@Test
	public void test_inhale_exhale_views() {
		Decl.Function f = function("f", null);
		Program program = program(f);
		Map<String, FunctionData> functions = FunctionData.forProgram(program);
		Expr ie = INHALE_EXHALE(EQ(FIELD(VAR(X), F), CONST(1)), EQ(FIELD(VAR(X), F), CONST(2)));
		HeapAccessTranslator translator = translator(functions, true);
		Term lookup = Logic.LOOKUP_FIELD("f", Sort.Int, HEAP, TX);
		assertEquals(Arrays.asList(Logic.EQ(lookup, Logic.CONST(1))),
				translator.translatePostcondition(program, Arrays.asList(ie), functions.get("f")).get());
		assertEquals(Arrays.asList(Logic.EQ(lookup, Logic.CONST(2))),
				translator.translatePrecondition(program, Arrays.asList(ie), functions.get("f")).get());
	}

	@Test
	public void test_access_predicate_in_postcondition() {
		Decl.Function f = function("f", null);
		Program program = program(f);
		Map<String, FunctionData> functions = FunctionData.forProgram(program);
		HeapAccessTranslator translator = translator(functions, true);
		assertThrows(IllegalArgumentException.class, () -> translator.translatePostcondition(program,
				Arrays.asList((Expr) ACC(FIELD(VAR(X), F), WRITE())), functions.get("f")));
	}

	@Test
	public void test_result_and_formals() {
		Decl.Function f = function("f", null);
		Program program = program(f);
		FunctionData data = new FunctionData(f, 0, Collections.emptyMap());
		HeapAccessTranslator translator = translator(Collections.singletonMap("f", data), true);
		Term t = translator.translate(context(program, data, false, false),
				EQ(RESULT(Type.Int), ITE(EQ(VAR(X), NULL()), CONST(0), NEG(CONST(1)))));
		Term expected = Logic.EQ(Logic.VAR("result", Sort.Int),
				Logic.ITE(Logic.EQ(TX, Logic.NULL), Logic.CONST(0),
						Logic.ARITH(Term.Arithmetic.Operator.MINUS, Logic.CONST(0), Logic.CONST(1))));
		assertEquals(expected, t);
	}
}
