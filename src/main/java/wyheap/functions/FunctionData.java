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

import static wyheap.core.Logic.VAR;
import static wyheap.core.Logic.toSort;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import wyheap.core.Logic.Fun;
import wyheap.core.Logic.Sort;
import wyheap.core.Logic.Term;
import wyheap.core.Program;
import wyheap.core.Program.Decl;
import wyheap.core.Program.Expr;
import wyheap.util.NameExtractor;
import wyheap.verifier.VerificationError;
import wyheap.verifier.Verifier;

/**
 * Information about a function required to translate its body and
 * specification into axioms.
 *
 * @author David J. Pearce
 *
 */
public class FunctionData {
	private final Decl.Function function;
	private final Map<String, Term.Var> formalArgs;
	private final Term.Var formalResult;
	private final int height;
	/**
	 * Trigger functions for the predicates mentioned by this function.
	 */
	private final Map<String, Fun> predicateTriggers;
	/**
	 * Terms recorded for subexpressions of this function during an earlier
	 * verification of it. Keyed on identity.
	 */
	private final Map<Expr, Term> recordedTerms;
	private final List<VerificationError> verificationFailures;

	public FunctionData(Decl.Function function, int height, Map<String, Fun> predicateTriggers) {
		this(function, height, predicateTriggers, new IdentityHashMap<>(), Collections.emptyList());
	}

	private FunctionData(Decl.Function function, int height, Map<String, Fun> predicateTriggers,
			Map<Expr, Term> recordedTerms, List<VerificationError> verificationFailures) {
		this.function = function;
		this.height = height;
		this.predicateTriggers = Collections.unmodifiableMap(new LinkedHashMap<>(predicateTriggers));
		this.recordedTerms = Collections.unmodifiableMap(new IdentityHashMap<>(recordedTerms));
		this.verificationFailures = Collections.unmodifiableList(new ArrayList<>(verificationFailures));
		LinkedHashMap<String, Term.Var> args = new LinkedHashMap<>();
		for (Decl.Parameter p : function.getParameters()) {
			args.put(p.getName(), VAR(p.getName(), toSort(p.getType())));
		}
		this.formalArgs = Collections.unmodifiableMap(args);
		this.formalResult = VAR("result", toSort(function.getReturns()));
	}

	public Decl.Function getFunction() {
		return function;
	}

	public Map<String, Term.Var> getFormalArgs() {
		return formalArgs;
	}

	public Term.Var getFormalResult() {
		return formalResult;
	}

	public int getHeight() {
		return height;
	}

	public Map<String, Fun> getPredicateTriggers() {
		return predicateTriggers;
	}

	public Map<Expr, Term> getRecordedTerms() {
		return recordedTerms;
	}

	public List<VerificationError> getVerificationFailures() {
		return verificationFailures;
	}

	/**
	 * The heap snapshot over which this function's body and specification are
	 * translated.
	 */
	public Term.Var getFormalSnapshot() {
		return VAR("$heap", Sort.PHeap);
	}

	/**
	 * Get the function symbol for this function, which accepts a heap snapshot
	 * followed by the function's arguments.
	 *
	 * @return
	 */
	public Fun getSymbol() {
		ArrayList<Sort> parameters = new ArrayList<>();
		parameters.add(Sort.PHeap);
		for (Term.Var v : formalArgs.values()) {
			parameters.add(v.getSort());
		}
		return new Fun(function.getName(), parameters, formalResult.getSort());
	}

	public Fun getLimitedSymbol() {
		return getSymbol().limited();
	}

	public FunctionData withRecordedTerms(Map<Expr, Term> terms) {
		return new FunctionData(function, height, predicateTriggers, terms, verificationFailures);
	}

	public FunctionData withVerificationFailures(List<VerificationError> failures) {
		return new FunctionData(function, height, predicateTriggers, recordedTerms, failures);
	}

	/**
	 * Construct the function data for every function in a given program.
	 *
	 * @param program
	 * @return Map from function names to their data, in declaration order.
	 */
	public static Map<String, FunctionData> forProgram(Program program) {
		Map<String, Integer> heights = FunctionHeights.compute(program);
		LinkedHashMap<String, FunctionData> result = new LinkedHashMap<>();
		for (Decl.Function f : program.getFunctions()) {
			ArrayList<Expr> exprs = new ArrayList<>(f.getRequires());
			exprs.addAll(f.getEnsures());
			if (f.getBody() != null) {
				exprs.add(f.getBody());
			}
			LinkedHashMap<String, Fun> triggers = new LinkedHashMap<>();
			for (String p : NameExtractor.PREDICATES.extract(exprs)) {
				triggers.put(p, Verifier.predicateTrigger(program, p));
			}
			result.put(f.getName(), new FunctionData(f, heights.get(f.getName()), triggers));
		}
		return result;
	}
}
