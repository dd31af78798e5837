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

import java.util.List;

import wyheap.core.Program.Decl;
import wyheap.core.Program.Expr;
import wyheap.state.State;
import wyheap.verifier.ErrorDescriptor;
import wyheap.verifier.VerificationResult;

/**
 * Evaluates pure expressions into terms.
 *
 * @author David J. Pearce
 *
 */
public interface Evaluator {

	public VerificationResult eval(State state, Expr expr, ErrorDescriptor pve, Continuation.OfTerm continuation);

	/**
	 * Evaluate a sequence of expressions from left to right.
	 */
	public VerificationResult evals(State state, List<Expr> exprs, ErrorDescriptor pve,
			Continuation.OfTerms continuation);

	/**
	 * Evaluate the parts of a quantified assertion under fresh instances of its
	 * bound variables.
	 *
	 * @param state
	 * @param universal
	 * @param variables  The variables bound by the quantifier.
	 * @param conditions Expressions evaluated to boolean terms over the bound
	 *                   variables.
	 * @param bodies     Expressions evaluated to terms over the bound variables.
	 * @param triggers
	 * @param pve
	 * @param continuation
	 * @return
	 */
	public VerificationResult evalQuantified(State state, boolean universal, List<Decl.Parameter> variables,
			List<Expr> conditions, List<Expr> bodies, List<Expr.Trigger> triggers, ErrorDescriptor pve,
			Continuation.OfQuantified continuation);
}
