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

import static wyheap.core.Logic.NOT;

import wyheap.core.Logic.Term;
import wyheap.state.State;
import wyheap.verifier.Decider;
import wyheap.verifier.VerificationResult;

/**
 * Explores the true branch and then the false branch, each within its own
 * scope of the decider so that path conditions from one side never leak into
 * the other.
 *
 * @author David J. Pearce
 *
 */
public class DefaultBrancher implements Brancher {
	private final Decider decider;

	public DefaultBrancher(Decider decider) {
		this.decider = decider;
	}

	@Override
	public VerificationResult branch(State state, Term condition, Continuation trueBranch,
			Continuation falseBranch) {
		VerificationResult r1 = explore(state, condition, trueBranch);
		VerificationResult r2 = explore(state, NOT(condition), falseBranch);
		return r1.combine(r2);
	}

	private VerificationResult explore(State state, Term condition, Continuation continuation) {
		decider.pushScope();
		try {
			decider.assume(condition);
			return continuation.apply(state);
		} finally {
			decider.popScope();
		}
	}
}
