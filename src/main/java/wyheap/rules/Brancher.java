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

import wyheap.core.Logic.Term;
import wyheap.state.State;
import wyheap.verifier.VerificationResult;

/**
 * Explores two alternative continuations under a condition and its negation.
 * Both sides are always explored, and their outcomes are aggregated with
 * {@link VerificationResult#combine(VerificationResult)}.
 *
 * @author David J. Pearce
 *
 */
public interface Brancher {
	public VerificationResult branch(State state, Term condition, Continuation trueBranch,
			Continuation falseBranch);
}
