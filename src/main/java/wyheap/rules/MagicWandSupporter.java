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
import wyheap.core.Program.Expr;
import wyheap.state.State;
import wyheap.verifier.ErrorDescriptor;
import wyheap.verifier.VerificationResult;

public interface MagicWandSupporter {
	/**
	 * Create the chunk representing a given magic wand instance with a given
	 * snapshot. The chunk is not added to the heap.
	 *
	 * @param state
	 * @param wand
	 * @param snapshot
	 * @param pve
	 * @param continuation
	 * @return
	 */
	public VerificationResult createChunk(State state, Expr.MagicWand wand, Term snapshot, ErrorDescriptor pve,
			Continuation.OfChunk continuation);
}
