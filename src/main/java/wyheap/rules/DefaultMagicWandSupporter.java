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

import static wyheap.core.Logic.FULL;

import wyheap.core.Logic.Term;
import wyheap.core.Program.Expr;
import wyheap.state.Chunk;
import wyheap.state.MagicWandIdentifier;
import wyheap.state.State;
import wyheap.verifier.ErrorDescriptor;
import wyheap.verifier.VerificationResult;

/**
 * Creates wand chunks identified by the abstracted structure of the wand,
 * whose arguments are the values of the abstracted subexpressions.
 *
 * @author David J. Pearce
 *
 */
public class DefaultMagicWandSupporter implements MagicWandSupporter {
	private final Evaluator evaluator;

	public DefaultMagicWandSupporter(Evaluator evaluator) {
		this.evaluator = evaluator;
	}

	@Override
	public VerificationResult createChunk(State state, Expr.MagicWand wand, Term snapshot, ErrorDescriptor pve,
			Continuation.OfChunk continuation) {
		MagicWandIdentifier id = MagicWandIdentifier.of(wand);
		return evaluator.evals(state, id.getSubexpressions(), pve,
				(s1, args) -> continuation.apply(s1, new Chunk.MagicWand(id.getName(), args, snapshot, FULL)));
	}
}
