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

import wyheap.state.Chunk;
import wyheap.state.Heap;
import wyheap.state.State;
import wyheap.verifier.Decider;
import wyheap.verifier.VerificationResult;

public class DefaultChunkSupporter implements ChunkSupporter {
	private final Decider decider;

	public DefaultChunkSupporter(Decider decider) {
		this.decider = decider;
	}

	@Override
	public VerificationResult produce(State state, Heap heap, Chunk.NonQuantified chunk,
			Continuation.OfHeap continuation) {
		for (Chunk c : heap) {
			if (c instanceof Chunk.NonQuantified && ((Chunk.NonQuantified) c).hasSameIdentity(chunk)) {
				Chunk.NonQuantified existing = (Chunk.NonQuantified) c;
				decider.assume(EQ(existing.getSnapshot(), chunk.getSnapshot()));
				Chunk.NonQuantified merged = existing
						.withPermission(PERM_PLUS(existing.getPermission(), chunk.getPermission()));
				if (merged.getKind() == Chunk.Kind.FIELD) {
					// Write permission to a field is exclusive
					decider.assume(PERM_ATMOST(merged.getPermission(), FULL));
				}
				return continuation.apply(state, heap.replace(existing, merged));
			}
		}
		return continuation.apply(state, heap.add(chunk));
	}
}
