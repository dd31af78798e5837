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

import wyheap.state.Chunk;
import wyheap.state.Heap;
import wyheap.state.State;
import wyheap.verifier.VerificationResult;

/**
 * Adds non-quantified chunks to a heap.
 *
 * @author David J. Pearce
 *
 */
public interface ChunkSupporter {
	/**
	 * Add a chunk to a given heap, merging it with any chunk of the same identity
	 * already present. The resulting heap is passed to the continuation, which is
	 * responsible for installing it in the state.
	 *
	 * @param state
	 * @param heap
	 * @param chunk
	 * @param continuation
	 * @return
	 */
	public VerificationResult produce(State state, Heap heap, Chunk.NonQuantified chunk,
			Continuation.OfHeap continuation);
}
