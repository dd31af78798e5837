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

import wyheap.core.Logic.Term;
import wyheap.state.Chunk;
import wyheap.state.Heap;
import wyheap.state.State;
import wyheap.verifier.VerificationResult;

/**
 * The remainder of a symbolic execution, to be invoked once the current step
 * has succeeded. A step which fails never invokes its continuation but, rather,
 * returns a failure directly.
 *
 * @author David J. Pearce
 *
 */
public interface Continuation {

	public VerificationResult apply(State state);

	/**
	 * A continuation receiving the term an expression evaluated to.
	 */
	public interface OfTerm {
		public VerificationResult apply(State state, Term term);
	}

	public interface OfTerms {
		public VerificationResult apply(State state, List<Term> terms);
	}

	/**
	 * A continuation receiving an updated heap, which is not yet installed in
	 * the state.
	 */
	public interface OfHeap {
		public VerificationResult apply(State state, Heap heap);
	}

	public interface OfChunk {
		public VerificationResult apply(State state, Chunk.NonQuantified chunk);
	}

	/**
	 * A continuation receiving the result of evaluating a quantified
	 * assertion. Conditions and bodies are given over the fresh quantified
	 * variables.
	 */
	public interface OfQuantified {
		public VerificationResult apply(State state, List<Term.Var> variables, List<Term> conditions,
				List<Term> bodies, List<Term.Trigger> triggers);
	}
}
