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
import java.util.function.Function;

import wyheap.core.Logic.Term;
import wyheap.state.Chunk;
import wyheap.state.Heap;
import wyheap.state.SnapshotMapDefinition;
import wyheap.state.State;
import wyheap.util.Pair;
import wyheap.verifier.VerificationResult;

/**
 * Manages resources governed by quantified permissions. Such resources are
 * held in {@link Chunk.Quantified} chunks, whose values are given by snapshot
 * maps from resource arguments to values.
 *
 * @author David J. Pearce
 *
 */
public interface QuantifiedChunkSupporter {

	/**
	 * Produce the family of resources described by a quantified permission
	 * assertion <code>forall qvars :: condition ==> acc(resource(args), permission)</code>.
	 *
	 * @param state
	 * @param variables   The (fresh) quantified variables.
	 * @param condition   Term over the quantified variables.
	 * @param resource    Name of the field, predicate or wand identity.
	 * @param kind
	 * @param formals     Formal variables describing one resource instance.
	 * @param arguments   Resource arguments in terms of the quantified variables.
	 * @param snapshotMap Snapshot map giving the values of produced resources.
	 * @param permission  Term over the quantified variables.
	 * @param triggers
	 * @param continuation
	 * @return
	 */
	public VerificationResult produce(State state, List<Term.Var> variables, Term condition, String resource,
			Chunk.Kind kind, List<Term.Var> formals, List<Term> arguments, Term snapshotMap, Term permission,
			List<Term.Trigger> triggers, Continuation continuation);

	/**
	 * Produce a single resource instance for a resource governed by quantified
	 * permissions.
	 *
	 * @param state
	 * @param resource
	 * @param kind
	 * @param formals
	 * @param arguments
	 * @param snapshot
	 * @param permission
	 * @param trigger    Constructs the trigger term for a given snapshot map.
	 * @param continuation
	 * @return
	 */
	public VerificationResult produceSingleLocation(State state, String resource, Chunk.Kind kind,
			List<Term.Var> formals, List<Term> arguments, Term snapshot, Term permission,
			Function<Term, Term> trigger, Continuation continuation);

	/**
	 * Construct a fresh snapshot map which maps the given arguments to a given
	 * value, along with its definitional axiom.
	 *
	 * @return The snapshot map and its definitional axiom.
	 */
	public Pair<Term, Term> singletonSnapshotMap(State state, String resource, Chunk.Kind kind,
			List<Term> arguments, Term value);

	public Chunk.Quantified createSingletonQuantifiedChunk(List<Term.Var> formals, String resource,
			Chunk.Kind kind, List<Term> arguments, Term permission, Term snapshotMap);

	/**
	 * Split a heap into the quantified chunks for a given resource and all other
	 * chunks.
	 */
	public Pair<List<Chunk.Quantified>, List<Chunk>> splitHeap(Heap heap, String resource);

	/**
	 * Construct a snapshot map which agrees with each of the given chunks on all
	 * locations to which it holds permission. Results are cached in the state.
	 *
	 * @return The updated state along with the map's definition.
	 */
	public Pair<State, SnapshotMapDefinition> summarisingSnapshotMap(State state, String resource,
			List<Term.Var> formals, List<Chunk.Quantified> chunks);
}
