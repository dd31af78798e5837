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
package wyheap.state;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import wyheap.core.Logic;
import wyheap.core.Logic.Term;
import wyheap.util.Pair;

/**
 * The symbolic configuration threaded through symbolic execution. States are
 * immutable and every <code>withX</code> method returns an updated copy, hence
 * two branches of an exploration never alias the same heap.
 *
 * @author David J. Pearce
 *
 */
public class State {
	/**
	 * The current heap.
	 */
	private final Heap heap;
	/**
	 * The stack of reserve heaps used whilst packaging magic wands, with the top
	 * of stack first.
	 */
	private final List<Heap> reserveHeaps;
	private final Store store;
	/**
	 * The factor by which all produced permission amounts are scaled.
	 */
	private final Term permissionScalingFactor;
	private final FunctionRecorder functionRecorder;
	/**
	 * The fields, predicates and wand identities whose permissions are governed
	 * by quantified reasoning.
	 */
	private final Set<String> qpFields;
	private final Set<String> qpPredicates;
	private final Set<String> qpMagicWands;
	/**
	 * The formal variables used to describe the instances of each quantified
	 * predicate.
	 */
	private final Map<String, List<Term.Var>> predicateFormalVariables;
	private final Map<Pair<String, List<Chunk.Quantified>>, SnapshotMapDefinition> snapshotMapCache;
	/**
	 * Indicates execution takes place within an exhale extension (e.g. whilst
	 * packaging a wand), in which case the top reserve heap tracks the current
	 * heap.
	 */
	private final boolean exhaleExt;

	private State(Heap heap, List<Heap> reserveHeaps, Store store, Term permissionScalingFactor,
			FunctionRecorder functionRecorder, Set<String> qpFields, Set<String> qpPredicates,
			Set<String> qpMagicWands, Map<String, List<Term.Var>> predicateFormalVariables,
			Map<Pair<String, List<Chunk.Quantified>>, SnapshotMapDefinition> snapshotMapCache, boolean exhaleExt) {
		this.heap = heap;
		this.reserveHeaps = Collections.unmodifiableList(new ArrayList<>(reserveHeaps));
		this.store = store;
		this.permissionScalingFactor = permissionScalingFactor;
		this.functionRecorder = functionRecorder;
		this.qpFields = Collections.unmodifiableSet(new HashSet<>(qpFields));
		this.qpPredicates = Collections.unmodifiableSet(new HashSet<>(qpPredicates));
		this.qpMagicWands = Collections.unmodifiableSet(new HashSet<>(qpMagicWands));
		this.predicateFormalVariables = Collections.unmodifiableMap(new HashMap<>(predicateFormalVariables));
		this.snapshotMapCache = Collections.unmodifiableMap(new HashMap<>(snapshotMapCache));
		this.exhaleExt = exhaleExt;
	}

	/**
	 * Construct an initial state with an empty heap and store, a scaling factor
	 * of one and no function recording.
	 *
	 * @return
	 */
	public static State initial() {
		return new State(Heap.EMPTY, Collections.emptyList(), Store.EMPTY, Logic.FULL, FunctionRecorder.NOOP,
				Collections.emptySet(), Collections.emptySet(), Collections.emptySet(), Collections.emptyMap(),
				Collections.emptyMap(), false);
	}

	public Heap getHeap() {
		return heap;
	}

	public List<Heap> getReserveHeaps() {
		return reserveHeaps;
	}

	public Store getStore() {
		return store;
	}

	public Term getPermissionScalingFactor() {
		return permissionScalingFactor;
	}

	public FunctionRecorder getFunctionRecorder() {
		return functionRecorder;
	}

	public Set<String> getQpFields() {
		return qpFields;
	}

	public Set<String> getQpPredicates() {
		return qpPredicates;
	}

	public Set<String> getQpMagicWands() {
		return qpMagicWands;
	}

	public Map<String, List<Term.Var>> getPredicateFormalVariables() {
		return predicateFormalVariables;
	}

	public Map<Pair<String, List<Chunk.Quantified>>, SnapshotMapDefinition> getSnapshotMapCache() {
		return snapshotMapCache;
	}

	public boolean isExhaleExt() {
		return exhaleExt;
	}

	public State withHeap(Heap heap) {
		return new State(heap, reserveHeaps, store, permissionScalingFactor, functionRecorder, qpFields,
				qpPredicates, qpMagicWands, predicateFormalVariables, snapshotMapCache, exhaleExt);
	}

	public State withReserveHeaps(List<Heap> reserveHeaps) {
		return new State(heap, reserveHeaps, store, permissionScalingFactor, functionRecorder, qpFields,
				qpPredicates, qpMagicWands, predicateFormalVariables, snapshotMapCache, exhaleExt);
	}

	public State withStore(Store store) {
		return new State(heap, reserveHeaps, store, permissionScalingFactor, functionRecorder, qpFields,
				qpPredicates, qpMagicWands, predicateFormalVariables, snapshotMapCache, exhaleExt);
	}

	public State withPermissionScalingFactor(Term factor) {
		return new State(heap, reserveHeaps, store, factor, functionRecorder, qpFields, qpPredicates, qpMagicWands,
				predicateFormalVariables, snapshotMapCache, exhaleExt);
	}

	public State withFunctionRecorder(FunctionRecorder recorder) {
		return new State(heap, reserveHeaps, store, permissionScalingFactor, recorder, qpFields, qpPredicates,
				qpMagicWands, predicateFormalVariables, snapshotMapCache, exhaleExt);
	}

	public State withQuantifiedResources(Set<String> fields, Set<String> predicates, Set<String> wands) {
		return new State(heap, reserveHeaps, store, permissionScalingFactor, functionRecorder, fields, predicates,
				wands, predicateFormalVariables, snapshotMapCache, exhaleExt);
	}

	public State withPredicateFormalVariables(Map<String, List<Term.Var>> formals) {
		return new State(heap, reserveHeaps, store, permissionScalingFactor, functionRecorder, qpFields,
				qpPredicates, qpMagicWands, formals, snapshotMapCache, exhaleExt);
	}

	public State withSnapshotMapCache(Map<Pair<String, List<Chunk.Quantified>>, SnapshotMapDefinition> cache) {
		return new State(heap, reserveHeaps, store, permissionScalingFactor, functionRecorder, qpFields,
				qpPredicates, qpMagicWands, predicateFormalVariables, cache, exhaleExt);
	}

	public State withExhaleExt(boolean exhaleExt) {
		return new State(heap, reserveHeaps, store, permissionScalingFactor, functionRecorder, qpFields,
				qpPredicates, qpMagicWands, predicateFormalVariables, snapshotMapCache, exhaleExt);
	}

	@Override
	public String toString() {
		return "State(h=" + heap + ", g=" + store + ", p=" + permissionScalingFactor + ")";
	}
}
