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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import wyheap.core.Logic.Fun;
import wyheap.core.Logic.Sort;
import wyheap.core.Logic.Term;
import wyheap.state.Chunk;
import wyheap.state.Heap;
import wyheap.state.SnapshotMapDefinition;
import wyheap.state.State;
import wyheap.util.Pair;
import wyheap.util.Util;
import wyheap.util.VariableSubstitution;
import wyheap.verifier.Decider;
import wyheap.verifier.VerificationResult;

/**
 * A straightforward quantified chunk supporter. Bulk production introduces one
 * inverse function per quantified variable, mapping resource arguments back to
 * the quantified variables which produced them. No injectivity checks are
 * performed.
 *
 * @author David J. Pearce
 *
 */
public class DefaultQuantifiedChunkSupporter implements QuantifiedChunkSupporter {
	private final Decider decider;

	public DefaultQuantifiedChunkSupporter(Decider decider) {
		this.decider = decider;
	}

	@Override
	public VerificationResult produce(State s, List<Term.Var> qvars, Term condition, String resource,
			Chunk.Kind kind, List<Term.Var> formals, List<Term> args, Term sm, Term permission,
			List<Term.Trigger> triggers, Continuation Q) {
		List<Sort> formalSorts = Util.map(formals, Term::getSort);
		ArrayList<Term> inverses = new ArrayList<>();
		for (Term.Var qvar : qvars) {
			// Use a fresh variable name to obtain a fresh function symbol
			String name = decider.fresh("inv", qvar.getSort()).getId().getName();
			inverses.add(APP(new Fun(name, formalSorts, qvar.getSort()), new ArrayList<Term>(formals)));
		}
		VariableSubstitution inverted = new VariableSubstitution(qvars, inverses);
		Term guard = AND(condition, PERM_LESS(NONE, permission));
		// inv(args(x)) == x
		ArrayList<Term> first = new ArrayList<>();
		VariableSubstitution formalsToArgs = new VariableSubstitution(formals, args);
		for (int i = 0; i != qvars.size(); ++i) {
			first.add(EQ(formalsToArgs.transform(inverses.get(i)), qvars.get(i)));
		}
		decider.assume(FORALL(qvars, IMPLIES(guard, AND(first)), triggers));
		// args(inv(r)) == r
		ArrayList<Term> second = new ArrayList<>();
		for (int i = 0; i != formals.size(); ++i) {
			second.add(EQ(inverted.transform(args.get(i)), formals.get(i)));
		}
		List<Term.Trigger> inverseTriggers = inverses.isEmpty() ? Collections.emptyList()
				: Collections.singletonList(TRIGGER(inverses.get(0)));
		decider.assume(FORALL(formals, IMPLIES(inverted.transform(guard), AND(second)), inverseTriggers));
		decider.assume(FORALL(qvars, IMPLIES(condition, PERM_ATMOST(NONE, permission)), triggers));
		//
		Term cond = inverted.transform(condition);
		Term perm = ITE(cond, inverted.transform(permission), NONE);
		Chunk.Quantified ch = new Chunk.Quantified(kind, resource, formals, sm, cond, perm, null);
		return Q.apply(s.withHeap(s.getHeap().add(ch)));
	}

	@Override
	public VerificationResult produceSingleLocation(State s, String resource, Chunk.Kind kind,
			List<Term.Var> formals, List<Term> args, Term snapshot, Term permission, Function<Term, Term> trigger,
			Continuation Q) {
		Pair<Term, Term> p = singletonSnapshotMap(s, resource, kind, args, snapshot);
		Term sm = p.first();
		decider.assume(p.second());
		Chunk.Quantified ch = createSingletonQuantifiedChunk(formals, resource, kind, args, permission, sm);
		Heap h1 = s.getHeap().add(ch);
		List<Chunk.Quantified> relevant = splitHeap(h1, resource).first();
		Pair<State, SnapshotMapDefinition> summary = summarisingSnapshotMap(s, resource, formals, relevant);
		decider.assume(trigger.apply(summary.second().getSnapshotMap()));
		SnapshotMapDefinition definition = new SnapshotMapDefinition(resource, sm,
				Collections.singletonList(p.second()), Collections.emptyList());
		State s2 = summary.first().withHeap(h1)
				.withFunctionRecorder(s.getFunctionRecorder().recordSnapshotMap(definition));
		return Q.apply(s2);
	}

	@Override
	public Pair<Term, Term> singletonSnapshotMap(State s, String resource, Chunk.Kind kind, List<Term> args,
			Term value) {
		Sort sort = kind == Chunk.Kind.FIELD ? new Sort.FieldValueFunction(value.getSort())
				: Sort.PredicateSnapFunction;
		Term sm = decider.fresh("sm", sort);
		return new Pair<>(sm, EQ(LOOKUP(value.getSort(), sm, args), value));
	}

	@Override
	public Chunk.Quantified createSingletonQuantifiedChunk(List<Term.Var> formals, String resource,
			Chunk.Kind kind, List<Term> args, Term permission, Term sm) {
		ArrayList<Term> equalities = new ArrayList<>();
		for (int i = 0; i != formals.size(); ++i) {
			equalities.add(EQ(formals.get(i), args.get(i)));
		}
		Term condition = AND(equalities);
		return new Chunk.Quantified(kind, resource, formals, sm, condition, ITE(condition, permission, NONE), args);
	}

	@Override
	public Pair<List<Chunk.Quantified>, List<Chunk>> splitHeap(Heap heap, String resource) {
		ArrayList<Chunk.Quantified> relevant = new ArrayList<>();
		ArrayList<Chunk> others = new ArrayList<>();
		for (Chunk c : heap) {
			if (c instanceof Chunk.Quantified && c.getName().equals(resource)) {
				relevant.add((Chunk.Quantified) c);
			} else {
				others.add(c);
			}
		}
		return new Pair<>(relevant, others);
	}

	@Override
	public Pair<State, SnapshotMapDefinition> summarisingSnapshotMap(State s, String resource,
			List<Term.Var> formals, List<Chunk.Quantified> chunks) {
		Pair<String, List<Chunk.Quantified>> key = new Pair<>(resource, chunks);
		SnapshotMapDefinition cached = s.getSnapshotMapCache().get(key);
		if (cached != null) {
			return new Pair<>(s, cached);
		}
		Sort mapSort = chunks.isEmpty() ? Sort.PredicateSnapFunction : chunks.get(0).getSnapshotMap().getSort();
		Sort valueSort = valueSortOf(mapSort, chunks);
		Term sm = decider.fresh("sm", mapSort);
		Term lookup = LOOKUP(valueSort, sm, new ArrayList<Term>(formals));
		ArrayList<Term> valueDefinitions = new ArrayList<>();
		for (Chunk.Quantified c : chunks) {
			VariableSubstitution rename = new VariableSubstitution(c.getFormals(), formals);
			Term perm = rename.transform(c.getPermission());
			Term value = LOOKUP(valueSort, c.getSnapshotMap(), new ArrayList<Term>(formals));
			valueDefinitions.add(FORALL(formals, IMPLIES(PERM_LESS(NONE, perm), EQ(lookup, value)),
					Collections.singletonList(TRIGGER(lookup))));
		}
		decider.assume(valueDefinitions);
		SnapshotMapDefinition definition = new SnapshotMapDefinition(resource, sm, valueDefinitions,
				Collections.emptyList());
		Map<Pair<String, List<Chunk.Quantified>>, SnapshotMapDefinition> cache = new HashMap<>(
				s.getSnapshotMapCache());
		cache.put(key, definition);
		return new Pair<>(s.withSnapshotMapCache(cache), definition);
	}

	private static Sort valueSortOf(Sort mapSort, List<Chunk.Quantified> chunks) {
		if (mapSort instanceof Sort.FieldValueFunction) {
			return ((Sort.FieldValueFunction) mapSort).getCodomain();
		} else if (!chunks.isEmpty() && chunks.get(0).getKind() == Chunk.Kind.WAND) {
			return Sort.Snap;
		} else {
			return Sort.PHeap;
		}
	}
}
