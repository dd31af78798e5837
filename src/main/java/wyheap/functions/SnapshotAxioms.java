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
package wyheap.functions;

import static wyheap.core.Logic.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import wyheap.core.Logic.Sort;
import wyheap.core.Logic.Term;

/**
 * Background facts of the heap snapshot algebra.
 *
 * @author David J. Pearce
 *
 */
public class SnapshotAxioms {

	/**
	 * Looking up a field in the combination of a singleton for that field and
	 * any other snapshot yields the singleton's value:
	 * <code>forall r, v, h :: lookup_f(combine(singleton_f(r, v), h), r) == v</code>.
	 *
	 * @param field
	 * @param sort  Sort of the field's values.
	 * @return
	 */
	public static Term forField(String field, Sort sort) {
		Term.Var r = VAR("r", Sort.Ref);
		Term.Var v = VAR("v", sort);
		Term.Var h = VAR("h", Sort.PHeap);
		Term lookup = LOOKUP_FIELD(field, sort, COMBINE(SINGLETON(field, r, v), h), r);
		return FORALL(Arrays.asList(r, v, h), EQ(lookup, v), Collections.singletonList(TRIGGER(lookup)));
	}

	public static Term forPredicate(String predicate, List<Sort> parameters) {
		ArrayList<Term.Var> vars = new ArrayList<>();
		for (int i = 0; i != parameters.size(); ++i) {
			vars.add(VAR("x" + i, parameters.get(i)));
		}
		List<Term> args = new ArrayList<>(vars);
		Term.Var v = VAR("v", Sort.PHeap);
		Term.Var h = VAR("h", Sort.PHeap);
		Term lookup = LOOKUP_PREDICATE(predicate, COMBINE(SINGLETON_PREDICATE(predicate, args, v), h), args);
		vars.add(v);
		vars.add(h);
		return FORALL(vars, EQ(lookup, v), Collections.singletonList(TRIGGER(lookup)));
	}

	public static Term combineAssociativity() {
		Term.Var a = VAR("a", Sort.PHeap);
		Term.Var b = VAR("b", Sort.PHeap);
		Term.Var c = VAR("c", Sort.PHeap);
		Term lhs = COMBINE(a, COMBINE(b, c));
		return FORALL(Arrays.asList(a, b, c), EQ(lhs, COMBINE(COMBINE(a, b), c)),
				Collections.singletonList(TRIGGER(lhs)));
	}
}
