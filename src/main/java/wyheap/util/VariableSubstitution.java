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
package wyheap.util;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import wyheap.core.Logic.Term;

/**
 * Replaces occurrences of given variables within a term. Bound variables of
 * nested quantifiers and lets are not treated specially, hence the
 * replacements should not mention names bound within the term.
 *
 * @author David J. Pearce
 *
 */
public class VariableSubstitution extends AbstractTermTransform {
	private final Map<Term.Var, Term> mapping;

	public VariableSubstitution(Map<Term.Var, Term> mapping) {
		this.mapping = new HashMap<>(mapping);
	}

	public VariableSubstitution(List<Term.Var> from, List<? extends Term> to) {
		if (from.size() != to.size()) {
			throw new IllegalArgumentException("mismatched substitution");
		}
		this.mapping = new HashMap<>();
		for (int i = 0; i != from.size(); ++i) {
			mapping.put(from.get(i), to.get(i));
		}
	}

	@Override
	protected Term rewrite(Term term) {
		if (term instanceof Term.Var) {
			Term replacement = mapping.get(term);
			if (replacement != null) {
				return replacement;
			}
		}
		return term;
	}
}
