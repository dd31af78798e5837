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
package wyheap.verifier;

import java.util.List;

import wyheap.core.Logic.Sort;
import wyheap.core.Logic.Term;

/**
 * The bridge to the decision procedure. Symbolic execution only ever adds
 * facts to the current path condition and allocates fresh symbols.
 *
 * @author David J. Pearce
 *
 */
public interface Decider {

	/**
	 * Assume a given fact holds on the current path.
	 *
	 * @param fact
	 */
	public void assume(Term fact);

	public void assume(List<Term> facts);

	/**
	 * Determine whether a given fact is known to hold on the current path. A
	 * result of <code>false</code> means only that the fact could not be
	 * established, not that it is false. Checking <code>false</code> itself
	 * therefore asks whether the current path is infeasible.
	 *
	 * @param fact
	 * @return
	 */
	public boolean check(Term fact);

	/**
	 * Allocate a fresh symbol of a given sort, whose name begins with a given
	 * prefix.
	 *
	 * @param prefix
	 * @param sort
	 * @return
	 */
	public Term.Var fresh(String prefix, Sort sort);

	/**
	 * Open a new scope of path conditions. Facts assumed within the scope are
	 * discarded when it is closed.
	 */
	public void pushScope();

	public void popScope();

	/**
	 * Get all facts assumed on the current path, in order.
	 *
	 * @return
	 */
	public List<Term> getPathConditions();
}
