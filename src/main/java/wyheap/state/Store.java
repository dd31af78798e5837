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

import java.util.HashMap;
import java.util.Map;

import wyheap.core.Logic.Term;

/**
 * An immutable mapping from program variables to the terms they currently
 * denote.
 *
 * @author David J. Pearce
 *
 */
public class Store {
	public static final Store EMPTY = new Store(new HashMap<>());

	private final HashMap<String, Term> mapping;

	public Store(Map<String, Term> mapping) {
		this.mapping = new HashMap<>(mapping);
	}

	/**
	 * Get the term bound to a given variable, or <code>null</code> if it is not
	 * bound.
	 *
	 * @param name
	 * @return
	 */
	public Term get(String name) {
		return mapping.get(name);
	}

	public boolean contains(String name) {
		return mapping.containsKey(name);
	}

	/**
	 * Bind a given variable to a given term, producing an updated store.
	 *
	 * @param name
	 * @param value
	 * @return
	 */
	public Store put(String name, Term value) {
		Store nstore = new Store(mapping);
		nstore.mapping.put(name, value);
		return nstore;
	}

	/**
	 * Unbind a given variable, producing an updated store.
	 *
	 * @param name
	 * @return
	 */
	public Store remove(String name) {
		Store nstore = new Store(mapping);
		nstore.mapping.remove(name);
		return nstore;
	}

	@Override
	public String toString() {
		return mapping.toString();
	}
}
