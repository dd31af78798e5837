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
import java.util.List;

import wyheap.core.Logic.Term;

/**
 * A snapshot map together with the facts which define its values and its
 * domain.
 *
 * @author David J. Pearce
 *
 */
public class SnapshotMapDefinition {
	private final String resource;
	private final Term snapshotMap;
	private final List<Term> valueDefinitions;
	private final List<Term> domainDefinitions;

	public SnapshotMapDefinition(String resource, Term snapshotMap, List<Term> valueDefinitions,
			List<Term> domainDefinitions) {
		this.resource = resource;
		this.snapshotMap = snapshotMap;
		this.valueDefinitions = Collections.unmodifiableList(new ArrayList<>(valueDefinitions));
		this.domainDefinitions = Collections.unmodifiableList(new ArrayList<>(domainDefinitions));
	}

	public String getResource() {
		return resource;
	}

	public Term getSnapshotMap() {
		return snapshotMap;
	}

	public List<Term> getValueDefinitions() {
		return valueDefinitions;
	}

	public List<Term> getDomainDefinitions() {
		return domainDefinitions;
	}
}
