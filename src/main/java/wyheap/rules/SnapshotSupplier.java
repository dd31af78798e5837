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

import wyheap.core.Logic.Sort;
import wyheap.core.Logic.Term;

/**
 * Supplies the snapshot of the assertion currently being produced, at a
 * requested sort. This is invoked only when a snapshot is actually needed.
 *
 * @author David J. Pearce
 *
 */
public interface SnapshotSupplier {

	public Term get(Sort sort);
}
