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

/**
 * Records facts introduced whilst symbolically executing a function body, so
 * they can later be included in the function's axiomatisation.
 *
 * @author David J. Pearce
 *
 */
public interface FunctionRecorder {

	/**
	 * A recorder which records nothing, used outside of function bodies.
	 */
	public static final FunctionRecorder NOOP = new FunctionRecorder() {
		@Override
		public boolean isActive() {
			return false;
		}

		@Override
		public FunctionRecorder recordSnapshotMap(SnapshotMapDefinition definition) {
			return this;
		}

		@Override
		public List<SnapshotMapDefinition> getSnapshotMaps() {
			return Collections.emptyList();
		}
	};

	/**
	 * Check whether this recorder is recording, i.e. whether a function body is
	 * being executed.
	 *
	 * @return
	 */
	public boolean isActive();

	public FunctionRecorder recordSnapshotMap(SnapshotMapDefinition definition);

	public List<SnapshotMapDefinition> getSnapshotMaps();

	public static class Recording implements FunctionRecorder {
		private final List<SnapshotMapDefinition> snapshotMaps;

		public Recording() {
			this(Collections.emptyList());
		}

		private Recording(List<SnapshotMapDefinition> snapshotMaps) {
			this.snapshotMaps = Collections.unmodifiableList(snapshotMaps);
		}

		@Override
		public boolean isActive() {
			return true;
		}

		@Override
		public FunctionRecorder recordSnapshotMap(SnapshotMapDefinition definition) {
			ArrayList<SnapshotMapDefinition> nmaps = new ArrayList<>(snapshotMaps);
			nmaps.add(definition);
			return new Recording(nmaps);
		}

		@Override
		public List<SnapshotMapDefinition> getSnapshotMaps() {
			return snapshotMaps;
		}
	}
}
