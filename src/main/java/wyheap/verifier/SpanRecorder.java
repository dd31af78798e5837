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

import wyheap.core.Program;

/**
 * Receives a structured trace of symbolic execution, with one enter/leave pair
 * per assertion processed. Recording never influences the result.
 *
 * @author David J. Pearce
 *
 */
public interface SpanRecorder {
	public static final SpanRecorder NULL = new SpanRecorder() {
		@Override
		public void enter(String kind, Program.Expr assertion) {
		}

		@Override
		public void leave(String kind, Program.Expr assertion) {
		}
	};

	public void enter(String kind, Program.Expr assertion);

	public void leave(String kind, Program.Expr assertion);
}
