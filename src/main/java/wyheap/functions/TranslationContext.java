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

import java.util.Map;

import wyheap.core.Logic.Term;
import wyheap.core.Program;

/**
 * The context in which an expression is translated. This is immutable, except
 * for the outcome which is shared by all contexts derived from the same
 * top-level translation.
 *
 * @author David J. Pearce
 *
 */
public class TranslationContext {
	private final Program program;
	private final FunctionData data;
	private final Map<String, FunctionData> functions;
	/**
	 * The heap snapshot against which heap accesses are translated.
	 */
	private final Term snapshot;
	private final boolean ignoreAccessPredicates;
	/**
	 * Determines whether inhale-exhale expressions are translated according to
	 * their exhale part (or their inhale part otherwise).
	 */
	private final boolean exhaling;
	private final Outcome outcome;

	public TranslationContext(Program program, FunctionData data, Map<String, FunctionData> functions,
			Term snapshot, boolean ignoreAccessPredicates, boolean exhaling) {
		this(program, data, functions, snapshot, ignoreAccessPredicates, exhaling, new Outcome());
	}

	private TranslationContext(Program program, FunctionData data, Map<String, FunctionData> functions,
			Term snapshot, boolean ignoreAccessPredicates, boolean exhaling, Outcome outcome) {
		this.program = program;
		this.data = data;
		this.functions = functions;
		this.snapshot = snapshot;
		this.ignoreAccessPredicates = ignoreAccessPredicates;
		this.exhaling = exhaling;
		this.outcome = outcome;
	}

	public Program getProgram() {
		return program;
	}

	public FunctionData getData() {
		return data;
	}

	public Map<String, FunctionData> getFunctions() {
		return functions;
	}

	public Term getSnapshot() {
		return snapshot;
	}

	public boolean isIgnoringAccessPredicates() {
		return ignoreAccessPredicates;
	}

	public boolean isExhaling() {
		return exhaling;
	}

	public Outcome getOutcome() {
		return outcome;
	}

	public TranslationContext withSnapshot(Term snapshot) {
		return new TranslationContext(program, data, functions, snapshot, ignoreAccessPredicates, exhaling, outcome);
	}

	/**
	 * Tracks whether a top-level translation has failed, and whether a warning
	 * has already been issued for it.
	 */
	public static class Outcome {
		private boolean failed;
		private boolean warned;

		public boolean isFailed() {
			return failed;
		}

		public void markFailed() {
			failed = true;
		}

		public boolean hasWarned() {
			return warned;
		}

		public void markWarned() {
			warned = true;
		}
	}
}
