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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The outcome of exploring one or more paths.
 *
 * @author David J. Pearce
 *
 */
public abstract class VerificationResult {
	public static final VerificationResult SUCCESS = new Success();

	public abstract boolean isFatal();

	public abstract List<VerificationError> getErrors();

	/**
	 * Aggregate this result with another, retaining the errors of both in
	 * order.
	 *
	 * @param other
	 * @return
	 */
	public VerificationResult combine(VerificationResult other) {
		if (!isFatal()) {
			return other;
		} else if (!other.isFatal()) {
			return this;
		}
		ArrayList<VerificationError> errors = new ArrayList<>(getErrors());
		errors.addAll(other.getErrors());
		return new Failure(errors);
	}

	public static VerificationResult failure(VerificationError... errors) {
		return new Failure(Arrays.asList(errors));
	}

	public static class Success extends VerificationResult {
		private Success() {
		}

		@Override
		public boolean isFatal() {
			return false;
		}

		@Override
		public List<VerificationError> getErrors() {
			return Collections.emptyList();
		}

		@Override
		public String toString() {
			return "Success";
		}
	}

	public static class Failure extends VerificationResult {
		private final List<VerificationError> errors;

		public Failure(List<VerificationError> errors) {
			if (errors.isEmpty()) {
				throw new IllegalArgumentException("failure requires at least one error");
			}
			this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
		}

		@Override
		public boolean isFatal() {
			return true;
		}

		@Override
		public List<VerificationError> getErrors() {
			return errors;
		}

		@Override
		public String toString() {
			return "Failure" + errors;
		}
	}
}
