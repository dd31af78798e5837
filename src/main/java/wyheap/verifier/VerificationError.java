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
 * A verification error attributed to a particular program item.
 *
 * @author David J. Pearce
 *
 */
public class VerificationError {
	/**
	 * An inhale-exhale assertion was encountered where only its inhale part
	 * makes sense.
	 */
	public static final int MALFORMED_ASSERTION = 6001;
	/**
	 * An expression could not be evaluated, e.g. because of a division by zero
	 * or an unknown variable.
	 */
	public static final int EVALUATION_FAILURE = 6002;
	/**
	 * A heap-dependent expression could not be resolved against the recorded
	 * values.
	 */
	public static final int UNRESOLVED_HEAP_REFERENCE = 6003;

	private final int code;
	private final String message;
	private final Program.Item offendingNode;

	public VerificationError(int code, String message, Program.Item offendingNode) {
		this.code = code;
		this.message = message;
		this.offendingNode = offendingNode;
	}

	public int getCode() {
		return code;
	}

	public String getMessage() {
		return message;
	}

	public Program.Item getOffendingNode() {
		return offendingNode;
	}

	/**
	 * Get the source position of the offending node, or <code>null</code> if
	 * none is known.
	 *
	 * @return
	 */
	public Program.Position getPosition() {
		return offendingNode == null ? null : offendingNode.getPosition();
	}

	@Override
	public String toString() {
		Program.Position p = getPosition();
		return (p == null ? "" : p + ": ") + message + " (" + code + ")";
	}
}
