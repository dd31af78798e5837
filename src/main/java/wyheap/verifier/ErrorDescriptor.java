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
 * Describes how a failure arising whilst processing some program item should
 * be reported.
 *
 * @author David J. Pearce
 *
 */
public class ErrorDescriptor {
	private final String description;
	private final Program.Item offendingNode;

	public ErrorDescriptor(String description, Program.Item offendingNode) {
		this.description = description;
		this.offendingNode = offendingNode;
	}

	public String getDescription() {
		return description;
	}

	public Program.Item getOffendingNode() {
		return offendingNode;
	}

	/**
	 * Construct the error arising for a given reason.
	 *
	 * @param code
	 * @param reason
	 * @return
	 */
	public VerificationError dueTo(int code, String reason) {
		return new VerificationError(code, description + " " + reason, offendingNode);
	}
}
