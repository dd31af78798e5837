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
import java.util.List;

import wyheap.core.Logic;
import wyheap.core.Logic.Fun;
import wyheap.core.Logic.Sort;
import wyheap.core.Program;

/**
 * Bundles the collaborators which are shared by all rules operating on a
 * given program.
 *
 * @author David J. Pearce
 *
 */
public class Verifier {
	private final Program program;
	private final Decider decider;
	private final Config config;
	private final Reporter reporter;
	private final SpanRecorder spanRecorder;

	public Verifier(Program program, Decider decider) {
		this(program, decider, new Config(), Reporter.NULL, SpanRecorder.NULL);
	}

	public Verifier(Program program, Decider decider, Config config, Reporter reporter, SpanRecorder spanRecorder) {
		if (program == null) {
			throw new IllegalArgumentException("invalid program");
		} else if (decider == null) {
			throw new IllegalArgumentException("invalid decider");
		}
		this.program = program;
		this.decider = decider;
		this.config = config;
		this.reporter = reporter;
		this.spanRecorder = spanRecorder;
	}

	public Program getProgram() {
		return program;
	}

	public Decider getDecider() {
		return decider;
	}

	public Config getConfig() {
		return config;
	}

	public Reporter getReporter() {
		return reporter;
	}

	public SpanRecorder getSpanRecorder() {
		return spanRecorder;
	}

	/**
	 * Get the trigger function for a given predicate. This takes the snapshot
	 * of a predicate instance followed by its arguments.
	 *
	 * @param name
	 * @return
	 */
	public Fun predicateTrigger(String name) {
		return predicateTrigger(program, name);
	}

	public static Fun predicateTrigger(Program program, String name) {
		Program.Decl.Predicate predicate = program.findPredicate(name);
		List<Sort> parameters = new ArrayList<>();
		parameters.add(Sort.PHeap);
		for (Program.Decl.Parameter p : predicate.getParameters()) {
			parameters.add(Logic.toSort(p.getType()));
		}
		return new Fun(name + "%trigger", parameters, Sort.Bool);
	}
}
