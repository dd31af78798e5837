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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import wyheap.core.Program;
import wyheap.core.Program.Decl;
import wyheap.util.NameExtractor;

/**
 * <p>
 * Computes the <i>height</i> of every function in a program. Heights are
 * determined from the strongly connected components of the call graph, where
 * a function calls another if its body or specification invokes it. All
 * functions in the same component share a height, whilst a function always has
 * a strictly lower height than any function it calls in another component.
 * </p>
 * <p>
 * Thus, a call from a function to another of strictly greater height cannot be
 * part of a recursive cycle.
 * </p>
 *
 * @author David J. Pearce
 *
 */
public class FunctionHeights {
	private final Program program;
	private final Map<String, Set<String>> edges = new LinkedHashMap<>();
	// Tarjan's algorithm state
	private final Map<String, Integer> index = new HashMap<>();
	private final Map<String, Integer> lowlink = new HashMap<>();
	private final ArrayList<String> stack = new ArrayList<>();
	private final Set<String> onStack = new LinkedHashSet<>();
	private final List<List<String>> components = new ArrayList<>();
	private int counter = 0;

	private FunctionHeights(Program program) {
		this.program = program;
		for (Decl.Function f : program.getFunctions()) {
			LinkedHashSet<String> callees = new LinkedHashSet<>();
			if (f.getBody() != null) {
				callees.addAll(NameExtractor.FUNCTIONS.extract(f.getBody()));
			}
			callees.addAll(NameExtractor.FUNCTIONS.extract(f.getRequires()));
			callees.addAll(NameExtractor.FUNCTIONS.extract(f.getEnsures()));
			edges.put(f.getName(), callees);
		}
	}

	/**
	 * Compute the height of every function in a given program.
	 *
	 * @param program
	 * @return Map from function names to heights, in declaration order.
	 */
	public static Map<String, Integer> compute(Program program) {
		return new FunctionHeights(program).compute();
	}

	private Map<String, Integer> compute() {
		for (String f : edges.keySet()) {
			if (!index.containsKey(f)) {
				visit(f);
			}
		}
		// Components are emitted callees first
		HashMap<String, Integer> heights = new HashMap<>();
		int n = components.size();
		for (int i = 0; i != n; ++i) {
			for (String f : components.get(i)) {
				heights.put(f, n - 1 - i);
			}
		}
		LinkedHashMap<String, Integer> result = new LinkedHashMap<>();
		for (Decl.Function f : program.getFunctions()) {
			result.put(f.getName(), heights.get(f.getName()));
		}
		return result;
	}

	private void visit(String f) {
		index.put(f, counter);
		lowlink.put(f, counter);
		counter = counter + 1;
		stack.add(f);
		onStack.add(f);
		for (String g : edges.get(f)) {
			if (!edges.containsKey(g)) {
				// not a function of this program
				continue;
			} else if (!index.containsKey(g)) {
				visit(g);
				lowlink.put(f, Math.min(lowlink.get(f), lowlink.get(g)));
			} else if (onStack.contains(g)) {
				lowlink.put(f, Math.min(lowlink.get(f), index.get(g)));
			}
		}
		if (lowlink.get(f).equals(index.get(f))) {
			ArrayList<String> component = new ArrayList<>();
			String g;
			do {
				g = stack.remove(stack.size() - 1);
				onStack.remove(g);
				component.add(g);
			} while (!g.equals(f));
			components.add(component);
		}
	}
}
