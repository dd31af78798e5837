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

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.List;

import wyheap.core.Program.Expr;
import wyheap.io.AssertionPrinter;

/**
 * The identity of a magic wand, which is its structure with all free
 * variables abstracted away. For example, <code>acc(x.f) --* acc(y.f)</code>
 * and <code>acc(a.f) --* acc(b.f)</code> share the identity
 * <code>acc($0.f, write) --* acc($1.f, write)</code>. The abstracted
 * subexpressions must be evaluated to obtain the arguments of a wand chunk.
 *
 * @author David J. Pearce
 *
 */
public class MagicWandIdentifier {
	private final String name;
	private final List<Expr> subexpressions;

	private MagicWandIdentifier(String name, List<Expr> subexpressions) {
		this.name = name;
		this.subexpressions = subexpressions;
	}

	public static MagicWandIdentifier of(Expr.MagicWand wand) {
		StringWriter buf = new StringWriter();
		AssertionPrinter printer = new AssertionPrinter(new PrintWriter(buf), true);
		printer.writeExpression(wand);
		printer.flush();
		return new MagicWandIdentifier(buf.toString(), printer.getAbstracted());
	}

	public String getName() {
		return name;
	}

	public List<Expr> getSubexpressions() {
		return subexpressions;
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof MagicWandIdentifier && ((MagicWandIdentifier) o).name.equals(name);
	}

	@Override
	public int hashCode() {
		return name.hashCode();
	}

	@Override
	public String toString() {
		return name;
	}
}
