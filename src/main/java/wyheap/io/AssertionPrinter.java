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
package wyheap.io;

import java.io.OutputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;

import wyheap.core.Program.Decl;
import wyheap.core.Program.Expr;

/**
 * Renders assertions in their concrete source syntax. In <i>abstract</i> mode,
 * every variable access is replaced by a numbered placeholder
 * (<code>$0</code>, <code>$1</code>, ...) in order of first occurrence, except
 * for those bound within the assertion itself. Two magic wands which differ
 * only in the values they mention then print identically, which is how wand
 * identities are determined.
 *
 * @author David J. Pearce
 *
 */
public class AssertionPrinter {
	private final PrintWriter out;
	private final boolean abstractVariables;
	/**
	 * The free variables encountered so far in abstract mode, where index
	 * <code>i</code> corresponds to placeholder <code>$i</code>.
	 */
	private final ArrayList<String> abstracted = new ArrayList<>();
	private final ArrayList<Expr> abstractedExprs = new ArrayList<>();
	private final ArrayList<String> bound = new ArrayList<>();

	public AssertionPrinter(OutputStream output, boolean abstractVariables) {
		this(new PrintWriter(output), abstractVariables);
	}

	public AssertionPrinter(PrintWriter writer, boolean abstractVariables) {
		this.out = writer;
		this.abstractVariables = abstractVariables;
	}

	public void flush() {
		out.flush();
	}

	/**
	 * Get the expressions which were replaced by placeholders, in placeholder
	 * order.
	 *
	 * @return
	 */
	public List<Expr> getAbstracted() {
		return abstractedExprs;
	}

	private void writeExpressionWithBraces(Expr e) {
		if (e instanceof Expr.UnaryOperator || (e instanceof Expr.BinaryOperator && !(e instanceof Expr.FractionalPermission))
				|| e instanceof Expr.Conditional || e instanceof Expr.Quantifier) {
			out.print("(");
			writeExpression(e);
			out.print(")");
		} else {
			writeExpression(e);
		}
	}

	public void writeExpression(Expr e) {
		if (e instanceof Expr.Boolean) {
			out.print(((Expr.Boolean) e).getValue());
		} else if (e instanceof Expr.Integer) {
			out.print(((Expr.Integer) e).getValue());
		} else if (e instanceof Expr.Null) {
			out.print("null");
		} else if (e instanceof Expr.FullPermission) {
			out.print("write");
		} else if (e instanceof Expr.NoPermission) {
			out.print("none");
		} else if (e instanceof Expr.WildcardPermission) {
			out.print("wildcard");
		} else if (e instanceof Expr.FractionalPermission) {
			writeInfix((Expr.BinaryOperator) e, "/");
		} else if (e instanceof Expr.VariableAccess) {
			writeVariableAccess((Expr.VariableAccess) e);
		} else if (e instanceof Expr.Result) {
			out.print("result");
		} else if (e instanceof Expr.FieldAccess) {
			Expr.FieldAccess f = (Expr.FieldAccess) e;
			writeExpressionWithBraces(f.getReceiver());
			out.print(".");
			out.print(f.getName());
		} else if (e instanceof Expr.PredicateAccess) {
			Expr.PredicateAccess p = (Expr.PredicateAccess) e;
			writeCall(p.getName(), p.getArguments());
		} else if (e instanceof Expr.AccessPredicate) {
			Expr.AccessPredicate a = (Expr.AccessPredicate) e;
			out.print("acc(");
			writeExpression(a.getLocation());
			out.print(", ");
			writeExpression(a.getPermission());
			out.print(")");
		} else if (e instanceof Expr.MagicWand) {
			writeInfix((Expr.BinaryOperator) e, "--*");
		} else if (e instanceof Expr.CurrentPermission) {
			out.print("perm(");
			writeExpression(((Expr.CurrentPermission) e).getLocation());
			out.print(")");
		} else if (e instanceof Expr.Equals) {
			writeInfix((Expr.BinaryOperator) e, "==");
		} else if (e instanceof Expr.NotEquals) {
			writeInfix((Expr.BinaryOperator) e, "!=");
		} else if (e instanceof Expr.LessThan) {
			writeInfix((Expr.BinaryOperator) e, "<");
		} else if (e instanceof Expr.LessThanOrEqual) {
			writeInfix((Expr.BinaryOperator) e, "<=");
		} else if (e instanceof Expr.GreaterThan) {
			writeInfix((Expr.BinaryOperator) e, ">");
		} else if (e instanceof Expr.GreaterThanOrEqual) {
			writeInfix((Expr.BinaryOperator) e, ">=");
		} else if (e instanceof Expr.Addition) {
			writeInfix((Expr.BinaryOperator) e, "+");
		} else if (e instanceof Expr.Subtraction) {
			writeInfix((Expr.BinaryOperator) e, "-");
		} else if (e instanceof Expr.Multiplication) {
			writeInfix((Expr.BinaryOperator) e, "*");
		} else if (e instanceof Expr.Division) {
			writeInfix((Expr.BinaryOperator) e, "\\");
		} else if (e instanceof Expr.Remainder) {
			writeInfix((Expr.BinaryOperator) e, "%");
		} else if (e instanceof Expr.Negation) {
			out.print("-");
			writeExpressionWithBraces(((Expr.Negation) e).getOperand());
		} else if (e instanceof Expr.LogicalNot) {
			out.print("!");
			writeExpressionWithBraces(((Expr.LogicalNot) e).getOperand());
		} else if (e instanceof Expr.LogicalAnd) {
			writeInfix((Expr.BinaryOperator) e, "&&");
		} else if (e instanceof Expr.LogicalOr) {
			writeInfix((Expr.BinaryOperator) e, "||");
		} else if (e instanceof Expr.Implies) {
			writeInfix((Expr.BinaryOperator) e, "==>");
		} else if (e instanceof Expr.Conditional) {
			Expr.Conditional c = (Expr.Conditional) e;
			writeExpressionWithBraces(c.getCondition());
			out.print(" ? ");
			writeExpressionWithBraces(c.getTrueBranch());
			out.print(" : ");
			writeExpressionWithBraces(c.getFalseBranch());
		} else if (e instanceof Expr.Let) {
			writeLet((Expr.Let) e);
		} else if (e instanceof Expr.Quantifier) {
			writeQuantifier((Expr.Quantifier) e);
		} else if (e instanceof Expr.Unfolding) {
			Expr.Unfolding u = (Expr.Unfolding) e;
			out.print("unfolding ");
			writeExpression(u.getPredicate());
			out.print(" in ");
			writeExpression(u.getBody());
		} else if (e instanceof Expr.Applying) {
			Expr.Applying a = (Expr.Applying) e;
			out.print("applying (");
			writeExpression(a.getWand());
			out.print(") in ");
			writeExpression(a.getBody());
		} else if (e instanceof Expr.InhaleExhale) {
			Expr.InhaleExhale ie = (Expr.InhaleExhale) e;
			out.print("[");
			writeExpression(ie.getInhale());
			out.print(", ");
			writeExpression(ie.getExhale());
			out.print("]");
		} else if (e instanceof Expr.Invoke) {
			Expr.Invoke i = (Expr.Invoke) e;
			writeCall(i.getName(), i.getArguments());
		} else {
			throw new IllegalArgumentException("unknown expression encountered (" + e.getClass().getName() + ")");
		}
	}

	private void writeInfix(Expr.BinaryOperator e, String operator) {
		writeExpressionWithBraces(e.getLeftHandSide());
		out.print(" ");
		out.print(operator);
		out.print(" ");
		writeExpressionWithBraces(e.getRightHandSide());
	}

	private void writeCall(String name, List<Expr> arguments) {
		out.print(name);
		out.print("(");
		for (int i = 0; i != arguments.size(); ++i) {
			if (i != 0) {
				out.print(", ");
			}
			writeExpression(arguments.get(i));
		}
		out.print(")");
	}

	private void writeVariableAccess(Expr.VariableAccess e) {
		String name = e.getVariable();
		if (!abstractVariables || bound.contains(name)) {
			out.print(name);
		} else {
			int index = abstracted.indexOf(name);
			if (index < 0) {
				index = abstracted.size();
				abstracted.add(name);
				abstractedExprs.add(e);
			}
			out.print("$" + index);
		}
	}

	private void writeLet(Expr.Let e) {
		out.print("let ");
		out.print(e.getVariable().getName());
		out.print(" == (");
		writeExpression(e.getInitialiser());
		out.print(") in ");
		bound.add(e.getVariable().getName());
		writeExpression(e.getBody());
		bound.remove(bound.size() - 1);
	}

	private void writeQuantifier(Expr.Quantifier e) {
		List<Decl.Parameter> params = e.getParameters();
		out.print(e instanceof Expr.UniversalQuantifier ? "forall " : "exists ");
		for (int i = 0; i != params.size(); ++i) {
			Decl.Parameter ith = params.get(i);
			if (i != 0) {
				out.print(", ");
			}
			out.print(ith.getName());
			bound.add(ith.getName());
		}
		out.print(" :: ");
		if (e instanceof Expr.UniversalQuantifier) {
			for (Expr.Trigger t : ((Expr.UniversalQuantifier) e).getTriggers()) {
				out.print("{");
				List<Expr> es = t.getExpressions();
				for (int i = 0; i != es.size(); ++i) {
					if (i != 0) {
						out.print(", ");
					}
					writeExpression(es.get(i));
				}
				out.print("} ");
			}
		}
		writeExpression(e.getBody());
		for (int i = 0; i != params.size(); ++i) {
			bound.remove(bound.size() - 1);
		}
	}

	public static String toString(Expr expr) {
		StringWriter buf = new StringWriter();
		AssertionPrinter p = new AssertionPrinter(new PrintWriter(buf), false);
		p.writeExpression(expr);
		p.flush();
		return buf.toString();
	}
}
