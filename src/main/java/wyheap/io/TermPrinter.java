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
import java.util.List;

import wyheap.core.Logic.Term;

/**
 * Renders terms in a Boogie-like concrete syntax, primarily for logging and
 * diagnostics.
 *
 * @author David J. Pearce
 *
 */
public class TermPrinter {
	private final PrintWriter out;

	public TermPrinter(OutputStream output) {
		this(new PrintWriter(output));
	}

	public TermPrinter(PrintWriter writer) {
		this.out = writer;
	}

	public void flush() {
		out.flush();
	}

	private void writeTermWithBraces(Term t) {
		if (t.getOperands().isEmpty() || t instanceof Term.App || isAlgebraic(t)) {
			writeTerm(t);
		} else {
			out.print("(");
			writeTerm(t);
			out.print(")");
		}
	}

	public void writeTerm(Term t) {
		if (t instanceof Term.Var) {
			out.print(((Term.Var) t).getId().getName());
		} else if (t instanceof Term.BooleanLiteral) {
			out.print(((Term.BooleanLiteral) t).getValue());
		} else if (t instanceof Term.IntLiteral) {
			out.print(((Term.IntLiteral) t).getValue());
		} else if (t instanceof Term.Null) {
			out.print("null");
		} else if (t instanceof Term.FullPerm) {
			out.print("write");
		} else if (t instanceof Term.NoPerm) {
			out.print("none");
		} else if (t instanceof Term.FractionPerm) {
			writeInfix(" / ", t.getOperands());
		} else if (t instanceof Term.PermTimes) {
			writeInfix(" *p ", t.getOperands());
		} else if (t instanceof Term.PermPlus) {
			writeInfix(" +p ", t.getOperands());
		} else if (t instanceof Term.PermMinus) {
			writeInfix(" -p ", t.getOperands());
		} else if (t instanceof Term.PermLess) {
			writeInfix(" <p ", t.getOperands());
		} else if (t instanceof Term.PermAtMost) {
			writeInfix(" <=p ", t.getOperands());
		} else if (t instanceof Term.Arithmetic) {
			writeInfix(" " + ((Term.Arithmetic) t).getOperator().getSymbol() + " ", t.getOperands());
		} else if (t instanceof Term.Equals) {
			writeInfix(" == ", t.getOperands());
		} else if (t instanceof Term.And) {
			writeInfix(" && ", t.getOperands());
		} else if (t instanceof Term.Or) {
			writeInfix(" || ", t.getOperands());
		} else if (t instanceof Term.Implies) {
			writeInfix(" ==> ", t.getOperands());
		} else if (t instanceof Term.Not) {
			out.print("!");
			writeTermWithBraces(((Term.Not) t).getOperand());
		} else if (t instanceof Term.Ite) {
			writeTermWithBraces(t.getOperands().get(0));
			out.print(" ? ");
			writeTermWithBraces(t.getOperands().get(1));
			out.print(" : ");
			writeTermWithBraces(t.getOperands().get(2));
		} else if (t instanceof Term.Let) {
			writeLet((Term.Let) t);
		} else if (t instanceof Term.Quantification) {
			writeQuantification((Term.Quantification) t);
		} else if (t instanceof Term.App) {
			writeApplication(((Term.App) t).getFunction().getName(), t.getOperands());
		} else if (t instanceof Term.Combine) {
			writeApplication("PHeap.combine", t.getOperands());
		} else if (t instanceof Term.Restrict) {
			writeApplication("PHeap.restrict_" + ((Term.Restrict) t).getFunction(), t.getOperands());
		} else if (t instanceof Term.LookupField) {
			writeApplication("PHeap.lookup_" + ((Term.LookupField) t).getField(), t.getOperands());
		} else if (t instanceof Term.LookupPredicate) {
			writeApplication("PHeap.lookup_" + ((Term.LookupPredicate) t).getPredicate(), t.getOperands());
		} else if (t instanceof Term.SingletonField) {
			writeApplication("PHeap.singleton_" + ((Term.SingletonField) t).getField(), t.getOperands());
		} else if (t instanceof Term.SingletonPredicate) {
			writeApplication("PHeap.singleton_" + ((Term.SingletonPredicate) t).getPredicate(), t.getOperands());
		} else if (t instanceof Term.RemovePredicate) {
			writeApplication("PHeap.remove_" + ((Term.RemovePredicate) t).getPredicate(), t.getOperands());
		} else if (t instanceof Term.MagicWandSnapshot) {
			writeApplication("MWSF", t.getOperands());
		} else if (t instanceof Term.SortWrapper) {
			writeApplication("$SortWrappers." + t.getSort().getName(), t.getOperands());
		} else if (t instanceof Term.Lookup) {
			Term.Lookup l = (Term.Lookup) t;
			writeTermWithBraces(l.getMap());
			out.print("[");
			writeList(l.getArguments());
			out.print("]");
		} else if (t instanceof Term.ResourceTrigger) {
			writeApplication(((Term.ResourceTrigger) t).getResource() + "#trigger", t.getOperands());
		} else {
			throw new IllegalArgumentException("unknown term encountered (" + t.getClass().getName() + ")");
		}
	}

	private void writeInfix(String operator, List<Term> operands) {
		for (int i = 0; i != operands.size(); ++i) {
			if (i != 0) {
				out.print(operator);
			}
			writeTermWithBraces(operands.get(i));
		}
	}

	private void writeApplication(String name, List<Term> arguments) {
		out.print(name);
		out.print("(");
		writeList(arguments);
		out.print(")");
	}

	private void writeList(List<Term> terms) {
		for (int i = 0; i != terms.size(); ++i) {
			if (i != 0) {
				out.print(", ");
			}
			writeTerm(terms.get(i));
		}
	}

	private void writeLet(Term.Let t) {
		out.print("let ");
		out.print(t.getVariable().getId().getName());
		out.print(" == ");
		writeTermWithBraces(t.getBound());
		out.print(" in ");
		writeTerm(t.getBody());
	}

	private void writeQuantification(Term.Quantification t) {
		out.print(t.isUniversal() ? "forall " : "exists ");
		List<Term.Var> vars = t.getVariables();
		for (int i = 0; i != vars.size(); ++i) {
			if (i != 0) {
				out.print(", ");
			}
			out.print(vars.get(i).getId().getName());
			out.print(": ");
			out.print(vars.get(i).getSort().getName());
		}
		out.print(" :: ");
		for (Term.Trigger trigger : t.getTriggers()) {
			out.print("{ ");
			writeList(trigger.getTerms());
			out.print(" } ");
		}
		writeTerm(t.getBody());
	}

	private static boolean isAlgebraic(Term t) {
		return t instanceof Term.Combine || t instanceof Term.Restrict || t instanceof Term.LookupField
				|| t instanceof Term.LookupPredicate || t instanceof Term.SingletonField
				|| t instanceof Term.SingletonPredicate || t instanceof Term.RemovePredicate
				|| t instanceof Term.MagicWandSnapshot || t instanceof Term.SortWrapper || t instanceof Term.Lookup || t instanceof Term.ResourceTrigger;
	}

	public static String toString(Term term) {
		StringWriter buf = new StringWriter();
		TermPrinter p = new TermPrinter(new PrintWriter(buf));
		p.writeTerm(term);
		p.flush();
		return buf.toString();
	}
}
