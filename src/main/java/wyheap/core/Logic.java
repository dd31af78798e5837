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
package wyheap.core;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import wyheap.io.TermPrinter;

/**
 * The term language handed to the decision procedure. Terms are immutable and
 * compared structurally. Heap snapshots are terms of sort {@link Sort#PHeap}
 * which are only ever composed and decomposed through the snapshot algebra
 * (i.e. {@link Term.Combine}, {@link Term.Restrict}, {@link Term.LookupField},
 * {@link Term.LookupPredicate}, {@link Term.SingletonField},
 * {@link Term.SingletonPredicate} and {@link Term.RemovePredicate}).
 *
 * @author David J. Pearce
 *
 */
public class Logic {

	// =========================================================================
	// Sorts
	// =========================================================================

	public interface Sort {
		public static final Sort Bool = new Basic("Bool");
		public static final Sort Int = new Basic("Int");
		public static final Sort Perm = new Basic("Perm");
		public static final Sort Ref = new Basic("Ref");
		/**
		 * The sort of plain snapshots, as carried by magic wand chunks.
		 */
		public static final Sort Snap = new Basic("Snap");
		/**
		 * The sort of partial heaps, as used for predicate and function snapshots.
		 */
		public static final Sort PHeap = new Basic("PHeap");
		/**
		 * Snapshot maps for quantified predicates and wands.
		 */
		public static final Sort PredicateSnapFunction = new Basic("PSF");

		public String getName();

		public static class Basic implements Sort {
			private final String name;

			private Basic(String name) {
				this.name = name;
			}

			@Override
			public String getName() {
				return name;
			}

			@Override
			public String toString() {
				return name;
			}
		}

		/**
		 * Snapshot maps for quantified fields, mapping receivers to values of the
		 * field's sort.
		 */
		public static class FieldValueFunction implements Sort {
			private final Sort codomain;

			public FieldValueFunction(Sort codomain) {
				this.codomain = codomain;
			}

			public Sort getCodomain() {
				return codomain;
			}

			@Override
			public String getName() {
				return "FVF[" + codomain.getName() + "]";
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof FieldValueFunction && ((FieldValueFunction) o).codomain.equals(codomain);
			}

			@Override
			public int hashCode() {
				return codomain.hashCode() * 7;
			}

			@Override
			public String toString() {
				return getName();
			}
		}
	}

	// =========================================================================
	// Identifiers
	// =========================================================================

	public interface Identifier {
		public String getName();
	}

	public static class SimpleIdentifier implements Identifier {
		private final String name;

		public SimpleIdentifier(String name) {
			this.name = name;
		}

		@Override
		public String getName() {
			return name;
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof SimpleIdentifier && ((SimpleIdentifier) o).name.equals(name);
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

	/**
	 * An identifier made unique by appending a numeric suffix, such as
	 * <code>x@3</code>. These arise whenever a bound program variable is given a
	 * fresh symbolic name.
	 */
	public static class SuffixedIdentifier implements Identifier {
		private final String prefix;
		private final String suffix;

		public SuffixedIdentifier(String prefix, String suffix) {
			this.prefix = prefix;
			this.suffix = suffix;
		}

		public String getPrefix() {
			return prefix;
		}

		public String getSuffix() {
			return suffix;
		}

		@Override
		public String getName() {
			return prefix + "@" + suffix;
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof SuffixedIdentifier) {
				SuffixedIdentifier i = (SuffixedIdentifier) o;
				return i.prefix.equals(prefix) && i.suffix.equals(suffix);
			}
			return false;
		}

		@Override
		public int hashCode() {
			return prefix.hashCode() ^ suffix.hashCode();
		}

		@Override
		public String toString() {
			return getName();
		}
	}

	// =========================================================================
	// Function symbols
	// =========================================================================

	/**
	 * An uninterpreted function symbol.
	 */
	public static class Fun {
		private static final String LIMITED_SUFFIX = "%limited";

		private final String name;
		private final List<Sort> parameters;
		private final Sort returns;

		public Fun(String name, List<Sort> parameters, Sort returns) {
			this.name = name;
			this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
			this.returns = returns;
		}

		public String getName() {
			return name;
		}

		public List<Sort> getParameters() {
			return parameters;
		}

		public Sort getReturns() {
			return returns;
		}

		/**
		 * Get the limited variant of this function symbol, which is never unfolded
		 * by the function's definitional axiom.
		 *
		 * @return
		 */
		public Fun limited() {
			return new Fun(name + LIMITED_SUFFIX, parameters, returns);
		}

		public boolean isLimited() {
			return name.endsWith(LIMITED_SUFFIX);
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Fun) {
				Fun f = (Fun) o;
				return f.name.equals(name) && f.parameters.equals(parameters) && f.returns.equals(returns);
			}
			return false;
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

	// =========================================================================
	// Terms
	// =========================================================================

	public interface Term {
		/**
		 * Get the sort of this term.
		 *
		 * @return
		 */
		public Sort getSort();

		/**
		 * Get the immediate subterms of this term.
		 *
		 * @return
		 */
		public List<Term> getOperands();

		/**
		 * Construct a term of the same kind as this, but with the given subterms.
		 * This should return <code>this</code> when nothing changed.
		 *
		 * @param operands
		 * @return
		 */
		public Term withOperands(List<Term> operands);

		public static abstract class AbstractTerm implements Term {
			private final Sort sort;
			private final List<Term> operands;

			public AbstractTerm(Sort sort, Term... operands) {
				this(sort, Arrays.asList(operands));
			}

			public AbstractTerm(Sort sort, List<Term> operands) {
				this.sort = sort;
				this.operands = Collections.unmodifiableList(new ArrayList<>(operands));
				for (Term t : operands) {
					if (t == null) {
						throw new IllegalArgumentException("null operand");
					}
				}
			}

			@Override
			public Sort getSort() {
				return sort;
			}

			@Override
			public List<Term> getOperands() {
				return operands;
			}

			@Override
			public Term withOperands(List<Term> operands) {
				if (operands.size() != this.operands.size()) {
					throw new IllegalArgumentException("invalid number of operands");
				}
				for (int i = 0; i != operands.size(); ++i) {
					if (operands.get(i) != this.operands.get(i)) {
						return construct(operands);
					}
				}
				return this;
			}

			protected Term operand(int i) {
				return operands.get(i);
			}

			protected List<Term> operands(int start) {
				return operands.subList(start, operands.size());
			}

			/**
			 * Construct a fresh instance of this term kind from a given list of
			 * operands.
			 *
			 * @param operands
			 * @return
			 */
			protected abstract Term construct(List<Term> operands);

			/**
			 * Get any non-term data which distinguishes this term from another of the
			 * same kind and with the same operands.
			 *
			 * @return
			 */
			protected Object[] getData() {
				return new Object[0];
			}

			@Override
			public boolean equals(Object o) {
				if (o == this) {
					return true;
				} else if (o == null || o.getClass() != getClass()) {
					return false;
				}
				AbstractTerm t = (AbstractTerm) o;
				return sort.equals(t.sort) && Arrays.equals(getData(), t.getData()) && operands.equals(t.operands);
			}

			@Override
			public int hashCode() {
				return Objects.hash(getClass().getName(), Arrays.hashCode(getData()), operands);
			}

			@Override
			public String toString() {
				return TermPrinter.toString(this);
			}
		}

		/**
		 * A term without any subterms.
		 */
		public static abstract class Leaf extends AbstractTerm {
			public Leaf(Sort sort) {
				super(sort);
			}

			@Override
			protected Term construct(List<Term> operands) {
				return this;
			}
		}

		// Variables and literals

		public static class Var extends Leaf {
			private final Identifier id;

			private Var(Identifier id, Sort sort) {
				super(sort);
				this.id = id;
			}

			public Identifier getId() {
				return id;
			}

			@Override
			protected Object[] getData() {
				return new Object[] { id };
			}
		}

		public static class BooleanLiteral extends Leaf {
			private final boolean value;

			private BooleanLiteral(boolean value) {
				super(Sort.Bool);
				this.value = value;
			}

			public boolean getValue() {
				return value;
			}

			@Override
			protected Object[] getData() {
				return new Object[] { value };
			}
		}

		public static class IntLiteral extends Leaf {
			private final BigInteger value;

			private IntLiteral(BigInteger value) {
				super(Sort.Int);
				this.value = value;
			}

			public BigInteger getValue() {
				return value;
			}

			@Override
			protected Object[] getData() {
				return new Object[] { value };
			}
		}

		public static class Null extends Leaf {
			private Null() {
				super(Sort.Ref);
			}
		}

		// Permissions

		public static class FullPerm extends Leaf {
			private FullPerm() {
				super(Sort.Perm);
			}
		}

		public static class NoPerm extends Leaf {
			private NoPerm() {
				super(Sort.Perm);
			}
		}

		public static class FractionPerm extends AbstractTerm {
			private FractionPerm(Term numerator, Term denominator) {
				super(Sort.Perm, numerator, denominator);
			}

			public Term getNumerator() {
				return operand(0);
			}

			public Term getDenominator() {
				return operand(1);
			}

			@Override
			protected Term construct(List<Term> operands) {
				return new FractionPerm(operands.get(0), operands.get(1));
			}
		}

		public static class PermTimes extends AbstractTerm {
			private PermTimes(Term lhs, Term rhs) {
				super(Sort.Perm, lhs, rhs);
			}

			@Override
			protected Term construct(List<Term> operands) {
				return new PermTimes(operands.get(0), operands.get(1));
			}
		}

		public static class PermPlus extends AbstractTerm {
			private PermPlus(Term lhs, Term rhs) {
				super(Sort.Perm, lhs, rhs);
			}

			@Override
			protected Term construct(List<Term> operands) {
				return new PermPlus(operands.get(0), operands.get(1));
			}
		}

		public static class PermMinus extends AbstractTerm {
			private PermMinus(Term lhs, Term rhs) {
				super(Sort.Perm, lhs, rhs);
			}

			@Override
			protected Term construct(List<Term> operands) {
				return new PermMinus(operands.get(0), operands.get(1));
			}
		}

		public static class PermLess extends AbstractTerm {
			private PermLess(Term lhs, Term rhs) {
				super(Sort.Bool, lhs, rhs);
			}

			@Override
			protected Term construct(List<Term> operands) {
				return new PermLess(operands.get(0), operands.get(1));
			}
		}

		public static class PermAtMost extends AbstractTerm {
			private PermAtMost(Term lhs, Term rhs) {
				super(Sort.Bool, lhs, rhs);
			}

			@Override
			protected Term construct(List<Term> operands) {
				return new PermAtMost(operands.get(0), operands.get(1));
			}
		}

		// Integer arithmetic

		/**
		 * The binary arithmetic and comparison operators over integers.
		 */
		public static class Arithmetic extends AbstractTerm {
			public enum Operator {
				PLUS("+"), MINUS("-"), TIMES("*"), DIV("div"), MOD("mod"), LESS("<"), ATMOST("<="), GREATER(">"),
				ATLEAST(">=");

				private final String symbol;

				Operator(String symbol) {
					this.symbol = symbol;
				}

				public String getSymbol() {
					return symbol;
				}

				public boolean isComparison() {
					return ordinal() >= LESS.ordinal();
				}
			}

			private final Operator operator;

			private Arithmetic(Operator operator, Term lhs, Term rhs) {
				super(operator.isComparison() ? Sort.Bool : Sort.Int, lhs, rhs);
				this.operator = operator;
			}

			public Operator getOperator() {
				return operator;
			}

			@Override
			protected Object[] getData() {
				return new Object[] { operator };
			}

			@Override
			protected Term construct(List<Term> operands) {
				return new Arithmetic(operator, operands.get(0), operands.get(1));
			}
		}

		// Logical

		public static class Equals extends AbstractTerm {
			private Equals(Term lhs, Term rhs) {
				super(Sort.Bool, lhs, rhs);
			}

			public Term getLeftHandSide() {
				return operand(0);
			}

			public Term getRightHandSide() {
				return operand(1);
			}

			@Override
			protected Term construct(List<Term> operands) {
				return new Equals(operands.get(0), operands.get(1));
			}
		}

		public static class And extends AbstractTerm {
			private And(List<Term> operands) {
				super(Sort.Bool, operands);
			}

			@Override
			protected Term construct(List<Term> operands) {
				return new And(operands);
			}
		}

		public static class Or extends AbstractTerm {
			private Or(List<Term> operands) {
				super(Sort.Bool, operands);
			}

			@Override
			protected Term construct(List<Term> operands) {
				return new Or(operands);
			}
		}

		public static class Not extends AbstractTerm {
			private Not(Term operand) {
				super(Sort.Bool, operand);
			}

			public Term getOperand() {
				return operand(0);
			}

			@Override
			protected Term construct(List<Term> operands) {
				return new Not(operands.get(0));
			}
		}

		public static class Implies extends AbstractTerm {
			private Implies(Term lhs, Term rhs) {
				super(Sort.Bool, lhs, rhs);
			}

			@Override
			protected Term construct(List<Term> operands) {
				return new Implies(operands.get(0), operands.get(1));
			}
		}

		public static class Ite extends AbstractTerm {
			private Ite(Term condition, Term trueBranch, Term falseBranch) {
				super(trueBranch.getSort(), condition, trueBranch, falseBranch);
			}

			@Override
			protected Term construct(List<Term> operands) {
				return new Ite(operands.get(0), operands.get(1), operands.get(2));
			}
		}

		public static class Let extends AbstractTerm {
			private final Var variable;

			private Let(Var variable, Term bound, Term body) {
				super(body.getSort(), bound, body);
				this.variable = variable;
			}

			public Var getVariable() {
				return variable;
			}

			public Term getBound() {
				return operand(0);
			}

			public Term getBody() {
				return operand(1);
			}

			@Override
			protected Object[] getData() {
				return new Object[] { variable };
			}

			@Override
			protected Term construct(List<Term> operands) {
				return new Let(variable, operands.get(0), operands.get(1));
			}
		}

		/**
		 * A pattern guiding the instantiation of a quantifier.
		 */
		public static class Trigger {
			private final List<Term> terms;

			public Trigger(List<Term> terms) {
				this.terms = Collections.unmodifiableList(new ArrayList<>(terms));
			}

			public List<Term> getTerms() {
				return terms;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Trigger && ((Trigger) o).terms.equals(terms);
			}

			@Override
			public int hashCode() {
				return terms.hashCode();
			}
		}

		/**
		 * A universal or existential quantifier. The operands of a quantifier are
		 * its body followed by the terms of each trigger in turn.
		 */
		public static class Quantification extends AbstractTerm {
			private final boolean universal;
			private final List<Var> variables;
			private final int[] triggerSizes;

			private Quantification(boolean universal, List<Var> variables, Term body, List<Trigger> triggers) {
				super(Sort.Bool, flatten(body, triggers));
				this.universal = universal;
				this.variables = Collections.unmodifiableList(new ArrayList<>(variables));
				this.triggerSizes = new int[triggers.size()];
				for (int i = 0; i != triggers.size(); ++i) {
					triggerSizes[i] = triggers.get(i).getTerms().size();
				}
			}

			public boolean isUniversal() {
				return universal;
			}

			public List<Var> getVariables() {
				return variables;
			}

			public Term getBody() {
				return operand(0);
			}

			public List<Trigger> getTriggers() {
				return unflatten(getOperands());
			}

			@Override
			protected Object[] getData() {
				return new Object[] { universal, variables, Arrays.toString(triggerSizes) };
			}

			@Override
			protected Term construct(List<Term> operands) {
				return new Quantification(universal, variables, operands.get(0), unflatten(operands));
			}

			private List<Trigger> unflatten(List<Term> operands) {
				ArrayList<Trigger> triggers = new ArrayList<>();
				int index = 1;
				for (int size : triggerSizes) {
					triggers.add(new Trigger(operands.subList(index, index + size)));
					index += size;
				}
				return triggers;
			}

			private static List<Term> flatten(Term body, List<Trigger> triggers) {
				ArrayList<Term> operands = new ArrayList<>();
				operands.add(body);
				for (Trigger t : triggers) {
					operands.addAll(t.getTerms());
				}
				return operands;
			}
		}

		/**
		 * Application of an uninterpreted function symbol.
		 */
		public static class App extends AbstractTerm {
			private final Fun function;

			private App(Fun function, List<Term> arguments) {
				super(function.getReturns(), arguments);
				this.function = function;
				if (function.getParameters().size() != arguments.size()) {
					throw new IllegalArgumentException("invalid number of arguments for " + function.getName());
				}
			}

			public Fun getFunction() {
				return function;
			}

			public List<Term> getArguments() {
				return getOperands();
			}

			@Override
			protected Object[] getData() {
				return new Object[] { function };
			}

			@Override
			protected Term construct(List<Term> operands) {
				return new App(function, operands);
			}
		}

		// Snapshot algebra

		/**
		 * The union of two disjoint partial heaps.
		 */
		public static class Combine extends AbstractTerm {
			private Combine(Term lhs, Term rhs) {
				super(Sort.PHeap, lhs, rhs);
			}

			public Term getLeftHandSide() {
				return operand(0);
			}

			public Term getRightHandSide() {
				return operand(1);
			}

			@Override
			protected Term construct(List<Term> operands) {
				return new Combine(operands.get(0), operands.get(1));
			}
		}

		/**
		 * The part of a heap on which a given function application depends.
		 */
		public static class Restrict extends AbstractTerm {
			private final String function;

			private Restrict(String function, Term heap, List<Term> arguments) {
				super(Sort.PHeap, prepend(heap, arguments));
				this.function = function;
			}

			public String getFunction() {
				return function;
			}

			public Term getHeap() {
				return operand(0);
			}

			public List<Term> getArguments() {
				return operands(1);
			}

			@Override
			protected Object[] getData() {
				return new Object[] { function };
			}

			@Override
			protected Term construct(List<Term> operands) {
				return new Restrict(function, operands.get(0), operands.subList(1, operands.size()));
			}
		}

		public static class LookupField extends AbstractTerm {
			private final String field;

			private LookupField(String field, Sort sort, Term heap, Term receiver) {
				super(sort, heap, receiver);
				this.field = field;
			}

			public String getField() {
				return field;
			}

			public Term getHeap() {
				return operand(0);
			}

			public Term getReceiver() {
				return operand(1);
			}

			@Override
			protected Object[] getData() {
				return new Object[] { field };
			}

			@Override
			protected Term construct(List<Term> operands) {
				return new LookupField(field, getSort(), operands.get(0), operands.get(1));
			}
		}

		public static class LookupPredicate extends AbstractTerm {
			private final String predicate;

			private LookupPredicate(String predicate, Term heap, List<Term> arguments) {
				super(Sort.PHeap, prepend(heap, arguments));
				this.predicate = predicate;
			}

			public String getPredicate() {
				return predicate;
			}

			public Term getHeap() {
				return operand(0);
			}

			public List<Term> getArguments() {
				return operands(1);
			}

			@Override
			protected Object[] getData() {
				return new Object[] { predicate };
			}

			@Override
			protected Term construct(List<Term> operands) {
				return new LookupPredicate(predicate, operands.get(0), operands.subList(1, operands.size()));
			}
		}

		/**
		 * The partial heap holding exactly one field location.
		 */
		public static class SingletonField extends AbstractTerm {
			private final String field;

			private SingletonField(String field, Term receiver, Term value) {
				super(Sort.PHeap, receiver, value);
				this.field = field;
			}

			public String getField() {
				return field;
			}

			public Term getReceiver() {
				return operand(0);
			}

			public Term getValue() {
				return operand(1);
			}

			@Override
			protected Object[] getData() {
				return new Object[] { field };
			}

			@Override
			protected Term construct(List<Term> operands) {
				return new SingletonField(field, operands.get(0), operands.get(1));
			}
		}

		/**
		 * The partial heap holding exactly one predicate instance. The operands
		 * are the predicate's arguments followed by its snapshot.
		 */
		public static class SingletonPredicate extends AbstractTerm {
			private final String predicate;

			private SingletonPredicate(String predicate, List<Term> arguments, Term value) {
				super(Sort.PHeap, append(arguments, value));
				this.predicate = predicate;
			}

			public String getPredicate() {
				return predicate;
			}

			public List<Term> getArguments() {
				return getOperands().subList(0, getOperands().size() - 1);
			}

			public Term getValue() {
				return operand(getOperands().size() - 1);
			}

			@Override
			protected Object[] getData() {
				return new Object[] { predicate };
			}

			@Override
			protected Term construct(List<Term> operands) {
				int n = operands.size() - 1;
				return new SingletonPredicate(predicate, operands.subList(0, n), operands.get(n));
			}
		}

		public static class RemovePredicate extends AbstractTerm {
			private final String predicate;

			private RemovePredicate(String predicate, Term heap, List<Term> arguments) {
				super(Sort.PHeap, prepend(heap, arguments));
				this.predicate = predicate;
			}

			public String getPredicate() {
				return predicate;
			}

			public Term getHeap() {
				return operand(0);
			}

			public List<Term> getArguments() {
				return operands(1);
			}

			@Override
			protected Object[] getData() {
				return new Object[] { predicate };
			}

			@Override
			protected Term construct(List<Term> operands) {
				return new RemovePredicate(predicate, operands.get(0), operands.subList(1, operands.size()));
			}
		}

		public static class MagicWandSnapshot extends AbstractTerm {
			private MagicWandSnapshot(Term snapshot) {
				super(Sort.Snap, snapshot);
			}

			public Term getSnapshot() {
				return operand(0);
			}

			@Override
			protected Term construct(List<Term> operands) {
				return new MagicWandSnapshot(operands.get(0));
			}
		}

		/**
		 * Reinterprets a snapshot at a different sort.
		 */
		public static class SortWrapper extends AbstractTerm {
			private SortWrapper(Term term, Sort sort) {
				super(sort, term);
			}

			public Term getTerm() {
				return operand(0);
			}

			@Override
			protected Term construct(List<Term> operands) {
				return new SortWrapper(operands.get(0), getSort());
			}
		}

		// Snapshot maps

		/**
		 * Applying a snapshot map to the identity of a resource.
		 */
		public static class Lookup extends AbstractTerm {
			private Lookup(Sort sort, Term map, List<Term> arguments) {
				super(sort, prepend(map, arguments));
			}

			public Term getMap() {
				return operand(0);
			}

			public List<Term> getArguments() {
				return operands(1);
			}

			@Override
			protected Term construct(List<Term> operands) {
				return new Lookup(getSort(), operands.get(0), operands.subList(1, operands.size()));
			}
		}

		/**
		 * The trigger term <code>loc(sm, args)</code> used to instantiate
		 * quantified definitions involving a snapshot map for the named resource.
		 */
		public static class ResourceTrigger extends AbstractTerm {
			private final String resource;

			private ResourceTrigger(String resource, Term map, List<Term> arguments) {
				super(Sort.Bool, prepend(map, arguments));
				this.resource = resource;
			}

			public String getResource() {
				return resource;
			}

			public Term getMap() {
				return operand(0);
			}

			public List<Term> getArguments() {
				return operands(1);
			}

			@Override
			protected Object[] getData() {
				return new Object[] { resource };
			}

			@Override
			protected Term construct(List<Term> operands) {
				return new ResourceTrigger(resource, operands.get(0), operands.subList(1, operands.size()));
			}
		}
	}

	private static List<Term> prepend(Term head, List<Term> tail) {
		ArrayList<Term> r = new ArrayList<>();
		r.add(head);
		r.addAll(tail);
		return r;
	}

	private static List<Term> append(List<Term> init, Term last) {
		ArrayList<Term> r = new ArrayList<>(init);
		r.add(last);
		return r;
	}

	// =======================================================
	// Constructor API (for convenience)
	// =======================================================

	public static final Term.BooleanLiteral TRUE = new Term.BooleanLiteral(true);
	public static final Term.BooleanLiteral FALSE = new Term.BooleanLiteral(false);
	public static final Term.Null NULL = new Term.Null();
	public static final Term.FullPerm FULL = new Term.FullPerm();
	public static final Term.NoPerm NONE = new Term.NoPerm();

	public static Term.Var VAR(String name, Sort sort) {
		return new Term.Var(new SimpleIdentifier(name), sort);
	}

	public static Term.Var VAR(Identifier id, Sort sort) {
		return new Term.Var(id, sort);
	}

	public static Term.BooleanLiteral CONST(boolean b) {
		return b ? TRUE : FALSE;
	}

	public static Term.IntLiteral CONST(long i) {
		return new Term.IntLiteral(BigInteger.valueOf(i));
	}

	public static Term.IntLiteral CONST(BigInteger i) {
		return new Term.IntLiteral(i);
	}

	public static Term FRACTION(Term numerator, Term denominator) {
		return new Term.FractionPerm(numerator, denominator);
	}

	public static Term FRACTION(long numerator, long denominator) {
		return new Term.FractionPerm(CONST(numerator), CONST(denominator));
	}

	/**
	 * Multiply two permission amounts. Full permission is the identity and no
	 * permission is the zero.
	 *
	 * @param lhs
	 * @param rhs
	 * @return
	 */
	public static Term PERM_TIMES(Term lhs, Term rhs) {
		if (lhs instanceof Term.FullPerm) {
			return rhs;
		} else if (rhs instanceof Term.FullPerm) {
			return lhs;
		} else if (lhs instanceof Term.NoPerm || rhs instanceof Term.NoPerm) {
			return NONE;
		} else {
			return new Term.PermTimes(lhs, rhs);
		}
	}

	public static Term PERM_PLUS(Term lhs, Term rhs) {
		if (lhs instanceof Term.NoPerm) {
			return rhs;
		} else if (rhs instanceof Term.NoPerm) {
			return lhs;
		} else {
			return new Term.PermPlus(lhs, rhs);
		}
	}

	public static Term PERM_MINUS(Term lhs, Term rhs) {
		if (rhs instanceof Term.NoPerm) {
			return lhs;
		}
		return new Term.PermMinus(lhs, rhs);
	}

	public static Term PERM_LESS(Term lhs, Term rhs) {
		return new Term.PermLess(lhs, rhs);
	}

	public static Term PERM_ATMOST(Term lhs, Term rhs) {
		return new Term.PermAtMost(lhs, rhs);
	}

	public static Term ARITH(Term.Arithmetic.Operator op, Term lhs, Term rhs) {
		return new Term.Arithmetic(op, lhs, rhs);
	}

	public static Term EQ(Term lhs, Term rhs) {
		if (!lhs.getSort().equals(rhs.getSort())) {
			throw new IllegalArgumentException("incompatible sorts " + lhs.getSort() + " and " + rhs.getSort());
		}
		return new Term.Equals(lhs, rhs);
	}

	/**
	 * Construct a conjunction, dropping <code>true</code> operands and
	 * collapsing to <code>false</code> when any operand is <code>false</code>.
	 *
	 * @param operands
	 * @return
	 */
	public static Term AND(Term... operands) {
		return AND(Arrays.asList(operands));
	}

	public static Term AND(List<Term> operands) {
		ArrayList<Term> ops = new ArrayList<>();
		for (Term t : operands) {
			if (t == TRUE) {
				continue;
			} else if (t == FALSE) {
				return FALSE;
			} else if (t instanceof Term.And) {
				ops.addAll(t.getOperands());
			} else {
				ops.add(t);
			}
		}
		if (ops.isEmpty()) {
			return TRUE;
		} else if (ops.size() == 1) {
			return ops.get(0);
		}
		return new Term.And(ops);
	}

	public static Term OR(Term... operands) {
		ArrayList<Term> ops = new ArrayList<>();
		for (Term t : operands) {
			if (t == FALSE) {
				continue;
			} else if (t == TRUE) {
				return TRUE;
			} else {
				ops.add(t);
			}
		}
		if (ops.isEmpty()) {
			return FALSE;
		} else if (ops.size() == 1) {
			return ops.get(0);
		}
		return new Term.Or(ops);
	}

	public static Term NOT(Term operand) {
		if (operand == TRUE) {
			return FALSE;
		} else if (operand == FALSE) {
			return TRUE;
		} else if (operand instanceof Term.Not) {
			return ((Term.Not) operand).getOperand();
		}
		return new Term.Not(operand);
	}

	public static Term IMPLIES(Term lhs, Term rhs) {
		if (lhs == TRUE) {
			return rhs;
		} else if (lhs == FALSE || rhs == TRUE) {
			return TRUE;
		}
		return new Term.Implies(lhs, rhs);
	}

	public static Term ITE(Term condition, Term trueBranch, Term falseBranch) {
		if (condition == TRUE) {
			return trueBranch;
		} else if (condition == FALSE) {
			return falseBranch;
		}
		return new Term.Ite(condition, trueBranch, falseBranch);
	}

	public static Term LET(Term.Var variable, Term bound, Term body) {
		return new Term.Let(variable, bound, body);
	}

	public static Term FORALL(List<Term.Var> variables, Term body, List<Term.Trigger> triggers) {
		if (variables.isEmpty() || body == TRUE) {
			return body;
		}
		return new Term.Quantification(true, variables, body, triggers);
	}

	public static Term EXISTS(List<Term.Var> variables, Term body, List<Term.Trigger> triggers) {
		if (variables.isEmpty() || body == FALSE) {
			return body;
		}
		return new Term.Quantification(false, variables, body, triggers);
	}

	public static Term.Trigger TRIGGER(Term... terms) {
		return new Term.Trigger(Arrays.asList(terms));
	}

	public static Term.App APP(Fun function, List<Term> arguments) {
		return new Term.App(function, arguments);
	}

	public static Term.App APP(Fun function, Term... arguments) {
		return new Term.App(function, Arrays.asList(arguments));
	}

	// Snapshot algebra

	public static Term COMBINE(Term lhs, Term rhs) {
		return new Term.Combine(lhs, rhs);
	}

	public static Term RESTRICT(String function, Term heap, List<Term> arguments) {
		return new Term.Restrict(function, heap, arguments);
	}

	public static Term LOOKUP_FIELD(String field, Sort sort, Term heap, Term receiver) {
		return new Term.LookupField(field, sort, heap, receiver);
	}

	public static Term LOOKUP_PREDICATE(String predicate, Term heap, List<Term> arguments) {
		return new Term.LookupPredicate(predicate, heap, arguments);
	}

	public static Term SINGLETON(String field, Term receiver, Term value) {
		return new Term.SingletonField(field, receiver, value);
	}

	public static Term SINGLETON_PREDICATE(String predicate, List<Term> arguments, Term value) {
		return new Term.SingletonPredicate(predicate, arguments, value);
	}

	public static Term REMOVE_PREDICATE(String predicate, Term heap, List<Term> arguments) {
		return new Term.RemovePredicate(predicate, heap, arguments);
	}

	public static Term WAND_SNAPSHOT(Term snapshot) {
		return new Term.MagicWandSnapshot(snapshot);
	}

	public static Term CONVERT(Term term, Sort sort) {
		if (term.getSort().equals(sort)) {
			return term;
		}
		return new Term.SortWrapper(term, sort);
	}

	// Snapshot maps

	public static Term LOOKUP(Sort sort, Term map, List<Term> arguments) {
		return new Term.Lookup(sort, map, arguments);
	}

	public static Term RESOURCE_TRIGGER(String resource, Term map, List<Term> arguments) {
		return new Term.ResourceTrigger(resource, map, arguments);
	}

	/**
	 * Translate a program type into the corresponding sort.
	 *
	 * @param type
	 * @return
	 */
	public static Sort toSort(Program.Type type) {
		if (type instanceof Program.Type.Bool) {
			return Sort.Bool;
		} else if (type instanceof Program.Type.Int) {
			return Sort.Int;
		} else if (type instanceof Program.Type.Perm) {
			return Sort.Perm;
		} else if (type instanceof Program.Type.Ref) {
			return Sort.Ref;
		} else {
			throw new IllegalArgumentException("unknown type encountered (" + type.getClass().getName() + ")");
		}
	}
}
