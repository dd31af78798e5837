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
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * An immutable program as handed over by the front end. This provides the
 * assertion and expression language being produced and translated, along with
 * a read-only symbol table of the fields, predicates and functions declared in
 * the program.
 *
 * @author David J. Pearce
 *
 */
public class Program {
	/**
	 * The list of declared fields.
	 */
	private final List<Decl.Field> fields;
	/**
	 * The list of declared predicates.
	 */
	private final List<Decl.Predicate> predicates;
	/**
	 * The list of declared (heap-dependent) functions.
	 */
	private final List<Decl.Function> functions;

	public Program(List<Decl.Field> fields, List<Decl.Predicate> predicates, List<Decl.Function> functions) {
		this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
		this.predicates = Collections.unmodifiableList(new ArrayList<>(predicates));
		this.functions = Collections.unmodifiableList(new ArrayList<>(functions));
	}

	public List<Decl.Field> getFields() {
		return fields;
	}

	public List<Decl.Predicate> getPredicates() {
		return predicates;
	}

	public List<Decl.Function> getFunctions() {
		return functions;
	}

	public Decl.Field findField(String name) {
		for (Decl.Field f : fields) {
			if (f.getName().equals(name)) {
				return f;
			}
		}
		throw new IllegalArgumentException("unknown field \"" + name + "\"");
	}

	public Decl.Predicate findPredicate(String name) {
		for (Decl.Predicate p : predicates) {
			if (p.getName().equals(name)) {
				return p;
			}
		}
		throw new IllegalArgumentException("unknown predicate \"" + name + "\"");
	}

	public Decl.Function findFunction(String name) {
		for (Decl.Function f : functions) {
			if (f.getName().equals(name)) {
				return f;
			}
		}
		throw new IllegalArgumentException("unknown function \"" + name + "\"");
	}

	// =========================================================================
	// Top-Level Item
	// =========================================================================

	public interface Item {
		/**
		 * Get a particular attribute associated with this item.
		 * @param kind
		 * @param <T>
		 * @return
		 */
		public <T> T getAttribute(Class<T> kind);

		/**
		 * Get all attributes within this item.
		 * @return
		 */
		public Attribute[] getAttributes();

		/**
		 * Get the source position of this item, or <code>null</code> if none was
		 * recorded.
		 *
		 * @return
		 */
		public Position getPosition();
	}

	public static class AbstractItem implements Item {
		private final Attribute[] attributes;

		public AbstractItem(Attribute[] attributes) {
			this.attributes = attributes;
		}

		@Override
		public <T> T getAttribute(Class<T> kind) {
			for(int i=0;i!=attributes.length;++i) {
				T ith = attributes[i].as(kind);
				if(ith != null) {
					return ith;
				}
			}
			return null;
		}

		@Override
		public Attribute[] getAttributes() {
			return attributes;
		}

		@Override
		public Position getPosition() {
			return getAttribute(Position.class);
		}

		public boolean isFalse() {
			return (this instanceof Expr.Boolean) && !((Expr.Boolean) this).getValue();
		}

		public boolean isTrue() {
			return (this instanceof Expr.Boolean) && ((Expr.Boolean) this).getValue();
		}
	}

	// =========================================================================
	// Declarations
	// =========================================================================

	public interface Decl extends Item {

		public String getName();

		public static class Field extends AbstractItem implements Decl {
			private final String name;
			private final Type type;

			public Field(String name, Type type, Attribute... attributes) {
				super(attributes);
				this.name = name;
				this.type = type;
			}

			@Override
			public String getName() {
				return name;
			}

			public Type getType() {
				return type;
			}
		}

		/**
		 * A local variable declaration, as used for the formal parameters of
		 * predicates and functions, and for the variables bound by quantifiers and
		 * let expressions.
		 */
		public static class Parameter extends AbstractItem implements Decl {
			private final String name;
			private final Type type;

			public Parameter(String name, Type type, Attribute... attributes) {
				super(attributes);
				this.name = name;
				this.type = type;
			}

			@Override
			public String getName() {
				return name;
			}

			public Type getType() {
				return type;
			}
		}

		/**
		 * A predicate declaration. Abstract predicates have no body.
		 */
		public static class Predicate extends AbstractItem implements Decl {
			private final String name;
			private final List<Parameter> parameters;
			private final Expr body;

			public Predicate(String name, List<Parameter> parameters, Expr body, Attribute... attributes) {
				super(attributes);
				this.name = name;
				this.parameters = new ArrayList<>(parameters);
				this.body = body;
			}

			@Override
			public String getName() {
				return name;
			}

			public List<Parameter> getParameters() {
				return parameters;
			}

			public Expr getBody() {
				return body;
			}
		}

		/**
		 * A heap-dependent function declaration. Abstract functions have no body.
		 */
		public static class Function extends AbstractItem implements Decl {
			private final String name;
			private final List<Parameter> parameters;
			private final Type returns;
			private final List<Expr> requires;
			private final List<Expr> ensures;
			private final Expr body;

			public Function(String name, List<Parameter> parameters, Type returns, List<Expr> requires,
					List<Expr> ensures, Expr body, Attribute... attributes) {
				super(attributes);
				this.name = name;
				this.parameters = new ArrayList<>(parameters);
				this.returns = returns;
				this.requires = new ArrayList<>(requires);
				this.ensures = new ArrayList<>(ensures);
				this.body = body;
			}

			@Override
			public String getName() {
				return name;
			}

			public List<Parameter> getParameters() {
				return parameters;
			}

			public Type getReturns() {
				return returns;
			}

			public List<Expr> getRequires() {
				return requires;
			}

			public List<Expr> getEnsures() {
				return ensures;
			}

			public Expr getBody() {
				return body;
			}
		}
	}

	// =========================================================================
	// Expressions
	// =========================================================================

	public interface Expr extends Item {

		public interface UnaryOperator extends Expr {
			Expr getOperand();
		}

		public interface BinaryOperator extends Expr {
			Expr getLeftHandSide();
			Expr getRightHandSide();
		}

		/**
		 * A resource location, i.e. either a field access <code>e.f</code> or a
		 * predicate instance <code>P(e1,...,en)</code>.
		 */
		public interface Location extends Expr {
			public String getName();
		}

		/**
		 * An access predicate <code>acc(loc, perm)</code> denoting ownership of a
		 * given amount of permission to a given location.
		 */
		public interface AccessPredicate extends Expr {
			public Location getLocation();

			public Expr getPermission();
		}

		public interface Quantifier extends Expr {
			public List<Decl.Parameter> getParameters();

			public Expr getBody();
		}

		// Literals

		public static class Boolean extends AbstractItem implements Expr {
			private final boolean value;

			private Boolean(boolean value, Attribute[] attributes) {
				super(attributes);
				this.value = value;
			}

			public boolean getValue() {
				return value;
			}
		}

		public static class Integer extends AbstractItem implements Expr {
			private final BigInteger value;

			private Integer(BigInteger value, Attribute[] attributes) {
				super(attributes);
				this.value = value;
			}

			public BigInteger getValue() {
				return value;
			}
		}

		public static class Null extends AbstractItem implements Expr {
			private Null(Attribute[] attributes) {
				super(attributes);
			}
		}

		public static class FullPermission extends AbstractItem implements Expr {
			private FullPermission(Attribute[] attributes) {
				super(attributes);
			}
		}

		public static class NoPermission extends AbstractItem implements Expr {
			private NoPermission(Attribute[] attributes) {
				super(attributes);
			}
		}

		/**
		 * An unspecified, strictly positive amount of permission.
		 */
		public static class WildcardPermission extends AbstractItem implements Expr {
			private WildcardPermission(Attribute[] attributes) {
				super(attributes);
			}
		}

		public static class FractionalPermission extends AbstractItem implements BinaryOperator {
			private final Expr lhs;
			private final Expr rhs;

			private FractionalPermission(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(attributes);
				this.lhs = lhs;
				this.rhs = rhs;
			}

			@Override
			public Expr getLeftHandSide() {
				return lhs;
			}

			@Override
			public Expr getRightHandSide() {
				return rhs;
			}
		}

		// Variables

		public static class VariableAccess extends AbstractItem implements Expr {
			private final String variable;
			private final Type type;

			private VariableAccess(String var, Type type, Attribute[] attributes) {
				super(attributes);
				if(var == null) {
					throw new IllegalArgumentException();
				}
				this.variable = var;
				this.type = type;
			}

			public String getVariable() {
				return variable;
			}

			public Type getType() {
				return type;
			}

			@Override
			public String toString() {
				return "VAR(" + variable + ")";
			}
		}

		/**
		 * The result of the enclosing function, as used in its postcondition.
		 */
		public static class Result extends AbstractItem implements Expr {
			private final Type type;

			private Result(Type type, Attribute[] attributes) {
				super(attributes);
				this.type = type;
			}

			public Type getType() {
				return type;
			}
		}

		// Locations

		public static class FieldAccess extends AbstractItem implements Location {
			private final Expr receiver;
			private final Decl.Field field;

			private FieldAccess(Expr receiver, Decl.Field field, Attribute[] attributes) {
				super(attributes);
				this.receiver = receiver;
				this.field = field;
			}

			public Expr getReceiver() {
				return receiver;
			}

			public Decl.Field getField() {
				return field;
			}

			@Override
			public String getName() {
				return field.getName();
			}
		}

		public static class PredicateAccess extends AbstractItem implements Location {
			private final String name;
			private final List<Expr> arguments;

			private PredicateAccess(String name, Collection<Expr> arguments, Attribute[] attributes) {
				super(attributes);
				this.name = name;
				this.arguments = new ArrayList<>(arguments);
			}

			@Override
			public String getName() {
				return name;
			}

			public List<Expr> getArguments() {
				return arguments;
			}
		}

		// Access predicates

		public static class FieldAccessPredicate extends AbstractItem implements AccessPredicate {
			private final FieldAccess location;
			private final Expr permission;

			private FieldAccessPredicate(FieldAccess location, Expr permission, Attribute[] attributes) {
				super(attributes);
				this.location = location;
				this.permission = permission;
			}

			@Override
			public FieldAccess getLocation() {
				return location;
			}

			@Override
			public Expr getPermission() {
				return permission;
			}
		}

		public static class PredicateAccessPredicate extends AbstractItem implements AccessPredicate {
			private final PredicateAccess location;
			private final Expr permission;

			private PredicateAccessPredicate(PredicateAccess location, Expr permission, Attribute[] attributes) {
				super(attributes);
				this.location = location;
				this.permission = permission;
			}

			@Override
			public PredicateAccess getLocation() {
				return location;
			}

			@Override
			public Expr getPermission() {
				return permission;
			}
		}

		/**
		 * A magic wand <code>A --* B</code>.
		 */
		public static class MagicWand extends AbstractItem implements BinaryOperator {
			private final Expr lhs;
			private final Expr rhs;

			private MagicWand(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(attributes);
				this.lhs = lhs;
				this.rhs = rhs;
			}

			@Override
			public Expr getLeftHandSide() {
				return lhs;
			}

			@Override
			public Expr getRightHandSide() {
				return rhs;
			}
		}

		/**
		 * The amount of permission currently held to a given location, written
		 * <code>perm(loc)</code>.
		 */
		public static class CurrentPermission extends AbstractItem implements Expr {
			private final Location location;

			private CurrentPermission(Location location, Attribute[] attributes) {
				super(attributes);
				this.location = location;
			}

			public Location getLocation() {
				return location;
			}
		}

		// Comparators

		public static class Equals extends AbstractItem implements BinaryOperator {
			private final Expr lhs;
			private final Expr rhs;

			private Equals(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(attributes);
				this.lhs = lhs;
				this.rhs = rhs;
			}

			@Override
			public Expr getLeftHandSide() {
				return lhs;
			}

			@Override
			public Expr getRightHandSide() {
				return rhs;
			}
		}

		public static class NotEquals extends AbstractItem implements BinaryOperator {
			private final Expr lhs;
			private final Expr rhs;

			private NotEquals(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(attributes);
				this.lhs = lhs;
				this.rhs = rhs;
			}

			@Override
			public Expr getLeftHandSide() {
				return lhs;
			}

			@Override
			public Expr getRightHandSide() {
				return rhs;
			}
		}

		public static class LessThan extends AbstractItem implements BinaryOperator {
			private final Expr lhs;
			private final Expr rhs;

			private LessThan(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(attributes);
				this.lhs = lhs;
				this.rhs = rhs;
			}

			@Override
			public Expr getLeftHandSide() {
				return lhs;
			}

			@Override
			public Expr getRightHandSide() {
				return rhs;
			}
		}

		public static class LessThanOrEqual extends AbstractItem implements BinaryOperator {
			private final Expr lhs;
			private final Expr rhs;

			private LessThanOrEqual(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(attributes);
				this.lhs = lhs;
				this.rhs = rhs;
			}

			@Override
			public Expr getLeftHandSide() {
				return lhs;
			}

			@Override
			public Expr getRightHandSide() {
				return rhs;
			}
		}

		public static class GreaterThan extends AbstractItem implements BinaryOperator {
			private final Expr lhs;
			private final Expr rhs;

			private GreaterThan(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(attributes);
				this.lhs = lhs;
				this.rhs = rhs;
			}

			@Override
			public Expr getLeftHandSide() {
				return lhs;
			}

			@Override
			public Expr getRightHandSide() {
				return rhs;
			}
		}

		public static class GreaterThanOrEqual extends AbstractItem implements BinaryOperator {
			private final Expr lhs;
			private final Expr rhs;

			private GreaterThanOrEqual(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(attributes);
				this.lhs = lhs;
				this.rhs = rhs;
			}

			@Override
			public Expr getLeftHandSide() {
				return lhs;
			}

			@Override
			public Expr getRightHandSide() {
				return rhs;
			}
		}

		// Arithmetic

		public static class Addition extends AbstractItem implements BinaryOperator {
			private final Expr lhs;
			private final Expr rhs;

			private Addition(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(attributes);
				this.lhs = lhs;
				this.rhs = rhs;
			}

			@Override
			public Expr getLeftHandSide() {
				return lhs;
			}

			@Override
			public Expr getRightHandSide() {
				return rhs;
			}
		}

		public static class Subtraction extends AbstractItem implements BinaryOperator {
			private final Expr lhs;
			private final Expr rhs;

			private Subtraction(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(attributes);
				this.lhs = lhs;
				this.rhs = rhs;
			}

			@Override
			public Expr getLeftHandSide() {
				return lhs;
			}

			@Override
			public Expr getRightHandSide() {
				return rhs;
			}
		}

		public static class Multiplication extends AbstractItem implements BinaryOperator {
			private final Expr lhs;
			private final Expr rhs;

			private Multiplication(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(attributes);
				this.lhs = lhs;
				this.rhs = rhs;
			}

			@Override
			public Expr getLeftHandSide() {
				return lhs;
			}

			@Override
			public Expr getRightHandSide() {
				return rhs;
			}
		}

		public static class Division extends AbstractItem implements BinaryOperator {
			private final Expr lhs;
			private final Expr rhs;

			private Division(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(attributes);
				this.lhs = lhs;
				this.rhs = rhs;
			}

			@Override
			public Expr getLeftHandSide() {
				return lhs;
			}

			@Override
			public Expr getRightHandSide() {
				return rhs;
			}
		}

		public static class Remainder extends AbstractItem implements BinaryOperator {
			private final Expr lhs;
			private final Expr rhs;

			private Remainder(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(attributes);
				this.lhs = lhs;
				this.rhs = rhs;
			}

			@Override
			public Expr getLeftHandSide() {
				return lhs;
			}

			@Override
			public Expr getRightHandSide() {
				return rhs;
			}
		}

		public static class Negation extends AbstractItem implements UnaryOperator {
			private final Expr operand;

			private Negation(Expr operand, Attribute[] attributes) {
				super(attributes);
				this.operand = operand;
			}

			@Override
			public Expr getOperand() {
				return operand;
			}
		}

		// Logical

		public static class LogicalNot extends AbstractItem implements UnaryOperator {
			private final Expr operand;

			private LogicalNot(Expr operand, Attribute[] attributes) {
				super(attributes);
				this.operand = operand;
			}

			@Override
			public Expr getOperand() {
				return operand;
			}
		}

		/**
		 * Separating conjunction when either operand holds resources, and ordinary
		 * conjunction otherwise.
		 */
		public static class LogicalAnd extends AbstractItem implements BinaryOperator {
			private final Expr lhs;
			private final Expr rhs;

			private LogicalAnd(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(attributes);
				this.lhs = lhs;
				this.rhs = rhs;
			}

			@Override
			public Expr getLeftHandSide() {
				return lhs;
			}

			@Override
			public Expr getRightHandSide() {
				return rhs;
			}
		}

		public static class LogicalOr extends AbstractItem implements BinaryOperator {
			private final Expr lhs;
			private final Expr rhs;

			private LogicalOr(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(attributes);
				this.lhs = lhs;
				this.rhs = rhs;
			}

			@Override
			public Expr getLeftHandSide() {
				return lhs;
			}

			@Override
			public Expr getRightHandSide() {
				return rhs;
			}
		}

		public static class Implies extends AbstractItem implements BinaryOperator {
			private final Expr lhs;
			private final Expr rhs;

			private Implies(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(attributes);
				this.lhs = lhs;
				this.rhs = rhs;
			}

			@Override
			public Expr getLeftHandSide() {
				return lhs;
			}

			@Override
			public Expr getRightHandSide() {
				return rhs;
			}
		}

		public static class Conditional extends AbstractItem implements Expr {
			private final Expr condition;
			private final Expr trueBranch;
			private final Expr falseBranch;

			private Conditional(Expr condition, Expr trueBranch, Expr falseBranch, Attribute[] attributes) {
				super(attributes);
				this.condition = condition;
				this.trueBranch = trueBranch;
				this.falseBranch = falseBranch;
			}

			public Expr getCondition() {
				return condition;
			}

			public Expr getTrueBranch() {
				return trueBranch;
			}

			public Expr getFalseBranch() {
				return falseBranch;
			}
		}

		public static class Let extends AbstractItem implements Expr {
			private final Decl.Parameter variable;
			private final Expr initialiser;
			private final Expr body;

			private Let(Decl.Parameter variable, Expr initialiser, Expr body, Attribute[] attributes) {
				super(attributes);
				this.variable = variable;
				this.initialiser = initialiser;
				this.body = body;
			}

			public Decl.Parameter getVariable() {
				return variable;
			}

			public Expr getInitialiser() {
				return initialiser;
			}

			public Expr getBody() {
				return body;
			}
		}

		// Quantifiers

		/**
		 * A set of expressions which together form a pattern used to instantiate
		 * a quantifier.
		 */
		public static class Trigger extends AbstractItem implements Item {
			private final List<Expr> expressions;

			private Trigger(Collection<Expr> expressions, Attribute[] attributes) {
				super(attributes);
				this.expressions = new ArrayList<>(expressions);
			}

			public List<Expr> getExpressions() {
				return expressions;
			}
		}

		public static class UniversalQuantifier extends AbstractItem implements Quantifier {
			private final List<Decl.Parameter> parameters;
			private final List<Trigger> triggers;
			private final Expr body;

			private UniversalQuantifier(Collection<Decl.Parameter> parameters, Collection<Trigger> triggers, Expr body,
					Attribute[] attributes) {
				super(attributes);
				this.parameters = new ArrayList<>(parameters);
				this.triggers = new ArrayList<>(triggers);
				this.body = body;
			}

			@Override
			public List<Decl.Parameter> getParameters() {
				return parameters;
			}

			public List<Trigger> getTriggers() {
				return triggers;
			}

			@Override
			public Expr getBody() {
				return body;
			}
		}

		public static class ExistentialQuantifier extends AbstractItem implements Quantifier {
			private final List<Decl.Parameter> parameters;
			private final Expr body;

			private ExistentialQuantifier(Collection<Decl.Parameter> parameters, Expr body, Attribute[] attributes) {
				super(attributes);
				this.parameters = new ArrayList<>(parameters);
				this.body = body;
			}

			@Override
			public List<Decl.Parameter> getParameters() {
				return parameters;
			}

			@Override
			public Expr getBody() {
				return body;
			}
		}

		// Ghost operations

		public static class Unfolding extends AbstractItem implements Expr {
			private final PredicateAccessPredicate predicate;
			private final Expr body;

			private Unfolding(PredicateAccessPredicate predicate, Expr body, Attribute[] attributes) {
				super(attributes);
				this.predicate = predicate;
				this.body = body;
			}

			public PredicateAccessPredicate getPredicate() {
				return predicate;
			}

			public Expr getBody() {
				return body;
			}
		}

		public static class Applying extends AbstractItem implements Expr {
			private final MagicWand wand;
			private final Expr body;

			private Applying(MagicWand wand, Expr body, Attribute[] attributes) {
				super(attributes);
				this.wand = wand;
				this.body = body;
			}

			public MagicWand getWand() {
				return wand;
			}

			public Expr getBody() {
				return body;
			}
		}

		/**
		 * An assertion <code>[A, B]</code> which behaves as <code>A</code> when
		 * inhaled and as <code>B</code> when exhaled.
		 */
		public static class InhaleExhale extends AbstractItem implements Expr {
			private final Expr inhale;
			private final Expr exhale;

			private InhaleExhale(Expr inhale, Expr exhale, Attribute[] attributes) {
				super(attributes);
				this.inhale = inhale;
				this.exhale = exhale;
			}

			public Expr getInhale() {
				return inhale;
			}

			public Expr getExhale() {
				return exhale;
			}
		}

		/**
		 * Application of a heap-dependent function.
		 */
		public static class Invoke extends AbstractItem implements Expr {
			private final String name;
			private final List<Expr> arguments;
			private final Type returns;

			private Invoke(String name, Collection<Expr> arguments, Type returns, Attribute[] attributes) {
				super(attributes);
				this.name = name;
				this.arguments = new ArrayList<>(arguments);
				this.returns = returns;
			}

			public String getName() {
				return name;
			}

			public List<Expr> getArguments() {
				return arguments;
			}

			public Type getReturns() {
				return returns;
			}
		}
	}

	// =========================================================================
	// Types
	// =========================================================================

	public interface Type extends Item {
		public static final Type Bool = new Bool();
		public static final Type Int = new Int();
		public static final Type Perm = new Perm();
		public static final Type Ref = new Ref();

		public static class Bool extends AbstractItem implements Type {
			public Bool(Attribute... attributes) {
				super(attributes);
			}
		}

		public static class Int extends AbstractItem  implements Type {
			public Int(Attribute... attributes) {
				super(attributes);
			}
		}

		public static class Perm extends AbstractItem  implements Type {
			public Perm(Attribute... attributes) {
				super(attributes);
			}
		}

		public static class Ref extends AbstractItem  implements Type {
			public Ref(Attribute... attributes) {
				super(attributes);
			}
		}
	}

	// =========================================================================
	// Attributes
	// =========================================================================

	public interface Attribute {
		/**
		 * Get the contents of this attribute as a given kind.  If that doesn't match, then return <code>null</code>.
		 * @param kind
		 * @param <T>
		 * @return
		 */
		public <T> T as(Class<T> kind);
	}

	/**
	 * A position within the original source file.
	 */
	public static class Position {
		private final int line;
		private final int column;

		public Position(int line, int column) {
			this.line = line;
			this.column = column;
		}

		public int getLine() {
			return line;
		}

		public int getColumn() {
			return column;
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Position && ((Position) o).line == line && ((Position) o).column == column;
		}

		@Override
		public int hashCode() {
			return line * 31 + column;
		}

		@Override
		public String toString() {
			return line + "." + column;
		}
	}

	// =======================================================
	// Constructor API (for convenience)
	// =======================================================

	public static Attribute ATTRIBUTE(Object o) {
		return new Attribute() {
			@Override
			public <T> T as(Class<T> kind) {
				if(kind.isInstance(o)) {
					return (T) o;
				} else {
					return null;
				}
			}
			@Override
			public String toString() {
				return "ATTR(" + o + ")";
			}
		};
	}

	public static Attribute POSITION(int line, int column) {
		return ATTRIBUTE(new Position(line, column));
	}

	// Literals
	public static Expr.Boolean CONST(boolean b, Attribute... attributes) {
		return new Expr.Boolean(b, attributes);
	}

	public static Expr.Integer CONST(int i, Attribute... attributes) {
		return new Expr.Integer(BigInteger.valueOf(i), attributes);
	}

	public static Expr.Integer CONST(BigInteger i, Attribute... attributes) {
		return new Expr.Integer(i, attributes);
	}

	public static Expr.Null NULL(Attribute... attributes) {
		return new Expr.Null(attributes);
	}

	public static Expr.FullPermission WRITE(Attribute... attributes) {
		return new Expr.FullPermission(attributes);
	}

	public static Expr.NoPermission NONE(Attribute... attributes) {
		return new Expr.NoPermission(attributes);
	}

	public static Expr.WildcardPermission WILDCARD(Attribute... attributes) {
		return new Expr.WildcardPermission(attributes);
	}

	public static Expr.FractionalPermission FRACTION(Expr numerator, Expr denominator, Attribute... attributes) {
		return new Expr.FractionalPermission(numerator, denominator, attributes);
	}

	public static Expr.FractionalPermission FRACTION(int numerator, int denominator, Attribute... attributes) {
		return new Expr.FractionalPermission(CONST(numerator), CONST(denominator), attributes);
	}

	// Variables
	public static Expr.VariableAccess VAR(String name, Type type, Attribute... attributes) {
		return new Expr.VariableAccess(name, type, attributes);
	}

	public static Expr.VariableAccess VAR(Decl.Parameter p, Attribute... attributes) {
		return new Expr.VariableAccess(p.getName(), p.getType(), attributes);
	}

	public static Expr.Result RESULT(Type type, Attribute... attributes) {
		return new Expr.Result(type, attributes);
	}

	// Locations and access predicates
	public static Expr.FieldAccess FIELD(Expr receiver, Decl.Field field, Attribute... attributes) {
		return new Expr.FieldAccess(receiver, field, attributes);
	}

	public static Expr.PredicateAccess PREDICATE(String name, List<Expr> arguments, Attribute... attributes) {
		return new Expr.PredicateAccess(name, arguments, attributes);
	}

	public static Expr.PredicateAccess PREDICATE(String name, Expr argument, Attribute... attributes) {
		return new Expr.PredicateAccess(name, Arrays.asList(argument), attributes);
	}

	public static Expr.FieldAccessPredicate ACC(Expr.FieldAccess location, Expr permission, Attribute... attributes) {
		return new Expr.FieldAccessPredicate(location, permission, attributes);
	}

	public static Expr.PredicateAccessPredicate ACC(Expr.PredicateAccess location, Expr permission, Attribute... attributes) {
		return new Expr.PredicateAccessPredicate(location, permission, attributes);
	}

	public static Expr.MagicWand WAND(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.MagicWand(lhs, rhs, attributes);
	}

	public static Expr.CurrentPermission PERM(Expr.Location location, Attribute... attributes) {
		return new Expr.CurrentPermission(location, attributes);
	}

	// Comparators
	public static Expr.Equals EQ(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Equals(lhs, rhs, attributes);
	}

	public static Expr.NotEquals NEQ(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.NotEquals(lhs, rhs, attributes);
	}

	public static Expr.LessThan LT(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.LessThan(lhs, rhs, attributes);
	}

	public static Expr.LessThanOrEqual LTEQ(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.LessThanOrEqual(lhs, rhs, attributes);
	}

	public static Expr.GreaterThan GT(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.GreaterThan(lhs, rhs, attributes);
	}

	public static Expr.GreaterThanOrEqual GTEQ(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.GreaterThanOrEqual(lhs, rhs, attributes);
	}

	// Arithmetic
	public static Expr.Addition ADD(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Addition(lhs, rhs, attributes);
	}

	public static Expr.Subtraction SUB(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Subtraction(lhs, rhs, attributes);
	}

	public static Expr.Multiplication MUL(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Multiplication(lhs, rhs, attributes);
	}

	public static Expr.Division DIV(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Division(lhs, rhs, attributes);
	}

	public static Expr.Remainder REM(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Remainder(lhs, rhs, attributes);
	}

	public static Expr.Negation NEG(Expr operand, Attribute... attributes) {
		return new Expr.Negation(operand, attributes);
	}

	// Logical
	public static Expr.LogicalNot NOT(Expr operand, Attribute... attributes) {
		return new Expr.LogicalNot(operand, attributes);
	}

	public static Expr.LogicalAnd AND(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.LogicalAnd(lhs, rhs, attributes);
	}

	/**
	 * Construct a right-nested conjunction of one or more operands.
	 *
	 * @param operands
	 * @return
	 */
	public static Expr AND(List<Expr> operands) {
		if (operands.isEmpty()) {
			return CONST(true);
		}
		Expr result = operands.get(operands.size() - 1);
		for (int i = operands.size() - 2; i >= 0; --i) {
			result = new Expr.LogicalAnd(operands.get(i), result, new Attribute[0]);
		}
		return result;
	}

	public static Expr.LogicalOr OR(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.LogicalOr(lhs, rhs, attributes);
	}

	public static Expr.Implies IMPLIES(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Implies(lhs, rhs, attributes);
	}

	public static Expr.Conditional ITE(Expr condition, Expr trueBranch, Expr falseBranch, Attribute... attributes) {
		return new Expr.Conditional(condition, trueBranch, falseBranch, attributes);
	}

	public static Expr.Let LET(Decl.Parameter variable, Expr initialiser, Expr body, Attribute... attributes) {
		return new Expr.Let(variable, initialiser, body, attributes);
	}

	// Quantifiers
	public static Expr.Trigger TRIGGER(Expr... expressions) {
		return new Expr.Trigger(Arrays.asList(expressions), new Attribute[0]);
	}

	public static Expr.UniversalQuantifier FORALL(Decl.Parameter parameter, Expr body, Attribute... attributes) {
		return new Expr.UniversalQuantifier(Arrays.asList(parameter), Collections.emptyList(), body, attributes);
	}

	public static Expr.UniversalQuantifier FORALL(List<Decl.Parameter> parameters, List<Expr.Trigger> triggers, Expr body,
			Attribute... attributes) {
		return new Expr.UniversalQuantifier(parameters, triggers, body, attributes);
	}

	public static Expr.ExistentialQuantifier EXISTS(Decl.Parameter parameter, Expr body, Attribute... attributes) {
		return new Expr.ExistentialQuantifier(Arrays.asList(parameter), body, attributes);
	}

	public static Expr.ExistentialQuantifier EXISTS(List<Decl.Parameter> parameters, Expr body, Attribute... attributes) {
		return new Expr.ExistentialQuantifier(parameters, body, attributes);
	}

	// Ghost operations
	public static Expr.Unfolding UNFOLDING(Expr.PredicateAccessPredicate predicate, Expr body, Attribute... attributes) {
		return new Expr.Unfolding(predicate, body, attributes);
	}

	public static Expr.Applying APPLYING(Expr.MagicWand wand, Expr body, Attribute... attributes) {
		return new Expr.Applying(wand, body, attributes);
	}

	public static Expr.InhaleExhale INHALE_EXHALE(Expr inhale, Expr exhale, Attribute... attributes) {
		return new Expr.InhaleExhale(inhale, exhale, attributes);
	}

	// Functions
	public static Expr.Invoke INVOKE(String name, List<Expr> arguments, Type returns, Attribute... attributes) {
		return new Expr.Invoke(name, arguments, returns, attributes);
	}

	public static Expr.Invoke INVOKE(String name, Expr argument, Type returns, Attribute... attributes) {
		return new Expr.Invoke(name, Arrays.asList(argument), returns, attributes);
	}
}
