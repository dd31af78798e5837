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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import wyheap.core.Logic.Term;

/**
 * A record of some owned resource within the symbolic heap. Permission amounts
 * are never negative.
 *
 * @author David J. Pearce
 *
 */
public interface Chunk {

	/**
	 * Distinguishes the kind of resource held in a chunk.
	 */
	public enum Kind {
		FIELD, PREDICATE, WAND
	}

	public Kind getKind();

	/**
	 * Get the name of the resource held in this chunk. For wands, this is the
	 * wand's abstract identity.
	 *
	 * @return
	 */
	public String getName();

	public Term getPermission();

	/**
	 * A chunk describing exactly one resource instance, such as the field
	 * location <code>x.f</code> or the predicate instance <code>P(x)</code>.
	 * Two such chunks have the same identity when they have the same kind, name
	 * and (syntactically) the same arguments.
	 */
	public static abstract class NonQuantified implements Chunk {
		private final Kind kind;
		private final String name;
		private final List<Term> arguments;
		private final Term snapshot;
		private final Term permission;

		public NonQuantified(Kind kind, String name, List<Term> arguments, Term snapshot, Term permission) {
			this.kind = kind;
			this.name = name;
			this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
			this.snapshot = snapshot;
			this.permission = permission;
		}

		@Override
		public Kind getKind() {
			return kind;
		}

		@Override
		public String getName() {
			return name;
		}

		public List<Term> getArguments() {
			return arguments;
		}

		public Term getSnapshot() {
			return snapshot;
		}

		@Override
		public Term getPermission() {
			return permission;
		}

		public boolean hasSameIdentity(NonQuantified other) {
			return kind == other.kind && name.equals(other.name) && arguments.equals(other.arguments);
		}

		public abstract NonQuantified withPermission(Term permission);

		@Override
		public boolean equals(Object o) {
			if (o != null && o.getClass() == getClass()) {
				NonQuantified c = (NonQuantified) o;
				return hasSameIdentity(c) && snapshot.equals(c.snapshot) && permission.equals(c.permission);
			}
			return false;
		}

		@Override
		public int hashCode() {
			return Objects.hash(kind, name, arguments, snapshot, permission);
		}

		@Override
		public String toString() {
			return name + arguments + " # " + snapshot + " # " + permission;
		}
	}

	/**
	 * A chunk for a single field location or predicate instance.
	 */
	public static class Basic extends NonQuantified {
		public Basic(Kind kind, String name, List<Term> arguments, Term snapshot, Term permission) {
			super(kind, name, arguments, snapshot, permission);
			if (kind == Kind.WAND) {
				throw new IllegalArgumentException("invalid chunk kind");
			}
		}

		@Override
		public Basic withPermission(Term permission) {
			return new Basic(getKind(), getName(), getArguments(), getSnapshot(), permission);
		}
	}

	/**
	 * A chunk for a single magic wand instance. The arguments are the values of
	 * the wand's abstracted subexpressions.
	 */
	public static class MagicWand extends NonQuantified {
		public MagicWand(String identity, List<Term> arguments, Term snapshot, Term permission) {
			super(Kind.WAND, identity, arguments, snapshot, permission);
		}

		@Override
		public MagicWand withPermission(Term permission) {
			return new MagicWand(getName(), getArguments(), getSnapshot(), permission);
		}
	}

	/**
	 * A chunk describing a (potentially unbounded) family of resources. Each
	 * member is identified by an instantiation of the formal variables, whilst
	 * the permission held to it is given by the permission term over those
	 * variables, and its value by applying the snapshot map.
	 */
	public static class Quantified implements Chunk {
		private final Kind kind;
		private final String name;
		private final List<Term.Var> formals;
		private final Term snapshotMap;
		private final Term condition;
		private final Term permission;
		/**
		 * The arguments of the only resource in this chunk, or <code>null</code>
		 * if this chunk does not describe a singleton.
		 */
		private final List<Term> singletonArguments;

		public Quantified(Kind kind, String name, List<Term.Var> formals, Term snapshotMap, Term condition,
				Term permission, List<Term> singletonArguments) {
			this.kind = kind;
			this.name = name;
			this.formals = Collections.unmodifiableList(new ArrayList<>(formals));
			this.snapshotMap = snapshotMap;
			this.condition = condition;
			this.permission = permission;
			this.singletonArguments = singletonArguments;
		}

		@Override
		public Kind getKind() {
			return kind;
		}

		@Override
		public String getName() {
			return name;
		}

		public List<Term.Var> getFormals() {
			return formals;
		}

		public Term getSnapshotMap() {
			return snapshotMap;
		}

		public Term getCondition() {
			return condition;
		}

		@Override
		public Term getPermission() {
			return permission;
		}

		public List<Term> getSingletonArguments() {
			return singletonArguments;
		}

		public boolean isSingleton() {
			return singletonArguments != null;
		}

		@Override
		public String toString() {
			return "QA " + formals + " :: " + name + " -> " + snapshotMap + " # " + permission;
		}
	}
}
