package de.tu_berlin.coga.jlpp.parse;

import java.util.Collections;
import java.util.List;

import com.google.common.base.Function;
import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

/**
 * A decision variable of the problem: its lower case name and its column in
 * the canonical variable order.
 */
public final class Variable {
	private static final Function<Variable, String> NAME = new Function<Variable, String>() {
		@Override
		public String apply(Variable variable) {
			return variable.name;
		}
	};

	private final String name;
	private final int index;

	public Variable(String name, int index) {
		Preconditions.checkArgument(index >= 0, "negative index %s", index);
		this.name = Preconditions.checkNotNull(name);
		this.index = index;
	}

	public String name() {
		return name;
	}

	public int index() {
		return index;
	}

	/**
	 * Looks up a name in a canonical variable list.
	 *
	 * @param variables
	 *          variables sorted by name, as returned by
	 *          {@link VariableDiscovery}
	 * @return the column of the variable, or -1 if it is not in the list
	 */
	public static int indexOf(List<Variable> variables, String name) {
		int index = Collections.binarySearch(Lists.transform(variables, NAME), name);
		return index < 0 ? -1 : index;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof Variable)) {
			return false;
		}
		Variable other = (Variable) obj;
		return index == other.index && name.equals(other.name);
	}

	@Override
	public int hashCode() {
		return 31 * name.hashCode() + index;
	}

	@Override
	public String toString() {
		return name;
	}
}
