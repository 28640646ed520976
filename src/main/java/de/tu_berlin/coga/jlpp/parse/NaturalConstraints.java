package de.tu_berlin.coga.jlpp.parse;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Sign restrictions of the variables together with the declarations that
 * were ignored on the way.
 */
public final class NaturalConstraints {
	private final int[] natures;
	private final ImmutableList<Diagnostic> diagnostics;

	NaturalConstraints(int[] natures, List<Diagnostic> diagnostics) {
		this.natures = natures;
		this.diagnostics = ImmutableList.copyOf(diagnostics);
	}

	/**
	 * @return per variable -1 for <code>x &lt;= 0</code>, 0 for free, 1 for
	 *         <code>x &gt;= 0</code>
	 */
	public int[] natures() {
		return natures.clone();
	}

	public ImmutableList<Diagnostic> diagnostics() {
		return diagnostics;
	}
}
