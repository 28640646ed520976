package de.tu_berlin.coga.jlpp.parse;

/**
 * The sections of a problem text, cut at its keywords.
 */
public final class Sections {
	private final Segment objective;
	private final Segment constraints;
	private final Segment naturalConstraints;

	Sections(Segment objective, Segment constraints, Segment naturalConstraints) {
		this.objective = objective;
		this.constraints = constraints;
		this.naturalConstraints = naturalConstraints;
	}

	/**
	 * @return everything before the constraints keyword, direction keyword
	 *         included
	 */
	public Segment objective() {
		return objective;
	}

	/**
	 * @return the text between the constraints keyword and <code>with</code>
	 *         or <code>end</code>
	 */
	public Segment constraints() {
		return constraints;
	}

	/**
	 * @return the text between <code>with</code> and <code>end</code>, or
	 *         <code>null</code> if there is no <code>with</code>
	 */
	public Segment naturalConstraints() {
		return naturalConstraints;
	}

	public boolean hasNaturalConstraints() {
		return naturalConstraints != null;
	}
}
