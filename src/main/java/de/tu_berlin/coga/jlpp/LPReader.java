package de.tu_berlin.coga.jlpp;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.io.CharStreams;

import de.tu_berlin.coga.jlpp.exceptions.LPParseException;
import de.tu_berlin.coga.jlpp.parse.ConstraintExtractor;
import de.tu_berlin.coga.jlpp.parse.Constraints;
import de.tu_berlin.coga.jlpp.parse.Diagnostic;
import de.tu_berlin.coga.jlpp.parse.NaturalConstraintExtractor;
import de.tu_berlin.coga.jlpp.parse.NaturalConstraints;
import de.tu_berlin.coga.jlpp.parse.Objective;
import de.tu_berlin.coga.jlpp.parse.ObjectiveExtractor;
import de.tu_berlin.coga.jlpp.parse.SectionSplitter;
import de.tu_berlin.coga.jlpp.parse.Sections;
import de.tu_berlin.coga.jlpp.parse.Segment;
import de.tu_berlin.coga.jlpp.parse.SourceText;
import de.tu_berlin.coga.jlpp.parse.Variable;
import de.tu_berlin.coga.jlpp.parse.VariableDiscovery;

/**
 * A class to read linear problems written in the form
 *
 * <pre>
 * max 2x1 + 3x2
 * s.t.
 * x1 + x2 &lt;= 4
 * x1 - x2 &gt;= 1
 * with
 * x2 free
 * end
 * </pre>
 *
 * Initialise with a file name, or use {@link #fromText(String)}, and invoke
 * {@link #readLP()}. Variables are named <code>x</code> followed by a
 * number; their columns follow the sorted order of the names. Without a
 * <code>with</code> section all variables are non-negative.
 * <p>
 * Reading either yields a complete {@link LinearProblem} or fails with an
 * {@link LPParseException}; the variables and diagnostics of this reader are
 * only filled in after a successful read.
 */
public class LPReader {
	private static final Logger LOGGER = LoggerFactory.getLogger(LPReader.class);

	/**
	 * Steps of reading a problem.
	 */
	public static enum Status {
		START, DIRECTION_FOUND, OBJECTIVE_PARSED, CONSTRAINTS_PARSED, NATURAL_CONSTRAINTS_PARSED, DONE, FAILED
	}

	private final String filename;
	private final String text;

	private Status status;
	private ImmutableList<Variable> variables;
	private ImmutableList<Diagnostic> diagnostics;
	private LinearProblem problem;

	/**
	 * Initialises the parser.
	 *
	 * @param fname
	 *          file name to read from
	 */
	public LPReader(String fname) {
		this(fname, null);
	}

	private LPReader(String fname, String text) {
		this.filename = fname;
		this.text = text;
		this.status = Status.START;
		this.variables = ImmutableList.of();
		this.diagnostics = ImmutableList.of();
	}

	/**
	 * Initialises a parser for a problem held in memory.
	 */
	public static LPReader fromText(String text) {
		return new LPReader(null, text);
	}

	/**
	 * Reads the problem from the file or text with which the parser was
	 * initialised.
	 *
	 * @throws LPParseException
	 *           if the text is not a valid linear problem
	 * @throws IOException
	 *           if the file cannot be read
	 */
	public LinearProblem readLP() throws LPParseException, IOException {
		String input = text;
		if (input == null) {
			LOGGER.debug("reading {}", filename);
			Reader in = Files.newBufferedReader(Paths.get(filename), StandardCharsets.UTF_8);
			try {
				input = CharStreams.toString(in);
			} finally {
				in.close();
			}
		}

		status = Status.START;
		try {
			return parse(new SourceText(input));
		} catch (LPParseException e) {
			LOGGER.debug("reading failed in status {}", status);
			status = Status.FAILED;
			throw e;
		}
	}

	private LinearProblem parse(SourceText source) throws LPParseException {
		Sections sections = SectionSplitter.split(source);

		int direction = ObjectiveExtractor.direction(sections.objective());
		Segment objectiveExpression = ObjectiveExtractor.expression(sections.objective());
		switchTo(Status.DIRECTION_FOUND);

		List<Segment> constraintLines = sections.constraints().lines();
		ImmutableList<Variable> vars = VariableDiscovery.discover(objectiveExpression, constraintLines);
		if (vars.isEmpty()) {
			throw LPParseException.noVariables();
		}

		Objective objective = ObjectiveExtractor.extract(sections.objective(), vars);
		switchTo(Status.OBJECTIVE_PARSED);

		Constraints constraints = ConstraintExtractor.extract(constraintLines, vars);
		switchTo(Status.CONSTRAINTS_PARSED);

		NaturalConstraints naturalConstraints = NaturalConstraintExtractor.extract(sections.naturalConstraints(), vars);
		if (sections.hasNaturalConstraints()) {
			switchTo(Status.NATURAL_CONSTRAINTS_PARSED);
		}

		String[] names = new String[vars.size()];
		for (Variable variable : vars) {
			names[variable.index()] = variable.name();
		}
		LinearProblem result = new LinearProblem(direction, objective.coefficients(), constraints.a(),
				constraints.eqin(), constraints.b(), naturalConstraints.natures(), names);

		variables = vars;
		diagnostics = naturalConstraints.diagnostics();
		problem = result;
		switchTo(Status.DONE);
		LOGGER.debug("{} constraints, {} variables", result.getNumConstraints(), result.getNumVariables());
		return result;
	}

	private void switchTo(Status next) {
		LOGGER.debug("switching to status {}", next);
		status = next;
	}

	public Status status() {
		return status;
	}

	/**
	 * @return the problem read, <code>null</code> before a successful read
	 */
	public LinearProblem problem() {
		return problem;
	}

	/**
	 * Tells the variables in canonical order.
	 *
	 * @return the variables of the linear program read
	 */
	public List<Variable> variables() {
		return variables;
	}

	/**
	 * Tells the problems that were found but did not stop reading, such as
	 * natural constraints of unknown variables.
	 */
	public List<Diagnostic> diagnostics() {
		return diagnostics;
	}

	/**
	 * Tells the number of variables.
	 *
	 * @return the number of variables of the linear program read
	 */
	public int noOfVariables() {
		return variables.size();
	}

	/**
	 * Tells the number of constraints.
	 *
	 * @return the number of constraints of the linear program read
	 */
	public int noOfConstraints() {
		return problem == null ? 0 : problem.getNumConstraints();
	}

	/**
	 * Tells the names of the variables.
	 *
	 * @return the name of variable <code>j</code>
	 */
	public String variableName(int j) {
		return variables.get(j).name();
	}
}
