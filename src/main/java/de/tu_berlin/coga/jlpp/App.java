package de.tu_berlin.coga.jlpp;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.tu_berlin.coga.jlpp.exceptions.LPParseException;

/**
 * Program entry point
 *
 */
public class App {
	private static final Logger LOGGER = LoggerFactory.getLogger(App.class);

	static final int EXIT_OK = 0;
	static final int EXIT_USAGE = 1;
	static final int EXIT_FAILURE = 2;

	static final String OUTPUT_PREFIX = "(LP-2) ";

	/**
	 * Parses the problem given on the command line and writes it in matrix
	 * form.
	 *
	 * @param args
	 *          see {@link Options}
	 */
	public static void main(String[] args) {
		System.exit(run(args, System.out));
	}

	static int run(String[] args, PrintStream out) {
		Options options;
		try {
			options = Options.parse(args);
		} catch (IllegalArgumentException e) {
			LOGGER.error(e.getMessage());
			out.print(Options.USAGE);
			return EXIT_USAGE;
		}
		if (options.isHelp()) {
			out.print(Options.USAGE);
			return EXIT_OK;
		}

		try {
			LinearProblem problem = read(options);
			if (options.isDual()) {
				problem = DualConverter.toDual(problem);
			}

			LPJsonCodec codec = new LPJsonCodec();
			if (options.isPrint()) {
				if (options.isExportJson()) {
					out.println(codec.toJson(problem));
				} else {
					out.print(LPWriter.format(problem));
				}
			} else {
				Path output = outputPath(options);
				if (options.isExportJson()) {
					codec.write(problem, output);
				} else {
					LOGGER.warn("this output is not meant for parsing, use --json for JSON format instead");
					LPWriter.write(problem, output);
				}
				LOGGER.info("wrote {}", output);
			}
			return EXIT_OK;
		} catch (LPParseException e) {
			LOGGER.error("{}: {}", options.getInputFile(), e.getMessage());
			return EXIT_FAILURE;
		} catch (IOException e) {
			LOGGER.error("I/O error: {}", e.toString());
			return EXIT_FAILURE;
		}
	}

	private static LinearProblem read(Options options) throws LPParseException, IOException {
		if (options.isLoadJson()) {
			return new LPJsonCodec().read(Paths.get(options.getInputFile()));
		}
		return new LPReader(options.getInputFile()).readLP();
	}

	/**
	 * @return the <code>-o</code> file, or the input file name prefixed with
	 *         <code>(LP-2) </code> in the input's directory
	 */
	static Path outputPath(Options options) {
		if (options.getOutputFile() != null) {
			return Paths.get(options.getOutputFile());
		}
		Path input = Paths.get(options.getInputFile());
		String name = OUTPUT_PREFIX + input.getFileName() + (options.isExportJson() ? ".json" : "");
		return input.resolveSibling(name);
	}
}
