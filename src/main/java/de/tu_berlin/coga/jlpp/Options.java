package de.tu_berlin.coga.jlpp;

/**
 * Command line options of {@link App}.
 */
public final class Options {

	static final String USAGE = "Usage: jlpp -i <inputFile> [options]\n"
			+ "\n"
			+ "Options:\n"
			+ "    -i, --input  <inputFile>  : define input file name (mutually exclusive with -l)\n"
			+ "    -l, --load   <inputFile>  : define input JSON file name to load\n"
			+ "    -j, --json                : export problem in JSON format\n"
			+ "    -o, --output <outputFile> : define output file name\n"
			+ "                                (Default: '(LP-2) <inputFile>')\n"
			+ "    -p, --print               : just print the output in the console\n"
			+ "    -d, --dual                : convert the problem from primal to dual form\n"
			+ "    -h, --help                : show this help\n";

	String inputFile;
	String outputFile;
	boolean loadJson;
	boolean exportJson;
	boolean print;
	boolean dual;
	boolean help;

	private Options() {
	}

	/**
	 * @throws IllegalArgumentException
	 *           for unknown options, missing values or a missing input file
	 */
	public static Options parse(String[] args) {
		Options options = new Options();
		for (int i = 0; i < args.length; i++) {
			String a = args[i];
			switch (a) {
			case "-h":
			case "--help":
				options.help = true;
				break;
			case "-i":
			case "--input":
				options.setInput(value(args, ++i, a), false);
				break;
			case "-l":
			case "--load":
				options.setInput(value(args, ++i, a), true);
				break;
			case "-o":
			case "--output":
				options.outputFile = value(args, ++i, a);
				break;
			case "-j":
			case "--json":
				options.exportJson = true;
				break;
			case "-p":
			case "--print":
				options.print = true;
				break;
			case "-d":
			case "--dual":
				options.dual = true;
				break;
			default:
				throw new IllegalArgumentException("Unknown option: " + a);
			}
		}
		if (!options.help && options.inputFile == null) {
			throw new IllegalArgumentException("Missing input file");
		}
		return options;
	}

	private void setInput(String file, boolean json) {
		if (inputFile != null) {
			throw new IllegalArgumentException("Multiple inputs: " + file);
		}
		inputFile = file;
		loadJson = json;
	}

	private static String value(String[] args, int i, String option) {
		if (i >= args.length || args[i].startsWith("-")) {
			throw new IllegalArgumentException("Option " + option + " needs a file name");
		}
		return args[i];
	}

	public String getInputFile() {
		return inputFile;
	}

	/**
	 * @return the output file given with <code>-o</code>, <code>null</code>
	 *         for the default name
	 */
	public String getOutputFile() {
		return outputFile;
	}

	public boolean isLoadJson() {
		return loadJson;
	}

	public boolean isExportJson() {
		return exportJson;
	}

	public boolean isPrint() {
		return print;
	}

	public boolean isDual() {
		return dual;
	}

	public boolean isHelp() {
		return help;
	}
}
