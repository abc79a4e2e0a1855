package solclar;

import org.apache.commons.io.FileUtils;
import org.json.JSONException;
import org.json.JSONObject;
import org.plumelib.options.Option;
import org.plumelib.options.Options;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

public class SolClarOptions {
	public static final String VERSION = "0.1.0";
	public static final String DEFAULT_EXTENSION = ".clar";

	@Option("Print the version and exit")
	public boolean version = false;

	@Option("-h Print usage information")
	public boolean help = false;

	@Option("-q Reduce printing during execution")
	public boolean logLvlQuiet = false;

	/**
	 * Be verbose, print extra detailed information. Sets the log level to FINE, which includes parser tracing.
	 */
	@Option("-v Print detailed information during execution")
	public boolean logLvlVerbose = false;

	@Option("-o <file> Clarity file to write, when the source declares exactly one contract")
	public String outputFile;

	@Option("-d <dir> Directory receiving one Clarity file per contract")
	public String outputDir;

	@Option("-c <file> Path to the JSON configuration file, if any")
	public String configFilePath;

	public String inputFilePath;

	// resolved from the command line first, then from the configuration file
	public String buildDir;
	public String extension = DEFAULT_EXTENSION;

	private final Options plumeOptions;
	private final String[] args;

	public SolClarOptions(String[] args) {
		this.args = args;
		plumeOptions = new Options("solclar [options] source.sol", this);
	}

	public void printHelp() {
		plumeOptions.printUsage();
	}

	public boolean isInformational() {
		return version || help;
	}

	public void parse() throws SolClarOptionException {
		String[] remainingArgs;
		try {
			remainingArgs = plumeOptions.parse(args);
		} catch (Options.ArgException e) {
			throw new SolClarOptionException(e.getMessage());
		}

		if (isInformational()) {
			return;
		}

		if (remainingArgs.length != 1) {
			throw new SolClarOptionException(
					"Expected exactly one input file, found " + remainingArgs.length);
		}
		inputFilePath = remainingArgs[0];

		if (outputFile != null && outputDir != null) {
			throw new SolClarOptionException("-o and -d cannot be used together");
		}
		buildDir = outputDir;

		if (configFilePath == null || configFilePath.isEmpty()) {
			return;
		}

		String s;
		try {
			s = FileUtils.readFileToString(new File(configFilePath), StandardCharsets.UTF_8);
		} catch (IOException ex) {
			throw new SolClarOptionException("Error reading configuration file: " + ex.getMessage());
		}

		JSONObject config;
		try {
			config = new JSONObject(s);
		} catch (JSONException e) {
			throw new SolClarOptionException(configFilePath + ": parsing error: " + e.getMessage());
		}

		JSONObject build = config.optJSONObject("build");
		if (build == null) {
			return;
		}
		if (buildDir == null && outputFile == null) {
			buildDir = build.optString("output_dir", null);
		}
		extension = build.optString("extension", DEFAULT_EXTENSION);
		if (!extension.startsWith(".")) {
			throw new SolClarOptionException(
					configFilePath + ": build.extension must start with '.', found \"" + extension + "\"");
		}
	}
}
