package solclar;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;
import solclar.errors.Issue;
import solclar.errors.TopLevelIssueContext;
import solclar.model.solidity.SolidityContract;
import solclar.trans.SolClarTransException;
import solclar.trans.SolClarTranslator;
import solclar.trans.intermediate.IOErrorIssue;
import solclar.trans.intermediate.WhileReadingFile;
import solclar.trans.intermediate.WhileWritingContract;
import solclar.trans.passes.parse.option.OptionParserIssue;
import solclar.trans.passes.parse.option.OptionParsingPass;
import solclar.trans.passes.parse.solidity.LoggerParseTrace;
import solclar.trans.passes.parse.solidity.SolidityParsingPass;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;

public class SolClarMain {
	private final String[] cmdArgs;
	private static final Logger logger = Logger.getLogger("SolClarMain");

	static {
		// the default console handler stops at INFO, which would hide -v output
		ConsoleHandler handler = new ConsoleHandler();
		handler.setLevel(Level.ALL);
		logger.addHandler(handler);
		logger.setUseParentHandlers(false);
	}

	public SolClarMain(String[] args) {
		cmdArgs = args;
	}

	public static void main(String[] args) {
		if (new SolClarMain(args).run()) {
			logger.info("Finished");
		} else {
			logger.info("Terminated with errors");
			System.exit(1);
		}
	}

	// Top-level workhorse method.
	public boolean run() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();

		// Check options, set up logging.
		SolClarOptions opts = OptionParsingPass.perform(ctx, cmdArgs);
		logger.setLevel(logLevel(opts));
		if (ctx.hasErrors()) {
			System.err.println(ctx.format());
			opts.printHelp();
			return false;
		}
		if (opts.version) {
			System.out.println("solclar version " + SolClarOptions.VERSION);
			return true;
		}
		if (opts.help) {
			opts.printHelp();
			return true;
		}

		try {
			Path inputFilePath = Paths.get(opts.inputFilePath);

			logger.info("Opening source file");
			String source = readSource(ctx, inputFilePath);
			checkErrors(ctx);

			logger.info("Parsing Solidity source");
			List<SolidityContract> contracts = parse(ctx, inputFilePath, source);
			checkErrors(ctx);
			logger.info("Found " + contracts.size() + " contract(s)");

			Map<String, Path> destinations = resolveDestinations(ctx, opts, inputFilePath, contracts);
			checkErrors(ctx);

			for (SolidityContract contract : contracts) {
				logger.info("Translating contract " + contract.getName());
				String clarity = SolClarTranslator.translateContract(contract);

				Path destination = destinations.get(contract.getName());
				logger.info("Writing contract " + contract.getName() + " to \"" + destination + "\"");
				try {
					FileUtils.writeStringToFile(destination.toFile(), clarity, StandardCharsets.UTF_8);
				} catch (IOException e) {
					ctx.withContext(new WhileWritingContract(contract.getName(), destination))
							.error(new IOErrorIssue(e));
				}
			}
			checkErrors(ctx);
		} catch (SolClarTransException e) {
			logger.severe("found issues");
			System.err.println(e.getMessage());
			return false;
		}

		return true;
	}

	// -q wins over -v; parser tracing is logged at FINE
	static Level logLevel(SolClarOptions opts) {
		if (opts.logLvlQuiet) {
			return Level.WARNING;
		}
		return opts.logLvlVerbose ? Level.FINE : Level.INFO;
	}

	private static String readSource(TopLevelIssueContext ctx, Path inputFilePath) {
		try {
			return FileUtils.readFileToString(inputFilePath.toFile(), StandardCharsets.UTF_8);
		} catch (IOException e) {
			ctx.withContext(new WhileReadingFile(inputFilePath)).error(new IOErrorIssue(e));
			return null;
		}
	}

	private static List<SolidityContract> parse(TopLevelIssueContext ctx, Path inputFilePath, String source) {
		try {
			return SolidityParsingPass.perform(inputFilePath, source, new LoggerParseTrace(logger));
		} catch (Issue issue) {
			ctx.withContext(new WhileReadingFile(inputFilePath)).error(issue);
			return null;
		}
	}

	/**
	 * One contract goes to the -o file, or next to the source with the extension swapped. Several contracts, or
	 * an explicit output directory, give one file per contract named after the lower-cased contract name.
	 */
	static Map<String, Path> resolveDestinations(TopLevelIssueContext ctx, SolClarOptions opts, Path inputFilePath,
	                                             List<SolidityContract> contracts) {
		Map<String, Path> destinations = new LinkedHashMap<>();
		if (opts.outputFile != null) {
			if (contracts.size() != 1) {
				ctx.error(new OptionParserIssue("-o requires a source declaring exactly one contract, found " +
						contracts.size()));
			} else {
				destinations.put(contracts.get(0).getName(), Paths.get(opts.outputFile));
			}
			return destinations;
		}
		if (opts.buildDir == null && contracts.size() == 1) {
			destinations.put(contracts.get(0).getName(),
					Paths.get(FilenameUtils.removeExtension(inputFilePath.toString()) + opts.extension));
			return destinations;
		}
		Path dir = opts.buildDir != null ?
				Paths.get(opts.buildDir) : inputFilePath.toAbsolutePath().getParent();
		if (opts.buildDir == null) {
			logger.warning("Source declares " + contracts.size() + " contracts, writing them to " + dir);
		}
		for (SolidityContract contract : contracts) {
			destinations.put(contract.getName(),
					dir.resolve(contract.getName().toLowerCase(Locale.ROOT) + opts.extension));
		}
		return destinations;
	}

	private static void checkErrors(TopLevelIssueContext ctx) throws SolClarTransException {
		if (ctx.hasErrors()) {
			throw new SolClarTransException(ctx.format());
		}
	}
}
