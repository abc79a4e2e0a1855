package solclar;

import org.apache.commons.io.FileUtils;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.logging.Level;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

public class SolClarMainTest {

	private static final String COUNTER = "contract Counter {\n" +
			"  uint256 public count;\n" +
			"  function increment() public { count = count + 1; }\n" +
			"}\n";

	private static final String PAIR = "contract A { bool flag; }\ncontract B { uint256 n; }\n";

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private File source(String name, String text) throws IOException {
		File file = folder.newFile(name);
		FileUtils.writeStringToFile(file, text, StandardCharsets.UTF_8);
		return file;
	}

	private static String read(File file) throws IOException {
		return FileUtils.readFileToString(file, StandardCharsets.UTF_8);
	}

	private static boolean run(String... args) {
		return new SolClarMain(args).run();
	}

	@Test
	public void singleContractNextToSource() throws IOException {
		File sol = source("Counter.sol", COUNTER);
		assertTrue(run("-q", sol.getPath()));
		File clar = new File(folder.getRoot(), "Counter.clar");
		assertTrue(clar.isFile());
		assertThat(read(clar), containsString(";; Contract: Counter\n"));
		assertThat(read(clar), containsString("(define-read-only (get-count)"));
	}

	@Test
	public void severalContractsNextToSource() throws IOException {
		File sol = source("pair.sol", PAIR);
		assertTrue(run("-q", sol.getPath()));
		assertThat(read(new File(folder.getRoot(), "a.clar")), containsString("(define-data-var flag bool false)"));
		assertThat(read(new File(folder.getRoot(), "b.clar")), containsString("(define-data-var n uint u0)"));
	}

	@Test
	public void explicitOutputFile() throws IOException {
		File sol = source("Counter.sol", COUNTER);
		File out = new File(folder.getRoot(), "custom.clar");
		assertTrue(run("-q", "-o", out.getPath(), sol.getPath()));
		assertThat(read(out), containsString(";; Contract: Counter\n"));
		assertFalse(new File(folder.getRoot(), "Counter.clar").exists());
	}

	@Test
	public void outputFileRejectsSeveralContracts() throws IOException {
		File sol = source("pair.sol", PAIR);
		File out = new File(folder.getRoot(), "out.clar");
		assertFalse(run("-q", "-o", out.getPath(), sol.getPath()));
		assertFalse(out.exists());
	}

	@Test
	public void outputDirectory() throws IOException {
		File sol = source("Counter.sol", COUNTER);
		File dir = new File(folder.getRoot(), "build");
		assertTrue(run("-q", "-d", dir.getPath(), sol.getPath()));
		assertTrue(new File(dir, "counter.clar").isFile());
	}

	@Test
	public void configurationFile() throws IOException {
		File sol = source("pair.sol", PAIR);
		File dir = new File(folder.getRoot(), "gen");
		File config = source("solclar.json",
				"{\"build\": {\"output_dir\": \"" + dir.getPath().replace("\\", "\\\\") + "\", \"extension\": \".txt\"}}");
		assertTrue(run("-q", "-c", config.getPath(), sol.getPath()));
		assertTrue(new File(dir, "a.txt").isFile());
		assertTrue(new File(dir, "b.txt").isFile());
	}

	@Test
	public void commandLineDirectoryWinsOverConfiguration() throws IOException {
		File sol = source("Counter.sol", COUNTER);
		File cliDir = new File(folder.getRoot(), "cli");
		File configDir = new File(folder.getRoot(), "config");
		File config = source("solclar.json",
				"{\"build\": {\"output_dir\": \"" + configDir.getPath().replace("\\", "\\\\") + "\"}}");
		assertTrue(run("-q", "-c", config.getPath(), "-d", cliDir.getPath(), sol.getPath()));
		assertTrue(new File(cliDir, "counter.clar").isFile());
		assertFalse(configDir.exists());
	}

	@Test
	public void badExtensionInConfiguration() throws IOException {
		File sol = source("Counter.sol", COUNTER);
		File config = source("solclar.json", "{\"build\": {\"extension\": \"clar\"}}");
		assertFalse(run("-q", "-c", config.getPath(), sol.getPath()));
	}

	@Test
	public void malformedConfiguration() throws IOException {
		File sol = source("Counter.sol", COUNTER);
		File config = source("solclar.json", "{build");
		assertFalse(run("-q", "-c", config.getPath(), sol.getPath()));
	}

	@Test
	public void parseErrorWritesNothing() throws IOException {
		File sol = source("Broken.sol", "contract Broken { uint256 x }");
		assertFalse(run("-q", sol.getPath()));
		assertFalse(new File(folder.getRoot(), "Broken.clar").exists());
	}

	@Test
	public void missingSourceFile() {
		assertFalse(run("-q", new File(folder.getRoot(), "absent.sol").getPath()));
	}

	@Test
	public void noArguments() {
		assertFalse(run());
	}

	@Test
	public void outputFileAndDirectoryTogether() throws IOException {
		File sol = source("Counter.sol", COUNTER);
		assertFalse(run("-q", "-o", "x.clar", "-d", folder.getRoot().getPath(), sol.getPath()));
	}

	@Test
	public void unknownOption() throws IOException {
		File sol = source("Counter.sol", COUNTER);
		assertFalse(run("--no-such-option", sol.getPath()));
	}

	@Test
	public void versionNeedsNoInput() {
		assertTrue(run("--version"));
	}

	@Test
	public void optionsResolveDefaults() throws SolClarOptionException {
		SolClarOptions opts = new SolClarOptions(new String[] {"in.sol"});
		opts.parse();
		assertThat(opts.inputFilePath, is("in.sol"));
		assertThat(opts.extension, is(SolClarOptions.DEFAULT_EXTENSION));
		assertFalse(opts.isInformational());
	}

	@Test
	public void logLevelFollowsFlags() throws SolClarOptionException {
		assertThat(SolClarMain.logLevel(parsed("in.sol")), is(Level.INFO));
		assertThat(SolClarMain.logLevel(parsed("-v", "in.sol")), is(Level.FINE));
		assertThat(SolClarMain.logLevel(parsed("-q", "in.sol")), is(Level.WARNING));
		assertThat(SolClarMain.logLevel(parsed("-q", "-v", "in.sol")), is(Level.WARNING));
	}

	private static SolClarOptions parsed(String... args) throws SolClarOptionException {
		SolClarOptions opts = new SolClarOptions(args);
		opts.parse();
		return opts;
	}
}
