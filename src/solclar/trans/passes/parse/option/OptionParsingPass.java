package solclar.trans.passes.parse.option;

import solclar.SolClarOptionException;
import solclar.SolClarOptions;
import solclar.errors.IssueContext;

/**
 * Reads the command line and the configuration file it names. A failure is reported to the issue context; the
 * returned options are then only good for printing usage.
 */
public class OptionParsingPass {
	private OptionParsingPass() {}

	public static SolClarOptions perform(IssueContext ctx, String[] args) {
		SolClarOptions opts = new SolClarOptions(args);
		try {
			opts.parse();
		} catch (SolClarOptionException e) {
			ctx.error(new OptionParserIssue(e.getMessage()));
		}
		return opts;
	}
}
