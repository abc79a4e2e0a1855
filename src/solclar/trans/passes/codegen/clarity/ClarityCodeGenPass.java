package solclar.trans.passes.codegen.clarity;

import solclar.Unreachable;
import solclar.formatters.ClarityContractFormatter;
import solclar.formatters.IndentingWriter;
import solclar.model.clarity.ClarityContract;

import java.io.IOException;
import java.io.StringWriter;

public class ClarityCodeGenPass {
	private ClarityCodeGenPass() {}

	public static String perform(ClarityContract contract) {
		StringWriter w = new StringWriter();
		IndentingWriter out = new IndentingWriter(w);
		try {
			new ClarityContractFormatter(out).format(contract);
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return w.toString();
	}
}
