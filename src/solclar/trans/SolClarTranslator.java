package solclar.trans;

import solclar.model.clarity.ClarityContract;
import solclar.model.solidity.SolidityContract;
import solclar.parser.ParseTrace;
import solclar.parser.ParsingError;
import solclar.parser.SolidityParser;
import solclar.trans.passes.codegen.clarity.ClarityCodeGenPass;
import solclar.trans.passes.conversion.ClarityConversionPass;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory translation of Solidity source text into Clarity source text: parse, then lower and render each
 * contract on its own.
 */
public final class SolClarTranslator {
	private SolClarTranslator() {}

	/**
	 * @return the generated Clarity text of every contract, keyed by contract name, in declaration order
	 * @throws ParsingError if the source does not parse; nothing is translated in that case
	 */
	public static Map<String, String> translate(Path file, CharSequence source, ParseTrace trace)
			throws ParsingError {
		List<SolidityContract> contracts = SolidityParser.readContracts(file, source, trace);
		Map<String, String> result = new LinkedHashMap<>();
		for(SolidityContract contract : contracts) {
			result.put(contract.getName(), translateContract(contract));
		}
		return result;
	}

	public static Map<String, String> translate(CharSequence source) throws ParsingError {
		return translate(null, source, ParseTrace.NONE);
	}

	public static String translateContract(SolidityContract contract) {
		ClarityContract lowered = ClarityConversionPass.perform(contract);
		return ClarityCodeGenPass.perform(lowered);
	}
}
