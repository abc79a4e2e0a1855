package solclar.parser;

import org.junit.Test;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

public class SolidityParserTraceTest {

	@Test
	public void traceReceivesParserDecisions() throws ParsingError {
		List<String> messages = new ArrayList<>();
		SolidityParser.readContracts(
				Paths.get("Counter.sol"),
				"pragma solidity ^0.8.0;\ncontract Counter { uint256 count; function inc() public { count = count + 1; } }",
				messages::add);
		assertThat(messages, hasItem("contract Counter"));
		assertThat(messages, hasItem("state variable uint256 count"));
		assertThat(messages, hasItem("folded operator +"));
		assertThat(messages, hasItem("assignment to count"));
	}

	@Test
	public void errorLocationPointsAtOffendingToken() {
		try {
			SolidityParser.readContracts(Paths.get("Broken.sol"), "contract C {\n  uint256 x\n}\n", ParseTrace.NONE);
			fail("expected a syntax error");
		} catch (ParsingError e) {
			assertThat(e, instanceOf(SyntaxError.class));
			assertThat(e.getLocation().getStartLine(), is(3));
			assertThat(e.getLocation().getStartColumn(), is(1));
			assertThat(e.getLocation().getFile(), is(Paths.get("Broken.sol")));
			assertThat(e.getMessage(), containsString("expected ';' but found '}'"));
		}
	}

	@Test
	public void nestedMappingKeepsEveryLevel() throws ParsingError {
		List<solclar.model.solidity.SolidityContract> contracts = SolidityParser.readContracts(
				"contract N { mapping(address => mapping(address => mapping(uint256 => bool))) deep; }");
		solclar.model.solidity.SolidityStateVariable deep = contracts.get(0).getStateVariables().get(0);
		assertTrue(deep.isMapping());
		assertThat(deep.getMapping().getDepth(), is(3));
		assertThat(deep.getType(), is("mapping(address => mapping(address => mapping(uint256 => bool)))"));
		assertThat(deep.getMapping().getInnermost().getKeyType(), is("uint256"));
		assertThat(deep.getMapping().getInnermost().getValueType(), is("bool"));
	}
}
