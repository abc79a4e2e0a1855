package solclar.trans;

import org.junit.Test;
import solclar.parser.EmptySourceError;
import solclar.parser.ParsingError;
import solclar.parser.SyntaxError;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Map;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.junit.Assert.assertThat;

public class SolClarTranslatorTest {

	private static String translateOne(String source) throws ParsingError {
		Map<String, String> result = SolClarTranslator.translate(source);
		assertThat(result.size(), is(1));
		return result.values().iterator().next();
	}

	private static int occurrences(String haystack, String needle) {
		int count = 0;
		int from = haystack.indexOf(needle);
		while(from != -1) {
			++count;
			from = haystack.indexOf(needle, from + needle.length());
		}
		return count;
	}

	@Test
	public void counter() throws ParsingError {
		String out = translateOne("contract Counter {\n" +
				"  uint256 count;\n" +
				"  function increment() public { count = count + 1; }\n" +
				"}\n");
		assertThat(out, containsString("(define-data-var count uint u0)"));
		assertThat(out, containsString("(define-public (increment)\n  (ok (var-set count (+ (var-get count) u1))))"));
		assertThat(out, not(containsString("get-count")));
	}

	@Test
	public void constantsAreNotDataVariables() throws ParsingError {
		String out = translateOne("contract Limits { uint256 constant LIMIT = 100; }");
		assertThat(out, containsString("(define-constant LIMIT u100)"));
		assertThat(out, not(containsString("define-data-var")));
		assertThat(out, not(containsString("get-LIMIT")));
	}

	@Test
	public void publicMappingHasGetter() throws ParsingError {
		String out = translateOne("contract Bank { mapping(address => uint256) public balances; }");
		assertThat(out, containsString("(define-map balances principal uint)"));
		assertThat(out, containsString("(define-read-only (get-balances (key principal))"));
	}

	@Test
	public void nestedMappingIsDefinedOnce() throws ParsingError {
		String out = translateOne(
				"contract Nft { mapping(address => mapping(uint256 => bool)) public approvals; }");
		assertThat(occurrences(out, "(define-map approvals {owner: principal, token-id: uint} bool)"), is(1));
		assertThat(occurrences(out, "(define-map "), is(1));
	}

	@Test
	public void eventFields() throws ParsingError {
		String out = translateOne("contract Token {\n" +
				"  event Transfer(address indexed from, address indexed to, uint256 amount);\n" +
				"}");
		assertThat(out, containsString(";; @desc Event: Transfer\n"));
		assertThat(out, containsString(";; @fields (indexed) from: principal, (indexed) to: principal, amount: uint\n"));
	}

	@Test
	public void emptyPrivateFunction() throws ParsingError {
		String out = translateOne("contract Quiet { function f() private {} }");
		assertThat(out, containsString("(define-private (f)\n  (ok true))"));
	}

	@Test
	public void publicVariableGetsGetter() throws ParsingError {
		String out = translateOne("contract Owned { address public owner; constructor() { owner = msg.sender; } }");
		assertThat(out, containsString(";; @access public\n(define-data-var owner principal tx-sender)"));
		assertThat(out, containsString("(define-read-only (get-owner)\n  (ok (var-get owner)))"));
		assertThat(out, containsString("(define-public (init)\n  (ok (var-set owner tx-sender)))"));
	}

	@Test
	public void contractsKeepDeclarationOrder() throws ParsingError {
		Map<String, String> result = SolClarTranslator.translate(
				"contract Zeta {} contract Alpha {} contract Mid {}");
		assertThat(new ArrayList<>(result.keySet()), is(Arrays.asList("Zeta", "Alpha", "Mid")));
		assertThat(result.get("Alpha"), containsString(";; Contract: Alpha\n"));
	}

	@Test
	public void translationIsDeterministic() throws ParsingError {
		String source = "contract Token {\n" +
				"  mapping(address => uint256) balances;\n" +
				"  event Sent(address to, uint256 amount);\n" +
				"  function send(address to, uint256 amount) public {\n" +
				"    balances[to] = balances[to] + amount;\n" +
				"    emit Sent(to, amount);\n" +
				"  }\n" +
				"}";
		assertThat(SolClarTranslator.translate(source), is(SolClarTranslator.translate(source)));
	}

	@Test(expected = SyntaxError.class)
	public void syntaxErrorTranslatesNothing() throws ParsingError {
		SolClarTranslator.translate("contract Good {} contract Bad { uint256 x }");
	}

	@Test(expected = EmptySourceError.class)
	public void sourceWithoutContract() throws ParsingError {
		SolClarTranslator.translate("pragma solidity ^0.8.0;");
	}

	@Test
	public void stringReturnWithDataLocation() throws ParsingError {
		String out = translateOne("contract T { string name; " +
				"function getName() public view returns (string memory) { return name; } }");
		assertThat(out, containsString("(define-public (getName)\n  (ok (var-get name)))"));
	}
}
