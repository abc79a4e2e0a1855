package solclar.parser;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;
import solclar.model.solidity.SolidityContract;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;
import static solclar.model.solidity.SolidityBuilder.*;

@RunWith(Parameterized.class)
public class SolidityParserTest {

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
				{
						"contract Counter {\n" +
						"    uint256 count;\n" +
						"    function increment() public {\n" +
						"        count = count + 1;\n" +
						"    }\n" +
						"}\n",
						Collections.singletonList(contract(
								"Counter",
								vars(var("count", "uint256")),
								functions(function("increment", "public", body(
										assign("count", binop(id("count"), "+", num(1)))))),
								events(),
								null))
				},
				// operators fold left with one precedence level; parentheses still group
				{
						"contract Ops {\n" +
						"    function f() public view returns (uint256 result) {\n" +
						"        return a - b - c;\n" +
						"    }\n" +
						"    function g() pure private {\n" +
						"        a + b * c;\n" +
						"        a + (b * c);\n" +
						"    }\n" +
						"}\n",
						Collections.singletonList(contract(
								"Ops",
								vars(),
								functions(
										function("f", params(), "uint256", "public", "view", body(
												ret(binop(binop(id("a"), "-", id("b")), "-", id("c"))))),
										function("g", params(), null, "private", "pure", body(
												exprStmt(binop(binop(id("a"), "+", id("b")), "*", id("c"))),
												exprStmt(binop(id("a"), "+", binop(id("b"), "*", id("c"))))))),
								events(),
								null))
				},
				{
						"contract Registry {\n" +
						"    mapping(address => uint256) public balances;\n" +
						"    mapping(address => mapping(uint256 => bool)) approvals;\n" +
						"    event Transfer(address indexed from, address indexed to, uint256 amount);\n" +
						"    event Ping(uint256);\n" +
						"}\n",
						Collections.singletonList(contract(
								"Registry",
								vars(
										mappingVar("balances", "public", mapping("address", "uint256")),
										mappingVar("approvals", null,
												mapping("address", mapping("uint256", "bool")))),
								functions(),
								events(
										event("Transfer",
												eventParam("address", true, "from"),
												eventParam("address", true, "to"),
												eventParam("uint256", false, "amount")),
										event("Ping", eventParam("uint256", false, ""))),
								null))
				},
				{
						"// SPDX-License-Identifier: MIT\n" +
						"pragma solidity ^0.8.0;\n" +
						"contract Token {\n" +
						"    address owner;\n" +
						"    constructor(uint256 supply) payable public {\n" +
						"        owner = msg.sender;\n" +
						"        balances[msg.sender] = supply;\n" +
						"    }\n" +
						"    function approve(address spender, uint256 id) external {\n" +
						"        approvals[msg.sender][id] = true;\n" +
						"        emit Approval(msg.sender, spender);\n" +
						"        emit Done;\n" +
						"        return;\n" +
						"    }\n" +
						"}\n",
						Collections.singletonList(contract(
								"Token",
								vars(var("owner", "address")),
								functions(function(
										"approve",
										params(param("address", "spender"), param("uint256", "id")),
										null,
										"external",
										null,
										body(
												mapAssign("approvals",
														binop(member(id("msg"), "sender"), ",", id("id")),
														lit("true")),
												emit("Approval", member(id("msg"), "sender"), id("spender")),
												emit("Done")))),
								events(),
								constructor(
										params(param("uint256", "supply")),
										"public",
										body(
												assign("owner", member(id("msg"), "sender")),
												mapAssign("balances", member(id("msg"), "sender"), id("supply"))))))
				},
				{
						"contract A {\n" +
						"    uint256 constant LIMIT = 100;\n" +
						"    string name = \"abc\";\n" +
						"    bool private flag = false;\n" +
						"    function setName(string memory newName) private {\n" +
						"        name = newName;\n" +
						"        helper(1, x);\n" +
						"        return balances[owner];\n" +
						"    }\n" +
						"}\n" +
						"contract B {}\n",
						Arrays.asList(
								contract(
										"A",
										vars(
												constant("LIMIT", "uint256", num(100)),
												var("name", "string", null, lit("\"abc\"")),
												var("flag", "bool", "private", lit("false"))),
										functions(function(
												"setName",
												params(param("string", "newName")),
												null,
												"private",
												null,
												body(
														assign("name", id("newName")),
														exprStmt(call("helper", num(1), id("x"))),
														ret(index("balances", id("owner")))))),
										events(),
										null),
								contract("B"))
				},
				// a data location after a return type is skipped like one after a parameter type
				{
						"contract Named {\n" +
						"    string name;\n" +
						"    function getName() public view returns (string memory) {\n" +
						"        return name;\n" +
						"    }\n" +
						"    function label() external view returns (string memory s) {\n" +
						"        return name;\n" +
						"    }\n" +
						"}\n",
						Collections.singletonList(contract(
								"Named",
								vars(var("name", "string")),
								functions(
										function("getName", params(), "string", "public", "view", body(
												ret(id("name")))),
										function("label", params(), "string", "external", "view", body(
												ret(id("name"))))),
								events(),
								null))
				},
		});
	}

	private final String source;
	private final List<SolidityContract> expected;

	public SolidityParserTest(String source, List<SolidityContract> expected) {
		this.source = source;
		this.expected = expected;
	}

	@Test
	public void test() throws ParsingError {
		assertThat(SolidityParser.readContracts(source), is(expected));
	}
}
