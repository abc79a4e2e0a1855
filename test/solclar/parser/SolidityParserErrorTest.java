package solclar.parser;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import java.util.Arrays;
import java.util.List;

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;

@RunWith(Parameterized.class)
public class SolidityParserErrorTest {

	@Parameters(name = "{index}: {0}")
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
				{ "", EmptySourceError.class },
				{ "  // nothing here\n", EmptySourceError.class },
				{ "pragma solidity ^0.8.0;", EmptySourceError.class },
				{ "contract { invalid syntax }", MissingNameError.class },
				{ "contract C { function () public {} }", MissingNameError.class },
				{ "contract C { uint256; }", MissingNameError.class },
				{ "contract C { uint256 public = 5; }", MissingNameError.class },
				{ "contract C { mapping(address => uint256) public; }", MissingNameError.class },
				{ "contract C { event (uint256 a); }", MissingNameError.class },
				{ "contract C { invalid syntax }", SyntaxError.class },
				{ "contract C { function f() public public {} }", SyntaxError.class },
				{ "contract C { function f() view pure {} }", SyntaxError.class },
				{ "contract C { uint256 public public x; }", SyntaxError.class },
				{ "contract C { constructor() {} constructor() {} }", SyntaxError.class },
				{ "contract C {} contract C {}", SyntaxError.class },
				{ "contract C { uint256 x;", SyntaxError.class },
				{ "contract C { function f() { x = 1 } }", SyntaxError.class },
				{ "contract C { function f() { a.b[1] = 2; } }", SyntaxError.class },
				{ "contract C { function f() { !x; } }", SyntaxError.class },
				{ "contract C { string s = \"abc; }", SyntaxError.class },
				{ "contract C { mapping(address => uint256) constant m; }", SyntaxError.class },
				{ "pragma solidity ^0.8.0", SyntaxError.class },
				{ "uint256 x;", SyntaxError.class },
				{ "contract C { uint256 constant X; }", MissingSubexpressionError.class },
				{ "contract C { mapping(=> uint256) m; }", MissingSubexpressionError.class },
				{ "contract C { mapping(address => ) m; }", MissingSubexpressionError.class },
				{ "contract C { function f() { x = ; } }", MissingSubexpressionError.class },
				{ "contract C { function f() { g(1, ); } }", MissingSubexpressionError.class },
				{ "contract C { function f() { m[] = 1; } }", MissingSubexpressionError.class },
				{ "contract C { function f() { a + b = 1; } }", InvalidAssignmentTargetError.class },
				{ "contract C { function f() { g() = 1; } }", InvalidAssignmentTargetError.class },
				{ "contract C { function f() { msg.sender = 1; } }", InvalidAssignmentTargetError.class },
		});
	}

	private final String source;
	private final Class<? extends ParsingError> expected;

	public SolidityParserErrorTest(String source, Class<? extends ParsingError> expected) {
		this.source = source;
		this.expected = expected;
	}

	@Test
	public void test() {
		try {
			SolidityParser.readContracts(source);
		} catch (ParsingError e) {
			assertThat(e, instanceOf(expected));
			return;
		}
		fail("expected " + expected.getSimpleName());
	}
}
