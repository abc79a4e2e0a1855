package solclar.trans.passes.conversion;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import java.util.Arrays;
import java.util.List;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

@RunWith(Parameterized.class)
public class SolidityTypeConversionTest {

	@Parameters(name = "{0} -> {1}")
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
				{ "uint256", "uint" },
				{ "uint", "uint" },
				{ "bool", "bool" },
				{ "address", "principal" },
				{ "string", "string-ascii" },
				{ "principal", "principal" },
				{ "string-ascii", "string-ascii" },
				{ "bytes32", "uint" },
				{ "int8", "uint" },
				{ "mapping(address => uint256)", "uint" },
				{ "", "uint" },
		});
	}

	private final String solidityType;
	private final String expected;

	public SolidityTypeConversionTest(String solidityType, String expected) {
		this.solidityType = solidityType;
		this.expected = expected;
	}

	@Test
	public void convertsType() {
		assertThat(SolidityTypeConversion.convertType(solidityType), is(expected));
	}

	@Test
	public void conversionIsIdempotent() {
		String once = SolidityTypeConversion.convertType(solidityType);
		assertThat(SolidityTypeConversion.convertType(once), is(once));
	}
}
