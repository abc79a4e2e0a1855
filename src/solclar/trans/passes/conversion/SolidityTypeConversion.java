package solclar.trans.passes.conversion;

import solclar.model.clarity.ClarityTypes;
import solclar.model.solidity.SolidityExpression;
import solclar.model.solidity.SolidityLiteral;
import solclar.model.solidity.SolidityMappingType;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Maps Solidity type names to Clarity type names, and picks the Clarity literal a data variable starts with.
 * Unknown types map to {@code uint}. Mapping a name that is already a Clarity type gives it back unchanged.
 */
public final class SolidityTypeConversion {
	private SolidityTypeConversion() {}

	private static final Map<String, String> TYPES;
	static {
		Map<String, String> types = new HashMap<>();
		types.put("uint256", ClarityTypes.UINT);
		types.put("uint", ClarityTypes.UINT);
		types.put("bool", ClarityTypes.BOOL);
		types.put("address", ClarityTypes.PRINCIPAL);
		types.put("string", ClarityTypes.STRING_ASCII);
		types.put(ClarityTypes.PRINCIPAL, ClarityTypes.PRINCIPAL);
		types.put(ClarityTypes.STRING_ASCII, ClarityTypes.STRING_ASCII);
		TYPES = Collections.unmodifiableMap(types);
	}

	public static String convertType(String solidityType) {
		return TYPES.getOrDefault(solidityType, ClarityTypes.UINT);
	}

	public static String convertKeyType(SolidityMappingType mapping) {
		if(!mapping.isNested()) {
			return convertType(mapping.getKeyType());
		}
		return ClarityTypes.compositeKey(
				convertType(mapping.getKeyType()),
				convertType(mapping.getInnermost().getKeyType()));
	}

	public static String convertValueType(SolidityMappingType mapping) {
		return convertType(mapping.getInnermost().getValueType());
	}

	public static String defaultValue(String clarityType) {
		switch(clarityType) {
			case ClarityTypes.BOOL:
				return ClarityTypes.FALSE;
			case ClarityTypes.PRINCIPAL:
				return ClarityTypes.TX_SENDER;
			case ClarityTypes.STRING_ASCII:
				return ClarityTypes.EMPTY_STRING;
			case ClarityTypes.UINT:
			default:
				return ClarityTypes.UINT_ZERO;
		}
	}

	/**
	 * @param clarityType the already converted type of the variable
	 * @param initialValue the initializer written in the source, or null
	 * @return the literal text the variable starts with. Only a literal initializer is kept; anything else falls
	 * back to the default value of the type.
	 */
	public static String initialValue(String clarityType, SolidityExpression initialValue) {
		if(!(initialValue instanceof SolidityLiteral)) {
			return defaultValue(clarityType);
		}
		String value = ((SolidityLiteral) initialValue).getValue();
		if(ClarityTypes.UINT.equals(clarityType) && isDecimal(value)) {
			return unsigned(value);
		}
		return value;
	}

	public static boolean isDecimal(String value) {
		if(value.isEmpty()) {
			return false;
		}
		for(int i = 0; i < value.length(); ++i) {
			if(!Character.isDigit(value.charAt(i))) {
				return false;
			}
		}
		return true;
	}

	public static String unsigned(String decimal) {
		return "u" + decimal;
	}
}
