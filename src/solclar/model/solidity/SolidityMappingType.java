package solclar.model.solidity;

import solclar.util.SourceLocation;

import java.util.Objects;

/**
 * One level of a {@code mapping(K => V)} type. When V is itself a mapping, {@link #getNested()} describes it and
 * {@link #getValueType()} holds its canonical text, so a chain of these describes nesting of any depth.
 */
public class SolidityMappingType extends SolidityNode {

	private final String keyType;
	private final String valueType;
	private final SolidityMappingType nested;

	public SolidityMappingType(SourceLocation location, String keyType, String valueType, SolidityMappingType nested) {
		super(location);
		this.keyType = keyType;
		this.valueType = valueType;
		this.nested = nested;
	}

	public String getKeyType() {
		return keyType;
	}

	public String getValueType() {
		return valueType;
	}

	public SolidityMappingType getNested() {
		return nested;
	}

	public boolean isNested() {
		return nested != null;
	}

	/**
	 * @return the number of mapping levels, 1 for a mapping whose value is not a mapping
	 */
	public int getDepth() {
		return nested == null ? 1 : 1 + nested.getDepth();
	}

	/**
	 * @return the innermost level of the chain (this mapping if it is not nested)
	 */
	public SolidityMappingType getInnermost() {
		SolidityMappingType current = this;
		while(current.nested != null) {
			current = current.nested;
		}
		return current;
	}

	public String toTypeString() {
		return canonicalName(keyType, valueType);
	}

	public static String canonicalName(String keyType, String valueType) {
		return "mapping(" + keyType + " => " + valueType + ")";
	}

	@Override
	public int hashCode() {
		return Objects.hash(keyType, valueType, nested);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		SolidityMappingType other = (SolidityMappingType) obj;
		return Objects.equals(keyType, other.keyType) &&
				Objects.equals(valueType, other.valueType) &&
				Objects.equals(nested, other.nested);
	}
}
