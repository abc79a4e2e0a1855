package solclar.model.solidity;

import solclar.util.SourceLocation;

import java.util.Objects;

/**
 * A contract-level storage declaration. A mapping variable carries its {@link SolidityMappingType} and has
 * {@code mapping(K => V)} as its type; a constant always has an initial value and is never a mapping.
 */
public class SolidityStateVariable extends SolidityNode {

	private final String name;
	private final String type;
	private final String visibility;
	private final boolean constant;
	private final SolidityExpression initialValue;
	private final SolidityMappingType mapping;

	public SolidityStateVariable(SourceLocation location, String name, String type, String visibility,
	                             boolean constant, SolidityExpression initialValue, SolidityMappingType mapping) {
		super(location);
		this.name = name;
		this.type = type;
		this.visibility = visibility;
		this.constant = constant;
		this.initialValue = initialValue;
		this.mapping = mapping;
	}

	public String getName() {
		return name;
	}

	public String getType() {
		return type;
	}

	public String getVisibility() {
		return visibility;
	}

	public boolean isConstant() {
		return constant;
	}

	/**
	 * @return the initializer expression, or null if there is none
	 */
	public SolidityExpression getInitialValue() {
		return initialValue;
	}

	public boolean isMapping() {
		return mapping != null;
	}

	/**
	 * @return the mapping type, or null if this is not a mapping
	 */
	public SolidityMappingType getMapping() {
		return mapping;
	}

	public String getMappingKeyType() {
		return mapping == null ? null : mapping.getKeyType();
	}

	public String getMappingValueType() {
		return mapping == null ? null : mapping.getValueType();
	}

	public SolidityMappingType getNestedMapping() {
		return mapping == null ? null : mapping.getNested();
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, type, visibility, constant, initialValue, mapping);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		SolidityStateVariable other = (SolidityStateVariable) obj;
		return constant == other.constant &&
				Objects.equals(name, other.name) &&
				Objects.equals(type, other.type) &&
				Objects.equals(visibility, other.visibility) &&
				Objects.equals(initialValue, other.initialValue) &&
				Objects.equals(mapping, other.mapping);
	}
}
