package solclar.model.solidity;

import solclar.util.SourceLocation;

import java.util.Objects;

public class SolidityEventParameter extends SolidityNode {

	private final String name;
	private final String type;
	private final boolean indexed;

	public SolidityEventParameter(SourceLocation location, String name, String type, boolean indexed) {
		super(location);
		this.name = name;
		this.type = type;
		this.indexed = indexed;
	}

	/**
	 * @return the parameter name, empty for an unnamed parameter
	 */
	public String getName() {
		return name;
	}

	public String getType() {
		return type;
	}

	public boolean isIndexed() {
		return indexed;
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, type, indexed);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		SolidityEventParameter other = (SolidityEventParameter) obj;
		return indexed == other.indexed && Objects.equals(name, other.name) && Objects.equals(type, other.type);
	}
}
