package solclar.model.solidity;

import solclar.util.SourceLocation;

import java.util.Objects;

public class SolidityParameter extends SolidityNode {

	private final String name;
	private final String type;

	public SolidityParameter(SourceLocation location, String name, String type) {
		super(location);
		this.name = name;
		this.type = type;
	}

	public String getName() {
		return name;
	}

	public String getType() {
		return type;
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, type);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		SolidityParameter other = (SolidityParameter) obj;
		return Objects.equals(name, other.name) && Objects.equals(type, other.type);
	}
}
