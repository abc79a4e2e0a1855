package solclar.model.solidity;

import solclar.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class SolidityEvent extends SolidityNode {

	private final String name;
	private final List<SolidityEventParameter> params;

	public SolidityEvent(SourceLocation location, String name, List<SolidityEventParameter> params) {
		super(location);
		this.name = name;
		this.params = params;
	}

	public String getName() {
		return name;
	}

	public List<SolidityEventParameter> getParams() {
		return params;
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, params);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		SolidityEvent other = (SolidityEvent) obj;
		return Objects.equals(name, other.name) && Objects.equals(params, other.params);
	}
}
