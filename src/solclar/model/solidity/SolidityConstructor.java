package solclar.model.solidity;

import solclar.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class SolidityConstructor extends SolidityNode {

	private final List<SolidityParameter> params;
	private final String visibility;
	private final List<SolidityStatement> body;

	public SolidityConstructor(SourceLocation location, List<SolidityParameter> params, String visibility,
	                           List<SolidityStatement> body) {
		super(location);
		this.params = params;
		this.visibility = visibility;
		this.body = body;
	}

	public List<SolidityParameter> getParams() {
		return params;
	}

	public String getVisibility() {
		return visibility;
	}

	public List<SolidityStatement> getBody() {
		return body;
	}

	@Override
	public int hashCode() {
		return Objects.hash(params, visibility, body);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		SolidityConstructor other = (SolidityConstructor) obj;
		return Objects.equals(params, other.params) &&
				Objects.equals(visibility, other.visibility) &&
				Objects.equals(body, other.body);
	}
}
