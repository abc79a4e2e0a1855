package solclar.model.clarity;

import java.util.List;
import java.util.Objects;

public class ClarityFunction extends ClarityNode {

	private final String name;
	private final List<ClarityParameter> parameters;
	private final boolean isPublic;
	private final boolean readOnly;
	private final List<ClarityExpression> body;

	public ClarityFunction(String name, List<ClarityParameter> parameters, boolean isPublic, boolean readOnly,
	                       List<ClarityExpression> body) {
		this.name = name;
		this.parameters = parameters;
		this.isPublic = isPublic;
		this.readOnly = readOnly;
		this.body = body;
	}

	public String getName() {
		return name;
	}

	public List<ClarityParameter> getParameters() {
		return parameters;
	}

	public boolean isPublic() {
		return isPublic;
	}

	public boolean isReadOnly() {
		return readOnly;
	}

	public List<ClarityExpression> getBody() {
		return body;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		ClarityFunction that = (ClarityFunction) o;
		return isPublic == that.isPublic &&
				readOnly == that.readOnly &&
				Objects.equals(name, that.name) &&
				Objects.equals(parameters, that.parameters) &&
				Objects.equals(body, that.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, parameters, isPublic, readOnly, body);
	}
}
