package solclar.model.solidity;

import solclar.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class SolidityFunction extends SolidityNode {

	private final String name;
	private final List<SolidityParameter> params;
	private final String returnType;
	private final String visibility;
	private final String mutability;
	private final List<SolidityStatement> body;

	public SolidityFunction(SourceLocation location, String name, List<SolidityParameter> params, String returnType,
	                        String visibility, String mutability, List<SolidityStatement> body) {
		super(location);
		this.name = name;
		this.params = params;
		this.returnType = returnType;
		this.visibility = visibility;
		this.mutability = mutability;
		this.body = body;
	}

	public String getName() {
		return name;
	}

	public List<SolidityParameter> getParams() {
		return params;
	}

	/**
	 * @return the declared return type, or null if the function does not return anything
	 */
	public String getReturnType() {
		return returnType;
	}

	/**
	 * @return one of public, private, internal or external; null if none was written
	 */
	public String getVisibility() {
		return visibility;
	}

	/**
	 * @return one of view, pure, payable or nonpayable; null if none was written
	 */
	public String getMutability() {
		return mutability;
	}

	public List<SolidityStatement> getBody() {
		return body;
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, params, returnType, visibility, mutability, body);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		SolidityFunction other = (SolidityFunction) obj;
		return Objects.equals(name, other.name) &&
				Objects.equals(params, other.params) &&
				Objects.equals(returnType, other.returnType) &&
				Objects.equals(visibility, other.visibility) &&
				Objects.equals(mutability, other.mutability) &&
				Objects.equals(body, other.body);
	}
}
