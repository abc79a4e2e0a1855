package solclar.model.solidity;

import solclar.util.SourceLocation;

import java.util.Objects;

/**
 * {@code name = value;}
 */
public class SolidityAssignment extends SolidityStatement {

	private final String variable;
	private final SolidityExpression value;

	public SolidityAssignment(SourceLocation location, String variable, SolidityExpression value) {
		super(location);
		this.variable = variable;
		this.value = value;
	}

	public String getVariable() {
		return variable;
	}

	public SolidityExpression getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(SolidityStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(variable, value);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		SolidityAssignment other = (SolidityAssignment) obj;
		return Objects.equals(variable, other.variable) && Objects.equals(value, other.value);
	}
}
