package solclar.model.solidity;

import solclar.util.SourceLocation;

import java.util.Objects;

public class SolidityReturn extends SolidityStatement {

	private final SolidityExpression value;

	public SolidityReturn(SourceLocation location, SolidityExpression value) {
		super(location);
		this.value = value;
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
		return Objects.hash(value);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		SolidityReturn other = (SolidityReturn) obj;
		return Objects.equals(value, other.value);
	}
}
