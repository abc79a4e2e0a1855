package solclar.model.solidity;

import solclar.util.SourceLocation;

import java.util.Objects;

public class SolidityExpressionStatement extends SolidityStatement {

	private final SolidityExpression expression;

	public SolidityExpressionStatement(SourceLocation location, SolidityExpression expression) {
		super(location);
		this.expression = expression;
	}

	public SolidityExpression getExpression() {
		return expression;
	}

	@Override
	public <T, E extends Throwable> T accept(SolidityStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(expression);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		SolidityExpressionStatement other = (SolidityExpressionStatement) obj;
		return Objects.equals(expression, other.expression);
	}
}
