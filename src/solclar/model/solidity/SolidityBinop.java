package solclar.model.solidity;

import solclar.util.SourceLocation;

import java.util.Objects;

public class SolidityBinop extends SolidityExpression {

	private final SolidityExpression lhs;
	private final String operator;
	private final SolidityExpression rhs;

	public SolidityBinop(SourceLocation location, SolidityExpression lhs, String operator, SolidityExpression rhs) {
		super(location);
		this.lhs = lhs;
		this.operator = operator;
		this.rhs = rhs;
	}

	public SolidityExpression getLHS() {
		return lhs;
	}

	public String getOperator() {
		return operator;
	}

	public SolidityExpression getRHS() {
		return rhs;
	}

	@Override
	public <T, E extends Throwable> T accept(SolidityExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(lhs, operator, rhs);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		SolidityBinop other = (SolidityBinop) obj;
		return Objects.equals(lhs, other.lhs) &&
				Objects.equals(operator, other.operator) &&
				Objects.equals(rhs, other.rhs);
	}
}
