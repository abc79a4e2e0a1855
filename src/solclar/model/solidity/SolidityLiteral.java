package solclar.model.solidity;

import solclar.util.SourceLocation;

import java.util.Objects;

/**
 * A number, string or boolean literal, kept as its raw lexeme (string literals include their quotes).
 */
public class SolidityLiteral extends SolidityExpression {

	private final String value;

	public SolidityLiteral(SourceLocation location, String value) {
		super(location);
		this.value = value;
	}

	public String getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(SolidityExpressionVisitor<T, E> v) throws E {
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
		SolidityLiteral other = (SolidityLiteral) obj;
		return Objects.equals(value, other.value);
	}
}
