package solclar.model.clarity;

import java.util.Objects;

/**
 * A literal already spelled in Clarity syntax, such as {@code u100}, {@code true} or {@code "Transfer"}.
 */
public class ClarityLiteral extends ClarityExpression {

	private final String value;

	public ClarityLiteral(String value) {
		this.value = value;
	}

	public String getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(ClarityExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		ClarityLiteral that = (ClarityLiteral) o;
		return Objects.equals(value, that.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(value);
	}
}
