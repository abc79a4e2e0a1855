package solclar.model.clarity;

import java.util.List;
import java.util.Objects;

/**
 * A {@code (print ...)} form. Event emission lowers to one of these, with the event name as first argument.
 */
public class ClarityPrint extends ClarityExpression {

	private final List<ClarityExpression> arguments;

	public ClarityPrint(List<ClarityExpression> arguments) {
		this.arguments = arguments;
	}

	public List<ClarityExpression> getArguments() {
		return arguments;
	}

	@Override
	public <T, E extends Throwable> T accept(ClarityExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		ClarityPrint that = (ClarityPrint) o;
		return Objects.equals(arguments, that.arguments);
	}

	@Override
	public int hashCode() {
		return Objects.hash(arguments);
	}
}
