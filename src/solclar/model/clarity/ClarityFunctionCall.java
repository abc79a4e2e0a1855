package solclar.model.clarity;

import java.util.List;
import java.util.Objects;

/**
 * A prefix call {@code (name arg ...)}. Operators, {@code var-get}, {@code var-set} and {@code tuple} are all
 * represented as calls.
 */
public class ClarityFunctionCall extends ClarityExpression {

	private final String name;
	private final List<ClarityExpression> arguments;

	public ClarityFunctionCall(String name, List<ClarityExpression> arguments) {
		this.name = name;
		this.arguments = arguments;
	}

	public String getName() {
		return name;
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
		ClarityFunctionCall that = (ClarityFunctionCall) o;
		return Objects.equals(name, that.name) &&
				Objects.equals(arguments, that.arguments);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, arguments);
	}
}
