package solclar.model.solidity;

import solclar.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class SolidityFunctionCall extends SolidityExpression {

	private final String name;
	private final List<SolidityExpression> arguments;

	public SolidityFunctionCall(SourceLocation location, String name, List<SolidityExpression> arguments) {
		super(location);
		this.name = name;
		this.arguments = arguments;
	}

	public String getName() {
		return name;
	}

	public List<SolidityExpression> getArguments() {
		return arguments;
	}

	@Override
	public <T, E extends Throwable> T accept(SolidityExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, arguments);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		SolidityFunctionCall other = (SolidityFunctionCall) obj;
		return Objects.equals(name, other.name) && Objects.equals(arguments, other.arguments);
	}
}
