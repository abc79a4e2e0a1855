package solclar.model.solidity;

import solclar.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class SolidityEmit extends SolidityStatement {

	private final String eventName;
	private final List<SolidityExpression> arguments;

	public SolidityEmit(SourceLocation location, String eventName, List<SolidityExpression> arguments) {
		super(location);
		this.eventName = eventName;
		this.arguments = arguments;
	}

	public String getEventName() {
		return eventName;
	}

	public List<SolidityExpression> getArguments() {
		return arguments;
	}

	@Override
	public <T, E extends Throwable> T accept(SolidityStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(eventName, arguments);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		SolidityEmit other = (SolidityEmit) obj;
		return Objects.equals(eventName, other.eventName) && Objects.equals(arguments, other.arguments);
	}
}
