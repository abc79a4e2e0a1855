package solclar.model.solidity;

import solclar.util.SourceLocation;

import java.util.Objects;

public class SolidityIdentifier extends SolidityExpression {

	private final String name;

	public SolidityIdentifier(SourceLocation location, String name) {
		super(location);
		this.name = name;
	}

	public String getName() {
		return name;
	}

	@Override
	public <T, E extends Throwable> T accept(SolidityExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		SolidityIdentifier other = (SolidityIdentifier) obj;
		return Objects.equals(name, other.name);
	}
}
