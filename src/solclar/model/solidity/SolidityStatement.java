package solclar.model.solidity;

import solclar.util.SourceLocation;

public abstract class SolidityStatement extends SolidityNode {
	public SolidityStatement(SourceLocation location) {
		super(location);
	}

	public abstract <T, E extends Throwable> T accept(SolidityStatementVisitor<T, E> v) throws E;
}
