package solclar.model.solidity;

import solclar.util.SourceLocatable;
import solclar.util.SourceLocation;

/**
 * Base of the Solidity AST. Equality is structural and ignores source locations, so that parsed trees can be
 * compared against trees built with {@link SolidityBuilder}.
 */
public abstract class SolidityNode extends SourceLocatable {

	private final SourceLocation location;

	public SolidityNode(SourceLocation location) {
		this.location = location;
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	@Override
	public abstract int hashCode();

	@Override
	public abstract boolean equals(Object obj);

}
