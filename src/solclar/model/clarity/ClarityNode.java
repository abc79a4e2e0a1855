package solclar.model.clarity;

/**
 * Base class of the Clarity intermediate representation. Nodes are produced by lowering and carry no source
 * locations.
 */
public abstract class ClarityNode {

	@Override
	public abstract boolean equals(Object other);

	@Override
	public abstract int hashCode();

}
