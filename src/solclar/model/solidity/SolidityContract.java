package solclar.model.solidity;

import solclar.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class SolidityContract extends SolidityNode {

	private final String name;
	private final List<SolidityFunction> functions;
	private final List<SolidityStateVariable> stateVariables;
	private final List<SolidityEvent> events;
	private final SolidityConstructor constructor;

	public SolidityContract(SourceLocation location, String name, List<SolidityFunction> functions,
	                        List<SolidityStateVariable> stateVariables, List<SolidityEvent> events,
	                        SolidityConstructor constructor) {
		super(location);
		this.name = name;
		this.functions = functions;
		this.stateVariables = stateVariables;
		this.events = events;
		this.constructor = constructor;
	}

	public String getName() {
		return name;
	}

	public List<SolidityFunction> getFunctions() {
		return functions;
	}

	public List<SolidityStateVariable> getStateVariables() {
		return stateVariables;
	}

	public List<SolidityEvent> getEvents() {
		return events;
	}

	/**
	 * @return the explicit constructor, or null if the contract relies on default initialization
	 */
	public SolidityConstructor getConstructor() {
		return constructor;
	}

	public boolean hasConstructor() {
		return constructor != null;
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, functions, stateVariables, events, constructor);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		SolidityContract other = (SolidityContract) obj;
		return Objects.equals(name, other.name) &&
				Objects.equals(functions, other.functions) &&
				Objects.equals(stateVariables, other.stateVariables) &&
				Objects.equals(events, other.events) &&
				Objects.equals(constructor, other.constructor);
	}
}
