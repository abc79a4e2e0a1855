package solclar.model.clarity;

import java.util.List;
import java.util.Objects;

/**
 * A lowered contract, ready to be rendered. Data variables keep their declaration order; constants and mutable
 * variables share the one list and are told apart by {@link ClarityDataVar#isConstant()}.
 */
public class ClarityContract extends ClarityNode {

	private final String name;
	private final List<ClarityFunction> functions;
	private final List<ClarityDataVar> dataVars;
	private final List<ClarityMap> maps;
	private final List<ClarityEvent> events;

	public ClarityContract(String name, List<ClarityFunction> functions, List<ClarityDataVar> dataVars,
	                       List<ClarityMap> maps, List<ClarityEvent> events) {
		this.name = name;
		this.functions = functions;
		this.dataVars = dataVars;
		this.maps = maps;
		this.events = events;
	}

	public String getName() {
		return name;
	}

	public List<ClarityFunction> getFunctions() {
		return functions;
	}

	public List<ClarityDataVar> getDataVars() {
		return dataVars;
	}

	public List<ClarityMap> getMaps() {
		return maps;
	}

	public List<ClarityEvent> getEvents() {
		return events;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		ClarityContract that = (ClarityContract) o;
		return Objects.equals(name, that.name) &&
				Objects.equals(functions, that.functions) &&
				Objects.equals(dataVars, that.dataVars) &&
				Objects.equals(maps, that.maps) &&
				Objects.equals(events, that.events);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, functions, dataVars, maps, events);
	}
}
