package solclar.model.clarity;

import java.util.List;
import java.util.Objects;

public class ClarityEvent extends ClarityNode {

	private final String name;
	private final List<ClarityEventField> fields;

	public ClarityEvent(String name, List<ClarityEventField> fields) {
		this.name = name;
		this.fields = fields;
	}

	public String getName() {
		return name;
	}

	public List<ClarityEventField> getFields() {
		return fields;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		ClarityEvent that = (ClarityEvent) o;
		return Objects.equals(name, that.name) &&
				Objects.equals(fields, that.fields);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, fields);
	}
}
