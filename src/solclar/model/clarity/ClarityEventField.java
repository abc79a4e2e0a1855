package solclar.model.clarity;

import java.util.Objects;

public class ClarityEventField extends ClarityNode {

	private final String name;
	private final String type;
	private final boolean indexed;

	public ClarityEventField(String name, String type, boolean indexed) {
		this.name = name;
		this.type = type;
		this.indexed = indexed;
	}

	public String getName() {
		return name;
	}

	public String getType() {
		return type;
	}

	public boolean isIndexed() {
		return indexed;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		ClarityEventField that = (ClarityEventField) o;
		return indexed == that.indexed &&
				Objects.equals(name, that.name) &&
				Objects.equals(type, that.type);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, type, indexed);
	}
}
