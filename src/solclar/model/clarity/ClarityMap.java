package solclar.model.clarity;

import java.util.Objects;

/**
 * A single-level map. The key type may be a composite record type such as
 * {@code {owner: principal, token-id: uint}}.
 */
public class ClarityMap extends ClarityNode {

	private final String name;
	private final String keyType;
	private final String valueType;

	public ClarityMap(String name, String keyType, String valueType) {
		this.name = name;
		this.keyType = keyType;
		this.valueType = valueType;
	}

	public String getName() {
		return name;
	}

	public String getKeyType() {
		return keyType;
	}

	public String getValueType() {
		return valueType;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		ClarityMap that = (ClarityMap) o;
		return Objects.equals(name, that.name) &&
				Objects.equals(keyType, that.keyType) &&
				Objects.equals(valueType, that.valueType);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, keyType, valueType);
	}
}
