package solclar.model.clarity;

import java.util.List;
import java.util.Objects;

public class ClarityMapSet extends ClarityExpression {

	private final String mapName;
	private final List<ClarityExpression> keys;
	private final ClarityExpression value;

	public ClarityMapSet(String mapName, List<ClarityExpression> keys, ClarityExpression value) {
		this.mapName = mapName;
		this.keys = keys;
		this.value = value;
	}

	public String getMapName() {
		return mapName;
	}

	public List<ClarityExpression> getKeys() {
		return keys;
	}

	public ClarityExpression getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(ClarityExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		ClarityMapSet that = (ClarityMapSet) o;
		return Objects.equals(mapName, that.mapName) &&
				Objects.equals(keys, that.keys) &&
				Objects.equals(value, that.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(mapName, keys, value);
	}
}
