package solclar.model.clarity;

import java.util.List;
import java.util.Objects;

public class ClarityMapGet extends ClarityExpression {

	private final String mapName;
	private final List<ClarityExpression> keys;

	public ClarityMapGet(String mapName, List<ClarityExpression> keys) {
		this.mapName = mapName;
		this.keys = keys;
	}

	public String getMapName() {
		return mapName;
	}

	public List<ClarityExpression> getKeys() {
		return keys;
	}

	@Override
	public <T, E extends Throwable> T accept(ClarityExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		ClarityMapGet that = (ClarityMapGet) o;
		return Objects.equals(mapName, that.mapName) &&
				Objects.equals(keys, that.keys);
	}

	@Override
	public int hashCode() {
		return Objects.hash(mapName, keys);
	}
}
