package solclar.model.solidity;

import solclar.util.SourceLocation;

import java.util.Objects;

public class SolidityMapAccess extends SolidityExpression {

	private final String mapName;
	private final SolidityExpression key;

	public SolidityMapAccess(SourceLocation location, String mapName, SolidityExpression key) {
		super(location);
		this.mapName = mapName;
		this.key = key;
	}

	public String getMapName() {
		return mapName;
	}

	public SolidityExpression getKey() {
		return key;
	}

	@Override
	public <T, E extends Throwable> T accept(SolidityExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(mapName, key);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		SolidityMapAccess other = (SolidityMapAccess) obj;
		return Objects.equals(mapName, other.mapName) && Objects.equals(key, other.key);
	}
}
