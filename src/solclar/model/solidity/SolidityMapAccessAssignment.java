package solclar.model.solidity;

import solclar.util.SourceLocation;

import java.util.Objects;

/**
 * {@code map[key] = value;}, where a multi-level target such as {@code map[a][b]} has already been folded into
 * a single composite key.
 */
public class SolidityMapAccessAssignment extends SolidityStatement {

	private final String mapName;
	private final SolidityExpression key;
	private final SolidityExpression value;

	public SolidityMapAccessAssignment(SourceLocation location, String mapName, SolidityExpression key,
	                                   SolidityExpression value) {
		super(location);
		this.mapName = mapName;
		this.key = key;
		this.value = value;
	}

	public String getMapName() {
		return mapName;
	}

	public SolidityExpression getKey() {
		return key;
	}

	public SolidityExpression getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(SolidityStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(mapName, key, value);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		SolidityMapAccessAssignment other = (SolidityMapAccessAssignment) obj;
		return Objects.equals(mapName, other.mapName) &&
				Objects.equals(key, other.key) &&
				Objects.equals(value, other.value);
	}
}
