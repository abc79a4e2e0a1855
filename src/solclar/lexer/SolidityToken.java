package solclar.lexer;

import solclar.util.SourceLocatable;
import solclar.util.SourceLocation;

import java.util.Objects;

public class SolidityToken extends SourceLocatable {

	private final String value;
	private final SolidityTokenType type;
	private final SourceLocation location;

	public SolidityToken(String value, SolidityTokenType type, SourceLocation location) {
		this.value = value;
		this.type = type;
		this.location = location;
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	/**
	 * @return the token text exactly as written, including the quotes of a string literal
	 */
	public String getValue() {
		return value;
	}

	public SolidityTokenType getType() {
		return type;
	}

	public boolean is(SolidityTokenType type, String value) {
		return this.type == type && this.value.equals(value);
	}

	public boolean isBuiltin(String value) {
		return is(SolidityTokenType.BUILTIN, value);
	}

	@Override
	public String toString() {
		return "SolidityToken [value=" + value + ", type=" + type + ", location=" + location + "]";
	}

	@Override
	public int hashCode() {
		return Objects.hash(value, type, location);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		SolidityToken other = (SolidityToken) obj;
		return type == other.type && Objects.equals(value, other.value) && Objects.equals(location, other.location);
	}

}
