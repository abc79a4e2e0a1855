package solclar.model.clarity;

import java.util.Objects;

/**
 * A {@code define-data-var} or, when constant, a {@code define-constant}. The initial value is already Clarity
 * literal text. The visibility is the one written in the source, or null.
 */
public class ClarityDataVar extends ClarityNode {

	private final String name;
	private final String type;
	private final String initialValue;
	private final boolean constant;
	private final String visibility;

	public ClarityDataVar(String name, String type, String initialValue, boolean constant, String visibility) {
		this.name = name;
		this.type = type;
		this.initialValue = initialValue;
		this.constant = constant;
		this.visibility = visibility;
	}

	public String getName() {
		return name;
	}

	public String getType() {
		return type;
	}

	public String getInitialValue() {
		return initialValue;
	}

	public boolean isConstant() {
		return constant;
	}

	public String getVisibility() {
		return visibility;
	}

	public boolean isPublic() {
		return "public".equals(visibility);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		ClarityDataVar that = (ClarityDataVar) o;
		return constant == that.constant &&
				Objects.equals(name, that.name) &&
				Objects.equals(type, that.type) &&
				Objects.equals(initialValue, that.initialValue) &&
				Objects.equals(visibility, that.visibility);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, type, initialValue, constant, visibility);
	}
}
