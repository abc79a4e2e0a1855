package solclar.model.solidity;

import solclar.util.SourceLocation;

import java.util.Objects;

public class SolidityMemberAccess extends SolidityExpression {

	private final SolidityExpression base;
	private final String member;

	public SolidityMemberAccess(SourceLocation location, SolidityExpression base, String member) {
		super(location);
		this.base = base;
		this.member = member;
	}

	public SolidityExpression getBase() {
		return base;
	}

	public String getMember() {
		return member;
	}

	@Override
	public <T, E extends Throwable> T accept(SolidityExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(base, member);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		SolidityMemberAccess other = (SolidityMemberAccess) obj;
		return Objects.equals(base, other.base) && Objects.equals(member, other.member);
	}
}
