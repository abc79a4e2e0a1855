package solclar.model.solidity;

public abstract class SolidityExpressionVisitor<T, E extends Throwable> {
	public abstract T visit(SolidityLiteral literal) throws E;
	public abstract T visit(SolidityIdentifier identifier) throws E;
	public abstract T visit(SolidityBinop binop) throws E;
	public abstract T visit(SolidityMapAccess mapAccess) throws E;
	public abstract T visit(SolidityMemberAccess memberAccess) throws E;
	public abstract T visit(SolidityFunctionCall functionCall) throws E;
}
