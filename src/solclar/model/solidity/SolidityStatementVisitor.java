package solclar.model.solidity;

public abstract class SolidityStatementVisitor<T, E extends Throwable> {
	public abstract T visit(SolidityExpressionStatement expressionStatement) throws E;
	public abstract T visit(SolidityReturn solidityReturn) throws E;
	public abstract T visit(SolidityAssignment assignment) throws E;
	public abstract T visit(SolidityMapAccessAssignment mapAccessAssignment) throws E;
	public abstract T visit(SolidityEmit emit) throws E;
}
