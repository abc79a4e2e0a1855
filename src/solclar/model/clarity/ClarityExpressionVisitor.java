package solclar.model.clarity;

public abstract class ClarityExpressionVisitor<T, E extends Throwable> {
	public abstract T visit(ClarityLiteral literal) throws E;
	public abstract T visit(ClarityVariable variable) throws E;
	public abstract T visit(ClarityFunctionCall functionCall) throws E;
	public abstract T visit(ClarityMapGet mapGet) throws E;
	public abstract T visit(ClarityMapSet mapSet) throws E;
	public abstract T visit(ClarityPrint print) throws E;
}
