package solclar.parser;

public abstract class ParsingErrorVisitor<T, E extends Throwable> {
	public abstract T visit(SyntaxError syntaxError) throws E;
	public abstract T visit(EmptySourceError emptySourceError) throws E;
	public abstract T visit(MissingNameError missingNameError) throws E;
	public abstract T visit(InvalidAssignmentTargetError invalidAssignmentTargetError) throws E;
	public abstract T visit(MissingSubexpressionError missingSubexpressionError) throws E;
}
