package solclar.trans.passes.conversion;

import solclar.InternalCompilerError;
import solclar.model.clarity.*;
import solclar.model.solidity.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Lowers one statement to the single Clarity expression that performs it.
 */
public class SolidityStatementConversionVisitor extends SolidityStatementVisitor<ClarityExpression, RuntimeException> {

	private final SolidityExpressionConversionVisitor expressions;

	public SolidityStatementConversionVisitor(SolidityExpressionConversionVisitor expressions) {
		this.expressions = expressions;
	}

	@Override
	public ClarityExpression visit(SolidityExpressionStatement expressionStatement) throws RuntimeException {
		return expressionStatement.getExpression().accept(expressions);
	}

	@Override
	public ClarityExpression visit(SolidityReturn solidityReturn) throws RuntimeException {
		// the parser drops a return without a value
		if(solidityReturn.getValue() == null) {
			throw new InternalCompilerError("return without a value " + solidityReturn.getLocation().prettyString());
		}
		return solidityReturn.getValue().accept(expressions);
	}

	@Override
	public ClarityExpression visit(SolidityAssignment assignment) throws RuntimeException {
		return new ClarityFunctionCall("var-set", Arrays.asList(
				new ClarityVariable(assignment.getVariable()),
				assignment.getValue().accept(expressions)));
	}

	@Override
	public ClarityExpression visit(SolidityMapAccessAssignment mapAccessAssignment) throws RuntimeException {
		return new ClarityMapSet(
				mapAccessAssignment.getMapName(),
				Collections.singletonList(mapAccessAssignment.getKey().accept(expressions)),
				mapAccessAssignment.getValue().accept(expressions));
	}

	@Override
	public ClarityExpression visit(SolidityEmit emit) throws RuntimeException {
		List<ClarityExpression> arguments = new ArrayList<>();
		arguments.add(new ClarityLiteral("\"" + emit.getEventName() + "\""));
		arguments.addAll(expressions.convertAll(emit.getArguments()));
		return new ClarityPrint(arguments);
	}
}
