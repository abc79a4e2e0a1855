package solclar.trans.passes.conversion;

import solclar.model.clarity.*;
import solclar.model.solidity.*;
import solclar.parser.SolidityGrammar;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class SolidityExpressionConversionVisitor extends SolidityExpressionVisitor<ClarityExpression, RuntimeException> {

	private static final String SENDER_CONTEXT = "msg";
	private static final String SENDER_FIELD = "sender";

	public List<ClarityExpression> convertAll(List<SolidityExpression> expressions) {
		List<ClarityExpression> result = new ArrayList<>();
		for(SolidityExpression expression : expressions) {
			result.add(expression.accept(this));
		}
		return result;
	}

	@Override
	public ClarityExpression visit(SolidityLiteral literal) throws RuntimeException {
		String value = literal.getValue();
		if(SolidityTypeConversion.isDecimal(value)) {
			return new ClarityLiteral(SolidityTypeConversion.unsigned(value));
		}
		return new ClarityLiteral(value);
	}

	// state reads always go through var-get
	@Override
	public ClarityExpression visit(SolidityIdentifier identifier) throws RuntimeException {
		return new ClarityFunctionCall("var-get",
				Collections.singletonList(new ClarityVariable(identifier.getName())));
	}

	@Override
	public ClarityExpression visit(SolidityBinop binop) throws RuntimeException {
		String name = SolidityGrammar.COMPOSITE_KEY_OPERATOR.equals(binop.getOperator()) ?
				"tuple" : binop.getOperator();
		return new ClarityFunctionCall(name, Arrays.asList(binop.getLHS().accept(this), binop.getRHS().accept(this)));
	}

	@Override
	public ClarityExpression visit(SolidityMapAccess mapAccess) throws RuntimeException {
		return new ClarityMapGet(mapAccess.getMapName(), Collections.singletonList(mapAccess.getKey().accept(this)));
	}

	@Override
	public ClarityExpression visit(SolidityMemberAccess memberAccess) throws RuntimeException {
		SolidityExpression base = memberAccess.getBase();
		if(base instanceof SolidityIdentifier) {
			String baseName = ((SolidityIdentifier) base).getName();
			if(SENDER_CONTEXT.equals(baseName) && SENDER_FIELD.equals(memberAccess.getMember())) {
				return new ClarityVariable(ClarityTypes.TX_SENDER);
			}
			return new ClarityVariable(baseName + "-" + memberAccess.getMember());
		}
		// no general member model; the name is a placeholder with no binding in the output
		return new ClarityVariable(base.toString() + "-" + memberAccess.getMember());
	}

	@Override
	public ClarityExpression visit(SolidityFunctionCall functionCall) throws RuntimeException {
		return new ClarityFunctionCall(functionCall.getName(), convertAll(functionCall.getArguments()));
	}
}
