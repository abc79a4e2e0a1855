package solclar.trans.passes.conversion;

import solclar.model.clarity.*;
import solclar.model.solidity.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Lowers a parsed contract to the Clarity intermediate representation. Lowering accepts every contract the
 * parser can produce and never fails.
 */
public class ClarityConversionPass {
	private ClarityConversionPass() {}

	public static final String CONSTRUCTOR_NAME = "init";

	public static ClarityContract perform(SolidityContract contract) {
		SolidityExpressionConversionVisitor expressions = new SolidityExpressionConversionVisitor();
		SolidityStatementConversionVisitor statements = new SolidityStatementConversionVisitor(expressions);

		List<ClarityDataVar> dataVars = new ArrayList<>();
		List<ClarityMap> maps = new ArrayList<>();
		for(SolidityStateVariable variable : contract.getStateVariables()) {
			if(variable.isMapping()) {
				maps.add(convertMapping(variable));
			}else {
				String type = SolidityTypeConversion.convertType(variable.getType());
				dataVars.add(new ClarityDataVar(
						variable.getName(),
						type,
						SolidityTypeConversion.initialValue(type, variable.getInitialValue()),
						variable.isConstant(),
						variable.getVisibility()));
			}
		}

		List<ClarityFunction> functions = new ArrayList<>();
		if(contract.hasConstructor()) {
			SolidityConstructor constructor = contract.getConstructor();
			functions.add(new ClarityFunction(
					CONSTRUCTOR_NAME,
					convertParameters(constructor.getParams()),
					true,
					false,
					convertBody(statements, constructor.getBody())));
		}
		for(SolidityFunction function : contract.getFunctions()) {
			functions.add(new ClarityFunction(
					function.getName(),
					convertParameters(function.getParams()),
					isPublic(function.getVisibility()),
					isReadOnly(function.getMutability()),
					convertBody(statements, function.getBody())));
		}

		List<ClarityEvent> events = new ArrayList<>();
		for(SolidityEvent event : contract.getEvents()) {
			List<ClarityEventField> fields = new ArrayList<>();
			for(SolidityEventParameter param : event.getParams()) {
				fields.add(new ClarityEventField(
						param.getName(), SolidityTypeConversion.convertType(param.getType()), param.isIndexed()));
			}
			events.add(new ClarityEvent(event.getName(), fields));
		}

		return new ClarityContract(contract.getName(), functions, dataVars, maps, events);
	}

	// any nesting depth flattens to one map keyed on the outermost and innermost keys
	static ClarityMap convertMapping(SolidityStateVariable variable) {
		SolidityMappingType mapping = variable.getMapping();
		return new ClarityMap(
				variable.getName(),
				SolidityTypeConversion.convertKeyType(mapping),
				SolidityTypeConversion.convertValueType(mapping));
	}

	static boolean isPublic(String visibility) {
		return "public".equals(visibility) || "external".equals(visibility);
	}

	static boolean isReadOnly(String mutability) {
		return "view".equals(mutability) || "pure".equals(mutability);
	}

	private static List<ClarityParameter> convertParameters(List<SolidityParameter> params) {
		List<ClarityParameter> result = new ArrayList<>();
		for(SolidityParameter param : params) {
			result.add(new ClarityParameter(param.getName(), SolidityTypeConversion.convertType(param.getType())));
		}
		return result;
	}

	private static List<ClarityExpression> convertBody(SolidityStatementConversionVisitor statements,
	                                                   List<SolidityStatement> body) {
		List<ClarityExpression> result = new ArrayList<>();
		for(SolidityStatement statement : body) {
			result.add(statement.accept(statements));
		}
		return result;
	}
}
