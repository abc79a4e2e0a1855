package solclar.model.solidity;

import solclar.util.SourceLocation;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class SolidityBuilder {
	private SolidityBuilder() {}

	// declarations

	public static SolidityContract contract(String name, List<SolidityStateVariable> stateVariables,
	                                        List<SolidityFunction> functions, List<SolidityEvent> events,
	                                        SolidityConstructor constructor) {
		return new SolidityContract(SourceLocation.unknown(), name, functions, stateVariables, events, constructor);
	}

	public static SolidityContract contract(String name) {
		return contract(name, vars(), functions(), events(), null);
	}

	public static List<SolidityStateVariable> vars(SolidityStateVariable... vars) {
		return Arrays.asList(vars);
	}

	public static List<SolidityFunction> functions(SolidityFunction... functions) {
		return Arrays.asList(functions);
	}

	public static List<SolidityEvent> events(SolidityEvent... events) {
		return Arrays.asList(events);
	}

	public static SolidityStateVariable var(String name, String type, String visibility) {
		return new SolidityStateVariable(SourceLocation.unknown(), name, type, visibility, false, null, null);
	}

	public static SolidityStateVariable var(String name, String type) {
		return var(name, type, null);
	}

	public static SolidityStateVariable var(String name, String type, String visibility, SolidityExpression init) {
		return new SolidityStateVariable(SourceLocation.unknown(), name, type, visibility, false, init, null);
	}

	public static SolidityStateVariable constant(String name, String type, SolidityExpression value) {
		return new SolidityStateVariable(SourceLocation.unknown(), name, type, null, true, value, null);
	}

	public static SolidityStateVariable mappingVar(String name, String visibility, SolidityMappingType mapping) {
		return new SolidityStateVariable(
				SourceLocation.unknown(), name, mapping.toTypeString(), visibility, false, null, mapping);
	}

	public static SolidityMappingType mapping(String keyType, String valueType) {
		return new SolidityMappingType(SourceLocation.unknown(), keyType, valueType, null);
	}

	public static SolidityMappingType mapping(String keyType, SolidityMappingType nested) {
		return new SolidityMappingType(SourceLocation.unknown(), keyType, nested.toTypeString(), nested);
	}

	public static SolidityFunction function(String name, List<SolidityParameter> params, String returnType,
	                                        String visibility, String mutability, List<SolidityStatement> body) {
		return new SolidityFunction(SourceLocation.unknown(), name, params, returnType, visibility, mutability, body);
	}

	public static SolidityFunction function(String name, String visibility, List<SolidityStatement> body) {
		return function(name, params(), null, visibility, null, body);
	}

	public static SolidityConstructor constructor(List<SolidityParameter> params, String visibility,
	                                              List<SolidityStatement> body) {
		return new SolidityConstructor(SourceLocation.unknown(), params, visibility, body);
	}

	public static List<SolidityParameter> params(SolidityParameter... params) {
		return Arrays.asList(params);
	}

	public static SolidityParameter param(String type, String name) {
		return new SolidityParameter(SourceLocation.unknown(), name, type);
	}

	public static SolidityEvent event(String name, SolidityEventParameter... params) {
		return new SolidityEvent(SourceLocation.unknown(), name, Arrays.asList(params));
	}

	public static SolidityEventParameter eventParam(String type, boolean indexed, String name) {
		return new SolidityEventParameter(SourceLocation.unknown(), name, type, indexed);
	}

	// statements

	public static List<SolidityStatement> body(SolidityStatement... statements) {
		return Arrays.asList(statements);
	}

	public static List<SolidityStatement> emptyBody() {
		return Collections.emptyList();
	}

	public static SolidityExpressionStatement exprStmt(SolidityExpression expression) {
		return new SolidityExpressionStatement(SourceLocation.unknown(), expression);
	}

	public static SolidityReturn ret(SolidityExpression value) {
		return new SolidityReturn(SourceLocation.unknown(), value);
	}

	public static SolidityAssignment assign(String variable, SolidityExpression value) {
		return new SolidityAssignment(SourceLocation.unknown(), variable, value);
	}

	public static SolidityMapAccessAssignment mapAssign(String mapName, SolidityExpression key,
	                                                    SolidityExpression value) {
		return new SolidityMapAccessAssignment(SourceLocation.unknown(), mapName, key, value);
	}

	public static SolidityEmit emit(String eventName, SolidityExpression... args) {
		return new SolidityEmit(SourceLocation.unknown(), eventName, Arrays.asList(args));
	}

	// expressions

	public static SolidityLiteral lit(String value) {
		return new SolidityLiteral(SourceLocation.unknown(), value);
	}

	public static SolidityLiteral num(long value) {
		return lit(Long.toString(value));
	}

	public static SolidityIdentifier id(String name) {
		return new SolidityIdentifier(SourceLocation.unknown(), name);
	}

	public static SolidityBinop binop(SolidityExpression lhs, String operator, SolidityExpression rhs) {
		return new SolidityBinop(SourceLocation.unknown(), lhs, operator, rhs);
	}

	public static SolidityMapAccess index(String mapName, SolidityExpression key) {
		return new SolidityMapAccess(SourceLocation.unknown(), mapName, key);
	}

	public static SolidityMemberAccess member(SolidityExpression base, String member) {
		return new SolidityMemberAccess(SourceLocation.unknown(), base, member);
	}

	public static SolidityFunctionCall call(String name, SolidityExpression... args) {
		return new SolidityFunctionCall(SourceLocation.unknown(), name, Arrays.asList(args));
	}
}
