package solclar.parser;

import solclar.lexer.SolidityLexer;
import solclar.lexer.SolidityToken;
import solclar.lexer.SolidityTokenType;
import solclar.model.solidity.*;
import solclar.util.SourceLocation;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser for the Solidity subset described by {@link SolidityGrammar}.
 *
 * The first error aborts the whole parse, so callers either get every contract of the text or none.
 */
public final class SolidityParser {

	// the tokens we are parsing, always terminated by an EOF token
	private final List<SolidityToken> tokens;

	// index of the next token to consume
	private int cur;

	private final ParseTrace trace;

	private SolidityParser(List<SolidityToken> tokens, ParseTrace trace) {
		this.tokens = tokens;
		this.cur = 0;
		this.trace = trace;
	}

	/**
	 * Parses every contract declared in a source text.
	 *
	 * @param file the file the text was read from, used only in locations; may be null
	 * @param text the source text
	 * @param trace receives a description of each parsing decision
	 * @return the contracts, in declaration order
	 * @throws ParsingError if the text is not a valid source file, or declares no contract
	 */
	public static List<SolidityContract> readContracts(Path file, CharSequence text, ParseTrace trace)
			throws ParsingError {
		List<SolidityToken> tokens = new SolidityLexer(file, text).readTokens();
		return new SolidityParser(tokens, trace).parseFile();
	}

	public static List<SolidityContract> readContracts(CharSequence text) throws ParsingError {
		return readContracts(null, text, ParseTrace.NONE);
	}

	// token cursor

	private SolidityToken peek() {
		return tokens.get(cur);
	}

	private SolidityToken peek(int ahead) {
		return tokens.get(Math.min(cur + ahead, tokens.size() - 1));
	}

	private boolean hasNext() {
		return peek().getType() != SolidityTokenType.EOF;
	}

	private SolidityToken next() {
		SolidityToken tok = tokens.get(cur);
		if(tok.getType() != SolidityTokenType.EOF) {
			++cur;
		}
		return tok;
	}

	private SolidityToken previous() {
		return tokens.get(Math.max(cur - 1, 0));
	}

	private boolean atBuiltin(String value) {
		return peek().isBuiltin(value);
	}

	private boolean atIdentifier() {
		return peek().getType() == SolidityTokenType.IDENT;
	}

	private boolean skipBuiltin(String value) {
		if(atBuiltin(value)) {
			next();
			return true;
		}
		return false;
	}

	private static String describe(SolidityToken tok) {
		if(tok.getType() == SolidityTokenType.EOF) {
			return "end of input";
		}
		return "'" + tok.getValue() + "'";
	}

	private SyntaxError unexpected(String expected) {
		return new SyntaxError("expected " + expected + " but found " + describe(peek()), peek().getLocation());
	}

	private SolidityToken expectBuiltin(String value) throws SyntaxError {
		if(!atBuiltin(value)) {
			throw unexpected("'" + value + "'");
		}
		return next();
	}

	private SolidityToken expectIdentifier(String what) throws SyntaxError {
		if(!atIdentifier()) {
			throw unexpected(what);
		}
		return next();
	}

	// the location spanning from a start location to the last consumed token
	private SourceLocation spanFrom(SourceLocation start) {
		return start.combine(previous().getLocation());
	}

	// declarations

	private List<SolidityContract> parseFile() throws ParsingError {
		List<SolidityContract> contracts = new ArrayList<>();
		Set<String> names = new HashSet<>();
		while(hasNext()) {
			if(atBuiltin(SolidityGrammar.PRAGMA)) {
				skipPragma();
			}else if(atBuiltin(SolidityGrammar.CONTRACT)) {
				SolidityContract contract = parseContract();
				if(!names.add(contract.getName())) {
					throw new SyntaxError(
							"duplicate contract name '" + contract.getName() + "'", contract.getLocation());
				}
				contracts.add(contract);
			}else {
				throw unexpected("a contract declaration");
			}
		}
		if(contracts.isEmpty()) {
			throw new EmptySourceError("no contract declaration found", peek().getLocation());
		}
		return contracts;
	}

	private void skipPragma() throws SyntaxError {
		SolidityToken start = next();
		while(!atBuiltin(";")) {
			if(!hasNext()) {
				throw new SyntaxError("unterminated pragma directive", start.getLocation());
			}
			next();
		}
		next();
		trace.trace("skipped pragma directive " + start.getLocation().prettyString());
	}

	private SolidityContract parseContract() throws ParsingError {
		SolidityToken start = expectBuiltin(SolidityGrammar.CONTRACT);
		if(atBuiltin("{")) {
			throw new MissingNameError("contract declaration has no name", peek().getLocation());
		}
		String name = expectIdentifier("a contract name").getValue();
		trace.trace("contract " + name);
		expectBuiltin("{");

		List<SolidityFunction> functions = new ArrayList<>();
		List<SolidityStateVariable> stateVariables = new ArrayList<>();
		List<SolidityEvent> events = new ArrayList<>();
		SolidityConstructor constructor = null;
		while(!atBuiltin("}")) {
			if(atBuiltin(SolidityGrammar.EVENT)) {
				events.add(parseEvent());
			}else if(atBuiltin(SolidityGrammar.FUNCTION)) {
				functions.add(parseFunction());
			}else if(atBuiltin(SolidityGrammar.CONSTRUCTOR)) {
				SourceLocation location = peek().getLocation();
				if(constructor != null) {
					throw new SyntaxError("contract " + name + " declares more than one constructor", location);
				}
				constructor = parseConstructor();
			}else if(atBuiltin(SolidityGrammar.MAPPING)) {
				stateVariables.add(parseMappingStateVariable());
			}else if(atIdentifier()) {
				stateVariables.add(parseBasicStateVariable());
			}else if(!hasNext()) {
				throw unexpected("'}'");
			}else {
				throw unexpected("a declaration in contract " + name);
			}
		}
		next();
		return new SolidityContract(spanFrom(start.getLocation()), name, functions, stateVariables, events,
				constructor);
	}

	private SolidityStateVariable parseBasicStateVariable() throws ParsingError {
		SolidityToken typeToken = next();
		String visibility = null;
		boolean constant = false;
		while(true) {
			if(peek().getType() == SolidityTokenType.BUILTIN && SolidityGrammar.isVisibilityModifier(peek().getValue())) {
				if(visibility != null) {
					throw new SyntaxError("duplicate visibility modifier " + describe(peek()), peek().getLocation());
				}
				visibility = next().getValue();
			}else if(atBuiltin(SolidityGrammar.CONSTANT)) {
				if(constant) {
					throw new SyntaxError("duplicate constant modifier", peek().getLocation());
				}
				next();
				constant = true;
			}else {
				break;
			}
		}
		if(atBuiltin(";") || atBuiltin(SolidityGrammar.ASSIGN)) {
			throw new MissingNameError(
					"state variable of type " + typeToken.getValue() + " has no name", peek().getLocation());
		}
		String name = expectIdentifier("a state variable name").getValue();
		SolidityExpression initialValue = null;
		if(skipBuiltin(SolidityGrammar.ASSIGN)) {
			initialValue = parseExpression();
		}
		if(constant && initialValue == null) {
			throw new MissingSubexpressionError("constant " + name + " has no value", peek().getLocation());
		}
		expectBuiltin(";");
		trace.trace((constant ? "constant " : "state variable ") + typeToken.getValue() + " " + name);
		return new SolidityStateVariable(spanFrom(typeToken.getLocation()), name, typeToken.getValue(), visibility,
				constant, initialValue, null);
	}

	private SolidityStateVariable parseMappingStateVariable() throws ParsingError {
		SourceLocation start = peek().getLocation();
		SolidityMappingType mapping = parseMappingType();
		String visibility = null;
		if(peek().getType() == SolidityTokenType.BUILTIN && SolidityGrammar.isVisibilityModifier(peek().getValue())) {
			visibility = next().getValue();
		}
		if(atBuiltin(SolidityGrammar.CONSTANT)) {
			throw new SyntaxError("a mapping cannot be constant", peek().getLocation());
		}
		if(atBuiltin(";")) {
			throw new MissingNameError(
					"state variable of type " + mapping.toTypeString() + " has no name", peek().getLocation());
		}
		String name = expectIdentifier("a state variable name").getValue();
		expectBuiltin(";");
		trace.trace("mapping " + name + " of depth " + mapping.getDepth());
		return new SolidityStateVariable(spanFrom(start), name, mapping.toTypeString(), visibility, false, null,
				mapping);
	}

	private SolidityMappingType parseMappingType() throws ParsingError {
		SolidityToken start = expectBuiltin(SolidityGrammar.MAPPING);
		expectBuiltin("(");
		if(atBuiltin(SolidityGrammar.MAPPING_ARROW) || atBuiltin(")")) {
			throw new MissingSubexpressionError("mapping has no key type", peek().getLocation());
		}
		String keyType = expectIdentifier("a mapping key type").getValue();
		expectBuiltin(SolidityGrammar.MAPPING_ARROW);
		SolidityMappingType nested = null;
		String valueType;
		if(atBuiltin(SolidityGrammar.MAPPING)) {
			nested = parseMappingType();
			valueType = nested.toTypeString();
		}else if(atBuiltin(")")) {
			throw new MissingSubexpressionError("mapping has no value type", peek().getLocation());
		}else {
			valueType = expectIdentifier("a mapping value type").getValue();
		}
		expectBuiltin(")");
		return new SolidityMappingType(spanFrom(start.getLocation()), keyType, valueType, nested);
	}

	private String parseTypeName() throws ParsingError {
		if(atBuiltin(SolidityGrammar.MAPPING)) {
			return parseMappingType().toTypeString();
		}
		return expectIdentifier("a type").getValue();
	}

	private List<SolidityParameter> parseParameters() throws ParsingError {
		List<SolidityParameter> params = new ArrayList<>();
		expectBuiltin("(");
		if(skipBuiltin(")")) {
			return params;
		}
		do {
			SourceLocation start = peek().getLocation();
			String type = parseTypeName();
			skipDataLocation();
			if(atBuiltin(",") || atBuiltin(")")) {
				throw new MissingNameError("parameter of type " + type + " has no name", peek().getLocation());
			}
			String name = expectIdentifier("a parameter name").getValue();
			params.add(new SolidityParameter(spanFrom(start), name, type));
		} while(skipBuiltin(","));
		expectBuiltin(")");
		return params;
	}

	// memory, storage and calldata make no difference to the translation
	private void skipDataLocation() {
		if(peek().getType() == SolidityTokenType.BUILTIN && SolidityGrammar.isDataLocation(peek().getValue())) {
			next();
		}
	}

	// visibility and mutability modifiers, in any order, each at most once
	private String[] parseModifiers() throws SyntaxError {
		String visibility = null;
		String mutability = null;
		while(peek().getType() == SolidityTokenType.BUILTIN) {
			String value = peek().getValue();
			if(SolidityGrammar.isVisibilityModifier(value)) {
				if(visibility != null) {
					throw new SyntaxError("duplicate visibility modifier '" + value + "'", peek().getLocation());
				}
				visibility = value;
			}else if(SolidityGrammar.isMutabilityModifier(value)) {
				if(mutability != null) {
					throw new SyntaxError("duplicate mutability modifier '" + value + "'", peek().getLocation());
				}
				mutability = value;
			}else {
				break;
			}
			next();
		}
		return new String[]{visibility, mutability};
	}

	private SolidityFunction parseFunction() throws ParsingError {
		SolidityToken start = expectBuiltin(SolidityGrammar.FUNCTION);
		if(atBuiltin("(")) {
			throw new MissingNameError("function has no name", peek().getLocation());
		}
		String name = expectIdentifier("a function name").getValue();
		List<SolidityParameter> params = parseParameters();
		String[] modifiers = parseModifiers();
		String returnType = null;
		if(skipBuiltin(SolidityGrammar.RETURNS)) {
			expectBuiltin("(");
			returnType = parseTypeName();
			skipDataLocation();
			if(atIdentifier()) {
				next();
			}
			expectBuiltin(")");
		}
		trace.trace("function " + name + " with " + params.size() + " parameter(s)");
		List<SolidityStatement> body = parseBody();
		return new SolidityFunction(spanFrom(start.getLocation()), name, params, returnType, modifiers[0],
				modifiers[1], body);
	}

	private SolidityConstructor parseConstructor() throws ParsingError {
		SolidityToken start = expectBuiltin(SolidityGrammar.CONSTRUCTOR);
		List<SolidityParameter> params = parseParameters();
		String[] modifiers = parseModifiers();
		trace.trace("constructor with " + params.size() + " parameter(s)");
		List<SolidityStatement> body = parseBody();
		return new SolidityConstructor(spanFrom(start.getLocation()), params, modifiers[0], body);
	}

	private SolidityEvent parseEvent() throws ParsingError {
		SolidityToken start = expectBuiltin(SolidityGrammar.EVENT);
		if(atBuiltin("(")) {
			throw new MissingNameError("event has no name", peek().getLocation());
		}
		String name = expectIdentifier("an event name").getValue();
		List<SolidityEventParameter> params = new ArrayList<>();
		expectBuiltin("(");
		if(!atBuiltin(")")) {
			do {
				SourceLocation paramStart = peek().getLocation();
				String type = parseTypeName();
				boolean indexed = skipBuiltin(SolidityGrammar.INDEXED);
				String paramName = atIdentifier() ? next().getValue() : "";
				params.add(new SolidityEventParameter(spanFrom(paramStart), paramName, type, indexed));
			} while(skipBuiltin(","));
		}
		expectBuiltin(")");
		expectBuiltin(";");
		trace.trace("event " + name + " with " + params.size() + " field(s)");
		return new SolidityEvent(spanFrom(start.getLocation()), name, params);
	}

	// statements

	private List<SolidityStatement> parseBody() throws ParsingError {
		expectBuiltin("{");
		List<SolidityStatement> body = new ArrayList<>();
		while(!atBuiltin("}")) {
			if(!hasNext()) {
				throw unexpected("'}'");
			}
			SolidityStatement statement = parseStatement();
			if(statement != null) {
				body.add(statement);
			}
		}
		next();
		return body;
	}

	/**
	 * @return the statement, or null for a statement that has no effect (a bare {@code return;})
	 */
	private SolidityStatement parseStatement() throws ParsingError {
		SourceLocation start = peek().getLocation();
		if(skipBuiltin(SolidityGrammar.EMIT)) {
			String eventName = expectIdentifier("an event name").getValue();
			List<SolidityExpression> arguments = new ArrayList<>();
			if(atBuiltin("(")) {
				arguments = parseArguments();
			}
			expectBuiltin(";");
			trace.trace("emit " + eventName);
			return new SolidityEmit(spanFrom(start), eventName, arguments);
		}
		if(skipBuiltin(SolidityGrammar.RETURN)) {
			if(skipBuiltin(";")) {
				trace.trace("empty return dropped");
				return null;
			}
			SolidityExpression value = parseExpression();
			expectBuiltin(";");
			trace.trace("return " + value);
			return new SolidityReturn(spanFrom(start), value);
		}

		SolidityExpression expression = parseExpression();
		if(atBuiltin(SolidityGrammar.ASSIGN)) {
			SourceLocation assignLocation = next().getLocation();
			SolidityExpression value = parseExpression();
			expectBuiltin(";");
			if(expression instanceof SolidityIdentifier) {
				String variable = ((SolidityIdentifier) expression).getName();
				trace.trace("assignment to " + variable);
				return new SolidityAssignment(spanFrom(start), variable, value);
			}else if(expression instanceof SolidityMapAccess) {
				SolidityMapAccess target = (SolidityMapAccess) expression;
				trace.trace("assignment to " + target);
				return new SolidityMapAccessAssignment(
						spanFrom(start), target.getMapName(), target.getKey(), value);
			}
			throw new InvalidAssignmentTargetError(
					"cannot assign to " + expression, expression.getLocation().combine(assignLocation));
		}
		expectBuiltin(";");
		trace.trace("expression statement " + expression);
		return new SolidityExpressionStatement(spanFrom(start), expression);
	}

	// expressions

	private List<SolidityExpression> parseArguments() throws ParsingError {
		expectBuiltin("(");
		List<SolidityExpression> arguments = new ArrayList<>();
		if(skipBuiltin(")")) {
			return arguments;
		}
		do {
			arguments.add(parseExpression());
		} while(skipBuiltin(","));
		expectBuiltin(")");
		return arguments;
	}

	/**
	 * Every binary operator has the same precedence and folds to the left, so {@code a + b * c} is
	 * {@code (a + b) * c}.
	 */
	private SolidityExpression parseExpression() throws ParsingError {
		SolidityExpression lhs = parseTerm();
		while(peek().getType() == SolidityTokenType.BUILTIN && SolidityGrammar.isBinaryOperator(peek().getValue())) {
			String operator = next().getValue();
			SolidityExpression rhs = parseTerm();
			lhs = new SolidityBinop(lhs.getLocation().combine(rhs.getLocation()), lhs, operator, rhs);
			trace.trace("folded operator " + operator);
		}
		return lhs;
	}

	private boolean atEndOfExpression() {
		return !hasNext() || atBuiltin(";") || atBuiltin(")") || atBuiltin("]") || atBuiltin(",")
				|| atBuiltin("}");
	}

	private SolidityExpression parseTerm() throws ParsingError {
		SolidityToken tok = peek();
		switch(tok.getType()) {
			case NUMBER:
			case STRING:
				next();
				return new SolidityLiteral(tok.getLocation(), tok.getValue());
			case IDENT:
				if(peek(1).isBuiltin("(")) {
					next();
					List<SolidityExpression> arguments = parseArguments();
					return new SolidityFunctionCall(spanFrom(tok.getLocation()), tok.getValue(), arguments);
				}
				return parseIndexAccess();
			case BUILTIN:
				if(SolidityGrammar.isBooleanLiteral(tok.getValue())) {
					next();
					return new SolidityLiteral(tok.getLocation(), tok.getValue());
				}
				if(tok.isBuiltin("(")) {
					next();
					SolidityExpression inner = parseExpression();
					expectBuiltin(")");
					return inner;
				}
				break;
			default:
				break;
		}
		if(atEndOfExpression()) {
			throw new MissingSubexpressionError("expected an expression but found " + describe(tok),
					tok.getLocation());
		}
		throw unexpected("an expression");
	}

	private SolidityExpression parseIndexAccess() throws ParsingError {
		SolidityToken start = next();
		SolidityExpression base = new SolidityIdentifier(start.getLocation(), start.getValue());
		while(skipBuiltin(".")) {
			String member = expectIdentifier("a member name").getValue();
			base = new SolidityMemberAccess(spanFrom(start.getLocation()), base, member);
		}
		if(!atBuiltin("[")) {
			return base;
		}
		if(!(base instanceof SolidityIdentifier)) {
			throw new SyntaxError("only a named mapping can be indexed, not " + base, peek().getLocation());
		}
		String mapName = ((SolidityIdentifier) base).getName();
		SolidityExpression key = null;
		while(skipBuiltin("[")) {
			SolidityExpression index = parseExpression();
			expectBuiltin("]");
			if(key == null) {
				key = index;
			}else {
				key = new SolidityBinop(key.getLocation().combine(index.getLocation()), key,
						SolidityGrammar.COMPOSITE_KEY_OPERATOR, index);
			}
		}
		return new SolidityMapAccess(spanFrom(start.getLocation()), mapName, key);
	}
}
