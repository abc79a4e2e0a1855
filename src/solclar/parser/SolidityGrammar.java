package solclar.parser;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The Solidity subset understood by {@link SolidityParser}.
 *
 * <pre>
 * file                  ::= { pragma | contract } EOF
 * pragma                ::= "pragma" { any token except ";" } ";"
 * contract              ::= "contract" IDENT "{" { member } "}"
 * member                ::= event | function | constructor | stateVariable
 * event                 ::= "event" IDENT "(" [ eventParam { "," eventParam } ] ")" ";"
 * eventParam            ::= typeName [ "indexed" ] [ IDENT ]
 * function              ::= "function" IDENT "(" params ")" { modifier } [ "returns" "(" typeName [ dataLocation ] [ IDENT ] ")" ] body
 * constructor           ::= "constructor" "(" params ")" { modifier } body
 * modifier              ::= visibility | mutability
 * params                ::= [ param { "," param } ]
 * param                 ::= typeName [ dataLocation ] IDENT
 * dataLocation          ::= "memory" | "storage" | "calldata"
 * stateVariable         ::= basicStateVariable | mappingStateVariable
 * basicStateVariable    ::= IDENT { visibility | "constant" } IDENT [ "=" expression ] ";"
 * mappingStateVariable  ::= mappingType [ visibility ] IDENT ";"
 * typeName              ::= mappingType | IDENT
 * mappingType           ::= "mapping" "(" IDENT "=>" typeName ")"
 * body                  ::= "{" { statement } "}"
 * statement             ::= "emit" IDENT [ "(" [ expression { "," expression } ] ")" ] ";"
 *                         | "return" [ expression ] ";"
 *                         | indexAccess "=" expression ";"
 *                         | expression ";"
 * expression            ::= term { BINOP term }
 * term                  ::= LITERAL | call | indexAccess | "(" expression ")"
 * call                  ::= IDENT "(" [ expression { "," expression } ] ")"
 * indexAccess           ::= memberAccess { "[" expression "]" }
 * memberAccess          ::= IDENT { "." IDENT }
 * </pre>
 *
 * All binary operators share one precedence level and associate to the left.
 */
public final class SolidityGrammar {
	private SolidityGrammar() {}

	public static final String CONTRACT = "contract";
	public static final String PRAGMA = "pragma";
	public static final String FUNCTION = "function";
	public static final String CONSTRUCTOR = "constructor";
	public static final String EVENT = "event";
	public static final String EMIT = "emit";
	public static final String RETURN = "return";
	public static final String RETURNS = "returns";
	public static final String MAPPING = "mapping";
	public static final String INDEXED = "indexed";
	public static final String CONSTANT = "constant";
	public static final String TRUE = "true";
	public static final String FALSE = "false";

	public static final String MAPPING_ARROW = "=>";
	public static final String ASSIGN = "=";

	/**
	 * The binary operator used internally to combine the keys of a multi-level index access such as
	 * {@code m[a][b]}. It never appears as a source token.
	 */
	public static final String COMPOSITE_KEY_OPERATOR = ",";

	public static final List<String> VISIBILITY_MODIFIERS = Collections.unmodifiableList(Arrays.asList(
			"public", "private", "internal", "external"));

	public static final List<String> MUTABILITY_MODIFIERS = Collections.unmodifiableList(Arrays.asList(
			"view", "pure", "payable", "nonpayable"));

	public static final List<String> DATA_LOCATIONS = Collections.unmodifiableList(Arrays.asList(
			"memory", "storage", "calldata"));

	public static final List<String> BINARY_OPERATORS = Collections.unmodifiableList(Arrays.asList(
			"+", "-", "*", "/", "%",
			"==", "!=", "<", ">", "<=", ">=",
			"&&", "||"));

	/**
	 * Punctuation and operator tokens, longest first so that the lexer can take the first match. Some of them,
	 * such as {@code ^} in a version constraint, are only ever accepted inside a pragma.
	 */
	public static final List<String> SYMBOLS = Collections.unmodifiableList(Arrays.asList(
			"=>", "==", "!=", "<=", ">=", "&&", "||",
			"(", ")", "{", "}", "[", "]", ";", ",", ".",
			"=", "+", "-", "*", "/", "%", "<", ">", "!", "^", "~"));

	public static final Set<String> KEYWORDS;
	static {
		Set<String> keywords = new HashSet<>(Arrays.asList(
				CONTRACT, PRAGMA, FUNCTION, CONSTRUCTOR, EVENT, EMIT, RETURN, RETURNS, MAPPING, INDEXED,
				CONSTANT, TRUE, FALSE));
		keywords.addAll(VISIBILITY_MODIFIERS);
		keywords.addAll(MUTABILITY_MODIFIERS);
		keywords.addAll(DATA_LOCATIONS);
		KEYWORDS = Collections.unmodifiableSet(keywords);
	}

	public static boolean isVisibilityModifier(String value) {
		return VISIBILITY_MODIFIERS.contains(value);
	}

	public static boolean isMutabilityModifier(String value) {
		return MUTABILITY_MODIFIERS.contains(value);
	}

	public static boolean isDataLocation(String value) {
		return DATA_LOCATIONS.contains(value);
	}

	public static boolean isBinaryOperator(String value) {
		return BINARY_OPERATORS.contains(value);
	}

	public static boolean isBooleanLiteral(String value) {
		return TRUE.equals(value) || FALSE.equals(value);
	}
}
