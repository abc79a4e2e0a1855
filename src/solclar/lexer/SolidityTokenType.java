package solclar.lexer;

public enum SolidityTokenType {
	STRING,
	IDENT,
	NUMBER,
	// keywords, punctuation and operators
	BUILTIN,
	// always the last token, so the parser never has to check for running off the end
	EOF,
}
