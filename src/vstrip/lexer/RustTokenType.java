package vstrip.lexer;

public enum RustTokenType {
	IDENT,
	LIFETIME,
	INTEGER,
	FLOAT,
	// string literals of every flavour: plain, raw, byte and C strings
	STRING,
	// character and byte literals
	CHAR,
	PUNCT,
	// `///` and `/** */`, attached to the following item
	DOC_COMMENT,
	// `//!` and `/*! */`, attached to the enclosing module or file
	INNER_DOC_COMMENT,
	EOF,
}
