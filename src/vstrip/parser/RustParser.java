package vstrip.parser;

import vstrip.lexer.RustLexer;
import vstrip.model.rust.RustExpression;
import vstrip.model.rust.RustSourceUnit;

import java.nio.file.Path;

/**
 * Entry points into the Rust parser.
 */
public final class RustParser {

	private RustParser() {}

	private static RustItemParser parserFor(Path filename, CharSequence chars) throws ParseFailureException {
		RustLexer lexer = new RustLexer(filename, chars);
		return new RustItemParser(new TokenStream(lexer.readTokens()));
	}

	public static RustSourceUnit readSourceUnit(Path filename, CharSequence chars) throws ParseFailureException {
		return parserFor(filename, chars).parseSourceUnit();
	}

	/**
	 * Reads a single expression that spans all of chars.
	 */
	public static RustExpression readExpression(Path filename, CharSequence chars) throws ParseFailureException {
		RustItemParser parser = parserFor(filename, chars);
		RustExpression expression = parser.parseExpression();
		if (!parser.tokens.isEOF()) {
			throw parser.error("end of expression");
		}
		return expression;
	}

}
