package vstrip.lexer;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import vstrip.parser.ParseFailureException;
import vstrip.util.SourceLocation;

/**
 * A Rust lexer that also knows the extra operators of the Verus dialect.
 *
 * Ordinary comments are dropped, doc comments are kept as their own tokens so
 * they can be re-emitted with the item they document. Multi-character
 * punctuation is matched longest first, so for example `==>` wins over `==`.
 * The parser splits `>>` and friends itself where generics need it.
 */
public class RustLexer {

	static final String[] PUNCTUATION = {
		// verification dialect operators
		"<==>",
		"=~~=",
		"!~~=",
		"==>",
		"<==",
		"===",
		"!==",
		"=~=",
		"!~=",
		"&&&",
		"|||",
		// three character operators
		"<<=",
		">>=",
		"...",
		"..=",
		// two character operators
		"::",
		"->",
		"=>",
		"==",
		"!=",
		"<=",
		">=",
		"&&",
		"||",
		"+=",
		"-=",
		"*=",
		"/=",
		"%=",
		"^=",
		"&=",
		"|=",
		"<<",
		">>",
		"..",
		// single characters
		"+",
		"-",
		"*",
		"/",
		"%",
		"^",
		"!",
		"&",
		"|",
		"=",
		"<",
		">",
		"@",
		".",
		",",
		";",
		":",
		"#",
		"$",
		"?",
		"~",
		"(",
		")",
		"[",
		"]",
		"{",
		"}",
	};

	static final Pattern IDENT = Pattern.compile("(?:r#)?[\\p{L}_][\\p{L}\\p{N}_]*");
	static final Pattern LIFETIME = Pattern.compile("'[\\p{L}_][\\p{L}\\p{N}_]*");

	static final Pattern NUMBER_PREFIXED = Pattern.compile("0(?:x[0-9a-fA-F_]+|o[0-7_]+|b[01_]+)[\\p{L}\\p{N}_]*");
	static final Pattern INTEGER = Pattern.compile("[0-9][0-9_]*");
	static final Pattern FRACTION = Pattern.compile("\\.[0-9][0-9_]*");
	static final Pattern EXPONENT = Pattern.compile("[eE][+-]?[0-9_]*[0-9][0-9_]*");
	static final Pattern SUFFIX = Pattern.compile("[\\p{L}_][\\p{L}\\p{N}_]*");

	static final Pattern RAW_STRING_START = Pattern.compile("(?:br|cr|r)(#*)\"");

	private final Path filename;
	private final CharSequence chars;

	private int index;
	private int line;
	private int column;

	public RustLexer(Path filename, CharSequence chars) {
		this.filename = filename;
		this.chars = chars;
	}

	private SourceLocation locationFrom(int startIndex, int startLine, int startColumn) {
		return new SourceLocation(filename, startIndex, index, startLine, line, startColumn, column);
	}

	private SourceLocation here() {
		return new SourceLocation(filename, index, index, line, line, column, column);
	}

	private void advance(int count) {
		for (int i = 0; i < count && index < chars.length(); i++) {
			if (chars.charAt(index) == '\n') {
				++line;
				column = 0;
			} else {
				++column;
			}
			++index;
		}
	}

	private char peek(int ahead) {
		int pos = index + ahead;
		return pos < chars.length() ? chars.charAt(pos) : '\0';
	}

	private boolean startsWith(String s) {
		return index + s.length() <= chars.length() && s.contentEquals(chars.subSequence(index, index + s.length()));
	}

	private Matcher lookingAt(Pattern pattern) {
		Matcher m = pattern.matcher(chars);
		m.region(index, chars.length());
		return m.lookingAt() ? m : null;
	}

	/**
	 * @return the tokens of the whole input, terminated by an EOF token
	 * @throws ParseFailureException if part of the input is not a Rust token
	 */
	public List<RustToken> readTokens() throws ParseFailureException {
		List<RustToken> tokens = new ArrayList<>();
		index = 0;
		line = 0;
		column = 0;

		// a shebang line is not Rust, but `#![attr]` on the first line is
		if (startsWith("#!") && !startsWith("#![")) {
			while (index < chars.length() && chars.charAt(index) != '\n') {
				advance(1);
			}
		}

		while (true) {
			skipWhitespaceAndComments(tokens);
			if (index >= chars.length()) {
				tokens.add(new RustToken("", RustTokenType.EOF, here()));
				return tokens;
			}
			tokens.add(readToken(tokens));
		}
	}

	private void skipWhitespaceAndComments(List<RustToken> tokens) throws ParseFailureException {
		while (index < chars.length()) {
			char c = chars.charAt(index);
			if (Character.isWhitespace(c)) {
				advance(1);
			} else if (startsWith("//")) {
				int startIndex = index;
				int startLine = line;
				int startColumn = column;
				while (index < chars.length() && chars.charAt(index) != '\n') {
					advance(1);
				}
				String text = chars.subSequence(startIndex, index).toString().stripTrailing();
				if (text.startsWith("///") && !text.startsWith("////")) {
					tokens.add(new RustToken(text, RustTokenType.DOC_COMMENT,
							locationFrom(startIndex, startLine, startColumn)));
				} else if (text.startsWith("//!")) {
					tokens.add(new RustToken(text, RustTokenType.INNER_DOC_COMMENT,
							locationFrom(startIndex, startLine, startColumn)));
				}
			} else if (startsWith("/*")) {
				readBlockComment(tokens);
			} else {
				return;
			}
		}
	}

	private void readBlockComment(List<RustToken> tokens) throws ParseFailureException {
		SourceLocation start = here();
		int startIndex = index;
		int startLine = line;
		int startColumn = column;
		int depth = 0;
		do {
			if (index >= chars.length()) {
				throw new ParseFailureException(start, "unterminated block comment");
			}
			if (startsWith("/*")) {
				++depth;
				advance(2);
			} else if (startsWith("*/")) {
				--depth;
				advance(2);
			} else {
				advance(1);
			}
		} while (depth > 0);
		String text = chars.subSequence(startIndex, index).toString();
		if (text.startsWith("/**") && !text.startsWith("/***") && !text.equals("/**/")) {
			tokens.add(new RustToken(text, RustTokenType.DOC_COMMENT, locationFrom(startIndex, startLine, startColumn)));
		} else if (text.startsWith("/*!")) {
			tokens.add(new RustToken(text, RustTokenType.INNER_DOC_COMMENT,
					locationFrom(startIndex, startLine, startColumn)));
		}
	}

	private RustToken readToken(List<RustToken> tokensSoFar) throws ParseFailureException {
		int startIndex = index;
		int startLine = line;
		int startColumn = column;
		char c = chars.charAt(index);

		// literals with a prefix must be tried before identifiers
		Matcher m = lookingAt(RAW_STRING_START);
		if (m != null) {
			readRawString(m.group(1).length(), m.end() - index);
			return new RustToken(chars.subSequence(startIndex, index).toString(), RustTokenType.STRING,
					locationFrom(startIndex, startLine, startColumn));
		}
		if ((c == 'b' || c == 'c') && peek(1) == '"') {
			advance(1);
			readQuoted('"');
			return new RustToken(chars.subSequence(startIndex, index).toString(), RustTokenType.STRING,
					locationFrom(startIndex, startLine, startColumn));
		}
		if (c == 'b' && peek(1) == '\'') {
			advance(1);
			readQuoted('\'');
			return new RustToken(chars.subSequence(startIndex, index).toString(), RustTokenType.CHAR,
					locationFrom(startIndex, startLine, startColumn));
		}

		m = lookingAt(IDENT);
		if (m != null) {
			advance(m.end() - index);
			return new RustToken(m.group(), RustTokenType.IDENT, locationFrom(startIndex, startLine, startColumn));
		}

		if (Character.isDigit(c)) {
			return readNumber(tokensSoFar, startIndex, startLine, startColumn);
		}

		if (c == '"') {
			readQuoted('"');
			return new RustToken(chars.subSequence(startIndex, index).toString(), RustTokenType.STRING,
					locationFrom(startIndex, startLine, startColumn));
		}

		if (c == '\'') {
			// 'a' and '\n' are characters, 'a and 'static are lifetimes
			boolean isChar = peek(1) == '\\' || peek(2) == '\'';
			if (!isChar) {
				m = lookingAt(LIFETIME);
				if (m != null) {
					advance(m.end() - index);
					return new RustToken(m.group(), RustTokenType.LIFETIME,
							locationFrom(startIndex, startLine, startColumn));
				}
			}
			readQuoted('\'');
			return new RustToken(chars.subSequence(startIndex, index).toString(), RustTokenType.CHAR,
					locationFrom(startIndex, startLine, startColumn));
		}

		for (String punct : PUNCTUATION) {
			if (startsWith(punct)) {
				advance(punct.length());
				return new RustToken(punct, RustTokenType.PUNCT, locationFrom(startIndex, startLine, startColumn));
			}
		}

		throw new ParseFailureException(here(), "unexpected character '" + c + "'");
	}

	private RustToken readNumber(List<RustToken> tokensSoFar, int startIndex, int startLine, int startColumn) {
		Matcher m = lookingAt(NUMBER_PREFIXED);
		if (m != null) {
			advance(m.end() - index);
			return new RustToken(m.group(), RustTokenType.INTEGER, locationFrom(startIndex, startLine, startColumn));
		}
		m = lookingAt(INTEGER);
		advance(m.end() - index);
		boolean isFloat = false;
		// in `t.0.1` the indices are integers, never the float `0.1`
		boolean afterDot = !tokensSoFar.isEmpty() && tokensSoFar.get(tokensSoFar.size() - 1).isPunct(".");
		if (!afterDot && peek(0) == '.') {
			m = lookingAt(FRACTION);
			if (m != null) {
				advance(m.end() - index);
				isFloat = true;
			} else if (peek(1) != '.' && !Character.isLetter(peek(1)) && peek(1) != '_') {
				// `1.` is a float on its own
				advance(1);
				isFloat = true;
			}
		}
		if (!afterDot) {
			m = lookingAt(EXPONENT);
			if (m != null) {
				advance(m.end() - index);
				isFloat = true;
			}
		}
		m = lookingAt(SUFFIX);
		if (m != null) {
			if (m.group().startsWith("f")) {
				isFloat = true;
			}
			advance(m.end() - index);
		}
		return new RustToken(chars.subSequence(startIndex, index).toString(),
				isFloat ? RustTokenType.FLOAT : RustTokenType.INTEGER,
				locationFrom(startIndex, startLine, startColumn));
	}

	private void readQuoted(char quote) throws ParseFailureException {
		SourceLocation start = here();
		advance(1);
		while (true) {
			if (index >= chars.length()) {
				throw new ParseFailureException(start, quote == '"' ? "unterminated string literal"
						: "unterminated character literal");
			}
			char c = chars.charAt(index);
			if (c == '\\') {
				advance(2);
			} else if (c == quote) {
				advance(1);
				break;
			} else if (quote == '\'' && c == '\n') {
				throw new ParseFailureException(start, "unterminated character literal");
			} else {
				advance(1);
			}
		}
		// literal suffixes such as "abc"suffix are legal tokens
		Matcher m = lookingAt(SUFFIX);
		if (m != null) {
			advance(m.end() - index);
		}
	}

	private void readRawString(int hashes, int prefixLength) throws ParseFailureException {
		SourceLocation start = here();
		advance(prefixLength);
		String terminator = "\"" + "#".repeat(hashes);
		while (!startsWith(terminator)) {
			if (index >= chars.length()) {
				throw new ParseFailureException(start, "unterminated raw string literal");
			}
			advance(1);
		}
		advance(terminator.length());
	}
}
