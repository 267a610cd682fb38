package vstrip.parser;

import vstrip.lexer.RustToken;
import vstrip.lexer.RustTokenType;
import vstrip.model.rust.RustAttribute;
import vstrip.util.SourceLocation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Token-level helpers shared by the layers of the Rust parser: expectations,
 * identifiers, attributes and raw token trees.
 */
abstract class AbstractRustParser {

	static final Set<String> RESERVED = new HashSet<>(Arrays.asList(
			"as", "async", "await", "break", "const", "continue", "dyn", "else", "enum", "extern", "false", "fn",
			"for", "if", "impl", "in", "let", "loop", "match", "mod", "move", "mut", "pub", "ref", "return",
			"static", "struct", "trait", "true", "type", "unsafe", "use", "where", "while"));

	/**
	 * Keywords that start a verification clause on a signature, loop or
	 * closure.
	 */
	static final Set<String> SPEC_CLAUSE_KEYWORDS = new HashSet<>(Arrays.asList(
			"requires", "ensures", "recommends", "invariant", "invariant_except_break", "invariant_ensures",
			"decreases", "opens_invariants", "no_unwind", "returns", "default_ensures", "when", "via"));

	final TokenStream tokens;

	AbstractRustParser(TokenStream tokens) {
		this.tokens = tokens;
	}

	ParseFailureException error(String expected) {
		RustToken found = tokens.peek();
		String description = found.getType() == RustTokenType.EOF
				? "expected " + expected + ", found end of file"
				: "expected " + expected + ", found `" + found.getValue() + "`";
		return new ParseFailureException(found.getLocation(), description);
	}

	SourceLocation locationFrom(RustToken start) {
		RustToken last = tokens.getLastConsumed();
		if (last == null) {
			return start.getLocation();
		}
		return start.getLocation().combine(last.getLocation());
	}

	RustToken expectPunct(String value) throws ParseFailureException {
		if (!tokens.isPunct(value)) {
			throw error("`" + value + "`");
		}
		return tokens.next();
	}

	void expectPunctPrefix(String value) throws ParseFailureException {
		if (!tokens.eatPunctPrefix(value)) {
			throw error("`" + value + "`");
		}
	}

	RustToken expectKeyword(String value) throws ParseFailureException {
		if (!tokens.isIdent(value)) {
			throw error("`" + value + "`");
		}
		return tokens.next();
	}

	boolean isIdentifier() {
		RustToken token = tokens.peek();
		return token.getType() == RustTokenType.IDENT && !RESERVED.contains(token.getValue());
	}

	boolean isIdentifier(int n) {
		RustToken token = tokens.peek(n);
		return token.getType() == RustTokenType.IDENT && !RESERVED.contains(token.getValue());
	}

	String parseIdentifier() throws ParseFailureException {
		if (!isIdentifier()) {
			throw error("identifier");
		}
		return tokens.next().getValue();
	}

	boolean isSpecClauseKeyword() {
		RustToken token = tokens.peek();
		return token.getType() == RustTokenType.IDENT && SPEC_CLAUSE_KEYWORDS.contains(token.getValue());
	}

	boolean isOuterAttributeStart() {
		return tokens.isType(RustTokenType.DOC_COMMENT) || (tokens.isPunct("#") && tokens.isPunct(1, "["));
	}

	boolean isInnerAttributeStart() {
		return tokens.isType(RustTokenType.INNER_DOC_COMMENT) ||
				(tokens.isPunct("#") && tokens.isPunct(1, "!") && tokens.isPunct(2, "["));
	}

	List<RustAttribute> parseOuterAttributes() throws ParseFailureException {
		List<RustAttribute> attributes = new ArrayList<>();
		while (isOuterAttributeStart()) {
			RustToken start = tokens.peek();
			if (start.getType() == RustTokenType.DOC_COMMENT) {
				tokens.next();
				attributes.add(new RustAttribute(start.getLocation(), false, start.getValue(), null,
						new ArrayList<>()));
			} else {
				tokens.next();
				tokens.next();
				attributes.add(parseAttributeBody(start, false));
			}
		}
		return attributes;
	}

	List<RustAttribute> parseInnerAttributes() throws ParseFailureException {
		List<RustAttribute> attributes = new ArrayList<>();
		while (isInnerAttributeStart()) {
			RustToken start = tokens.peek();
			if (start.getType() == RustTokenType.INNER_DOC_COMMENT) {
				tokens.next();
				attributes.add(new RustAttribute(start.getLocation(), true, start.getValue(), null,
						new ArrayList<>()));
			} else {
				tokens.next();
				tokens.next();
				tokens.next();
				attributes.add(parseAttributeBody(start, true));
			}
		}
		return attributes;
	}

	/**
	 * Parses the part of an attribute after its opening bracket: a path
	 * followed by arbitrary tokens up to the closing bracket.
	 */
	private RustAttribute parseAttributeBody(RustToken start, boolean inner) throws ParseFailureException {
		StringBuilder path = new StringBuilder();
		if (tokens.eatPunct("::")) {
			path.append("::");
		}
		if (!tokens.isType(RustTokenType.IDENT)) {
			throw error("attribute path");
		}
		path.append(tokens.next().getValue());
		while (tokens.isPunct("::")) {
			tokens.next();
			if (!tokens.isType(RustTokenType.IDENT)) {
				throw error("attribute path segment");
			}
			path.append("::").append(tokens.next().getValue());
		}
		List<RustToken> arguments = new ArrayList<>();
		while (!tokens.isPunct("]")) {
			if (tokens.isEOF()) {
				throw error("`]`");
			}
			readTokenTree(arguments);
		}
		tokens.next();
		return new RustAttribute(locationFrom(start), inner, null, path.toString(), arguments);
	}

	boolean isOpenDelimiter() {
		return tokens.isPunct("(") || tokens.isPunct("[") || tokens.isPunct("{");
	}

	private static String closerOf(String open) {
		switch (open) {
			case "(":
				return ")";
			case "[":
				return "]";
			default:
				return "}";
		}
	}

	/**
	 * Appends one token tree to out: either a single token, or a delimited
	 * group together with its delimiters.
	 */
	void readTokenTree(List<RustToken> out) throws ParseFailureException {
		RustToken token = tokens.peek();
		if (token.getType() == RustTokenType.EOF) {
			throw error("token");
		}
		if (token.isPunct(")") || token.isPunct("]") || token.isPunct("}")) {
			throw new ParseFailureException(token.getLocation(), "unexpected closing delimiter `" +
					token.getValue() + "`");
		}
		tokens.next();
		out.add(token);
		if (token.getType() == RustTokenType.PUNCT && (token.isPunct("(") || token.isPunct("[") ||
				token.isPunct("{"))) {
			String closer = closerOf(token.getValue());
			while (!tokens.isPunct(closer)) {
				if (tokens.isEOF()) {
					throw new ParseFailureException(token.getLocation(), "unclosed delimiter `" +
							token.getValue() + "`");
				}
				readTokenTree(out);
			}
			out.add(tokens.next());
		}
	}

	/**
	 * Reads a delimited group and returns the tokens between its delimiters.
	 */
	List<RustToken> readDelimitedTokens() throws ParseFailureException {
		if (!isOpenDelimiter()) {
			throw error("`(`, `[` or `{`");
		}
		List<RustToken> group = new ArrayList<>();
		readTokenTree(group);
		return new ArrayList<>(group.subList(1, group.size() - 1));
	}

}
