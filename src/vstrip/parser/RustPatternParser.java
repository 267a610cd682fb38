package vstrip.parser;

import vstrip.lexer.RustToken;
import vstrip.lexer.RustTokenType;
import vstrip.model.rust.*;

import java.util.ArrayList;
import java.util.List;

abstract class RustPatternParser extends RustTypeParser {

	RustPatternParser(TokenStream tokens) {
		super(tokens);
	}

	/**
	 * Parses a pattern including top-level alternatives `A | B`.
	 */
	RustPattern parsePattern() throws ParseFailureException {
		RustToken start = tokens.peek();
		tokens.eatPunct("|");
		RustPattern first = parsePatternNoAlternatives();
		if (!tokens.isPunct("|")) {
			return first;
		}
		List<RustPattern> alternatives = new ArrayList<>();
		alternatives.add(first);
		while (tokens.eatPunct("|")) {
			alternatives.add(parsePatternNoAlternatives());
		}
		return new RustOrPattern(locationFrom(start), alternatives);
	}

	private boolean isRangeOperator() {
		return tokens.isPunct("..=") || tokens.isPunct("...") || tokens.isPunct("..");
	}

	private boolean isRangeEndStart() {
		return tokens.peek().isLiteral() || tokens.isPunct("-") || isPathStart();
	}

	private RustPattern parseRangeEnd() throws ParseFailureException {
		RustToken start = tokens.peek();
		if (tokens.peek().isLiteral() || tokens.isPunct("-")) {
			return parseLiteralPattern();
		}
		return new RustPathPattern(locationFrom(start), parseExpressionPath());
	}

	private RustPattern parseLiteralPattern() throws ParseFailureException {
		RustToken start = tokens.peek();
		String prefix = "";
		if (tokens.eatPunct("-")) {
			prefix = "-";
		}
		if (!tokens.peek().isLiteral()) {
			throw error("literal");
		}
		String value = prefix + tokens.next().getValue();
		return new RustLiteralPattern(locationFrom(start), value);
	}

	private RustPattern maybeRange(RustToken start, RustPattern lower) throws ParseFailureException {
		if (!isRangeOperator()) {
			return lower;
		}
		String operator = tokens.next().getValue();
		RustPattern upper = null;
		if (isRangeEndStart()) {
			upper = parseRangeEnd();
		}
		return new RustRangePattern(locationFrom(start), lower, operator, upper);
	}

	private List<RustPattern> parsePatternList(String closer) throws ParseFailureException {
		List<RustPattern> elements = new ArrayList<>();
		while (!tokens.isPunct(closer)) {
			elements.add(parsePattern());
			if (!tokens.eatPunct(",")) {
				break;
			}
		}
		expectPunct(closer);
		return elements;
	}

	RustPattern parsePatternNoAlternatives() throws ParseFailureException {
		RustToken start = tokens.peek();
		if (tokens.isIdent("_")) {
			tokens.next();
			return new RustWildcardPattern(locationFrom(start));
		}
		if (tokens.isPunct("..=") || tokens.isPunct("...")) {
			String operator = tokens.next().getValue();
			RustPattern upper = parseRangeEnd();
			return new RustRangePattern(locationFrom(start), null, operator, upper);
		}
		if (tokens.isPunct("..")) {
			tokens.next();
			return new RustRestPattern(locationFrom(start));
		}
		if (tokens.isPunctPrefix("&") && !tokens.isPunct("&=")) {
			tokens.eatPunctPrefix("&");
			boolean mutable = tokens.eatIdent("mut");
			RustPattern pattern = parsePatternNoAlternatives();
			return new RustReferencePattern(locationFrom(start), mutable, pattern);
		}
		if (tokens.eatPunct("(")) {
			List<RustPattern> elements = new ArrayList<>();
			boolean trailingComma = false;
			while (!tokens.isPunct(")")) {
				elements.add(parsePattern());
				trailingComma = tokens.eatPunct(",");
				if (!trailingComma) {
					break;
				}
			}
			expectPunct(")");
			if (elements.size() == 1 && !trailingComma && !(elements.get(0) instanceof RustRestPattern)) {
				return new RustParenthesizedPattern(locationFrom(start), elements.get(0));
			}
			return new RustTuplePattern(locationFrom(start), elements);
		}
		if (tokens.eatPunct("[")) {
			List<RustPattern> elements = parsePatternList("]");
			return new RustSlicePattern(locationFrom(start), elements);
		}
		if (tokens.peek().isLiteral() || tokens.isPunct("-")) {
			return maybeRange(start, parseLiteralPattern());
		}
		if (tokens.isIdent("true") || tokens.isIdent("false")) {
			return new RustLiteralPattern(locationFrom(start), tokens.next().getValue());
		}
		if (tokens.isIdent("ref") || tokens.isIdent("mut")) {
			boolean byRef = tokens.eatIdent("ref");
			boolean mutable = tokens.eatIdent("mut");
			String name = parseIdentifier();
			return finishIdentPattern(start, byRef, mutable, name);
		}
		if (isPathStart()) {
			boolean simple = isIdentifier() && !tokens.isPunct(1, "::") && !tokens.isPunct(1, "(") &&
					!tokens.isPunct(1, "{") && !tokens.isPunct(1, "!");
			if (simple && !isRangeFollowing()) {
				String name = tokens.next().getValue();
				return finishIdentPattern(start, false, false, name);
			}
			RustPath path = parseExpressionPath();
			if (tokens.isPunct("!")) {
				throw new ParseFailureException(tokens.peek().getLocation(), "macro invocations in patterns are " +
						"not supported");
			}
			if (tokens.eatPunct("(")) {
				List<RustPattern> elements = parsePatternList(")");
				return new RustTupleStructPattern(locationFrom(start), path, elements);
			}
			if (tokens.isPunct("{")) {
				return parseStructPattern(start, path);
			}
			return maybeRange(start, new RustPathPattern(locationFrom(start), path));
		}
		throw error("pattern");
	}

	private boolean isRangeFollowing() {
		return tokens.isPunct(1, "..=") || tokens.isPunct(1, "...") ||
				(tokens.isPunct(1, "..") && tokens.peek(2).getType() != RustTokenType.PUNCT);
	}

	private RustPattern finishIdentPattern(RustToken start, boolean byRef, boolean mutable, String name)
			throws ParseFailureException {
		RustPattern subpattern = null;
		if (tokens.eatPunct("@")) {
			subpattern = parsePatternNoAlternatives();
		}
		return new RustIdentPattern(locationFrom(start), byRef, mutable, name, subpattern);
	}

	private RustPattern parseStructPattern(RustToken start, RustPath path) throws ParseFailureException {
		expectPunct("{");
		List<RustFieldPattern> fields = new ArrayList<>();
		boolean rest = false;
		while (!tokens.isPunct("}")) {
			if (tokens.eatPunct("..")) {
				rest = true;
				break;
			}
			RustToken fieldStart = tokens.peek();
			if ((isIdentifier() || tokens.isType(RustTokenType.INTEGER)) && tokens.isPunct(1, ":")) {
				String name = tokens.next().getValue();
				tokens.next();
				RustPattern pattern = parsePattern();
				fields.add(new RustFieldPattern(locationFrom(fieldStart), name, pattern, false));
			} else {
				boolean byRef = tokens.eatIdent("ref");
				boolean mutable = tokens.eatIdent("mut");
				String name = parseIdentifier();
				RustPattern pattern = new RustIdentPattern(locationFrom(fieldStart), byRef, mutable, name, null);
				fields.add(new RustFieldPattern(locationFrom(fieldStart), name, pattern, true));
			}
			if (!tokens.eatPunct(",")) {
				break;
			}
		}
		expectPunct("}");
		return new RustStructPattern(locationFrom(start), path, fields, rest);
	}

}
