package vstrip.parser;

import vstrip.lexer.RustToken;
import vstrip.lexer.RustTokenType;
import vstrip.model.rust.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Items and source units. This is the top of the parser stack.
 */
class RustItemParser extends RustExpressionParser {

	private static final Set<String> PUBLISH_QUALIFIERS = new HashSet<>(Arrays.asList(
			"open", "closed", "uninterp"));
	private static final Set<String> ITEM_KEYWORDS = new HashSet<>(Arrays.asList(
			"fn", "struct", "enum", "impl", "trait", "const", "static", "type", "mod", "use"));

	RustItemParser(TokenStream tokens) {
		super(tokens);
	}

	RustSourceUnit parseSourceUnit() throws ParseFailureException {
		RustToken start = tokens.peek();
		List<RustAttribute> innerAttributes = parseInnerAttributes();
		List<RustItem> items = parseItemsUntil(null);
		if (!tokens.isEOF()) {
			throw error("item");
		}
		return new RustSourceUnit(locationFrom(start), innerAttributes, items);
	}

	/**
	 * Parses items up to closer, or to the end of file when closer is null.
	 * The closer itself is not consumed.
	 */
	private List<RustItem> parseItemsUntil(String closer) throws ParseFailureException {
		List<RustItem> items = new ArrayList<>();
		while (true) {
			while (tokens.eatPunct(";")) {
				// stray semicolons between items
			}
			if (tokens.isEOF() || (closer != null && tokens.isPunct(closer))) {
				return items;
			}
			List<RustAttribute> attributes = parseOuterAttributes();
			items.add(parseMember(attributes));
		}
	}

	private boolean isMacroItemStart() {
		int n = 0;
		if (tokens.isPunct("::")) {
			n++;
		}
		while (isIdentifier(n) && tokens.isPunct(n + 1, "::")) {
			n += 2;
		}
		return isIdentifier(n) && tokens.isPunct(n + 1, "!");
	}

	private RustItem parseMember(List<RustAttribute> attributes) throws ParseFailureException {
		if (isItemStart()) {
			return parseItem(attributes);
		}
		if (isMacroItemStart()) {
			return parseMacroItem(attributes);
		}
		throw error("item");
	}

	/**
	 * Skips visibility and qualifier words without consuming anything.
	 *
	 * @return the lookahead index of the word that determines the item kind
	 */
	private int skipItemPrefix() {
		int n = 0;
		if (tokens.isIdent(n, "pub")) {
			n++;
			if (tokens.isPunct(n, "(")) {
				while (!tokens.isPunct(n, ")") && tokens.peek(n).getType() != RustTokenType.EOF) {
					n++;
				}
				n++;
			}
		}
		while (true) {
			RustToken token = tokens.peek(n);
			if (token.getType() != RustTokenType.IDENT) {
				return n;
			}
			String word = token.getValue();
			if (PUBLISH_QUALIFIERS.contains(word) || word.equals("proof") || word.equals("exec") ||
					word.equals("axiom") || word.equals("async") || word.equals("default")) {
				n++;
			} else if (word.equals("broadcast") && !tokens.isIdent(n + 1, "use") &&
					!tokens.isIdent(n + 1, "group")) {
				n++;
			} else if (word.equals("spec")) {
				n++;
				if (tokens.isPunct(n, "(") && tokens.isIdent(n + 1, "checked") && tokens.isPunct(n + 2, ")")) {
					n += 3;
				}
			} else if (word.equals("unsafe") && !tokens.isPunct(n + 1, "{")) {
				n++;
			} else if (word.equals("const") && (tokens.isIdent(n + 1, "fn") || tokens.isIdent(n + 1, "unsafe") ||
					tokens.isIdent(n + 1, "async") || tokens.isIdent(n + 1, "extern"))) {
				n++;
			} else if (word.equals("extern") && tokens.peek(n + 1).getType() == RustTokenType.STRING &&
					tokens.isIdent(n + 2, "fn")) {
				n += 2;
			} else if (word.equals("extern") && tokens.isIdent(n + 1, "fn")) {
				n++;
			} else {
				return n;
			}
		}
	}

	@Override
	boolean isItemStart() {
		int n = skipItemPrefix();
		RustToken token = tokens.peek(n);
		if (token.getType() != RustTokenType.IDENT) {
			return false;
		}
		String word = token.getValue();
		if (word.equals("const")) {
			return !tokens.isPunct(n + 1, "{");
		}
		if (word.equals("static")) {
			return isIdentifier(n + 1) || tokens.isIdent(n + 1, "mut");
		}
		if (ITEM_KEYWORDS.contains(word)) {
			return true;
		}
		switch (word) {
			case "extern":
				return tokens.isIdent(n + 1, "crate") || tokens.isPunct(n + 1, "{") ||
						(tokens.peek(n + 1).getType() == RustTokenType.STRING && tokens.isPunct(n + 2, "{"));
			case "union":
				return isIdentifier(n + 1);
			case "auto":
				return tokens.isIdent(n + 1, "trait");
			case "broadcast":
				return tokens.isIdent(n + 1, "use") || tokens.isIdent(n + 1, "group");
			case "macro_rules":
				return tokens.isPunct(n + 1, "!");
			default:
				return false;
		}
	}

	private String parseVisibility() throws ParseFailureException {
		if (!tokens.eatIdent("pub")) {
			return "";
		}
		if (!tokens.isPunct("(")) {
			return "pub";
		}
		if (tokens.isIdent(1, "crate") || tokens.isIdent(1, "self") || tokens.isIdent(1, "super")) {
			tokens.next();
			String scope = tokens.next().getValue();
			expectPunct(")");
			return "pub(" + scope + ")";
		}
		if (tokens.isIdent(1, "in")) {
			tokens.next();
			tokens.next();
			RustPath path = parseTypePath();
			expectPunct(")");
			return "pub(in " + path + ")";
		}
		return "pub";
	}

	@Override
	RustItem parseItem(List<RustAttribute> attributes) throws ParseFailureException {
		RustToken start = tokens.peek();
		String visibility = parseVisibility();
		List<String> modeQualifiers = new ArrayList<>();
		List<String> qualifiers = new ArrayList<>();
		RustFunctionMode mode = RustFunctionMode.DEFAULT;
		while (true) {
			if (PUBLISH_QUALIFIERS.contains(tokens.peek().getValue()) && tokens.isType(RustTokenType.IDENT)) {
				modeQualifiers.add(tokens.next().getValue());
			} else if (tokens.isIdent("broadcast") && !tokens.isIdent(1, "use") && !tokens.isIdent(1, "group")) {
				modeQualifiers.add(tokens.next().getValue());
			} else if (tokens.isIdent("spec")) {
				tokens.next();
				mode = RustFunctionMode.SPEC;
				if (tokens.isPunct("(") && tokens.isIdent(1, "checked") && tokens.isPunct(2, ")")) {
					tokens.next();
					tokens.next();
					tokens.next();
					mode = RustFunctionMode.SPEC_CHECKED;
				}
			} else if (tokens.eatIdent("proof")) {
				mode = RustFunctionMode.PROOF;
			} else if (tokens.eatIdent("exec")) {
				mode = RustFunctionMode.EXEC;
			} else if (tokens.eatIdent("axiom")) {
				mode = RustFunctionMode.PROOF_AXIOM;
			} else if (tokens.isIdent("const") && (tokens.isIdent(1, "fn") || tokens.isIdent(1, "unsafe") ||
					tokens.isIdent(1, "async") || tokens.isIdent(1, "extern"))) {
				qualifiers.add(tokens.next().getValue());
			} else if (tokens.isIdent("async") || tokens.isIdent("default")) {
				qualifiers.add(tokens.next().getValue());
			} else if (tokens.isIdent("unsafe") && (tokens.isIdent(1, "fn") || (tokens.isIdent(1, "extern") &&
					(tokens.isIdent(2, "fn") || tokens.isIdent(3, "fn"))))) {
				qualifiers.add(tokens.next().getValue());
			} else if (tokens.isIdent("extern") && tokens.peek(1).getType() == RustTokenType.STRING &&
					tokens.isIdent(2, "fn")) {
				tokens.next();
				qualifiers.add("extern " + tokens.next().getValue());
			} else if (tokens.isIdent("extern") && tokens.isIdent(1, "fn")) {
				qualifiers.add(tokens.next().getValue());
			} else {
				break;
			}
		}

		if (tokens.isIdent("fn")) {
			return parseFunction(start, attributes, visibility, qualifiers, mode, modeQualifiers);
		}
		if (tokens.isIdent("const") || tokens.isIdent("static")) {
			return parseConst(start, attributes, visibility, mode, modeQualifiers);
		}
		if (mode != RustFunctionMode.DEFAULT || !modeQualifiers.isEmpty() || !qualifiers.isEmpty()) {
			throw error("`fn` or `const`");
		}
		boolean unsafe = tokens.eatIdent("unsafe");
		RustToken keyword = tokens.peek();
		switch (keyword.getValue()) {
			case "struct":
				return parseStruct(start, attributes, visibility);
			case "enum":
				return parseEnum(start, attributes, visibility);
			case "impl":
				return parseImpl(start, attributes, visibility, unsafe);
			case "trait":
			case "auto":
				return parseTrait(start, attributes, visibility, unsafe);
			case "type":
				return parseTypeAlias(start, attributes, visibility);
			case "mod":
				return parseModule(start, attributes, visibility, unsafe);
			case "use":
				return parseUse(start, attributes, visibility, false);
			case "broadcast":
				tokens.next();
				if (tokens.isIdent("use")) {
					return parseUse(start, attributes, visibility, true);
				}
				return parseBroadcastGroup(start, attributes, visibility);
			case "macro_rules":
				return parseMacroItem(attributes);
			case "extern":
			case "union":
				return parseVerbatimItem(start, attributes, visibility, unsafe);
			default:
				throw error("item");
		}
	}

	private RustItem parseFunction(RustToken start, List<RustAttribute> attributes, String visibility,
	                               List<String> qualifiers, RustFunctionMode mode, List<String> modeQualifiers)
			throws ParseFailureException {
		expectKeyword("fn");
		String name = parseIdentifier();
		List<RustGenericParam> generics = parseGenericParams();
		expectPunct("(");
		List<RustParam> params = new ArrayList<>();
		while (!tokens.isPunct(")")) {
			params.add(parseParam());
			if (!tokens.eatPunct(",")) {
				break;
			}
		}
		expectPunct(")");
		RustReturnType returnType = null;
		if (tokens.eatPunct("->")) {
			returnType = parseReturnType();
		}
		String proofStrategy = null;
		if (tokens.isIdent("by") && tokens.isPunct(1, "(")) {
			tokens.next();
			tokens.next();
			proofStrategy = parseIdentifier();
			expectPunct(")");
		}
		List<RustWherePredicate> whereClause = parseWhereClause();
		List<RustSpecClause> specClauses = parseSpecClauses();
		RustBlock body = null;
		if (!tokens.eatPunct(";")) {
			body = parseBlock();
		}
		return new RustFunction(locationFrom(start), attributes, visibility, qualifiers, mode, modeQualifiers, name,
				generics, params, returnType, proofStrategy, whereClause, specClauses, body);
	}

	/**
	 * @return the number of tokens making up a `self` receiver at the current
	 * position, or 0 when there is none
	 */
	private int receiverLength() {
		int n = 0;
		if (tokens.isPunct("&")) {
			n++;
			if (tokens.peek(n).getType() == RustTokenType.LIFETIME) {
				n++;
			}
		}
		if (tokens.isIdent(n, "mut")) {
			n++;
		}
		if (!tokens.isIdent(n, "self")) {
			return 0;
		}
		n++;
		if (tokens.isPunct(n, ":")) {
			return 0;
		}
		return n;
	}

	private RustParam parseParam() throws ParseFailureException {
		RustToken start = tokens.peek();
		List<RustAttribute> attributes = parseOuterAttributes();
		int receiver = receiverLength();
		if (receiver > 0) {
			StringBuilder text = new StringBuilder();
			for (int i = 0; i < receiver; i++) {
				RustToken token = tokens.next();
				text.append(token.getValue());
				if (token.getType() != RustTokenType.PUNCT) {
					text.append(" ");
				}
			}
			return new RustParam(locationFrom(start), attributes, RustDataMode.DEFAULT, text.toString().trim(), null,
					null);
		}
		RustDataMode mode = parseParamMode();
		RustPattern pattern = parsePatternNoAlternatives();
		expectPunct(":");
		RustType type = parseType();
		return new RustParam(locationFrom(start), attributes, mode, null, pattern, type);
	}

	private RustItem parseConst(RustToken start, List<RustAttribute> attributes, String visibility,
	                            RustFunctionMode mode, List<String> modeQualifiers) throws ParseFailureException {
		String keyword = tokens.next().getValue();
		boolean mutable = keyword.equals("static") && tokens.eatIdent("mut");
		String name;
		if (tokens.isIdent("_")) {
			name = tokens.next().getValue();
		} else {
			name = parseIdentifier();
		}
		expectPunct(":");
		RustType type = parseType();
		RustExpression value = null;
		if (tokens.eatPunct("=")) {
			value = parseExpressionAllowingStructs();
		}
		expectPunct(";");
		return new RustConst(locationFrom(start), attributes, visibility, mode, modeQualifiers, keyword, mutable,
				name, type, value);
	}

	private RustField parseField(boolean named) throws ParseFailureException {
		RustToken start = tokens.peek();
		List<RustAttribute> attributes = parseOuterAttributes();
		String visibility = parseVisibility();
		RustDataMode mode = RustDataMode.DEFAULT;
		if (tokens.isIdent("ghost") || tokens.isIdent("tracked")) {
			boolean isMode = named
					? isIdentifier(1) && tokens.isPunct(2, ":")
					: !tokens.isPunct(1, ",") && !tokens.isPunct(1, ")") && !tokens.isPunct(1, "::") &&
					!tokens.isPunct(1, "<");
			if (isMode) {
				mode = tokens.next().isIdent("ghost") ? RustDataMode.GHOST : RustDataMode.TRACKED;
			}
		}
		String name = null;
		if (named) {
			name = parseIdentifier();
			expectPunct(":");
		}
		RustType type = parseType();
		return new RustField(locationFrom(start), attributes, visibility, mode, name, type);
	}

	private List<RustField> parseFields(RustFieldsStyle style) throws ParseFailureException {
		List<RustField> fields = new ArrayList<>();
		if (style == RustFieldsStyle.UNIT) {
			return fields;
		}
		boolean named = style == RustFieldsStyle.NAMED;
		String closer = named ? "}" : ")";
		expectPunct(named ? "{" : "(");
		while (!tokens.isPunct(closer)) {
			fields.add(parseField(named));
			if (!tokens.eatPunct(",")) {
				break;
			}
		}
		expectPunct(closer);
		return fields;
	}

	private RustItem parseStruct(RustToken start, List<RustAttribute> attributes, String visibility)
			throws ParseFailureException {
		expectKeyword("struct");
		String name = parseIdentifier();
		List<RustGenericParam> generics = parseGenericParams();
		List<RustWherePredicate> whereClause = parseWhereClause();
		if (tokens.isPunct("{")) {
			List<RustField> fields = parseFields(RustFieldsStyle.NAMED);
			return new RustStruct(locationFrom(start), attributes, visibility, name, generics, whereClause,
					RustFieldsStyle.NAMED, fields);
		}
		if (tokens.isPunct("(")) {
			List<RustField> fields = parseFields(RustFieldsStyle.TUPLE);
			whereClause = parseWhereClause();
			expectPunct(";");
			return new RustStruct(locationFrom(start), attributes, visibility, name, generics, whereClause,
					RustFieldsStyle.TUPLE, fields);
		}
		expectPunct(";");
		return new RustStruct(locationFrom(start), attributes, visibility, name, generics, whereClause,
				RustFieldsStyle.UNIT, Collections.emptyList());
	}

	private RustItem parseEnum(RustToken start, List<RustAttribute> attributes, String visibility)
			throws ParseFailureException {
		expectKeyword("enum");
		String name = parseIdentifier();
		List<RustGenericParam> generics = parseGenericParams();
		List<RustWherePredicate> whereClause = parseWhereClause();
		expectPunct("{");
		List<RustVariant> variants = new ArrayList<>();
		while (!tokens.isPunct("}")) {
			RustToken variantStart = tokens.peek();
			List<RustAttribute> variantAttributes = parseOuterAttributes();
			String variantName = parseIdentifier();
			RustFieldsStyle style = RustFieldsStyle.UNIT;
			if (tokens.isPunct("{")) {
				style = RustFieldsStyle.NAMED;
			} else if (tokens.isPunct("(")) {
				style = RustFieldsStyle.TUPLE;
			}
			List<RustField> fields = parseFields(style);
			RustExpression discriminant = null;
			if (tokens.eatPunct("=")) {
				discriminant = parseExpressionAllowingStructs();
			}
			variants.add(new RustVariant(locationFrom(variantStart), variantAttributes, variantName, style, fields,
					discriminant));
			if (!tokens.eatPunct(",")) {
				break;
			}
		}
		expectPunct("}");
		return new RustEnum(locationFrom(start), attributes, visibility, name, generics, whereClause, variants);
	}

	private List<RustItem> parseMemberBlock() throws ParseFailureException {
		expectPunct("{");
		if (isInnerAttributeStart()) {
			throw new ParseFailureException(tokens.peek().getLocation(), "inner attributes in impl and trait " +
					"blocks are not supported");
		}
		List<RustItem> items = parseItemsUntil("}");
		expectPunct("}");
		return items;
	}

	private RustItem parseImpl(RustToken start, List<RustAttribute> attributes, String visibility, boolean unsafe)
			throws ParseFailureException {
		expectKeyword("impl");
		List<RustGenericParam> generics = parseGenericParams();
		boolean negative = tokens.eatPunct("!");
		RustType first = parseTypeNoBounds();
		RustType trait = null;
		RustType selfType = first;
		if (tokens.eatIdent("for")) {
			trait = first;
			selfType = parseTypeNoBounds();
		} else if (negative) {
			throw error("`for`");
		}
		List<RustWherePredicate> whereClause = parseWhereClause();
		List<RustItem> items = parseMemberBlock();
		return new RustImpl(locationFrom(start), attributes, visibility, unsafe, generics, negative, trait, selfType,
				whereClause, items);
	}

	private RustItem parseTrait(RustToken start, List<RustAttribute> attributes, String visibility, boolean unsafe)
			throws ParseFailureException {
		boolean auto = tokens.eatIdent("auto");
		expectKeyword("trait");
		String name = parseIdentifier();
		List<RustGenericParam> generics = parseGenericParams();
		List<RustBound> supertraits = new ArrayList<>();
		if (tokens.eatPunct(":") && !tokens.isPunct("{") && !tokens.isIdent("where")) {
			supertraits = parseBounds();
		}
		List<RustWherePredicate> whereClause = parseWhereClause();
		List<RustItem> items = parseMemberBlock();
		return new RustTrait(locationFrom(start), attributes, visibility, unsafe, auto, name, generics, supertraits,
				whereClause, items);
	}

	private RustItem parseTypeAlias(RustToken start, List<RustAttribute> attributes, String visibility)
			throws ParseFailureException {
		expectKeyword("type");
		String name = parseIdentifier();
		List<RustGenericParam> generics = parseGenericParams();
		List<RustBound> bounds = new ArrayList<>();
		if (tokens.eatPunct(":")) {
			bounds = parseBounds();
		}
		List<RustWherePredicate> whereClause = parseWhereClause();
		RustType type = null;
		if (tokens.eatPunct("=")) {
			type = parseType();
		}
		expectPunct(";");
		return new RustTypeAlias(locationFrom(start), attributes, visibility, name, generics, bounds, whereClause,
				type);
	}

	private RustItem parseModule(RustToken start, List<RustAttribute> attributes, String visibility,
	                             boolean unsafe) throws ParseFailureException {
		expectKeyword("mod");
		String name = parseIdentifier();
		if (tokens.eatPunct(";")) {
			return new RustModule(locationFrom(start), attributes, visibility, unsafe, name, Collections.emptyList(),
					null);
		}
		expectPunct("{");
		List<RustAttribute> innerAttributes = parseInnerAttributes();
		List<RustItem> items = parseItemsUntil("}");
		expectPunct("}");
		return new RustModule(locationFrom(start), attributes, visibility, unsafe, name, innerAttributes, items);
	}

	private String parseUseName() throws ParseFailureException {
		if (tokens.isIdent("self") || tokens.isIdent("super") || tokens.isIdent("crate") || tokens.isIdent("Self")) {
			return tokens.next().getValue();
		}
		return parseIdentifier();
	}

	private RustUseTree parseUseTree() throws ParseFailureException {
		RustToken start = tokens.peek();
		if (tokens.eatPunct("*")) {
			return new RustUseTree(locationFrom(start), RustUseTree.Kind.GLOB, null, null, null,
					Collections.emptyList());
		}
		if (tokens.isPunct("{")) {
			tokens.next();
			List<RustUseTree> group = new ArrayList<>();
			while (!tokens.isPunct("}")) {
				group.add(parseUseTree());
				if (!tokens.eatPunct(",")) {
					break;
				}
			}
			expectPunct("}");
			return new RustUseTree(locationFrom(start), RustUseTree.Kind.GROUP, null, null, null, group);
		}
		if (tokens.eatPunct("::")) {
			RustUseTree child = parseUseTree();
			return new RustUseTree(locationFrom(start), RustUseTree.Kind.PATH, "", null, child,
					Collections.emptyList());
		}
		String name = parseUseName();
		if (tokens.eatPunct("::")) {
			RustUseTree child = parseUseTree();
			return new RustUseTree(locationFrom(start), RustUseTree.Kind.PATH, name, null, child,
					Collections.emptyList());
		}
		String rename = null;
		if (tokens.eatIdent("as")) {
			rename = tokens.isIdent("_") ? tokens.next().getValue() : parseIdentifier();
		}
		return new RustUseTree(locationFrom(start), RustUseTree.Kind.NAME, name, rename, null,
				Collections.emptyList());
	}

	private RustItem parseUse(RustToken start, List<RustAttribute> attributes, String visibility, boolean broadcast)
			throws ParseFailureException {
		expectKeyword("use");
		RustToken treeStart = tokens.peek();
		RustUseTree tree = parseUseTree();
		if (broadcast && tokens.isPunct(",")) {
			// `broadcast use a, b;` lists several lemmas or groups at once
			List<RustUseTree> group = new ArrayList<>();
			group.add(tree);
			while (tokens.eatPunct(",")) {
				if (tokens.isPunct(";")) {
					break;
				}
				group.add(parseUseTree());
			}
			tree = new RustUseTree(locationFrom(treeStart), RustUseTree.Kind.GROUP, null, null, null, group);
		}
		expectPunct(";");
		return new RustUse(locationFrom(start), attributes, visibility, broadcast, tree);
	}

	private RustItem parseBroadcastGroup(RustToken start, List<RustAttribute> attributes, String visibility)
			throws ParseFailureException {
		expectKeyword("group");
		String name = parseIdentifier();
		expectPunct("{");
		List<RustPath> members = new ArrayList<>();
		while (!tokens.isPunct("}")) {
			members.add(parseExpressionPath());
			if (!tokens.eatPunct(",")) {
				break;
			}
		}
		expectPunct("}");
		return new RustBroadcastGroup(locationFrom(start), attributes, visibility, name, members);
	}

	private RustItem parseMacroItem(List<RustAttribute> attributes) throws ParseFailureException {
		RustToken start = tokens.peek();
		RustPath path = parseExpressionPath();
		expectPunct("!");
		String name = null;
		if (path.isSimple("macro_rules")) {
			name = parseIdentifier();
		}
		if (!isOpenDelimiter()) {
			throw error("`(`, `[` or `{`");
		}
		RustMacroDelimiter delimiter = RustMacroDelimiter.fromOpen(tokens.peek().getValue());
		List<RustToken> body = readDelimitedTokens();
		if (delimiter != RustMacroDelimiter.BRACE) {
			expectPunct(";");
		}
		return new RustMacroItem(locationFrom(start), attributes, "", path, name, delimiter, body);
	}

	/**
	 * Reads an item the tool passes through untouched, up to its terminating
	 * `;` or its braced body.
	 */
	private RustItem parseVerbatimItem(RustToken start, List<RustAttribute> attributes, String visibility,
	                                   boolean unsafe) throws ParseFailureException {
		List<RustToken> body = new ArrayList<>();
		if (unsafe) {
			body.add(tokens.getLastConsumed());
		}
		while (true) {
			if (tokens.isPunct(";")) {
				body.add(tokens.next());
				break;
			}
			boolean braced = tokens.isPunct("{");
			readTokenTree(body);
			if (braced) {
				break;
			}
		}
		return new RustVerbatimItem(locationFrom(start), attributes, visibility, body);
	}

}
