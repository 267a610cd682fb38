package vstrip.parser;

import vstrip.lexer.RustToken;
import vstrip.lexer.RustTokenType;
import vstrip.model.rust.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Expressions, blocks and statements, including the verification-only
 * expression forms.
 *
 * Binary operators are parsed by precedence climbing. Where Rust forbids a
 * struct literal (the head of if, while, match and for, and verification
 * clauses that precede a body) the noStruct flag is set, so `x {` ends the
 * expression instead of starting a literal.
 */
abstract class RustExpressionParser extends RustPatternParser {

	private static final Map<String, Integer> BINARY_PRECEDENCE = new HashMap<>();
	private static final Set<String> RIGHT_ASSOCIATIVE = new HashSet<>(Collections.singletonList("==>"));
	private static final Set<String> TRIGGER_ATTRIBUTES = new HashSet<>(Arrays.asList(
			"trigger", "verifier::trigger", "auto", "all_triggers"));
	private static final Set<String> ASSIGNMENT_OPERATORS = new HashSet<>(Arrays.asList(
			"=", "+=", "-=", "*=", "/=", "%=", "^=", "&=", "|=", "<<=", ">>="));

	static {
		BINARY_PRECEDENCE.put("<==>", 1);
		BINARY_PRECEDENCE.put("==>", 2);
		BINARY_PRECEDENCE.put("<==", 2);
		BINARY_PRECEDENCE.put("||", 3);
		BINARY_PRECEDENCE.put("&&", 4);
		for (String comparison : Arrays.asList("==", "!=", "<", ">", "<=", ">=", "===", "!==", "=~=", "!~=",
				"=~~=", "!~~=")) {
			BINARY_PRECEDENCE.put(comparison, 5);
		}
		BINARY_PRECEDENCE.put("|", 6);
		BINARY_PRECEDENCE.put("^", 7);
		BINARY_PRECEDENCE.put("&", 8);
		BINARY_PRECEDENCE.put("<<", 9);
		BINARY_PRECEDENCE.put(">>", 9);
		BINARY_PRECEDENCE.put("+", 10);
		BINARY_PRECEDENCE.put("-", 10);
		BINARY_PRECEDENCE.put("*", 11);
		BINARY_PRECEDENCE.put("/", 11);
		BINARY_PRECEDENCE.put("%", 11);
	}

	private static final int LOWEST_PRECEDENCE = 1;
	private static final int COMPARISON_PRECEDENCE = 5;

	private boolean noStruct = false;

	RustExpressionParser(TokenStream tokens) {
		super(tokens);
	}

	abstract boolean isItemStart();

	abstract RustItem parseItem(List<RustAttribute> attributes) throws ParseFailureException;

	@Override
	RustExpression parseConstantExpression() throws ParseFailureException {
		return parseExpressionAllowingStructs();
	}

	@Override
	RustExpression parseConstantArgument() throws ParseFailureException {
		return parseUnary();
	}

	@Override
	RustExpression parseBlockExpression() throws ParseFailureException {
		RustToken start = tokens.peek();
		RustBlock block = parseBlock();
		return new RustBlockExpression(locationFrom(start), null, Collections.emptyList(), block);
	}

	boolean canStartExpression() {
		RustToken token = tokens.peek();
		switch (token.getType()) {
			case INTEGER:
			case FLOAT:
			case STRING:
			case CHAR:
			case LIFETIME:
				return true;
			case IDENT:
				return !token.getValue().equals("as") && !token.getValue().equals("else") &&
						!token.getValue().equals("in") && !token.getValue().equals("where");
			case PUNCT:
				switch (token.getValue()) {
					case "(":
					case "[":
					case "{":
					case "|":
					case "||":
					case "!":
					case "-":
					case "*":
					case "&":
					case "&&":
					case "..":
					case "..=":
					case "<":
					case "::":
					case "#":
					case "&&&":
					case "|||":
						return true;
					default:
						return false;
				}
			default:
				return false;
		}
	}

	RustExpression parseExpression() throws ParseFailureException {
		if (tokens.isPunct("&&&") || tokens.isPunct("|||")) {
			RustToken start = tokens.peek();
			String operator = start.getValue();
			List<RustExpression> operands = new ArrayList<>();
			while (tokens.eatPunct(operator)) {
				operands.add(parseAssignment());
			}
			return new RustBigOperator(locationFrom(start), operator, operands);
		}
		return parseAssignment();
	}

	RustExpression parseExpressionNoStruct() throws ParseFailureException {
		boolean saved = noStruct;
		noStruct = true;
		try {
			return parseExpression();
		} finally {
			noStruct = saved;
		}
	}

	RustExpression parseExpressionAllowingStructs() throws ParseFailureException {
		boolean saved = noStruct;
		noStruct = false;
		try {
			return parseExpression();
		} finally {
			noStruct = saved;
		}
	}

	private RustExpression parseAssignment() throws ParseFailureException {
		RustToken start = tokens.peek();
		RustExpression lhs = parseRange();
		if (tokens.isType(RustTokenType.PUNCT) && ASSIGNMENT_OPERATORS.contains(tokens.peek().getValue())) {
			String operator = tokens.next().getValue();
			RustExpression rhs = parseAssignment();
			return new RustBinary(locationFrom(start), lhs, operator, rhs);
		}
		return lhs;
	}

	private boolean canStartRangeEnd() {
		if (noStruct && tokens.isPunct("{")) {
			return false;
		}
		return canStartExpression() && !isSpecClauseKeyword();
	}

	private RustExpression parseRange() throws ParseFailureException {
		RustToken start = tokens.peek();
		if (tokens.isPunct("..") || tokens.isPunct("..=")) {
			String operator = tokens.next().getValue();
			RustExpression to = null;
			if (canStartRangeEnd()) {
				to = parseBinary(LOWEST_PRECEDENCE);
			}
			return new RustRange(locationFrom(start), null, operator, to);
		}
		RustExpression from = parseBinary(LOWEST_PRECEDENCE);
		if (tokens.isPunct("..") || tokens.isPunct("..=")) {
			String operator = tokens.next().getValue();
			RustExpression to = null;
			if (canStartRangeEnd()) {
				to = parseBinary(LOWEST_PRECEDENCE);
			}
			return new RustRange(locationFrom(start), from, operator, to);
		}
		return from;
	}

	private Integer currentBinaryPrecedence() {
		RustToken token = tokens.peek();
		if (token.getType() != RustTokenType.PUNCT) {
			return null;
		}
		return BINARY_PRECEDENCE.get(token.getValue());
	}

	private RustExpression parseBinary(int minPrecedence) throws ParseFailureException {
		RustToken start = tokens.peek();
		RustExpression lhs = parseCast();
		while (true) {
			Integer precedence = currentBinaryPrecedence();
			if (precedence == null || precedence < minPrecedence) {
				return lhs;
			}
			String operator = tokens.next().getValue();
			int nextMin = RIGHT_ASSOCIATIVE.contains(operator) ? precedence : precedence + 1;
			RustExpression rhs = parseBinary(nextMin);
			lhs = new RustBinary(locationFrom(start), lhs, operator, rhs);
		}
	}

	private RustExpression parseCast() throws ParseFailureException {
		RustToken start = tokens.peek();
		RustExpression expression = parseUnary();
		while (true) {
			if (tokens.eatIdent("as")) {
				RustType type = parseTypeNoBounds();
				expression = new RustCast(locationFrom(start), expression, type);
			} else if (tokens.isIdent("is") && isPathStart(1)) {
				tokens.next();
				RustToken pathStart = tokens.peek();
				RustPath path = parseExpressionPath();
				expression = new RustBinary(locationFrom(start), expression, "is",
						new RustPathExpression(locationFrom(pathStart), path));
			} else if (tokens.isIdent("matches")) {
				tokens.next();
				RustPattern pattern = parsePattern();
				expression = new RustMatches(locationFrom(start), expression, pattern);
			} else {
				return expression;
			}
		}
	}

	private boolean isPathStart(int n) {
		RustToken token = tokens.peek(n);
		return (token.getType() == RustTokenType.IDENT && !RESERVED.contains(token.getValue())) ||
				token.isPunct("::");
	}

	private RustExpression parseUnary() throws ParseFailureException {
		RustToken start = tokens.peek();
		if (isOuterAttributeStart()) {
			for (RustAttribute attribute : parseOuterAttributes()) {
				if (!isTriggerAttribute(attribute)) {
					throw new ParseFailureException(attribute.getLocation(), "attributes on expressions are not " +
							"supported");
				}
			}
			return parseUnary();
		}
		if (tokens.isPunct("-") || tokens.isPunct("!") || tokens.isPunct("*")) {
			String operator = tokens.next().getValue();
			RustExpression operand = parseUnary();
			return new RustUnary(locationFrom(start), operator, operand, false);
		}
		if (tokens.isPunct("&") || tokens.isPunct("&&")) {
			tokens.eatPunctPrefix("&");
			String operator = tokens.eatIdent("mut") ? "&mut" : "&";
			RustExpression operand = parseUnary();
			return new RustUnary(locationFrom(start), operator, operand, false);
		}
		return parsePostfix(start, parsePrimary());
	}

	static boolean isTriggerAttribute(RustAttribute attribute) {
		return !attribute.isDocComment() && TRIGGER_ATTRIBUTES.contains(attribute.getPath());
	}

	List<RustExpression> parseCallArguments(String closer) throws ParseFailureException {
		boolean saved = noStruct;
		noStruct = false;
		try {
			List<RustExpression> arguments = new ArrayList<>();
			while (!tokens.isPunct(closer)) {
				arguments.add(parseExpression());
				if (!tokens.eatPunct(",")) {
					break;
				}
			}
			expectPunct(closer);
			return arguments;
		} finally {
			noStruct = saved;
		}
	}

	RustExpression parsePostfix(RustToken start, RustExpression expression) throws ParseFailureException {
		while (true) {
			if (tokens.isPunct("?") || tokens.isPunct("@")) {
				String operator = tokens.next().getValue();
				expression = new RustUnary(locationFrom(start), operator, expression, true);
			} else if (tokens.isPunct(".")) {
				tokens.next();
				RustToken memberStart = tokens.peek();
				if (tokens.isType(RustTokenType.INTEGER)) {
					expression = new RustFieldAccess(locationFrom(start), expression, tokens.next().getValue());
				} else if (tokens.isIdent("await")) {
					tokens.next();
					expression = new RustFieldAccess(locationFrom(start), expression, "await");
				} else {
					String name = parseIdentifier();
					RustGenericArgs arguments = null;
					if (tokens.isPunct("::") && tokens.isPunct(1, "<")) {
						tokens.next();
						arguments = parseGenericArgs();
					}
					if (tokens.isPunct("(")) {
						tokens.next();
						RustPathSegment method = new RustPathSegment(locationFrom(memberStart), name, arguments,
								arguments != null);
						List<RustExpression> callArguments = parseCallArguments(")");
						expression = new RustMethodCall(locationFrom(start), expression, method, callArguments);
					} else if (arguments != null) {
						throw error("`(`");
					} else {
						expression = new RustFieldAccess(locationFrom(start), expression, name);
					}
				}
			} else if (tokens.isPunct("(")) {
				tokens.next();
				List<RustExpression> arguments = parseCallArguments(")");
				expression = new RustCall(locationFrom(start), expression, arguments);
			} else if (tokens.isPunct("[")) {
				tokens.next();
				RustExpression index = parseExpressionAllowingStructs();
				expectPunct("]");
				expression = new RustIndex(locationFrom(start), expression, index);
			} else {
				return expression;
			}
		}
	}

	private boolean isClosureStart() {
		int n = 0;
		if (tokens.isIdent(n, "async")) {
			n++;
		}
		if (tokens.isIdent(n, "move")) {
			n++;
		}
		return tokens.isPunct(n, "|") || tokens.isPunct(n, "||");
	}

	private boolean isQuantifierStart() {
		RustToken token = tokens.peek();
		return (token.isIdent("forall") || token.isIdent("exists") || token.isIdent("choose")) &&
				(tokens.isPunct(1, "|") || tokens.isPunct(1, "||"));
	}

	/**
	 * @return whether the current token starts an expression that ends with a
	 * block and, in statement position, ends the statement there
	 */
	boolean isBlockLikeStart() {
		RustToken token = tokens.peek();
		if (token.isPunct("{")) {
			return true;
		}
		if (token.getType() == RustTokenType.LIFETIME && tokens.isPunct(1, ":")) {
			return true;
		}
		if (token.getType() != RustTokenType.IDENT) {
			return false;
		}
		switch (token.getValue()) {
			case "if":
			case "match":
			case "while":
			case "loop":
			case "for":
				return true;
			case "unsafe":
			case "proof":
				return tokens.isPunct(1, "{");
			default:
				return false;
		}
	}

	RustExpression parsePrimary() throws ParseFailureException {
		RustToken start = tokens.peek();
		if (start.isLiteral()) {
			tokens.next();
			return new RustLiteral(locationFrom(start), start.getValue());
		}
		if (start.isIdent("true") || start.isIdent("false")) {
			tokens.next();
			return new RustLiteral(locationFrom(start), start.getValue());
		}
		if (start.isPunct("(")) {
			return parseParenthesized();
		}
		if (start.isPunct("[")) {
			return parseArray();
		}
		if (start.isPunct("{")) {
			return parseBlockExpression();
		}
		if (start.getType() == RustTokenType.LIFETIME && tokens.isPunct(1, ":")) {
			String label = tokens.next().getValue();
			tokens.next();
			return parseLabeled(start, label);
		}
		if (isClosureStart()) {
			return parseClosure();
		}
		if (isQuantifierStart()) {
			return parseQuantifier();
		}
		if (start.getType() == RustTokenType.IDENT) {
			switch (start.getValue()) {
				case "if":
					return parseIf();
				case "match":
					return parseMatch();
				case "while":
				case "loop":
				case "for":
					return parseLabeled(start, null);
				case "unsafe":
				case "const":
					if (tokens.isPunct(1, "{")) {
						String modifier = tokens.next().getValue();
						RustBlock block = parseBlock();
						return new RustBlockExpression(locationFrom(start), null, Collections.singletonList(modifier),
								block);
					}
					break;
				case "async": {
					tokens.next();
					List<String> modifiers = new ArrayList<>();
					modifiers.add("async");
					if (tokens.eatIdent("move")) {
						modifiers.add("move");
					}
					RustBlock block = parseBlock();
					return new RustBlockExpression(locationFrom(start), null, modifiers, block);
				}
				case "return": {
					tokens.next();
					RustExpression value = canStartValue() ? parseExpression() : null;
					return new RustReturn(locationFrom(start), value);
				}
				case "break": {
					tokens.next();
					String label = null;
					if (tokens.isType(RustTokenType.LIFETIME)) {
						label = tokens.next().getValue();
					}
					RustExpression value = canStartValue() ? parseExpression() : null;
					return new RustBreak(locationFrom(start), label, value);
				}
				case "continue": {
					tokens.next();
					String label = null;
					if (tokens.isType(RustTokenType.LIFETIME)) {
						label = tokens.next().getValue();
					}
					return new RustContinue(locationFrom(start), label);
				}
				case "let": {
					tokens.next();
					RustPattern pattern = parsePattern();
					expectPunct("=");
					RustExpression expression = parseBinary(COMPARISON_PRECEDENCE);
					return new RustLetCondition(locationFrom(start), pattern, expression);
				}
				case "assert":
					if (tokens.isPunct(1, "(")) {
						return parseAssert();
					}
					if (tokens.isIdent(1, "forall")) {
						return parseAssertForall();
					}
					break;
				case "assume":
					if (tokens.isPunct(1, "(")) {
						tokens.next();
						tokens.next();
						RustExpression condition = parseExpressionAllowingStructs();
						expectPunct(")");
						return new RustAssume(locationFrom(start), condition);
					}
					break;
				case "proof":
					if (tokens.isPunct(1, "{")) {
						tokens.next();
						RustBlock block = parseBlock();
						return new RustProofBlock(locationFrom(start), block);
					}
					break;
				default:
					break;
			}
		}
		if (isPathStart()) {
			return parsePathExpression();
		}
		throw error("expression");
	}

	private boolean canStartValue() {
		if (noStruct && tokens.isPunct("{")) {
			return false;
		}
		return canStartExpression();
	}

	private RustExpression parsePathExpression() throws ParseFailureException {
		RustToken start = tokens.peek();
		RustPath path = parseExpressionPath();
		if (tokens.isPunct("!") && (tokens.isPunct(1, "(") || tokens.isPunct(1, "[") || tokens.isPunct(1, "{"))) {
			tokens.next();
			RustMacroDelimiter delimiter = RustMacroDelimiter.fromOpen(tokens.peek().getValue());
			List<RustToken> body = readDelimitedTokens();
			return new RustMacroCall(locationFrom(start), path, delimiter, body);
		}
		if (tokens.isPunct("{") && !noStruct) {
			return parseStructLiteral(start, path);
		}
		return new RustPathExpression(locationFrom(start), path);
	}

	private RustExpression parseStructLiteral(RustToken start, RustPath path) throws ParseFailureException {
		expectPunct("{");
		boolean saved = noStruct;
		noStruct = false;
		try {
			List<RustFieldInit> fields = new ArrayList<>();
			RustExpression base = null;
			while (!tokens.isPunct("}")) {
				if (tokens.eatPunct("..")) {
					if (!tokens.isPunct("}")) {
						base = parseExpression();
					}
					break;
				}
				RustToken fieldStart = tokens.peek();
				String name;
				if (tokens.isType(RustTokenType.INTEGER)) {
					name = tokens.next().getValue();
				} else {
					name = parseIdentifier();
				}
				RustExpression value = null;
				if (tokens.eatPunct(":")) {
					value = parseExpression();
				}
				fields.add(new RustFieldInit(locationFrom(fieldStart), name, value));
				if (!tokens.eatPunct(",")) {
					break;
				}
			}
			expectPunct("}");
			return new RustStructLiteral(locationFrom(start), path, fields, base);
		} finally {
			noStruct = saved;
		}
	}

	private RustExpression parseParenthesized() throws ParseFailureException {
		RustToken start = tokens.peek();
		expectPunct("(");
		boolean saved = noStruct;
		noStruct = false;
		try {
			if (tokens.eatPunct(")")) {
				return new RustTuple(locationFrom(start), Collections.emptyList());
			}
			RustExpression first = parseExpression();
			if (tokens.eatPunct(")")) {
				return new RustParenthesized(locationFrom(start), first);
			}
			expectPunct(",");
			List<RustExpression> elements = new ArrayList<>();
			elements.add(first);
			while (!tokens.isPunct(")")) {
				elements.add(parseExpression());
				if (!tokens.eatPunct(",")) {
					break;
				}
			}
			expectPunct(")");
			return new RustTuple(locationFrom(start), elements);
		} finally {
			noStruct = saved;
		}
	}

	private RustExpression parseArray() throws ParseFailureException {
		RustToken start = tokens.peek();
		expectPunct("[");
		boolean saved = noStruct;
		noStruct = false;
		try {
			if (tokens.eatPunct("]")) {
				return new RustArray(locationFrom(start), Collections.emptyList());
			}
			RustExpression first = parseExpression();
			if (tokens.eatPunct(";")) {
				RustExpression count = parseExpression();
				expectPunct("]");
				return new RustArrayRepeat(locationFrom(start), first, count);
			}
			List<RustExpression> elements = new ArrayList<>();
			elements.add(first);
			while (tokens.eatPunct(",")) {
				if (tokens.isPunct("]")) {
					break;
				}
				elements.add(parseExpression());
			}
			expectPunct("]");
			return new RustArray(locationFrom(start), elements);
		} finally {
			noStruct = saved;
		}
	}

	private RustExpression parseLabeled(RustToken start, String label) throws ParseFailureException {
		if (tokens.isPunct("{")) {
			RustBlock block = parseBlock();
			return new RustBlockExpression(locationFrom(start), label, Collections.emptyList(), block);
		}
		if (tokens.eatIdent("while")) {
			RustExpression condition = parseExpressionNoStruct();
			List<RustSpecClause> specClauses = parseSpecClauses();
			RustBlock body = parseBlock();
			return new RustWhile(locationFrom(start), label, condition, specClauses, body);
		}
		if (tokens.eatIdent("loop")) {
			List<RustSpecClause> specClauses = parseSpecClauses();
			RustBlock body = parseBlock();
			return new RustLoop(locationFrom(start), label, specClauses, body);
		}
		if (tokens.eatIdent("for")) {
			RustPattern pattern = parsePattern();
			expectKeyword("in");
			String iteratorName = null;
			if (isIdentifier() && tokens.isPunct(1, ":")) {
				iteratorName = tokens.next().getValue();
				tokens.next();
			}
			RustExpression iterable = parseExpressionNoStruct();
			List<RustSpecClause> specClauses = parseSpecClauses();
			RustBlock body = parseBlock();
			return new RustFor(locationFrom(start), label, pattern, iteratorName, iterable, specClauses, body);
		}
		throw error("loop or block after label");
	}

	private RustExpression parseIf() throws ParseFailureException {
		RustToken start = tokens.peek();
		expectKeyword("if");
		RustExpression condition = parseExpressionNoStruct();
		RustBlock thenBlock = parseBlock();
		RustExpression elseBranch = null;
		if (tokens.eatIdent("else")) {
			if (tokens.isIdent("if")) {
				elseBranch = parseIf();
			} else {
				elseBranch = parseBlockExpression();
			}
		}
		return new RustIf(locationFrom(start), condition, thenBlock, elseBranch);
	}

	private RustExpression parseMatch() throws ParseFailureException {
		RustToken start = tokens.peek();
		expectKeyword("match");
		RustExpression scrutinee = parseExpressionNoStruct();
		expectPunct("{");
		boolean saved = noStruct;
		noStruct = false;
		try {
			List<RustMatchArm> arms = new ArrayList<>();
			while (!tokens.isPunct("}")) {
				RustToken armStart = tokens.peek();
				List<RustAttribute> attributes = parseOuterAttributes();
				RustPattern pattern = parsePattern();
				RustExpression guard = null;
				if (tokens.eatIdent("if")) {
					guard = parseExpression();
				}
				expectPunct("=>");
				RustExpression body;
				boolean blockLike = isBlockLikeStart();
				if (blockLike) {
					body = parseBlockLike();
				} else {
					body = parseExpression();
				}
				arms.add(new RustMatchArm(locationFrom(armStart), attributes, pattern, guard, body));
				if (!tokens.eatPunct(",") && !tokens.isPunct("}") && !blockLike) {
					throw error("`,`");
				}
			}
			expectPunct("}");
			return new RustMatch(locationFrom(start), scrutinee, arms);
		} finally {
			noStruct = saved;
		}
	}

	/**
	 * Parses a block-like expression together with any method calls or `?`
	 * applied to it, but no binary operators: in statement position and as a
	 * match arm body the block ends the expression.
	 */
	RustExpression parseBlockLike() throws ParseFailureException {
		RustToken start = tokens.peek();
		RustExpression expression = parsePrimary();
		if (tokens.isPunct(".") || tokens.isPunct("?")) {
			expression = parsePostfix(start, expression);
		}
		return expression;
	}

	private List<RustParam> parseClosureParams() throws ParseFailureException {
		List<RustParam> params = new ArrayList<>();
		if (tokens.eatPunct("||")) {
			return params;
		}
		expectPunct("|");
		while (!tokens.isPunct("|")) {
			RustToken paramStart = tokens.peek();
			List<RustAttribute> attributes = parseOuterAttributes();
			RustDataMode mode = parseParamMode();
			RustPattern pattern = parsePatternNoAlternatives();
			RustType type = null;
			if (tokens.eatPunct(":")) {
				type = parseType();
			}
			params.add(new RustParam(locationFrom(paramStart), attributes, mode, null, pattern, type));
			if (!tokens.eatPunct(",")) {
				break;
			}
		}
		expectPunct("|");
		return params;
	}

	/**
	 * Reads a ghost or tracked marker in front of a parameter pattern. The
	 * words are only markers when a pattern follows them.
	 */
	RustDataMode parseParamMode() {
		RustToken token = tokens.peek();
		if (!token.isIdent("ghost") && !token.isIdent("tracked")) {
			return RustDataMode.DEFAULT;
		}
		RustToken next = tokens.peek(1);
		boolean patternFollows = (next.getType() == RustTokenType.IDENT && !next.isIdent("as")) ||
				next.isPunct("(") || next.isPunct("[") || next.isPunct("&");
		if (!patternFollows) {
			return RustDataMode.DEFAULT;
		}
		tokens.next();
		return token.isIdent("ghost") ? RustDataMode.GHOST : RustDataMode.TRACKED;
	}

	private RustExpression parseClosure() throws ParseFailureException {
		RustToken start = tokens.peek();
		List<String> modifiers = new ArrayList<>();
		if (tokens.eatIdent("async")) {
			modifiers.add("async");
		}
		if (tokens.eatIdent("move")) {
			modifiers.add("move");
		}
		List<RustParam> params = parseClosureParams();
		RustReturnType returnType = null;
		if (tokens.eatPunct("->")) {
			returnType = parseReturnType();
		}
		List<RustSpecClause> specClauses = parseSpecClauses();
		RustExpression body;
		if (returnType != null || !specClauses.isEmpty()) {
			body = parseBlockExpression();
		} else {
			body = parseExpression();
		}
		return new RustClosure(locationFrom(start), modifiers, params, returnType, specClauses, body);
	}

	private RustExpression parseQuantifierBody() throws ParseFailureException {
		for (RustAttribute attribute : parseInnerAttributes()) {
			if (!isTriggerAttribute(attribute)) {
				throw new ParseFailureException(attribute.getLocation(), "only trigger attributes may annotate " +
						"a quantifier body");
			}
		}
		return parseExpression();
	}

	private RustExpression parseQuantifier() throws ParseFailureException {
		RustToken start = tokens.peek();
		String quantifier = tokens.next().getValue();
		List<RustParam> params = parseClosureParams();
		RustExpression body = parseQuantifierBody();
		return new RustQuantifier(locationFrom(start), quantifier, params, body);
	}

	private RustExpression parseAssert() throws ParseFailureException {
		RustToken start = tokens.peek();
		expectKeyword("assert");
		expectPunct("(");
		RustExpression condition = parseExpressionAllowingStructs();
		expectPunct(")");
		String strategy = null;
		List<RustSpecClause> requires = new ArrayList<>();
		RustBlock proof = null;
		if (tokens.eatIdent("by")) {
			if (tokens.eatPunct("(")) {
				strategy = parseIdentifier();
				expectPunct(")");
				while (tokens.isIdent("requires")) {
					requires.add(parseSpecClause());
				}
				if (tokens.isPunct("{")) {
					proof = parseBlock();
				}
			} else {
				proof = parseBlock();
			}
		}
		return new RustAssert(locationFrom(start), condition, strategy, requires, proof);
	}

	private RustExpression parseAssertForall() throws ParseFailureException {
		RustToken start = tokens.peek();
		expectKeyword("assert");
		expectKeyword("forall");
		List<RustParam> params = parseClosureParams();
		for (RustAttribute attribute : parseInnerAttributes()) {
			if (!isTriggerAttribute(attribute)) {
				throw new ParseFailureException(attribute.getLocation(), "only trigger attributes may annotate " +
						"an assert forall");
			}
		}
		RustExpression condition = parseExpressionNoStruct();
		RustExpression implies = null;
		if (tokens.eatIdent("implies")) {
			implies = parseExpressionNoStruct();
		}
		RustBlock proof = null;
		if (tokens.eatIdent("by")) {
			proof = parseBlock();
		}
		return new RustAssertForall(locationFrom(start), params, condition, implies, proof);
	}

	private boolean canStartClauseExpression() {
		return canStartExpression() && !tokens.isPunct("{") && !isSpecClauseKeyword();
	}

	RustSpecClause parseSpecClause() throws ParseFailureException {
		RustToken start = tokens.next();
		List<RustExpression> expressions = new ArrayList<>();
		while (canStartClauseExpression()) {
			expressions.add(parseExpressionNoStruct());
			if (!tokens.eatPunct(",")) {
				break;
			}
		}
		return new RustSpecClause(locationFrom(start), start.getValue(), expressions);
	}

	/**
	 * Parses the verification clauses in front of a function or loop body.
	 */
	List<RustSpecClause> parseSpecClauses() throws ParseFailureException {
		List<RustSpecClause> clauses = new ArrayList<>();
		while (isSpecClauseKeyword()) {
			clauses.add(parseSpecClause());
		}
		return clauses;
	}

	RustBlock parseBlock() throws ParseFailureException {
		RustToken start = tokens.peek();
		expectPunct("{");
		if (isInnerAttributeStart()) {
			throw new ParseFailureException(tokens.peek().getLocation(), "inner attributes in blocks are not " +
					"supported");
		}
		boolean saved = noStruct;
		noStruct = false;
		try {
			List<RustStatement> statements = new ArrayList<>();
			while (true) {
				while (tokens.eatPunct(";")) {
					// empty statements carry nothing
				}
				if (tokens.isPunct("}")) {
					break;
				}
				if (tokens.isEOF()) {
					throw new ParseFailureException(start.getLocation(), "unclosed delimiter `{`");
				}
				statements.add(parseStatement());
			}
			expectPunct("}");
			return new RustBlock(locationFrom(start), statements);
		} finally {
			noStruct = saved;
		}
	}

	private RustStatement parseStatement() throws ParseFailureException {
		RustToken start = tokens.peek();
		List<RustAttribute> attributes = parseOuterAttributes();
		if (tokens.isIdent("let")) {
			return parseLet(start, attributes);
		}
		if (isItemStart()) {
			RustItem item = parseItem(attributes);
			return new RustItemStatement(locationFrom(start), item);
		}
		if (isBlockLikeStart()) {
			RustExpression expression = parseBlockLike();
			boolean semicolon = tokens.eatPunct(";");
			if (!semicolon && !tokens.isPunct("}") && !tokens.getLastConsumed().isPunct("}")) {
				throw error("`;`");
			}
			return new RustExpressionStatement(locationFrom(start), attributes, expression, semicolon);
		}
		RustExpression expression = parseExpression();
		boolean semicolon = tokens.eatPunct(";");
		if (!semicolon && !tokens.isPunct("}") && !tokens.getLastConsumed().isPunct("}")) {
			throw error("`;`");
		}
		return new RustExpressionStatement(locationFrom(start), attributes, expression, semicolon);
	}

	private RustStatement parseLet(RustToken start, List<RustAttribute> attributes) throws ParseFailureException {
		expectKeyword("let");
		RustDataMode mode = RustDataMode.DEFAULT;
		if ((tokens.isIdent("ghost") || tokens.isIdent("tracked")) && !tokens.isPunct(1, ":") &&
				!tokens.isPunct(1, "=") && !tokens.isPunct(1, ";") && !tokens.isPunct(1, "@") &&
				!tokens.isPunct(1, "|")) {
			mode = tokens.next().isIdent("ghost") ? RustDataMode.GHOST : RustDataMode.TRACKED;
		}
		RustPattern pattern = parsePattern();
		RustType type = null;
		if (tokens.eatPunct(":")) {
			type = parseType();
		}
		RustExpression init = null;
		RustBlock elseBlock = null;
		if (tokens.eatPunct("=")) {
			init = parseExpression();
			if (tokens.eatIdent("else")) {
				elseBlock = parseBlock();
			}
		}
		expectPunct(";");
		return new RustLet(locationFrom(start), attributes, mode, pattern, type, init, elseBlock);
	}

}
