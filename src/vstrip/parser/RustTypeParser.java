package vstrip.parser;

import vstrip.lexer.RustToken;
import vstrip.lexer.RustTokenType;
import vstrip.model.rust.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Types, paths, generic parameters and arguments, bounds and where clauses.
 */
abstract class RustTypeParser extends AbstractRustParser {

	RustTypeParser(TokenStream tokens) {
		super(tokens);
	}

	/**
	 * Parses an array length.
	 */
	abstract RustExpression parseConstantExpression() throws ParseFailureException;

	/**
	 * Parses a literal, possibly negated, or a path as a constant generic
	 * argument. Anything more complex has to be a block.
	 */
	abstract RustExpression parseConstantArgument() throws ParseFailureException;

	/**
	 * Parses a block expression, as used for `{ N + 1 }` generic arguments.
	 */
	abstract RustExpression parseBlockExpression() throws ParseFailureException;

	boolean isPathSegmentName() {
		RustToken token = tokens.peek();
		if (token.getType() != RustTokenType.IDENT) {
			return false;
		}
		return !RESERVED.contains(token.getValue());
	}

	boolean isPathStart() {
		return isPathSegmentName() || tokens.isPunct("::") || tokens.isPunct("<") || tokens.isPunct("<<");
	}

	RustType parseType() throws ParseFailureException {
		RustToken start = tokens.peek();
		if (tokens.isPunctPrefix("&") && !tokens.isPunct("&=") && !tokens.isPunct("&&=")) {
			tokens.eatPunctPrefix("&");
			String lifetime = null;
			if (tokens.isType(RustTokenType.LIFETIME)) {
				lifetime = tokens.next().getValue();
			}
			boolean mutable = tokens.eatIdent("mut");
			RustType type = parseTypeNoBounds();
			return new RustReferenceType(locationFrom(start), lifetime, mutable, type);
		}
		if (tokens.eatPunct("*")) {
			boolean mutable;
			if (tokens.eatIdent("mut")) {
				mutable = true;
			} else {
				expectKeyword("const");
				mutable = false;
			}
			RustType type = parseTypeNoBounds();
			return new RustPointerType(locationFrom(start), mutable, type);
		}
		if (tokens.eatPunct("(")) {
			List<RustType> elements = new ArrayList<>();
			boolean trailingComma = false;
			while (!tokens.isPunct(")")) {
				elements.add(parseType());
				trailingComma = tokens.eatPunct(",");
				if (!trailingComma) {
					break;
				}
			}
			expectPunct(")");
			if (elements.size() == 1 && !trailingComma) {
				return new RustParenthesizedType(locationFrom(start), elements.get(0));
			}
			return new RustTupleType(locationFrom(start), elements);
		}
		if (tokens.eatPunct("[")) {
			RustType element = parseType();
			if (tokens.eatPunct(";")) {
				RustExpression length = parseConstantExpression();
				expectPunct("]");
				return new RustArrayType(locationFrom(start), element, length);
			}
			expectPunct("]");
			return new RustSliceType(locationFrom(start), element);
		}
		if (tokens.eatPunct("!")) {
			return new RustNeverType(locationFrom(start));
		}
		if (tokens.eatIdent("_")) {
			return new RustInferType(locationFrom(start));
		}
		if (tokens.isIdent("impl") || tokens.isIdent("dyn")) {
			String keyword = tokens.next().getValue();
			List<RustBound> bounds = parseBounds();
			return new RustTraitObjectType(locationFrom(start), keyword, bounds);
		}
		if (isFunctionPointerStart()) {
			return parseFunctionPointerType();
		}
		if (tokens.isIdent("for")) {
			List<String> forLifetimes = parseForLifetimes();
			if (isFunctionPointerStart()) {
				RustFunctionPointerType pointer = parseFunctionPointerType();
				return new RustFunctionPointerType(locationFrom(start), forLifetimes, pointer.getQualifiers(),
						pointer.getParams(), pointer.getReturnType());
			}
			RustPath path = parseTypePath();
			List<RustBound> bounds = new ArrayList<>();
			bounds.add(new RustBound(locationFrom(start), null, false, forLifetimes, path));
			return new RustTraitObjectType(locationFrom(start), "", bounds);
		}
		if (isPathStart()) {
			return new RustPathType(locationFrom(start), parseTypePath());
		}
		throw error("type");
	}

	RustType parseTypeNoBounds() throws ParseFailureException {
		return parseType();
	}

	private boolean isFunctionPointerStart() {
		int n = 0;
		if (tokens.isIdent(n, "unsafe")) {
			n++;
		}
		if (tokens.isIdent(n, "extern")) {
			n++;
			if (tokens.peek(n).getType() == RustTokenType.STRING) {
				n++;
			}
		}
		return tokens.isIdent(n, "fn");
	}

	private RustFunctionPointerType parseFunctionPointerType() throws ParseFailureException {
		RustToken start = tokens.peek();
		List<String> qualifiers = new ArrayList<>();
		if (tokens.eatIdent("unsafe")) {
			qualifiers.add("unsafe");
		}
		if (tokens.eatIdent("extern")) {
			if (tokens.isType(RustTokenType.STRING)) {
				qualifiers.add("extern " + tokens.next().getValue());
			} else {
				qualifiers.add("extern");
			}
		}
		expectKeyword("fn");
		expectPunct("(");
		List<RustType> params = new ArrayList<>();
		while (!tokens.isPunct(")")) {
			// fn(name: T) names are documentation only
			if (isIdentifier() && tokens.isPunct(1, ":")) {
				tokens.next();
				tokens.next();
			}
			params.add(parseType());
			if (!tokens.eatPunct(",")) {
				break;
			}
		}
		expectPunct(")");
		RustType returnType = null;
		if (tokens.eatPunct("->")) {
			returnType = parseTypeNoBounds();
		}
		return new RustFunctionPointerType(locationFrom(start), Collections.emptyList(), qualifiers, params,
				returnType);
	}

	List<String> parseForLifetimes() throws ParseFailureException {
		List<String> lifetimes = new ArrayList<>();
		if (!tokens.eatIdent("for")) {
			return lifetimes;
		}
		expectPunct("<");
		while (tokens.isType(RustTokenType.LIFETIME)) {
			lifetimes.add(tokens.next().getValue());
			if (!tokens.eatPunct(",")) {
				break;
			}
		}
		expectPunctPrefix(">");
		return lifetimes;
	}

	RustPath parseTypePath() throws ParseFailureException {
		return parsePath(false);
	}

	RustPath parseExpressionPath() throws ParseFailureException {
		return parsePath(true);
	}

	/**
	 * Parses a path. In expression paths generic arguments need the turbofish
	 * `::<`, in type paths a bare `<` opens them and `(..) -> T` is accepted for
	 * the Fn traits.
	 */
	private RustPath parsePath(boolean expressionStyle) throws ParseFailureException {
		RustToken start = tokens.peek();
		RustType qualifiedSelf = null;
		RustPath qualifiedTrait = null;
		boolean global = false;
		if (tokens.isPunctPrefix("<") && !tokens.isPunct("<=") && !tokens.isPunct("<<=")) {
			tokens.eatPunctPrefix("<");
			qualifiedSelf = parseType();
			if (tokens.eatIdent("as")) {
				qualifiedTrait = parseTypePath();
			}
			expectPunctPrefix(">");
			expectPunct("::");
		} else if (tokens.eatPunct("::")) {
			global = true;
		}
		List<RustPathSegment> segments = new ArrayList<>();
		while (true) {
			RustToken segmentStart = tokens.peek();
			if (!isPathSegmentName()) {
				throw error("path segment");
			}
			String name = tokens.next().getValue();
			RustGenericArgs arguments = null;
			boolean turbofish = false;
			if (tokens.isPunct("::") && tokens.isPunct(1, "<")) {
				tokens.next();
				turbofish = true;
				arguments = parseGenericArgs();
			} else if (!expressionStyle && tokens.isPunct("<")) {
				arguments = parseGenericArgs();
			} else if (!expressionStyle && tokens.isPunct("(") && isFnTraitName(name)) {
				arguments = parseParenthesizedArgs();
			}
			segments.add(new RustPathSegment(locationFrom(segmentStart), name, arguments, turbofish));
			if (tokens.isPunct("::") && isPathSegmentName(1)) {
				tokens.next();
			} else {
				break;
			}
		}
		return new RustPath(locationFrom(start), qualifiedSelf, qualifiedTrait, global, segments);
	}

	private boolean isPathSegmentName(int n) {
		RustToken token = tokens.peek(n);
		return token.getType() == RustTokenType.IDENT && !RESERVED.contains(token.getValue());
	}

	// spec_fn and FnSpec are the specification closure types
	private static boolean isFnTraitName(String name) {
		return name.equals("Fn") || name.equals("FnMut") || name.equals("FnOnce") || name.equals("spec_fn") ||
				name.equals("FnSpec");
	}

	private RustGenericArgs parseParenthesizedArgs() throws ParseFailureException {
		RustToken start = tokens.peek();
		expectPunct("(");
		List<RustGenericArg> arguments = new ArrayList<>();
		while (!tokens.isPunct(")")) {
			RustToken argStart = tokens.peek();
			RustType type = parseType();
			arguments.add(new RustGenericArg(locationFrom(argStart), RustGenericArg.Kind.TYPE, null, type, null,
					null, Collections.emptyList()));
			if (!tokens.eatPunct(",")) {
				break;
			}
		}
		expectPunct(")");
		RustType output = null;
		if (tokens.eatPunct("->")) {
			output = parseTypeNoBounds();
		}
		return new RustGenericArgs(locationFrom(start), true, arguments, output);
	}

	RustGenericArgs parseGenericArgs() throws ParseFailureException {
		RustToken start = tokens.peek();
		expectPunctPrefix("<");
		List<RustGenericArg> arguments = new ArrayList<>();
		while (!tokens.isPunctPrefix(">")) {
			arguments.add(parseGenericArg());
			if (!tokens.eatPunct(",")) {
				break;
			}
		}
		expectPunctPrefix(">");
		return new RustGenericArgs(locationFrom(start), false, arguments, null);
	}

	private RustGenericArg parseGenericArg() throws ParseFailureException {
		RustToken start = tokens.peek();
		if (tokens.isType(RustTokenType.LIFETIME)) {
			String lifetime = tokens.next().getValue();
			return new RustGenericArg(locationFrom(start), RustGenericArg.Kind.LIFETIME, lifetime, null, null, null,
					Collections.emptyList());
		}
		if (tokens.peek().isLiteral() || tokens.isPunct("-") || tokens.isPunct("{") || tokens.isIdent("true") ||
				tokens.isIdent("false")) {
			RustExpression value = tokens.isPunct("{") ? parseBlockExpression() : parseConstantArgument();
			return new RustGenericArg(locationFrom(start), RustGenericArg.Kind.CONST, null, null, value, null,
					Collections.emptyList());
		}
		if (isIdentifier() && tokens.isPunct(1, "=")) {
			String name = tokens.next().getValue();
			tokens.next();
			RustType type = parseType();
			return new RustGenericArg(locationFrom(start), RustGenericArg.Kind.BINDING, null, type, null, name,
					Collections.emptyList());
		}
		if (isIdentifier() && tokens.isPunct(1, ":")) {
			String name = tokens.next().getValue();
			tokens.next();
			List<RustBound> bounds = parseBounds();
			return new RustGenericArg(locationFrom(start), RustGenericArg.Kind.CONSTRAINT, null, null, null, name,
					bounds);
		}
		RustType type = parseType();
		return new RustGenericArg(locationFrom(start), RustGenericArg.Kind.TYPE, null, type, null, null,
				Collections.emptyList());
	}

	private boolean isBoundStart() {
		return tokens.isType(RustTokenType.LIFETIME) || tokens.isPunct("?") || tokens.isIdent("for") ||
				tokens.isPunct("(") || isPathStart();
	}

	List<RustBound> parseBounds() throws ParseFailureException {
		List<RustBound> bounds = new ArrayList<>();
		bounds.add(parseBound());
		while (tokens.eatPunct("+")) {
			if (!isBoundStart()) {
				break;
			}
			bounds.add(parseBound());
		}
		return bounds;
	}

	private RustBound parseBound() throws ParseFailureException {
		RustToken start = tokens.peek();
		if (tokens.isType(RustTokenType.LIFETIME)) {
			String lifetime = tokens.next().getValue();
			return new RustBound(locationFrom(start), lifetime, false, Collections.emptyList(), null);
		}
		if (tokens.eatPunct("(")) {
			RustBound inner = parseBound();
			expectPunct(")");
			return inner;
		}
		boolean maybe = tokens.eatPunct("?");
		List<String> forLifetimes = parseForLifetimes();
		RustPath path = parseTypePath();
		return new RustBound(locationFrom(start), null, maybe, forLifetimes, path);
	}

	List<RustGenericParam> parseGenericParams() throws ParseFailureException {
		List<RustGenericParam> params = new ArrayList<>();
		if (!tokens.isPunct("<")) {
			return params;
		}
		tokens.next();
		while (!tokens.isPunctPrefix(">")) {
			params.add(parseGenericParam());
			if (!tokens.eatPunct(",")) {
				break;
			}
		}
		expectPunctPrefix(">");
		return params;
	}

	private RustGenericParam parseGenericParam() throws ParseFailureException {
		List<RustAttribute> attributes = parseOuterAttributes();
		RustToken start = tokens.peek();
		if (tokens.isType(RustTokenType.LIFETIME)) {
			String name = tokens.next().getValue();
			List<RustBound> bounds = new ArrayList<>();
			if (tokens.eatPunct(":")) {
				while (tokens.isType(RustTokenType.LIFETIME)) {
					RustToken bound = tokens.next();
					bounds.add(new RustBound(bound.getLocation(), bound.getValue(), false, Collections.emptyList(),
							null));
					if (!tokens.eatPunct("+")) {
						break;
					}
				}
			}
			return new RustGenericParam(locationFrom(start), attributes, RustGenericParam.Kind.LIFETIME, name,
					bounds, null, null, null);
		}
		if (tokens.eatIdent("const")) {
			String name = parseIdentifier();
			expectPunct(":");
			RustType type = parseType();
			RustExpression defaultValue = null;
			if (tokens.eatPunct("=")) {
				defaultValue = tokens.isPunct("{") ? parseBlockExpression() : parseConstantArgument();
			}
			return new RustGenericParam(locationFrom(start), attributes, RustGenericParam.Kind.CONST, name,
					Collections.emptyList(), type, null, defaultValue);
		}
		String name = parseIdentifier();
		List<RustBound> bounds = new ArrayList<>();
		if (tokens.eatPunct(":") && !tokens.isPunctPrefix(">") && !tokens.isPunct(",") && !tokens.isPunct("=")) {
			bounds = parseBounds();
		}
		RustType defaultType = null;
		if (tokens.eatPunct("=")) {
			defaultType = parseType();
		}
		return new RustGenericParam(locationFrom(start), attributes, RustGenericParam.Kind.TYPE, name, bounds,
				null, defaultType, null);
	}

	List<RustWherePredicate> parseWhereClause() throws ParseFailureException {
		List<RustWherePredicate> predicates = new ArrayList<>();
		if (!tokens.eatIdent("where")) {
			return predicates;
		}
		while (!tokens.isPunct("{") && !tokens.isPunct(";") && !tokens.isPunct("=") && !tokens.isEOF() &&
				!isSpecClauseKeyword()) {
			predicates.add(parseWherePredicate());
			if (!tokens.eatPunct(",")) {
				break;
			}
		}
		return predicates;
	}

	private RustWherePredicate parseWherePredicate() throws ParseFailureException {
		RustToken start = tokens.peek();
		if (tokens.isType(RustTokenType.LIFETIME)) {
			String lifetime = tokens.next().getValue();
			expectPunct(":");
			List<RustBound> bounds = new ArrayList<>();
			while (tokens.isType(RustTokenType.LIFETIME)) {
				RustToken bound = tokens.next();
				bounds.add(new RustBound(bound.getLocation(), bound.getValue(), false, Collections.emptyList(),
						null));
				if (!tokens.eatPunct("+")) {
					break;
				}
			}
			return new RustWherePredicate(locationFrom(start), Collections.emptyList(), null, lifetime, bounds);
		}
		List<String> forLifetimes = parseForLifetimes();
		RustType type = parseType();
		expectPunct(":");
		List<RustBound> bounds = new ArrayList<>();
		if (isBoundStart()) {
			bounds = parseBounds();
		}
		return new RustWherePredicate(locationFrom(start), forLifetimes, type, null, bounds);
	}

	/**
	 * Parses what follows `->`: a type, or a named return value `(name: T)`
	 * optionally preceded by `tracked`.
	 */
	RustReturnType parseReturnType() throws ParseFailureException {
		RustToken start = tokens.peek();
		if (tokens.isPunct("(")) {
			int n = 1;
			RustDataMode mode = RustDataMode.DEFAULT;
			if (tokens.isIdent(1, "tracked") && tokens.peek(2).getType() == RustTokenType.IDENT) {
				mode = RustDataMode.TRACKED;
				n = 2;
			}
			if (isIdentifier(n) && tokens.isPunct(n + 1, ":") && !tokens.isPunct(n + 1, "::")) {
				tokens.next();
				if (mode != RustDataMode.DEFAULT) {
					tokens.next();
				}
				String name = tokens.next().getValue();
				tokens.next();
				RustType type = parseType();
				expectPunct(")");
				return new RustReturnType(locationFrom(start), mode, name, type);
			}
		}
		RustDataMode mode = RustDataMode.DEFAULT;
		if (tokens.isIdent("tracked") && !tokens.isPunct(1, "::")) {
			tokens.next();
			mode = RustDataMode.TRACKED;
		}
		RustType type = parseType();
		return new RustReturnType(locationFrom(start), mode, null, type);
	}

}
