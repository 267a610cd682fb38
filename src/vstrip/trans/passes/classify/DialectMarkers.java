package vstrip.trans.passes.classify;

import vstrip.lexer.RustToken;
import vstrip.lexer.RustTokenType;
import vstrip.model.rust.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Local syntactic evidence that a construct belongs to the verification
 * dialect.
 */
public final class DialectMarkers {

	private DialectMarkers() {}

	/**
	 * Macros that only contain proof code.
	 */
	public static final Set<String> PROOF_MACROS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
			"proof", "calc", "assert_by", "assert_forall_by", "assert_by_contradiction", "open_invariant",
			"open_local_invariant", "open_atomic_invariant", "assert_seqs_equal", "assert_sets_equal",
			"assert_maps_equal")));

	/**
	 * Builtin functions that instruct the verifier and are called as statements.
	 */
	public static final Set<String> PROOF_BUILTINS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
			"reveal", "reveal_with_fuel", "hide")));

	public static final Set<String> GHOST_OPERATORS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
			"==>", "<==", "<==>", "===", "!==", "=~=", "!~=", "=~~=", "!~~=", "is")));

	private static final Set<String> VERIFICATION_ATTRIBUTES = new HashSet<>(Arrays.asList(
			"trigger", "via_fn", "when_used_as_spec", "is_variant", "auto", "spec_fn"));

	private static final Set<String> SPEC_FUNCTION_TYPES = new HashSet<>(Arrays.asList("spec_fn", "FnSpec"));

	private static final Set<String> VERIFICATION_CRATES = new HashSet<>(Arrays.asList(
			"vstd", "builtin", "builtin_macros", "verus_builtin", "verus_builtin_macros"));

	private static final Set<String> DIALECT_PUNCTUATION = new HashSet<>(Arrays.asList(
			"==>", "<==", "<==>", "===", "!==", "=~=", "!~=", "=~~=", "!~~=", "&&&", "|||"));

	public static boolean isGhostWrapper(RustPath path) {
		return path.getQualifiedSelf() == null && !path.getSegments().isEmpty() &&
				(path.getLastName().equals("Ghost") || path.getLastName().equals("Tracked"));
	}

	/**
	 * @return whether type is a specification closure type, `spec_fn(A) -> B`
	 * or its older spelling `FnSpec(A) -> B`
	 */
	public static boolean isSpecFunctionType(RustType type) {
		if (!(type instanceof RustPathType)) {
			return false;
		}
		RustPath path = ((RustPathType) type).getPath();
		return path.getQualifiedSelf() == null && !path.getSegments().isEmpty() &&
				SPEC_FUNCTION_TYPES.contains(path.getLastName());
	}

	/**
	 * @return GHOST or TRACKED for `Ghost<T>` and `Tracked<T>`, GHOST for
	 * specification closure types, NONE otherwise
	 */
	public static GhostMarker wrapperMarker(RustType type) {
		if (isSpecFunctionType(type)) {
			return GhostMarker.GHOST;
		}
		if (!(type instanceof RustPathType)) {
			return GhostMarker.NONE;
		}
		RustPath path = ((RustPathType) type).getPath();
		if (!isGhostWrapper(path)) {
			return GhostMarker.NONE;
		}
		return path.getLastName().equals("Ghost") ? GhostMarker.GHOST : GhostMarker.TRACKED;
	}

	/**
	 * @return GHOST or TRACKED for the patterns `Ghost(x)` and `Tracked(x)`
	 */
	public static GhostMarker wrapperMarker(RustPattern pattern) {
		if (!(pattern instanceof RustTupleStructPattern)) {
			return GhostMarker.NONE;
		}
		RustPath path = ((RustTupleStructPattern) pattern).getPath();
		if (!isGhostWrapper(path)) {
			return GhostMarker.NONE;
		}
		return path.getLastName().equals("Ghost") ? GhostMarker.GHOST : GhostMarker.TRACKED;
	}

	public static GhostMarker modeMarker(RustDataMode mode) {
		switch (mode) {
			case GHOST:
				return GhostMarker.GHOST;
			case TRACKED:
				return GhostMarker.TRACKED;
			default:
				return GhostMarker.NONE;
		}
	}

	/**
	 * @return whether expression is `Ghost(..)` or `Tracked(..)`
	 */
	public static boolean isWrapperConstruction(RustExpression expression) {
		if (!(expression instanceof RustCall)) {
			return false;
		}
		RustExpression function = ((RustCall) expression).getFunction();
		return function instanceof RustPathExpression && isGhostWrapper(((RustPathExpression) function).getPath());
	}

	/**
	 * @return GHOST or TRACKED for the constructions `Ghost(e)` and `Tracked(e)`
	 */
	public static GhostMarker wrapperMarker(RustExpression expression) {
		if (!isWrapperConstruction(expression)) {
			return GhostMarker.NONE;
		}
		RustPath path = ((RustPathExpression) ((RustCall) expression).getFunction()).getPath();
		return path.getLastName().equals("Ghost") ? GhostMarker.GHOST : GhostMarker.TRACKED;
	}

	public static boolean isVerificationAttribute(RustAttribute attribute) {
		if (attribute.isDocComment()) {
			return false;
		}
		List<String> segments = attribute.getPathSegments();
		String first = segments.get(0);
		if (first.equals("verifier") || first.equals("verus")) {
			return true;
		}
		return segments.size() == 1 && VERIFICATION_ATTRIBUTES.contains(first);
	}

	public static boolean isVerificationCrate(String name) {
		return VERIFICATION_CRATES.contains(name);
	}

	public static boolean isWrapperMacro(RustPath path) {
		return path.isSimple("verus");
	}

	public static boolean isProofMacro(RustPath path) {
		return path.getQualifiedSelf() == null && !path.getSegments().isEmpty() &&
				PROOF_MACROS.contains(path.getLastName());
	}

	/**
	 * @return whether expression calls one of the verifier's builtin
	 * instructions, such as `reveal(f)`
	 */
	public static boolean isProofBuiltinCall(RustExpression expression) {
		if (!(expression instanceof RustCall)) {
			return false;
		}
		RustExpression function = ((RustCall) expression).getFunction();
		if (!(function instanceof RustPathExpression)) {
			return false;
		}
		RustPath path = ((RustPathExpression) function).getPath();
		return path.getSegments().size() == 1 && PROOF_BUILTINS.contains(path.getLastName());
	}

	public static boolean isGhostOperator(RustExpression expression) {
		if (expression instanceof RustBinary) {
			return GHOST_OPERATORS.contains(((RustBinary) expression).getOperator());
		}
		if (expression instanceof RustUnary) {
			RustUnary unary = (RustUnary) expression;
			return unary.isPostfix() && unary.getOperator().equals("@");
		}
		return expression instanceof RustMatches || expression instanceof RustBigOperator;
	}

	/**
	 * Looks for dialect syntax inside an unparsed token sequence.
	 *
	 * @return the first token that marks dialect code, or null
	 */
	public static RustToken findMarker(List<RustToken> tokens) {
		for (int i = 0; i < tokens.size(); i++) {
			RustToken token = tokens.get(i);
			RustToken next = i + 1 < tokens.size() ? tokens.get(i + 1) : null;
			if (token.getType() == RustTokenType.PUNCT && DIALECT_PUNCTUATION.contains(token.getValue())) {
				return token;
			}
			if (token.getType() != RustTokenType.IDENT || next == null) {
				continue;
			}
			String word = token.getValue();
			if (next.isPunct("!") && (word.equals("verus") || PROOF_MACROS.contains(word))) {
				return token;
			}
			if ((word.equals("forall") || word.equals("exists") || word.equals("choose")) &&
					(next.isPunct("|") || next.isPunct("||"))) {
				return token;
			}
			if ((word.equals("spec") || word.equals("proof")) && next.isIdent("fn")) {
				return token;
			}
			if (word.equals("proof") && next.isPunct("{")) {
				return token;
			}
		}
		return null;
	}

}
