package vstrip.formatters;

import vstrip.lexer.RustToken;
import vstrip.lexer.RustTokenType;

import java.io.IOException;
import java.io.Writer;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public class FormattingTools {

	private FormattingTools() {}

	public interface Formatter<T>{
		void format(T param) throws IOException;
	}

	public static <T> void writeSeparated(Writer out, List<T> items, String separator, Formatter<T> writer)
			throws IOException {
		boolean isFirst = true;
		for(T item : items) {
			if(!isFirst) {
				out.write(separator);
			}
			isFirst = false;
			writer.format(item);
		}
	}

	public static <T> void writeCommaSeparated(Writer out, List<T> items, Formatter<T> writer) throws IOException {
		writeSeparated(out, items, ", ", writer);
	}

	private static final Set<String> NO_SPACE_BEFORE = new HashSet<>(Arrays.asList(
			")", "]", ",", ";", ".", "?", ":", "::"));
	private static final Set<String> NO_SPACE_AFTER = new HashSet<>(Arrays.asList(
			"(", "[", ".", "::", "$", "#"));
	private static final Set<String> PREFIX_OPERATORS = new HashSet<>(Arrays.asList(
			"&", "-", "*", "!"));
	private static final Set<String> CLOSERS = new HashSet<>(Arrays.asList(")", "]", "}"));

	private static boolean isOpenDelimiter(RustToken token) {
		return token != null && (token.isPunct("(") || token.isPunct("[") || token.isPunct("{"));
	}

	private static boolean needsSpace(RustToken beforePrev, RustToken prev, RustToken token, RustToken next) {
		boolean prevPunct = prev.getType() == RustTokenType.PUNCT;
		boolean tokenPunct = token.getType() == RustTokenType.PUNCT;
		if (prevPunct && NO_SPACE_AFTER.contains(prev.getValue())) {
			return false;
		}
		if (tokenPunct && NO_SPACE_BEFORE.contains(token.getValue())) {
			return false;
		}
		if (token.isPunct("(") || token.isPunct("[")) {
			if (prev.getType() == RustTokenType.IDENT || prev.isPunct(")") || prev.isPunct("]") ||
					prev.isPunct("!") || prev.isPunct(">")) {
				return false;
			}
		}
		// name!(...) is a macro invocation, #![...] an inner attribute
		if (token.isPunct("!") && isOpenDelimiter(next) &&
				(prev.getType() == RustTokenType.IDENT || prev.isPunct("#"))) {
			return false;
		}
		if (prevPunct && PREFIX_OPERATORS.contains(prev.getValue()) && !isOpenDelimiter(token)) {
			boolean prefixPosition = beforePrev == null ||
					(beforePrev.getType() == RustTokenType.PUNCT && !CLOSERS.contains(beforePrev.getValue()));
			if (prefixPosition) {
				return false;
			}
		}
		return true;
	}

	/**
	 * Writes a token list, as kept for macro invocations and verbatim items, on
	 * a single line. Only doc comments force line breaks.
	 */
	public static void writeTokens(IndentingWriter out, List<RustToken> tokens) throws IOException {
		RustToken beforePrev = null;
		RustToken prev = null;
		boolean atLineStart = false;
		for (int i = 0; i < tokens.size(); i++) {
			RustToken token = tokens.get(i);
			RustToken next = i + 1 < tokens.size() ? tokens.get(i + 1) : null;
			if (token.getType() == RustTokenType.DOC_COMMENT || token.getType() == RustTokenType.INNER_DOC_COMMENT) {
				if (prev != null && !atLineStart) {
					out.newLine();
				}
				out.writeVerbatim(token.getValue());
				out.newLine();
				atLineStart = true;
			} else {
				if (prev != null && !atLineStart && needsSpace(beforePrev, prev, token, next)) {
					out.write(" ");
				}
				if (token.isLiteral()) {
					out.writeVerbatim(token.getValue());
				} else {
					out.write(token.getValue());
				}
				atLineStart = false;
			}
			beforePrev = prev;
			prev = token;
		}
	}

}
