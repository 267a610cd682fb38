package vstrip.trans.passes.preprocess;

import vstrip.trans.passes.parse.SyntaxIssue;
import vstrip.util.SourceLocation;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * Unwraps `verus! { ... }` blocks in place.
 *
 * The wrapper text (`verus!`, the opening brace and the matching closing
 * brace) is overwritten with spaces, so every character of the enclosed items
 * keeps its offset, line and column. Comments, string and character literals
 * are skipped while scanning, and only a whole identifier `verus` starts a
 * wrapper. The content of a wrapper is not scanned again: a nested wrapper
 * stays in the text as an ordinary macro invocation.
 */
public class WrapperPreprocessingPass {
	private static final Logger logger = Logger.getLogger(WrapperPreprocessingPass.class.getName());

	private WrapperPreprocessingPass() {}

	public static String perform(Path inputFileName, CharSequence inputFileContents) throws SyntaxIssue {
		StringBuilder out = new StringBuilder(inputFileContents);
		int index = 0;
		int wrappers = 0;
		while (index < out.length()) {
			int skipped = skipNonCode(out, index);
			if (skipped != index) {
				index = skipped;
				continue;
			}
			char c = out.charAt(index);
			if (!isIdentifierStart(c)) {
				index++;
				continue;
			}
			int identifierEnd = index;
			while (identifierEnd < out.length() && isIdentifierPart(out.charAt(identifierEnd))) {
				identifierEnd++;
			}
			if (!"verus".contentEquals(out.subSequence(index, identifierEnd))) {
				index = identifierEnd;
				continue;
			}
			int bang = skipWhitespace(out, identifierEnd);
			if (bang >= out.length() || out.charAt(bang) != '!') {
				index = identifierEnd;
				continue;
			}
			int open = skipWhitespace(out, bang + 1);
			if (open >= out.length() || out.charAt(open) != '{') {
				// `verus!(...)` and friends are left to the later stages
				index = identifierEnd;
				continue;
			}
			int close = findMatchingBrace(out, open);
			if (close < 0) {
				throw new SyntaxIssue(locationOf(inputFileName, out, index, open + 1),
						"unmatched `verus! {` wrapper opened at byte offset " + byteOffset(out, index));
			}
			blank(out, index, open + 1);
			blank(out, close, close + 1);
			wrappers++;
			index = close + 1;
		}
		logger.fine("unwrapped " + wrappers + " verus! block(s) in " + inputFileName);
		return out.toString();
	}

	static boolean isIdentifierStart(char c) {
		return c == '_' || Character.isLetter(c);
	}

	static boolean isIdentifierPart(char c) {
		return c == '_' || Character.isLetterOrDigit(c);
	}

	private static int skipWhitespace(CharSequence chars, int index) {
		while (index < chars.length() && Character.isWhitespace(chars.charAt(index))) {
			index++;
		}
		return index;
	}

	private static boolean startsWith(CharSequence chars, int index, String prefix) {
		return index + prefix.length() <= chars.length() &&
				prefix.contentEquals(chars.subSequence(index, index + prefix.length()));
	}

	/**
	 * @return the index just past the comment or literal starting at index, or
	 * index itself when none starts there
	 */
	static int skipNonCode(CharSequence chars, int index) {
		if (startsWith(chars, index, "//")) {
			while (index < chars.length() && chars.charAt(index) != '\n') {
				index++;
			}
			return index;
		}
		if (startsWith(chars, index, "/*")) {
			int depth = 0;
			while (index < chars.length()) {
				if (startsWith(chars, index, "/*")) {
					depth++;
					index += 2;
				} else if (startsWith(chars, index, "*/")) {
					depth--;
					index += 2;
					if (depth == 0) {
						return index;
					}
				} else {
					index++;
				}
			}
			return index;
		}
		// string prefixes only count when they do not continue an identifier
		boolean atWordStart = index == 0 || !isIdentifierPart(chars.charAt(index - 1));
		if (atWordStart) {
			int prefixEnd = index;
			if (startsWith(chars, index, "br") || startsWith(chars, index, "cr")) {
				prefixEnd += 2;
			} else if (startsWith(chars, index, "r")) {
				prefixEnd += 1;
			}
			if (prefixEnd > index) {
				int hashes = 0;
				while (prefixEnd + hashes < chars.length() && chars.charAt(prefixEnd + hashes) == '#') {
					hashes++;
				}
				if (prefixEnd + hashes < chars.length() && chars.charAt(prefixEnd + hashes) == '"') {
					return skipRawString(chars, prefixEnd + hashes + 1, hashes);
				}
			}
			if ((startsWith(chars, index, "b\"") || startsWith(chars, index, "c\""))) {
				return skipString(chars, index + 2, '"');
			}
			if (startsWith(chars, index, "b'")) {
				return skipString(chars, index + 2, '\'');
			}
		}
		char c = chars.charAt(index);
		if (c == '"') {
			return skipString(chars, index + 1, '"');
		}
		if (c == '\'') {
			if (startsWith(chars, index + 1, "\\")) {
				return skipString(chars, index + 1, '\'');
			}
			if (index + 2 < chars.length() && chars.charAt(index + 2) == '\'') {
				return index + 3;
			}
			// a lifetime or label
			return index + 1;
		}
		return index;
	}

	private static int skipString(CharSequence chars, int index, char quote) {
		while (index < chars.length()) {
			char c = chars.charAt(index);
			if (c == '\\') {
				index += 2;
			} else if (c == quote) {
				return index + 1;
			} else {
				index++;
			}
		}
		return chars.length();
	}

	private static int skipRawString(CharSequence chars, int index, int hashes) {
		StringBuilder terminator = new StringBuilder("\"");
		for (int i = 0; i < hashes; i++) {
			terminator.append('#');
		}
		while (index < chars.length()) {
			if (startsWith(chars, index, terminator.toString())) {
				return index + terminator.length();
			}
			index++;
		}
		return chars.length();
	}

	/**
	 * @return the index of the brace closing the one at open, or -1
	 */
	static int findMatchingBrace(CharSequence chars, int open) {
		int depth = 0;
		int index = open;
		while (index < chars.length()) {
			int skipped = skipNonCode(chars, index);
			if (skipped != index) {
				index = skipped;
				continue;
			}
			char c = chars.charAt(index);
			if (c == '{') {
				depth++;
			} else if (c == '}') {
				depth--;
				if (depth == 0) {
					return index;
				}
			}
			index++;
		}
		return -1;
	}

	private static void blank(StringBuilder chars, int from, int to) {
		for (int i = from; i < to; i++) {
			if (chars.charAt(i) != '\n' && chars.charAt(i) != '\r') {
				chars.setCharAt(i, ' ');
			}
		}
	}

	static int byteOffset(CharSequence chars, int index) {
		return chars.subSequence(0, index).toString().getBytes(StandardCharsets.UTF_8).length;
	}

	private static SourceLocation locationOf(Path file, CharSequence chars, int start, int end) {
		int line = 0;
		int column = 0;
		for (int i = 0; i < start; i++) {
			if (chars.charAt(i) == '\n') {
				line++;
				column = 0;
			} else {
				column++;
			}
		}
		return new SourceLocation(file, start, end, line, line, column, column + (end - start));
	}

}
