package vstrip.parser;

import vstrip.lexer.RustToken;
import vstrip.lexer.RustTokenType;
import vstrip.util.SourceLocation;

import java.util.List;

/**
 * A cursor over a token list.
 *
 * Compound punctuation can be consumed piecewise: closing two generic argument
 * lists at once consumes the `>>` token in two steps, and `&&` can be read as
 * two reference operators. A mark therefore records both the token index and
 * how many characters of the current token have been consumed.
 */
public final class TokenStream {

	private final List<RustToken> tokens;
	private int position;
	private int split;
	private RustToken lastConsumed;

	public TokenStream(List<RustToken> tokens) {
		this.tokens = tokens;
		this.position = 0;
		this.split = 0;
	}

	public int mark() {
		return position * 4 + split;
	}

	public void reset(int mark) {
		position = mark / 4;
		split = mark % 4;
	}

	public RustToken peek() {
		RustToken token = tokens.get(position);
		if (split == 0) {
			return token;
		}
		SourceLocation location = token.getLocation();
		return new RustToken(token.getValue().substring(split), token.getType(), new SourceLocation(
				location.getFile(), location.getStartOffset() + split, location.getEndOffset(),
				location.getStartLine(), location.getEndLine(), location.getStartColumn() + split,
				location.getEndColumn()));
	}

	/**
	 * @return the token n positions ahead; split tokens are seen whole
	 */
	public RustToken peek(int n) {
		if (n == 0) {
			return peek();
		}
		int index = Math.min(position + n, tokens.size() - 1);
		return tokens.get(index);
	}

	public RustToken next() {
		RustToken token = peek();
		if (token.getType() != RustTokenType.EOF) {
			position++;
		}
		split = 0;
		lastConsumed = token;
		return token;
	}

	public boolean isEOF() {
		return peek().getType() == RustTokenType.EOF;
	}

	public boolean isPunct(String value) {
		return peek().isPunct(value);
	}

	public boolean isPunct(int n, String value) {
		return peek(n).isPunct(value);
	}

	public boolean isIdent(String value) {
		return peek().isIdent(value);
	}

	public boolean isIdent(int n, String value) {
		return peek(n).isIdent(value);
	}

	public boolean isType(RustTokenType type) {
		return peek().getType() == type;
	}

	public boolean eatPunct(String value) {
		if (isPunct(value)) {
			next();
			return true;
		}
		return false;
	}

	public boolean eatIdent(String value) {
		if (isIdent(value)) {
			next();
			return true;
		}
		return false;
	}

	/**
	 * Consumes value when the current punctuation token is value, or starts
	 * with it, in which case the rest of the token stays current.
	 */
	public boolean eatPunctPrefix(String value) {
		RustToken token = peek();
		if (token.getType() != RustTokenType.PUNCT || !token.getValue().startsWith(value)) {
			return false;
		}
		if (token.getValue().length() == value.length()) {
			next();
			return true;
		}
		SourceLocation location = token.getLocation();
		lastConsumed = new RustToken(value, RustTokenType.PUNCT, new SourceLocation(
				location.getFile(), location.getStartOffset(), location.getStartOffset() + value.length(),
				location.getStartLine(), location.getStartLine(), location.getStartColumn(),
				location.getStartColumn() + value.length()));
		split += value.length();
		return true;
	}

	public boolean isPunctPrefix(String value) {
		RustToken token = peek();
		return token.getType() == RustTokenType.PUNCT && token.getValue().startsWith(value);
	}

	public RustToken getLastConsumed() {
		return lastConsumed;
	}

}
