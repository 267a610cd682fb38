package vstrip.model.rust;

import vstrip.lexer.RustToken;
import vstrip.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A macro invocation such as println!("{}", x). Its arguments are kept as tokens.
 */
public class RustMacroCall extends RustExpression {

	private final RustPath path;
	private final RustMacroDelimiter delimiter;
	private final List<RustToken> tokens;

	public RustMacroCall(SourceLocation location, RustPath path, RustMacroDelimiter delimiter, List<RustToken> tokens) {
		super(location);
		this.path = path;
		this.delimiter = delimiter;
		this.tokens = tokens;
	}

	public RustPath getPath() {
		return path;
	}

	public RustMacroDelimiter getDelimiter() {
		return delimiter;
	}

	public List<RustToken> getTokens() {
		return Collections.unmodifiableList(tokens);
	}

	@Override
	public <T, E extends Throwable> T accept(RustExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(path, delimiter, tokens);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustMacroCall that = (RustMacroCall) obj;
		return Objects.equals(path, that.path) &&
				delimiter == that.delimiter &&
				Objects.equals(tokens, that.tokens);
	}

}
