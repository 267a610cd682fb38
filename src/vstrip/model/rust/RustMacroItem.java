package vstrip.model.rust;

import vstrip.lexer.RustToken;
import vstrip.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A macro invocation in item position. For macro_rules! the macro being
 * defined is kept in name.
 */
public class RustMacroItem extends RustItem {

	private final RustPath path;
	private final String name;
	private final RustMacroDelimiter delimiter;
	private final List<RustToken> tokens;

	public RustMacroItem(SourceLocation location, List<RustAttribute> attributes, String visibility, RustPath path,
	                     String name, RustMacroDelimiter delimiter, List<RustToken> tokens) {
		super(location, attributes, visibility);
		this.path = path;
		this.name = name;
		this.delimiter = delimiter;
		this.tokens = tokens;
	}

	public RustPath getPath() {
		return path;
	}

	public String getName() {
		return name;
	}

	public RustMacroDelimiter getDelimiter() {
		return delimiter;
	}

	public List<RustToken> getTokens() {
		return Collections.unmodifiableList(tokens);
	}

	@Override
	public <T, E extends Throwable> T accept(RustItemVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getAttributes(), getVisibility(), path, name, delimiter, tokens);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustMacroItem that = (RustMacroItem) obj;
		return Objects.equals(getAttributes(), that.getAttributes()) &&
				Objects.equals(getVisibility(), that.getVisibility()) &&
				Objects.equals(path, that.path) &&
				Objects.equals(name, that.name) &&
				delimiter == that.delimiter &&
				Objects.equals(tokens, that.tokens);
	}

}
