package vstrip.model.rust;

import vstrip.lexer.RustToken;
import vstrip.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An item the parser does not model, such as an extern block, an extern
 * crate or a union. It is carried through as tokens.
 */
public class RustVerbatimItem extends RustItem {

	private final List<RustToken> tokens;

	public RustVerbatimItem(SourceLocation location, List<RustAttribute> attributes, String visibility,
	                        List<RustToken> tokens) {
		super(location, attributes, visibility);
		this.tokens = tokens;
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
		return Objects.hash(getAttributes(), getVisibility(), tokens);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustVerbatimItem that = (RustVerbatimItem) obj;
		return Objects.equals(getAttributes(), that.getAttributes()) &&
				Objects.equals(getVisibility(), that.getVisibility()) &&
				Objects.equals(tokens, that.tokens);
	}

}
