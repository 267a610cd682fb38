package vstrip.model.rust;

import vstrip.lexer.RustToken;
import vstrip.util.SourceLocation;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An attribute or a doc comment.
 *
 * #[path args...] or #![path args...]
 *
 * Doc comments keep their original lexeme in docComment and have no path.
 */
public class RustAttribute extends RustNode {

	private final boolean inner;
	private final String docComment;
	private final String path;
	private final List<RustToken> arguments;

	public RustAttribute(SourceLocation location, boolean inner, String docComment, String path,
	                     List<RustToken> arguments) {
		super(location);
		this.inner = inner;
		this.docComment = docComment;
		this.path = path;
		this.arguments = arguments;
	}

	public boolean isInner() {
		return inner;
	}

	public String getDocComment() {
		return docComment;
	}

	public String getPath() {
		return path;
	}

	public List<RustToken> getArguments() {
		return Collections.unmodifiableList(arguments);
	}

	public boolean isDocComment() {
		return docComment != null;
	}

	public List<String> getPathSegments() {
		if (path == null) {
			return Collections.emptyList();
		}
		return Arrays.asList(path.split("::"));
	}

	@Override
	public <T, E extends Throwable> T accept(RustNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(inner, docComment, path, arguments);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustAttribute that = (RustAttribute) obj;
		return inner == that.inner &&
				Objects.equals(docComment, that.docComment) &&
				Objects.equals(path, that.path) &&
				Objects.equals(arguments, that.arguments);
	}

}
