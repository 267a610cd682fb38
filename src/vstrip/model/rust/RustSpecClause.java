package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A verification clause such as requires, ensures, invariant or decreases.
 *
 * The modifiers of a decreases clause are kept as separate clauses with the
 * keywords when and via.
 */
public class RustSpecClause extends RustNode {

	private final String keyword;
	private final List<RustExpression> expressions;

	public RustSpecClause(SourceLocation location, String keyword, List<RustExpression> expressions) {
		super(location);
		this.keyword = keyword;
		this.expressions = expressions;
	}

	public String getKeyword() {
		return keyword;
	}

	public List<RustExpression> getExpressions() {
		return Collections.unmodifiableList(expressions);
	}

	@Override
	public <T, E extends Throwable> T accept(RustNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(keyword, expressions);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustSpecClause that = (RustSpecClause) obj;
		return Objects.equals(keyword, that.keyword) &&
				Objects.equals(expressions, that.expressions);
	}

}
