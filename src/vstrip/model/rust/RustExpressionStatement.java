package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An expression in statement position. The last one of a block may have no semicolon.
 */
public class RustExpressionStatement extends RustStatement {

	private final List<RustAttribute> attributes;
	private final RustExpression expression;
	private final boolean semicolon;

	public RustExpressionStatement(SourceLocation location, List<RustAttribute> attributes, RustExpression expression,
	                               boolean semicolon) {
		super(location);
		this.attributes = attributes;
		this.expression = expression;
		this.semicolon = semicolon;
	}

	public List<RustAttribute> getAttributes() {
		return Collections.unmodifiableList(attributes);
	}

	public RustExpression getExpression() {
		return expression;
	}

	public boolean hasSemicolon() {
		return semicolon;
	}

	@Override
	public <T, E extends Throwable> T accept(RustStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(attributes, expression, semicolon);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustExpressionStatement that = (RustExpressionStatement) obj;
		return Objects.equals(attributes, that.attributes) &&
				Objects.equals(expression, that.expression) &&
				semicolon == that.semicolon;
	}

}
