package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * forall|x: T| body, exists|x: T| body and choose|x: T| body
 */
public class RustQuantifier extends RustExpression {

	private final String quantifier;
	private final List<RustParam> params;
	private final RustExpression body;

	public RustQuantifier(SourceLocation location, String quantifier, List<RustParam> params, RustExpression body) {
		super(location);
		this.quantifier = quantifier;
		this.params = params;
		this.body = body;
	}

	public String getQuantifier() {
		return quantifier;
	}

	public List<RustParam> getParams() {
		return Collections.unmodifiableList(params);
	}

	public RustExpression getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(RustExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(quantifier, params, body);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustQuantifier that = (RustQuantifier) obj;
		return Objects.equals(quantifier, that.quantifier) &&
				Objects.equals(params, that.params) &&
				Objects.equals(body, that.body);
	}

}
