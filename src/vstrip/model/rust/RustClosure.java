package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class RustClosure extends RustExpression {

	private final List<String> modifiers;
	private final List<RustParam> params;
	private final RustReturnType returnType;
	private final List<RustSpecClause> specClauses;
	private final RustExpression body;

	public RustClosure(SourceLocation location, List<String> modifiers, List<RustParam> params,
	                   RustReturnType returnType, List<RustSpecClause> specClauses, RustExpression body) {
		super(location);
		this.modifiers = modifiers;
		this.params = params;
		this.returnType = returnType;
		this.specClauses = specClauses;
		this.body = body;
	}

	public List<String> getModifiers() {
		return Collections.unmodifiableList(modifiers);
	}

	public List<RustParam> getParams() {
		return Collections.unmodifiableList(params);
	}

	public RustReturnType getReturnType() {
		return returnType;
	}

	public List<RustSpecClause> getSpecClauses() {
		return Collections.unmodifiableList(specClauses);
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
		return Objects.hash(modifiers, params, returnType, specClauses, body);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustClosure that = (RustClosure) obj;
		return Objects.equals(modifiers, that.modifiers) &&
				Objects.equals(params, that.params) &&
				Objects.equals(returnType, that.returnType) &&
				Objects.equals(specClauses, that.specClauses) &&
				Objects.equals(body, that.body);
	}

}
