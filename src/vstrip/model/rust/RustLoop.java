package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class RustLoop extends RustExpression {

	private final String label;
	private final List<RustSpecClause> specClauses;
	private final RustBlock body;

	public RustLoop(SourceLocation location, String label, List<RustSpecClause> specClauses, RustBlock body) {
		super(location);
		this.label = label;
		this.specClauses = specClauses;
		this.body = body;
	}

	public String getLabel() {
		return label;
	}

	public List<RustSpecClause> getSpecClauses() {
		return Collections.unmodifiableList(specClauses);
	}

	public RustBlock getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(RustExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(label, specClauses, body);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustLoop that = (RustLoop) obj;
		return Objects.equals(label, that.label) &&
				Objects.equals(specClauses, that.specClauses) &&
				Objects.equals(body, that.body);
	}

}
