package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Objects;

public class RustContinue extends RustExpression {

	private final String label;

	public RustContinue(SourceLocation location, String label) {
		super(location);
		this.label = label;
	}

	public String getLabel() {
		return label;
	}

	@Override
	public <T, E extends Throwable> T accept(RustExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(label);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustContinue that = (RustContinue) obj;
		return Objects.equals(label, that.label);
	}

}
