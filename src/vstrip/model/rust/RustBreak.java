package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Objects;

public class RustBreak extends RustExpression {

	private final String label;
	private final RustExpression value;

	public RustBreak(SourceLocation location, String label, RustExpression value) {
		super(location);
		this.label = label;
		this.value = value;
	}

	public String getLabel() {
		return label;
	}

	public RustExpression getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(RustExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(label, value);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustBreak that = (RustBreak) obj;
		return Objects.equals(label, that.label) &&
				Objects.equals(value, that.value);
	}

}
