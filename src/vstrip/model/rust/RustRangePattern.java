package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Objects;

public class RustRangePattern extends RustPattern {

	private final RustPattern lower;
	private final String operator;
	private final RustPattern upper;

	public RustRangePattern(SourceLocation location, RustPattern lower, String operator, RustPattern upper) {
		super(location);
		this.lower = lower;
		this.operator = operator;
		this.upper = upper;
	}

	public RustPattern getLower() {
		return lower;
	}

	public String getOperator() {
		return operator;
	}

	public RustPattern getUpper() {
		return upper;
	}

	@Override
	public <T, E extends Throwable> T accept(RustPatternVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(lower, operator, upper);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustRangePattern that = (RustRangePattern) obj;
		return Objects.equals(lower, that.lower) &&
				Objects.equals(operator, that.operator) &&
				Objects.equals(upper, that.upper);
	}

}
