package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class RustMatch extends RustExpression {

	private final RustExpression scrutinee;
	private final List<RustMatchArm> arms;

	public RustMatch(SourceLocation location, RustExpression scrutinee, List<RustMatchArm> arms) {
		super(location);
		this.scrutinee = scrutinee;
		this.arms = arms;
	}

	public RustExpression getScrutinee() {
		return scrutinee;
	}

	public List<RustMatchArm> getArms() {
		return Collections.unmodifiableList(arms);
	}

	@Override
	public <T, E extends Throwable> T accept(RustExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(scrutinee, arms);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustMatch that = (RustMatch) obj;
		return Objects.equals(scrutinee, that.scrutinee) &&
				Objects.equals(arms, that.arms);
	}

}
