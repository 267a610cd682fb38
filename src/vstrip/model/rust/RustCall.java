package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class RustCall extends RustExpression {

	private final RustExpression function;
	private final List<RustExpression> arguments;

	public RustCall(SourceLocation location, RustExpression function, List<RustExpression> arguments) {
		super(location);
		this.function = function;
		this.arguments = arguments;
	}

	public RustExpression getFunction() {
		return function;
	}

	public List<RustExpression> getArguments() {
		return Collections.unmodifiableList(arguments);
	}

	@Override
	public <T, E extends Throwable> T accept(RustExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(function, arguments);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustCall that = (RustCall) obj;
		return Objects.equals(function, that.function) &&
				Objects.equals(arguments, that.arguments);
	}

}
