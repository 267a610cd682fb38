package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class RustMethodCall extends RustExpression {

	private final RustExpression receiver;
	private final RustPathSegment method;
	private final List<RustExpression> arguments;

	public RustMethodCall(SourceLocation location, RustExpression receiver, RustPathSegment method,
	                      List<RustExpression> arguments) {
		super(location);
		this.receiver = receiver;
		this.method = method;
		this.arguments = arguments;
	}

	public RustExpression getReceiver() {
		return receiver;
	}

	public RustPathSegment getMethod() {
		return method;
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
		return Objects.hash(receiver, method, arguments);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustMethodCall that = (RustMethodCall) obj;
		return Objects.equals(receiver, that.receiver) &&
				Objects.equals(method, that.method) &&
				Objects.equals(arguments, that.arguments);
	}

}
