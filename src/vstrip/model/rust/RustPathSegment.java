package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Objects;

public class RustPathSegment extends RustNode {

	private final String name;
	private final RustGenericArgs arguments;
	private final boolean turbofish;

	public RustPathSegment(SourceLocation location, String name, RustGenericArgs arguments, boolean turbofish) {
		super(location);
		this.name = name;
		this.arguments = arguments;
		this.turbofish = turbofish;
	}

	public String getName() {
		return name;
	}

	public RustGenericArgs getArguments() {
		return arguments;
	}

	public boolean isTurbofish() {
		return turbofish;
	}

	@Override
	public <T, E extends Throwable> T accept(RustNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, arguments, turbofish);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustPathSegment that = (RustPathSegment) obj;
		return Objects.equals(name, that.name) &&
				Objects.equals(arguments, that.arguments) &&
				turbofish == that.turbofish;
	}

}
