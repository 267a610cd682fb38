package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Objects;

public class RustPathPattern extends RustPattern {

	private final RustPath path;

	public RustPathPattern(SourceLocation location, RustPath path) {
		super(location);
		this.path = path;
	}

	public RustPath getPath() {
		return path;
	}

	@Override
	public <T, E extends Throwable> T accept(RustPatternVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(path);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustPathPattern that = (RustPathPattern) obj;
		return Objects.equals(path, that.path);
	}

}
