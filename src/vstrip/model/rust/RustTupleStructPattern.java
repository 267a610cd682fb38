package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class RustTupleStructPattern extends RustPattern {

	private final RustPath path;
	private final List<RustPattern> elements;

	public RustTupleStructPattern(SourceLocation location, RustPath path, List<RustPattern> elements) {
		super(location);
		this.path = path;
		this.elements = elements;
	}

	public RustPath getPath() {
		return path;
	}

	public List<RustPattern> getElements() {
		return Collections.unmodifiableList(elements);
	}

	@Override
	public <T, E extends Throwable> T accept(RustPatternVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(path, elements);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustTupleStructPattern that = (RustTupleStructPattern) obj;
		return Objects.equals(path, that.path) &&
				Objects.equals(elements, that.elements);
	}

}
