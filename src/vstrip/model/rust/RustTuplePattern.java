package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class RustTuplePattern extends RustPattern {

	private final List<RustPattern> elements;

	public RustTuplePattern(SourceLocation location, List<RustPattern> elements) {
		super(location);
		this.elements = elements;
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
		return Objects.hash(elements);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustTuplePattern that = (RustTuplePattern) obj;
		return Objects.equals(elements, that.elements);
	}

}
