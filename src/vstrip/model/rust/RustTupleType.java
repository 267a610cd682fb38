package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Tuple types. The unit type is the empty tuple.
 */
public class RustTupleType extends RustType {

	private final List<RustType> elements;

	public RustTupleType(SourceLocation location, List<RustType> elements) {
		super(location);
		this.elements = elements;
	}

	public List<RustType> getElements() {
		return Collections.unmodifiableList(elements);
	}

	@Override
	public <T, E extends Throwable> T accept(RustTypeVisitor<T, E> v) throws E {
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
		RustTupleType that = (RustTupleType) obj;
		return Objects.equals(elements, that.elements);
	}

}
