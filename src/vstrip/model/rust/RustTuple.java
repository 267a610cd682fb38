package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class RustTuple extends RustExpression {

	private final List<RustExpression> elements;

	public RustTuple(SourceLocation location, List<RustExpression> elements) {
		super(location);
		this.elements = elements;
	}

	public List<RustExpression> getElements() {
		return Collections.unmodifiableList(elements);
	}

	@Override
	public <T, E extends Throwable> T accept(RustExpressionVisitor<T, E> v) throws E {
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
		RustTuple that = (RustTuple) obj;
		return Objects.equals(elements, that.elements);
	}

}
