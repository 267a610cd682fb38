package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class RustOrPattern extends RustPattern {

	private final List<RustPattern> alternatives;

	public RustOrPattern(SourceLocation location, List<RustPattern> alternatives) {
		super(location);
		this.alternatives = alternatives;
	}

	public List<RustPattern> getAlternatives() {
		return Collections.unmodifiableList(alternatives);
	}

	@Override
	public <T, E extends Throwable> T accept(RustPatternVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(alternatives);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustOrPattern that = (RustOrPattern) obj;
		return Objects.equals(alternatives, that.alternatives);
	}

}
