package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class RustStructPattern extends RustPattern {

	private final RustPath path;
	private final List<RustFieldPattern> fields;
	private final boolean rest;

	public RustStructPattern(SourceLocation location, RustPath path, List<RustFieldPattern> fields, boolean rest) {
		super(location);
		this.path = path;
		this.fields = fields;
		this.rest = rest;
	}

	public RustPath getPath() {
		return path;
	}

	public List<RustFieldPattern> getFields() {
		return Collections.unmodifiableList(fields);
	}

	public boolean isRest() {
		return rest;
	}

	@Override
	public <T, E extends Throwable> T accept(RustPatternVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(path, fields, rest);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustStructPattern that = (RustStructPattern) obj;
		return Objects.equals(path, that.path) &&
				Objects.equals(fields, that.fields) &&
				rest == that.rest;
	}

}
