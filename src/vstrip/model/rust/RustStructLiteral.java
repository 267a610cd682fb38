package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Path { field: value, ..base }
 */
public class RustStructLiteral extends RustExpression {

	private final RustPath path;
	private final List<RustFieldInit> fields;
	private final RustExpression base;

	public RustStructLiteral(SourceLocation location, RustPath path, List<RustFieldInit> fields, RustExpression base) {
		super(location);
		this.path = path;
		this.fields = fields;
		this.base = base;
	}

	public RustPath getPath() {
		return path;
	}

	public List<RustFieldInit> getFields() {
		return Collections.unmodifiableList(fields);
	}

	public RustExpression getBase() {
		return base;
	}

	@Override
	public <T, E extends Throwable> T accept(RustExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(path, fields, base);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustStructLiteral that = (RustStructLiteral) obj;
		return Objects.equals(path, that.path) &&
				Objects.equals(fields, that.fields) &&
				Objects.equals(base, that.base);
	}

}
