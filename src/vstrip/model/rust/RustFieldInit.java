package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Objects;

/**
 * name: value inside a struct literal. The value is null for the shorthand form.
 */
public class RustFieldInit extends RustNode {

	private final String name;
	private final RustExpression value;

	public RustFieldInit(SourceLocation location, String name, RustExpression value) {
		super(location);
		this.name = name;
		this.value = value;
	}

	public String getName() {
		return name;
	}

	public RustExpression getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(RustNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, value);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustFieldInit that = (RustFieldInit) obj;
		return Objects.equals(name, that.name) &&
				Objects.equals(value, that.value);
	}

}
