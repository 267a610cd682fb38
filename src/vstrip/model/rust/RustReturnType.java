package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Objects;

/**
 * -> T, -> (name: T) or -> (tracked name: T)
 */
public class RustReturnType extends RustNode {

	private final RustDataMode mode;
	private final String name;
	private final RustType type;

	public RustReturnType(SourceLocation location, RustDataMode mode, String name, RustType type) {
		super(location);
		this.mode = mode;
		this.name = name;
		this.type = type;
	}

	public RustDataMode getMode() {
		return mode;
	}

	public String getName() {
		return name;
	}

	public RustType getType() {
		return type;
	}

	@Override
	public <T, E extends Throwable> T accept(RustNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(mode, name, type);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustReturnType that = (RustReturnType) obj;
		return mode == that.mode &&
				Objects.equals(name, that.name) &&
				Objects.equals(type, that.type);
	}

}
