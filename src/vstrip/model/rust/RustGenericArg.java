package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class RustGenericArg extends RustNode {

	public enum Kind {
		LIFETIME,
		TYPE,
		CONST,
		BINDING,
		CONSTRAINT,
	}

	private final Kind kind;
	private final String lifetime;
	private final RustType type;
	private final RustExpression value;
	private final String name;
	private final List<RustBound> bounds;

	public RustGenericArg(SourceLocation location, Kind kind, String lifetime, RustType type, RustExpression value,
	                      String name, List<RustBound> bounds) {
		super(location);
		this.kind = kind;
		this.lifetime = lifetime;
		this.type = type;
		this.value = value;
		this.name = name;
		this.bounds = bounds;
	}

	public Kind getKind() {
		return kind;
	}

	public String getLifetime() {
		return lifetime;
	}

	public RustType getType() {
		return type;
	}

	public RustExpression getValue() {
		return value;
	}

	public String getName() {
		return name;
	}

	public List<RustBound> getBounds() {
		return Collections.unmodifiableList(bounds);
	}

	@Override
	public <T, E extends Throwable> T accept(RustNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, lifetime, type, value, name, bounds);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustGenericArg that = (RustGenericArg) obj;
		return kind == that.kind &&
				Objects.equals(lifetime, that.lifetime) &&
				Objects.equals(type, that.type) &&
				Objects.equals(value, that.value) &&
				Objects.equals(name, that.name) &&
				Objects.equals(bounds, that.bounds);
	}

}
