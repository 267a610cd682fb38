package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 'a: 'b, T: Bound = Default or const N: usize = 3
 */
public class RustGenericParam extends RustNode {

	public enum Kind {
		LIFETIME,
		TYPE,
		CONST,
	}

	private final List<RustAttribute> attributes;
	private final Kind kind;
	private final String name;
	private final List<RustBound> bounds;
	private final RustType type;
	private final RustType defaultType;
	private final RustExpression defaultValue;

	public RustGenericParam(SourceLocation location, List<RustAttribute> attributes, Kind kind, String name,
	                        List<RustBound> bounds, RustType type, RustType defaultType, RustExpression defaultValue) {
		super(location);
		this.attributes = attributes;
		this.kind = kind;
		this.name = name;
		this.bounds = bounds;
		this.type = type;
		this.defaultType = defaultType;
		this.defaultValue = defaultValue;
	}

	public List<RustAttribute> getAttributes() {
		return Collections.unmodifiableList(attributes);
	}

	public Kind getKind() {
		return kind;
	}

	public String getName() {
		return name;
	}

	public List<RustBound> getBounds() {
		return Collections.unmodifiableList(bounds);
	}

	public RustType getType() {
		return type;
	}

	public RustType getDefaultType() {
		return defaultType;
	}

	public RustExpression getDefaultValue() {
		return defaultValue;
	}

	@Override
	public <T, E extends Throwable> T accept(RustNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(attributes, kind, name, bounds, type, defaultType, defaultValue);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustGenericParam that = (RustGenericParam) obj;
		return Objects.equals(attributes, that.attributes) &&
				kind == that.kind &&
				Objects.equals(name, that.name) &&
				Objects.equals(bounds, that.bounds) &&
				Objects.equals(type, that.type) &&
				Objects.equals(defaultType, that.defaultType) &&
				Objects.equals(defaultValue, that.defaultValue);
	}

}
