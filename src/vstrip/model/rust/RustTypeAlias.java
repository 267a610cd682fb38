package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class RustTypeAlias extends RustItem {

	private final String name;
	private final List<RustGenericParam> generics;
	private final List<RustBound> bounds;
	private final List<RustWherePredicate> whereClause;
	private final RustType type;

	public RustTypeAlias(SourceLocation location, List<RustAttribute> attributes, String visibility, String name,
	                     List<RustGenericParam> generics, List<RustBound> bounds, List<RustWherePredicate> whereClause,
	                     RustType type) {
		super(location, attributes, visibility);
		this.name = name;
		this.generics = generics;
		this.bounds = bounds;
		this.whereClause = whereClause;
		this.type = type;
	}

	public String getName() {
		return name;
	}

	public List<RustGenericParam> getGenerics() {
		return Collections.unmodifiableList(generics);
	}

	public List<RustBound> getBounds() {
		return Collections.unmodifiableList(bounds);
	}

	public List<RustWherePredicate> getWhereClause() {
		return Collections.unmodifiableList(whereClause);
	}

	public RustType getType() {
		return type;
	}

	@Override
	public <T, E extends Throwable> T accept(RustItemVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getAttributes(), getVisibility(), name, generics, bounds, whereClause, type);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustTypeAlias that = (RustTypeAlias) obj;
		return Objects.equals(getAttributes(), that.getAttributes()) &&
				Objects.equals(getVisibility(), that.getVisibility()) &&
				Objects.equals(name, that.name) &&
				Objects.equals(generics, that.generics) &&
				Objects.equals(bounds, that.bounds) &&
				Objects.equals(whereClause, that.whereClause) &&
				Objects.equals(type, that.type);
	}

}
