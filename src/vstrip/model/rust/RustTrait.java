package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class RustTrait extends RustItem {

	private final boolean unsafe;
	private final boolean auto;
	private final String name;
	private final List<RustGenericParam> generics;
	private final List<RustBound> supertraits;
	private final List<RustWherePredicate> whereClause;
	private final List<RustItem> items;

	public RustTrait(SourceLocation location, List<RustAttribute> attributes, String visibility, boolean unsafe,
	                 boolean auto, String name, List<RustGenericParam> generics, List<RustBound> supertraits,
	                 List<RustWherePredicate> whereClause, List<RustItem> items) {
		super(location, attributes, visibility);
		this.unsafe = unsafe;
		this.auto = auto;
		this.name = name;
		this.generics = generics;
		this.supertraits = supertraits;
		this.whereClause = whereClause;
		this.items = items;
	}

	public boolean isUnsafe() {
		return unsafe;
	}

	public boolean isAuto() {
		return auto;
	}

	public String getName() {
		return name;
	}

	public List<RustGenericParam> getGenerics() {
		return Collections.unmodifiableList(generics);
	}

	public List<RustBound> getSupertraits() {
		return Collections.unmodifiableList(supertraits);
	}

	public List<RustWherePredicate> getWhereClause() {
		return Collections.unmodifiableList(whereClause);
	}

	public List<RustItem> getItems() {
		return Collections.unmodifiableList(items);
	}

	@Override
	public <T, E extends Throwable> T accept(RustItemVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getAttributes(), getVisibility(), unsafe, auto, name, generics, supertraits, whereClause,
				items);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustTrait that = (RustTrait) obj;
		return Objects.equals(getAttributes(), that.getAttributes()) &&
				Objects.equals(getVisibility(), that.getVisibility()) &&
				unsafe == that.unsafe &&
				auto == that.auto &&
				Objects.equals(name, that.name) &&
				Objects.equals(generics, that.generics) &&
				Objects.equals(supertraits, that.supertraits) &&
				Objects.equals(whereClause, that.whereClause) &&
				Objects.equals(items, that.items);
	}

}
