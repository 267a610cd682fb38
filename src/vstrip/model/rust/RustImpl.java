package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * impl<T> Trait for Type where ... { items }
 */
public class RustImpl extends RustItem {

	private final boolean unsafe;
	private final List<RustGenericParam> generics;
	private final boolean negative;
	private final RustType trait;
	private final RustType selfType;
	private final List<RustWherePredicate> whereClause;
	private final List<RustItem> items;

	public RustImpl(SourceLocation location, List<RustAttribute> attributes, String visibility, boolean unsafe,
	                List<RustGenericParam> generics, boolean negative, RustType trait, RustType selfType,
	                List<RustWherePredicate> whereClause, List<RustItem> items) {
		super(location, attributes, visibility);
		this.unsafe = unsafe;
		this.generics = generics;
		this.negative = negative;
		this.trait = trait;
		this.selfType = selfType;
		this.whereClause = whereClause;
		this.items = items;
	}

	public boolean isUnsafe() {
		return unsafe;
	}

	public List<RustGenericParam> getGenerics() {
		return Collections.unmodifiableList(generics);
	}

	public boolean isNegative() {
		return negative;
	}

	public RustType getTrait() {
		return trait;
	}

	public RustType getSelfType() {
		return selfType;
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
		return Objects.hash(getAttributes(), getVisibility(), unsafe, generics, negative, trait, selfType, whereClause,
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
		RustImpl that = (RustImpl) obj;
		return Objects.equals(getAttributes(), that.getAttributes()) &&
				Objects.equals(getVisibility(), that.getVisibility()) &&
				unsafe == that.unsafe &&
				Objects.equals(generics, that.generics) &&
				negative == that.negative &&
				Objects.equals(trait, that.trait) &&
				Objects.equals(selfType, that.selfType) &&
				Objects.equals(whereClause, that.whereClause) &&
				Objects.equals(items, that.items);
	}

}
