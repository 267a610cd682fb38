package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class RustWherePredicate extends RustNode {

	private final List<String> forLifetimes;
	private final RustType boundedType;
	private final String boundedLifetime;
	private final List<RustBound> bounds;

	public RustWherePredicate(SourceLocation location, List<String> forLifetimes, RustType boundedType,
	                          String boundedLifetime, List<RustBound> bounds) {
		super(location);
		this.forLifetimes = forLifetimes;
		this.boundedType = boundedType;
		this.boundedLifetime = boundedLifetime;
		this.bounds = bounds;
	}

	public List<String> getForLifetimes() {
		return Collections.unmodifiableList(forLifetimes);
	}

	public RustType getBoundedType() {
		return boundedType;
	}

	public String getBoundedLifetime() {
		return boundedLifetime;
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
		return Objects.hash(forLifetimes, boundedType, boundedLifetime, bounds);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustWherePredicate that = (RustWherePredicate) obj;
		return Objects.equals(forLifetimes, that.forLifetimes) &&
				Objects.equals(boundedType, that.boundedType) &&
				Objects.equals(boundedLifetime, that.boundedLifetime) &&
				Objects.equals(bounds, that.bounds);
	}

}
