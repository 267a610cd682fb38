package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * dyn A + B, impl A + B, or a bare trait object when the keyword is empty
 */
public class RustTraitObjectType extends RustType {

	private final String keyword;
	private final List<RustBound> bounds;

	public RustTraitObjectType(SourceLocation location, String keyword, List<RustBound> bounds) {
		super(location);
		this.keyword = keyword;
		this.bounds = bounds;
	}

	public String getKeyword() {
		return keyword;
	}

	public List<RustBound> getBounds() {
		return Collections.unmodifiableList(bounds);
	}

	@Override
	public <T, E extends Throwable> T accept(RustTypeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(keyword, bounds);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustTraitObjectType that = (RustTraitObjectType) obj;
		return Objects.equals(keyword, that.keyword) &&
				Objects.equals(bounds, that.bounds);
	}

}
