package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The root of a parsed file: its inner attributes followed by its items.
 */
public class RustSourceUnit extends RustNode {

	private final List<RustAttribute> innerAttributes;
	private final List<RustItem> items;

	public RustSourceUnit(SourceLocation location, List<RustAttribute> innerAttributes, List<RustItem> items) {
		super(location);
		this.innerAttributes = innerAttributes;
		this.items = items;
	}

	public List<RustAttribute> getInnerAttributes() {
		return Collections.unmodifiableList(innerAttributes);
	}

	public List<RustItem> getItems() {
		return Collections.unmodifiableList(items);
	}

	@Override
	public <T, E extends Throwable> T accept(RustNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(innerAttributes, items);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustSourceUnit that = (RustSourceUnit) obj;
		return Objects.equals(innerAttributes, that.innerAttributes) &&
				Objects.equals(items, that.items);
	}

}
