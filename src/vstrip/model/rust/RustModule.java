package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * mod name { items } or, when items is null, mod name;
 */
public class RustModule extends RustItem {

	private final boolean unsafe;
	private final String name;
	private final List<RustAttribute> innerAttributes;
	private final List<RustItem> items;

	public RustModule(SourceLocation location, List<RustAttribute> attributes, String visibility, boolean unsafe,
	                  String name, List<RustAttribute> innerAttributes, List<RustItem> items) {
		super(location, attributes, visibility);
		this.unsafe = unsafe;
		this.name = name;
		this.innerAttributes = innerAttributes;
		this.items = items;
	}

	public boolean isUnsafe() {
		return unsafe;
	}

	public String getName() {
		return name;
	}

	public List<RustAttribute> getInnerAttributes() {
		return Collections.unmodifiableList(innerAttributes);
	}

	public List<RustItem> getItems() {
		return items == null ? null : Collections.unmodifiableList(items);
	}

	@Override
	public <T, E extends Throwable> T accept(RustItemVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getAttributes(), getVisibility(), unsafe, name, innerAttributes, items);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustModule that = (RustModule) obj;
		return Objects.equals(getAttributes(), that.getAttributes()) &&
				Objects.equals(getVisibility(), that.getVisibility()) &&
				unsafe == that.unsafe &&
				Objects.equals(name, that.name) &&
				Objects.equals(innerAttributes, that.innerAttributes) &&
				Objects.equals(items, that.items);
	}

}
