package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Collections;
import java.util.List;

public abstract class RustItem extends RustNode {

	private final List<RustAttribute> attributes;
	private final String visibility;

	public RustItem(SourceLocation location, List<RustAttribute> attributes, String visibility) {
		super(location);
		this.attributes = attributes;
		this.visibility = visibility;
	}

	/**
	 * @return the outer attributes and doc comments of this item, in source order
	 */
	public List<RustAttribute> getAttributes() {
		return Collections.unmodifiableList(attributes);
	}

	/**
	 * @return the visibility, e.g. "pub" or "pub(crate)", or the empty string
	 */
	public String getVisibility() {
		return visibility;
	}

	@Override
	public <T, E extends Throwable> T accept(RustNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	public abstract <T, E extends Throwable> T accept(RustItemVisitor<T, E> v) throws E;
}
