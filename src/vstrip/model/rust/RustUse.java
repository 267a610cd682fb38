package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class RustUse extends RustItem {

	private final boolean broadcast;
	private final RustUseTree tree;

	public RustUse(SourceLocation location, List<RustAttribute> attributes, String visibility, boolean broadcast,
	               RustUseTree tree) {
		super(location, attributes, visibility);
		this.broadcast = broadcast;
		this.tree = tree;
	}

	public boolean isBroadcast() {
		return broadcast;
	}

	public RustUseTree getTree() {
		return tree;
	}

	@Override
	public <T, E extends Throwable> T accept(RustItemVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getAttributes(), getVisibility(), broadcast, tree);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustUse that = (RustUse) obj;
		return Objects.equals(getAttributes(), that.getAttributes()) &&
				Objects.equals(getVisibility(), that.getVisibility()) &&
				broadcast == that.broadcast &&
				Objects.equals(tree, that.tree);
	}

}
