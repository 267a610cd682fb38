package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * broadcast group name { member, ... }
 */
public class RustBroadcastGroup extends RustItem {

	private final String name;
	private final List<RustPath> members;

	public RustBroadcastGroup(SourceLocation location, List<RustAttribute> attributes, String visibility, String name,
	                          List<RustPath> members) {
		super(location, attributes, visibility);
		this.name = name;
		this.members = members;
	}

	public String getName() {
		return name;
	}

	public List<RustPath> getMembers() {
		return Collections.unmodifiableList(members);
	}

	@Override
	public <T, E extends Throwable> T accept(RustItemVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getAttributes(), getVisibility(), name, members);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustBroadcastGroup that = (RustBroadcastGroup) obj;
		return Objects.equals(getAttributes(), that.getAttributes()) &&
				Objects.equals(getVisibility(), that.getVisibility()) &&
				Objects.equals(name, that.name) &&
				Objects.equals(members, that.members);
	}

}
