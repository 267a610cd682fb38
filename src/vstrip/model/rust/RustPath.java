package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A path such as a::b::<T>::c, ::std::mem or <T as Trait>::Item.
 */
public class RustPath extends RustNode {

	private final RustType qualifiedSelf;
	private final RustPath qualifiedTrait;
	private final boolean global;
	private final List<RustPathSegment> segments;

	public RustPath(SourceLocation location, RustType qualifiedSelf, RustPath qualifiedTrait, boolean global,
	                List<RustPathSegment> segments) {
		super(location);
		this.qualifiedSelf = qualifiedSelf;
		this.qualifiedTrait = qualifiedTrait;
		this.global = global;
		this.segments = segments;
	}

	public RustType getQualifiedSelf() {
		return qualifiedSelf;
	}

	public RustPath getQualifiedTrait() {
		return qualifiedTrait;
	}

	public boolean isGlobal() {
		return global;
	}

	public List<RustPathSegment> getSegments() {
		return Collections.unmodifiableList(segments);
	}

	public boolean isSimple(String... names) {
		if (qualifiedSelf != null || global || segments.size() != names.length) {
			return false;
		}
		for (int i = 0; i < names.length; i++) {
			if (!segments.get(i).getName().equals(names[i]) || segments.get(i).getArguments() != null) {
				return false;
			}
		}
		return true;
	}

	public String getLastName() {
		return segments.get(segments.size() - 1).getName();
	}

	public String getFirstName() {
		return segments.get(0).getName();
	}

	@Override
	public <T, E extends Throwable> T accept(RustNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(qualifiedSelf, qualifiedTrait, global, segments);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustPath that = (RustPath) obj;
		return Objects.equals(qualifiedSelf, that.qualifiedSelf) &&
				Objects.equals(qualifiedTrait, that.qualifiedTrait) &&
				global == that.global &&
				Objects.equals(segments, that.segments);
	}

}
