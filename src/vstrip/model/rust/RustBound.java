package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A trait bound such as ?Sized or for<'a> Fn(&'a T), or a lifetime bound.
 */
public class RustBound extends RustNode {

	private final String lifetime;
	private final boolean maybe;
	private final List<String> forLifetimes;
	private final RustPath path;

	public RustBound(SourceLocation location, String lifetime, boolean maybe, List<String> forLifetimes,
	                 RustPath path) {
		super(location);
		this.lifetime = lifetime;
		this.maybe = maybe;
		this.forLifetimes = forLifetimes;
		this.path = path;
	}

	public String getLifetime() {
		return lifetime;
	}

	public boolean isMaybe() {
		return maybe;
	}

	public List<String> getForLifetimes() {
		return Collections.unmodifiableList(forLifetimes);
	}

	public RustPath getPath() {
		return path;
	}

	@Override
	public <T, E extends Throwable> T accept(RustNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(lifetime, maybe, forLifetimes, path);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustBound that = (RustBound) obj;
		return Objects.equals(lifetime, that.lifetime) &&
				maybe == that.maybe &&
				Objects.equals(forLifetimes, that.forLifetimes) &&
				Objects.equals(path, that.path);
	}

}
