package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Objects;

/**
 * ref mut name @ subpattern
 */
public class RustIdentPattern extends RustPattern {

	private final boolean byRef;
	private final boolean mutable;
	private final String name;
	private final RustPattern subpattern;

	public RustIdentPattern(SourceLocation location, boolean byRef, boolean mutable, String name,
	                        RustPattern subpattern) {
		super(location);
		this.byRef = byRef;
		this.mutable = mutable;
		this.name = name;
		this.subpattern = subpattern;
	}

	public boolean isByRef() {
		return byRef;
	}

	public boolean isMutable() {
		return mutable;
	}

	public String getName() {
		return name;
	}

	public RustPattern getSubpattern() {
		return subpattern;
	}

	@Override
	public <T, E extends Throwable> T accept(RustPatternVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(byRef, mutable, name, subpattern);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustIdentPattern that = (RustIdentPattern) obj;
		return byRef == that.byRef &&
				mutable == that.mutable &&
				Objects.equals(name, that.name) &&
				Objects.equals(subpattern, that.subpattern);
	}

}
