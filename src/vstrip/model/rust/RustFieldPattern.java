package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Objects;

public class RustFieldPattern extends RustNode {

	private final String name;
	private final RustPattern pattern;
	private final boolean shorthand;

	public RustFieldPattern(SourceLocation location, String name, RustPattern pattern, boolean shorthand) {
		super(location);
		this.name = name;
		this.pattern = pattern;
		this.shorthand = shorthand;
	}

	public String getName() {
		return name;
	}

	public RustPattern getPattern() {
		return pattern;
	}

	public boolean isShorthand() {
		return shorthand;
	}

	@Override
	public <T, E extends Throwable> T accept(RustNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, pattern, shorthand);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustFieldPattern that = (RustFieldPattern) obj;
		return Objects.equals(name, that.name) &&
				Objects.equals(pattern, that.pattern) &&
				shorthand == that.shorthand;
	}

}
