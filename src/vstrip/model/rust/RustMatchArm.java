package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class RustMatchArm extends RustNode {

	private final List<RustAttribute> attributes;
	private final RustPattern pattern;
	private final RustExpression guard;
	private final RustExpression body;

	public RustMatchArm(SourceLocation location, List<RustAttribute> attributes, RustPattern pattern,
	                    RustExpression guard, RustExpression body) {
		super(location);
		this.attributes = attributes;
		this.pattern = pattern;
		this.guard = guard;
		this.body = body;
	}

	public List<RustAttribute> getAttributes() {
		return Collections.unmodifiableList(attributes);
	}

	public RustPattern getPattern() {
		return pattern;
	}

	public RustExpression getGuard() {
		return guard;
	}

	public RustExpression getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(RustNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(attributes, pattern, guard, body);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustMatchArm that = (RustMatchArm) obj;
		return Objects.equals(attributes, that.attributes) &&
				Objects.equals(pattern, that.pattern) &&
				Objects.equals(guard, that.guard) &&
				Objects.equals(body, that.body);
	}

}
