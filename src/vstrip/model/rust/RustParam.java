package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A function, closure or quantifier parameter.
 *
 * A self receiver such as &mut self is kept as text in receiver, in which case
 * there is no pattern. Closure and quantifier parameters may have no type.
 */
public class RustParam extends RustNode {

	private final List<RustAttribute> attributes;
	private final RustDataMode mode;
	private final String receiver;
	private final RustPattern pattern;
	private final RustType type;

	public RustParam(SourceLocation location, List<RustAttribute> attributes, RustDataMode mode, String receiver,
	                 RustPattern pattern, RustType type) {
		super(location);
		this.attributes = attributes;
		this.mode = mode;
		this.receiver = receiver;
		this.pattern = pattern;
		this.type = type;
	}

	public List<RustAttribute> getAttributes() {
		return Collections.unmodifiableList(attributes);
	}

	public RustDataMode getMode() {
		return mode;
	}

	public String getReceiver() {
		return receiver;
	}

	public RustPattern getPattern() {
		return pattern;
	}

	public RustType getType() {
		return type;
	}

	@Override
	public <T, E extends Throwable> T accept(RustNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(attributes, mode, receiver, pattern, type);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustParam that = (RustParam) obj;
		return Objects.equals(attributes, that.attributes) &&
				mode == that.mode &&
				Objects.equals(receiver, that.receiver) &&
				Objects.equals(pattern, that.pattern) &&
				Objects.equals(type, that.type);
	}

}
