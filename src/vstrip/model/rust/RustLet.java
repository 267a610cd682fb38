package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * let [ghost|tracked] pattern: type = init else { ... };
 */
public class RustLet extends RustStatement {

	private final List<RustAttribute> attributes;
	private final RustDataMode mode;
	private final RustPattern pattern;
	private final RustType type;
	private final RustExpression init;
	private final RustBlock elseBlock;

	public RustLet(SourceLocation location, List<RustAttribute> attributes, RustDataMode mode, RustPattern pattern,
	               RustType type, RustExpression init, RustBlock elseBlock) {
		super(location);
		this.attributes = attributes;
		this.mode = mode;
		this.pattern = pattern;
		this.type = type;
		this.init = init;
		this.elseBlock = elseBlock;
	}

	public List<RustAttribute> getAttributes() {
		return Collections.unmodifiableList(attributes);
	}

	public RustDataMode getMode() {
		return mode;
	}

	public RustPattern getPattern() {
		return pattern;
	}

	public RustType getType() {
		return type;
	}

	public RustExpression getInit() {
		return init;
	}

	public RustBlock getElseBlock() {
		return elseBlock;
	}

	@Override
	public <T, E extends Throwable> T accept(RustStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(attributes, mode, pattern, type, init, elseBlock);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustLet that = (RustLet) obj;
		return Objects.equals(attributes, that.attributes) &&
				mode == that.mode &&
				Objects.equals(pattern, that.pattern) &&
				Objects.equals(type, that.type) &&
				Objects.equals(init, that.init) &&
				Objects.equals(elseBlock, that.elseBlock);
	}

}
