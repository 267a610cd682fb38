package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 'label: unsafe { ... }, async move { ... } and plain blocks
 */
public class RustBlockExpression extends RustExpression {

	private final String label;
	private final List<String> modifiers;
	private final RustBlock block;

	public RustBlockExpression(SourceLocation location, String label, List<String> modifiers, RustBlock block) {
		super(location);
		this.label = label;
		this.modifiers = modifiers;
		this.block = block;
	}

	public String getLabel() {
		return label;
	}

	public List<String> getModifiers() {
		return Collections.unmodifiableList(modifiers);
	}

	public RustBlock getBlock() {
		return block;
	}

	@Override
	public <T, E extends Throwable> T accept(RustExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(label, modifiers, block);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustBlockExpression that = (RustBlockExpression) obj;
		return Objects.equals(label, that.label) &&
				Objects.equals(modifiers, that.modifiers) &&
				Objects.equals(block, that.block);
	}

}
