package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * <A, B, Item = C> or, for the Fn traits, (A, B) -> C
 */
public class RustGenericArgs extends RustNode {

	private final boolean parenthesized;
	private final List<RustGenericArg> arguments;
	private final RustType output;

	public RustGenericArgs(SourceLocation location, boolean parenthesized, List<RustGenericArg> arguments,
	                       RustType output) {
		super(location);
		this.parenthesized = parenthesized;
		this.arguments = arguments;
		this.output = output;
	}

	public boolean isParenthesized() {
		return parenthesized;
	}

	public List<RustGenericArg> getArguments() {
		return Collections.unmodifiableList(arguments);
	}

	public RustType getOutput() {
		return output;
	}

	@Override
	public <T, E extends Throwable> T accept(RustNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(parenthesized, arguments, output);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustGenericArgs that = (RustGenericArgs) obj;
		return parenthesized == that.parenthesized &&
				Objects.equals(arguments, that.arguments) &&
				Objects.equals(output, that.output);
	}

}
