package vstrip.model.rust;

import vstrip.Unreachable;
import vstrip.formatters.IndentingWriter;
import vstrip.formatters.RustNodeFormattingVisitor;
import vstrip.scope.UID;
import vstrip.util.SourceLocatable;
import vstrip.util.SourceLocation;

import java.io.IOException;
import java.io.StringWriter;

/**
 * Base class of the Rust syntax tree.
 *
 * Equality is structural and ignores source locations, so a tree and the tree
 * obtained by printing and re-parsing it compare equal.
 */
public abstract class RustNode extends SourceLocatable {

	private final SourceLocation location;
	private final UID uid;

	public RustNode(SourceLocation location) {
		this.location = location;
		this.uid = new UID();
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	public UID getUID() {
		return uid;
	}

	@Override
	public abstract int hashCode();

	@Override
	public abstract boolean equals(Object obj);

	public abstract <T, E extends Throwable> T accept(RustNodeVisitor<T, E> v) throws E;

	@Override
	public String toString() {
		StringWriter w = new StringWriter();
		IndentingWriter out = new IndentingWriter(w);
		try {
			accept(new RustNodeFormattingVisitor(out));
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return w.toString();
	}

}
