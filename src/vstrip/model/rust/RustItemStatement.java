package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Objects;

public class RustItemStatement extends RustStatement {

	private final RustItem item;

	public RustItemStatement(SourceLocation location, RustItem item) {
		super(location);
		this.item = item;
	}

	public RustItem getItem() {
		return item;
	}

	@Override
	public <T, E extends Throwable> T accept(RustStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(item);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustItemStatement that = (RustItemStatement) obj;
		return Objects.equals(item, that.item);
	}

}
