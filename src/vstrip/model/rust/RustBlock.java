package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class RustBlock extends RustNode {

	private final List<RustStatement> statements;

	public RustBlock(SourceLocation location, List<RustStatement> statements) {
		super(location);
		this.statements = statements;
	}

	public List<RustStatement> getStatements() {
		return Collections.unmodifiableList(statements);
	}

	@Override
	public <T, E extends Throwable> T accept(RustNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(statements);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustBlock that = (RustBlock) obj;
		return Objects.equals(statements, that.statements);
	}

}
