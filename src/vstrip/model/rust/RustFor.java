package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * for pattern in iterable { body }, or with a named ghost iterator,
 * for pattern in name: iterable, that invariants may refer to
 */
public class RustFor extends RustExpression {

	private final String label;
	private final RustPattern pattern;
	private final String iteratorName;
	private final RustExpression iterable;
	private final List<RustSpecClause> specClauses;
	private final RustBlock body;

	public RustFor(SourceLocation location, String label, RustPattern pattern, String iteratorName,
	               RustExpression iterable, List<RustSpecClause> specClauses, RustBlock body) {
		super(location);
		this.label = label;
		this.pattern = pattern;
		this.iteratorName = iteratorName;
		this.iterable = iterable;
		this.specClauses = specClauses;
		this.body = body;
	}

	public String getLabel() {
		return label;
	}

	public RustPattern getPattern() {
		return pattern;
	}

	public String getIteratorName() {
		return iteratorName;
	}

	public RustExpression getIterable() {
		return iterable;
	}

	public List<RustSpecClause> getSpecClauses() {
		return Collections.unmodifiableList(specClauses);
	}

	public RustBlock getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(RustExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(label, pattern, iteratorName, iterable, specClauses, body);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustFor that = (RustFor) obj;
		return Objects.equals(label, that.label) &&
				Objects.equals(pattern, that.pattern) &&
				Objects.equals(iteratorName, that.iteratorName) &&
				Objects.equals(iterable, that.iterable) &&
				Objects.equals(specClauses, that.specClauses) &&
				Objects.equals(body, that.body);
	}

}
