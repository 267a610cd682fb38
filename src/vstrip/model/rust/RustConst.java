package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * const and static items. The keyword is either "const" or "static".
 */
public class RustConst extends RustItem {

	private final RustFunctionMode mode;
	private final List<String> modeQualifiers;
	private final String keyword;
	private final boolean mutable;
	private final String name;
	private final RustType type;
	private final RustExpression value;

	public RustConst(SourceLocation location, List<RustAttribute> attributes, String visibility, RustFunctionMode mode,
	                 List<String> modeQualifiers, String keyword, boolean mutable, String name, RustType type,
	                 RustExpression value) {
		super(location, attributes, visibility);
		this.mode = mode;
		this.modeQualifiers = modeQualifiers;
		this.keyword = keyword;
		this.mutable = mutable;
		this.name = name;
		this.type = type;
		this.value = value;
	}

	public RustFunctionMode getMode() {
		return mode;
	}

	public List<String> getModeQualifiers() {
		return Collections.unmodifiableList(modeQualifiers);
	}

	public String getKeyword() {
		return keyword;
	}

	public boolean isMutable() {
		return mutable;
	}

	public String getName() {
		return name;
	}

	public RustType getType() {
		return type;
	}

	public RustExpression getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(RustItemVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getAttributes(), getVisibility(), mode, modeQualifiers, keyword, mutable, name, type,
				value);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustConst that = (RustConst) obj;
		return Objects.equals(getAttributes(), that.getAttributes()) &&
				Objects.equals(getVisibility(), that.getVisibility()) &&
				mode == that.mode &&
				Objects.equals(modeQualifiers, that.modeQualifiers) &&
				Objects.equals(keyword, that.keyword) &&
				mutable == that.mutable &&
				Objects.equals(name, that.name) &&
				Objects.equals(type, that.type) &&
				Objects.equals(value, that.value);
	}

}
