package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A struct or variant field. Tuple fields have no name.
 */
public class RustField extends RustNode {

	private final List<RustAttribute> attributes;
	private final String visibility;
	private final RustDataMode mode;
	private final String name;
	private final RustType type;

	public RustField(SourceLocation location, List<RustAttribute> attributes, String visibility, RustDataMode mode,
	                 String name, RustType type) {
		super(location);
		this.attributes = attributes;
		this.visibility = visibility;
		this.mode = mode;
		this.name = name;
		this.type = type;
	}

	public List<RustAttribute> getAttributes() {
		return Collections.unmodifiableList(attributes);
	}

	public String getVisibility() {
		return visibility;
	}

	public RustDataMode getMode() {
		return mode;
	}

	public String getName() {
		return name;
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
		return Objects.hash(attributes, visibility, mode, name, type);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustField that = (RustField) obj;
		return Objects.equals(attributes, that.attributes) &&
				Objects.equals(visibility, that.visibility) &&
				mode == that.mode &&
				Objects.equals(name, that.name) &&
				Objects.equals(type, that.type);
	}

}
