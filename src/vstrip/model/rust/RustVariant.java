package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class RustVariant extends RustNode {

	private final List<RustAttribute> attributes;
	private final String name;
	private final RustFieldsStyle style;
	private final List<RustField> fields;
	private final RustExpression discriminant;

	public RustVariant(SourceLocation location, List<RustAttribute> attributes, String name, RustFieldsStyle style,
	                   List<RustField> fields, RustExpression discriminant) {
		super(location);
		this.attributes = attributes;
		this.name = name;
		this.style = style;
		this.fields = fields;
		this.discriminant = discriminant;
	}

	public List<RustAttribute> getAttributes() {
		return Collections.unmodifiableList(attributes);
	}

	public String getName() {
		return name;
	}

	public RustFieldsStyle getStyle() {
		return style;
	}

	public List<RustField> getFields() {
		return Collections.unmodifiableList(fields);
	}

	public RustExpression getDiscriminant() {
		return discriminant;
	}

	@Override
	public <T, E extends Throwable> T accept(RustNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(attributes, name, style, fields, discriminant);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustVariant that = (RustVariant) obj;
		return Objects.equals(attributes, that.attributes) &&
				Objects.equals(name, that.name) &&
				style == that.style &&
				Objects.equals(fields, that.fields) &&
				Objects.equals(discriminant, that.discriminant);
	}

}
