package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class RustStruct extends RustItem {

	private final String name;
	private final List<RustGenericParam> generics;
	private final List<RustWherePredicate> whereClause;
	private final RustFieldsStyle style;
	private final List<RustField> fields;

	public RustStruct(SourceLocation location, List<RustAttribute> attributes, String visibility, String name,
	                  List<RustGenericParam> generics, List<RustWherePredicate> whereClause, RustFieldsStyle style,
	                  List<RustField> fields) {
		super(location, attributes, visibility);
		this.name = name;
		this.generics = generics;
		this.whereClause = whereClause;
		this.style = style;
		this.fields = fields;
	}

	public String getName() {
		return name;
	}

	public List<RustGenericParam> getGenerics() {
		return Collections.unmodifiableList(generics);
	}

	public List<RustWherePredicate> getWhereClause() {
		return Collections.unmodifiableList(whereClause);
	}

	public RustFieldsStyle getStyle() {
		return style;
	}

	public List<RustField> getFields() {
		return Collections.unmodifiableList(fields);
	}

	@Override
	public <T, E extends Throwable> T accept(RustItemVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getAttributes(), getVisibility(), name, generics, whereClause, style, fields);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustStruct that = (RustStruct) obj;
		return Objects.equals(getAttributes(), that.getAttributes()) &&
				Objects.equals(getVisibility(), that.getVisibility()) &&
				Objects.equals(name, that.name) &&
				Objects.equals(generics, that.generics) &&
				Objects.equals(whereClause, that.whereClause) &&
				style == that.style &&
				Objects.equals(fields, that.fields);
	}

}
