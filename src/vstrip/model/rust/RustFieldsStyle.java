package vstrip.model.rust;

/**
 * Named fields { a: A }, tuple fields (A, B), or no fields at all.
 */
public enum RustFieldsStyle {
	NAMED,
	TUPLE,
	UNIT,
}
