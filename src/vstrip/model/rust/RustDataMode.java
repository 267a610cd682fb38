package vstrip.model.rust;

/**
 * The mode of a parameter, field or local: ordinary data, or ghost/tracked
 * data that exists only for verification.
 */
public enum RustDataMode {
	DEFAULT,
	GHOST,
	TRACKED,
}
