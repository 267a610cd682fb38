package vstrip.trans.batch;

/**
 * Where stripped files go.
 */
public enum OutputMode {
	STANDARD_OUTPUT,
	OUTPUT_FILE,
	IN_PLACE,
	CHECK,
}
