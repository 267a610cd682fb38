package vstrip.trans.passes.classify;

/**
 * What a construct exists for. Only {@link #EXECUTABLE} constructs survive
 * stripping.
 */
public enum Kind {
	EXECUTABLE,
	SPECIFICATION,
	PROOF,
	GHOST_DATA,
}
