package vstrip.trans.passes.classify;

public enum GhostMarker {
	NONE,
	GHOST,
	TRACKED,
}
