package vstrip.trans.passes.classify;

import vstrip.InternalCompilerError;
import vstrip.model.rust.RustFieldInit;
import vstrip.model.rust.RustNode;
import vstrip.scope.UID;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * The result of classifying one source unit: a Kind for every item,
 * statement, attribute and verification clause, and a GhostMarker for every
 * parameter, field and struct literal field initializer. Both tables are keyed
 * by node identity, so the tree itself is never annotated.
 */
public class Classification {

	private final Map<UID, Kind> kinds = new HashMap<>();
	private final Map<UID, GhostMarker> markers = new HashMap<>();
	private final Map<String, Set<String>> ghostFields = new HashMap<>();

	void setKind(RustNode node, Kind kind) {
		if (kinds.put(node.getUID(), kind) != null) {
			throw new InternalCompilerError("node classified twice: " + node);
		}
	}

	void setGhostMarker(RustNode node, GhostMarker marker) {
		if (markers.put(node.getUID(), marker) != null) {
			throw new InternalCompilerError("ghost marker assigned twice: " + node);
		}
	}

	void addGhostField(String typeName, String fieldName) {
		ghostFields.computeIfAbsent(typeName, k -> new HashSet<>()).add(fieldName);
	}

	/**
	 * @return whether some struct or enum variant named typeName in this unit
	 * declares fieldName as a ghost or tracked field
	 */
	public boolean isGhostField(String typeName, String fieldName) {
		Set<String> fields = ghostFields.get(typeName);
		return fields != null && fields.contains(fieldName);
	}

	public Kind getKind(RustNode node) {
		Kind kind = kinds.get(node.getUID());
		if (kind == null) {
			throw new InternalCompilerError("node was not classified: " + node);
		}
		return kind;
	}

	public GhostMarker getGhostMarker(RustNode node) {
		GhostMarker marker = markers.get(node.getUID());
		if (marker == null) {
			throw new InternalCompilerError("no ghost marker for " + node);
		}
		return marker;
	}

	/**
	 * @return whether node is kept by the stripper
	 */
	public boolean isRetained(RustNode node) {
		return getKind(node) == Kind.EXECUTABLE;
	}

	public boolean isGhost(RustNode node) {
		return getGhostMarker(node) != GhostMarker.NONE;
	}

	/**
	 * Struct literals are only marked where they are reached by the classifier,
	 * so an unmarked initializer is kept.
	 */
	public boolean isGhostInitializer(RustFieldInit init) {
		return markers.getOrDefault(init.getUID(), GhostMarker.NONE) != GhostMarker.NONE;
	}

	public int count(Kind kind) {
		int count = 0;
		for (Kind k : kinds.values()) {
			if (k == kind) {
				++count;
			}
		}
		return count;
	}

}
