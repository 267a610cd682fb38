package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The tree of a use declaration.
 *
 * PATH is name::child, NAME is a leaf with an optional rename, GLOB is * and
 * GROUP is {a, b, c}. A leading :: is a PATH with an empty name.
 */
public class RustUseTree extends RustNode {

	public enum Kind {
		PATH,
		NAME,
		GLOB,
		GROUP,
	}

	private final Kind kind;
	private final String name;
	private final String rename;
	private final RustUseTree child;
	private final List<RustUseTree> group;

	public RustUseTree(SourceLocation location, Kind kind, String name, String rename, RustUseTree child,
	                   List<RustUseTree> group) {
		super(location);
		this.kind = kind;
		this.name = name;
		this.rename = rename;
		this.child = child;
		this.group = group;
	}

	public Kind getKind() {
		return kind;
	}

	public String getName() {
		return name;
	}

	public String getRename() {
		return rename;
	}

	public RustUseTree getChild() {
		return child;
	}

	public List<RustUseTree> getGroup() {
		return Collections.unmodifiableList(group);
	}

	public List<String> getLeadingNames() {
		List<String> names = new ArrayList<>();
		RustUseTree tree = this;
		while (tree.kind == Kind.PATH) {
			names.add(tree.name);
			tree = tree.child;
		}
		if (tree.kind == Kind.NAME) {
			names.add(tree.name);
		}
		return names;
	}

	@Override
	public <T, E extends Throwable> T accept(RustNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, name, rename, child, group);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustUseTree that = (RustUseTree) obj;
		return kind == that.kind &&
				Objects.equals(name, that.name) &&
				Objects.equals(rename, that.rename) &&
				Objects.equals(child, that.child) &&
				Objects.equals(group, that.group);
	}

}
