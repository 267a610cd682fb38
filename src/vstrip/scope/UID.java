package vstrip.scope;

import java.util.concurrent.atomic.AtomicLong;

/**
 * An identity for a syntax tree node. Two structurally equal nodes parsed from
 * different places have different UIDs, which lets passes attach facts to one
 * specific node.
 */
public class UID implements Comparable<UID> {
	private static final AtomicLong counter = new AtomicLong();

	private final long id;

	public UID() {
		this.id = counter.getAndIncrement();
	}

	public long getId() {
		return id;
	}

	@Override
	public int compareTo(UID o) {
		return Long.compare(id, o.id);
	}

	@Override
	public String toString() {
		return "UID(" + id + ")";
	}
}
