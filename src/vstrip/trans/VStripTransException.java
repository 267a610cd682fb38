package vstrip.trans;

import vstrip.VStripException;

/**
 * Exception raised while turning a Verus source file into plain Rust
 */
public class VStripTransException extends VStripException {

	private static final long serialVersionUID = -1752641749710219477L;
	private static final String prefix = "Stripping Error";

	public VStripTransException(String msg) {
		super(prefix, msg);
	}

}
