package vstrip.trans.passes.strip;

import vstrip.model.rust.RustSourceUnit;
import vstrip.trans.passes.classify.Classification;

import java.util.logging.Logger;

public class StrippingPass {
	private static final Logger logger = Logger.getLogger(StrippingPass.class.getName());

	private StrippingPass() {}

	public static RustSourceUnit perform(RustSourceUnit sourceUnit, Classification classification) {
		RustSourceUnit result = new RustSourceUnit(sourceUnit.getLocation(),
				StrippingItemVisitor.stripAttributes(classification, sourceUnit.getInnerAttributes()),
				new StrippingItemVisitor(classification).stripItems(sourceUnit.getItems()));
		logger.fine("kept " + result.getItems().size() + " of " + sourceUnit.getItems().size() + " top-level items");
		return result;
	}
}
