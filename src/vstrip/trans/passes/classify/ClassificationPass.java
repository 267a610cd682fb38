package vstrip.trans.passes.classify;

import vstrip.errors.IssueContext;
import vstrip.model.rust.*;

import java.util.List;

public class ClassificationPass {
	private ClassificationPass() {}

	private static void collectGhostFields(Classification classification, String typeName, List<RustField> fields) {
		for (RustField field : fields) {
			if (field.getName() != null && ClassificationItemVisitor.fieldMarker(field) != GhostMarker.NONE) {
				classification.addGhostField(typeName, field.getName());
			}
		}
	}

	// struct literals may come before the declaration of their type
	private static void collectGhostFields(Classification classification, List<RustItem> items) {
		for (RustItem item : items) {
			if (item instanceof RustStruct) {
				RustStruct rustStruct = (RustStruct) item;
				collectGhostFields(classification, rustStruct.getName(), rustStruct.getFields());
			} else if (item instanceof RustEnum) {
				for (RustVariant variant : ((RustEnum) item).getVariants()) {
					collectGhostFields(classification, variant.getName(), variant.getFields());
				}
			} else if (item instanceof RustModule && ((RustModule) item).getItems() != null) {
				collectGhostFields(classification, ((RustModule) item).getItems());
			}
		}
	}

	public static Classification perform(IssueContext ctx, RustSourceUnit sourceUnit) {
		Classification classification = new Classification();
		collectGhostFields(classification, sourceUnit.getItems());
		ClassificationItemVisitor.classifyAttributes(classification, sourceUnit.getInnerAttributes());
		ClassificationItemVisitor visitor = new ClassificationItemVisitor(ctx, classification);
		for (RustItem item : sourceUnit.getItems()) {
			item.accept(visitor);
		}
		return classification;
	}
}
