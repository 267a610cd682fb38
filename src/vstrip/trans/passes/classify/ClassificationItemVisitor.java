package vstrip.trans.passes.classify;

import vstrip.errors.IssueContext;
import vstrip.lexer.RustToken;
import vstrip.model.rust.*;

import java.util.List;

public class ClassificationItemVisitor extends RustItemVisitor<Void, RuntimeException> {

	private final IssueContext ctx;
	private final Classification classification;

	public ClassificationItemVisitor(IssueContext ctx, Classification classification) {
		this.ctx = ctx;
		this.classification = classification;
	}

	static void classifyAttributes(Classification classification, List<RustAttribute> attributes) {
		for (RustAttribute attribute : attributes) {
			classification.setKind(attribute, DialectMarkers.isVerificationAttribute(attribute)
					? Kind.SPECIFICATION
					: Kind.EXECUTABLE);
		}
	}

	static void classifyParams(Classification classification, List<RustParam> params) {
		for (RustParam param : params) {
			classifyAttributes(classification, param.getAttributes());
			GhostMarker marker = DialectMarkers.modeMarker(param.getMode());
			if (marker == GhostMarker.NONE && param.getType() != null) {
				marker = DialectMarkers.wrapperMarker(param.getType());
			}
			if (marker == GhostMarker.NONE && param.getPattern() != null) {
				marker = DialectMarkers.wrapperMarker(param.getPattern());
			}
			classification.setGhostMarker(param, marker);
		}
	}

	static void classifySpecClauses(Classification classification, List<RustSpecClause> specClauses) {
		for (RustSpecClause clause : specClauses) {
			classification.setKind(clause, Kind.SPECIFICATION);
		}
	}

	static GhostMarker fieldMarker(RustField field) {
		GhostMarker marker = DialectMarkers.modeMarker(field.getMode());
		if (marker == GhostMarker.NONE) {
			marker = DialectMarkers.wrapperMarker(field.getType());
		}
		return marker;
	}

	private void classifyFields(List<RustField> fields) {
		for (RustField field : fields) {
			classifyAttributes(classification, field.getAttributes());
			classification.setGhostMarker(field, fieldMarker(field));
		}
	}

	private void classifyGenerics(List<RustGenericParam> generics) {
		for (RustGenericParam generic : generics) {
			classifyAttributes(classification, generic.getAttributes());
		}
	}

	private void classifyMembers(List<RustItem> items) {
		for (RustItem item : items) {
			item.accept(this);
		}
	}

	private void checkExpression(RustExpression expression) {
		if (expression != null) {
			expression.accept(new ClassificationExpressionVisitor(ctx, classification));
		}
	}

	private void checkTokens(List<RustToken> tokens) {
		RustToken marker = DialectMarkers.findMarker(tokens);
		if (marker != null) {
			ctx.error(new UnsupportedConstructIssue(marker.getLocation(), "verification syntax `" +
					marker.getValue() + "` inside a macro invocation or unparsed item"));
		}
	}

	private static Kind modeKind(RustFunctionMode mode) {
		switch (mode) {
			case SPEC:
			case SPEC_CHECKED:
				return Kind.SPECIFICATION;
			case PROOF:
			case PROOF_AXIOM:
				return Kind.PROOF;
			default:
				return Kind.EXECUTABLE;
		}
	}

	@Override
	public Void visit(RustFunction rustFunction) throws RuntimeException {
		classifyAttributes(classification, rustFunction.getAttributes());
		Kind kind = modeKind(rustFunction.getMode());
		classification.setKind(rustFunction, kind);
		if (kind != Kind.EXECUTABLE) {
			return null;
		}
		classifyGenerics(rustFunction.getGenerics());
		classifyParams(classification, rustFunction.getParams());
		classifySpecClauses(classification, rustFunction.getSpecClauses());
		RustReturnType returnType = rustFunction.getReturnType();
		if (returnType != null && (returnType.getMode() != RustDataMode.DEFAULT ||
				DialectMarkers.wrapperMarker(returnType.getType()) != GhostMarker.NONE)) {
			ctx.error(new UnsupportedConstructIssue(returnType.getLocation(), "executable function `" +
					rustFunction.getName() + "` returns a ghost or tracked value"));
		}
		if (rustFunction.getBody() != null) {
			new ClassificationStatementVisitor(ctx, classification).classifyBlock(rustFunction.getBody());
		}
		return null;
	}

	@Override
	public Void visit(RustStruct rustStruct) throws RuntimeException {
		classifyAttributes(classification, rustStruct.getAttributes());
		classification.setKind(rustStruct, Kind.EXECUTABLE);
		classifyGenerics(rustStruct.getGenerics());
		classifyFields(rustStruct.getFields());
		return null;
	}

	@Override
	public Void visit(RustEnum rustEnum) throws RuntimeException {
		classifyAttributes(classification, rustEnum.getAttributes());
		classification.setKind(rustEnum, Kind.EXECUTABLE);
		classifyGenerics(rustEnum.getGenerics());
		for (RustVariant variant : rustEnum.getVariants()) {
			classifyAttributes(classification, variant.getAttributes());
			classifyFields(variant.getFields());
			checkExpression(variant.getDiscriminant());
		}
		return null;
	}

	@Override
	public Void visit(RustImpl rustImpl) throws RuntimeException {
		classifyAttributes(classification, rustImpl.getAttributes());
		classification.setKind(rustImpl, Kind.EXECUTABLE);
		classifyGenerics(rustImpl.getGenerics());
		classifyMembers(rustImpl.getItems());
		return null;
	}

	@Override
	public Void visit(RustTrait rustTrait) throws RuntimeException {
		classifyAttributes(classification, rustTrait.getAttributes());
		classification.setKind(rustTrait, Kind.EXECUTABLE);
		classifyGenerics(rustTrait.getGenerics());
		classifyMembers(rustTrait.getItems());
		return null;
	}

	@Override
	public Void visit(RustConst rustConst) throws RuntimeException {
		classifyAttributes(classification, rustConst.getAttributes());
		Kind kind = modeKind(rustConst.getMode());
		classification.setKind(rustConst, kind);
		if (kind == Kind.EXECUTABLE) {
			checkExpression(rustConst.getValue());
		}
		return null;
	}

	@Override
	public Void visit(RustTypeAlias rustTypeAlias) throws RuntimeException {
		classifyAttributes(classification, rustTypeAlias.getAttributes());
		classification.setKind(rustTypeAlias, Kind.EXECUTABLE);
		classifyGenerics(rustTypeAlias.getGenerics());
		return null;
	}

	@Override
	public Void visit(RustModule rustModule) throws RuntimeException {
		classifyAttributes(classification, rustModule.getAttributes());
		classification.setKind(rustModule, Kind.EXECUTABLE);
		classifyAttributes(classification, rustModule.getInnerAttributes());
		if (rustModule.getItems() != null) {
			classifyMembers(rustModule.getItems());
		}
		return null;
	}

	@Override
	public Void visit(RustUse rustUse) throws RuntimeException {
		classifyAttributes(classification, rustUse.getAttributes());
		if (rustUse.isBroadcast()) {
			classification.setKind(rustUse, Kind.PROOF);
			return null;
		}
		String crate = null;
		for (String name : rustUse.getTree().getLeadingNames()) {
			if (!name.isEmpty()) {
				crate = name;
				break;
			}
		}
		classification.setKind(rustUse, crate != null && DialectMarkers.isVerificationCrate(crate)
				? Kind.SPECIFICATION
				: Kind.EXECUTABLE);
		return null;
	}

	@Override
	public Void visit(RustMacroItem rustMacroItem) throws RuntimeException {
		classifyAttributes(classification, rustMacroItem.getAttributes());
		classification.setKind(rustMacroItem, Kind.EXECUTABLE);
		RustPath path = rustMacroItem.getPath();
		if (DialectMarkers.isWrapperMacro(path)) {
			ctx.error(new UnsupportedConstructIssue(rustMacroItem.getLocation(), "nested `verus!` wrapper"));
		} else if (DialectMarkers.isProofMacro(path)) {
			ctx.error(new UnsupportedConstructIssue(rustMacroItem.getLocation(), "proof macro `" +
					path.getLastName() + "!` outside statement position"));
		} else {
			checkTokens(rustMacroItem.getTokens());
		}
		return null;
	}

	@Override
	public Void visit(RustBroadcastGroup rustBroadcastGroup) throws RuntimeException {
		classifyAttributes(classification, rustBroadcastGroup.getAttributes());
		classification.setKind(rustBroadcastGroup, Kind.PROOF);
		return null;
	}

	@Override
	public Void visit(RustVerbatimItem rustVerbatimItem) throws RuntimeException {
		classifyAttributes(classification, rustVerbatimItem.getAttributes());
		classification.setKind(rustVerbatimItem, Kind.EXECUTABLE);
		checkTokens(rustVerbatimItem.getTokens());
		return null;
	}

}
