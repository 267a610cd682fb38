package vstrip.trans.passes.strip;

import vstrip.Unreachable;
import vstrip.model.rust.*;
import vstrip.trans.passes.classify.Classification;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Rebuilds a retained item without its verification-only parts. Items that
 * are dropped as a whole are filtered out by {@link #stripItems(List)} and
 * never visited.
 */
public class StrippingItemVisitor extends RustItemVisitor<RustItem, RuntimeException> {

	private final Classification classification;

	public StrippingItemVisitor(Classification classification) {
		this.classification = classification;
	}

	static List<RustAttribute> stripAttributes(Classification classification, List<RustAttribute> attributes) {
		return attributes.stream().filter(classification::isRetained).collect(Collectors.toList());
	}

	static List<RustParam> stripParams(Classification classification, List<RustParam> params) {
		List<RustParam> result = new ArrayList<>();
		for (RustParam param : params) {
			if (classification.isGhost(param)) {
				continue;
			}
			result.add(new RustParam(param.getLocation(), stripAttributes(classification, param.getAttributes()),
					RustDataMode.DEFAULT, param.getReceiver(), param.getPattern(), param.getType()));
		}
		return result;
	}

	/**
	 * `-> (r: T)` becomes `-> T`.
	 */
	static RustReturnType stripReturnType(RustReturnType returnType) {
		return new RustReturnType(returnType.getLocation(), RustDataMode.DEFAULT, null, returnType.getType());
	}

	public List<RustItem> stripItems(List<RustItem> items) {
		List<RustItem> result = new ArrayList<>();
		for (RustItem item : items) {
			if (classification.isRetained(item)) {
				result.add(item.accept(this));
			}
		}
		return result;
	}

	private List<RustAttribute> stripAttributes(List<RustAttribute> attributes) {
		return stripAttributes(classification, attributes);
	}

	private List<RustField> stripFields(List<RustField> fields) {
		List<RustField> result = new ArrayList<>();
		for (RustField field : fields) {
			if (classification.isGhost(field)) {
				continue;
			}
			result.add(new RustField(field.getLocation(), stripAttributes(field.getAttributes()),
					field.getVisibility(), RustDataMode.DEFAULT, field.getName(), field.getType()));
		}
		return result;
	}

	private List<RustGenericParam> stripGenerics(List<RustGenericParam> generics) {
		return generics.stream()
				.map(g -> new RustGenericParam(g.getLocation(), stripAttributes(g.getAttributes()), g.getKind(),
						g.getName(), g.getBounds(), g.getType(), g.getDefaultType(), g.getDefaultValue()))
				.collect(Collectors.toList());
	}

	private RustExpression stripExpression(RustExpression expression) {
		if (expression == null) {
			return null;
		}
		return expression.accept(new StrippingStatementVisitor(classification).expressions());
	}

	@Override
	public RustItem visit(RustFunction rustFunction) throws RuntimeException {
		RustReturnType returnType = rustFunction.getReturnType();
		RustBlock body = rustFunction.getBody();
		return new RustFunction(rustFunction.getLocation(), stripAttributes(rustFunction.getAttributes()),
				rustFunction.getVisibility(), rustFunction.getQualifiers(), RustFunctionMode.DEFAULT,
				Collections.emptyList(), rustFunction.getName(), stripGenerics(rustFunction.getGenerics()),
				stripParams(classification, rustFunction.getParams()),
				returnType == null ? null : stripReturnType(returnType), null, rustFunction.getWhereClause(),
				Collections.emptyList(),
				body == null ? null : new StrippingStatementVisitor(classification).stripBlock(body));
	}

	@Override
	public RustItem visit(RustStruct rustStruct) throws RuntimeException {
		return new RustStruct(rustStruct.getLocation(), stripAttributes(rustStruct.getAttributes()),
				rustStruct.getVisibility(), rustStruct.getName(), stripGenerics(rustStruct.getGenerics()),
				rustStruct.getWhereClause(), rustStruct.getStyle(), stripFields(rustStruct.getFields()));
	}

	@Override
	public RustItem visit(RustEnum rustEnum) throws RuntimeException {
		List<RustVariant> variants = rustEnum.getVariants().stream()
				.map(v -> new RustVariant(v.getLocation(), stripAttributes(v.getAttributes()), v.getName(),
						v.getStyle(), stripFields(v.getFields()), stripExpression(v.getDiscriminant())))
				.collect(Collectors.toList());
		return new RustEnum(rustEnum.getLocation(), stripAttributes(rustEnum.getAttributes()),
				rustEnum.getVisibility(), rustEnum.getName(), stripGenerics(rustEnum.getGenerics()),
				rustEnum.getWhereClause(), variants);
	}

	@Override
	public RustItem visit(RustImpl rustImpl) throws RuntimeException {
		return new RustImpl(rustImpl.getLocation(), stripAttributes(rustImpl.getAttributes()),
				rustImpl.getVisibility(), rustImpl.isUnsafe(), stripGenerics(rustImpl.getGenerics()),
				rustImpl.isNegative(), rustImpl.getTrait(), rustImpl.getSelfType(), rustImpl.getWhereClause(),
				stripItems(rustImpl.getItems()));
	}

	@Override
	public RustItem visit(RustTrait rustTrait) throws RuntimeException {
		return new RustTrait(rustTrait.getLocation(), stripAttributes(rustTrait.getAttributes()),
				rustTrait.getVisibility(), rustTrait.isUnsafe(), rustTrait.isAuto(), rustTrait.getName(),
				stripGenerics(rustTrait.getGenerics()), rustTrait.getSupertraits(), rustTrait.getWhereClause(),
				stripItems(rustTrait.getItems()));
	}

	@Override
	public RustItem visit(RustConst rustConst) throws RuntimeException {
		return new RustConst(rustConst.getLocation(), stripAttributes(rustConst.getAttributes()),
				rustConst.getVisibility(), RustFunctionMode.DEFAULT, Collections.emptyList(), rustConst.getKeyword(),
				rustConst.isMutable(), rustConst.getName(), rustConst.getType(), stripExpression(rustConst.getValue()));
	}

	@Override
	public RustItem visit(RustTypeAlias rustTypeAlias) throws RuntimeException {
		return new RustTypeAlias(rustTypeAlias.getLocation(), stripAttributes(rustTypeAlias.getAttributes()),
				rustTypeAlias.getVisibility(), rustTypeAlias.getName(), stripGenerics(rustTypeAlias.getGenerics()),
				rustTypeAlias.getBounds(), rustTypeAlias.getWhereClause(), rustTypeAlias.getType());
	}

	@Override
	public RustItem visit(RustModule rustModule) throws RuntimeException {
		List<RustItem> items = rustModule.getItems() == null ? null : stripItems(rustModule.getItems());
		return new RustModule(rustModule.getLocation(), stripAttributes(rustModule.getAttributes()),
				rustModule.getVisibility(), rustModule.isUnsafe(), rustModule.getName(),
				stripAttributes(rustModule.getInnerAttributes()), items);
	}

	@Override
	public RustItem visit(RustUse rustUse) throws RuntimeException {
		return new RustUse(rustUse.getLocation(), stripAttributes(rustUse.getAttributes()), rustUse.getVisibility(),
				false, rustUse.getTree());
	}

	@Override
	public RustItem visit(RustMacroItem rustMacroItem) throws RuntimeException {
		return new RustMacroItem(rustMacroItem.getLocation(), stripAttributes(rustMacroItem.getAttributes()),
				rustMacroItem.getVisibility(), rustMacroItem.getPath(), rustMacroItem.getName(),
				rustMacroItem.getDelimiter(), rustMacroItem.getTokens());
	}

	@Override
	public RustItem visit(RustBroadcastGroup rustBroadcastGroup) throws RuntimeException {
		// always classified as proof
		throw new Unreachable();
	}

	@Override
	public RustItem visit(RustVerbatimItem rustVerbatimItem) throws RuntimeException {
		return new RustVerbatimItem(rustVerbatimItem.getLocation(), stripAttributes(rustVerbatimItem.getAttributes()),
				rustVerbatimItem.getVisibility(), rustVerbatimItem.getTokens());
	}

}
