package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A function, possibly with a verification mode and clauses.
 *
 * pub open spec fn name<T>(params) -> Ret by (strategy) where ... requires ... ensures ... { body }
 *
 * Qualifiers are the ordinary Rust ones (const, async, unsafe, extern "C");
 * modeQualifiers are open, closed, uninterp and broadcast. Functions without
 * a body, as found in traits, have a null body. The proof strategy, such as
 * nonlinear_arith, is null unless given.
 */
public class RustFunction extends RustItem {

	private final List<String> qualifiers;
	private final RustFunctionMode mode;
	private final List<String> modeQualifiers;
	private final String name;
	private final List<RustGenericParam> generics;
	private final List<RustParam> params;
	private final RustReturnType returnType;
	private final String proofStrategy;
	private final List<RustWherePredicate> whereClause;
	private final List<RustSpecClause> specClauses;
	private final RustBlock body;

	public RustFunction(SourceLocation location, List<RustAttribute> attributes, String visibility,
	                    List<String> qualifiers, RustFunctionMode mode, List<String> modeQualifiers, String name,
	                    List<RustGenericParam> generics, List<RustParam> params, RustReturnType returnType,
	                    String proofStrategy, List<RustWherePredicate> whereClause, List<RustSpecClause> specClauses, RustBlock body) {
		super(location, attributes, visibility);
		this.qualifiers = qualifiers;
		this.mode = mode;
		this.modeQualifiers = modeQualifiers;
		this.name = name;
		this.generics = generics;
		this.params = params;
		this.returnType = returnType;
		this.proofStrategy = proofStrategy;
		this.whereClause = whereClause;
		this.specClauses = specClauses;
		this.body = body;
	}

	public List<String> getQualifiers() {
		return Collections.unmodifiableList(qualifiers);
	}

	public RustFunctionMode getMode() {
		return mode;
	}

	public List<String> getModeQualifiers() {
		return Collections.unmodifiableList(modeQualifiers);
	}

	public String getName() {
		return name;
	}

	public List<RustGenericParam> getGenerics() {
		return Collections.unmodifiableList(generics);
	}

	public List<RustParam> getParams() {
		return Collections.unmodifiableList(params);
	}

	public RustReturnType getReturnType() {
		return returnType;
	}

	public String getProofStrategy() {
		return proofStrategy;
	}

	public List<RustWherePredicate> getWhereClause() {
		return Collections.unmodifiableList(whereClause);
	}

	public List<RustSpecClause> getSpecClauses() {
		return Collections.unmodifiableList(specClauses);
	}

	public RustBlock getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(RustItemVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getAttributes(), getVisibility(), qualifiers, mode, modeQualifiers, name, generics, params,
				returnType, proofStrategy, whereClause, specClauses, body);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustFunction that = (RustFunction) obj;
		return Objects.equals(getAttributes(), that.getAttributes()) &&
				Objects.equals(getVisibility(), that.getVisibility()) &&
				Objects.equals(qualifiers, that.qualifiers) &&
				mode == that.mode &&
				Objects.equals(modeQualifiers, that.modeQualifiers) &&
				Objects.equals(name, that.name) &&
				Objects.equals(generics, that.generics) &&
				Objects.equals(params, that.params) &&
				Objects.equals(returnType, that.returnType) &&
				Objects.equals(proofStrategy, that.proofStrategy) &&
				Objects.equals(whereClause, that.whereClause) &&
				Objects.equals(specClauses, that.specClauses) &&
				Objects.equals(body, that.body);
	}

}
