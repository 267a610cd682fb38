package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class RustFunctionPointerType extends RustType {

	private final List<String> forLifetimes;
	private final List<String> qualifiers;
	private final List<RustType> params;
	private final RustType returnType;

	public RustFunctionPointerType(SourceLocation location, List<String> forLifetimes, List<String> qualifiers,
	                               List<RustType> params, RustType returnType) {
		super(location);
		this.forLifetimes = forLifetimes;
		this.qualifiers = qualifiers;
		this.params = params;
		this.returnType = returnType;
	}

	public List<String> getForLifetimes() {
		return Collections.unmodifiableList(forLifetimes);
	}

	public List<String> getQualifiers() {
		return Collections.unmodifiableList(qualifiers);
	}

	public List<RustType> getParams() {
		return Collections.unmodifiableList(params);
	}

	public RustType getReturnType() {
		return returnType;
	}

	@Override
	public <T, E extends Throwable> T accept(RustTypeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(forLifetimes, qualifiers, params, returnType);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustFunctionPointerType that = (RustFunctionPointerType) obj;
		return Objects.equals(forLifetimes, that.forLifetimes) &&
				Objects.equals(qualifiers, that.qualifiers) &&
				Objects.equals(params, that.params) &&
				Objects.equals(returnType, that.returnType);
	}

}
