package vstrip.errors;

public abstract class ContextVisitor<T, E extends Throwable> {
	public abstract T visit(FileContext fileContext) throws E;
}
