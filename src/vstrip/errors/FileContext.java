package vstrip.errors;

import java.nio.file.Path;

/**
 * Marks issues as belonging to one input file of a batch.
 */
public class FileContext extends Context {

	private final Path file;

	public FileContext(Path file) {
		this.file = file;
	}

	public Path getFile() {
		return file;
	}

	@Override
	public <T, E extends Throwable> T accept(ContextVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
