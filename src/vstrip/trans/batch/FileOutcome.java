package vstrip.trans.batch;

import java.nio.file.Path;

/**
 * What happened to one input file. Text is only kept for results that still
 * have to be printed to standard output.
 */
public class FileOutcome {

	public enum Status {
		STRIPPED,
		EMPTY,
		FAILED,
	}

	private final Path path;
	private final Status status;
	private final String text;
	private final String failure;

	private FileOutcome(Path path, Status status, String text, String failure) {
		this.path = path;
		this.status = status;
		this.text = text;
		this.failure = failure;
	}

	public static FileOutcome stripped(Path path, String text) {
		return new FileOutcome(path, Status.STRIPPED, text, null);
	}

	public static FileOutcome empty(Path path, String text) {
		return new FileOutcome(path, Status.EMPTY, text, null);
	}

	public static FileOutcome failed(Path path, String failure) {
		return new FileOutcome(path, Status.FAILED, null, failure);
	}

	public Path getPath() {
		return path;
	}

	public Status getStatus() {
		return status;
	}

	public boolean isFailed() {
		return status == Status.FAILED;
	}

	public String getText() {
		return text;
	}

	public String getFailure() {
		return failure;
	}

}
