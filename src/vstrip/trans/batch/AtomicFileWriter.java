package vstrip.trans.batch;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Replaces a file's contents by writing a temporary file next to it and moving
 * it over the original. Readers see either the old or the new contents.
 */
public class AtomicFileWriter {
	private AtomicFileWriter() {}

	public static void write(Path destination, String contents) throws IOException {
		Path directory = destination.toAbsolutePath().getParent();
		Path temp = Files.createTempFile(directory, "." + destination.getFileName() + ".", ".tmp");
		try {
			try (BufferedWriter writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
				writer.write(contents);
			}
			try {
				Files.move(temp, destination, StandardCopyOption.ATOMIC_MOVE);
			} catch (AtomicMoveNotSupportedException e) {
				Files.move(temp, destination, StandardCopyOption.REPLACE_EXISTING);
			}
		} catch (IOException | RuntimeException e) {
			try {
				Files.deleteIfExists(temp);
			} catch (IOException deleteFailure) {
				e.addSuppressed(deleteFailure);
			}
			throw e;
		}
	}

}
