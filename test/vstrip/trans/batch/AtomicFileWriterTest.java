package vstrip.trans.batch;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import org.apache.commons.io.FileUtils;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

public class AtomicFileWriterTest {

	private Path tempDir;

	@Before
	public void setup() throws IOException {
		tempDir = Files.createTempDirectory("vstriptest");
	}

	@After
	public void cleanup() throws IOException {
		FileUtils.deleteDirectory(tempDir.toFile());
	}

	@Test
	public void replacesContentsWithoutLeavingTemporaryFiles() throws IOException {
		Path file = tempDir.resolve("lib.rs");
		Files.write(file, "verus! {}\n".getBytes(StandardCharsets.UTF_8));
		AtomicFileWriter.write(file, "fn é() {}\n");
		assertThat(new String(Files.readAllBytes(file), StandardCharsets.UTF_8), is("fn é() {}\n"));
		try (Stream<Path> entries = Files.list(tempDir)) {
			assertThat(entries.count(), is(1L));
		}
	}

	@Test
	public void createsMissingFile() throws IOException {
		Path file = tempDir.resolve("new.rs");
		AtomicFileWriter.write(file, "");
		assertTrue(Files.exists(file));
		assertThat(Files.size(file), is(0L));
	}

	@Test(expected = IOException.class)
	public void missingDirectoryFails() throws IOException {
		AtomicFileWriter.write(tempDir.resolve("missing").resolve("lib.rs"), "fn main() {}\n");
	}

}
