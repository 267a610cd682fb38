package vstrip.trans.batch;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

public class InputCollectorTest {

	private Path tempDir;

	@Before
	public void setup() throws IOException {
		tempDir = Files.createTempDirectory("vstriptest");
		Files.createDirectories(tempDir.resolve("src").resolve("nested"));
		Files.createDirectories(tempDir.resolve("target").resolve("debug"));
		Files.createFile(tempDir.resolve("src").resolve("lib.rs"));
		Files.createFile(tempDir.resolve("src").resolve("main.rs"));
		Files.createFile(tempDir.resolve("src").resolve("nested").resolve("mod.rs"));
		Files.createFile(tempDir.resolve("src").resolve("notes.md"));
		Files.createFile(tempDir.resolve("target").resolve("debug").resolve("build.rs"));
		Files.createFile(tempDir.resolve("Cargo.toml"));
	}

	@After
	public void cleanup() throws IOException {
		FileUtils.deleteDirectory(tempDir.toFile());
	}

	@Test
	public void recursiveCollectionSkipsDirectoriesAndFiltersExtensions() {
		List<Path> files = new InputCollector(true, Collections.singletonList(".rs"), Arrays.asList("target", ".git"))
				.collect(Collections.singletonList(tempDir.toString()));
		assertThat(files, is(Arrays.asList(
				tempDir.resolve("src").resolve("lib.rs"),
				tempDir.resolve("src").resolve("main.rs"),
				tempDir.resolve("src").resolve("nested").resolve("mod.rs"))));
	}

	@Test
	public void configuredExtensions() {
		List<Path> files = new InputCollector(true, Arrays.asList(".md", ".toml"), Collections.emptyList())
				.collect(Collections.singletonList(tempDir.toString()));
		assertThat(files, is(Arrays.asList(
				tempDir.resolve("Cargo.toml"),
				tempDir.resolve("src").resolve("notes.md"))));
	}

	@Test
	public void plainInputsAreKeptInOrder() {
		String lib = tempDir.resolve("src").resolve("lib.rs").toString();
		String missing = tempDir.resolve("missing.rs").toString();
		String dir = tempDir.resolve("src").toString();
		List<Path> files = new InputCollector(false, Collections.singletonList(".rs"), Collections.emptyList())
				.collect(Arrays.asList(missing, lib, dir));
		assertThat(files, is(Arrays.asList(
				tempDir.resolve("missing.rs"),
				tempDir.resolve("src").resolve("lib.rs"),
				tempDir.resolve("src"))));
	}

}
