package vstrip.trans.batch;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.logging.Logger;

import org.apache.commons.io.FileUtils;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

public class BatchProcessorTest {

	private static final Logger logger = Logger.getLogger(BatchProcessorTest.class.getName());

	private static final String EXEC_SOURCE = "verus! {\nfn f(x: u32) -> u32\n    requires x > 0,\n{\n    x\n}\n}\n";
	private static final String EXEC_STRIPPED = "fn f(x: u32) -> u32 {\n    x\n}\n";
	private static final String SPEC_SOURCE = "verus! {\nspec fn s() -> int { 1 }\n}\n";
	private static final String BROKEN_SOURCE = "fn f( {\n";

	private Path tempDir;
	private ByteArrayOutputStream stdout;

	@Before
	public void setup() throws IOException {
		tempDir = Files.createTempDirectory("vstriptest");
		stdout = new ByteArrayOutputStream();
	}

	@After
	public void cleanup() throws IOException {
		FileUtils.deleteDirectory(tempDir.toFile());
	}

	private Path file(String name, String contents) throws IOException {
		Path path = tempDir.resolve(name);
		Files.write(path, contents.getBytes(StandardCharsets.UTF_8));
		return path;
	}

	private static String read(Path path) throws IOException {
		return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
	}

	private BatchProcessor processor(OutputMode mode, Path outputFile, boolean keepEmpty, int jobs) {
		return new BatchProcessor(logger, mode, outputFile, keepEmpty, jobs,
				new PrintStream(stdout, true));
	}

	private String printed() {
		return new String(stdout.toByteArray(), StandardCharsets.UTF_8);
	}

	@Test
	public void failingFileDoesNotStopTheBatch() throws IOException {
		Path a = file("a.rs", EXEC_SOURCE);
		Path b = file("b.rs", BROKEN_SOURCE);
		Path c = file("c.rs", "fn main() {}\n");
		BatchSummary summary = processor(OutputMode.STANDARD_OUTPUT, null, false, 2).run(Arrays.asList(a, b, c));
		assertThat(summary.getProcessed(), is(3));
		assertThat(summary.getSucceeded(), is(2));
		assertThat(summary.getFailed(), is(1));
		assertTrue(summary.hasFailures());
		assertThat(printed(), is(EXEC_STRIPPED + "fn main() {}\n"));
	}

	@Test
	public void failureMessageNamesTheFile() throws IOException {
		Path b = file("b.rs", BROKEN_SOURCE);
		FileOutcome outcome = processor(OutputMode.CHECK, null, false, 1).process(b);
		assertTrue(outcome.isFailed());
		assertThat(outcome.getFailure(), containsString("while processing " + b));
		assertThat(outcome.getFailure(), containsString("syntax error:"));
	}

	@Test
	public void inPlaceRewritesFiles() throws IOException {
		Path a = file("a.rs", EXEC_SOURCE);
		BatchSummary summary = processor(OutputMode.IN_PLACE, null, false, 1).run(Collections.singletonList(a));
		assertFalse(summary.hasFailures());
		assertThat(read(a), is(EXEC_STRIPPED));
		assertThat(printed(), is(""));
	}

	@Test
	public void inPlaceDeletesEmptyResults() throws IOException {
		Path s = file("s.rs", SPEC_SOURCE);
		BatchSummary summary = processor(OutputMode.IN_PLACE, null, false, 1).run(Collections.singletonList(s));
		assertFalse(summary.hasFailures());
		assertFalse(Files.exists(s));
	}

	@Test
	public void inPlaceKeepsEmptyResultsWhenAsked() throws IOException {
		Path s = file("s.rs", SPEC_SOURCE);
		BatchSummary summary = processor(OutputMode.IN_PLACE, null, true, 1).run(Collections.singletonList(s));
		assertFalse(summary.hasFailures());
		assertTrue(Files.exists(s));
		assertThat(read(s), is(""));
	}

	@Test
	public void outputFile() throws IOException {
		Path a = file("a.rs", EXEC_SOURCE);
		Path out = tempDir.resolve("out.rs");
		BatchSummary summary = processor(OutputMode.OUTPUT_FILE, out, false, 1).run(Collections.singletonList(a));
		assertFalse(summary.hasFailures());
		assertThat(read(out), is(EXEC_STRIPPED));
		assertThat(read(a), is(EXEC_SOURCE));
	}

	@Test
	public void checkWritesNothing() throws IOException {
		Path a = file("a.rs", EXEC_SOURCE);
		Path s = file("s.rs", SPEC_SOURCE);
		BatchSummary summary = processor(OutputMode.CHECK, null, false, 1).run(Arrays.asList(a, s));
		assertFalse(summary.hasFailures());
		assertThat(read(a), is(EXEC_SOURCE));
		assertTrue(Files.exists(s));
		assertThat(printed(), is(""));
	}

	@Test
	public void directoryWithoutRecursionFails() throws IOException {
		Path dir = Files.createDirectory(tempDir.resolve("crate"));
		FileOutcome outcome = processor(OutputMode.STANDARD_OUTPUT, null, false, 1).process(dir);
		assertTrue(outcome.isFailed());
		assertThat(outcome.getFailure(), containsString("is a directory"));
	}

	@Test
	public void missingFileFails() {
		BatchSummary summary = processor(OutputMode.STANDARD_OUTPUT, null, false, 1)
				.run(Collections.singletonList(tempDir.resolve("missing.rs")));
		assertThat(summary.getFailed(), is(1));
	}

	@Test
	public void invalidUtf8Fails() throws IOException {
		Path bad = tempDir.resolve("bad.rs");
		Files.write(bad, new byte[]{'f', 'n', ' ', (byte) 0xff});
		FileOutcome outcome = processor(OutputMode.STANDARD_OUTPUT, null, false, 1).process(bad);
		assertTrue(outcome.isFailed());
		assertThat(outcome.getFailure(), containsString("IO Error on " + bad));
	}

}
