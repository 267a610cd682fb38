package vstrip;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.apache.commons.io.FileUtils;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

public class VStripMainTest {

	private Path tempDir;
	private ByteArrayOutputStream stdout;
	private ByteArrayOutputStream stderr;

	@Before
	public void setup() throws IOException {
		tempDir = Files.createTempDirectory("vstriptest");
		stdout = new ByteArrayOutputStream();
		stderr = new ByteArrayOutputStream();
	}

	@After
	public void cleanup() throws IOException {
		FileUtils.deleteDirectory(tempDir.toFile());
	}

	private int run(String... args) {
		return new VStripMain(args, new PrintStream(stdout, true), new PrintStream(stderr, true)).run();
	}

	private String file(String name, String contents) throws IOException {
		Path path = tempDir.resolve(name);
		Files.write(path, contents.getBytes(StandardCharsets.UTF_8));
		return path.toString();
	}

	private static String text(ByteArrayOutputStream stream) {
		return new String(stream.toByteArray(), StandardCharsets.UTF_8);
	}

	@Test
	public void version() {
		assertThat(run("--version"), is(VStripMain.EXIT_SUCCESS));
		assertThat(text(stdout), is("vstrip version " + VStripOptions.VERSION + System.lineSeparator()));
	}

	@Test
	public void usageErrorExitsWithTwo() {
		assertThat(run(), is(VStripMain.EXIT_USAGE));
		assertThat(text(stderr), containsString("unable to parse options: no input files"));
		assertThat(text(stdout), is(""));
	}

	@Test
	public void strippedFileGoesToStandardOutput() throws IOException {
		String lib = file("lib.rs", "verus! {\nproof fn p() {}\nfn f() {}\n}\n");
		assertThat(run("-q", lib), is(VStripMain.EXIT_SUCCESS));
		assertThat(text(stdout), is("fn f() {}\n"));
	}

	@Test
	public void anyFailureExitsWithOne() throws IOException {
		String good = file("good.rs", "fn f() {}\n");
		String bad = file("bad.rs", "fn f() { assert(true)\n");
		assertThat(run("-q", good, bad), is(VStripMain.EXIT_FAILURE));
		assertThat(text(stdout), is("fn f() {}\n"));
	}

	@Test
	public void recursiveInPlace() throws IOException {
		Files.createDirectories(tempDir.resolve("src"));
		String lib = file("src/lib.rs", "fn f(Ghost(x): Ghost<int>) {}\n");
		String spec = file("src/spec.rs", "spec fn s() -> int { 1 }\n");
		assertThat(run("-q", "-r", "-i", tempDir.toString()), is(VStripMain.EXIT_SUCCESS));
		assertThat(new String(Files.readAllBytes(tempDir.resolve(lib)), StandardCharsets.UTF_8), is("fn f() {}\n"));
		assertFalse(Files.exists(tempDir.resolve(spec)));
		assertThat(text(stdout), is(""));
	}

}
