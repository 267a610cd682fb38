package vstrip;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;

import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

public class VStripOptionsTest {

	private Path tempDir;
	private Path configPath;

	@Before
	public void setup() throws IOException {
		tempDir = Files.createTempDirectory("vstriptest");
		configPath = tempDir.resolve("vstrip.json");
	}

	@After
	public void cleanup() throws IOException {
		Files.deleteIfExists(configPath);
		Files.deleteIfExists(tempDir);
	}

	private void writeConfig(JSONObject config) throws IOException {
		try (BufferedWriter w = Files.newBufferedWriter(configPath)) {
			config.write(w);
		}
	}

	private static VStripOptions options(String... args) {
		VStripOptions opts = new VStripOptions(args);
		opts.parse();
		return opts;
	}

	private static String failure(String... args) {
		try {
			options(args);
		} catch (VStripOptionException e) {
			return e.getMsg();
		}
		fail("expected a VStripOptionException");
		return null;
	}

	@Test
	public void defaults() {
		VStripOptions opts = options("lib.rs");
		assertThat(opts.inputs, is(Collections.singletonList("lib.rs")));
		assertThat(opts.jobs, is(1));
		assertFalse(opts.in_place);
		assertFalse(opts.check);
		assertFalse(opts.keep_empty);
		assertFalse(opts.recursive);
		assertThat(opts.output, is(nullValue()));
		assertThat(opts.extensions, is(Collections.singletonList(".rs")));
		assertThat(opts.skipDirectories, is(Arrays.asList("target", ".git")));
	}

	@Test
	public void flags() {
		VStripOptions opts = options("-i", "-r", "--jobs=4", "src", "tests");
		assertTrue(opts.in_place);
		assertTrue(opts.recursive);
		assertThat(opts.jobs, is(4));
		assertThat(opts.inputs, is(Arrays.asList("src", "tests")));
	}

	@Test
	public void versionNeedsNoInputs() {
		assertTrue(options("--version").version);
	}

	@Test
	public void noInputs() {
		assertThat(failure(), is("no input files"));
	}

	@Test
	public void inPlaceAndOutputConflict() {
		assertThat(failure("-i", "--output=out.rs", "lib.rs"), is("-i and -o cannot be used together"));
	}

	@Test
	public void checkDoesNotWrite() {
		assertThat(failure("--check", "-i", "lib.rs"),
				is("--check does not write output; do not combine it with -i or -o"));
	}

	@Test
	public void outputNeedsSingleInput() {
		assertThat(failure("--output=out.rs", "a.rs", "b.rs"), is("-o requires exactly one input file"));
		assertThat(failure("--output=out.rs", "-r", "src"), is("-o requires exactly one input file"));
	}

	@Test
	public void jobsMustBePositive() {
		assertThat(failure("--jobs=0", "lib.rs"), is("the number of jobs must be at least 1, got 0"));
	}

	@Test
	public void unknownOption() {
		assertThat(failure("--frobnicate", "lib.rs"), containsString("frobnicate"));
	}

	@Test
	public void configurationFile() throws IOException {
		JSONObject config = new JSONObject();
		config.put("keep_empty", true);
		config.put("jobs", 3);
		config.put("extensions", new JSONArray(Arrays.asList(".rs", ".verus")));
		config.put("skip_directories", new JSONArray(Collections.singletonList("vendor")));
		writeConfig(config);

		VStripOptions opts = options("-c", configPath.toString(), "lib.rs");
		assertTrue(opts.keep_empty);
		assertThat(opts.jobs, is(3));
		assertThat(opts.extensions, is(Arrays.asList(".rs", ".verus")));
		assertThat(opts.skipDirectories, is(Collections.singletonList("vendor")));
	}

	@Test
	public void commandLineJobsOverrideConfiguration() throws IOException {
		JSONObject config = new JSONObject();
		config.put("jobs", 3);
		writeConfig(config);
		assertThat(options("-c", configPath.toString(), "--jobs=8", "lib.rs").jobs, is(8));
	}

	@Test
	public void invalidConfiguration() throws IOException {
		Files.write(configPath, "{\"jobs\": ".getBytes());
		assertThat(failure("-c", configPath.toString(), "lib.rs"), startsWith(configPath + ": parsing error: "));
	}

	@Test
	public void missingConfiguration() {
		assertThat(failure("-c", tempDir.resolve("absent.json").toString(), "lib.rs"),
				startsWith("Error reading configuration file: "));
	}

}
