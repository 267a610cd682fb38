package vstrip.trans;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import vstrip.errors.TopLevelIssueContext;

@RunWith(Parameterized.class)
public class StripPipelineGoldenTest {

	@Parameters(name = "{0}")
	public static List<Object[]> data() {
		return Arrays.stream(new String[]{
				"clause_erasure",
				"complex_specs",
				"expression_proofs",
				"external_body",
				"ghost_fields",
				"ghost_locals",
				"ghost_params",
				"loops",
				"plain",
				"proof_statements",
				"traits",
				"whole_items",
		}).map(name -> new Object[]{name}).collect(Collectors.toList());
	}

	private final String name;

	public StripPipelineGoldenTest(String name) {
		this.name = name;
	}

	private static String read(Path path) throws IOException {
		return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
	}

	@Test
	public void test() throws IOException {
		Path inputPath = Paths.get("test", "rust", "input", name + ".rs");
		Path expectedPath = Paths.get("test", "rust", "expected", name + ".rs");
		String expected = read(expectedPath);

		StripResult result = StripPipeline.perform(new TopLevelIssueContext(), inputPath, read(inputPath));
		assertThat(result.getText(), is(expected));
		assertFalse(result.isEmpty());

		StripResult again = StripPipeline.perform(new TopLevelIssueContext(), expectedPath, expected);
		assertThat(again.getText(), is(expected));
	}

}
