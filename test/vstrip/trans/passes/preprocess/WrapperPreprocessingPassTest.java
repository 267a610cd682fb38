package vstrip.trans.passes.preprocess;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.nio.file.Path;
import java.nio.file.Paths;

import org.junit.Test;

import vstrip.trans.passes.parse.SyntaxIssue;

public class WrapperPreprocessingPassTest {

	static Path testFile = Paths.get("TEST");

	@Test
	public void blanksWrapperAndKeepsOffsets() throws SyntaxIssue {
		String input = "use a;\nverus! {\nfn f() {}\n}\nfn g() {}\n";
		String output = WrapperPreprocessingPass.perform(testFile, input);
		assertThat(output, is("use a;\n        \nfn f() {}\n \nfn g() {}\n"));
		assertThat(output.length(), is(input.length()));
		assertThat(output.indexOf("fn f"), is(input.indexOf("fn f")));
	}

	@Test
	public void unwrapsEveryTopLevelWrapper() throws SyntaxIssue {
		String output = WrapperPreprocessingPass.perform(testFile, "verus!{a}verus! { b }");
		assertThat(output, is("       a          b  "));
	}

	@Test
	public void textWithoutWrapperIsUnchanged() throws SyntaxIssue {
		String input = "fn main() {\n    println!(\"hello\");\n}\n";
		assertThat(WrapperPreprocessingPass.perform(testFile, input), is(input));
	}

	@Test
	public void commentsAndStringsAreSkipped() throws SyntaxIssue {
		String input = "// verus! {\n/* verus! { */\nlet s = \"verus! {\";\nlet r = r#\"verus! { \"#;\n";
		assertThat(WrapperPreprocessingPass.perform(testFile, input), is(input));
	}

	@Test
	public void bracesInsideLiteralsDoNotCloseTheWrapper() throws SyntaxIssue {
		String input = "verus! { let c = '}'; let s = \"}\"; }";
		String output = WrapperPreprocessingPass.perform(testFile, input);
		assertThat(output, is("         let c = '}'; let s = \"}\";  "));
	}

	@Test
	public void onlyWholeIdentifierStartsWrapper() throws SyntaxIssue {
		String input = "not_verus! { x }";
		assertThat(WrapperPreprocessingPass.perform(testFile, input), is(input));
	}

	@Test
	public void wrapperWithoutBraceIsLeftAlone() throws SyntaxIssue {
		String input = "verus!(x);";
		assertThat(WrapperPreprocessingPass.perform(testFile, input), is(input));
	}

	@Test
	public void nestedWrapperIsNotUnwrapped() throws SyntaxIssue {
		String input = "verus! { verus! { x } }";
		assertThat(WrapperPreprocessingPass.perform(testFile, input), is("         verus! { x }  "));
	}

	@Test
	public void unmatchedWrapperReportsByteOffset() {
		String input = "// é\nverus! {\nfn f() {}\n";
		try {
			WrapperPreprocessingPass.perform(testFile, input);
			fail("an unmatched wrapper must be rejected");
		} catch (SyntaxIssue issue) {
			// é takes two bytes, so the wrapper starts at byte 6 and character 5
			assertThat(issue.getDescription(), is("unmatched `verus! {` wrapper opened at byte offset 6"));
			assertThat(issue.getLocation().getStartLine(), is(1));
			assertThat(issue.getLocation().getStartColumn(), is(0));
		}
	}

}
