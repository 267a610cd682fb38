package vstrip.trans;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.nio.file.Path;
import java.nio.file.Paths;

import org.junit.Test;

import vstrip.errors.IssueWithContext;
import vstrip.errors.TopLevelIssueContext;
import vstrip.trans.passes.classify.UnsupportedConstructIssue;
import vstrip.trans.passes.parse.SyntaxIssue;

public class StripPipelineTest {

	static Path testFile = Paths.get("src", "lib.rs");

	@Test
	public void plainRustIsNormalized() {
		StripResult result = StripPipeline.perform(new TopLevelIssueContext(), testFile,
				"fn main()   {\n\n    let x = 1 ;\n}\n");
		assertThat(result.getText(), is("fn main() {\n    let x = 1;\n}\n"));
		assertFalse(result.isEmpty());
	}

	@Test
	public void specificationOnlyFileIsEmpty() {
		StripResult result = StripPipeline.perform(new TopLevelIssueContext(), testFile,
				"use vstd::prelude::*;\nverus! {\nspec fn s() -> int { 1 }\n}\n");
		assertTrue(result.isEmpty());
		assertThat(result.getText(), is(""));
	}

	@Test
	public void syntaxErrorIsReportedWithFile() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		try {
			StripPipeline.perform(ctx, testFile, "fn f() {\n    let a = 1\n    a\n}\n");
			fail("expected a VStripTransException");
		} catch (VStripTransException e) {
			assertThat(e.getMessage(), containsString("while processing " + testFile));
			assertThat(e.getMessage(), containsString("syntax error: expected `;`, found `a`"));
		}
		assertThat(ctx.getIssues().size(), is(1));
		IssueWithContext issue = (IssueWithContext) ctx.getIssues().get(0);
		assertThat(issue.getIssue(), instanceOf(SyntaxIssue.class));
	}

	@Test
	public void unmatchedWrapperIsASyntaxError() {
		try {
			StripPipeline.perform(new TopLevelIssueContext(), testFile, "verus! {\nfn f() {}\n");
			fail("expected a VStripTransException");
		} catch (VStripTransException e) {
			assertThat(e.getMessage(), containsString("unmatched `verus! {` wrapper opened at byte offset 0"));
		}
	}

	@Test
	public void unsupportedConstructsAreAllReported() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		try {
			StripPipeline.perform(ctx, testFile, "fn f(a: bool, b: bool) -> bool {\n" +
					"    let c = a ==> b;\n" +
					"    let d = forall|i: int| i > 0;\n" +
					"    c\n" +
					"}\n");
			fail("expected a VStripTransException");
		} catch (VStripTransException e) {
			assertThat(e.getMessage(), containsString("Detected 2 issue(s)"));
			assertThat(e.getMessage(), containsString(
					"unsupported construct: ghost operator `==>` inside executable code"));
			assertThat(e.getMessage(), containsString(
					"unsupported construct: quantifier `forall` inside executable code"));
		}
		for (int i = 0; i < 2; i++) {
			IssueWithContext issue = (IssueWithContext) ctx.getIssues().get(i);
			assertThat(issue.getIssue(), instanceOf(UnsupportedConstructIssue.class));
		}
	}

}
