package vstrip.trans.passes.strip;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.nio.file.Path;
import java.nio.file.Paths;

import org.junit.Test;

import vstrip.errors.TopLevelIssueContext;
import vstrip.model.rust.RustSourceUnit;
import vstrip.trans.StripPipeline;
import vstrip.trans.passes.classify.Classification;
import vstrip.trans.passes.classify.ClassificationPass;
import vstrip.trans.passes.parse.ParsingPass;
import vstrip.trans.passes.parse.SyntaxIssue;
import vstrip.trans.passes.preprocess.WrapperPreprocessingPass;

public class StrippingPassTest {

	static Path testFile = Paths.get("TEST");

	private static RustSourceUnit strip(String source) throws SyntaxIssue {
		RustSourceUnit unit = ParsingPass.perform(testFile, WrapperPreprocessingPass.perform(testFile, source));
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		Classification classification = ClassificationPass.perform(ctx, unit);
		assertFalse(ctx.format(), ctx.hasErrors());
		return StrippingPass.perform(unit, classification);
	}

	private static String stripToText(String source) throws SyntaxIssue {
		return StripPipeline.format(strip(source));
	}

	@Test
	public void clausesAndNamedReturn() throws SyntaxIssue {
		assertThat(stripToText("verus! {\n" +
						"fn divide(a: u32, b: u32) -> (result: u32)\n" +
						"    requires b > 0,\n" +
						"    ensures result <= a,\n" +
						"{\n" +
						"    a / b\n" +
						"}\n" +
						"}\n"),
				is("fn divide(a: u32, b: u32) -> u32 {\n" +
						"    a / b\n" +
						"}\n"));
	}

	@Test
	public void proofStatements() throws SyntaxIssue {
		assertThat(stripToText("fn f(x: u32) -> u32 {\n" +
						"    assert(x >= 0);\n" +
						"    proof { assume(false); }\n" +
						"    let y = x;\n" +
						"    y\n" +
						"}\n"),
				is("fn f(x: u32) -> u32 {\n" +
						"    let y = x;\n" +
						"    y\n" +
						"}\n"));
	}

	@Test
	public void ghostParametersAndLocals() throws SyntaxIssue {
		assertThat(stripToText("fn f(x: u32, Ghost(y): Ghost<int>, tracked p: Perm) -> u32 {\n" +
						"    let ghost z = y + 1;\n" +
						"    let w = x * 2;\n" +
						"    w\n" +
						"}\n"),
				is("fn f(x: u32) -> u32 {\n" +
						"    let w = x * 2;\n" +
						"    w\n" +
						"}\n"));
	}

	@Test
	public void ghostFields() throws SyntaxIssue {
		assertThat(stripToText("struct S {\n" +
						"    a: u32,\n" +
						"    ghost b: int,\n" +
						"    c: Tracked<Perm>,\n" +
						"}\n" +
						"struct G {\n" +
						"    ghost x: int,\n" +
						"}\n"),
				is("struct S {\n" +
						"    a: u32,\n" +
						"}\n" +
						"struct G {}\n"));
	}

	@Test
	public void triggerInnerAttributesInClauses() throws SyntaxIssue {
		assertThat(stripToText("fn f(v: &Vec<u32>) -> (r: u32)\n" +
						"    requires forall|i: int| #![all_triggers] 0 <= i < v.len() ==> v[i] < 100,\n" +
						"    ensures forall|i: int| #![auto] 0 <= i < v.len() ==> v[i] <= r,\n" +
						"{\n" +
						"    proof {\n" +
						"        assert forall|i: int| #![auto] 0 <= i < v.len() implies v[i] < 100 by {}\n" +
						"    }\n" +
						"    0\n" +
						"}\n"),
				is("fn f(v: &Vec<u32>) -> u32 {\n" +
						"    0\n" +
						"}\n"));
	}

	@Test
	public void ghostStructLiteralInitializers() throws SyntaxIssue {
		assertThat(stripToText("struct S {\n" +
						"    x: u32,\n" +
						"    g: Ghost<int>,\n" +
						"    ghost h: int,\n" +
						"}\n" +
						"fn mk(h: u32) -> S {\n" +
						"    S { x: 1, g: Ghost(0), h }\n" +
						"}\n" +
						"fn other(p: u32) -> T {\n" +
						"    T { a: p, t: Tracked(p) }\n" +
						"}\n"),
				is("struct S {\n" +
						"    x: u32,\n" +
						"}\n" +
						"fn mk(h: u32) -> S {\n" +
						"    S { x: 1 }\n" +
						"}\n" +
						"fn other(p: u32) -> T {\n" +
						"    T { a: p }\n" +
						"}\n"));
	}

	@Test
	public void enumVariantGhostInitializers() throws SyntaxIssue {
		assertThat(stripToText("enum E {\n" +
						"    A { n: u32, ghost m: int },\n" +
						"}\n" +
						"fn mk() -> E {\n" +
						"    E::A { n: 1, m: 2 }\n" +
						"}\n"),
				is("enum E {\n" +
						"    A { n: u32 },\n" +
						"}\n" +
						"fn mk() -> E {\n" +
						"    E::A { n: 1 }\n" +
						"}\n"));
	}

	@Test
	public void specFunctionTypedParametersAndFields() throws SyntaxIssue {
		assertThat(stripToText("struct Pred {\n" +
						"    n: u64,\n" +
						"    inv: spec_fn(int) -> bool,\n" +
						"}\n" +
						"fn check(n: u64, p: spec_fn(int) -> bool, q: FnSpec(int) -> int) -> u64 {\n" +
						"    n\n" +
						"}\n"),
				is("struct Pred {\n" +
						"    n: u64,\n" +
						"}\n" +
						"fn check(n: u64) -> u64 {\n" +
						"    n\n" +
						"}\n"));
	}

	@Test
	public void proofStrategyFunctionIsRemoved() throws SyntaxIssue {
		assertThat(stripToText("proof fn mul_pos(x: int, y: int) by (nonlinear_arith)\n" +
						"    requires x > 0, y > 0,\n" +
						"    ensures x * y > 0,\n" +
						"{}\n" +
						"fn e() {}\n"),
				is("fn e() {}\n"));
	}

	@Test
	public void namedForIterator() throws SyntaxIssue {
		assertThat(stripToText("fn sum(v: &Vec<u32>) -> u32 {\n" +
						"    let mut s = 0;\n" +
						"    for j in it: 0..v.len()\n" +
						"        invariant s <= j * 100,\n" +
						"    {\n" +
						"        s += 1;\n" +
						"    }\n" +
						"    s\n" +
						"}\n"),
				is("fn sum(v: &Vec<u32>) -> u32 {\n" +
						"    let mut s = 0;\n" +
						"    for j in 0..v.len() {\n" +
						"        s += 1;\n" +
						"    }\n" +
						"    s\n" +
						"}\n"));
	}

	@Test
	public void matchesInSpecificationCode() throws SyntaxIssue {
		assertThat(stripToText("spec fn is_some(o: Option<int>) -> bool {\n" +
						"    o matches Some(_)\n" +
						"}\n" +
						"fn get(o: Option<u32>) -> u32\n" +
						"    requires o matches Some(x) && x > 0,\n" +
						"{\n" +
						"    o.unwrap()\n" +
						"}\n"),
				is("fn get(o: Option<u32>) -> u32 {\n" +
						"    o.unwrap()\n" +
						"}\n"));
	}

	@Test
	public void wholeItems() throws SyntaxIssue {
		assertThat(stripToText("use vstd::prelude::*;\n" +
						"spec fn s() -> int { 1 }\n" +
						"proof fn p() {}\n" +
						"fn e() {}\n"),
				is("fn e() {}\n"));
	}

	@Test
	public void specificationOnlyFileBecomesEmpty() throws SyntaxIssue {
		RustSourceUnit stripped = strip("verus! {\nspec fn s() -> int { 1 }\nproof fn p() {}\n}\n");
		assertTrue(stripped.getItems().isEmpty());
		assertThat(StripPipeline.format(stripped), is(""));
	}

	@Test
	public void strippedOutputIsAFixedPoint() throws SyntaxIssue {
		String once = stripToText("verus! {\n" +
				"fn g(v: &Vec<u64>, Ghost(n): Ghost<nat>) -> u64\n" +
				"    requires v.len() > 0,\n" +
				"{\n" +
				"    let mut i = 0;\n" +
				"    while i < v.len()\n" +
				"        invariant i <= v.len(),\n" +
				"    {\n" +
				"        assert(i < v.len());\n" +
				"        i += 1;\n" +
				"    }\n" +
				"    v[0]\n" +
				"}\n" +
				"}\n");
		assertThat(once, is("fn g(v: &Vec<u64>) -> u64 {\n" +
				"    let mut i = 0;\n" +
				"    while i < v.len() {\n" +
				"        i += 1;\n" +
				"    }\n" +
				"    v[0]\n" +
				"}\n"));
		assertThat(stripToText(once), is(once));
	}

}
