package vstrip.trans.passes.classify;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import org.junit.Test;

import vstrip.errors.Issue;
import vstrip.errors.TopLevelIssueContext;
import vstrip.model.rust.*;
import vstrip.trans.passes.parse.ParsingPass;
import vstrip.trans.passes.parse.SyntaxIssue;
import vstrip.trans.passes.preprocess.WrapperPreprocessingPass;

public class ClassificationPassTest {

	static Path testFile = Paths.get("TEST");

	private TopLevelIssueContext ctx = new TopLevelIssueContext();

	private static RustSourceUnit parse(String source) throws SyntaxIssue {
		return ParsingPass.perform(testFile, WrapperPreprocessingPass.perform(testFile, source));
	}

	private Classification classify(RustSourceUnit unit) {
		return ClassificationPass.perform(ctx, unit);
	}

	private static RustFunction function(RustSourceUnit unit, int index) {
		return (RustFunction) unit.getItems().get(index);
	}

	private String singleIssue() {
		List<Issue> issues = ctx.getIssues();
		assertThat(issues.size(), is(1));
		assertThat(issues.get(0), instanceOf(UnsupportedConstructIssue.class));
		return ((UnsupportedConstructIssue) issues.get(0)).getDescription();
	}

	@Test
	public void functionModes() throws SyntaxIssue {
		RustSourceUnit unit = parse("verus! {\n" +
				"spec fn a() -> int { 1 }\n" +
				"proof fn b() {}\n" +
				"exec fn c() {}\n" +
				"fn d() {}\n" +
				"axiom fn e();\n" +
				"spec(checked) fn f() -> int { 1 }\n" +
				"}\n");
		Classification classification = classify(unit);
		assertFalse(ctx.hasErrors());
		assertThat(classification.getKind(function(unit, 0)), is(Kind.SPECIFICATION));
		assertThat(classification.getKind(function(unit, 1)), is(Kind.PROOF));
		assertThat(classification.getKind(function(unit, 2)), is(Kind.EXECUTABLE));
		assertThat(classification.getKind(function(unit, 3)), is(Kind.EXECUTABLE));
		assertThat(classification.getKind(function(unit, 4)), is(Kind.PROOF));
		assertThat(classification.getKind(function(unit, 5)), is(Kind.SPECIFICATION));
	}

	@Test
	public void useDeclarations() throws SyntaxIssue {
		RustSourceUnit unit = parse("use vstd::prelude::*;\n" +
				"use builtin::*;\n" +
				"use std::vec::Vec;\n" +
				"broadcast use vstd::seq::group_seq_axioms;\n" +
				"use ::vstd::map::Map;\n");
		Classification classification = classify(unit);
		List<RustItem> items = unit.getItems();
		assertThat(classification.getKind(items.get(0)), is(Kind.SPECIFICATION));
		assertThat(classification.getKind(items.get(1)), is(Kind.SPECIFICATION));
		assertThat(classification.getKind(items.get(2)), is(Kind.EXECUTABLE));
		assertThat(classification.getKind(items.get(3)), is(Kind.PROOF));
		assertThat(classification.getKind(items.get(4)), is(Kind.SPECIFICATION));
	}

	@Test
	public void attributes() throws SyntaxIssue {
		RustSourceUnit unit = parse("#[inline]\n#[verifier::external_body]\n#[verus::trusted]\n#[trigger]\nfn f() {}\n");
		Classification classification = classify(unit);
		List<RustAttribute> attributes = function(unit, 0).getAttributes();
		assertThat(classification.getKind(attributes.get(0)), is(Kind.EXECUTABLE));
		assertThat(classification.getKind(attributes.get(1)), is(Kind.SPECIFICATION));
		assertThat(classification.getKind(attributes.get(2)), is(Kind.SPECIFICATION));
		assertThat(classification.getKind(attributes.get(3)), is(Kind.SPECIFICATION));
	}

	@Test
	public void ghostParameters() throws SyntaxIssue {
		RustSourceUnit unit = parse("fn f(a: u32, Ghost(b): Ghost<int>, c: Tracked<Perm>, ghost d: int, " +
				"tracked e: Perm, &self) {}\n");
		Classification classification = classify(unit);
		List<RustParam> params = function(unit, 0).getParams();
		assertThat(classification.getGhostMarker(params.get(0)), is(GhostMarker.NONE));
		assertThat(classification.getGhostMarker(params.get(1)), is(GhostMarker.GHOST));
		assertThat(classification.getGhostMarker(params.get(2)), is(GhostMarker.TRACKED));
		assertThat(classification.getGhostMarker(params.get(3)), is(GhostMarker.GHOST));
		assertThat(classification.getGhostMarker(params.get(4)), is(GhostMarker.TRACKED));
		assertThat(classification.getGhostMarker(params.get(5)), is(GhostMarker.NONE));
	}

	@Test
	public void ghostFields() throws SyntaxIssue {
		RustSourceUnit unit = parse("struct S {\n    a: u32,\n    ghost b: int,\n    c: Ghost<int>,\n" +
				"    tracked d: Perm,\n    ghost: u8,\n}\n");
		Classification classification = classify(unit);
		List<RustField> fields = ((RustStruct) unit.getItems().get(0)).getFields();
		assertThat(classification.getGhostMarker(fields.get(0)), is(GhostMarker.NONE));
		assertThat(classification.getGhostMarker(fields.get(1)), is(GhostMarker.GHOST));
		assertThat(classification.getGhostMarker(fields.get(2)), is(GhostMarker.GHOST));
		assertThat(classification.getGhostMarker(fields.get(3)), is(GhostMarker.TRACKED));
		assertThat(classification.getGhostMarker(fields.get(4)), is(GhostMarker.NONE));
	}

	@Test
	public void statements() throws SyntaxIssue {
		RustSourceUnit unit = parse("fn f(x: u32) -> u32 {\n" +
				"    let a = x;\n" +
				"    let ghost b = x;\n" +
				"    let c: Ghost<int> = Ghost(0);\n" +
				"    let d = Tracked(x);\n" +
				"    assert(a == x);\n" +
				"    assume(a == x);\n" +
				"    proof { assert(true); }\n" +
				"    calc! { (==) a; {} x; }\n" +
				"    reveal(spec_f);\n" +
				"    println!(\"{}\", a);\n" +
				"    assert!(a == x);\n" +
				"    a\n" +
				"}\n");
		Classification classification = classify(unit);
		assertFalse(ctx.format(), ctx.hasErrors());
		List<RustStatement> statements = function(unit, 0).getBody().getStatements();
		Kind[] expected = {
				Kind.EXECUTABLE, Kind.GHOST_DATA, Kind.GHOST_DATA, Kind.GHOST_DATA, Kind.PROOF, Kind.PROOF,
				Kind.PROOF, Kind.PROOF, Kind.PROOF, Kind.EXECUTABLE, Kind.EXECUTABLE, Kind.EXECUTABLE,
		};
		assertThat(statements.size(), is(expected.length));
		for (int i = 0; i < expected.length; i++) {
			assertThat("statement " + i, classification.getKind(statements.get(i)), is(expected[i]));
		}
	}

	@Test
	public void specClauses() throws SyntaxIssue {
		RustSourceUnit unit = parse("fn f(x: u32) -> (r: u32)\n    requires x > 0,\n    ensures r == x,\n{\n    x\n}\n");
		Classification classification = classify(unit);
		for (RustSpecClause clause : function(unit, 0).getSpecClauses()) {
			assertThat(classification.getKind(clause), is(Kind.SPECIFICATION));
		}
		assertThat(function(unit, 0).getSpecClauses().size(), is(2));
	}

	@Test
	public void droppedItemsAreNotDescended() throws SyntaxIssue {
		RustSourceUnit unit = parse("spec fn f(s: Seq<int>) -> bool {\n    forall|i: int| 0 <= i ==> s[i] > 0\n}\n");
		classify(unit);
		assertFalse(ctx.hasErrors());
	}

	@Test
	public void assertInsideExpressionIsRejected() throws SyntaxIssue {
		classify(parse("fn f(x: u32) -> u32 {\n    let y = { assert(x > 0); x };\n    if x > 0 { assume(x > 1); }\n    y\n}\n"));
		assertThat(ctx.getIssues().size(), is(0));

		ctx = new TopLevelIssueContext();
		classify(parse("fn f(x: u32) -> u32 {\n    g(assert(x > 0))\n}\n"));
		assertThat(singleIssue(), is("`assert` inside executable code"));
	}

	@Test
	public void ghostOperatorInExecutableCodeIsRejected() throws SyntaxIssue {
		classify(parse("fn f(a: bool, b: bool) -> bool {\n    a ==> b\n}\n"));
		assertThat(singleIssue(), is("ghost operator `==>` inside executable code"));
	}

	@Test
	public void matchesInExecutableCodeIsRejected() throws SyntaxIssue {
		classify(parse("fn f(o: Option<u32>) -> bool {\n    o matches Some(x)\n}\n"));
		assertThat(singleIssue(), is("ghost operator `matches` inside executable code"));
	}

	@Test
	public void specFunctionTypesAreGhost() throws SyntaxIssue {
		RustSourceUnit unit = parse("fn f(a: u32, p: spec_fn(int) -> bool, q: FnSpec(int) -> int) {}\n" +
				"struct S {\n    a: u32,\n    inv: spec_fn(int) -> bool,\n}\n");
		Classification classification = classify(unit);
		assertFalse(ctx.hasErrors());
		List<RustParam> params = function(unit, 0).getParams();
		assertThat(classification.getGhostMarker(params.get(0)), is(GhostMarker.NONE));
		assertThat(classification.getGhostMarker(params.get(1)), is(GhostMarker.GHOST));
		assertThat(classification.getGhostMarker(params.get(2)), is(GhostMarker.GHOST));
		List<RustField> fields = ((RustStruct) unit.getItems().get(1)).getFields();
		assertThat(classification.getGhostMarker(fields.get(0)), is(GhostMarker.NONE));
		assertThat(classification.getGhostMarker(fields.get(1)), is(GhostMarker.GHOST));
	}

	@Test
	public void ghostFieldInitializers() throws SyntaxIssue {
		RustSourceUnit unit = parse("struct S {\n    x: u32,\n    ghost g: int,\n}\n" +
				"fn mk(g: u32) -> S {\n    S { x: 1, g }\n}\n" +
				"fn other() -> T {\n    T { a: 2, t: Tracked(p) }\n}\n");
		Classification classification = classify(unit);
		assertFalse(ctx.format(), ctx.hasErrors());
		RustStructLiteral mk = tailLiteral(function(unit, 1));
		assertFalse(classification.isGhostInitializer(mk.getFields().get(0)));
		assertTrue(classification.isGhostInitializer(mk.getFields().get(1)));
		RustStructLiteral other = tailLiteral(function(unit, 2));
		assertFalse(classification.isGhostInitializer(other.getFields().get(0)));
		assertTrue(classification.isGhostInitializer(other.getFields().get(1)));
	}

	private static RustStructLiteral tailLiteral(RustFunction function) {
		List<RustStatement> statements = function.getBody().getStatements();
		RustExpressionStatement tail = (RustExpressionStatement) statements.get(statements.size() - 1);
		return (RustStructLiteral) tail.getExpression();
	}

	@Test
	public void viewInExecutableCodeIsRejected() throws SyntaxIssue {
		classify(parse("fn f(v: Vec<u8>) -> usize {\n    v@.len()\n}\n"));
		assertThat(singleIssue(), is("view operator `@` inside executable code"));
	}

	@Test
	public void quantifierInExecutableCodeIsRejected() throws SyntaxIssue {
		classify(parse("fn f() -> bool {\n    forall|i: int| i > 0\n}\n"));
		assertThat(singleIssue(), is("quantifier `forall` inside executable code"));
	}

	@Test
	public void nestedWrapperIsRejected() throws SyntaxIssue {
		classify(parse("verus! {\nverus! {\nfn f() {}\n}\n}\n"));
		assertThat(singleIssue(), is("nested `verus!` wrapper"));
	}

	@Test
	public void dialectSyntaxInMacroArgumentsIsRejected() throws SyntaxIssue {
		classify(parse("fn f(a: bool, b: bool) {\n    debug_assert!(a ==> b);\n}\n"));
		assertThat(singleIssue(), is("verification syntax `==>` inside the arguments of `debug_assert!`"));
	}

	@Test
	public void proofMacroOutsideStatementPositionIsRejected() throws SyntaxIssue {
		classify(parse("fn f() -> u32 {\n    let x = calc! { (==) 1; {} 1; };\n    x\n}\n"));
		assertThat(singleIssue(), is("proof macro `calc!` outside statement position"));
	}

	@Test
	public void executableFunctionReturningGhostIsRejected() throws SyntaxIssue {
		classify(parse("fn f() -> Ghost<int> {\n    Ghost(1)\n}\n"));
		assertThat(singleIssue(), is("executable function `f` returns a ghost or tracked value"));
	}

	@Test
	public void everyIssueIsReported() throws SyntaxIssue {
		classify(parse("fn f(a: bool, b: bool) -> bool {\n    a ==> b\n}\nfn g() -> bool {\n    exists|i: int| i > 0\n}\n"));
		assertThat(ctx.getIssues().size(), is(2));
	}

}
