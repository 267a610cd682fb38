package vstrip.parser;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.nio.file.Paths;

import org.junit.Test;

import vstrip.model.rust.RustBinary;
import vstrip.model.rust.RustExpression;
import vstrip.model.rust.RustFunction;
import vstrip.model.rust.RustPathExpression;
import vstrip.model.rust.RustSourceUnit;
import vstrip.model.rust.RustStruct;

public class RustParserFailureTest {

	private static ParseFailureException parseFailure(String source) {
		try {
			RustParser.readSourceUnit(Paths.get("TEST"), source);
		} catch (ParseFailureException e) {
			return e;
		}
		fail("expected a parse failure for: " + source);
		return null;
	}

	@Test
	public void missingSemicolonBetweenStatements() {
		ParseFailureException e = parseFailure("fn f() {\n    a\n    b\n}\n");
		assertThat(e.getDescription(), is("expected `;`, found `b`"));
		assertThat(e.getLocation().getStartLine(), is(2));
	}

	@Test
	public void letRequiresSemicolon() {
		ParseFailureException e = parseFailure("fn f() { let x = 1 }");
		assertThat(e.getDescription(), is("expected `;`, found `}`"));
	}

	@Test
	public void unexpectedEndOfFile() {
		ParseFailureException e = parseFailure("fn f(");
		assertThat(e.getDescription(), is("expected pattern, found end of file"));
	}

	@Test
	public void strayTokenAtTopLevel() {
		parseFailure("fn f() {}\n42\n");
	}

	@Test
	public void unterminatedLiteralInsideBody() {
		ParseFailureException e = parseFailure("fn f() {\n    let s = \"abc;\n}\n");
		assertThat(e.getDescription(), is("unterminated string literal"));
	}

	@Test
	public void blockLikeStatementsNeedNoSemicolon() throws ParseFailureException {
		RustSourceUnit unit = RustParser.readSourceUnit(Paths.get("TEST"),
				"fn f() {\n    if a {} else {}\n    while b {}\n    m! { x }\n    c\n}\n");
		RustFunction f = (RustFunction) unit.getItems().get(0);
		assertThat(f.getBody().getStatements().size(), is(4));
	}

	@Test
	public void ghostWordsAreOrdinaryNamesOutsideModePosition() throws ParseFailureException {
		RustSourceUnit unit = RustParser.readSourceUnit(Paths.get("TEST"),
				"struct S {\n    ghost: u32,\n    tracked: u64,\n}\n");
		RustStruct s = (RustStruct) unit.getItems().get(0);
		assertThat(s.getFields().get(0).getName(), is("ghost"));
		assertThat(s.getFields().get(1).getName(), is("tracked"));
	}

	@Test
	public void implicationIsRightAssociative() throws ParseFailureException {
		RustExpression e = RustParser.readExpression(Paths.get("TEST"), "a ==> b ==> c");
		// implication groups to the right
		RustBinary outer = (RustBinary) e;
		assertThat(outer.getOperator(), is("==>"));
		assertThat(outer.getLhs(), instanceOf(RustPathExpression.class));
		assertThat(outer.getRhs(), instanceOf(RustBinary.class));
	}

	@Test
	public void trailingTokensAfterExpression() {
		try {
			RustParser.readExpression(Paths.get("TEST"), "a b");
			fail("trailing tokens must be rejected");
		} catch (ParseFailureException e) {
			assertThat(e.getDescription(), is("expected end of expression, found `b`"));
		}
	}

}
