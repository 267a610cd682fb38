package vstrip.lexer;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.nio.file.Paths;
import java.util.List;

import org.junit.Test;

import vstrip.parser.ParseFailureException;

public class RustLexerFailureTest {

	private static ParseFailureException lexFailure(String input) {
		try {
			new RustLexer(Paths.get("TEST"), input).readTokens();
		} catch (ParseFailureException e) {
			return e;
		}
		fail("expected " + input + " to be rejected");
		return null;
	}

	@Test
	public void unterminatedString() {
		ParseFailureException e = lexFailure("let s = \"abc");
		assertThat(e.getDescription(), is("unterminated string literal"));
		assertThat(e.getLocation().getStartColumn(), is(8));
	}

	@Test
	public void unterminatedBlockComment() {
		ParseFailureException e = lexFailure("a /* b");
		assertThat(e.getDescription(), is("unterminated block comment"));
	}

	@Test
	public void unexpectedCharacter() {
		ParseFailureException e = lexFailure("a\n  \\ b");
		assertThat(e.getDescription(), containsString("unexpected character"));
		assertThat(e.getLocation().getStartLine(), is(1));
		assertThat(e.getLocation().getStartColumn(), is(2));
	}

	@Test
	public void locationsAreZeroBased() throws ParseFailureException {
		List<RustToken> tokens = new RustLexer(Paths.get("TEST"), "fn\n    main").readTokens();
		assertThat(tokens.get(1).getLocation().getStartLine(), is(1));
		assertThat(tokens.get(1).getLocation().getStartColumn(), is(4));
		assertThat(tokens.get(1).getLocation().getStartOffset(), is(7));
	}

}
