package vstrip.lexer;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import vstrip.parser.ParseFailureException;
import vstrip.util.SourceLocation;

@RunWith(Parameterized.class)
public class RustLexerTest {

	static Path testFile = Paths.get("TEST");

	// token equality ignores locations
	private static RustToken tok(String value, RustTokenType type) {
		return new RustToken(value, type, SourceLocation.unknown());
	}

	private static RustToken ident(String value) {
		return tok(value, RustTokenType.IDENT);
	}

	private static RustToken punct(String value) {
		return tok(value, RustTokenType.PUNCT);
	}

	private static RustToken eof() {
		return tok("", RustTokenType.EOF);
	}

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
			{ "", Arrays.asList(eof()) },
			{ "fn main", Arrays.asList(ident("fn"), ident("main"), eof()) },
			{ "a ==> b", Arrays.asList(ident("a"), punct("==>"), ident("b"), eof()) },
			{ "a <==> b", Arrays.asList(ident("a"), punct("<==>"), ident("b"), eof()) },
			{ "a == b", Arrays.asList(ident("a"), punct("=="), ident("b"), eof()) },
			{ "x =~= y", Arrays.asList(ident("x"), punct("=~="), ident("y"), eof()) },
			{ "&&& a", Arrays.asList(punct("&&&"), ident("a"), eof()) },
			{ "v@", Arrays.asList(ident("v"), punct("@"), eof()) },
			{ "0..10", Arrays.asList(tok("0", RustTokenType.INTEGER), punct(".."),
					tok("10", RustTokenType.INTEGER), eof()) },
			{ "3.14", Arrays.asList(tok("3.14", RustTokenType.FLOAT), eof()) },
			{ "1u64", Arrays.asList(tok("1u64", RustTokenType.INTEGER), eof()) },
			{ "2f32", Arrays.asList(tok("2f32", RustTokenType.FLOAT), eof()) },
			{ "0xFF_u8", Arrays.asList(tok("0xFF_u8", RustTokenType.INTEGER), eof()) },
			{ "t.0.1", Arrays.asList(ident("t"), punct("."), tok("0", RustTokenType.INTEGER), punct("."),
					tok("1", RustTokenType.INTEGER), eof()) },
			{ "\"a // b\"", Arrays.asList(tok("\"a // b\"", RustTokenType.STRING), eof()) },
			{ "r#\"raw \"quoted\" text\"#", Arrays.asList(
					tok("r#\"raw \"quoted\" text\"#", RustTokenType.STRING), eof()) },
			{ "b\"bytes\"", Arrays.asList(tok("b\"bytes\"", RustTokenType.STRING), eof()) },
			{ "'a' 'b", Arrays.asList(tok("'a'", RustTokenType.CHAR), tok("'b", RustTokenType.LIFETIME), eof()) },
			{ "'\\n'", Arrays.asList(tok("'\\n'", RustTokenType.CHAR), eof()) },
			{ "&'static str", Arrays.asList(punct("&"), tok("'static", RustTokenType.LIFETIME), ident("str"),
					eof()) },
			{ "a // comment\nb", Arrays.asList(ident("a"), ident("b"), eof()) },
			{ "a /* outer /* nested */ still */ b", Arrays.asList(ident("a"), ident("b"), eof()) },
			{ "/// docs\nfn", Arrays.asList(tok("/// docs", RustTokenType.DOC_COMMENT), ident("fn"), eof()) },
			{ "//! crate docs", Arrays.asList(tok("//! crate docs", RustTokenType.INNER_DOC_COMMENT), eof()) },
			{ "//// not docs\nx", Arrays.asList(ident("x"), eof()) },
			{ "r#type", Arrays.asList(ident("r#type"), eof()) },
			{ "a::<b>", Arrays.asList(ident("a"), punct("::"), punct("<"), ident("b"), punct(">"), eof()) },
			{ "#![allow(x)]", Arrays.asList(punct("#"), punct("!"), punct("["), ident("allow"), punct("("),
					ident("x"), punct(")"), punct("]"), eof()) },
			{ "#!/usr/bin/env run\nfn", Arrays.asList(ident("fn"), eof()) },
		});
	}

	private String input;
	private List<RustToken> expected;

	public RustLexerTest(String input, List<RustToken> expected) {
		this.input = input;
		this.expected = expected;
	}

	@Test
	public void test() throws ParseFailureException {
		RustLexer lexer = new RustLexer(testFile, input);
		assertThat(lexer.readTokens(), is(expected));
	}

}
