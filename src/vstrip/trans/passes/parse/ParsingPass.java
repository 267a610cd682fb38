package vstrip.trans.passes.parse;

import vstrip.model.rust.RustSourceUnit;
import vstrip.parser.ParseFailureException;
import vstrip.parser.RustParser;

import java.nio.file.Path;

public class ParsingPass {
	private ParsingPass() {}

	public static RustSourceUnit perform(Path inputFileName, CharSequence inputFileContents) throws SyntaxIssue {
		try {
			return RustParser.readSourceUnit(inputFileName, inputFileContents);
		} catch (ParseFailureException e) {
			throw new SyntaxIssue(e.getLocation(), e.getDescription());
		}
	}
}
