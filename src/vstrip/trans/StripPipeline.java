package vstrip.trans;

import vstrip.Unreachable;
import vstrip.errors.FileContext;
import vstrip.errors.IssueContext;
import vstrip.errors.TopLevelIssueContext;
import vstrip.formatters.IndentingWriter;
import vstrip.formatters.RustNodeFormattingVisitor;
import vstrip.model.rust.RustSourceUnit;
import vstrip.trans.passes.classify.Classification;
import vstrip.trans.passes.classify.ClassificationPass;
import vstrip.trans.passes.classify.Kind;
import vstrip.trans.passes.parse.ParsingPass;
import vstrip.trans.passes.parse.SyntaxIssue;
import vstrip.trans.passes.preprocess.WrapperPreprocessingPass;
import vstrip.trans.passes.strip.StrippingPass;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * Strips one file: unwraps `verus!` blocks, parses, classifies, strips and
 * prints. Issues are recorded in the given context, tagged with the file, and
 * end the pipeline with a {@link VStripTransException}.
 */
public class StripPipeline {
	private static final Logger logger = Logger.getLogger(StripPipeline.class.getName());

	private StripPipeline() {}

	private static void checkErrors(TopLevelIssueContext ctx) throws VStripTransException {
		if (ctx.hasErrors()) {
			throw new VStripTransException(ctx.format());
		}
	}

	public static StripResult perform(TopLevelIssueContext ctx, Path inputFileName, CharSequence inputFileContents)
			throws VStripTransException {
		IssueContext fileCtx = ctx.withContext(new FileContext(inputFileName));

		RustSourceUnit sourceUnit = null;
		try {
			logger.fine("Unwrapping verus! blocks in " + inputFileName);
			String unwrapped = WrapperPreprocessingPass.perform(inputFileName, inputFileContents);
			logger.fine("Parsing " + inputFileName);
			sourceUnit = ParsingPass.perform(inputFileName, unwrapped);
		} catch (SyntaxIssue issue) {
			fileCtx.error(issue);
		}
		checkErrors(ctx);

		logger.fine("Classifying " + inputFileName);
		Classification classification = ClassificationPass.perform(fileCtx, sourceUnit);
		checkErrors(ctx);
		logger.fine(String.format("%s: %d specification, %d proof and %d ghost constructs", inputFileName,
				classification.count(Kind.SPECIFICATION), classification.count(Kind.PROOF),
				classification.count(Kind.GHOST_DATA)));

		logger.fine("Stripping " + inputFileName);
		RustSourceUnit stripped = StrippingPass.perform(sourceUnit, classification);

		return new StripResult(format(stripped), stripped.getItems().isEmpty());
	}

	public static String format(RustSourceUnit sourceUnit) {
		StringWriter writer = new StringWriter();
		try (IndentingWriter out = new IndentingWriter(writer)) {
			sourceUnit.accept(new RustNodeFormattingVisitor(out));
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return writer.toString();
	}

}
