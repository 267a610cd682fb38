package vstrip;

import vstrip.errors.TopLevelIssueContext;
import vstrip.trans.batch.BatchProcessor;
import vstrip.trans.batch.BatchSummary;
import vstrip.trans.batch.InputCollector;
import vstrip.trans.batch.OutputMode;
import vstrip.trans.passes.parse.option.OptionParsingPass;

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.logging.Logger;

public class VStripMain {
	public static final int EXIT_SUCCESS = 0;
	public static final int EXIT_FAILURE = 1;
	public static final int EXIT_USAGE = 2;

	private final String[] cmdArgs;
	private final PrintStream out;
	private final PrintStream err;
	private static Logger logger;

	public VStripMain(String[] args, PrintStream out, PrintStream err) {
		cmdArgs = args;
		this.out = out;
		this.err = err;
		// Get the top Logger instance
		logger = Logger.getLogger("VStripMain");
	}

	public VStripMain(String[] args) {
		this(args, System.out, System.err);
	}

	public static void main(String[] args) {
		System.exit(new VStripMain(args).run());
	}

	private static OutputMode outputMode(VStripOptions opts) {
		if (opts.check) {
			return OutputMode.CHECK;
		}
		if (opts.in_place) {
			return OutputMode.IN_PLACE;
		}
		if (opts.output != null) {
			return OutputMode.OUTPUT_FILE;
		}
		return OutputMode.STANDARD_OUTPUT;
	}

	// Top-level workhorse method; returns the process exit code.
	public int run() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();

		// Check options, set up logging.
		VStripOptions opts = OptionParsingPass.perform(ctx, logger, cmdArgs);
		if (ctx.hasErrors()) {
			err.println(ctx.format());
			opts.printHelp(err);
			return EXIT_USAGE;
		}
		if (opts.version) {
			out.println("vstrip version " + VStripOptions.VERSION);
			return EXIT_SUCCESS;
		}
		if (opts.help) {
			opts.printHelp(out);
			return EXIT_SUCCESS;
		}

		logger.fine("Collecting input files");
		List<Path> files = new InputCollector(opts.recursive, opts.extensions, opts.skipDirectories)
				.collect(opts.inputs);

		OutputMode mode = outputMode(opts);
		logger.fine("Stripping " + files.size() + " file(s) on " + opts.jobs + " thread(s)");
		Path outputFile = opts.output == null ? null : Paths.get(opts.output);
		BatchSummary summary = new BatchProcessor(logger, mode, outputFile, opts.keep_empty, opts.jobs, out)
				.run(files);
		return summary.hasFailures() ? EXIT_FAILURE : EXIT_SUCCESS;
	}
}
