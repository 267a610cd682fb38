package vstrip.trans.passes.parse.option;

import vstrip.VStripOptionException;
import vstrip.VStripOptions;
import vstrip.errors.IssueContext;

import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

public class OptionParsingPass {
	private OptionParsingPass() {}

	public static VStripOptions perform(IssueContext ctx, Logger logger, String[] args) {
		VStripOptions opts = new VStripOptions(args);
		try {
			opts.parse();
		} catch (VStripOptionException e) {
			ctx.error(new OptionParserIssue(e.getMsg()));
		}
		// set the log level based on command line arguments
		Level level;
		if (opts.quiet) {
			level = Level.WARNING;
		} else if (opts.verbose) {
			level = Level.FINE;
		} else {
			level = Level.INFO;
		}
		logger.setLevel(level);
		Logger.getLogger("vstrip").setLevel(level);
		for (Handler handler : Logger.getLogger("").getHandlers()) {
			handler.setLevel(level);
		}
		return opts;
	}
}
