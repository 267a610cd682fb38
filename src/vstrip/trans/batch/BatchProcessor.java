package vstrip.trans.batch;

import vstrip.errors.FileContext;
import vstrip.errors.TopLevelIssueContext;
import vstrip.trans.StripPipeline;
import vstrip.trans.StripResult;
import vstrip.trans.VStripTransException;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.Logger;

/**
 * Strips a list of files on a fixed pool of worker threads. Outcomes are
 * reported, and standard output written, by the calling thread in input
 * order. A failing file never stops the rest of the batch.
 */
public class BatchProcessor {

	private final Logger logger;
	private final OutputMode mode;
	private final Path outputFile;
	private final boolean keepEmpty;
	private final int jobs;
	private final PrintStream out;

	public BatchProcessor(Logger logger, OutputMode mode, Path outputFile, boolean keepEmpty, int jobs,
	                      PrintStream out) {
		this.logger = logger;
		this.mode = mode;
		this.outputFile = outputFile;
		this.keepEmpty = keepEmpty;
		this.jobs = jobs;
		this.out = out;
	}

	public BatchSummary run(List<Path> files) {
		ExecutorService executor = Executors.newFixedThreadPool(jobs);
		List<Future<FileOutcome>> futures = new ArrayList<>();
		try {
			for (Path file : files) {
				futures.add(executor.submit(() -> process(file)));
			}
			int succeeded = 0;
			int failed = 0;
			for (int i = 0; i < futures.size(); i++) {
				FileOutcome outcome = await(files.get(i), futures.get(i));
				report(outcome);
				if (outcome.isFailed()) {
					++failed;
				} else {
					++succeeded;
				}
			}
			BatchSummary summary = new BatchSummary(succeeded, failed);
			if (summary.hasFailures()) {
				logger.warning(summary.toString());
			} else {
				logger.info(summary.toString());
			}
			return summary;
		} finally {
			executor.shutdownNow();
		}
	}

	private FileOutcome await(Path file, Future<FileOutcome> future) {
		try {
			return future.get();
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			return FileOutcome.failed(file, "interrupted before " + file + " was processed");
		} catch (ExecutionException e) {
			return FileOutcome.failed(file, "internal error while processing " + file + ": " + e.getCause());
		}
	}

	private void report(FileOutcome outcome) {
		Path path = outcome.getPath();
		switch (outcome.getStatus()) {
			case FAILED:
				logger.severe(outcome.getFailure());
				break;
			case EMPTY:
				logger.warning(path + " contained only specification code");
				if (mode == OutputMode.STANDARD_OUTPUT && keepEmpty) {
					out.print(outcome.getText());
				}
				break;
			case STRIPPED:
				if (mode == OutputMode.CHECK) {
					logger.info(path + " would be stripped successfully");
				} else {
					logger.info(path + " stripped");
				}
				if (mode == OutputMode.STANDARD_OUTPUT) {
					out.print(outcome.getText());
				}
				break;
		}
		out.flush();
	}

	static String readSource(Path file) throws IOException {
		if (Files.isDirectory(file)) {
			throw new IOException("is a directory; use -r to strip the files inside it");
		}
		byte[] bytes = Files.readAllBytes(file);
		return StandardCharsets.UTF_8.newDecoder().decode(ByteBuffer.wrap(bytes)).toString();
	}

	FileOutcome process(Path file) {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		try {
			StripResult result = StripPipeline.perform(ctx, file, readSource(file));
			if (result.isEmpty()) {
				writeEmpty(file, result.getText());
				return FileOutcome.empty(file, result.getText());
			}
			write(file, result.getText());
			return FileOutcome.stripped(file, result.getText());
		} catch (VStripTransException e) {
			return FileOutcome.failed(file, e.getMsg());
		} catch (IOException e) {
			ctx.withContext(new FileContext(file)).error(new IOErrorIssue(file, e));
			return FileOutcome.failed(file, ctx.format());
		}
	}

	private void write(Path file, String text) throws IOException {
		switch (mode) {
			case IN_PLACE:
				AtomicFileWriter.write(file, text);
				break;
			case OUTPUT_FILE:
				try (BufferedWriter writer = Files.newBufferedWriter(outputFile, StandardCharsets.UTF_8)) {
					writer.write(text);
				}
				break;
			case STANDARD_OUTPUT:
			case CHECK:
				break;
		}
	}

	private void writeEmpty(Path file, String text) throws IOException {
		if (keepEmpty) {
			write(file, text);
		} else if (mode == OutputMode.IN_PLACE) {
			Files.deleteIfExists(file);
		}
	}

}
