package vstrip.trans.batch;

public class BatchSummary {

	private final int succeeded;
	private final int failed;

	public BatchSummary(int succeeded, int failed) {
		this.succeeded = succeeded;
		this.failed = failed;
	}

	public int getProcessed() {
		return succeeded + failed;
	}

	public int getSucceeded() {
		return succeeded;
	}

	public int getFailed() {
		return failed;
	}

	public boolean hasFailures() {
		return failed != 0;
	}

	@Override
	public String toString() {
		return "Processed " + getProcessed() + " file(s): " + succeeded + " succeeded, " + failed + " failed";
	}

}
