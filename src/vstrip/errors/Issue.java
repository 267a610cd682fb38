package vstrip.errors;

import vstrip.Unreachable;
import vstrip.formatters.IndentingWriter;
import vstrip.formatters.IssueFormattingVisitor;
import vstrip.trans.VStripTransException;

import java.io.IOException;
import java.io.StringWriter;

public abstract class Issue extends VStripTransException {
	private static final long serialVersionUID = 3113426839203657410L;

	public Issue() {
		super("");
	}

	@Override
	public String getMessage() {
		StringWriter sw = new StringWriter();
		IndentingWriter out = new IndentingWriter(sw);
		try {
			accept(new IssueFormattingVisitor(out));
		} catch (IOException e) {
			throw new Unreachable(e); // string ops don't throw IO exceptions
		}
		return sw.getBuffer().toString();
	}

	public Issue withContext(Context ctx) {
		return new IssueWithContext(this, ctx);
	}

	public abstract <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E;

}
