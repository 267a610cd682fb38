package vstrip.formatters;

import java.io.IOException;
import java.io.Writer;

/**
 * A writer that indents every line it starts by the current indentation.
 * Lines always end in '\n' regardless of the platform, so output is the same
 * everywhere.
 */
public class IndentingWriter extends Writer {

	private static final String LF = "\n";

	Writer out;
	int indent = 0;
	boolean shouldIndent = false;
	int defaultIndent = 4;
	int horizontalPosition = 0;

	public static class Indent implements AutoCloseable {

		IndentingWriter writer;
		int spaces;

		public Indent(IndentingWriter writer, int spaces) {
			this.writer = writer;
			this.spaces = spaces;
		}

		@Override
		public void close() {
			writer.unindent(spaces);
		}

	}

	public Indent indent(int spaces) {
		indent += spaces;
		return new Indent(this, spaces);
	}

	public Indent indent() {
		return indent(defaultIndent);
	}

	/**
	 * @return the 0-based position along the current line of text being written
	 */
	public int getHorizontalPosition() {
		return horizontalPosition;
	}

	public void unindent(int spaces) {
		if(spaces > indent) {
			throw new RuntimeException("can't unindent below 0");
		}
		indent -= spaces;
	}

	public IndentingWriter(Writer out) {
		this.out = out;
	}

	public IndentingWriter(Writer out, int defaultIndent) {
		this.out = out;
		this.defaultIndent = defaultIndent;
	}

	@Override
	public void close() throws IOException {
		out.close();
	}

	@Override
	public void flush() throws IOException {
		out.flush();
	}

	public void newLine() throws IOException {
		write(LF);
	}

	/**
	 * Writes text whose own line breaks must not be indented, such as a
	 * multi-line string literal. Only the start of the text is indented.
	 */
	public void writeVerbatim(String text) throws IOException {
		if(shouldIndent) {
			for(int i = 0; i < indent; ++i) {
				out.write(" ");
			}
			horizontalPosition = indent;
			shouldIndent = false;
		}
		out.write(text);
		int lastLine = text.lastIndexOf(LF);
		if(lastLine == -1) {
			horizontalPosition += text.length();
		}else {
			horizontalPosition = text.length() - lastLine - LF.length();
		}
	}

	@Override
	public void write(char[] chars, int offset, int len) throws IOException {
		String data = String.valueOf(chars, offset, len);
		int start = 0;
		while(start < data.length()) {
			int next = data.indexOf(LF, start);
			if(shouldIndent && next != start) {
				// blank lines are left without trailing whitespace
				for(int i = 0; i < indent; ++i) {
					out.write(" ");
				}
				horizontalPosition = indent;
			}
			shouldIndent = false;
			if(next != -1) {
				out.write(data, start, next + LF.length() - start);
				horizontalPosition = 0;
				start = next + LF.length();
				shouldIndent = true;
			}else {
				horizontalPosition += data.length() - start;
				out.write(data.substring(start));
				break;
			}
		}
	}

}
