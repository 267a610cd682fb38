package vstrip;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.plumelib.options.Option;
import org.plumelib.options.Options;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class VStripOptions {
	public static final String VERSION = "0.3.0";

	@Option(value = "-V Print the version and exit", aliases = {"-version"})
	public boolean version = false;

	@Option(value = "-h Print usage information", aliases = {"-help"})
	public boolean help = false;

	@Option(value = "-q Only report warnings and errors", aliases = {"-quiet"})
	public boolean quiet = false;

	/**
	 * Be verbose, print extra detailed information. Sets the log level to FINE.
	 */
	@Option(value = "-v Print detailed information during execution", aliases = {"-verbose"})
	public boolean verbose = false;

	@Option(value = "-o <path> Write the result to this file instead of standard output (single input only)",
			aliases = {"-output"})
	public String output = null;

	@Option(value = "-i Rewrite each input file in place", aliases = {"-in-place"})
	public boolean in_place = false;

	@Option(value = "-r Descend into directories", aliases = {"-recursive"})
	public boolean recursive = false;

	@Option("Only check that every input can be stripped; write nothing")
	public boolean check = false;

	@Option("Write results that contain no items instead of skipping them")
	public boolean keep_empty = false;

	@Option(value = "-j <n> Number of files processed in parallel", aliases = {"-jobs"})
	public Integer jobs = null;

	@Option(value = "-c <path> JSON configuration file, if any", aliases = {"-config"})
	public String config = null;

	public List<String> inputs = Collections.emptyList();

	// fields extracted from the JSON configuration file, or their defaults
	public List<String> extensions = Collections.singletonList(".rs");
	public List<String> skipDirectories = Arrays.asList("target", ".git");

	private final Options plumeOptions;
	private final String[] args;

	public VStripOptions(String[] args) {
		this.args = args;
		plumeOptions = new Options("vstrip [options] input...", this);
	}

	public void printHelp(PrintStream ps) {
		plumeOptions.printUsage(ps);
	}

	public void parse() throws VStripOptionException {
		String[] remainingArgs;
		try {
			remainingArgs = plumeOptions.parse(args);
		} catch (Options.ArgException e) {
			throw new VStripOptionException(e.getMessage());
		}

		if (version || help) {
			return;
		}

		inputs = Arrays.asList(remainingArgs);
		if (inputs.isEmpty()) {
			throw new VStripOptionException("no input files");
		}
		if (in_place && output != null) {
			throw new VStripOptionException("-i and -o cannot be used together");
		}
		if (check && (in_place || output != null)) {
			throw new VStripOptionException("--check does not write output; do not combine it with -i or -o");
		}
		if (output != null && (inputs.size() != 1 || recursive)) {
			throw new VStripOptionException("-o requires exactly one input file");
		}

		if (config != null) {
			readConfig();
		}
		if (jobs == null) {
			jobs = 1;
		}
		if (jobs < 1) {
			throw new VStripOptionException("the number of jobs must be at least 1, got " + jobs);
		}
	}

	private static List<String> getStrings(JSONArray array) {
		List<String> result = new ArrayList<>();
		for (int i = 0; i < array.length(); i++) {
			result.add(array.getString(i));
		}
		return result;
	}

	private void readConfig() throws VStripOptionException {
		String s;

		try {
			byte[] jsonBytes = Files.readAllBytes(Paths.get(config));
			s = new String(jsonBytes, StandardCharsets.UTF_8);
		} catch (IOException ex) {
			throw new VStripOptionException("Error reading configuration file: " + ex.getMessage());
		}

		try {
			JSONObject object = new JSONObject(s);
			// command line flags take precedence over the file
			if (object.has("keep_empty")) {
				keep_empty = keep_empty || object.getBoolean("keep_empty");
			}
			if (jobs == null && object.has("jobs")) {
				jobs = object.getInt("jobs");
			}
			if (object.has("extensions")) {
				extensions = getStrings(object.getJSONArray("extensions"));
			}
			if (object.has("skip_directories")) {
				skipDirectories = getStrings(object.getJSONArray("skip_directories"));
			}
		} catch (JSONException e) {
			throw new VStripOptionException(config + ": parsing error: " + e.getMessage());
		}
	}
}
