package vstrip.trans.batch;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.filefilter.FileFilterUtils;
import org.apache.commons.io.filefilter.IOFileFilter;
import org.apache.commons.io.filefilter.NameFileFilter;
import org.apache.commons.io.filefilter.SuffixFileFilter;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Expands the command line inputs into the list of files to strip. Paths that
 * do not name a readable file are kept as they are, so that they are reported
 * as failed inputs in their place.
 */
public class InputCollector {

	private final boolean recursive;
	private final IOFileFilter fileFilter;
	private final IOFileFilter directoryFilter;

	public InputCollector(boolean recursive, List<String> extensions, List<String> skipDirectories) {
		this.recursive = recursive;
		this.fileFilter = new SuffixFileFilter(extensions);
		this.directoryFilter = FileFilterUtils.notFileFilter(new NameFileFilter(skipDirectories));
	}

	public List<Path> collect(List<String> inputs) {
		List<Path> result = new ArrayList<>();
		for (String input : inputs) {
			Path path = Paths.get(input);
			if (recursive && Files.isDirectory(path)) {
				result.addAll(walk(path));
			} else {
				result.add(path);
			}
		}
		return result;
	}

	private List<Path> walk(Path directory) {
		Collection<File> files = FileUtils.listFiles(directory.toFile(), fileFilter, directoryFilter);
		return files.stream()
				.map(File::toPath)
				.sorted()
				.collect(Collectors.toList());
	}

}
