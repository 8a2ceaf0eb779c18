package com.pngify.ant;

import com.pngify.core.PngReader;
import com.pngify.core.PngResizer;
import com.pngify.core.PngWriter;
import org.apache.tools.ant.BuildException;
import org.apache.tools.ant.DirectoryScanner;
import org.apache.tools.ant.Task;
import org.apache.tools.ant.types.FileSet;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Pngify resizer ant task
 *
 * <pre>
 * &lt;pngResize width="32" height="32" toDir="build/icons"&gt;
 *     &lt;fileset dir="icons" includes="**&#47;*.png"/&gt;
 * &lt;/pngResize&gt;
 * </pre>
 */
public class PngResizerTask extends Task {

	private String toDir;
	public String getToDir() { return this.toDir; }
	public void setToDir(String toDir) { this.toDir = toDir; }

	private Integer width;
	public Integer getWidth() { return this.width; }
	public void setWidth(Integer width) { this.width = width; }

	private Integer height;
	public Integer getHeight() { return this.height; }
	public void setHeight(Integer height) { this.height = height; }

	private Boolean skipCrcCheck = Boolean.FALSE;
	public Boolean getSkipCrcCheck() { return skipCrcCheck; }
	public void setSkipCrcCheck(Boolean skipCrcCheck) { this.skipCrcCheck = skipCrcCheck; }

	private Integer compressionLevel;
	public Integer getCompressionLevel() { return this.compressionLevel; }
	public void setCompressionLevel(Integer compressionLevel) { this.compressionLevel = compressionLevel; }

	private String logLevel;
	public String getLogLevel() { return this.logLevel; }
	public void setLogLevel(String logLevel) { this.logLevel = logLevel; }

	private final List<File> results = new ArrayList<>();
	public List<File> getResults() { return results; }

	private List<FileSet> filesets = new ArrayList<>();
	public void addFileset(FileSet fileset) {
		if (!this.filesets.contains(fileset)) {
			this.filesets.add(fileset);
		}
	}

	@Override
	public void execute() throws BuildException {
		if (width == null || height == null || width <= 0 || height <= 0) {
			throw new BuildException(String.format("width and height must be positive, got %s x %s", width, height));
		}
		this.resize();
	}

	/* */
	private void resize() {
		final long start = System.currentTimeMillis();

		final PngReader reader = new PngReader(logLevel);
		reader.setVerifyCrc(!Boolean.TRUE.equals(skipCrcCheck));
		final PngWriter writer = new PngWriter(logLevel);
		writer.setCompressionLevel(compressionLevel);
		final PngResizer resizer = new PngResizer(reader, writer);

		int failures = 0;
		for (FileSet fileset : filesets) {
			final DirectoryScanner ds = fileset.getDirectoryScanner(getProject());
			for (String src : ds.getIncludedFiles()) {
				final File input = new File(fileset.getDir(getProject()), src);
				try {
					// keep nested dirs of a **/* fileset
					final File outputDir = (toDir == null)
							? input.getParentFile() : makeDirs(new File(toDir, src).getParentFile());

					results.add(resizer.resize(input, outputDir, width, height));
				} catch (Exception e) {
					failures++;
					log(String.format("Problem resizing %s. Caught %s", input.getPath(), e.getMessage()));
				}
			}
		}

		log(String.format("Resized %d files in %d milliseconds, %d failed",
				results.size(), System.currentTimeMillis() - start, failures));
	}

	/* */
	private File makeDirs(File out) {
		try {
			if (!out.exists()) {
				if (!out.mkdirs()) {
					throw new IOException("Couldn't create path: " + out.getPath());
				}
			}
			return out.getCanonicalFile();
		} catch (IOException e) {
			throw new BuildException("Bad path: " + out.getPath(), e);
		}
	}
}
