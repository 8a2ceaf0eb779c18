package com.pngify;

import com.pngify.core.Logger;
import com.pngify.core.PngException;
import com.pngify.core.PngReader;
import com.pngify.core.PngResizer;
import com.pngify.core.PngWriter;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Resizes PNG images with nearest-neighbor sampling. Each input file.png is
 * written as file_WxH.png.
 *
 * @see <a href="http://www.w3.org/TR/PNG">PNG spec</a>
 */
public class PngifyResizer {
	/** */
	private static final String HELP = "java -cp pngify-x.x.jar com.pngify.PngifyResizer [options] file1 [file2 ..]\n"
			+ "Options:\n"
			+ "  --width            the width of the resized images (required)\n"
			+ "  --height           the height of the resized images (required)\n"
			+ "  --toDir            the directory where resized files go (will be created if it doesn't exist;\n"
			+ "                     default is next to each original)\n"
			+ "  --skipCrcCheck     true to accept chunks whose crc doesn't match\n"
			+ "  --compressionLevel the compression level; 0-9 allowed (default is the zlib default)\n"
			+ "  --logLevel         the level of logging output (none, debug, info, or error)\n";

	private final List<File> results = new ArrayList<>();
	public List<File> getResults() { return results; }

	private int failures;
	public int getFailures() { return failures; }

	/** */
	public PngifyResizer(String toDir, String[] fileNames, int width, int height, Boolean skipCrcCheck,
			Integer compressionLevel, String logLevel) {

		final long start = System.currentTimeMillis();
		final Logger log = new Logger(logLevel);

		final PngReader reader = new PngReader(logLevel);
		reader.setVerifyCrc(!Boolean.TRUE.equals(skipCrcCheck));
		final PngWriter writer = new PngWriter(logLevel);
		writer.setCompressionLevel(compressionLevel);
		final PngResizer resizer = new PngResizer(reader, writer);

		for (String file : fileNames) {
			try {
				final File source = new File(file);
				final File outputDir = (toDir == null)
						? source.getAbsoluteFile().getParentFile() : new File(makeDirs(toDir));

				results.add(resizer.resize(source, outputDir, width, height));
			} catch (PngException | IOException e) {
				failures++;
				log.error("Problem resizing %s: %s", file, e.getMessage());
			}
		}
		log.info("Resized %d files in %d milliseconds, %d failed", results.size(), System.currentTimeMillis() - start, failures);
	}

	/* */
	private static String makeDirs(String path) throws IOException {
		File out = new File(path);
		if (!out.exists()) {
			if (!out.mkdirs()) {
				throw new IOException("Couldn't create path: " + path);
			}
		}
		return out.getCanonicalPath();
	}

	/** */
	public static void main(String[] args) {
		final PngifyResizer resizer = run(args);
		if (resizer == null || resizer.getFailures() > 0) {
			System.exit(1);
		}
	}

	/**
	 * Parse the command line and resize the files it names.
	 * @return null when the arguments are unusable and the help text was printed instead
	 */
	static PngifyResizer run(String[] args) {
		final Map<String, String> options = new HashMap<>();
		int last = 0;
		for (int i = 0; i < args.length; i++) {
			String arg = args[i];
			if (arg.startsWith("--")) {
				int next = i + 1;
				if (next < args.length) {
					options.put(arg, args[next]);
					last = next + 1;
				} else {
					options.put(arg, null);
					last = next;
				}
			}
		}
		final String[] files = Arrays.copyOfRange(args, last, args.length);

		if (files.length == 0) {
			System.out.println("No files to process");
			System.out.println(HELP);
			return null;
		}

		final Integer width = safeInteger(options.get("--width"));
		final Integer height = safeInteger(options.get("--height"));
		if (width == null || height == null) {
			System.out.println("Both --width and --height are required");
			System.out.println(HELP);
			return null;
		}

		final String toDir = options.get("--toDir");
		final Boolean skipCrcCheck = Boolean.valueOf(options.get("--skipCrcCheck"));
		final Integer compressionLevel = safeInteger(options.get("--compressionLevel"));
		final String logLevel = (options.get("--logLevel") == null) ? Logger.INFO : options.get("--logLevel");

		return new PngifyResizer(toDir, files, width, height, skipCrcCheck, compressionLevel, logLevel);
	}

	/* */
	private static Integer safeInteger(String input) {
		try {
			return Integer.valueOf(input);
		} catch (NumberFormatException e) {
			return null;
		}
	}
}
