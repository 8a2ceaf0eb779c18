package com.pngify;

import com.pngify.core.PngPixel;
import com.pngify.core.PngPixelBuffer;
import com.pngify.core.PngReader;
import com.pngify.core.PngWriter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 *
 */
class PngifyResizerTest {

	@Test
	void resizesIntoToDir(@TempDir Path dir) throws Exception {
		final String source = dir.resolve("in.png").toString();
		new PngWriter().export(PngPixelBuffer.of(1, 2, Arrays.asList(new PngPixel(1, 1, 1), new PngPixel(2, 2, 2))), source);
		final String toDir = dir.resolve("resized/deeper").toString();

		final PngifyResizer resizer = new PngifyResizer(toDir, new String[] { source, dir.resolve("missing.png").toString() },
				3, 4, false, null, "none");

		assertEquals(1, resizer.getResults().size());
		assertEquals(1, resizer.getFailures());

		final File out = new File(toDir, "in_3x4.png");
		assertTrue(out.isFile());
		assertEquals(new PngPixel(2, 2, 2), new PngReader().read(out).getPixels().getPixel(2, 3));
	}

	@Test
	void defaultsToSourceDirectory(@TempDir Path dir) throws Exception {
		final String source = dir.resolve("in.png").toString();
		new PngWriter().export(PngPixelBuffer.of(1, 1, Arrays.asList(new PngPixel(7, 7, 7))), source);

		new PngifyResizer(null, new String[] { source }, 2, 2, null, 9, null);

		assertTrue(dir.resolve("in_2x2.png").toFile().isFile());
	}

	@Test
	void skipCrcCheck(@TempDir Path dir) throws Exception {
		final String source = writeImageWithBadCrc(dir.resolve("bad.png"));

		PngifyResizer resizer = new PngifyResizer(null, new String[] { source }, 2, 2, false, null, "none");
		assertEquals(1, resizer.getFailures());
		assertFalse(dir.resolve("bad_2x2.png").toFile().exists());

		resizer = new PngifyResizer(null, new String[] { source }, 2, 2, true, null, "none");
		assertEquals(0, resizer.getFailures());
		assertEquals(new PngPixel(9, 9, 9), new PngReader().read(resizer.getResults().get(0)).getPixels().getPixel(1, 1));
	}

	@Test
	void commandLine(@TempDir Path dir) throws Exception {
		final String source = writeImageWithBadCrc(dir.resolve("bad.png"));
		final String toDir = dir.resolve("out").toString();

		final PngifyResizer resizer = PngifyResizer.run(new String[] {
				"--width", "3", "--height", "1", "--toDir", toDir, "--skipCrcCheck", "true",
				"--compressionLevel", "1", "--logLevel", "none", source });

		assertNotNull(resizer);
		assertEquals(1, resizer.getResults().size());
		assertTrue(new File(toDir, "bad_3x1.png").isFile());
	}

	@Test
	void commandLineNeedsWidthHeightAndFiles(@TempDir Path dir) throws Exception {
		final String source = dir.resolve("in.png").toString();
		new PngWriter().export(PngPixelBuffer.of(1, 1, Arrays.asList(new PngPixel(7, 7, 7))), source);

		final String out = captureStdout(() -> {
			assertNull(PngifyResizer.run(new String[] { "--height", "2", source }));
			assertNull(PngifyResizer.run(new String[] { "--width", "two", "--height", "2", source }));
			assertNull(PngifyResizer.run(new String[] { "--width", "2", "--height", "2" }));
		});

		assertTrue(out.contains("Both --width and --height are required"));
		assertTrue(out.contains("No files to process"));
		assertFalse(dir.resolve("in_2x2.png").toFile().exists());
	}

	@Test
	void commandLineLogsAtInfoByDefault(@TempDir Path dir) throws Exception {
		final String source = dir.resolve("in.png").toString();
		new PngWriter().export(PngPixelBuffer.of(1, 1, Arrays.asList(new PngPixel(7, 7, 7))), source);

		final String info = captureStdout(() -> PngifyResizer.run(new String[] { "--width", "2", "--height", "2", source }));
		assertTrue(info.contains("Resized 1 files"), info);

		final String quiet = captureStdout(
				() -> PngifyResizer.run(new String[] { "--width", "2", "--height", "2", "--logLevel", "none", source }));
		assertEquals("", quiet);
	}

	/* last byte of the header chunk's crc */
	private static String writeImageWithBadCrc(Path file) throws Exception {
		final byte[] png = new PngWriter().write(PngPixelBuffer.of(1, 1, Arrays.asList(new PngPixel(9, 9, 9))));
		png[32] ^= 0x01;
		Files.write(file, png);
		return file.toString();
	}

	/* */
	private static String captureStdout(Runnable action) {
		final PrintStream original = System.out;
		final ByteArrayOutputStream captured = new ByteArrayOutputStream();
		System.setOut(new PrintStream(captured, true));
		try {
			action.run();
		} finally {
			System.setOut(original);
		}
		return new String(captured.toByteArray(), StandardCharsets.UTF_8);
	}
}
