package com.pngify.core;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.DataInputStream;
import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.zip.Inflater;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 *
 */
class PngWriterTest {

	private static final List<PngPixel> PIXELS = Arrays.asList(
			new PngPixel(1, 2, 3, 4), new PngPixel(5, 6, 7, 8), new PngPixel(9, 10, 11, 12),
			new PngPixel(13, 14, 15, 16), new PngPixel(17, 18, 19, 20), new PngPixel(21, 22, 23, 24));

	@Test
	void writesHeaderDataAndTrailer() throws Exception {
		final byte[] png = new PngWriter().write(3, 2, PIXELS);

		assertArrayEquals(PngTestImages.SIGNATURE, Arrays.copyOf(png, 8));

		final List<PngChunk> chunks = readChunks(png);
		assertEquals(3, chunks.size());
		assertEquals(PngChunk.IMAGE_HEADER, chunks.get(0).getTypeString());
		assertEquals(PngChunk.IMAGE_DATA, chunks.get(1).getTypeString());
		assertEquals(PngChunk.IMAGE_TRAILER, chunks.get(2).getTypeString());
		assertEquals(0, chunks.get(2).getLength());

		assertArrayEquals(PngTestImages.bytes(0, 0, 0, 3, 0, 0, 0, 2, 8, 6, 0, 0, 0), chunks.get(0).getData());
	}

	@Test
	void imageHoldsOnlyCriticalChunks() {
		final PngImage image = new PngWriter().toPngImage(PngPixelBuffer.of(3, 2, PIXELS));

		assertTrue(image.isTerminated());
		for (PngChunk chunk : image.getChunks()) {
			assertTrue(chunk.isCritical(), chunk.getTypeString());
		}
		assertEquals(3, PngHeader.fromChunk(image.getChunks().get(0)).getWidth());
		assertEquals(PngColorType.TRUECOLOR_ALPHA, PngHeader.fromChunk(image.getChunks().get(0)).getColorType());
	}

	@Test
	void writesUnfilteredScanlines() throws Exception {
		final byte[] png = new PngWriter().write(3, 2, PIXELS);
		final byte[] scanlines = inflate(readChunks(png).get(1).getData(), 2 * (1 + 3 * 4));

		assertArrayEquals(PngTestImages.bytes(
				0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12,
				0, 13, 14, 15, 16, 17, 18, 19, 20, 21, 22, 23, 24), scanlines);
	}

	@Test
	void rejectsMismatchedPixelCount() {
		final PngWriter writer = new PngWriter();

		PngException e = assertThrows(PngException.class, () -> writer.write(2, 2, PIXELS));
		assertEquals(PngException.Reason.INVALID_PIXEL_BUFFER_LENGTH, e.getReason());

		e = assertThrows(PngException.class, () -> writer.write(4, 2, PIXELS));
		assertEquals(PngException.Reason.INVALID_PIXEL_BUFFER_LENGTH, e.getReason());
	}

	@Test
	void rejectsEmptyDimensions() {
		final PngException e = assertThrows(PngException.class,
				() -> new PngWriter().write(0, 3, new ArrayList<PngPixel>()));
		assertEquals(PngException.Reason.INVALID_DIMENSIONS, e.getReason());
	}

	@Test
	void compressionLevelDoesNotChangePixels() {
		final PngWriter writer = new PngWriter();
		final List<PngPixel> pixels = PngTestImages.randomPixels(40 * 30, 3);

		for (Integer level : new Integer[] { 0, 1, 9, null, 42 }) {
			writer.setCompressionLevel(level);
			final PngDecodedImage decoded = new PngReader().read(writer.write(40, 30, pixels));
			assertEquals(pixels, decoded.getPixels().getPixels());
		}
	}

	@Test
	void export(@TempDir Path dir) throws Exception {
		final PngPixelBuffer pixels = PngPixelBuffer.of(3, 2, PIXELS);
		final File out = new PngWriter().export(pixels, dir.resolve("out.png").toString());

		assertTrue(out.isFile());
		assertArrayEquals(new PngWriter().write(pixels), Files.readAllBytes(out.toPath()));
	}

	@Test
	void failedValidationWritesNothing(@TempDir Path dir) {
		final File out = dir.resolve("never.png").toFile();
		assertThrows(PngException.class,
				() -> new PngWriter().export(PngPixelBuffer.of(5, 5, PIXELS), out.getPath()));
		assertFalse(out.exists());
	}

	/* */
	private static List<PngChunk> readChunks(byte[] png) throws Exception {
		final DataInputStream ins = new DataInputStream(new ByteArrayInputStream(png, 8, png.length - 8));
		final PngChunkCodec codec = new PngChunkCodec();
		final List<PngChunk> chunks = new ArrayList<>();
		while (ins.available() > 0) {
			chunks.add(codec.read(ins));
		}
		return chunks;
	}

	/* */
	private static byte[] inflate(byte[] data, int expectedLength) throws Exception {
		final Inflater inflater = new Inflater();
		inflater.setInput(data);
		final byte[] result = new byte[expectedLength + 16];
		final int length = inflater.inflate(result);
		assertTrue(inflater.finished());
		inflater.end();
		return Arrays.copyOf(result, length);
	}
}
