package com.pngify.core;

import com.pngify.core.processing.PngByteArrayOutputStream;

import java.io.File;
import java.io.IOException;
import java.util.List;

/**
 * Encodes RGBA pixels as an 8 bit truecolor-with-alpha png: unfiltered scanlines,
 * one IDAT chunk, no ancillary chunks.
 */
public class PngWriter extends PngProcessor {

	private Integer compressionLevel;
	public Integer getCompressionLevel() { return this.compressionLevel; }
	/** 0-9; null (or anything out of range) means the zlib default */
	public void setCompressionLevel(Integer compressionLevel) { this.compressionLevel = compressionLevel; }

	public PngWriter() {
		this(Logger.NONE);
	}

	public PngWriter(String logLevel) {
		super(logLevel);
	}

	/**
	 * Encode width * height pixels given row by row.
	 *
	 * @throws PngException with {@link PngException.Reason#INVALID_PIXEL_BUFFER_LENGTH} if
	 *         the pixel count doesn't match, before any encoding is done
	 */
	public byte[] write(int width, int height, List<PngPixel> pixels) {
		return write(PngPixelBuffer.of(width, height, pixels));
	}

	/** */
	public byte[] write(PngPixelBuffer pixels) {
		return toPngImage(pixels).toByteArray();
	}

	/**
	 * Encode the pixels and write them to the named file. Nothing is written if encoding fails.
	 */
	public File export(PngPixelBuffer pixels, String fileName) throws IOException {
		return toPngImage(pixels).export(fileName);
	}

	/** */
	public PngImage toPngImage(PngPixelBuffer pixels) {
		log.debug("=== WRITING %dx%d ===", pixels.getWidth(), pixels.getHeight());

		final byte[] deflatedImageData;
		try {
			deflatedImageData = pngCompressionHandler.deflate(getScanlines(pixels), compressionLevel);
		} catch (IOException e) {
			throw new PngException(PngException.Reason.IO_ERROR, "Couldn't compress image data", e);
		}

		final PngImage image = new PngImage(log, chunkCodec);
		image.addChunk(PngHeader.rgba8(pixels.getWidth(), pixels.getHeight()).toChunk());
		image.addChunk(new PngChunk(PngChunk.IMAGE_DATA, deflatedImageData));
		image.addChunk(new PngChunk(PngChunk.IMAGE_TRAILER, new byte[0]));

		return image;
	}

	/*
	 * One filter byte per row followed by the row's RGBA bytes, which are already
	 * in the order truecolor-with-alpha scanlines want them.
	 */
	private PngByteArrayOutputStream getScanlines(PngPixelBuffer pixels) {
		final int rowBytes = pixels.getWidth() * 4;
		final long total = scanlineLength(pixels.getWidth(), PngColorType.TRUECOLOR_ALPHA) * pixels.getHeight();
		if (total > Integer.MAX_VALUE - 8) {
			throw new PngException(PngException.Reason.INVALID_DIMENSIONS,
					String.format("Scanlines for %dx%d don't fit in memory", pixels.getWidth(), pixels.getHeight()));
		}

		final byte[] rgba = pixels.rgba();
		final PngByteArrayOutputStream scanlines = new PngByteArrayOutputStream((int) total);
		for (int y = 0; y < pixels.getHeight(); y++) {
			scanlines.write(FILTER_NONE);
			scanlines.write(rgba, y * rowBytes, rowBytes);
		}
		return scanlines;
	}
}
