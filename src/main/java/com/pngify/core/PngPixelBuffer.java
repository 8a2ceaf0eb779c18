package com.pngify.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Immutable row-major RGBA pixel data for an image of a given width and height.
 * Holds exactly width * height pixels, four bytes each.
 */
public final class PngPixelBuffer {

	private static final int CHANNELS = 4;

	private final int width;
	public int getWidth() { return this.width; }

	private final int height;
	public int getHeight() { return this.height; }

	private final byte[] rgba;

	/* rgba is already checked and owned by this buffer */
	private PngPixelBuffer(int width, int height, byte[] rgba) {
		this.width = width;
		this.height = height;
		this.rgba = rgba;
	}

	/**
	 * Build a buffer from a pixel sequence, checking that it holds exactly width * height pixels.
	 */
	public static PngPixelBuffer of(int width, int height, List<PngPixel> pixels) {
		final int byteCount = byteCount(width, height);
		if (pixels == null || pixels.size() * (long) CHANNELS != byteCount) {
			throw new PngException(PngException.Reason.INVALID_PIXEL_BUFFER_LENGTH,
					String.format("Expected %d pixels for %dx%d but got %d", (long) width * height, width, height,
							(pixels == null) ? 0 : pixels.size()));
		}

		final byte[] rgba = new byte[byteCount];
		int i = 0;
		for (PngPixel pixel : pixels) {
			rgba[i++] = (byte) pixel.getRed();
			rgba[i++] = (byte) pixel.getGreen();
			rgba[i++] = (byte) pixel.getBlue();
			rgba[i++] = (byte) pixel.getAlpha();
		}
		return new PngPixelBuffer(width, height, rgba);
	}

	/**
	 * @param rgba width * height * 4 bytes; copied
	 */
	public static PngPixelBuffer copyOf(int width, int height, byte[] rgba) {
		return new PngPixelBuffer(width, height, checkLength(width, height, rgba).clone());
	}

	/** Wraps bytes produced by the codec itself, skipping the defensive copy */
	static PngPixelBuffer wrap(int width, int height, byte[] rgba) {
		return new PngPixelBuffer(width, height, checkLength(width, height, rgba));
	}

	/** Number of pixels, always width * height */
	public int size() {
		return this.rgba.length / CHANNELS;
	}

	/** */
	public PngPixel getPixel(int x, int y) {
		if (x < 0 || x >= this.width || y < 0 || y >= this.height) {
			throw new IndexOutOfBoundsException(String.format("(%d,%d) outside %dx%d", x, y, this.width, this.height));
		}
		return pixelAt((y * this.width + x) * CHANNELS);
	}

	/** All pixels, row by row */
	public List<PngPixel> getPixels() {
		final List<PngPixel> pixels = new ArrayList<>(size());
		for (int offset = 0; offset < this.rgba.length; offset += CHANNELS) {
			pixels.add(pixelAt(offset));
		}
		return Collections.unmodifiableList(pixels);
	}

	/** A copy of the raw RGBA bytes */
	public byte[] toRgbaBytes() {
		return this.rgba.clone();
	}

	/** Raw bytes without copying; callers in this package must not modify them */
	byte[] rgba() {
		return this.rgba;
	}

	/* */
	private PngPixel pixelAt(int offset) {
		return new PngPixel(this.rgba[offset] & 0xff, this.rgba[offset + 1] & 0xff,
				this.rgba[offset + 2] & 0xff, this.rgba[offset + 3] & 0xff);
	}

	/* */
	static int byteCount(int width, int height) {
		if (width <= 0 || height <= 0) {
			throw new PngException(PngException.Reason.INVALID_DIMENSIONS,
					String.format("Image dimensions must be positive: %dx%d", width, height));
		}
		final long count = (long) width * height * CHANNELS;
		if (count > Integer.MAX_VALUE - 8) {
			throw new PngException(PngException.Reason.INVALID_DIMENSIONS,
					String.format("Image too large to hold in memory: %dx%d", width, height));
		}
		return (int) count;
	}

	/* */
	private static byte[] checkLength(int width, int height, byte[] rgba) {
		final int byteCount = byteCount(width, height);
		if (rgba == null || rgba.length != byteCount) {
			throw new PngException(PngException.Reason.INVALID_PIXEL_BUFFER_LENGTH,
					String.format("Expected %d bytes of RGBA data for %dx%d but got %d", byteCount, width, height,
							(rgba == null) ? 0 : rgba.length));
		}
		return rgba;
	}

	@Override
	public int hashCode() {
		return 31 * (31 * this.width + this.height) + Arrays.hashCode(this.rgba);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}

		if (obj == null || this.getClass() != obj.getClass()) {
			return false;
		}

		PngPixelBuffer other = (PngPixelBuffer) obj;
		return this.width == other.width && this.height == other.height && Arrays.equals(this.rgba, other.rgba);
	}

	@Override
	public String toString() {
		return String.format("PngPixelBuffer[%dx%d]", this.width, this.height);
	}
}
