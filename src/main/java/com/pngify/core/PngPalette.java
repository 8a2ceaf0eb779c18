package com.pngify.core;

/**
 * RGB color table from a PLTE chunk, addressed by the indexes of an indexed-color image.
 */
public final class PngPalette {

	private final byte[] rgb;

	private PngPalette(byte[] rgb) {
		this.rgb = rgb;
	}

	/** */
	public static PngPalette fromChunk(PngChunk chunk) {
		if (chunk.getLength() % 3 != 0) {
			throw new PngException(PngException.Reason.INVALID_PALETTE,
					"Palette length must be a multiple of 3 but was " + chunk.getLength());
		}
		return new PngPalette(chunk.getData());
	}

	/** Number of entries */
	public int size() {
		return this.rgb.length / 3;
	}

	/**
	 * The entry at the index as an opaque pixel.
	 */
	public PngPixel getColor(int index) {
		if (index < 0 || index >= size()) {
			throw indexOutOfRange(index);
		}
		final int offset = index * 3;
		return new PngPixel(this.rgb[offset] & 0xff, this.rgb[offset + 1] & 0xff, this.rgb[offset + 2] & 0xff);
	}

	/* copies the entry straight into an RGBA array */
	void copyTo(int index, byte[] rgba, int offset) {
		if (index >= size()) {
			throw indexOutOfRange(index);
		}
		System.arraycopy(this.rgb, index * 3, rgba, offset, 3);
		rgba[offset + 3] = (byte) PngPixel.OPAQUE;
	}

	/* */
	private PngException indexOutOfRange(int index) {
		return new PngException(PngException.Reason.PALETTE_INDEX_OUT_OF_RANGE,
				String.format("Palette index %d out of range for %d entries", index, size()));
	}
}
