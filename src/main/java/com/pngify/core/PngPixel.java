package com.pngify.core;

/**
 * A single 8 bit RGBA pixel. Channel values are kept in 0..255.
 */
public final class PngPixel {

	public static final int OPAQUE = 255;

	private final int red;
	private final int green;
	private final int blue;
	private final int alpha;

	/** */
	public PngPixel(int red, int green, int blue) {
		this(red, green, blue, OPAQUE);
	}

	/** */
	public PngPixel(int red, int green, int blue, int alpha) {
		this.red = checkChannel(red);
		this.green = checkChannel(green);
		this.blue = checkChannel(blue);
		this.alpha = checkChannel(alpha);
	}

	/** Grey pixel with the same value in all three color channels */
	public static PngPixel grey(int value, int alpha) {
		return new PngPixel(value, value, value, alpha);
	}

	public int getRed() { return this.red; }
	public int getGreen() { return this.green; }
	public int getBlue() { return this.blue; }
	public int getAlpha() { return this.alpha; }

	/* */
	private static int checkChannel(int value) {
		if (value < 0 || value > 255) {
			throw new IllegalArgumentException("Channel value out of range: " + value);
		}
		return value;
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + this.alpha;
		result = prime * result + this.blue;
		result = prime * result + this.green;
		result = prime * result + this.red;
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}

		if (obj == null || this.getClass() != obj.getClass()) {
			return false;
		}

		PngPixel other = (PngPixel) obj;
		return this.alpha == other.alpha && this.blue == other.blue
				&& this.green == other.green && this.red == other.red;
	}

	@Override
	public String toString() {
		return String.format("%02X%02X%02X.%02X", red, green, blue, alpha);
	}
}
