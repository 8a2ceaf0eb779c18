package com.pngify.core;

/**
 * Result of reading a png: its dimensions, the color type it was stored in and its pixels as RGBA.
 */
public final class PngDecodedImage {

	private final PngColorType colorType;
	public PngColorType getColorType() { return this.colorType; }

	private final PngPixelBuffer pixels;
	public PngPixelBuffer getPixels() { return this.pixels; }

	/** */
	public PngDecodedImage(PngColorType colorType, PngPixelBuffer pixels) {
		this.colorType = colorType;
		this.pixels = pixels;
	}

	public int getWidth() { return this.pixels.getWidth(); }
	public int getHeight() { return this.pixels.getHeight(); }

	@Override
	public String toString() {
		return String.format("%dx%d %s", getWidth(), getHeight(), this.colorType);
	}
}
