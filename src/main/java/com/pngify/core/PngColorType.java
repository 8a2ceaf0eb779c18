package com.pngify.core;

/**
 * The color types a png header may declare, with the number of bytes one
 * pixel takes in a raw 8 bit scanline.
 * @see <a href="http://www.w3.org/TR/PNG/#6Colour-values">Colour types</a>
 */
public enum PngColorType {
	GREYSCALE(0, 1),
	TRUECOLOR(2, 3),
	INDEXED_COLOR(3, 1),
	GREYSCALE_ALPHA(4, 2),
	TRUECOLOR_ALPHA(6, 4);

	private final int code;
	public int getCode() { return this.code; }

	private final int bytesPerPixel;
	public int getBytesPerPixel() { return this.bytesPerPixel; }

	PngColorType(int code, int bytesPerPixel) {
		this.code = code;
		this.bytesPerPixel = bytesPerPixel;
	}

	/**
	 * @throws PngException.UnsupportedColorType for any code png doesn't define
	 */
	public static PngColorType forCode(int code) {
		for (PngColorType type : values()) {
			if (type.code == code) {
				return type;
			}
		}
		throw PngException.unsupportedColorType(code);
	}
}
