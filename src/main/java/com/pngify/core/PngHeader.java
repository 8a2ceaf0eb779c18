package com.pngify.core;

import java.nio.ByteBuffer;

/**
 * The contents of an IHDR chunk.
 * @see <a href="http://www.w3.org/TR/PNG/#11IHDR">IHDR Image header</a>
 */
public final class PngHeader {

	static final int LENGTH = 13;

	private final long width;
	private final long height;
	private final int bitDepth;
	private final int colorTypeCode;
	private final int compressionMethod;
	private final int filterMethod;
	private final int interlaceMethod;

	/** */
	public PngHeader(long width, long height, int bitDepth, int colorTypeCode,
			int compressionMethod, int filterMethod, int interlaceMethod) {
		this.width = width;
		this.height = height;
		this.bitDepth = bitDepth;
		this.colorTypeCode = colorTypeCode;
		this.compressionMethod = compressionMethod;
		this.filterMethod = filterMethod;
		this.interlaceMethod = interlaceMethod;
	}

	/** Header for 8 bit, non-interlaced RGBA, the only layout the writer produces */
	public static PngHeader rgba8(int width, int height) {
		return new PngHeader(width, height, 8, PngColorType.TRUECOLOR_ALPHA.getCode(), 0, 0, 0);
	}

	/** */
	public static PngHeader fromChunk(PngChunk chunk) {
		if (!chunk.isType(PngChunk.IMAGE_HEADER) || chunk.getLength() != LENGTH) {
			throw new PngException(PngException.Reason.INVALID_CHUNK,
					String.format("Not a valid header chunk: %s", chunk));
		}
		return new PngHeader(chunk.getUnsignedInt(0), chunk.getUnsignedInt(4),
				chunk.getUnsignedByte(8), chunk.getUnsignedByte(9),
				chunk.getUnsignedByte(10), chunk.getUnsignedByte(11), chunk.getUnsignedByte(12));
	}

	/** */
	public PngChunk toChunk() {
		final ByteBuffer data = ByteBuffer.allocate(LENGTH);
		data.putInt((int) this.width);
		data.putInt((int) this.height);
		data.put((byte) this.bitDepth);
		data.put((byte) this.colorTypeCode);
		data.put((byte) this.compressionMethod);
		data.put((byte) this.filterMethod);
		data.put((byte) this.interlaceMethod);

		return new PngChunk(PngChunk.IMAGE_HEADER, data.array());
	}

	public long getWidth() { return this.width; }
	public long getHeight() { return this.height; }
	public int getBitDepth() { return this.bitDepth; }
	public int getInterlaceMethod() { return this.interlaceMethod; }

	/**
	 * @throws PngException.UnsupportedColorType if the code isn't a png color type
	 */
	public PngColorType getColorType() {
		return PngColorType.forCode(this.colorTypeCode);
	}

	@Override
	public String toString() {
		return String.format("%dx%d, depth=%d, colorType=%d, interlace=%d",
				width, height, bitDepth, colorTypeCode, interlaceMethod);
	}
}
