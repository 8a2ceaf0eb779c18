package com.pngify.core;

import java.nio.charset.StandardCharsets;
import java.util.zip.CRC32;

/**
 * A typed piece of a png stream: a four letter type tag and its payload.
 * The length and crc that surround it on the wire are derived from those two.
 * @see <a href="http://www.w3.org/TR/PNG/#5Chunk-layout">Chunk layout</a>
 */
public class PngChunk {

	public static final String IMAGE_HEADER = "IHDR";
	public static final String PALETTE = "PLTE";
	public static final String IMAGE_DATA = "IDAT";
	public static final String IMAGE_TRAILER = "IEND";

	public static final int TYPE_LENGTH = 4;

	private final byte[] type;
	private final byte[] data;

	/** */
	public PngChunk(byte[] type, byte[] data) {
		if (type == null || type.length != TYPE_LENGTH) {
			throw new PngException(PngException.Reason.INVALID_CHUNK,
					"Chunk type must be 4 bytes but was " + ((type == null) ? 0 : type.length));
		}
		this.type = type.clone();
		this.data = (data == null) ? new byte[0] : data.clone();
	}

	/** */
	public PngChunk(String type, byte[] data) {
		this(type.getBytes(StandardCharsets.US_ASCII), data);
	}

	/** */
	public byte[] getType() {
		return this.type.clone();
	}

	/** */
	public String getTypeString() {
		return new String(this.type, StandardCharsets.US_ASCII);
	}

	/** */
	public byte[] getData() {
		return this.data.clone();
	}

	/** Payload without copying, for the codec's own reads */
	byte[] data() {
		return this.data;
	}

	/** */
	public int getLength() {
		return this.data.length;
	}

	/** */
	public boolean isType(String typeString) {
		return getTypeString().equals(typeString);
	}

	/**
	 * Critical chunks have an upper case first letter.
	 */
	public boolean isCritical() {
		return (this.type[0] & 0x20) == 0;
	}

	/** */
	public int getUnsignedByte(int offset) {
		return this.data[offset] & 0xff;
	}

	/** Big-endian unsigned 32 bit value at the offset */
	public long getUnsignedInt(int offset) {
		return ((long) getUnsignedByte(offset) << 24)
				| (getUnsignedByte(offset + 1) << 16)
				| (getUnsignedByte(offset + 2) << 8)
				| getUnsignedByte(offset + 3);
	}

	/**
	 * CRC-32 over the type and the data, as stored in the trailer.
	 */
	public long getCRC() {
		final CRC32 crc = new CRC32();
		crc.update(this.type, 0, this.type.length);
		crc.update(this.data, 0, this.data.length);
		return crc.getValue();
	}

	/** */
	public boolean verifyCRC(long crc) {
		return getCRC() == crc;
	}

	@Override
	public String toString() {
		return String.format("%s[%d bytes, crc=%08x]", getTypeString(), getLength(), getCRC());
	}
}
