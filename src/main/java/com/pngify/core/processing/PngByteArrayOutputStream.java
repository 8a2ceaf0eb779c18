package com.pngify.core.processing;

import java.io.ByteArrayOutputStream;

/**
 * Byte buffer whose backing array can be read in place, so scanline and
 * compressed image data don't get copied on every hand-off.
 */
public class PngByteArrayOutputStream extends ByteArrayOutputStream {

	public PngByteArrayOutputStream() {
		this(32);
	}

	public PngByteArrayOutputStream(int size) {
		super(Math.max(size, 1));
	}

	/** The backing array; only the first {@link #len()} bytes are valid */
	public byte[] get() {
		return buf;
	}

	public int len() {
		return count;
	}
}
