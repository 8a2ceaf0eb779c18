package com.pngify.core;

/**
 * Exception type for pngify code. Every failure carries a {@link Reason} so
 * callers can tell a corrupt file from a bad argument without parsing messages.
 */
public class PngException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	/** What went wrong */
	public enum Reason {
		INVALID_SIGNATURE,
		UNSUPPORTED_COLOR_TYPE,
		UNSUPPORTED_BIT_DEPTH,
		UNSUPPORTED_INTERLACE,
		CHUNK_TOO_LARGE,
		CHECKSUM_MISMATCH,
		INVALID_CHUNK,
		INVALID_PALETTE,
		MISSING_HEADER,
		MISSING_PALETTE,
		TRUNCATED_STREAM,
		DECOMPRESSION_ERROR,
		PALETTE_INDEX_OUT_OF_RANGE,
		INVALID_DIMENSIONS,
		INVALID_PIXEL_BUFFER_LENGTH,
		INVALID_TARGET_DIMENSIONS,
		IO_ERROR,
		INTERRUPTED
	}

	private final Reason reason;
	public Reason getReason() { return this.reason; }

	/** */
	public PngException(Reason reason, String message) {
		super(message);
		this.reason = reason;
	}

	/** */
	public PngException(Reason reason, String message, Throwable cause) {
		super(message, cause);
		this.reason = reason;
	}

	/** */
	public static PngException unsupportedColorType(int code) {
		return new UnsupportedColorType(code);
	}

	/**
	 * Raised when the header names a color type outside of 0, 2, 3, 4 and 6.
	 */
	public static class UnsupportedColorType extends PngException {

		private static final long serialVersionUID = 1L;

		private final int code;
		public int getCode() { return this.code; }

		UnsupportedColorType(int code) {
			super(Reason.UNSUPPORTED_COLOR_TYPE, "Unsupported color type: " + code);
			this.code = code;
		}
	}
}
