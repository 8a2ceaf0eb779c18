package com.pngify.core.processing;

import java.io.IOException;

/**
 * Apply PNG compression and decompression. Implies zlib format, aka LZ77.
 */
public interface PngCompressionHandler {

	/**
	 * Deflate (compress) raw scanline data into a zlib stream.
	 *
	 * @param inflatedImageData The uncompressed scanlines, filter bytes included
	 * @param compressionLevel 0-9, or null for the zlib default
	 * @return The zlib stream for the image data chunk
	 */
	public byte[] deflate(PngByteArrayOutputStream inflatedImageData, Integer compressionLevel) throws IOException;

	/**
	 * Inflate (decompress) a zlib stream.
	 *
	 * @param deflatedImageData The concatenated image data chunk payloads
	 * @param maxLength The most uncompressed bytes the image can hold
	 * @return The uncompressed scanlines
	 * @throws IOException when the stream is malformed, ends early, or inflates past maxLength
	 */
	public PngByteArrayOutputStream inflate(PngByteArrayOutputStream deflatedImageData, long maxLength) throws IOException;
}
