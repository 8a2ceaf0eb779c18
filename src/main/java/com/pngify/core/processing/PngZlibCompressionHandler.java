package com.pngify.core.processing;

import com.pngify.core.Logger;

import java.io.EOFException;
import java.io.IOException;
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.DeflaterOutputStream;
import java.util.zip.Inflater;

/**
 * Implements PNG compression and decompression with java.util.zip
 */
public class PngZlibCompressionHandler implements PngCompressionHandler {

	private final Logger log;

	/** */
	public PngZlibCompressionHandler(Logger log) {
		this.log = log;
	}

	/**
	 * {@inheritDoc}
	 */
	@Override
	public byte[] deflate(PngByteArrayOutputStream inflatedImageData, Integer compressionLevel) throws IOException {
		final int level = (compressionLevel == null || compressionLevel > Deflater.BEST_COMPRESSION
				|| compressionLevel < Deflater.NO_COMPRESSION) ? Deflater.DEFAULT_COMPRESSION : compressionLevel;

		final PngByteArrayOutputStream deflatedOut = new PngByteArrayOutputStream(Math.max(inflatedImageData.len() / 2, 64));
		final Deflater deflater = new Deflater(level);
		try (DeflaterOutputStream stream = new DeflaterOutputStream(deflatedOut, deflater)) {
			stream.write(inflatedImageData.get(), 0, inflatedImageData.len());
		} finally {
			deflater.end();
		}
		log.debug("Compression level=%d, bytes %d -> %d", level, inflatedImageData.len(), deflatedOut.len());

		return deflatedOut.toByteArray();
	}

	/**
	 * {@inheritDoc}
	 * Unlike InflaterInputStream this refuses streams that stop before the zlib trailer.
	 */
	@Override
	public PngByteArrayOutputStream inflate(PngByteArrayOutputStream deflatedImageData, long maxLength) throws IOException {
		final long initialSize = Math.min(deflatedImageData.len() * 4L, maxLength);
		final PngByteArrayOutputStream inflatedOut = new PngByteArrayOutputStream((int) Math.min(initialSize, 1 << 20));
		final Inflater inflater = new Inflater();
		try {
			inflater.setInput(deflatedImageData.get(), 0, deflatedImageData.len());

			final byte[] block = new byte[8192];
			while (!inflater.finished()) {
				final int readLength = inflater.inflate(block);
				if (readLength > 0) {
					if (inflatedOut.len() + (long) readLength > maxLength) {
						throw new IOException("Image data inflates past " + maxLength + " bytes");
					}
					inflatedOut.write(block, 0, readLength);
				} else if (inflater.needsInput()) {
					throw new EOFException("Unexpected end of zlib stream after " + inflatedOut.len() + " bytes");
				} else if (inflater.needsDictionary()) {
					throw new IOException("Image data asks for a preset dictionary");
				}
			}
		} catch (DataFormatException e) {
			throw new IOException("Invalid zlib stream: " + e.getMessage(), e);
		} finally {
			inflater.end();
		}
		log.debug("Inflated %d bytes into %d", deflatedImageData.len(), inflatedOut.len());

		return inflatedOut;
	}
}
