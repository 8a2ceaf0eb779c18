package com.pngify.core;

import com.pngify.core.processing.PngByteArrayOutputStream;

import java.io.BufferedInputStream;
import java.io.ByteArrayInputStream;
import java.io.DataInputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * Decodes 8 bit, non-interlaced png images of any color type into RGBA pixels.
 * Scanline filters are not reversed, so only unfiltered images decode correctly.
 */
public class PngReader extends PngProcessor {

	public PngReader() {
		this(Logger.NONE);
	}

	public PngReader(String logLevel) {
		super(logLevel);
	}

	/** Check chunk crcs against their trailers; on by default */
	public void setVerifyCrc(boolean verifyCrc) {
		chunkCodec.setVerifyCrc(verifyCrc);
	}

	/** */
	public void setMaxChunkLength(int maxChunkLength) {
		chunkCodec.setMaxChunkLength(maxChunkLength);
	}

	/** */
	public static PngDecodedImage readRGBA8(final byte[] image) {
		return new PngReader().read(image);
	}

	/** */
	public PngDecodedImage read(final byte[] image) {
		try {
			return read(new ByteArrayInputStream(image));
		} catch (IOException e) {
			throw new PngException(PngException.Reason.IO_ERROR, "Error: " + e.getMessage(), e);
		}
	}

	/** */
	public PngDecodedImage read(final File file) throws IOException {
		try (InputStream ins = new BufferedInputStream(new FileInputStream(file))) {
			log.debug("Reading %s", file.getPath());
			return read(ins);
		}
	}

	/**
	 * Read a whole png stream, up to and including its IEND chunk.
	 * Nothing is kept on the reader between calls.
	 */
	public PngDecodedImage read(final InputStream ins) throws IOException {
		log.debug("=== READING ===");

		final DataInputStream dis = new DataInputStream(ins);
		PngImage.readSignature(dis);

		PngHeader header = null;
		PngPalette palette = null;
		boolean imageDataSeen = false;
		final PngByteArrayOutputStream imageData = new PngByteArrayOutputStream(8192);

		while (true) {
			final PngChunk chunk = chunkCodec.read(dis);
			final String type = chunk.getTypeString();

			if (header == null && !PngChunk.IMAGE_HEADER.equals(type)) {
				throw new PngException(PngException.Reason.MISSING_HEADER,
						"Expected " + PngChunk.IMAGE_HEADER + " as the first chunk but got " + type);
			}

			switch (type) {
				case PngChunk.IMAGE_HEADER:
					if (header != null) {
						throw new PngException(PngException.Reason.INVALID_CHUNK, "More than one header chunk");
					}
					header = readHeader(chunk);
					log.debug("header: %s", header);
					break;

				case PngChunk.PALETTE:
					if (imageDataSeen) {
						log.debug("Ignoring palette after image data");
					} else {
						palette = PngPalette.fromChunk(chunk);
						log.debug("palette: %d entries", palette.size());
					}
					break;

				case PngChunk.IMAGE_DATA:
					imageData.write(chunk.data(), 0, chunk.getLength());
					imageDataSeen = true;
					break;

				case PngChunk.IMAGE_TRAILER:
					return new PngDecodedImage(header.getColorType(), expand(header, palette, imageData));

				default:
					log.debug("Skipping chunk: %s", chunk);
					break;
			}
		}
	}

	/* */
	private PngHeader readHeader(PngChunk chunk) {
		final PngHeader header = PngHeader.fromChunk(chunk);

		// fail on the color type here rather than when expanding pixels
		header.getColorType();

		if (header.getBitDepth() != 8) {
			throw new PngException(PngException.Reason.UNSUPPORTED_BIT_DEPTH,
					"Unsupported bit depth: " + header.getBitDepth());
		}
		if (header.getInterlaceMethod() != 0) {
			throw new PngException(PngException.Reason.UNSUPPORTED_INTERLACE,
					"Unsupported interlace method: " + header.getInterlaceMethod());
		}
		if (header.getWidth() > Integer.MAX_VALUE || header.getHeight() > Integer.MAX_VALUE) {
			throw new PngException(PngException.Reason.INVALID_DIMENSIONS,
					String.format("Image dimensions out of range: %dx%d", header.getWidth(), header.getHeight()));
		}
		PngPixelBuffer.byteCount((int) header.getWidth(), (int) header.getHeight());

		return header;
	}

	/*
	 * Inflate the image data and turn every scanline into RGBA pixels.
	 */
	private PngPixelBuffer expand(PngHeader header, PngPalette palette, PngByteArrayOutputStream imageData) {
		final PngColorType colorType = header.getColorType();
		final int width = (int) header.getWidth();
		final int height = (int) header.getHeight();

		if (colorType == PngColorType.INDEXED_COLOR && palette == null) {
			throw new PngException(PngException.Reason.MISSING_PALETTE, "Indexed color image without a palette");
		}

		final long expected = scanlineLength(width, colorType) * height;
		final PngByteArrayOutputStream inflated;
		try {
			inflated = pngCompressionHandler.inflate(imageData, expected);
		} catch (IOException e) {
			throw new PngException(PngException.Reason.DECOMPRESSION_ERROR, "Couldn't inflate image data: " + e.getMessage(), e);
		}

		if (inflated.len() < expected) {
			throw new PngException(PngException.Reason.DECOMPRESSION_ERROR,
					String.format("Expected %d bytes of scanlines but image data holds %d", expected, inflated.len()));
		}

		final byte[] data = inflated.get();
		final byte[] rgba = new byte[PngPixelBuffer.byteCount(width, height)];
		int in = 0;
		int out = 0;

		for (int y = 0; y < height; y++) {
			in++; // filter type byte; only unfiltered rows are supported

			for (int x = 0; x < width; x++) {
				switch (colorType) {
					case GREYSCALE: {
						final byte grey = data[in++];
						rgba[out] = grey;
						rgba[out + 1] = grey;
						rgba[out + 2] = grey;
						rgba[out + 3] = (byte) PngPixel.OPAQUE;
						break;
					}

					case TRUECOLOR: {
						System.arraycopy(data, in, rgba, out, 3);
						rgba[out + 3] = (byte) PngPixel.OPAQUE;
						in += 3;
						break;
					}

					case INDEXED_COLOR: {
						palette.copyTo(data[in++] & 0xff, rgba, out);
						break;
					}

					case GREYSCALE_ALPHA: {
						final byte grey = data[in++];
						rgba[out] = grey;
						rgba[out + 1] = grey;
						rgba[out + 2] = grey;
						rgba[out + 3] = data[in++];
						break;
					}

					case TRUECOLOR_ALPHA: {
						System.arraycopy(data, in, rgba, out, 4);
						in += 4;
						break;
					}

					default:
						throw PngException.unsupportedColorType(colorType.getCode());
				}
				out += 4;
			}
		}

		return PngPixelBuffer.wrap(width, height, rgba);
	}
}
