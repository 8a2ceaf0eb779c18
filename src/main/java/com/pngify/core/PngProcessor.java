package com.pngify.core;

import com.pngify.core.processing.PngCompressionHandler;
import com.pngify.core.processing.PngZlibCompressionHandler;

/**
 * Base class for png image processing
 */
public abstract class PngProcessor {

	/** Filter type byte for an unfiltered scanline */
	protected static final int FILTER_NONE = 0;

	protected final Logger log;
	protected final PngChunkCodec chunkCodec;
	protected final PngCompressionHandler pngCompressionHandler;

	protected PngProcessor(String logLevel) {
		this.log = new Logger(logLevel);
		this.chunkCodec = new PngChunkCodec(log);
		this.pngCompressionHandler = new PngZlibCompressionHandler(log);
	}

	/** */
	public Logger getLog() {
		return this.log;
	}

	/**
	 * Length in bytes of one raw scanline including its filter byte
	 */
	protected static long scanlineLength(long width, PngColorType colorType) {
		return width * colorType.getBytesPerPixel() + 1;
	}
}
