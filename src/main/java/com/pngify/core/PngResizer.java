package com.pngify.core;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Nearest-neighbor resizing of decoded images. Each target pixel copies exactly
 * one source pixel; there is no blending.
 */
public class PngResizer {

	private final Logger log;
	private final PngReader reader;
	private final PngWriter writer;

	private boolean concurrent = false;
	public boolean isConcurrent() { return this.concurrent; }
	/**
	 * Whether to compute rows on a thread pool. Should be left off in
	 * environments that don't allow thread creation.
	 */
	public void setConcurrent(boolean concurrent) { this.concurrent = concurrent; }

	public PngResizer() {
		this(Logger.NONE);
	}

	public PngResizer(String logLevel) {
		this(new PngReader(logLevel), new PngWriter(logLevel));
	}

	/** */
	public PngResizer(PngReader reader, PngWriter writer) {
		this.log = reader.getLog();
		this.reader = reader;
		this.writer = writer;
	}

	/**
	 * Map target pixel (j, i) to source pixel (j * oldWidth / newWidth, i * oldHeight / newHeight), rounding down.
	 */
	public PngPixelBuffer resize(PngPixelBuffer source, int newWidth, int newHeight) {
		if (newWidth <= 0 || newHeight <= 0) {
			throw new PngException(PngException.Reason.INVALID_TARGET_DIMENSIONS,
					String.format("Target dimensions must be positive: %dx%d", newWidth, newHeight));
		}

		final byte[] target = new byte[PngPixelBuffer.byteCount(newWidth, newHeight)];
		if (concurrent && newHeight > 1) {
			resizeConcurrently(source, target, newWidth, newHeight);
		} else {
			resizeRows(source, target, newWidth, newHeight, 0, newHeight);
		}
		log.debug("Resized %dx%d -> %dx%d", source.getWidth(), source.getHeight(), newWidth, newHeight);

		return PngPixelBuffer.wrap(newWidth, newHeight, target);
	}

	/**
	 * Resize a png file and write the result next to it as {@code <stem>_<width>x<height>.png}.
	 *
	 * @return the written file
	 */
	public File resize(String fileName, int newWidth, int newHeight) throws IOException {
		final File source = new File(fileName);
		return resize(source, source.getAbsoluteFile().getParentFile(), newWidth, newHeight);
	}

	/**
	 * Resize a png file, writing {@code <stem>_<width>x<height>.png} into the given directory.
	 */
	public File resize(File source, File toDir, int newWidth, int newHeight) throws IOException {
		final PngDecodedImage image = reader.read(source);
		final PngPixelBuffer resized = resize(image.getPixels(), newWidth, newHeight);

		final File out = new File(toDir, resizedFileName(source.getName(), newWidth, newHeight));
		writer.export(resized, out.getPath());
		log.info("%dx%d -> %dx%d - %s", image.getWidth(), image.getHeight(), newWidth, newHeight, out.getPath());

		return out;
	}

	/**
	 * The file name a resized copy gets: the extension is dropped and the new dimensions appended.
	 */
	public static String resizedFileName(String fileName, int newWidth, int newHeight) {
		final int dot = fileName.lastIndexOf('.');
		final String stem = (dot > 0) ? fileName.substring(0, dot) : fileName;
		return String.format("%s_%dx%d.png", stem, newWidth, newHeight);
	}

	/* rows [fromRow, toRow) of the target; no row depends on another */
	private static void resizeRows(PngPixelBuffer source, byte[] target, int newWidth, int newHeight, int fromRow, int toRow) {
		final byte[] rgba = source.rgba();
		final long oldWidth = source.getWidth();
		final long oldHeight = source.getHeight();

		for (int i = fromRow; i < toRow; i++) {
			final int sy = (int) (i * oldHeight / newHeight);
			final int targetRow = i * newWidth * 4;
			final int sourceRow = sy * source.getWidth() * 4;
			for (int j = 0; j < newWidth; j++) {
				final int sx = (int) (j * oldWidth / newWidth);
				System.arraycopy(rgba, sourceRow + sx * 4, target, targetRow + j * 4, 4);
			}
		}
	}

	/*
	 * Split the target rows into one band per processor and fill them in parallel.
	 */
	private void resizeConcurrently(final PngPixelBuffer source, final byte[] target, final int newWidth, final int newHeight) {
		final int threads = Math.min(Runtime.getRuntime().availableProcessors(), newHeight);
		final int band = (newHeight + threads - 1) / threads;

		final List<Callable<Object>> tasks = new ArrayList<>();
		for (int from = 0; from < newHeight; from += band) {
			final int fromRow = from;
			final int toRow = Math.min(from + band, newHeight);
			tasks.add(Executors.callable(new Runnable() {
				@Override
				public void run() {
					resizeRows(source, target, newWidth, newHeight, fromRow, toRow);
				}
			}));
		}

		final ExecutorService resizeThreadPool = Executors.newFixedThreadPool(tasks.size());
		try {
			for (Future<Object> result : resizeThreadPool.invokeAll(tasks)) {
				result.get();
			}
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new PngException(PngException.Reason.INTERRUPTED, "Interrupted while resizing", e);
		} catch (ExecutionException e) {
			if (e.getCause() instanceof RuntimeException) {
				throw (RuntimeException) e.getCause();
			}
			throw new IllegalStateException("Resize failed", e.getCause());
		} finally {
			resizeThreadPool.shutdown();
		}
	}
}
