package com.pngify.core;

import com.pngify.core.processing.PngByteArrayOutputStream;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A png stream as it goes on the wire: the signature followed by chunks, the last being IEND.
 */
public class PngImage {

	public static final long SIGNATURE = 0x89504e470d0a1a0aL;

	private final Logger log;
	private final PngChunkCodec chunkCodec;

	private final List<PngChunk> chunks = new ArrayList<>();
	public List<PngChunk> getChunks() { return Collections.unmodifiableList(this.chunks); }

	/** */
	public PngImage(Logger log, PngChunkCodec chunkCodec) {
		this.log = log;
		this.chunkCodec = chunkCodec;
	}

	/** */
	public void addChunk(PngChunk chunk) {
		if (isTerminated()) {
			throw new PngException(PngException.Reason.INVALID_CHUNK,
					"Can't add " + chunk.getTypeString() + " after " + PngChunk.IMAGE_TRAILER);
		}
		this.chunks.add(chunk);
	}

	/** */
	public boolean isTerminated() {
		return !this.chunks.isEmpty() && this.chunks.get(this.chunks.size() - 1).isType(PngChunk.IMAGE_TRAILER);
	}

	/** */
	public void writeDataOutputStream(OutputStream output) throws IOException {
		if (!isTerminated()) {
			throw new PngException(PngException.Reason.INVALID_CHUNK, "Image has no " + PngChunk.IMAGE_TRAILER + " chunk");
		}

		final DataOutputStream outs = new DataOutputStream(output);
		outs.writeLong(PngImage.SIGNATURE);
		for (PngChunk chunk : this.chunks) {
			this.chunkCodec.write(outs, chunk);
		}
		outs.flush();
	}

	/** The whole stream, signature included */
	public byte[] toByteArray() {
		final PngByteArrayOutputStream bytes = new PngByteArrayOutputStream();
		try {
			writeDataOutputStream(bytes);
		} catch (IOException e) {
			throw new PngException(PngException.Reason.IO_ERROR, "Couldn't serialize image", e);
		}
		return bytes.toByteArray();
	}

	/**
	 * Write the stream to the named file. Bytes are assembled in memory first,
	 * so a serialization failure never leaves a partial file behind.
	 */
	public File export(String fileName) throws IOException {
		final byte[] bytes = toByteArray();
		final File out = new File(fileName);
		try (FileOutputStream outs = new FileOutputStream(out)) {
			outs.write(bytes);
		}
		log.debug("Exported %d bytes to %s", bytes.length, out.getPath());

		return out;
	}

	/**
	 * Consume the first 8 bytes of the stream and check they are the png signature.
	 */
	public static void readSignature(DataInputStream ins) throws IOException {
		final long signature;
		try {
			signature = ins.readLong();
		} catch (EOFException e) {
			throw new PngException(PngException.Reason.INVALID_SIGNATURE, "Too short for a png signature", e);
		}
		if (signature != PngImage.SIGNATURE) {
			throw new PngException(PngException.Reason.INVALID_SIGNATURE,
					String.format("Bad png signature: %016x", signature));
		}
	}
}
