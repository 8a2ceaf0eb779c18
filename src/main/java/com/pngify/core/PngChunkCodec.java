package com.pngify.core;

import com.pngify.core.processing.PngByteArrayOutputStream;

import java.io.ByteArrayInputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;

/**
 * Reads and writes single chunks: a big-endian length, the type, the data and
 * a big-endian CRC-32 of type and data.
 */
public class PngChunkCodec {

	/** Largest length the png length field may carry */
	public static final int MAX_CHUNK_LENGTH = Integer.MAX_VALUE;

	private static final int READ_BLOCK_SIZE = 8192;

	private final Logger log;

	private boolean verifyCrc = true;
	public boolean isVerifyCrc() { return this.verifyCrc; }
	public void setVerifyCrc(boolean verifyCrc) { this.verifyCrc = verifyCrc; }

	private int maxChunkLength = MAX_CHUNK_LENGTH;
	public int getMaxChunkLength() { return this.maxChunkLength; }
	public void setMaxChunkLength(int maxChunkLength) {
		if (maxChunkLength < 0) {
			throw new IllegalArgumentException("Max chunk length can't be negative: " + maxChunkLength);
		}
		this.maxChunkLength = maxChunkLength;
	}

	/** */
	public PngChunkCodec() {
		this(new Logger(Logger.NONE));
	}

	/** */
	public PngChunkCodec(Logger log) {
		this.log = log;
	}

	/**
	 * Serialize one chunk: length, type, data, crc.
	 */
	public byte[] encode(byte[] type, byte[] data) {
		final PngChunk chunk = new PngChunk(type, data);

		final PngByteArrayOutputStream bytes = new PngByteArrayOutputStream(chunk.getLength() + 12);
		try (DataOutputStream out = new DataOutputStream(bytes)) {
			write(out, chunk);
		} catch (IOException e) {
			throw new PngException(PngException.Reason.IO_ERROR, "Couldn't encode chunk " + chunk.getTypeString(), e);
		}
		return bytes.toByteArray();
	}

	/** */
	public void write(DataOutputStream out, PngChunk chunk) throws IOException {
		checkLength(chunk.getLength());
		log.debug("write: %s", chunk);

		out.writeInt(chunk.getLength());
		out.write(chunk.getType());
		out.write(chunk.data());
		out.writeInt((int) chunk.getCRC());
	}

	/**
	 * Parse one chunk from the start of the given bytes.
	 */
	public PngChunk decode(byte[] bytes) {
		try {
			return read(new DataInputStream(new ByteArrayInputStream(bytes)));
		} catch (IOException e) {
			throw new PngException(PngException.Reason.IO_ERROR, "Couldn't decode chunk", e);
		}
	}

	/**
	 * Read the next chunk from the stream, checking its crc unless that has been switched off.
	 */
	public PngChunk read(DataInputStream ins) throws IOException {
		try {
			final long length = ins.readInt() & 0xffffffffL;
			checkLength(length);

			final byte[] type = new byte[PngChunk.TYPE_LENGTH];
			ins.readFully(type);
			final byte[] data = readData(ins, (int) length);
			final long crc = ins.readInt() & 0xffffffffL;

			final PngChunk chunk = new PngChunk(type, data);
			log.debug("read: %s", chunk);

			if (!chunk.verifyCRC(crc)) {
				if (this.verifyCrc) {
					throw new PngException(PngException.Reason.CHECKSUM_MISMATCH, String.format(
							"Corrupted %s chunk: crc is %08x but trailer says %08x", chunk.getTypeString(), chunk.getCRC(), crc));
				}
				log.debug("Ignoring crc mismatch in %s chunk", chunk.getTypeString());
			}
			return chunk;
		} catch (EOFException e) {
			throw new PngException(PngException.Reason.TRUNCATED_STREAM, "Stream ended in the middle of a chunk", e);
		}
	}

	/* reads in blocks so a bogus length on a short stream doesn't allocate it all up front */
	private byte[] readData(DataInputStream ins, int length) throws IOException {
		if (length <= READ_BLOCK_SIZE) {
			final byte[] data = new byte[length];
			ins.readFully(data);
			return data;
		}

		final PngByteArrayOutputStream data = new PngByteArrayOutputStream(READ_BLOCK_SIZE);
		final byte[] block = new byte[READ_BLOCK_SIZE];
		int remaining = length;
		while (remaining > 0) {
			final int size = Math.min(remaining, block.length);
			ins.readFully(block, 0, size);
			data.write(block, 0, size);
			remaining -= size;
		}
		return data.toByteArray();
	}

	/* */
	private void checkLength(long length) {
		if (length > this.maxChunkLength) {
			throw new PngException(PngException.Reason.CHUNK_TOO_LARGE,
					String.format("Chunk length %d exceeds the maximum of %d", length, this.maxChunkLength));
		}
	}
}
