package com.pngify.core;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 *
 */
class PngPixelBufferTest {

	@Test
	void pixelCountMustMatchDimensions() {
		PngException e = assertThrows(PngException.class,
				() -> PngPixelBuffer.of(2, 2, Arrays.asList(new PngPixel(1, 2, 3))));
		assertEquals(PngException.Reason.INVALID_PIXEL_BUFFER_LENGTH, e.getReason());

		e = assertThrows(PngException.class, () -> PngPixelBuffer.copyOf(2, 1, new byte[7]));
		assertEquals(PngException.Reason.INVALID_PIXEL_BUFFER_LENGTH, e.getReason());

		e = assertThrows(PngException.class, () -> PngPixelBuffer.of(2, 1, null));
		assertEquals(PngException.Reason.INVALID_PIXEL_BUFFER_LENGTH, e.getReason());
	}

	@Test
	void dimensionsMustBePositive() {
		final PngException e = assertThrows(PngException.class, () -> PngPixelBuffer.copyOf(0, 0, new byte[0]));
		assertEquals(PngException.Reason.INVALID_DIMENSIONS, e.getReason());
	}

	@Test
	void copiesInputAndOutput() {
		final byte[] rgba = PngTestImages.bytes(1, 2, 3, 4);
		final PngPixelBuffer buffer = PngPixelBuffer.copyOf(1, 1, rgba);

		rgba[0] = 100;
		buffer.toRgbaBytes()[1] = 100;
		assertEquals(new PngPixel(1, 2, 3, 4), buffer.getPixel(0, 0));
	}

	@Test
	void rowMajorAccess() {
		final PngPixelBuffer buffer = PngPixelBuffer.copyOf(2, 2, PngTestImages.bytes(
				0, 0, 0, 0, 1, 1, 1, 1,
				2, 2, 2, 2, 3, 3, 3, 3));

		assertEquals(4, buffer.size());
		assertEquals(PngPixel.grey(1, 1), buffer.getPixel(1, 0));
		assertEquals(PngPixel.grey(2, 2), buffer.getPixel(0, 1));
		assertThrows(IndexOutOfBoundsException.class, () -> buffer.getPixel(2, 0));
		assertThrows(UnsupportedOperationException.class, () -> buffer.getPixels().clear());
	}
}
