package com.snapbooth;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Streaming video output. Frames are consumed synchronously; the caller may drop its
 * reference as soon as {@link #writeFrame(BufferedImage)} returns.
 */
public interface VideoSink extends AutoCloseable
{
	void writeFrame(BufferedImage frame) throws IOException;

	/** Flushes and finalizes the container. No frames may be written afterwards. */
	void finish() throws IOException;

	/** Releases resources. After a successful {@link #finish()} this is a no-op; otherwise the output is abandoned. */
	@Override
	void close();

	@FunctionalInterface
	interface Factory
	{
		VideoSink open(Path output, int framesPerSecond) throws IOException;
	}
}
