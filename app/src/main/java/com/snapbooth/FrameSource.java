package com.snapbooth;

import java.awt.image.BufferedImage;

/**
 * A camera or camera stand-in. Safe to call repeatedly.
 */
public interface FrameSource
{
	/**
	 * @return the current frame, never {@code null}
	 * @throws FrameSourceException if no frame is available; {@link FrameSourceException#isTransient()}
	 *                              tells a busy or reconnecting device apart from a broken one
	 */
	BufferedImage requestFrame() throws FrameSourceException;
}
