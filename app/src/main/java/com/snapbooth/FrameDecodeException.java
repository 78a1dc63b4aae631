package com.snapbooth;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A single image could not be decoded. Encoders skip the frame; the compositor propagates.
 */
public class FrameDecodeException extends IOException
{
	private final Path path;

	public FrameDecodeException(Path path, String reason)
	{
		super("Failed to decode " + path + ": " + reason);
		this.path = path;
	}

	public FrameDecodeException(Path path, String reason, Throwable cause)
	{
		super("Failed to decode " + path + ": " + reason, cause);
		this.path = path;
	}

	public Path path()
	{
		return path;
	}
}
