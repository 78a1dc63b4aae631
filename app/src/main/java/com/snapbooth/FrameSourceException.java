package com.snapbooth;

public class FrameSourceException extends Exception
{
	private final boolean transientFailure;

	public FrameSourceException(String message, boolean transientFailure)
	{
		super(message);
		this.transientFailure = transientFailure;
	}

	public FrameSourceException(String message, boolean transientFailure, Throwable cause)
	{
		super(message, cause);
		this.transientFailure = transientFailure;
	}

	public static FrameSourceException unavailable(String message)
	{
		return new FrameSourceException(message, true);
	}

	public boolean isTransient()
	{
		return transientFailure;
	}
}
