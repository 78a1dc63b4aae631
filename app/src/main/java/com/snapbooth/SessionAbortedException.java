package com.snapbooth;

/**
 * A session stopped before completion because no frame could be captured. The photos taken so
 * far are discarded; the booth should offer a retake.
 */
public class SessionAbortedException extends Exception
{
	private final int shotIndex;

	public SessionAbortedException(int shotIndex, String message, Throwable cause)
	{
		super(message, cause);
		this.shotIndex = shotIndex;
	}

	/** 0-based index of the shot that could not be captured. */
	public int shotIndex()
	{
		return shotIndex;
	}
}
