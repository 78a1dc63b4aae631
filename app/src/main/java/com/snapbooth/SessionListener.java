package com.snapbooth;

/**
 * Session events. Called on the session worker thread; UI implementations must hand off to
 * their own thread.
 */
public interface SessionListener
{
	default void onStateChanged(SessionState state)
	{
	}

	default void onStatus(String status)
	{
	}

	default void onCountdownTick(int secondsRemaining)
	{
	}

	default void onShotCaptured(RawShot shot, int targetShotCount)
	{
	}

	default void onBurstFrameCaptured(RawShot frame, int burstFrameCount)
	{
	}

	/** Delivered exactly once per completed session. Never called for cancelled sessions. */
	default void onComplete(SessionResult result)
	{
	}

	default void onAborted(SessionAbortedException error)
	{
	}

	SessionListener NONE = new SessionListener()
	{
	};
}
