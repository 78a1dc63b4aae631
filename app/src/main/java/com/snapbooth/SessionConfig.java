package com.snapbooth;

/**
 * Settings for one capture session. Immutable for the lifetime of the session.
 *
 * @param interShotDelaySeconds pause before each shot after the first; AUTO only
 * @param burstFrameCount       boomerang burst frames captured after the last AUTO shot, 0 disables
 * @param burstIntervalMillis   spacing between burst frames
 */
public record SessionConfig(
		int targetShotCount,
		int countdownSeconds,
		CaptureMode mode,
		int interShotDelaySeconds,
		int burstFrameCount,
		long burstIntervalMillis)
{
	public SessionConfig
	{
		if (targetShotCount <= 0)
		{
			throw new IllegalArgumentException("targetShotCount must be positive: " + targetShotCount);
		}
		if (countdownSeconds <= 0)
		{
			throw new IllegalArgumentException("countdownSeconds must be positive: " + countdownSeconds);
		}
		if (mode == null)
		{
			throw new IllegalArgumentException("mode is required");
		}
		if (interShotDelaySeconds < 0)
		{
			throw new IllegalArgumentException("interShotDelaySeconds must not be negative: " + interShotDelaySeconds);
		}
		if (burstFrameCount < 0 || burstIntervalMillis < 0)
		{
			throw new IllegalArgumentException("burst settings must not be negative");
		}
	}

	public SessionConfig(int targetShotCount, int countdownSeconds, CaptureMode mode, int interShotDelaySeconds)
	{
		this(targetShotCount, countdownSeconds, mode, interShotDelaySeconds, 0, 0);
	}

	boolean burstEnabled()
	{
		return mode == CaptureMode.AUTO && burstFrameCount > 0;
	}
}
