package com.snapbooth;

/**
 * Suspension points of a capture session: countdown ticks, inter-shot delays and retry backoff.
 */
@FunctionalInterface
public interface SessionClock
{
	void sleep(long millis) throws InterruptedException;

	static SessionClock system()
	{
		return Thread::sleep;
	}
}
