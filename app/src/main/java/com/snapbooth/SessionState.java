package com.snapbooth;

public enum SessionState
{
	IDLE,
	COUNTDOWN,
	CAPTURING,
	/** Shutter failed transiently; waiting out the backoff before the single retry. */
	RETRY_OR_ABORT,
	/** AUTO: inter-shot delay. */
	POST_SHOT_PAUSE,
	/** MANUAL: between shots, waiting for the next trigger. */
	WAITING_FOR_TRIGGER,
	/** AUTO: boomerang burst after the last still. */
	BURST,
	COMPLETE;

	boolean acceptsNewSession()
	{
		return this == IDLE || this == COMPLETE;
	}
}
