package com.snapbooth;

import java.awt.Toolkit;

/**
 * Audible cues during a countdown. Best effort: the session ignores any failure.
 */
public interface CuePlayer
{
	void tick();

	CuePlayer SILENT = () -> {};

	/** System beep through AWT; throws {@code HeadlessException} on headless hosts. */
	static CuePlayer systemBeep()
	{
		return () -> Toolkit.getDefaultToolkit().beep();
	}
}
