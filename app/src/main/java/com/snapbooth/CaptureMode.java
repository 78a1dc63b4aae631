package com.snapbooth;

import java.util.Locale;

public enum CaptureMode
{
	/** One start event runs every shot unattended. */
	AUTO,

	/** Each shutter trigger runs exactly one countdown and shot. */
	MANUAL;

	public static CaptureMode parse(String name)
	{
		try
		{
			return valueOf(name.trim().toUpperCase(Locale.ROOT));
		}
		catch (IllegalArgumentException | NullPointerException e)
		{
			throw new IllegalArgumentException("Unknown capture mode: '" + name + "'");
		}
	}
}
