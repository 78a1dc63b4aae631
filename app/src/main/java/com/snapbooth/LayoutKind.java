package com.snapbooth;

import java.util.Locale;

/**
 * Print layouts supported by the booth. Each kind maps to exactly one slot table in
 * {@link SlotGeometry}.
 */
public enum LayoutKind
{
	/** 2x3 grid, one distinct photo per slot. */
	GRID,

	/** Two identical 3-photo strips side by side, cut in half after printing. */
	STRIP;

	/**
	 * Parses a configured layout name. Matching ignores case and surrounding whitespace.
	 *
	 * @throws UnknownLayoutKindException if the name is blank or not a known layout
	 */
	public static LayoutKind parse(String name)
	{
		if (name == null || name.isBlank())
		{
			throw new UnknownLayoutKindException(String.valueOf(name));
		}
		String normalized = name.trim().toUpperCase(Locale.ROOT);
		for (LayoutKind kind : values())
		{
			if (kind.name().equals(normalized))
			{
				return kind;
			}
		}
		throw new UnknownLayoutKindException(name);
	}
}
