package com.snapbooth;

/**
 * Raised when configuration names a layout that has no slot table. Never recovered by
 * substituting another layout.
 */
public class UnknownLayoutKindException extends IllegalArgumentException
{
	private final String layoutName;

	public UnknownLayoutKindException(String layoutName)
	{
		super("Unknown layout kind: '" + layoutName + "'");
		this.layoutName = layoutName;
	}

	public String layoutName()
	{
		return layoutName;
	}
}
