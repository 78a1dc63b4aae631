package com.snapbooth;

import java.awt.Rectangle;

/**
 * A photo placement region in canvas pixel space.
 */
public record SlotDefinition(int index, int x, int y, int width, int height)
{
	public SlotDefinition
	{
		if (width <= 0 || height <= 0)
		{
			throw new IllegalArgumentException("Slot " + index + " has empty size " + width + "x" + height);
		}
	}

	public SlotDefinition translate(int dx, int dy)
	{
		return new SlotDefinition(index, x + dx, y + dy, width, height);
	}

	public Rectangle bounds()
	{
		return new Rectangle(x, y, width, height);
	}

	boolean overlaps(SlotDefinition other)
	{
		return bounds().intersects(other.bounds());
	}

	boolean fitsWithin(int canvasWidth, int canvasHeight)
	{
		return x >= 0 && y >= 0 && x + width <= canvasWidth && y + height <= canvasHeight;
	}
}
