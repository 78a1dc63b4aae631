package com.snapbooth;

import java.util.ArrayList;
import java.util.List;

/**
 * Fixed slot tables for every {@link LayoutKind}. All layouts share a 1200x1800 canvas
 * (4x6 inch at 300 dpi).
 */
public final class SlotGeometry
{
	public static final int CANVAS_WIDTH = 1200;
	public static final int CANVAS_HEIGHT = 1800;

	/** Horizontal distance between a STRIP slot and its duplicate in the right-hand column. */
	public static final int STRIP_DUPLICATE_OFFSET = 600;

	private static final List<SlotDefinition> GRID_SLOTS = List.of(
			new SlotDefinition(0, 60, 350, 520, 390),
			new SlotDefinition(1, 620, 350, 520, 390),
			new SlotDefinition(2, 60, 780, 520, 390),
			new SlotDefinition(3, 620, 780, 520, 390),
			new SlotDefinition(4, 60, 1210, 520, 390),
			new SlotDefinition(5, 620, 1210, 520, 390)
	);

	private static final List<SlotDefinition> STRIP_SLOTS = List.of(
			new SlotDefinition(0, 50, 300, 500, 375),
			new SlotDefinition(1, 50, 705, 500, 375),
			new SlotDefinition(2, 50, 1110, 500, 375)
	);

	private SlotGeometry()
	{
	}

	/**
	 * Logical slots for a layout, in photo order. For STRIP these are the left-hand column
	 * only; see {@link #placementsFor(LayoutKind, int)} for the duplicated positions.
	 */
	public static List<SlotDefinition> slotsFor(LayoutKind kind)
	{
		if (kind == null)
		{
			throw new UnknownLayoutKindException("null");
		}
		return switch (kind)
		{
			case GRID -> GRID_SLOTS;
			case STRIP -> STRIP_SLOTS;
		};
	}

	public static List<SlotDefinition> slotsFor(String layoutName)
	{
		return slotsFor(LayoutKind.parse(layoutName));
	}

	/**
	 * Every rectangle a given logical slot is drawn into: one for GRID, two for STRIP.
	 */
	public static List<SlotDefinition> placementsFor(LayoutKind kind, int slotIndex)
	{
		SlotDefinition slot = slotsFor(kind).get(slotIndex);
		if (kind == LayoutKind.STRIP)
		{
			return List.of(slot, slot.translate(STRIP_DUPLICATE_OFFSET, 0));
		}
		return List.of(slot);
	}

	/** Number of distinct photos needed to fill the layout. */
	public static int photoCapacity(LayoutKind kind)
	{
		return slotsFor(kind).size();
	}

	static List<SlotDefinition> allPlacements(LayoutKind kind)
	{
		List<SlotDefinition> result = new ArrayList<>();
		for (int i = 0; i < slotsFor(kind).size(); i++)
		{
			result.addAll(placementsFor(kind, i));
		}
		return result;
	}
}
