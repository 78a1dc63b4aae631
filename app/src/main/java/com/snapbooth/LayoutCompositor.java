package com.snapbooth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.AlphaComposite;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.Rectangle;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Draws an ordered photo list and an optional frame overlay onto the print canvas.
 */
public class LayoutCompositor
{
	private static final Logger logger = LoggerFactory.getLogger(LayoutCompositor.class);

	private final Color background;
	private final boolean mirrorPhotos;

	public LayoutCompositor()
	{
		this(Color.WHITE, true);
	}

	public LayoutCompositor(Color background, boolean mirrorPhotos)
	{
		this.background = background;
		this.mirrorPhotos = mirrorPhotos;
	}

	/**
	 * Composites photos into the slots of {@code kind}. Photo {@code i} goes into slot {@code i};
	 * slots without a photo keep the background color and surplus photos are ignored.
	 *
	 * @param frameOverlay drawn last over the whole canvas, may be {@code null}
	 */
	public BufferedImage compose(List<BufferedImage> photos, LayoutKind kind, BufferedImage frameOverlay)
	{
		List<SlotDefinition> slots = SlotGeometry.slotsFor(kind);
		BufferedImage canvas = new BufferedImage(
				SlotGeometry.CANVAS_WIDTH, SlotGeometry.CANVAS_HEIGHT, BufferedImage.TYPE_INT_RGB);
		Graphics2D g2d = canvas.createGraphics();
		try
		{
			applyHints(g2d);
			g2d.setColor(background);
			g2d.fillRect(0, 0, canvas.getWidth(), canvas.getHeight());

			int count = Math.min(photos.size(), slots.size());
			for (int i = 0; i < count; i++)
			{
				drawIntoPlacements(g2d, photos.get(i), kind, i);
			}

			if (frameOverlay != null)
			{
				drawOverlay(g2d, frameOverlay);
			}
		}
		finally
		{
			g2d.dispose();
		}
		return canvas;
	}

	/**
	 * Same as {@link #compose(List, LayoutKind, BufferedImage)} but decodes each photo only
	 * while it is being drawn, so a single source raster is resident at a time.
	 */
	public BufferedImage compose(List<Path> photoPaths, LayoutKind kind, Path frameOverlay) throws IOException
	{
		List<SlotDefinition> slots = SlotGeometry.slotsFor(kind);
		BufferedImage canvas = new BufferedImage(
				SlotGeometry.CANVAS_WIDTH, SlotGeometry.CANVAS_HEIGHT, BufferedImage.TYPE_INT_RGB);
		Graphics2D g2d = canvas.createGraphics();
		try
		{
			applyHints(g2d);
			g2d.setColor(background);
			g2d.fillRect(0, 0, canvas.getWidth(), canvas.getHeight());

			int count = Math.min(photoPaths.size(), slots.size());
			for (int i = 0; i < count; i++)
			{
				BufferedImage photo = read(photoPaths.get(i));
				drawIntoPlacements(g2d, photo, kind, i);
			}

			if (frameOverlay != null)
			{
				drawOverlay(g2d, read(frameOverlay));
			}
		}
		finally
		{
			g2d.dispose();
		}
		logger.debug("Composed {} photo(s) into {} layout", Math.min(photoPaths.size(), slots.size()), kind);
		return canvas;
	}

	private void drawIntoPlacements(Graphics2D g2d, BufferedImage photo, LayoutKind kind, int slotIndex)
	{
		for (SlotDefinition placement : SlotGeometry.placementsFor(kind, slotIndex))
		{
			drawFillCrop(g2d, photo, placement);
		}
	}

	private void drawFillCrop(Graphics2D g2d, BufferedImage photo, SlotDefinition slot)
	{
		Rectangle crop = cropRegion(photo.getWidth(), photo.getHeight(), slot.width(), slot.height());
		int sx1 = crop.x;
		int sx2 = crop.x + crop.width;
		if (mirrorPhotos)
		{
			int t = sx1;
			sx1 = sx2;
			sx2 = t;
		}
		g2d.drawImage(photo,
				slot.x(), slot.y(), slot.x() + slot.width(), slot.y() + slot.height(),
				sx1, crop.y, sx2, crop.y + crop.height,
				null);
	}

	private static void drawOverlay(Graphics2D g2d, BufferedImage overlay)
	{
		g2d.setComposite(AlphaComposite.SrcOver);
		g2d.drawImage(overlay, 0, 0, SlotGeometry.CANVAS_WIDTH, SlotGeometry.CANVAS_HEIGHT, null);
	}

	/**
	 * Largest centered source region with the slot's aspect ratio. Scaling that region to the
	 * slot fills it completely; the excess on one axis is cropped away.
	 */
	static Rectangle cropRegion(int srcW, int srcH, int slotW, int slotH)
	{
		// Compare srcW/srcH against slotW/slotH without floating point
		long lhs = (long) srcW * slotH;
		long rhs = (long) srcH * slotW;
		if (lhs > rhs)
		{
			int cropW = (int) Math.max(1, Math.round((double) srcH * slotW / slotH));
			return new Rectangle((srcW - cropW) / 2, 0, cropW, srcH);
		}
		if (lhs < rhs)
		{
			int cropH = (int) Math.max(1, Math.round((double) srcW * slotH / slotW));
			return new Rectangle(0, (srcH - cropH) / 2, srcW, cropH);
		}
		return new Rectangle(0, 0, srcW, srcH);
	}

	private static void applyHints(Graphics2D g2d)
	{
		g2d.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
		g2d.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
		g2d.setRenderingHint(RenderingHints.KEY_ALPHA_INTERPOLATION, RenderingHints.VALUE_ALPHA_INTERPOLATION_QUALITY);
	}

	private static BufferedImage read(Path path) throws IOException
	{
		BufferedImage image = ImageIO.read(path.toFile());
		if (image == null)
		{
			throw new FrameDecodeException(path, "ImageIO returned null");
		}
		return image;
	}

	/** Photo paths in slot order for a layout, dropping any beyond its capacity. */
	public static List<Path> selectForLayout(List<Path> photoPaths, LayoutKind kind)
	{
		int capacity = SlotGeometry.photoCapacity(kind);
		return new ArrayList<>(photoPaths.subList(0, Math.min(capacity, photoPaths.size())));
	}

	/**
	 * Photo paths for a layout in the order the guest picked them. {@code picks} are indices into
	 * {@code photoPaths}; slot {@code i} receives {@code photoPaths.get(picks.get(i))}.
	 *
	 * @throws IllegalArgumentException if a pick is out of range or repeated, or there are more
	 *                                  picks than the layout has slots
	 */
	public static List<Path> selectForLayout(List<Path> photoPaths, LayoutKind kind, List<Integer> picks)
	{
		int capacity = SlotGeometry.photoCapacity(kind);
		if (picks.size() > capacity)
		{
			throw new IllegalArgumentException(picks.size() + " photos picked but " + kind + " holds " + capacity);
		}
		Set<Integer> seen = new HashSet<>();
		List<Path> selected = new ArrayList<>(picks.size());
		for (Integer pick : picks)
		{
			if (pick == null || pick < 0 || pick >= photoPaths.size())
			{
				throw new IllegalArgumentException("Pick " + pick + " is outside 0.." + (photoPaths.size() - 1));
			}
			if (!seen.add(pick))
			{
				throw new IllegalArgumentException("Photo " + pick + " picked twice");
			}
			selected.add(photoPaths.get(pick));
		}
		return selected;
	}
}
