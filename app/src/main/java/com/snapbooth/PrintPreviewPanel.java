package com.snapbooth;

import javax.swing.JPanel;
import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics;
import java.awt.Graphics2D;
import java.awt.Rectangle;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;

/**
 * Shows the finished print as a sheet of paper with a drop shadow. The print is downscaled
 * once per panel size, not on every repaint.
 */
class PrintPreviewPanel extends JPanel
{
	static final int MARGIN = 24;
	static final int SHADOW_OFFSET = 6;

	private static final Color SHADOW = new Color(0, 0, 0, 90);
	private static final Color PAPER_EDGE = new Color(220, 220, 220);

	private BufferedImage print;
	private BufferedImage scaled;
	private String message = "";

	void showPrint(BufferedImage image)
	{
		this.print = image;
		this.scaled = null;
		repaint();
	}

	/** Clears the print and shows {@code text} instead. */
	void showMessage(String text)
	{
		this.print = null;
		this.scaled = null;
		this.message = text;
		repaint();
	}

	@Override
	protected void paintComponent(Graphics g)
	{
		super.paintComponent(g);
		Graphics2D g2 = (Graphics2D) g;
		g2.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);

		Rectangle area = new Rectangle(MARGIN, MARGIN, getWidth() - 2 * MARGIN, getHeight() - 2 * MARGIN);
		if (print == null)
		{
			paintMessage(g2, area);
			return;
		}

		Rectangle sheet = fitRect(print.getWidth(), print.getHeight(), area);
		if (sheet.isEmpty()) return;

		if (scaled == null || scaled.getWidth() != sheet.width || scaled.getHeight() != sheet.height)
		{
			scaled = scaleTo(print, sheet.width, sheet.height);
		}

		g2.setColor(SHADOW);
		g2.fillRect(sheet.x + SHADOW_OFFSET, sheet.y + SHADOW_OFFSET, sheet.width, sheet.height);
		g2.drawImage(scaled, sheet.x, sheet.y, null);
		g2.setColor(PAPER_EDGE);
		g2.drawRect(sheet.x, sheet.y, sheet.width - 1, sheet.height - 1);
	}

	private void paintMessage(Graphics2D g2, Rectangle area)
	{
		if (message.isEmpty()) return;
		g2.setFont(getFont().deriveFont(Font.ITALIC, 18f));
		g2.setColor(Color.GRAY);
		FontMetrics fm = g2.getFontMetrics();
		int x = area.x + (area.width - fm.stringWidth(message)) / 2;
		int y = area.y + (area.height - fm.getHeight()) / 2 + fm.getAscent();
		g2.drawString(message, x, y);
	}

	/**
	 * Largest rectangle with the image's aspect ratio that fits {@code area}, centered in it.
	 * Empty when the area has no room.
	 */
	static Rectangle fitRect(int imageWidth, int imageHeight, Rectangle area)
	{
		if (area.width <= 0 || area.height <= 0 || imageWidth <= 0 || imageHeight <= 0)
		{
			return new Rectangle(area.x, area.y, 0, 0);
		}
		double scale = Math.min((double) area.width / imageWidth, (double) area.height / imageHeight);
		int w = Math.max(1, (int) (imageWidth * scale));
		int h = Math.max(1, (int) (imageHeight * scale));
		return new Rectangle(area.x + (area.width - w) / 2, area.y + (area.height - h) / 2, w, h);
	}

	private static BufferedImage scaleTo(BufferedImage source, int width, int height)
	{
		BufferedImage result = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
		Graphics2D g = result.createGraphics();
		try
		{
			g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
			g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
			g.drawImage(source, 0, 0, width, height, null);
		}
		finally
		{
			g.dispose();
		}
		return result;
	}
}
