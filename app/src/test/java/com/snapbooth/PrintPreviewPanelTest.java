package com.snapbooth;

import org.junit.jupiter.api.Test;

import java.awt.Rectangle;

import static org.junit.jupiter.api.Assertions.*;

class PrintPreviewPanelTest
{
	@Test
	void portraitPrintIsCenteredInLandscapeArea()
	{
		Rectangle sheet = PrintPreviewPanel.fitRect(1200, 1800, new Rectangle(24, 24, 800, 600));

		assertEquals(new Rectangle(224, 24, 400, 600), sheet);
	}

	@Test
	void landscapePrintFillsWidth()
	{
		Rectangle sheet = PrintPreviewPanel.fitRect(1800, 1200, new Rectangle(0, 0, 300, 600));

		assertEquals(300, sheet.width);
		assertEquals(200, sheet.height);
		assertEquals(0, sheet.x);
		assertEquals(200, sheet.y);
	}

	@Test
	void aspectRatioIsKept()
	{
		Rectangle sheet = PrintPreviewPanel.fitRect(1200, 1800, new Rectangle(0, 0, 777, 555));

		assertEquals(1200.0 / 1800.0, (double) sheet.width / sheet.height, 0.01);
		assertTrue(sheet.width <= 777);
		assertTrue(sheet.height <= 555);
	}

	@Test
	void collapsedPanelHasNoSheet()
	{
		assertTrue(PrintPreviewPanel.fitRect(1200, 1800, new Rectangle(24, 24, -48, 10)).isEmpty());
		assertTrue(PrintPreviewPanel.fitRect(1200, 1800, new Rectangle(24, 24, 0, 0)).isEmpty());
	}

}
