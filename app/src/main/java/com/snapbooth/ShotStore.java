package com.snapbooth;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Persists captured frames and reports where they went. Locations are opaque to the session.
 */
public interface ShotStore
{
	Path saveShot(BufferedImage image, int index) throws IOException;

	Path saveBurstFrame(BufferedImage image, int index) throws IOException;
}
