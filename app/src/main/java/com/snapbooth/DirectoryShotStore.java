package com.snapbooth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Writes each session's frames as JPEG files into its own timestamped directory under a root.
 */
public class DirectoryShotStore implements ShotStore
{
	private static final Logger logger = LoggerFactory.getLogger(DirectoryShotStore.class);

	private static final DateTimeFormatter SESSION_DIR_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss-SSS");
	static final float SHOT_QUALITY = 0.95f;
	static final float BURST_QUALITY = 0.8f;

	private final Path root;
	private volatile Path sessionDir;

	public DirectoryShotStore(Path root)
	{
		this.root = root;
	}

	/**
	 * Creates a fresh directory for the next session. Must be called before its first shot.
	 */
	public Path beginSession() throws IOException
	{
		Path dir = root.resolve("session-" + LocalDateTime.now().format(SESSION_DIR_FORMAT));
		Files.createDirectories(dir);
		sessionDir = dir;
		logger.info("Storing session frames in {}", dir);
		return dir;
	}

	public Path sessionDir()
	{
		return sessionDir;
	}

	@Override
	public Path saveShot(BufferedImage image, int index) throws IOException
	{
		return writeJpeg(image, String.format("shot_%03d.jpg", index + 1), SHOT_QUALITY);
	}

	@Override
	public Path saveBurstFrame(BufferedImage image, int index) throws IOException
	{
		return writeJpeg(image, String.format("burst_%03d.jpg", index + 1), BURST_QUALITY);
	}

	private Path writeJpeg(BufferedImage image, String fileName, float quality) throws IOException
	{
		Path dir = sessionDir;
		if (dir == null)
		{
			throw new IllegalStateException("beginSession() has not been called");
		}
		return writeJpeg(image, dir.resolve(fileName), quality);
	}

	/**
	 * Writes {@code image} as a JPEG, dropping any alpha channel.
	 */
	static Path writeJpeg(BufferedImage image, Path target, float quality) throws IOException
	{
		BufferedImage rgb = toRgb(image);
		ImageWriter writer = ImageIO.getImageWritersByFormatName("jpeg").next();
		try (AtomicOutput out = AtomicOutput.begin(target))
		{
			try (ImageOutputStream ios = ImageIO.createImageOutputStream(out.tempPath().toFile()))
			{
				writer.setOutput(ios);
				ImageWriteParam param = writer.getDefaultWriteParam();
				param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
				param.setCompressionQuality(quality);
				writer.write(null, new IIOImage(rgb, null, null), param);
			}
			return out.commit();
		}
		finally
		{
			writer.dispose();
		}
	}

	private static BufferedImage toRgb(BufferedImage image)
	{
		if (image.getType() == BufferedImage.TYPE_INT_RGB || image.getType() == BufferedImage.TYPE_3BYTE_BGR)
		{
			return image;
		}
		BufferedImage rgb = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
		Graphics2D g = rgb.createGraphics();
		try
		{
			g.drawImage(image, 0, 0, Color.WHITE, null);
		}
		finally
		{
			g.dispose();
		}
		return rgb;
	}
}
