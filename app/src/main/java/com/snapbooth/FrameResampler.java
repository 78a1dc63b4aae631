package com.snapbooth;

import org.apache.commons.imaging.Imaging;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import javax.imageio.ImageReadParam;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.awt.Dimension;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Iterator;

/**
 * Decodes an image at reduced resolution and scales it to an exact target width.
 * <p>
 * The source is inspected header-only first, then decoded with ImageIO source subsampling so
 * a print-resolution photo never has to be fully decoded. One raster is alive per call.
 */
public class FrameResampler
{
	private static final Logger logger = LoggerFactory.getLogger(FrameResampler.class);

	@FunctionalInterface
	interface Decoder
	{
		BufferedImage decode(Path path, int subsample) throws IOException;
	}

	@FunctionalInterface
	interface BoundsReader
	{
		Dimension read(Path path) throws IOException;
	}

	private final Decoder decoder;
	private final BoundsReader boundsReader;

	public FrameResampler()
	{
		this(FrameResampler::decodeSubsampled, FrameResampler::readBounds);
	}

	FrameResampler(Decoder decoder, BoundsReader boundsReader)
	{
		this.decoder = decoder;
		this.boundsReader = boundsReader;
	}

	/**
	 * @return an RGB image exactly {@code targetWidth} wide with the source aspect ratio
	 * @throws FrameDecodeException if the file cannot be read, or decoding runs out of memory twice
	 */
	public BufferedImage resample(Path path, int targetWidth) throws FrameDecodeException
	{
		if (targetWidth <= 0)
		{
			throw new IllegalArgumentException("targetWidth must be positive: " + targetWidth);
		}

		Dimension bounds;
		try
		{
			bounds = boundsReader.read(path);
		}
		catch (IOException e)
		{
			throw new FrameDecodeException(path, "cannot read image bounds", e);
		}
		if (bounds == null || bounds.width <= 0 || bounds.height <= 0)
		{
			throw new FrameDecodeException(path, "image has no size");
		}

		int factor = downscaleFactor(bounds.width, targetWidth);
		BufferedImage decoded;
		try
		{
			decoded = decodeOnce(path, factor);
		}
		catch (OutOfMemoryError first)
		{
			logger.warn("Out of memory decoding {} at 1/{}; retrying at 1/{}", path, factor, factor * 2);
			try
			{
				decoded = decodeOnce(path, factor * 2);
			}
			catch (OutOfMemoryError second)
			{
				throw new FrameDecodeException(path, "out of memory at 1/" + (factor * 2) + " resolution", second);
			}
		}

		Dimension target = targetSize(bounds.width, bounds.height, targetWidth);
		BufferedImage scaled = new BufferedImage(target.width, target.height, BufferedImage.TYPE_INT_RGB);
		Graphics2D g = scaled.createGraphics();
		try
		{
			g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
			g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
			g.drawImage(decoded, 0, 0, target.width, target.height, null);
		}
		finally
		{
			g.dispose();
			decoded.flush();
		}
		return scaled;
	}

	private BufferedImage decodeOnce(Path path, int factor) throws FrameDecodeException
	{
		BufferedImage image;
		try
		{
			image = decoder.decode(path, factor);
		}
		catch (FrameDecodeException e)
		{
			throw e;
		}
		catch (IOException e)
		{
			throw new FrameDecodeException(path, e.getMessage(), e);
		}
		if (image == null)
		{
			throw new FrameDecodeException(path, "no image data");
		}
		return image;
	}

	/**
	 * Smallest integer factor that brings {@code width} down to at most {@code targetWidth}.
	 */
	static int downscaleFactor(int width, int targetWidth)
	{
		if (width <= targetWidth) return 1;
		return (width + targetWidth - 1) / targetWidth;
	}

	static Dimension targetSize(int width, int height, int targetWidth)
	{
		int targetHeight = (int) Math.max(1, Math.round((double) height * targetWidth / width));
		return new Dimension(targetWidth, targetHeight);
	}

	static Dimension readBounds(Path path) throws IOException
	{
		try
		{
			return Imaging.getImageSize(path.toFile());
		}
		catch (IOException | RuntimeException e)
		{
			// Commons Imaging does not parse every format ImageIO can decode
			logger.debug("Header read failed for {}, falling back to ImageIO: {}", path, e.getMessage());
		}

		try (ImageInputStream iis = ImageIO.createImageInputStream(path.toFile()))
		{
			ImageReader reader = firstReader(path, iis);
			try
			{
				reader.setInput(iis, true, true);
				return new Dimension(reader.getWidth(0), reader.getHeight(0));
			}
			finally
			{
				reader.dispose();
			}
		}
	}

	static BufferedImage decodeSubsampled(Path path, int subsample) throws IOException
	{
		try (ImageInputStream iis = ImageIO.createImageInputStream(path.toFile()))
		{
			ImageReader reader = firstReader(path, iis);
			try
			{
				reader.setInput(iis, true, true);
				ImageReadParam param = reader.getDefaultReadParam();
				if (subsample > 1)
				{
					param.setSourceSubsampling(subsample, subsample, 0, 0);
				}
				return reader.read(0, param);
			}
			finally
			{
				reader.dispose();
			}
		}
	}

	private static ImageReader firstReader(Path path, ImageInputStream iis) throws IOException
	{
		if (iis == null)
		{
			throw new FrameDecodeException(path, "cannot open image stream");
		}
		Iterator<ImageReader> readers = ImageIO.getImageReaders(iis);
		if (!readers.hasNext())
		{
			throw new FrameDecodeException(path, "unsupported image format");
		}
		return readers.next();
	}
}
