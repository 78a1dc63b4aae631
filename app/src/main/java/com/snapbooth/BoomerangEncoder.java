package com.snapbooth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageTypeSpecifier;
import javax.imageio.ImageWriter;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.metadata.IIOMetadataNode;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Graphics2D;
import java.awt.Rectangle;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Writes a forward-then-reverse looping GIF from an ordered photo sequence.
 * <p>
 * Frames are resampled and written one at a time; the reverse pass decodes its frames again
 * rather than keeping the forward pass in memory.
 */
public class BoomerangEncoder
{
	private static final Logger logger = LoggerFactory.getLogger(BoomerangEncoder.class);

	public static final int DEFAULT_TARGET_WIDTH = 720;
	public static final int DEFAULT_DELAY_MS = 100;

	public interface ProgressListener
	{
		void onProgress(int current, int total);
	}

	private final FrameResampler resampler;
	private final int targetWidth;

	public BoomerangEncoder()
	{
		this(new FrameResampler(), DEFAULT_TARGET_WIDTH);
	}

	public BoomerangEncoder(FrameResampler resampler, int targetWidth)
	{
		this.resampler = resampler;
		this.targetWidth = targetWidth;
	}

	public void encode(List<Path> photoPaths, int delayMs, Path output) throws IOException
	{
		encode(photoPaths, delayMs, output, null);
	}

	/**
	 * @throws EmptyInputException if {@code photoPaths} is empty or no frame could be decoded
	 * @throws InterruptedIOException if the calling thread is interrupted between frames
	 */
	public void encode(List<Path> photoPaths, int delayMs, Path output, ProgressListener listener) throws IOException
	{
		if (photoPaths.isEmpty())
		{
			throw new EmptyInputException("No frames to encode");
		}

		int delayCentiseconds = Math.round(delayMs / 10.0f);
		if (delayCentiseconds < 2) delayCentiseconds = 2;

		List<Integer> order = playbackOrder(photoPaths.size());
		Set<Integer> undecodable = new HashSet<>();
		int written = 0;
		int screenHeight = 0;

		try (AtomicOutput out = AtomicOutput.begin(output))
		{
			ImageWriter writer = ImageIO.getImageWritersByFormatName("gif").next();
			try (ImageOutputStream ios = ImageIO.createImageOutputStream(out.tempPath().toFile()))
			{
				writer.setOutput(ios);

				for (int step = 0; step < order.size(); step++)
				{
					if (Thread.currentThread().isInterrupted())
					{
						throw new InterruptedIOException("Boomerang encode interrupted at frame " + step);
					}

					int sourceIndex = order.get(step);
					if (!undecodable.contains(sourceIndex))
					{
						BufferedImage frame = resampleOrNull(photoPaths.get(sourceIndex));
						if (frame == null)
						{
							undecodable.add(sourceIndex);
						}
						else
						{
							if (written == 0)
							{
								screenHeight = frame.getHeight();
								IIOMetadata streamMeta = writer.getDefaultStreamMetadata(null);
								configureStreamMeta(streamMeta, frame.getWidth(), screenHeight);
								writer.prepareWriteSequence(streamMeta);
							}
							else if (frame.getHeight() != screenHeight)
							{
								BufferedImage fitted = fitToScreen(frame, frame.getWidth(), screenHeight);
								frame.flush();
								frame = fitted;
							}
							IIOMetadata imageMeta = writer.getDefaultImageMetadata(new ImageTypeSpecifier(frame), null);
							configureImageMeta(imageMeta, delayCentiseconds, written == 0);
							writer.writeToSequence(new IIOImage(frame, null, imageMeta), null);
							frame.flush();
							written++;
						}
					}

					if (listener != null)
					{
						listener.onProgress(step + 1, order.size());
					}
				}

				if (written == 0)
				{
					throw new EmptyInputException("None of the " + photoPaths.size() + " frames could be decoded");
				}
				writer.endWriteSequence();
			}
			finally
			{
				writer.dispose();
			}
			out.commit();
		}

		logger.info("Wrote boomerang {} ({} frames, {} skipped source frame(s))", output, written, undecodable.size());
	}

	/**
	 * Source indices in playback order: every frame forward, then back down to index 1.
	 * The first and last frames are not repeated at the turnaround.
	 */
	static List<Integer> playbackOrder(int frameCount)
	{
		List<Integer> order = new ArrayList<>();
		for (int i = 0; i < frameCount; i++)
		{
			order.add(i);
		}
		if (frameCount > 2)
		{
			for (int i = frameCount - 2; i >= 1; i--)
			{
				order.add(i);
			}
		}
		return order;
	}

	/**
	 * Center-crops {@code frame} to the aspect of the logical screen and scales it to fill the
	 * screen exactly. Every frame shares the resampled width, so only a differing height (a
	 * portrait shot among landscape ones, say) needs this.
	 */
	static BufferedImage fitToScreen(BufferedImage frame, int screenWidth, int screenHeight)
	{
		Rectangle crop = LayoutCompositor.cropRegion(frame.getWidth(), frame.getHeight(), screenWidth, screenHeight);
		BufferedImage fitted = new BufferedImage(screenWidth, screenHeight, BufferedImage.TYPE_INT_RGB);
		Graphics2D g = fitted.createGraphics();
		try
		{
			g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
			g.drawImage(frame,
					0, 0, screenWidth, screenHeight,
					crop.x, crop.y, crop.x + crop.width, crop.y + crop.height,
					null);
		}
		finally
		{
			g.dispose();
		}
		return fitted;
	}

	private BufferedImage resampleOrNull(Path path)
	{
		try
		{
			return resampler.resample(path, targetWidth);
		}
		catch (FrameDecodeException e)
		{
			logger.warn("Skipping boomerang frame: {}", e.getMessage());
			return null;
		}
	}

	private static void configureStreamMeta(IIOMetadata streamMeta, int width, int height) throws IOException
	{
		String formatName = streamMeta.getNativeMetadataFormatName();
		IIOMetadataNode root = (IIOMetadataNode) streamMeta.getAsTree(formatName);

		IIOMetadataNode lsd = getOrCreateChild(root, "LogicalScreenDescriptor");
		lsd.setAttribute("logicalScreenWidth", String.valueOf(width));
		lsd.setAttribute("logicalScreenHeight", String.valueOf(height));
		lsd.setAttribute("colorResolution", "8");
		lsd.setAttribute("pixelAspectRatio", "0");

		streamMeta.setFromTree(formatName, root);
	}

	private static void configureImageMeta(IIOMetadata imageMeta, int delayCentiseconds, boolean firstFrame)
			throws IOException
	{
		String formatName = imageMeta.getNativeMetadataFormatName();
		IIOMetadataNode root = (IIOMetadataNode) imageMeta.getAsTree(formatName);

		IIOMetadataNode gce = getOrCreateChild(root, "GraphicControlExtension");
		gce.setAttribute("disposalMethod", "none");
		gce.setAttribute("userInputFlag", "FALSE");
		gce.setAttribute("transparentColorFlag", "FALSE");
		gce.setAttribute("transparentColorIndex", "0");
		gce.setAttribute("delayTime", String.valueOf(delayCentiseconds));

		if (firstFrame)
		{
			IIOMetadataNode appExtensions = getOrCreateChild(root, "ApplicationExtensions");
			IIOMetadataNode netscape = new IIOMetadataNode("ApplicationExtension");
			netscape.setAttribute("applicationID", "NETSCAPE");
			netscape.setAttribute("authenticationCode", "2.0");
			netscape.setUserObject(new byte[]{1, 0, 0}); // loop count 0 = infinite
			appExtensions.appendChild(netscape);
		}

		imageMeta.setFromTree(formatName, root);
	}

	private static IIOMetadataNode getOrCreateChild(IIOMetadataNode parent, String name)
	{
		for (int i = 0; i < parent.getLength(); i++)
		{
			if (parent.item(i).getNodeName().equals(name))
			{
				return (IIOMetadataNode) parent.item(i);
			}
		}
		IIOMetadataNode child = new IIOMetadataNode(name);
		parent.appendChild(child);
		return child;
	}
}
