package com.snapbooth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Encodes a short, deliberately choppy stop-motion clip by looping the photo sequence.
 */
public class StopMotionEncoder
{
	private static final Logger logger = LoggerFactory.getLogger(StopMotionEncoder.class);

	public static final int DEFAULT_FPS = 3;
	public static final int DEFAULT_LOOPS = 3;
	public static final int DEFAULT_TARGET_WIDTH = 1080;

	private final FrameResampler resampler;
	private final VideoSink.Factory sinkFactory;
	private final int framesPerSecond;
	private final int loops;
	private final int targetWidth;

	public StopMotionEncoder(VideoSink.Factory sinkFactory)
	{
		this(new FrameResampler(), sinkFactory, DEFAULT_FPS, DEFAULT_LOOPS, DEFAULT_TARGET_WIDTH);
	}

	public StopMotionEncoder(FrameResampler resampler, VideoSink.Factory sinkFactory,
							 int framesPerSecond, int loops, int targetWidth)
	{
		if (framesPerSecond <= 0 || loops <= 0 || targetWidth <= 0)
		{
			throw new IllegalArgumentException("fps, loops and width must be positive");
		}
		this.resampler = resampler;
		this.sinkFactory = sinkFactory;
		this.framesPerSecond = framesPerSecond;
		this.loops = loops;
		this.targetWidth = targetWidth;
	}

	/**
	 * @return the written video, or empty when {@code photoPaths} is empty
	 * @throws EmptyInputException if photos were given but none could be decoded
	 * @throws IOException if the video cannot be written
	 */
	public Optional<Path> encode(List<Path> photoPaths, Path output) throws IOException
	{
		if (photoPaths.isEmpty())
		{
			logger.info("No photos for stop-motion video, skipping");
			return Optional.empty();
		}

		int total = photoPaths.size() * loops;
		int written = 0;
		int skipped = 0;

		try (AtomicOutput out = AtomicOutput.begin(output);
			 VideoSink sink = sinkFactory.open(out.tempPath(), framesPerSecond))
		{
			for (int i = 0; i < total; i++)
			{
				if (Thread.currentThread().isInterrupted())
				{
					throw new InterruptedIOException("Stop-motion encode interrupted at frame " + i);
				}

				Path path = photoPaths.get(i % photoPaths.size());
				BufferedImage frame;
				try
				{
					frame = resampler.resample(path, targetWidth);
				}
				catch (FrameDecodeException e)
				{
					logger.warn("Skipping stop-motion frame {}: {}", i + 1, e.getMessage());
					skipped++;
					continue;
				}

				sink.writeFrame(frame);
				frame.flush();
				written++;
				logger.debug("Stop-motion frame {}/{} encoded", i + 1, total);
			}

			if (written == 0)
			{
				throw new EmptyInputException("None of the " + photoPaths.size() + " photos could be decoded");
			}
			sink.finish();
			out.commit();
		}

		logger.info("Wrote stop-motion video {} ({} frames @ {} fps, {} skipped)",
				output, written, framesPerSecond, skipped);
		return Optional.of(output);
	}
}
