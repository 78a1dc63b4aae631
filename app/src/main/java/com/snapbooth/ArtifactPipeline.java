package com.snapbooth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Turns a completed session into its deliverables: the print composite, the boomerang GIF and
 * the stop-motion video.
 * <p>
 * The composite is the primary deliverable and its failure propagates. The two animations are
 * encoded in parallel afterwards; a failure in either is logged and reported in the bundle
 * without affecting the other.
 */
public class ArtifactPipeline implements AutoCloseable
{
	private static final Logger logger = LoggerFactory.getLogger(ArtifactPipeline.class);

	static final String COMPOSITE_FILE = "print.jpg";
	static final String BOOMERANG_FILE = "boomerang.gif";
	static final String VIDEO_FILE = "stopmotion.mp4";
	static final float COMPOSITE_QUALITY = 0.95f;

	public record ArtifactBundle(Path composite, Optional<Path> boomerang, Optional<Path> video, List<String> failures)
	{
		public boolean complete()
		{
			return failures.isEmpty();
		}
	}

	private final LayoutCompositor compositor;
	private final LayoutKind layoutKind;
	private final Path overlay;
	private final BoomerangEncoder boomerangEncoder;
	private final int boomerangDelayMs;
	private final StopMotionEncoder stopMotionEncoder;
	private final ExecutorService executor;

	public ArtifactPipeline(LayoutCompositor compositor, LayoutKind layoutKind, Path overlay,
							BoomerangEncoder boomerangEncoder, int boomerangDelayMs,
							StopMotionEncoder stopMotionEncoder)
	{
		this.compositor = compositor;
		this.layoutKind = layoutKind;
		this.overlay = overlay;
		this.boomerangEncoder = boomerangEncoder;
		this.boomerangDelayMs = boomerangDelayMs;
		this.stopMotionEncoder = stopMotionEncoder;
		this.executor = Executors.newFixedThreadPool(2, r -> {
			Thread t = new Thread(r, "artifact-encoder");
			t.setDaemon(true);
			return t;
		});
	}

	public static ArtifactPipeline fromSettings(BoothSettings settings)
	{
		FrameResampler resampler = new FrameResampler();
		return new ArtifactPipeline(
				new LayoutCompositor(settings.background(), settings.mirrorPhotos()),
				settings.layoutKind(),
				settings.overlay(),
				new BoomerangEncoder(resampler, settings.boomerangWidth()),
				settings.boomerangDelayMs(),
				new StopMotionEncoder(resampler, FfmpegVideoSink.factory(settings.ffmpegPath()),
						settings.videoFps(), settings.videoLoops(), settings.videoWidth()));
	}

	/**
	 * Renders the artifacts with the first photos filling the layout's slots.
	 *
	 * @throws IOException if the composite cannot be produced
	 * @throws InterruptedException if interrupted; running encodes are cancelled and leave no output
	 */
	public ArtifactBundle process(SessionResult result, Path outputDir) throws IOException, InterruptedException
	{
		return processSlots(result, outputDir, LayoutCompositor.selectForLayout(result.photoPaths(), layoutKind));
	}

	/**
	 * Renders the artifacts with the guest's picks filling the layout's slots. The stop-motion video
	 * still uses every photo.
	 *
	 * @param picks indices into {@link SessionResult#photoPaths()}, in slot order
	 * @throws IllegalArgumentException if the picks do not fit the layout
	 */
	public ArtifactBundle process(SessionResult result, Path outputDir, List<Integer> picks)
			throws IOException, InterruptedException
	{
		return processSlots(result, outputDir, LayoutCompositor.selectForLayout(result.photoPaths(), layoutKind, picks));
	}

	private ArtifactBundle processSlots(SessionResult result, Path outputDir, List<Path> slotPhotos)
			throws IOException, InterruptedException
	{
		List<Path> photos = result.photoPaths();

		BufferedImage composite = compositor.compose(slotPhotos, layoutKind, overlay);
		Path compositePath = DirectoryShotStore.writeJpeg(
				composite, outputDir.resolve(COMPOSITE_FILE), COMPOSITE_QUALITY);
		composite.flush();
		logger.info("Wrote composite {}", compositePath);

		Path boomerangPath = outputDir.resolve(BOOMERANG_FILE);
		Future<Path> boomerang = executor.submit(() -> {
			boomerangEncoder.encode(result.boomerangSource(), boomerangDelayMs, boomerangPath);
			return boomerangPath;
		});
		Future<Optional<Path>> video = executor.submit(() -> stopMotionEncoder.encode(photos, outputDir.resolve(VIDEO_FILE)));

		List<String> failures = new ArrayList<>();
		Optional<Path> boomerangResult = Optional.empty();
		Optional<Path> videoResult = Optional.empty();
		try
		{
			try
			{
				boomerangResult = Optional.of(boomerang.get());
			}
			catch (ExecutionException e)
			{
				logger.error("Boomerang encode failed", e.getCause());
				failures.add("Boomerang: " + e.getCause().getMessage());
			}
			try
			{
				videoResult = video.get();
			}
			catch (ExecutionException e)
			{
				logger.error("Stop-motion encode failed", e.getCause());
				failures.add("Video: " + e.getCause().getMessage());
			}
		}
		catch (InterruptedException e)
		{
			boomerang.cancel(true);
			video.cancel(true);
			throw e;
		}

		return new ArtifactBundle(compositePath, boomerangResult, videoResult, List.copyOf(failures));
	}

	@Override
	public void close()
	{
		executor.shutdownNow();
	}
}
