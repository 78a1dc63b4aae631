package com.snapbooth;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class StopMotionEncoderTest
{

	@Test
	void loopsPhotoSequenceIntoSink(@TempDir Path tempDir) throws Exception
	{
		List<Path> photos = writePhotos(tempDir, 4);
		RecordingSinkFactory factory = new RecordingSinkFactory();
		Path output = tempDir.resolve("stopmotion.mp4");

		Optional<Path> result = new StopMotionEncoder(new FrameResampler(), factory, 3, 3, 100)
				.encode(photos, output);

		assertEquals(Optional.of(output), result);
		assertEquals(1, factory.opened.size());
		RecordingSink sink = factory.opened.get(0);
		assertEquals(3, sink.fps);
		assertEquals(12, sink.frameWidths.size());
		assertTrue(sink.frameWidths.stream().allMatch(w -> w == 100));
		assertTrue(sink.finished);
		assertTrue(sink.closed);
		assertTrue(Files.exists(output));
		assertArrayEquals(new byte[]{'m', 'p', '4'}, Files.readAllBytes(output));
	}

	@Test
	void emptyInputProducesNothing(@TempDir Path tempDir) throws Exception
	{
		RecordingSinkFactory factory = new RecordingSinkFactory();
		Path output = tempDir.resolve("none.mp4");

		Optional<Path> result = new StopMotionEncoder(factory).encode(List.of(), output);

		assertTrue(result.isEmpty());
		assertTrue(factory.opened.isEmpty());
		assertFalse(Files.exists(output));
	}

	@Test
	void undecodablePhotoIsSkippedEachLoop(@TempDir Path tempDir) throws Exception
	{
		List<Path> photos = writePhotos(tempDir, 3);
		Files.writeString(photos.get(1), "garbage");
		RecordingSinkFactory factory = new RecordingSinkFactory();

		new StopMotionEncoder(new FrameResampler(), factory, 3, 3, 64).encode(photos, tempDir.resolve("v.mp4"));

		assertEquals(6, factory.opened.get(0).frameWidths.size());
	}

	@Test
	void nothingDecodableFailsAndLeavesNoFile(@TempDir Path tempDir) throws Exception
	{
		Path bad = tempDir.resolve("bad.jpg");
		Files.writeString(bad, "garbage");
		RecordingSinkFactory factory = new RecordingSinkFactory();
		Path output = tempDir.resolve("v.mp4");

		assertThrows(EmptyInputException.class,
				() -> new StopMotionEncoder(new FrameResampler(), factory, 3, 3, 64).encode(List.of(bad), output));

		assertFalse(factory.opened.get(0).finished);
		assertTrue(factory.opened.get(0).closed);
		assertNoArtifacts(tempDir, output);
	}

	@Test
	void sinkFailureLeavesNoFile(@TempDir Path tempDir) throws Exception
	{
		List<Path> photos = writePhotos(tempDir, 2);
		RecordingSinkFactory factory = new RecordingSinkFactory();
		factory.failOnFinish = true;
		Path output = tempDir.resolve("v.mp4");

		assertThrows(IOException.class,
				() -> new StopMotionEncoder(new FrameResampler(), factory, 3, 1, 64).encode(photos, output));

		assertNoArtifacts(tempDir, output);
	}

	@Test
	void rejectsNonPositiveSettings()
	{
		RecordingSinkFactory factory = new RecordingSinkFactory();
		assertThrows(IllegalArgumentException.class,
				() -> new StopMotionEncoder(new FrameResampler(), factory, 0, 3, 1080));
		assertThrows(IllegalArgumentException.class,
				() -> new StopMotionEncoder(new FrameResampler(), factory, 3, 0, 1080));
	}

	private static void assertNoArtifacts(Path dir, Path output) throws IOException
	{
		assertFalse(Files.exists(output));
		try (Stream<Path> files = Files.list(dir))
		{
			assertTrue(files.noneMatch(p -> p.getFileName().toString().endsWith(".part")));
		}
	}

	static List<Path> writePhotos(Path dir, int count) throws IOException
	{
		List<Path> paths = new ArrayList<>();
		for (int i = 0; i < count; i++)
		{
			BufferedImage img = new BufferedImage(200, 150, BufferedImage.TYPE_INT_RGB);
			img.setRGB(i, i, 0xFF00FF);
			Path path = dir.resolve("shot_" + (i + 1) + ".png");
			ImageIO.write(img, "png", path.toFile());
			paths.add(path);
		}
		return paths;
	}

	static class RecordingSinkFactory implements VideoSink.Factory
	{
		final List<RecordingSink> opened = new ArrayList<>();
		boolean failOnFinish;

		@Override
		public VideoSink open(Path output, int framesPerSecond)
		{
			RecordingSink sink = new RecordingSink(output, framesPerSecond, failOnFinish);
			opened.add(sink);
			return sink;
		}
	}

	static class RecordingSink implements VideoSink
	{
		final Path output;
		final int fps;
		final boolean failOnFinish;
		final List<Integer> frameWidths = new ArrayList<>();
		boolean finished;
		boolean closed;

		RecordingSink(Path output, int fps, boolean failOnFinish)
		{
			this.output = output;
			this.fps = fps;
			this.failOnFinish = failOnFinish;
		}

		@Override
		public void writeFrame(BufferedImage frame)
		{
			frameWidths.add(frame.getWidth());
		}

		@Override
		public void finish() throws IOException
		{
			if (failOnFinish)
			{
				throw new IOException("encoder exploded");
			}
			Files.write(output, new byte[]{'m', 'p', '4'});
			finished = true;
		}

		@Override
		public void close()
		{
			closed = true;
		}
	}
}
