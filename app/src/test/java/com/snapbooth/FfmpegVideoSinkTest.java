package com.snapbooth;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class FfmpegVideoSinkTest
{

	@Test
	void commandPipesPngFramesIntoH264Mp4()
	{
		Path output = Path.of("out", "clip.mp4");
		List<String> command = FfmpegVideoSink.buildCommand("/opt/ffmpeg", output, 3);

		assertEquals("/opt/ffmpeg", command.get(0));
		assertEquals(output.toString(), command.get(command.size() - 1));
		assertEquals("image2pipe", after(command, "-f"));
		assertEquals("3", after(command, "-framerate"));
		assertEquals("-", after(command, "-i"));
		assertEquals("yuv420p", after(command, "-pix_fmt"));
		assertEquals("3", after(command, "-r"));
		assertTrue(command.contains("libx264"));
		assertTrue(command.contains("-y"));
		assertEquals("mp4", command.get(command.size() - 2));
	}

	@Test
	void configuredBinaryWins()
	{
		assertEquals("/usr/local/bin/ffmpeg", FfmpegVideoSink.resolveBinary("/usr/local/bin/ffmpeg"));
	}

	@Test
	void blankBinaryFallsBackToEnvironmentOrPath()
	{
		String env = System.getenv(FfmpegVideoSink.FFMPEG_PATH_ENV);
		String expected = env == null || env.isBlank() ? FfmpegVideoSink.DEFAULT_FFMPEG_BINARY : env;
		assertEquals(expected, FfmpegVideoSink.resolveBinary(null));
		assertEquals(expected, FfmpegVideoSink.resolveBinary("  "));
	}

	@Test
	void missingBinaryFailsToOpen()
	{
		VideoSink.Factory factory = FfmpegVideoSink.factory("/nonexistent/ffmpeg-binary");
		assertThrows(IOException.class, () -> factory.open(Path.of("x.mp4"), 3));
	}

	@Test
	@EnabledOnOs({OS.LINUX, OS.MAC})
	void stopMotionFramesArePipedAndCommitted(@TempDir Path tempDir) throws Exception
	{
		// Stands in for ffmpeg: copies stdin to the output path (the last argument)
		Path fake = script(tempDir, "copy-ffmpeg", "for last; do :; done", "exec cat > \"$last\"");
		List<Path> photos = StopMotionEncoderTest.writePhotos(tempDir, 2);
		Path output = tempDir.resolve("out/stopmotion.mp4");

		Optional<Path> result = new StopMotionEncoder(new FrameResampler(), FfmpegVideoSink.factory(fake.toString()), 3, 2, 64)
				.encode(photos, output);

		assertEquals(Optional.of(output), result);
		byte[] bytes = Files.readAllBytes(output);
		assertTrue(bytes.length > 8);
		assertEquals((byte) 0x89, bytes[0]);
		assertEquals('P', bytes[1]);
		assertEquals('N', bytes[2]);
		assertEquals('G', bytes[3]);
		assertEquals(4, countPngImages(bytes));
		assertNoPartFiles(output.getParent());
	}

	@Test
	@EnabledOnOs({OS.LINUX, OS.MAC})
	void nonZeroExitCarriesCapturedOutput(@TempDir Path tempDir) throws Exception
	{
		Path fake = script(tempDir, "failing-ffmpeg", "cat > /dev/null", "echo \"Unknown encoder 'libx264'\"", "exit 3");

		try (FfmpegVideoSink sink = FfmpegVideoSink.start(fake.toString(), tempDir.resolve("v.mp4"), 3))
		{
			sink.writeFrame(new BufferedImage(16, 16, BufferedImage.TYPE_INT_RGB));
			IOException e = assertThrows(IOException.class, sink::finish);
			assertTrue(e.getMessage().contains("exit code 3"), e.getMessage());
			assertTrue(e.getMessage().contains("Unknown encoder 'libx264'"), e.getMessage());
		}
	}

	@Test
	@EnabledOnOs({OS.LINUX, OS.MAC})
	void earlyExitIsReportedWithCapturedOutput(@TempDir Path tempDir) throws Exception
	{
		// Exits without reading stdin, so the pipe breaks under a large frame
		Path fake = script(tempDir, "early-ffmpeg", "echo \"Invalid data found when processing input\"", "exit 1");
		BufferedImage noise = noise(512, 512);

		IOException e = assertThrows(IOException.class, () -> {
			try (FfmpegVideoSink sink = FfmpegVideoSink.start(fake.toString(), tempDir.resolve("v.mp4"), 3))
			{
				for (int i = 0; i < 5; i++)
				{
					sink.writeFrame(noise);
				}
				sink.finish();
			}
		});
		assertTrue(e.getMessage().contains("Invalid data found when processing input"), e.getMessage());
	}

	@Test
	@EnabledOnOs({OS.LINUX, OS.MAC})
	void abandonedSinkIsKilledAndLeavesNoPartFile(@TempDir Path tempDir) throws Exception
	{
		Path fake = script(tempDir, "copy-ffmpeg", "for last; do :; done", "exec cat > \"$last\"");
		Path outDir = tempDir.resolve("out");
		Path target = outDir.resolve("stopmotion.mp4");

		FfmpegVideoSink abandoned;
		try (AtomicOutput out = AtomicOutput.begin(target);
			 FfmpegVideoSink sink = FfmpegVideoSink.start(fake.toString(), out.tempPath(), 3))
		{
			abandoned = sink;
			sink.writeFrame(new BufferedImage(16, 16, BufferedImage.TYPE_INT_RGB));
			assertTrue(sink.isAlive());
		}

		assertFalse(abandoned.isAlive());
		assertFalse(Files.exists(target));
		assertNoPartFiles(outDir);
	}

	private static Path script(Path dir, String name, String... lines) throws IOException
	{
		Path path = dir.resolve(name);
		Files.writeString(path, "#!/bin/sh\n" + String.join("\n", lines) + "\n");
		assertTrue(path.toFile().setExecutable(true));
		return path;
	}

	private static BufferedImage noise(int w, int h)
	{
		Random random = new Random(42);
		BufferedImage img = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
		for (int y = 0; y < h; y++)
		{
			for (int x = 0; x < w; x++)
			{
				img.setRGB(x, y, random.nextInt(0x1000000));
			}
		}
		return img;
	}

	/** Counts PNG IEND chunks, one per piped frame. */
	private static int countPngImages(byte[] bytes)
	{
		int count = 0;
		for (int i = 0; i + 3 < bytes.length; i++)
		{
			if (bytes[i] == 'I' && bytes[i + 1] == 'E' && bytes[i + 2] == 'N' && bytes[i + 3] == 'D')
			{
				count++;
			}
		}
		return count;
	}

	private static void assertNoPartFiles(Path dir) throws IOException
	{
		try (Stream<Path> files = Files.list(dir))
		{
			assertTrue(files.noneMatch(p -> p.getFileName().toString().endsWith(".part")));
		}
	}

	private static String after(List<String> command, String flag)
	{
		int i = command.indexOf(flag);
		assertTrue(i >= 0 && i < command.size() - 1, "missing " + flag);
		return command.get(i + 1);
	}
}
