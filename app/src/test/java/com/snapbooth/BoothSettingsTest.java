package com.snapbooth;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.Color;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class BoothSettingsTest
{

	@Test
	void defaultsMatchBundledProperties() throws Exception
	{
		BoothSettings settings = BoothSettings.loadDefaults();

		assertEquals(6, settings.session().targetShotCount());
		assertEquals(3, settings.session().countdownSeconds());
		assertEquals(CaptureMode.AUTO, settings.session().mode());
		assertEquals(2, settings.session().interShotDelaySeconds());
		assertEquals(15, settings.session().burstFrameCount());
		assertEquals(LayoutKind.GRID, settings.layoutKind());
		assertNull(settings.overlay());
		assertTrue(settings.mirrorPhotos());
		assertEquals(Color.WHITE, settings.background());
		assertEquals(BoomerangEncoder.DEFAULT_TARGET_WIDTH, settings.boomerangWidth());
		assertEquals(BoomerangEncoder.DEFAULT_DELAY_MS, settings.boomerangDelayMs());
		assertEquals(StopMotionEncoder.DEFAULT_TARGET_WIDTH, settings.videoWidth());
		assertEquals(StopMotionEncoder.DEFAULT_FPS, settings.videoFps());
		assertEquals(StopMotionEncoder.DEFAULT_LOOPS, settings.videoLoops());
		assertNull(settings.ffmpegPath());
		assertEquals(Path.of(System.getProperty("user.home"), "snapbooth"), settings.storageDir());
	}

	@Test
	void overridesFileReplacesIndividualKeys(@TempDir Path tempDir) throws Exception
	{
		Path overrides = tempDir.resolve("booth.properties");
		Files.writeString(overrides, String.join("\n",
				"session.mode=manual",
				"session.shots=3",
				"layout.kind=strip",
				"layout.mirror=false",
				"layout.background=#000000",
				"ffmpeg.path=/opt/ffmpeg/bin/ffmpeg",
				"storage.dir=" + tempDir.toString().replace("\\", "/")));

		BoothSettings settings = BoothSettings.load(overrides);

		assertEquals(CaptureMode.MANUAL, settings.session().mode());
		assertEquals(3, settings.session().targetShotCount());
		assertEquals(3, settings.session().countdownSeconds());
		assertEquals(LayoutKind.STRIP, settings.layoutKind());
		assertFalse(settings.mirrorPhotos());
		assertEquals(Color.BLACK, settings.background());
		assertEquals("/opt/ffmpeg/bin/ffmpeg", settings.ffmpegPath());
		assertEquals(tempDir, settings.storageDir());
	}

	@Test
	void unknownLayoutIsRejected() throws Exception
	{
		Map<String, String> kv = defaults();
		kv.put("layout.kind", "mosaic");

		UnknownLayoutKindException e = assertThrows(UnknownLayoutKindException.class, () -> BoothSettings.fromMap(kv));
		assertEquals("mosaic", e.layoutName());
	}

	@Test
	void invalidValuesNameTheirKey() throws Exception
	{
		Map<String, String> kv = defaults();
		kv.put("video.fps", "fast");
		IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> BoothSettings.fromMap(kv));
		assertTrue(e.getMessage().contains("video.fps"));

		Map<String, String> negative = defaults();
		negative.put("session.shots", "0");
		e = assertThrows(IllegalArgumentException.class, () -> BoothSettings.fromMap(negative));
		assertTrue(e.getMessage().contains("session.shots"));

		Map<String, String> missing = defaults();
		missing.remove("storage.dir");
		e = assertThrows(IllegalArgumentException.class, () -> BoothSettings.fromMap(missing));
		assertTrue(e.getMessage().contains("storage.dir"));

		Map<String, String> badColor = defaults();
		badColor.put("layout.background", "white-ish");
		e = assertThrows(IllegalArgumentException.class, () -> BoothSettings.fromMap(badColor));
		assertTrue(e.getMessage().contains("layout.background"));
	}

	@Test
	void overlayPathExpandsHome() throws Exception
	{
		Map<String, String> kv = defaults();
		kv.put("layout.overlay", "${user.home}/frames/wedding.png");

		BoothSettings settings = BoothSettings.fromMap(kv);

		assertEquals(Path.of(System.getProperty("user.home"), "frames", "wedding.png"), settings.overlay());
	}

	private static Map<String, String> defaults() throws Exception
	{
		Properties props = new Properties();
		try (InputStream in = BoothSettingsTest.class.getResourceAsStream(BoothSettings.DEFAULTS_RESOURCE))
		{
			props.load(in);
		}
		Map<String, String> kv = new HashMap<>();
		for (String name : props.stringPropertyNames())
		{
			kv.put(name, props.getProperty(name));
		}
		return kv;
	}
}
