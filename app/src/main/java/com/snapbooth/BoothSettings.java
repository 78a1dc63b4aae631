package com.snapbooth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Color;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

/**
 * Booth configuration. Defaults come from the {@code snapbooth.properties} classpath resource;
 * an optional external properties file overrides individual keys.
 *
 * @param overlay    frame overlay image, {@code null} for none
 * @param ffmpegPath ffmpeg executable, {@code null} to resolve from the environment
 */
public record BoothSettings(
		SessionConfig session,
		LayoutKind layoutKind,
		Path overlay,
		boolean mirrorPhotos,
		Color background,
		int boomerangWidth,
		int boomerangDelayMs,
		int videoWidth,
		int videoFps,
		int videoLoops,
		String ffmpegPath,
		Path storageDir,
		Path sourceDir)
{
	private static final Logger logger = LoggerFactory.getLogger(BoothSettings.class);

	static final String DEFAULTS_RESOURCE = "/snapbooth.properties";

	public static BoothSettings loadDefaults() throws IOException
	{
		return load(null);
	}

	/**
	 * @param overrides properties file whose keys replace the defaults, or {@code null}
	 */
	public static BoothSettings load(Path overrides) throws IOException
	{
		Properties props = new Properties();
		try (InputStream in = BoothSettings.class.getResourceAsStream(DEFAULTS_RESOURCE))
		{
			if (in == null)
			{
				throw new IOException("Missing classpath resource " + DEFAULTS_RESOURCE);
			}
			props.load(in);
		}
		if (overrides != null)
		{
			try (InputStream in = Files.newInputStream(overrides))
			{
				props.load(in);
			}
			logger.info("Loaded settings overrides from {}", overrides);
		}

		Map<String, String> kv = new HashMap<>();
		for (String name : props.stringPropertyNames())
		{
			kv.put(name, props.getProperty(name));
		}
		return fromMap(kv);
	}

	/**
	 * @throws IllegalArgumentException naming the offending key when a value is missing or invalid
	 * @throws UnknownLayoutKindException when {@code layout.kind} is not a known layout
	 */
	public static BoothSettings fromMap(Map<String, String> kv)
	{
		SessionConfig session = new SessionConfig(
				positiveInt(kv, "session.shots"),
				positiveInt(kv, "session.countdown.seconds"),
				CaptureMode.parse(required(kv, "session.mode")),
				nonNegativeInt(kv, "session.delay.seconds"),
				nonNegativeInt(kv, "session.burst.frames"),
				nonNegativeInt(kv, "session.burst.interval.ms"));

		String overlay = optional(kv, "layout.overlay");

		return new BoothSettings(
				session,
				LayoutKind.parse(required(kv, "layout.kind")),
				overlay == null ? null : Path.of(expandHome(overlay)),
				Boolean.parseBoolean(required(kv, "layout.mirror").trim()),
				color(kv, "layout.background"),
				positiveInt(kv, "boomerang.width"),
				positiveInt(kv, "boomerang.delay.ms"),
				positiveInt(kv, "video.width"),
				positiveInt(kv, "video.fps"),
				positiveInt(kv, "video.loops"),
				optional(kv, "ffmpeg.path"),
				Path.of(expandHome(required(kv, "storage.dir"))),
				Path.of(expandHome(required(kv, "source.dir"))));
	}

	private static String required(Map<String, String> kv, String key)
	{
		String value = kv.get(key);
		if (value == null || value.isBlank())
		{
			throw new IllegalArgumentException("Missing setting: " + key);
		}
		return value.trim();
	}

	private static String optional(Map<String, String> kv, String key)
	{
		String value = kv.get(key);
		return value == null || value.isBlank() ? null : value.trim();
	}

	private static int positiveInt(Map<String, String> kv, String key)
	{
		int value = parseInt(kv, key);
		if (value <= 0)
		{
			throw new IllegalArgumentException(key + " must be positive: " + value);
		}
		return value;
	}

	private static int nonNegativeInt(Map<String, String> kv, String key)
	{
		int value = parseInt(kv, key);
		if (value < 0)
		{
			throw new IllegalArgumentException(key + " must not be negative: " + value);
		}
		return value;
	}

	private static int parseInt(Map<String, String> kv, String key)
	{
		String raw = required(kv, key);
		try
		{
			return Integer.parseInt(raw);
		}
		catch (NumberFormatException e)
		{
			throw new IllegalArgumentException(key + " is not a number: '" + raw + "'", e);
		}
	}

	private static Color color(Map<String, String> kv, String key)
	{
		String raw = required(kv, key);
		try
		{
			return Color.decode(raw);
		}
		catch (NumberFormatException e)
		{
			throw new IllegalArgumentException(key + " is not a color: '" + raw + "'", e);
		}
	}

	static String expandHome(String value)
	{
		return value.replace("${user.home}", System.getProperty("user.home"));
	}
}
