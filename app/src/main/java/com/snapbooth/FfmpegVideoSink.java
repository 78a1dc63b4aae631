package com.snapbooth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.BufferedOutputStream;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * {@link VideoSink} backed by an ffmpeg child process. Frames are piped to its stdin as PNG
 * and encoded to H.264 MP4.
 */
public class FfmpegVideoSink implements VideoSink
{
	private static final Logger logger = LoggerFactory.getLogger(FfmpegVideoSink.class);

	static final String FFMPEG_PATH_ENV = "FFMPEG_PATH";
	static final String DEFAULT_FFMPEG_BINARY = "ffmpeg";
	private static final long FINISH_TIMEOUT_MINUTES = 5;
	private static final long EARLY_EXIT_WAIT_MILLIS = 1000;
	private static final long KILL_WAIT_MILLIS = 5000;
	private static final long DRAIN_WAIT_MILLIS = 5000;

	private final Process process;
	private final OutputStream stdin;
	private final Thread outputDrainer;
	private final StringBuilder output = new StringBuilder();
	private boolean finished;

	private FfmpegVideoSink(Process process)
	{
		this.process = process;
		this.stdin = new BufferedOutputStream(process.getOutputStream(), 1 << 16);
		this.outputDrainer = new Thread(this::drainOutput, "ffmpeg-output");
		this.outputDrainer.setDaemon(true);
		this.outputDrainer.start();
	}

	/**
	 * @param configuredBinary ffmpeg executable from settings, or {@code null} to use
	 *                         {@value #FFMPEG_PATH_ENV} and then {@code ffmpeg} on the PATH
	 */
	public static VideoSink.Factory factory(String configuredBinary)
	{
		return (output, fps) -> start(resolveBinary(configuredBinary), output, fps);
	}

	static FfmpegVideoSink start(String binary, Path output, int framesPerSecond) throws IOException
	{
		List<String> command = buildCommand(binary, output, framesPerSecond);
		logger.info("Starting ffmpeg: {}", String.join(" ", command));
		Process process = new ProcessBuilder(command)
				.redirectErrorStream(true)
				.start();
		return new FfmpegVideoSink(process);
	}

	static List<String> buildCommand(String binary, Path output, int framesPerSecond)
	{
		String fps = String.valueOf(framesPerSecond);
		List<String> command = new ArrayList<>();
		command.add(binary);
		command.add("-hide_banner");
		command.add("-loglevel");
		command.add("error");
		command.add("-y");
		command.add("-f");
		command.add("image2pipe");
		command.add("-framerate");
		command.add(fps);
		command.add("-c:v");
		command.add("png");
		command.add("-i");
		command.add("-");
		command.add("-vf");
		// libx264 with yuv420p needs even dimensions
		command.add("scale=trunc(iw/2)*2:trunc(ih/2)*2");
		command.add("-r");
		command.add(fps);
		command.add("-c:v");
		command.add("libx264");
		command.add("-preset");
		command.add("veryfast");
		command.add("-crf");
		command.add("20");
		command.add("-pix_fmt");
		command.add("yuv420p");
		command.add("-movflags");
		command.add("+faststart");
		command.add("-f");
		command.add("mp4");
		command.add(output.toString());
		return command;
	}

	static String resolveBinary(String configuredBinary)
	{
		if (configuredBinary != null && !configuredBinary.isBlank())
		{
			return configuredBinary;
		}
		String fromEnv = System.getenv(FFMPEG_PATH_ENV);
		if (fromEnv != null && !fromEnv.isBlank())
		{
			return fromEnv;
		}
		return DEFAULT_FFMPEG_BINARY;
	}

	@Override
	public void writeFrame(BufferedImage frame) throws IOException
	{
		if (finished)
		{
			throw new IllegalStateException("Sink already finished");
		}
		try
		{
			if (!ImageIO.write(frame, "png", stdin))
			{
				throw new IOException("No PNG writer available");
			}
		}
		catch (IOException e)
		{
			// A broken pipe usually means ffmpeg died; report why
			if (awaitExit(EARLY_EXIT_WAIT_MILLIS))
			{
				throw new IOException("ffmpeg exited early with code " + process.exitValue() + ". Output: " + drainedOutput(), e);
			}
			throw e;
		}
	}

	@Override
	public void finish() throws IOException
	{
		finished = true;
		IOException closeFailure = null;
		try
		{
			stdin.close();
		}
		catch (IOException e)
		{
			// ffmpeg may already have exited; its exit code says more than the broken pipe
			closeFailure = e;
		}
		try
		{
			boolean exited = process.waitFor(FINISH_TIMEOUT_MINUTES, TimeUnit.MINUTES);
			if (!exited)
			{
				process.destroyForcibly();
				throw new IOException("ffmpeg timed out finalizing video");
			}
		}
		catch (InterruptedException e)
		{
			Thread.currentThread().interrupt();
			process.destroyForcibly();
			throw new IOException("Interrupted while waiting for ffmpeg", e);
		}

		if (process.exitValue() != 0)
		{
			IOException failure = new IOException("ffmpeg failed with exit code " + process.exitValue() + ". Output: " + drainedOutput());
			if (closeFailure != null)
			{
				failure.addSuppressed(closeFailure);
			}
			throw failure;
		}
		if (closeFailure != null)
		{
			throw closeFailure;
		}
	}

	/**
	 * Kills ffmpeg if it is still running and waits for it to go, so the caller can delete a
	 * partial output file without ffmpeg recreating it.
	 */
	@Override
	public void close()
	{
		if (process.isAlive())
		{
			logger.warn("Abandoning unfinished video, killing ffmpeg");
			process.destroyForcibly();
			if (!awaitExit(KILL_WAIT_MILLIS))
			{
				logger.warn("ffmpeg did not exit within {} ms of being killed", KILL_WAIT_MILLIS);
			}
		}
		if (!finished)
		{
			try
			{
				stdin.close();
			}
			catch (IOException e)
			{
				logger.debug("Ignoring ffmpeg stdin close failure after abort: {}", e.getMessage());
			}
		}
	}

	private void drainOutput()
	{
		try (BufferedReader reader = new BufferedReader(
				new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8)))
		{
			String line;
			while ((line = reader.readLine()) != null)
			{
				synchronized (output)
				{
					output.append(line).append(System.lineSeparator());
				}
			}
		}
		catch (IOException e)
		{
			logger.debug("ffmpeg output stream closed: {}", e.getMessage());
		}
	}

	boolean isAlive()
	{
		return process.isAlive();
	}

	private boolean awaitExit(long millis)
	{
		try
		{
			return process.waitFor(millis, TimeUnit.MILLISECONDS);
		}
		catch (InterruptedException e)
		{
			Thread.currentThread().interrupt();
			return !process.isAlive();
		}
	}

	/** Everything ffmpeg printed. Call only once the process has exited. */
	private String drainedOutput()
	{
		try
		{
			outputDrainer.join(DRAIN_WAIT_MILLIS);
		}
		catch (InterruptedException e)
		{
			Thread.currentThread().interrupt();
		}
		synchronized (output)
		{
			return output.toString();
		}
	}
}
