package com.snapbooth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * A temporary sibling of an artifact path. Writers fill {@link #tempPath()} and call
 * {@link #commit()}; closing without a commit deletes the temporary, so consumers never see a
 * half-written artifact.
 */
final class AtomicOutput implements AutoCloseable
{
	private static final Logger logger = LoggerFactory.getLogger(AtomicOutput.class);

	private final Path target;
	private final Path temp;
	private boolean committed;

	private AtomicOutput(Path target, Path temp)
	{
		this.target = target;
		this.temp = temp;
	}

	static AtomicOutput begin(Path target) throws IOException
	{
		Path dir = target.toAbsolutePath().getParent();
		if (dir != null)
		{
			Files.createDirectories(dir);
		}
		Path temp = Files.createTempFile(dir, "." + target.getFileName().toString() + ".", ".part");
		return new AtomicOutput(target, temp);
	}

	Path tempPath()
	{
		return temp;
	}

	Path commit() throws IOException
	{
		try
		{
			Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
		}
		catch (AtomicMoveNotSupportedException e)
		{
			Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
		}
		committed = true;
		return target;
	}

	@Override
	public void close()
	{
		if (committed) return;
		try
		{
			Files.deleteIfExists(temp);
		}
		catch (IOException e)
		{
			logger.warn("Could not delete temporary file {}", temp, e);
		}
	}
}
