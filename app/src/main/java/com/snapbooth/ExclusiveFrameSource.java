package com.snapbooth;

import java.awt.image.BufferedImage;

/**
 * Hands out a {@link FrameSource} to one owner at a time. A capture session holds the lease from
 * its start until it completes, aborts or is cancelled; nobody else can request frames meanwhile.
 */
public final class ExclusiveFrameSource
{
	private final FrameSource delegate;
	private Lease current;

	public ExclusiveFrameSource(FrameSource delegate)
	{
		this.delegate = delegate;
	}

	/**
	 * @throws IllegalStateException if another owner holds the lease
	 */
	public synchronized Lease acquire(String owner)
	{
		if (current != null)
		{
			throw new IllegalStateException("Frame source already leased by " + current.owner);
		}
		current = new Lease(owner);
		return current;
	}

	public synchronized boolean isLeased()
	{
		return current != null;
	}

	private synchronized void release(Lease lease)
	{
		if (current == lease)
		{
			current = null;
		}
	}

	public final class Lease implements AutoCloseable
	{
		private final String owner;
		private volatile boolean released;

		private Lease(String owner)
		{
			this.owner = owner;
		}

		public BufferedImage requestFrame() throws FrameSourceException
		{
			if (released)
			{
				throw new IllegalStateException("Lease held by " + owner + " was already released");
			}
			BufferedImage frame = delegate.requestFrame();
			if (frame == null)
			{
				throw FrameSourceException.unavailable("Frame source returned no data");
			}
			return frame;
		}

		@Override
		public void close()
		{
			released = true;
			release(this);
		}
	}
}
