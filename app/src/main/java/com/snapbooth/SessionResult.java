package com.snapbooth;

import java.nio.file.Path;
import java.util.List;

/**
 * The ordered output of a completed session.
 *
 * @param photos      stills in capture order
 * @param burstFrames boomerang burst frames in capture order, empty when no burst ran
 */
public record SessionResult(List<RawShot> photos, List<RawShot> burstFrames)
{
	public SessionResult
	{
		photos = List.copyOf(photos);
		burstFrames = List.copyOf(burstFrames);
	}

	public List<Path> photoPaths()
	{
		return photos.stream().map(RawShot::path).toList();
	}

	public List<Path> burstPaths()
	{
		return burstFrames.stream().map(RawShot::path).toList();
	}

	/** Frames for the boomerang animation: the burst when one was captured, otherwise the stills. */
	public List<Path> boomerangSource()
	{
		return burstFrames.isEmpty() ? photoPaths() : burstPaths();
	}
}
