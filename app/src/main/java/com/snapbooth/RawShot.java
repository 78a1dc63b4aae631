package com.snapbooth;

import java.nio.file.Path;

/**
 * A persisted still. {@code index} is the shot's 0-based position in its session.
 */
public record RawShot(int index, Path path)
{
}
