package com.snapbooth;

import java.io.IOException;

/**
 * An encoder was handed no frames, or none of its frames could be decoded.
 */
public class EmptyInputException extends IOException
{
	public EmptyInputException(String message)
	{
		super(message);
	}
}
