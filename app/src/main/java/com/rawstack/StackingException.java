package com.rawstack;

import java.io.IOException;

/**
 * Base failure of a stacking session. Messages carry enough context (file,
 * dimensions, target path) to diagnose the problem without a debugger.
 */
public class StackingException extends IOException
{

	public StackingException(String message)
	{
		super(message);
	}

	public StackingException(String message, Throwable cause)
	{
		super(message, cause);
	}
}
