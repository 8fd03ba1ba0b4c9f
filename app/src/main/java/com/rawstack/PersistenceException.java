package com.rawstack;

import java.io.File;

public class PersistenceException extends StackingException
{

	private final File target;

	public PersistenceException(File target, Throwable cause)
	{
		super("Failed to write " + target.getPath() + ": " + cause.getMessage(), cause);
		this.target = target;
	}

	public File getTarget()
	{
		return target;
	}
}
