package com.rawstack;

import java.io.File;

public class DecodeException extends StackingException
{

	private final File file;

	public DecodeException(File file, String reason)
	{
		this(file, reason, null);
	}

	public DecodeException(File file, String reason, Throwable cause)
	{
		super("Failed to decode " + file.getPath() + ": " + reason, cause);
		this.file = file;
	}

	public File getFile()
	{
		return file;
	}
}
