package com.rawstack;

import java.io.File;

public class DimensionMismatchException extends StackingException
{

	private final File file;
	private final String expected;
	private final String actual;

	public DimensionMismatchException(int index, File file, PixelBuffer expected, PixelBuffer actual)
	{
		super(String.format("Inconsistent frame dimensions: frame %d (%s) is %s (expected %s)",
				index + 1, file.getName(), actual.shape(), expected.shape()));
		this.file = file;
		this.expected = expected.shape();
		this.actual = actual.shape();
	}

	public File getFile()
	{
		return file;
	}

	public String getExpected()
	{
		return expected;
	}

	public String getActual()
	{
		return actual;
	}
}
