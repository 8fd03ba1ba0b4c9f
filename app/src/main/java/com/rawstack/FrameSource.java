package com.rawstack;

import java.io.File;

/**
 * Decodes one input file into a pixel buffer.
 */
@FunctionalInterface
public interface FrameSource
{
	PixelBuffer decode(File file) throws DecodeException;
}
