package com.rawstack;

import java.io.File;

/**
 * One decoded frame on its way from the producer to the aggregator.
 *
 * @param index position of the file in the user's selection, 0-based
 */
public record FrameRecord(int index, File file, PixelBuffer buffer, ExposureDuration exposure)
{
}
