package com.rawstack;

import java.io.File;

/**
 * Looks up the exposure time recorded for a file.
 */
@FunctionalInterface
public interface ExposureMetadata
{
	/**
	 * @return the exposure, or {@link ExposureDuration#ZERO} when the file does
	 *         not record one
	 */
	ExposureDuration exposureOf(File file);
}
