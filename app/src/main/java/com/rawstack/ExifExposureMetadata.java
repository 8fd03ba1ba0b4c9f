package com.rawstack;

import org.apache.commons.imaging.Imaging;
import org.apache.commons.imaging.ImagingException;
import org.apache.commons.imaging.common.ImageMetadata;
import org.apache.commons.imaging.common.RationalNumber;
import org.apache.commons.imaging.formats.jpeg.JpegImageMetadata;
import org.apache.commons.imaging.formats.tiff.TiffField;
import org.apache.commons.imaging.formats.tiff.TiffImageMetadata;
import org.apache.commons.imaging.formats.tiff.constants.ExifTagConstants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;

/**
 * Reads the EXIF ExposureTime tag (0x829A) as an exact rational. Files without
 * the tag, or whose metadata cannot be read, count as zero-length exposures.
 */
public class ExifExposureMetadata implements ExposureMetadata
{

	private static final Logger LOG = LoggerFactory.getLogger(ExifExposureMetadata.class);

	@Override
	public ExposureDuration exposureOf(File file)
	{
		try
		{
			TiffImageMetadata exif = findExif(Imaging.getMetadata(file));
			if (exif == null)
			{
				LOG.warn("{} has no EXIF metadata, counting it as a zero-length exposure", file.getName());
				return ExposureDuration.ZERO;
			}
			TiffField field = exif.findField(ExifTagConstants.EXIF_TAG_EXPOSURE_TIME);
			if (field == null)
			{
				LOG.warn("{} has no ExposureTime tag, counting it as a zero-length exposure", file.getName());
				return ExposureDuration.ZERO;
			}
			ExposureDuration duration = toDuration(field.getValue());
			if (duration == null)
			{
				LOG.warn("{} has an unusable ExposureTime value '{}', counting it as zero",
						file.getName(), field.getValueDescription());
				return ExposureDuration.ZERO;
			}
			return duration;
		}
		catch (ImagingException | RuntimeException e)
		{
			LOG.warn("Cannot read metadata of {} ({}), counting it as a zero-length exposure",
					file.getName(), e.getMessage());
			return ExposureDuration.ZERO;
		}
		catch (IOException e)
		{
			LOG.warn("Cannot open {} for metadata ({}), counting it as a zero-length exposure",
					file.getName(), e.getMessage());
			return ExposureDuration.ZERO;
		}
	}

	static TiffImageMetadata findExif(ImageMetadata metadata)
	{
		if (metadata instanceof JpegImageMetadata jpeg)
		{
			return jpeg.getExif();
		}
		if (metadata instanceof TiffImageMetadata tiff)
		{
			return tiff;
		}
		return null;
	}

	static ExposureDuration toDuration(Object value)
	{
		if (value instanceof RationalNumber[] values && values.length > 0)
		{
			value = values[0];
		}
		if (value instanceof RationalNumber rational)
		{
			if (rational.divisor == 0) return null;
			return ExposureDuration.fromRational(rational);
		}
		if (value instanceof Number number)
		{
			// Some writers store the time as a plain number; this is the only inexact path
			return ExposureDuration.fromRational(RationalNumber.valueOf(number.doubleValue()));
		}
		return null;
	}
}
