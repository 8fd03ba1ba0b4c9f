package com.rawstack;

import org.apache.commons.imaging.ImagingException;
import org.apache.commons.imaging.common.RationalNumber;
import org.apache.commons.imaging.formats.tiff.TiffImageParser;
import org.apache.commons.imaging.formats.tiff.TiffImagingParameters;
import org.apache.commons.imaging.formats.tiff.constants.ExifTagConstants;
import org.apache.commons.imaging.formats.tiff.write.TiffOutputDirectory;
import org.apache.commons.imaging.formats.tiff.write.TiffOutputSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.awt.image.WritableRaster;
import java.io.BufferedOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.util.Locale;

/**
 * Turns the final aggregate into an 8-bit TIFF carrying the summed exposure as
 * its EXIF ExposureTime.
 */
public class StackFinalizer
{

	private static final Logger LOG = LoggerFactory.getLogger(StackFinalizer.class);

	public static final String OUTPUT_EXTENSION = "tiff";

	/**
	 * {@code <first-input-basename>_<policy>_<seconds>s.tiff}, seconds with two
	 * decimals.
	 */
	public static String outputFileName(File firstInput, ReductionPolicy policy, ExposureDuration totalExposure)
	{
		String name = firstInput.getName();
		int dot = name.lastIndexOf('.');
		String base = dot > 0 ? name.substring(0, dot) : name;
		return String.format(Locale.ROOT, "%s_%s_%ss.%s",
				base, policy.fileToken(), totalExposure.formatSeconds(), OUTPUT_EXTENSION);
	}

	static int toOutputSample(float value)
	{
		if (Float.isNaN(value) || value <= 0f) return 0;
		if (value >= 255f) return 255;
		return Math.round(value);
	}

	static BufferedImage toImage(PixelBuffer buffer)
	{
		int w = buffer.width();
		int h = buffer.height();
		int channels = buffer.channels();

		if (channels < 3)
		{
			BufferedImage gray = new BufferedImage(w, h, BufferedImage.TYPE_BYTE_GRAY);
			WritableRaster raster = gray.getRaster();
			for (int y = 0; y < h; y++)
			{
				for (int x = 0; x < w; x++)
				{
					raster.setSample(x, y, 0, toOutputSample(buffer.sample(x, y, 0)));
				}
			}
			return gray;
		}

		BufferedImage rgb = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
		for (int y = 0; y < h; y++)
		{
			for (int x = 0; x < w; x++)
			{
				int r = toOutputSample(buffer.sample(x, y, 0));
				int g = toOutputSample(buffer.sample(x, y, 1));
				int b = toOutputSample(buffer.sample(x, y, 2));
				rgb.setRGB(x, y, (r << 16) | (g << 8) | b);
			}
		}
		return rgb;
	}

	static BufferedImage thumbnail(PixelBuffer buffer, int maxEdge)
	{
		BufferedImage full = toImage(buffer);
		int w = full.getWidth();
		int h = full.getHeight();
		double scale = Math.min(1.0, (double) maxEdge / Math.max(w, h));
		if (scale >= 1.0) return full;

		int dstW = Math.max(1, (int) Math.round(w * scale));
		int dstH = Math.max(1, (int) Math.round(h * scale));
		BufferedImage small = new BufferedImage(dstW, dstH, full.getType());
		Graphics2D g = small.createGraphics();
		try
		{
			g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
			g.drawImage(full, 0, 0, dstW, dstH, null);
		}
		finally
		{
			g.dispose();
		}
		return small;
	}

	public void write(PixelBuffer result, ExposureDuration totalExposure, File target) throws PersistenceException
	{
		BufferedImage image = toImage(result);
		try
		{
			TiffOutputSet outputSet = new TiffOutputSet();
			TiffOutputDirectory exif = outputSet.getOrCreateExifDirectory();
			RationalNumber exposureTime = totalExposure.toRational();
			if (!totalExposure.fitsRational())
			{
				LOG.warn("Total exposure {} does not fit an EXIF rational, {} records it as {}/{} ({} s)",
						totalExposure, target.getName(), exposureTime.numerator, exposureTime.divisor,
						totalExposure.formatSeconds());
			}
			exif.add(ExifTagConstants.EXIF_TAG_EXPOSURE_TIME, exposureTime);

			TiffImagingParameters params = new TiffImagingParameters();
			params.setOutputSet(outputSet);

			try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(target.toPath())))
			{
				new TiffImageParser().writeImage(image, out, params);
			}
		}
		catch (ImagingException e)
		{
			throw new PersistenceException(target, e);
		}
		catch (IOException e)
		{
			throw new PersistenceException(target, e);
		}
		LOG.info("Wrote {} ({}x{}, exposure {} s)", target, image.getWidth(), image.getHeight(), totalExposure);
	}
}
