package com.rawstack;

import org.apache.commons.imaging.FormatCompliance;
import org.apache.commons.imaging.ImageFormats;
import org.apache.commons.imaging.Imaging;
import org.apache.commons.imaging.ImagingException;
import org.apache.commons.imaging.bytesource.ByteSource;
import org.apache.commons.imaging.formats.tiff.TiffContents;
import org.apache.commons.imaging.formats.tiff.TiffDirectory;
import org.apache.commons.imaging.formats.tiff.TiffField;
import org.apache.commons.imaging.formats.tiff.TiffImagingParameters;
import org.apache.commons.imaging.formats.tiff.TiffReader;
import org.apache.commons.imaging.formats.tiff.constants.TiffTagConstants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;
import java.awt.image.ColorModel;
import java.awt.image.DataBuffer;
import java.awt.image.IndexColorModel;
import java.awt.image.Raster;
import java.io.File;
import java.io.IOException;

/**
 * Reads TIFF-based raw containers (DNG and friends) and ordinary image files
 * through Commons Imaging, falling back to ImageIO for embedded previews that
 * Commons Imaging cannot parse. Samples are normalized to the 8-bit scale.
 */
public class RawFrameSource implements FrameSource
{

	private static final Logger LOG = LoggerFactory.getLogger(RawFrameSource.class);

	@Override
	public PixelBuffer decode(File file) throws DecodeException
	{
		if (!file.isFile())
		{
			throw new DecodeException(file, "not a readable file");
		}
		BufferedImage image = readImage(file);
		PixelBuffer buffer = toPixelBuffer(image);
		LOG.debug("Decoded {} as {}", file.getName(), buffer.shape());
		return buffer;
	}

	private static BufferedImage readImage(File file) throws DecodeException
	{
		Exception imagingFailure = null;
		try
		{
			BufferedImage image = Imaging.guessFormat(file) == ImageFormats.TIFF
					? readFullResolutionTiff(file)
					: Imaging.getBufferedImage(file);
			if (image != null) return image;
		}
		catch (ImagingException | RuntimeException e)
		{
			// Commons Imaging rejects many vendor raw layouts; ImageIO may still find a preview
			imagingFailure = e;
		}
		catch (IOException e)
		{
			throw new DecodeException(file, e.getMessage(), e);
		}

		try
		{
			BufferedImage image = ImageIO.read(file);
			if (image != null)
			{
				LOG.debug("Commons Imaging could not read {}, used ImageIO instead", file.getName());
				return image;
			}
		}
		catch (IOException e)
		{
			DecodeException failure = new DecodeException(file, e.getMessage(), e);
			if (imagingFailure != null) failure.addSuppressed(imagingFailure);
			throw failure;
		}

		String reason = imagingFailure != null
				? "unsupported or corrupt image (" + imagingFailure.getMessage() + ")"
				: "unsupported or corrupt image";
		throw new DecodeException(file, reason, imagingFailure);
	}

	/**
	 * Raw containers usually put a small preview in the first directory and the
	 * sensor image elsewhere. Picks the largest decodable full-resolution
	 * directory, and only falls back to a reduced-resolution one with a warning.
	 */
	static BufferedImage readFullResolutionTiff(File file) throws ImagingException, IOException
	{
		TiffImagingParameters params = new TiffImagingParameters();
		TiffContents contents = new TiffReader(params.isStrict())
				.readContents(ByteSource.file(file), params, FormatCompliance.getDefault());

		BufferedImage best = null;
		boolean bestIsPreview = false;
		Exception firstFailure = null;
		for (int i = 0; i < contents.directories.size(); i++)
		{
			TiffDirectory directory = contents.directories.get(i);
			if (!directory.hasTiffImageData()) continue;
			boolean preview = isReducedResolution(directory);
			BufferedImage image;
			try
			{
				image = directory.getTiffImage(params);
			}
			catch (ImagingException | RuntimeException e)
			{
				LOG.debug("Cannot decode directory {} of {}: {}", i, file.getName(), e.getMessage());
				if (firstFailure == null) firstFailure = e;
				continue;
			}
			if (image == null) continue;
			if (best == null
					|| (bestIsPreview && !preview)
					|| (bestIsPreview == preview && area(image) > area(best)))
			{
				best = image;
				bestIsPreview = preview;
			}
		}

		if (best == null)
		{
			throw new ImagingException("No decodable image directory in " + file.getName(), firstFailure);
		}
		if (bestIsPreview)
		{
			LOG.warn("{}: only the {}x{} preview could be decoded, stacking it instead of the sensor image",
					file.getName(), best.getWidth(), best.getHeight());
		}
		return best;
	}

	private static boolean isReducedResolution(TiffDirectory directory) throws ImagingException
	{
		TiffField subfileType = directory.findField(TiffTagConstants.TIFF_TAG_NEW_SUBFILE_TYPE);
		return subfileType != null
				&& (subfileType.getIntValue() & TiffTagConstants.SUBFILE_TYPE_VALUE_REDUCED_RESOLUTION_IMAGE) != 0;
	}

	private static long area(BufferedImage image)
	{
		return (long) image.getWidth() * image.getHeight();
	}

	static PixelBuffer toPixelBuffer(BufferedImage image)
	{
		int w = image.getWidth();
		int h = image.getHeight();
		Raster raster = image.getRaster();
		ColorModel cm = image.getColorModel();

		boolean indexed = cm instanceof IndexColorModel;
		boolean gray = !indexed && cm.getColorSpace().getType() == ColorSpace.TYPE_GRAY;
		int bits = raster.getSampleModel().getSampleSize(0);
		int dataType = raster.getDataBuffer().getDataType();
		boolean floating = dataType == DataBuffer.TYPE_FLOAT || dataType == DataBuffer.TYPE_DOUBLE;
		boolean deepColor = !indexed && !gray && raster.getNumBands() >= 3 && (bits > 8 || floating);

		if (gray || deepColor)
		{
			// Read bands directly so 16-bit and float data keep their precision
			int channels = gray ? 1 : 3;
			float scale = floating ? 255f : (float) (255.0 / ((1L << bits) - 1));
			float[] samples = new float[w * h * channels];
			int i = 0;
			for (int y = 0; y < h; y++)
			{
				for (int x = 0; x < w; x++)
				{
					for (int c = 0; c < channels; c++)
					{
						samples[i++] = raster.getSampleFloat(x, y, c) * scale;
					}
				}
			}
			return PixelBuffer.wrap(w, h, channels, samples);
		}

		float[] samples = new float[w * h * 3];
		int i = 0;
		for (int y = 0; y < h; y++)
		{
			for (int x = 0; x < w; x++)
			{
				int rgb = image.getRGB(x, y);
				samples[i++] = (rgb >> 16) & 0xFF;
				samples[i++] = (rgb >> 8) & 0xFF;
				samples[i++] = rgb & 0xFF;
			}
		}
		return PixelBuffer.wrap(w, h, 3, samples);
	}
}
