package com.rawstack;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.ArrayList;
import java.util.List;

/**
 * Sums the exposure of every selected file exactly. Computed once, before any
 * frame is decoded.
 */
public class ExposureAccumulator
{

	private static final Logger LOG = LoggerFactory.getLogger(ExposureAccumulator.class);

	public record Summary(List<ExposureDuration> perFile, ExposureDuration total)
	{
		public Summary
		{
			perFile = List.copyOf(perFile);
		}

		public ExposureDuration exposureOf(int index)
		{
			return perFile.get(index);
		}
	}

	private final ExposureMetadata metadata;

	public ExposureAccumulator(ExposureMetadata metadata)
	{
		this.metadata = metadata;
	}

	public Summary summarize(List<File> files) throws StackingException
	{
		List<ExposureDuration> perFile = new ArrayList<>(files.size());
		ExposureDuration total = ExposureDuration.ZERO;
		for (File file : files)
		{
			ExposureDuration exposure = metadata.exposureOf(file);
			if (exposure == null)
			{
				exposure = ExposureDuration.ZERO;
			}
			perFile.add(exposure);
			try
			{
				total = total.plus(exposure);
			}
			catch (ArithmeticException e)
			{
				throw new StackingException("Total exposure overflows when adding " + file.getName()
						+ " (" + exposure + " s to " + total + " s)", e);
			}
		}
		LOG.info("Total exposure of {} files: {} s ({})", files.size(), total.formatSeconds(), total);
		return new Summary(perFile, total);
	}
}
