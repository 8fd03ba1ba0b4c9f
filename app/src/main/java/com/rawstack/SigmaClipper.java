package com.rawstack;

import java.util.List;

final class SigmaClipper
{

	/** Samples further than this many standard deviations from the pixel mean are rejected. */
	static final double THRESHOLD = 2.0;

	private SigmaClipper()
	{
	}

	/**
	 * Per-pixel mean over the frames after rejecting outliers. Uses the
	 * population standard deviation of each pixel's samples. A pixel whose
	 * samples are all rejected becomes 0.
	 */
	static PixelBuffer clip(List<PixelBuffer> frames, double threshold)
	{
		if (frames.isEmpty())
		{
			throw new IllegalArgumentException("No frames to clip");
		}
		PixelBuffer first = frames.get(0);
		int n = frames.size();
		float[][] data = new float[n][];
		for (int f = 0; f < n; f++)
		{
			data[f] = frames.get(f).samples();
		}

		int size = first.sampleCount();
		float[] out = new float[size];
		for (int i = 0; i < size; i++)
		{
			double sum = 0;
			for (int f = 0; f < n; f++)
			{
				sum += data[f][i];
			}
			double mean = sum / n;

			double squares = 0;
			for (int f = 0; f < n; f++)
			{
				double d = data[f][i] - mean;
				squares += d * d;
			}
			double limit = threshold * Math.sqrt(squares / n);

			double kept = 0;
			int keptCount = 0;
			for (int f = 0; f < n; f++)
			{
				if (Math.abs(data[f][i] - mean) <= limit)
				{
					kept += data[f][i];
					keptCount++;
				}
			}
			out[i] = keptCount == 0 ? 0f : (float) (kept / keptCount);
		}
		return PixelBuffer.wrap(first.width(), first.height(), first.channels(), out);
	}
}
