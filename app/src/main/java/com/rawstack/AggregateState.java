package com.rawstack;

import java.util.ArrayList;
import java.util.List;

/**
 * Policy-specific accumulator. Owned and mutated by the consumer thread only.
 */
abstract class AggregateState
{

	private int seen;

	final void add(PixelBuffer buffer)
	{
		seen++;
		incorporate(buffer, seen);
	}

	final int seen()
	{
		return seen;
	}

	abstract void incorporate(PixelBuffer buffer, int n);

	/**
	 * @return the current running value, or null if the policy has none before
	 *         {@link #finish()}
	 */
	abstract PixelBuffer snapshot();

	abstract PixelBuffer finish();

	// --- Mean ---

	static final class RunningMean extends AggregateState
	{
		private PixelBuffer shape;
		private double[] running;

		@Override
		void incorporate(PixelBuffer buffer, int n)
		{
			float[] samples = buffer.samples();
			if (running == null)
			{
				shape = buffer;
				running = new double[samples.length];
				for (int i = 0; i < samples.length; i++)
				{
					running[i] = samples[i];
				}
				return;
			}
			for (int i = 0; i < samples.length; i++)
			{
				running[i] = (running[i] * (n - 1) + samples[i]) / n;
			}
		}

		@Override
		PixelBuffer snapshot()
		{
			if (running == null) return null;
			float[] out = new float[running.length];
			for (int i = 0; i < running.length; i++)
			{
				out[i] = (float) running[i];
			}
			return PixelBuffer.wrap(shape.width(), shape.height(), shape.channels(), out);
		}

		@Override
		PixelBuffer finish()
		{
			return snapshot();
		}
	}

	// --- Maximum / Minimum ---

	static final class Extremum extends AggregateState
	{
		private final boolean maximum;
		private PixelBuffer shape;
		private float[] running;

		Extremum(boolean maximum)
		{
			this.maximum = maximum;
		}

		@Override
		void incorporate(PixelBuffer buffer, int n)
		{
			if (running == null)
			{
				shape = buffer;
				running = buffer.copySamples();
				return;
			}
			float[] samples = buffer.samples();
			for (int i = 0; i < samples.length; i++)
			{
				running[i] = maximum ? Math.max(running[i], samples[i]) : Math.min(running[i], samples[i]);
			}
		}

		@Override
		PixelBuffer snapshot()
		{
			if (running == null) return null;
			return PixelBuffer.wrap(shape.width(), shape.height(), shape.channels(), running.clone());
		}

		@Override
		PixelBuffer finish()
		{
			return snapshot();
		}
	}

	// --- Sigma clipping: keeps every frame until the end ---

	static final class SigmaClip extends AggregateState
	{
		private final List<PixelBuffer> retained = new ArrayList<>();

		@Override
		void incorporate(PixelBuffer buffer, int n)
		{
			retained.add(buffer);
		}

		@Override
		PixelBuffer snapshot()
		{
			return null;
		}

		@Override
		PixelBuffer finish()
		{
			if (retained.isEmpty()) return null;
			PixelBuffer result = SigmaClipper.clip(retained, SigmaClipper.THRESHOLD);
			retained.clear();
			return result;
		}
	}
}
