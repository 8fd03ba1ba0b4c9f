package com.rawstack;

import java.util.Arrays;

/**
 * Dense height x width x channels block of float samples, stored row-major with
 * interleaved channels. Never modified after construction.
 */
public final class PixelBuffer
{

	private final int width;
	private final int height;
	private final int channels;
	private final float[] samples;

	private PixelBuffer(int width, int height, int channels, float[] samples)
	{
		if (width <= 0 || height <= 0 || channels <= 0)
		{
			throw new IllegalArgumentException("Invalid buffer shape " + width + "x" + height + "x" + channels);
		}
		if (samples.length != width * height * channels)
		{
			throw new IllegalArgumentException("Expected " + (width * height * channels)
					+ " samples for " + width + "x" + height + "x" + channels + ", got " + samples.length);
		}
		this.width = width;
		this.height = height;
		this.channels = channels;
		this.samples = samples;
	}

	public static PixelBuffer of(int width, int height, int channels, float[] samples)
	{
		return new PixelBuffer(width, height, channels, samples.clone());
	}

	public static PixelBuffer filled(int width, int height, int channels, float value)
	{
		float[] samples = new float[width * height * channels];
		Arrays.fill(samples, value);
		return new PixelBuffer(width, height, channels, samples);
	}

	// Takes ownership of the array; callers must not touch it afterwards
	static PixelBuffer wrap(int width, int height, int channels, float[] samples)
	{
		return new PixelBuffer(width, height, channels, samples);
	}

	public int width()
	{
		return width;
	}

	public int height()
	{
		return height;
	}

	public int channels()
	{
		return channels;
	}

	public int sampleCount()
	{
		return samples.length;
	}

	public float sample(int index)
	{
		return samples[index];
	}

	public float sample(int x, int y, int channel)
	{
		return samples[(y * width + x) * channels + channel];
	}

	public float[] copySamples()
	{
		return samples.clone();
	}

	// Read-only view for the aggregation loops
	float[] samples()
	{
		return samples;
	}

	public boolean sameShape(PixelBuffer other)
	{
		return width == other.width && height == other.height && channels == other.channels;
	}

	public String shape()
	{
		return width + "x" + height + "x" + channels;
	}

	@Override
	public String toString()
	{
		return "PixelBuffer[" + shape() + "]";
	}
}
