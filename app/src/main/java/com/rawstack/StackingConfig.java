package com.rawstack;

import java.io.File;

/**
 * Tuning knobs of a stacking session. Immutable; use the {@code withX} copies.
 *
 * @param outputDirectory where the stacked image goes; null means next to the
 *                        first input file
 */
public record StackingConfig(
	int queueCapacity,
	long pollIntervalMillis,
	int previewInterval,
	int previewMaxEdge,
	int decodeThreads,
	DecodeErrorPolicy errorPolicy,
	File outputDirectory)
{

	public static final int DEFAULT_QUEUE_CAPACITY = 8;
	public static final long DEFAULT_POLL_INTERVAL_MILLIS = 200;
	public static final int DEFAULT_PREVIEW_INTERVAL = 100;
	public static final int DEFAULT_PREVIEW_MAX_EDGE = 256;

	public StackingConfig
	{
		if (queueCapacity < 1) throw new IllegalArgumentException("queueCapacity must be >= 1");
		if (pollIntervalMillis < 1) throw new IllegalArgumentException("pollIntervalMillis must be >= 1");
		if (previewInterval < 1) throw new IllegalArgumentException("previewInterval must be >= 1");
		if (previewMaxEdge < 1) throw new IllegalArgumentException("previewMaxEdge must be >= 1");
		if (decodeThreads < 1) throw new IllegalArgumentException("decodeThreads must be >= 1");
		if (errorPolicy == null) throw new IllegalArgumentException("errorPolicy must not be null");
	}

	public static StackingConfig defaults()
	{
		return new StackingConfig(DEFAULT_QUEUE_CAPACITY, DEFAULT_POLL_INTERVAL_MILLIS,
				DEFAULT_PREVIEW_INTERVAL, DEFAULT_PREVIEW_MAX_EDGE, 1, DecodeErrorPolicy.ABORT, null);
	}

	public StackingConfig withQueueCapacity(int capacity)
	{
		return new StackingConfig(capacity, pollIntervalMillis, previewInterval, previewMaxEdge,
				decodeThreads, errorPolicy, outputDirectory);
	}

	public StackingConfig withPollIntervalMillis(long millis)
	{
		return new StackingConfig(queueCapacity, millis, previewInterval, previewMaxEdge,
				decodeThreads, errorPolicy, outputDirectory);
	}

	public StackingConfig withPreviewInterval(int interval)
	{
		return new StackingConfig(queueCapacity, pollIntervalMillis, interval, previewMaxEdge,
				decodeThreads, errorPolicy, outputDirectory);
	}

	public StackingConfig withDecodeThreads(int threads)
	{
		return new StackingConfig(queueCapacity, pollIntervalMillis, previewInterval, previewMaxEdge,
				threads, errorPolicy, outputDirectory);
	}

	public StackingConfig withErrorPolicy(DecodeErrorPolicy policy)
	{
		return new StackingConfig(queueCapacity, pollIntervalMillis, previewInterval, previewMaxEdge,
				decodeThreads, policy, outputDirectory);
	}

	public StackingConfig withOutputDirectory(File directory)
	{
		return new StackingConfig(queueCapacity, pollIntervalMillis, previewInterval, previewMaxEdge,
				decodeThreads, errorPolicy, directory);
	}
}
