package com.rawstack;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * One run of the pipeline: a producer decoding files on its own thread, the
 * aggregator consuming them on the calling thread, then the finalizer.
 */
public class StackingSession
{

	private static final Logger LOG = LoggerFactory.getLogger(StackingSession.class);

	private final List<File> files;
	private final ReductionPolicy policy;
	private final ExposureAccumulator.Summary exposure;
	private final File outputDirectory;
	private final StackingConfig config;
	private final FrameSource source;
	private final StackFinalizer finalizer;
	private final TelemetrySampler telemetry;
	private final ProgressSink sink;

	StackingSession(List<File> files, ReductionPolicy policy, ExposureAccumulator.Summary exposure,
					File outputDirectory, StackingConfig config, FrameSource source,
					StackFinalizer finalizer, TelemetrySampler telemetry, ProgressSink sink)
	{
		if (files.isEmpty())
		{
			throw new IllegalArgumentException("A session needs at least one file");
		}
		this.files = List.copyOf(files);
		this.policy = policy;
		this.exposure = exposure;
		this.outputDirectory = outputDirectory;
		this.config = config;
		this.source = source;
		this.finalizer = finalizer;
		this.telemetry = telemetry;
		this.sink = sink;
	}

	public StackResult run() throws StackingException
	{
		LOG.info("Stacking {} files with {} (exposure {} s)", files.size(), policy.displayName(),
				exposure.total().formatSeconds());
		sink.onStatus("Stacking " + files.size() + " files (" + policy.displayName() + ")");

		FrameQueue queue = new FrameQueue(config.queueCapacity());
		Aggregator aggregator = new Aggregator(policy, files.size(), sink, config);
		ExecutorService producerThread = Executors.newSingleThreadExecutor(r -> {
			Thread t = new Thread(r, "frame-producer");
			t.setDaemon(true);
			return t;
		});
		Future<Void> producer = producerThread.submit(new FrameProducer(files, exposure, source, queue,
				config.errorPolicy(), config.decodeThreads()));
		try
		{
			consume(queue, aggregator, producer);
		}
		catch (InterruptedException e)
		{
			Thread.currentThread().interrupt();
			throw new StackingException("Stacking interrupted after " + aggregator.stackedCount()
					+ " of " + files.size() + " frames", e);
		}
		finally
		{
			producer.cancel(true);
			producerThread.shutdownNow();
		}

		PixelBuffer result = aggregator.finish();
		ExposureDuration total = stackedExposure(aggregator);
		File output = new File(outputDirectory, StackFinalizer.outputFileName(files.get(0), policy, total));

		sink.onStatus("Saving " + output.getName());
		finalizer.write(result, total, output);

		StackResult stackResult = new StackResult(output, policy, aggregator.stackedCount(),
				aggregator.skippedCount(), total, result.width(), result.height());
		LOG.info("Finished: {} frames stacked, {} skipped -> {}", stackResult.stackedFrames(),
				stackResult.skippedFrames(), output);
		sink.onStatus("Finished");
		sink.onFinished(stackResult);
		return stackResult;
	}

	private void consume(FrameQueue queue, Aggregator aggregator, Future<Void> producer)
			throws StackingException, InterruptedException
	{
		while (!aggregator.isComplete())
		{
			sink.onTelemetry(telemetry.sample());
			FrameQueue.Message message = queue.poll(config.pollIntervalMillis(), TimeUnit.MILLISECONDS);
			if (message == null && producer.isDone())
			{
				// Everything the producer queued is visible now; one last look before giving up
				message = queue.poll(0, TimeUnit.MILLISECONDS);
				if (message == null)
				{
					throw producerStopped(producer, aggregator);
				}
			}
			if (message == null) continue;

			switch (message.kind())
			{
				case FRAME -> aggregator.accept(message.frame());
				case SKIPPED -> aggregator.skip(message.index(), message.file(), message.error(),
						exposure.exposureOf(message.index()));
				case FAILED -> throw message.error();
			}
		}
	}

	private ExposureDuration stackedExposure(Aggregator aggregator) throws StackingException
	{
		try
		{
			return exposure.total().minus(aggregator.skippedExposure());
		}
		catch (ArithmeticException e)
		{
			throw new StackingException("Cannot subtract skipped exposure " + aggregator.skippedExposure()
					+ " from total " + exposure.total(), e);
		}
	}

	private StackingException producerStopped(Future<Void> producer, Aggregator aggregator)
			throws InterruptedException
	{
		String progress = aggregator.stackedCount() + " of " + files.size() + " frames";
		try
		{
			producer.get();
			return new StackingException("Decoding stopped early after " + progress);
		}
		catch (ExecutionException e)
		{
			Throwable cause = e.getCause();
			while (cause instanceof ExecutionException && cause.getCause() != null)
			{
				cause = cause.getCause();
			}
			return new StackingException("Decoding failed after " + progress + ": " + cause, cause);
		}
	}
}
