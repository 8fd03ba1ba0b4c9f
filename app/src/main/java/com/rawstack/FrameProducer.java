package com.rawstack;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Decodes the selected files and feeds the results into the frame queue.
 * With one decode thread files are read strictly in selection order; with
 * more, frames are queued in completion order.
 */
class FrameProducer implements Callable<Void>
{

	private static final Logger LOG = LoggerFactory.getLogger(FrameProducer.class);

	private final List<File> files;
	private final ExposureAccumulator.Summary exposure;
	private final FrameSource source;
	private final FrameQueue queue;
	private final DecodeErrorPolicy errorPolicy;
	private final int decodeThreads;

	FrameProducer(List<File> files, ExposureAccumulator.Summary exposure, FrameSource source,
				  FrameQueue queue, DecodeErrorPolicy errorPolicy, int decodeThreads)
	{
		this.files = files;
		this.exposure = exposure;
		this.source = source;
		this.queue = queue;
		this.errorPolicy = errorPolicy;
		this.decodeThreads = decodeThreads;
	}

	@Override
	public Void call() throws Exception
	{
		if (decodeThreads <= 1 || files.size() == 1)
		{
			produceSequentially();
		}
		else
		{
			produceConcurrently();
		}
		return null;
	}

	private void produceSequentially() throws InterruptedException
	{
		for (int i = 0; i < files.size(); i++)
		{
			FrameQueue.Message message = decode(i);
			queue.put(message);
			if (message.kind() == FrameQueue.Kind.FAILED) return;
		}
	}

	private void produceConcurrently() throws Exception
	{
		AtomicInteger threadIds = new AtomicInteger();
		ExecutorService pool = Executors.newFixedThreadPool(decodeThreads, r -> {
			Thread t = new Thread(r, "frame-decoder-" + threadIds.incrementAndGet());
			t.setDaemon(true);
			return t;
		});
		try
		{
			CompletionService<FrameQueue.Message> completion = new ExecutorCompletionService<>(pool);
			int next = 0;
			int inFlight = 0;
			// Keep at most decodeThreads decodes outstanding so memory stays bounded
			while (next < files.size() && inFlight < decodeThreads)
			{
				int index = next++;
				completion.submit(() -> decode(index));
				inFlight++;
			}
			while (inFlight > 0)
			{
				FrameQueue.Message message = completion.take().get();
				inFlight--;
				queue.put(message);
				if (message.kind() == FrameQueue.Kind.FAILED) return;
				if (next < files.size())
				{
					int index = next++;
					completion.submit(() -> decode(index));
					inFlight++;
				}
			}
		}
		finally
		{
			pool.shutdownNow();
		}
	}

	private FrameQueue.Message decode(int index)
	{
		File file = files.get(index);
		try
		{
			PixelBuffer buffer = source.decode(file);
			return FrameQueue.Message.frame(new FrameRecord(index, file, buffer, exposure.exposureOf(index)));
		}
		catch (DecodeException e)
		{
			if (errorPolicy == DecodeErrorPolicy.SKIP)
			{
				return FrameQueue.Message.skipped(index, file, e);
			}
			LOG.error("Aborting: {}", e.getMessage());
			return FrameQueue.Message.failed(index, file, e);
		}
	}
}
