package com.rawstack;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Folds decoded frames into the session's aggregate, one at a time, on the
 * consumer thread. Also drives the per-frame progress and preview updates.
 */
public class Aggregator
{

	private static final Logger LOG = LoggerFactory.getLogger(Aggregator.class);

	private final ReductionPolicy policy;
	private final AggregateState state;
	private final int total;
	private final ProgressSink sink;
	private final int previewInterval;
	private final int previewMaxEdge;

	private PixelBuffer reference;
	private int handled;
	private int skipped;
	private ExposureDuration skippedExposure = ExposureDuration.ZERO;
	private boolean finished;

	public Aggregator(ReductionPolicy policy, int total, ProgressSink sink, StackingConfig config)
	{
		if (total <= 0)
		{
			throw new IllegalArgumentException("Nothing to aggregate: total = " + total);
		}
		this.policy = policy;
		this.state = policy.newState();
		this.total = total;
		this.sink = sink;
		this.previewInterval = config.previewInterval();
		this.previewMaxEdge = config.previewMaxEdge();
	}

	public void accept(FrameRecord record) throws DimensionMismatchException
	{
		checkOpen();
		PixelBuffer buffer = record.buffer();
		if (reference == null)
		{
			reference = buffer;
		}
		else if (!reference.sameShape(buffer))
		{
			throw new DimensionMismatchException(record.index(), record.file(), reference, buffer);
		}

		state.add(buffer);
		handled++;
		LOG.debug("Stacked frame {} ({}) [{}/{}]", record.index() + 1, record.file().getName(), handled, total);
		sink.onProgress(handled, total);

		if (state.seen() % previewInterval == 0 || isComplete())
		{
			pushPreview(state.snapshot());
		}
	}

	public void skip(int index, File file, DecodeException error, ExposureDuration exposure)
			throws StackingException
	{
		checkOpen();
		try
		{
			skippedExposure = skippedExposure.plus(exposure);
		}
		catch (ArithmeticException e)
		{
			throw new StackingException("Exposure of skipped frames overflows at " + file.getName(), e);
		}
		handled++;
		skipped++;
		LOG.warn("Skipping frame {} ({}): {}", index + 1, file.getName(), error.getMessage());
		sink.onFrameSkipped(file, error);
		sink.onProgress(handled, total);

		if (isComplete() && state.seen() > 0)
		{
			pushPreview(state.snapshot());
		}
	}

	public boolean isComplete()
	{
		return handled == total;
	}

	/**
	 * Produces the final aggregate. Only legal once every selected file has
	 * been stacked or skipped.
	 */
	public PixelBuffer finish() throws StackingException
	{
		if (!isComplete())
		{
			throw new IllegalStateException("Aggregate incomplete: " + handled + " of " + total + " frames handled");
		}
		checkOpen();
		finished = true;
		if (state.seen() == 0)
		{
			throw new StackingException("No frames could be decoded (" + skipped + " of " + total + " skipped)");
		}
		PixelBuffer result = state.finish();
		if (policy == ReductionPolicy.SIGMA_CLIPPING)
		{
			pushPreview(result);
		}
		return result;
	}

	private void pushPreview(PixelBuffer running)
	{
		if (running == null) return;
		sink.onPreview(StackFinalizer.thumbnail(running, previewMaxEdge));
	}

	private void checkOpen()
	{
		if (finished)
		{
			throw new IllegalStateException("Aggregate already finalized");
		}
	}

	public ReductionPolicy policy()
	{
		return policy;
	}

	public int stackedCount()
	{
		return state.seen();
	}

	public int skippedCount()
	{
		return skipped;
	}

	public ExposureDuration skippedExposure()
	{
		return skippedExposure;
	}
}
