package com.rawstack;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Progress reporting for the command line: everything goes to the log.
 */
class LoggingProgressSink implements ProgressSink
{

	private static final Logger LOG = LoggerFactory.getLogger(LoggingProgressSink.class);

	private int lastReportedPercent = -10;

	@Override
	public void onStatus(String message)
	{
		LOG.info(message);
	}

	@Override
	public void onProgress(int processed, int total)
	{
		int pct = ProgressSink.percent(processed, total);
		// Log every tenth percent, not every frame
		if (pct / 10 != lastReportedPercent / 10 || processed == total)
		{
			lastReportedPercent = pct;
			LOG.info("{}/{} frames ({}%)", processed, total, pct);
		}
	}

	@Override
	public void onTelemetry(Telemetry telemetry)
	{
		if (LOG.isTraceEnabled())
		{
			LOG.trace("cpu {}%, memory {}%, {} threads", String.format("%.0f", telemetry.cpuPercent()),
					String.format("%.0f", telemetry.memoryPercent()), telemetry.threadCount());
		}
	}

	@Override
	public void onFrameSkipped(File file, DecodeException error)
	{
		LOG.warn("Skipped {}: {}", file, error.getMessage());
	}

	@Override
	public void onFinished(StackResult result)
	{
		LOG.info("Saved {} ({} frames, {} skipped, total exposure {} s)", result.output(),
				result.stackedFrames(), result.skippedFrames(), result.totalExposure().formatSeconds());
	}
}
