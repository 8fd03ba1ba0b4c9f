package com.rawstack;

import java.awt.image.BufferedImage;
import java.io.File;

/**
 * Receives everything a session reports while it runs. All calls arrive on the
 * session's consumer thread; implementations that drive a UI must hop to
 * their own thread.
 */
public interface ProgressSink
{

	ProgressSink NONE = new ProgressSink()
	{
	};

	default void onStatus(String message)
	{
	}

	/**
	 * Called once per handled file. {@code processed} rises by exactly one per
	 * call and reaches {@code total} on the last call.
	 */
	default void onProgress(int processed, int total)
	{
	}

	default void onTelemetry(Telemetry telemetry)
	{
	}

	default void onPreview(BufferedImage preview)
	{
	}

	default void onFrameSkipped(File file, DecodeException error)
	{
	}

	default void onFinished(StackResult result)
	{
	}

	static int percent(int processed, int total)
	{
		return total <= 0 ? 0 : (int) ((processed * 100L) / total);
	}
}
