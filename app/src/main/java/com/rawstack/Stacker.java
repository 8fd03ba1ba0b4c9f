package com.rawstack;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.List;
import java.util.Optional;

/**
 * Entry point for stacking a selection of files: resolves the total exposure,
 * then runs one {@link StackingSession}.
 */
public class Stacker
{

	private static final Logger LOG = LoggerFactory.getLogger(Stacker.class);

	public static final String NO_FILES_SELECTED = "No files selected";

	private final FrameSource source;
	private final ExposureMetadata metadata;
	private final StackFinalizer finalizer;
	private final StackingConfig config;

	public Stacker(StackingConfig config)
	{
		this(new RawFrameSource(), new ExifExposureMetadata(), new StackFinalizer(), config);
	}

	public Stacker(FrameSource source, ExposureMetadata metadata, StackFinalizer finalizer, StackingConfig config)
	{
		this.source = source;
		this.metadata = metadata;
		this.finalizer = finalizer;
		this.config = config;
	}

	/**
	 * @return the result, or empty when {@code files} is empty (nothing is
	 *         decoded and the sink is told no files were selected)
	 */
	public Optional<StackResult> stack(List<File> files, ReductionPolicy policy, ProgressSink sink)
			throws StackingException
	{
		if (files == null || files.isEmpty())
		{
			LOG.info(NO_FILES_SELECTED);
			sink.onStatus(NO_FILES_SELECTED);
			return Optional.empty();
		}

		sink.onStatus("Reading exposure times");
		ExposureAccumulator.Summary exposure = new ExposureAccumulator(metadata).summarize(files);

		File outputDirectory = config.outputDirectory();
		if (outputDirectory == null)
		{
			outputDirectory = files.get(0).getAbsoluteFile().getParentFile();
		}

		StackingSession session = new StackingSession(files, policy, exposure, outputDirectory, config,
				source, finalizer, new TelemetrySampler(), sink);
		return Optional.of(session.run());
	}
}
