package com.rawstack;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.ArrayList;
import java.util.List;

/**
 * Headless front end:
 * {@code rawstack [--policy NAME] [--skip-unreadable] [--output DIR] [--threads N] FILE...}
 */
class CommandLine
{

	private static final Logger LOG = LoggerFactory.getLogger(CommandLine.class);

	static final int EXIT_OK = 0;
	static final int EXIT_FAILED = 1;
	static final int EXIT_USAGE = 2;

	static final String USAGE = "Usage: rawstack [--policy mean|maximum|minimum|sigma-clipping]"
			+ " [--skip-unreadable] [--output DIR] [--threads N] FILE...";

	record Options(ReductionPolicy policy, StackingConfig config, List<File> files)
	{
	}

	static Options parse(String[] args)
	{
		ReductionPolicy policy = ReductionPolicy.MEAN;
		StackingConfig config = StackingConfig.defaults();
		List<File> files = new ArrayList<>();

		for (int i = 0; i < args.length; i++)
		{
			String arg = args[i];
			switch (arg)
			{
				case "--policy", "-p" -> policy = ReductionPolicy.parse(valueOf(args, ++i, arg));
				case "--skip-unreadable" -> config = config.withErrorPolicy(DecodeErrorPolicy.SKIP);
				case "--output", "-o" -> config = config.withOutputDirectory(new File(valueOf(args, ++i, arg)));
				case "--threads", "-t" ->
				{
					String value = valueOf(args, ++i, arg);
					try
					{
						config = config.withDecodeThreads(Integer.parseInt(value));
					}
					catch (NumberFormatException e)
					{
						throw new IllegalArgumentException("--threads expects a number, got " + value);
					}
				}
				default ->
				{
					if (arg.startsWith("-"))
					{
						throw new IllegalArgumentException("Unknown option: " + arg);
					}
					files.add(new File(arg));
				}
			}
		}
		return new Options(policy, config, files);
	}

	private static String valueOf(String[] args, int index, String option)
	{
		if (index >= args.length)
		{
			throw new IllegalArgumentException(option + " needs a value");
		}
		return args[index];
	}

	static int run(String[] args)
	{
		Options options;
		try
		{
			options = parse(args);
		}
		catch (IllegalArgumentException e)
		{
			System.err.println(e.getMessage());
			System.err.println(USAGE);
			return EXIT_USAGE;
		}

		File outputDir = options.config().outputDirectory();
		if (outputDir != null && !outputDir.isDirectory())
		{
			System.err.println("Output directory does not exist: " + outputDir);
			return EXIT_USAGE;
		}

		try
		{
			new Stacker(options.config()).stack(options.files(), options.policy(), new LoggingProgressSink());
			return EXIT_OK;
		}
		catch (StackingException e)
		{
			LOG.error("Stacking failed: {}", e.getMessage(), e);
			return EXIT_FAILED;
		}
	}
}
