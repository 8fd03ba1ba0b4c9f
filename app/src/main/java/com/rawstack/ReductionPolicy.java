package com.rawstack;

import java.util.Locale;

/**
 * The per-pixel rule used to combine frames. Chosen once per session.
 */
public enum ReductionPolicy
{
	MEAN("Mean", "Mean")
	{
		@Override
		AggregateState newState()
		{
			return new AggregateState.RunningMean();
		}
	},
	MAXIMUM("Maximum", "Maximum")
	{
		@Override
		AggregateState newState()
		{
			return new AggregateState.Extremum(true);
		}
	},
	MINIMUM("Minimum", "Minimum")
	{
		@Override
		AggregateState newState()
		{
			return new AggregateState.Extremum(false);
		}
	},
	SIGMA_CLIPPING("Sigma Clipping", "SigmaClipping")
	{
		@Override
		AggregateState newState()
		{
			return new AggregateState.SigmaClip();
		}
	};

	private final String displayName;
	private final String fileToken;

	ReductionPolicy(String displayName, String fileToken)
	{
		this.displayName = displayName;
		this.fileToken = fileToken;
	}

	abstract AggregateState newState();

	public String displayName()
	{
		return displayName;
	}

	/** Name used in generated output file names. */
	public String fileToken()
	{
		return fileToken;
	}

	/**
	 * Accepts the enum name, the display name or the file token, ignoring case,
	 * spaces, dashes and underscores ("sigma-clipping", "SigmaClipping", ...).
	 */
	public static ReductionPolicy parse(String text)
	{
		String wanted = normalize(text);
		for (ReductionPolicy policy : values())
		{
			if (normalize(policy.name()).equals(wanted)
					|| normalize(policy.displayName).equals(wanted)
					|| normalize(policy.fileToken).equals(wanted))
			{
				return policy;
			}
		}
		throw new IllegalArgumentException("Unknown reduction policy: " + text);
	}

	private static String normalize(String text)
	{
		return text.trim().toLowerCase(Locale.ROOT).replaceAll("[\\s_-]", "");
	}

	@Override
	public String toString()
	{
		return displayName;
	}
}
