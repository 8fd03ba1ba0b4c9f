package com.rawstack;

import java.io.File;
import java.util.prefs.Preferences;

/**
 * Settings the desktop window remembers between runs.
 */
public class StackerPreferences
{
	private static final Preferences prefs = Preferences.userNodeForPackage(StackerPreferences.class);

	private static final String KEY_LAST_DIRECTORY = "last_directory";
	private static final String KEY_POLICY = "policy";
	private static final String KEY_SKIP_UNREADABLE = "skip_unreadable";
	private static final String KEY_DECODE_THREADS = "decode_threads";

	private StackerPreferences()
	{
	}

	public static File getLastDirectory()
	{
		String path = prefs.get(KEY_LAST_DIRECTORY, null);
		return path == null ? null : new File(path);
	}

	public static void setLastDirectory(File dir)
	{
		prefs.put(KEY_LAST_DIRECTORY, dir.getAbsolutePath());
	}

	public static ReductionPolicy getPolicy()
	{
		String name = prefs.get(KEY_POLICY, ReductionPolicy.MEAN.name());
		try
		{
			return ReductionPolicy.parse(name);
		}
		catch (IllegalArgumentException e)
		{
			return ReductionPolicy.MEAN;
		}
	}

	public static void setPolicy(ReductionPolicy policy)
	{
		prefs.put(KEY_POLICY, policy.name());
	}

	public static boolean isSkipUnreadable()
	{
		return prefs.getBoolean(KEY_SKIP_UNREADABLE, false);
	}

	public static void setSkipUnreadable(boolean skip)
	{
		prefs.putBoolean(KEY_SKIP_UNREADABLE, skip);
	}

	public static int getDecodeThreads()
	{
		return Math.max(1, prefs.getInt(KEY_DECODE_THREADS, 1));
	}

	public static void setDecodeThreads(int threads)
	{
		prefs.putInt(KEY_DECODE_THREADS, Math.max(1, threads));
	}
}
