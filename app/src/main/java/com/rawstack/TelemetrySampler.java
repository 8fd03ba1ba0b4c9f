package com.rawstack;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.lang.management.ThreadMXBean;

/**
 * Samples CPU, memory and thread counts through the platform MXBeans.
 */
public class TelemetrySampler
{

	private final OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
	private final ThreadMXBean threads = ManagementFactory.getThreadMXBean();

	public Telemetry sample()
	{
		double cpu = -1;
		double memory;
		if (os instanceof com.sun.management.OperatingSystemMXBean platform)
		{
			double load = platform.getProcessCpuLoad();
			cpu = load < 0 ? -1 : load * 100.0;
			long total = platform.getTotalMemorySize();
			long free = platform.getFreeMemorySize();
			memory = total > 0 ? (total - free) * 100.0 / total : heapPercent();
		}
		else
		{
			memory = heapPercent();
		}
		return new Telemetry(cpu, memory, threads.getThreadCount());
	}

	private static double heapPercent()
	{
		Runtime runtime = Runtime.getRuntime();
		long used = runtime.totalMemory() - runtime.freeMemory();
		return used * 100.0 / runtime.maxMemory();
	}
}
