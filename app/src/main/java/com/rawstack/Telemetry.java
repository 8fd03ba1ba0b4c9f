package com.rawstack;

/**
 * One resource-utilization sample taken while the consumer waits for frames.
 *
 * @param cpuPercent    process CPU load, 0-100, or -1 when the JVM cannot report it
 * @param memoryPercent physical memory in use, 0-100
 */
public record Telemetry(double cpuPercent, double memoryPercent, int threadCount)
{
}
