package com.rawstack;

import java.io.File;

public record StackResult(
	File output,
	ReductionPolicy policy,
	int stackedFrames,
	int skippedFrames,
	ExposureDuration totalExposure,
	int width,
	int height)
{
}
