package com.rawstack;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class StackerTest
{

	@TempDir
	Path tempDir;

	/** Frames keyed by file name; names missing from the map fail to decode. */
	private final Map<String, PixelBuffer> frames = new HashMap<>();
	private final FrameSource source = file -> {
		PixelBuffer buffer = frames.get(file.getName());
		if (buffer == null)
		{
			throw new DecodeException(file, "corrupt test frame");
		}
		return buffer;
	};
	private final ExposureMetadata hundredth = file -> ExposureDuration.of(1, 100);

	private File frame(String name, PixelBuffer buffer)
	{
		frames.put(name, buffer);
		return new File(tempDir.toFile(), name);
	}

	private List<File> constantFrames(int count, float value)
	{
		List<File> files = new ArrayList<>();
		for (int i = 0; i < count; i++)
		{
			files.add(frame(String.format("IMG_%04d.dng", i), PixelBuffer.filled(4, 3, 3, value)));
		}
		return files;
	}

	private Stacker stacker(StackingConfig config)
	{
		return new Stacker(source, hundredth, new StackFinalizer(), config.withOutputDirectory(tempDir.toFile()));
	}

	private Stacker stacker()
	{
		return stacker(StackingConfig.defaults());
	}

	private static PixelBuffer readBack(StackResult result) throws DecodeException
	{
		return new RawFrameSource().decode(result.output());
	}

	// --- Whole pipeline ---

	@Test
	void constantFramesStackToTheSameConstant() throws Exception
	{
		for (ReductionPolicy policy : ReductionPolicy.values())
		{
			frames.clear();
			List<File> files = constantFrames(5, 77f);
			StackResult result = stacker().stack(files, policy, ProgressSink.NONE).orElseThrow();

			PixelBuffer output = readBack(result);
			assertEquals("4x3x3", output.shape(), policy.name());
			for (int i = 0; i < output.sampleCount(); i++)
			{
				assertEquals(77f, output.sample(i), 0f, policy + " sample " + i);
			}
		}
	}

	@Test
	void resultDoesNotDependOnFrameOrder() throws Exception
	{
		float[][] values = {{10f, 200f}, {40f, 0f}, {100f, 13f}, {3f, 91f}, {250f, 250f}, {12f, 5f}};
		List<File> files = new ArrayList<>();
		for (int i = 0; i < values.length; i++)
		{
			files.add(frame("f" + i + ".dng", PixelBuffer.of(2, 1, 1, values[i])));
		}
		List<File> shuffled = new ArrayList<>(files);
		Collections.shuffle(shuffled, new Random(7));

		for (ReductionPolicy policy : ReductionPolicy.values())
		{
			PixelBuffer inOrder = readBack(stacker().stack(files, policy, ProgressSink.NONE).orElseThrow());
			PixelBuffer reordered = readBack(stacker().stack(shuffled, policy, ProgressSink.NONE).orElseThrow());
			assertArrayEquals(inOrder.copySamples(), reordered.copySamples(), 0f, policy.name());
		}
	}

	@Test
	void outputIsClampedToByteRange() throws Exception
	{
		List<File> files = List.of(
				frame("a.dng", PixelBuffer.of(2, 1, 3, new float[]{300f, -20f, 128.4f, 999f, 254.6f, 0.4f})),
				frame("b.dng", PixelBuffer.of(2, 1, 3, new float[]{280f, -5f, 10f, 260f, 1f, 0f})));

		PixelBuffer output = readBack(stacker().stack(files, ReductionPolicy.MAXIMUM, ProgressSink.NONE).orElseThrow());

		assertArrayEquals(new float[]{255f, 0f, 128f, 255f, 255f, 0f}, output.copySamples(), 0f);
	}

	@Test
	void meanOfDistinctFrames() throws Exception
	{
		List<File> files = List.of(
				frame("a.dng", PixelBuffer.filled(2, 2, 3, 10f)),
				frame("b.dng", PixelBuffer.filled(2, 2, 3, 20f)),
				frame("c.dng", PixelBuffer.filled(2, 2, 3, 60f)));

		PixelBuffer output = readBack(stacker().stack(files, ReductionPolicy.MEAN, ProgressSink.NONE).orElseThrow());

		assertEquals(30f, output.sample(0), 0f);
		assertEquals(30f, output.sample(output.sampleCount() - 1), 0f);
	}

	@Test
	void sigmaClippingDropsHotFrame() throws Exception
	{
		List<File> files = new ArrayList<>();
		for (int i = 0; i < 9; i++)
		{
			files.add(frame("dark" + i + ".dng", PixelBuffer.filled(3, 3, 3, 100f)));
		}
		files.add(frame("satellite.dng", PixelBuffer.filled(3, 3, 3, 255f)));

		PixelBuffer output = readBack(stacker().stack(files, ReductionPolicy.SIGMA_CLIPPING, ProgressSink.NONE)
				.orElseThrow());

		assertEquals(100f, output.sample(4), 0f);
	}

	// --- Exposure ---

	@Test
	void exposureIsSummedExactlyAndWrittenToTheOutput() throws Exception
	{
		List<File> files = constantFrames(3, 50f);
		StackResult result = stacker().stack(files, ReductionPolicy.MEAN, ProgressSink.NONE).orElseThrow();

		assertEquals(ExposureDuration.of(3, 100), result.totalExposure());
		assertEquals("IMG_0000_Mean_0.03s.tiff", result.output().getName());
		assertEquals(tempDir.toFile(), result.output().getParentFile());
		assertEquals(ExposureDuration.of(3, 100), new ExifExposureMetadata().exposureOf(result.output()));
	}

	@Test
	void thousandTenthSecondFramesMakeOneHundredSeconds() throws Exception
	{
		List<File> files = constantFrames(1000, 1f);
		Stacker stacker = new Stacker(source, file -> ExposureDuration.of(1, 10), new StackFinalizer(),
				StackingConfig.defaults().withOutputDirectory(tempDir.toFile()));

		StackResult result = stacker.stack(files, ReductionPolicy.MAXIMUM, ProgressSink.NONE).orElseThrow();

		assertEquals(ExposureDuration.ofSeconds(100), result.totalExposure());
		assertEquals("IMG_0000_Maximum_100.00s.tiff", result.output().getName());
	}

	@Test
	void missingExposureCountsAsZero() throws Exception
	{
		List<File> files = constantFrames(2, 50f);
		Stacker stacker = new Stacker(source, file -> ExposureDuration.ZERO, new StackFinalizer(),
				StackingConfig.defaults().withOutputDirectory(tempDir.toFile()));

		StackResult result = stacker.stack(files, ReductionPolicy.MINIMUM, ProgressSink.NONE).orElseThrow();

		assertTrue(result.totalExposure().isZero());
		assertEquals("IMG_0000_Minimum_0.00s.tiff", result.output().getName());
	}

	// --- Progress ---

	@Test
	void emptySelectionDoesNothing() throws Exception
	{
		RecordingSink sink = new RecordingSink();

		Optional<StackResult> result = stacker().stack(List.of(), ReductionPolicy.MEAN, sink);

		assertTrue(result.isEmpty());
		assertEquals(List.of(Stacker.NO_FILES_SELECTED), sink.statuses);
		assertTrue(sink.processed.isEmpty());
		assertTrue(sink.previews.isEmpty());
		assertTrue(sink.finished.isEmpty());
		assertEquals(0, sink.telemetrySamples);
		assertEquals(0, tempDir.toFile().listFiles().length);
	}

	@Test
	void progressRisesByOneAndReachesTotalOnce() throws Exception
	{
		RecordingSink sink = new RecordingSink();
		List<File> files = constantFrames(25, 9f);

		StackResult result = stacker(StackingConfig.defaults().withQueueCapacity(2))
				.stack(files, ReductionPolicy.MEAN, sink).orElseThrow();

		assertEquals(25, sink.processed.size());
		for (int i = 0; i < 25; i++)
		{
			assertEquals(i + 1, sink.processed.get(i));
			assertEquals(25, sink.totals.get(i));
		}
		assertTrue(sink.telemetrySamples >= 1);
		// only the last frame triggers a preview below the 100 frame cadence
		assertEquals(1, sink.previews.size());
		assertEquals(List.of(result), sink.finished);
		assertEquals("Finished", sink.statuses.get(sink.statuses.size() - 1));
	}

	@Test
	void previewCadenceOverWholeSession() throws Exception
	{
		RecordingSink sink = new RecordingSink();
		List<File> files = constantFrames(250, 9f);

		stacker().stack(files, ReductionPolicy.MINIMUM, sink);

		assertEquals(3, sink.previews.size());
	}

	// --- Failures ---

	@Test
	void unreadableFrameAbortsByDefault()
	{
		List<File> files = new ArrayList<>(constantFrames(3, 9f));
		files.add(1, new File(tempDir.toFile(), "broken.dng"));
		RecordingSink sink = new RecordingSink();

		DecodeException e = assertThrows(DecodeException.class,
				() -> stacker().stack(files, ReductionPolicy.MEAN, sink));

		assertEquals("broken.dng", e.getFile().getName());
		assertTrue(sink.finished.isEmpty());
		assertEquals(0, tempDir.toFile().listFiles().length);
	}

	@Test
	void unreadableFrameIsSkippedWhenAsked() throws Exception
	{
		List<File> files = new ArrayList<>(constantFrames(3, 9f));
		File broken = new File(tempDir.toFile(), "broken.dng");
		files.add(1, broken);
		RecordingSink sink = new RecordingSink();

		StackResult result = stacker(StackingConfig.defaults().withErrorPolicy(DecodeErrorPolicy.SKIP))
				.stack(files, ReductionPolicy.MEAN, sink).orElseThrow();

		assertEquals(3, result.stackedFrames());
		assertEquals(1, result.skippedFrames());
		assertEquals(ExposureDuration.of(3, 100), result.totalExposure());
		assertEquals("IMG_0000_Mean_0.03s.tiff", result.output().getName());
		assertEquals(List.of(broken), sink.skipped);
		assertEquals(List.of(1, 2, 3, 4), sink.processed);
	}

	@Test
	void everyFrameSkippedIsAFailure()
	{
		List<File> files = List.of(new File(tempDir.toFile(), "x.dng"), new File(tempDir.toFile(), "y.dng"));

		StackingException e = assertThrows(StackingException.class,
				() -> stacker(StackingConfig.defaults().withErrorPolicy(DecodeErrorPolicy.SKIP))
						.stack(files, ReductionPolicy.MEAN, ProgressSink.NONE));

		assertTrue(e.getMessage().startsWith("No frames could be decoded"), e.getMessage());
	}

	@Test
	void mismatchedFrameFailsTheSession()
	{
		List<File> files = List.of(
				frame("a.dng", PixelBuffer.filled(4, 3, 3, 1f)),
				frame("b.dng", PixelBuffer.filled(4, 3, 3, 1f)),
				frame("portrait.dng", PixelBuffer.filled(3, 4, 3, 1f)),
				frame("d.dng", PixelBuffer.filled(4, 3, 3, 1f)));

		DimensionMismatchException e = assertThrows(DimensionMismatchException.class,
				() -> stacker().stack(files, ReductionPolicy.MEAN, ProgressSink.NONE));

		assertEquals("portrait.dng", e.getFile().getName());
		assertEquals(0, tempDir.toFile().listFiles().length);
	}

	@Test
	void unwritableOutputIsAPersistenceFailure()
	{
		List<File> files = constantFrames(2, 9f);
		File missing = new File(tempDir.toFile(), "no/such/dir");
		Stacker stacker = new Stacker(source, hundredth, new StackFinalizer(),
				StackingConfig.defaults().withOutputDirectory(missing));

		PersistenceException e = assertThrows(PersistenceException.class,
				() -> stacker.stack(files, ReductionPolicy.MEAN, ProgressSink.NONE));

		assertTrue(e.getTarget().getPath().startsWith(missing.getPath()));
	}

	@Test
	void decoderCrashStopsTheSession()
	{
		List<File> files = constantFrames(3, 9f);
		FrameSource crashing = file -> {
			if (file.equals(files.get(1)))
			{
				throw new IllegalStateException("decoder crashed");
			}
			return source.decode(file);
		};
		RecordingSink sink = new RecordingSink();
		Stacker stacker = new Stacker(crashing, hundredth, new StackFinalizer(),
				StackingConfig.defaults().withOutputDirectory(tempDir.toFile()).withPollIntervalMillis(20));

		StackingException e = assertThrows(StackingException.class,
				() -> stacker.stack(files, ReductionPolicy.MEAN, sink));

		assertTrue(e.getMessage().startsWith("Decoding failed after 1 of 3 frames"), e.getMessage());
		assertInstanceOf(IllegalStateException.class, e.getCause());
		assertTrue(sink.finished.isEmpty());
		assertEquals(List.of(1), sink.processed);
		assertEquals(0, tempDir.toFile().listFiles().length);
	}

	// --- Parallel decoding ---

	@Test
	void parallelDecodingGivesTheSameResult() throws Exception
	{
		Random random = new Random(42);
		List<File> files = new ArrayList<>();
		for (int i = 0; i < 40; i++)
		{
			float[] samples = new float[6 * 4 * 3];
			for (int s = 0; s < samples.length; s++)
			{
				samples[s] = random.nextInt(256);
			}
			files.add(frame("p" + i + ".dng", PixelBuffer.of(6, 4, 3, samples)));
		}

		for (ReductionPolicy policy : List.of(ReductionPolicy.MAXIMUM, ReductionPolicy.MINIMUM))
		{
			PixelBuffer sequential = readBack(stacker().stack(files, policy, ProgressSink.NONE).orElseThrow());
			RecordingSink sink = new RecordingSink();
			PixelBuffer parallel = readBack(stacker(StackingConfig.defaults().withDecodeThreads(4))
					.stack(files, policy, sink).orElseThrow());

			assertArrayEquals(sequential.copySamples(), parallel.copySamples(), 0f, policy.name());
			assertEquals(40, sink.processed.get(sink.processed.size() - 1));
		}
	}
}
