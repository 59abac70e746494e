package com.gridcompare;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs one export at a time off the event thread. Results come back through {@link #poll()},
 * which the frame tick drains; the job object itself only carries progress for display.
 */
public class ExportPipeline
{
	private static final Logger logger = LoggerFactory.getLogger(ExportPipeline.class);

	private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

	@FunctionalInterface
	interface ExportTask
	{
		Path run(ProgressListener listener) throws Exception;
	}

	private final ViewerSettings settings;
	private final ImageDecoder decoder;
	private final Executor executor;
	private final AtomicBoolean inProgress = new AtomicBoolean();
	private final Queue<ExportResult> completed = new ConcurrentLinkedQueue<>();
	private volatile ExportJob currentJob;

	public ExportPipeline(ViewerSettings settings, ImageDecoder decoder)
	{
		this(settings, decoder, Executors.newSingleThreadExecutor(r -> {
			Thread t = new Thread(r, "grid-export");
			t.setDaemon(true);
			return t;
		}));
	}

	ExportPipeline(ViewerSettings settings, ImageDecoder decoder, Executor executor)
	{
		this.settings = settings;
		this.decoder = decoder;
		this.executor = executor;
	}

	public static String defaultPngName(LocalDateTime time)
	{
		return "grid_export_" + time.format(FILE_STAMP) + ".png";
	}

	/**
	 * Starts a mosaic export of the whole grid.
	 *
	 * @param output target file, or null for a timestamped name in the working directory
	 * @return the path that will be written, or null if another export is still running
	 */
	public Path startPng(Grid grid, int cellSize, Path output)
	{
		Path target = output != null ? output : Path.of(defaultPngName(LocalDateTime.now()));
		return start(ExportKind.PNG, target,
				listener -> PngExporter.export(grid, cellSize, settings, decoder, target, listener));
	}

	public Path startHtml(Grid grid, int cellSize, Path outputDir)
	{
		Path dir = outputDir != null ? outputDir : Path.of(settings.export().htmlDirectory());
		Path started = start(ExportKind.HTML, dir,
				listener -> HtmlExporter.export(grid, cellSize, settings, decoder, dir, listener));
		return started != null ? dir.resolve(HtmlExporter.INDEX_FILE) : null;
	}

	private Path start(ExportKind kind, Path target, ExportTask task)
	{
		if (!inProgress.compareAndSet(false, true))
		{
			logger.info("{} export ignored, another export is running", kind);
			return null;
		}
		ExportJob job = new ExportJob(kind, target);
		currentJob = job;
		logger.info("Starting {} export to {}", kind, target);
		try
		{
			executor.execute(() -> runJob(job, task));
		}
		catch (RuntimeException e)
		{
			inProgress.set(false);
			currentJob = null;
			throw e;
		}
		return target;
	}

	private void runJob(ExportJob job, ExportTask task)
	{
		Path result = null;
		try
		{
			result = task.run(job::onProgress);
		}
		catch (Exception | OutOfMemoryError e)
		{
			logger.error("{} export to {} failed", job.getKind(), job.getTarget(), e);
		}
		finally
		{
			job.finish(result);
			completed.offer(new ExportResult(job.getKind(), result));
			inProgress.set(false);
		}
	}

	public boolean isInProgress()
	{
		return inProgress.get();
	}

	/** The running job, or the last one to finish; null before the first export. */
	public ExportJob getCurrentJob()
	{
		return currentJob;
	}

	public ExportResult poll()
	{
		return completed.poll();
	}
}
