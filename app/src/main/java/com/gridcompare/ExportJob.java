package com.gridcompare;

import java.nio.file.Path;

/**
 * Live view of a running export. Written by the export worker, read by the event thread for the
 * progress bar; the values are display hints only.
 */
public class ExportJob
{
	private final ExportKind kind;
	private final Path target;
	private volatile boolean inProgress = true;
	private volatile double progress;
	private volatile String message;

	ExportJob(ExportKind kind, Path target)
	{
		this.kind = kind;
		this.target = target;
		this.message = kind.startMessage();
	}

	public ExportKind getKind()
	{
		return kind;
	}

	public Path getTarget()
	{
		return target;
	}

	public boolean isInProgress()
	{
		return inProgress;
	}

	public double getProgress()
	{
		return progress;
	}

	public String getMessage()
	{
		return message;
	}

	void onProgress(int current, int total)
	{
		if (total <= 0) return;
		progress = Math.max(0, Math.min(1, (double) current / total));
	}

	void finish(Path result)
	{
		if (result != null) progress = 1.0;
		message = result != null ? "Exported to " + result : "Export failed";
		inProgress = false;
	}
}
