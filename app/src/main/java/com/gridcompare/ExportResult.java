package com.gridcompare;

import java.nio.file.Path;

/** Final outcome of an export job; {@code output} is null when the job failed. */
public record ExportResult(ExportKind kind, Path output)
{
	public boolean succeeded()
	{
		return output != null;
	}
}
