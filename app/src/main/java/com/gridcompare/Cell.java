package com.gridcompare;

import java.nio.file.Path;

/**
 * One position of the comparison grid. Row 0 holds column headers, column 0 holds row headers,
 * everything else is either an image on disk or a placeholder for a file that is not there.
 */
public sealed interface Cell
{
	record Corner() implements Cell {}

	record ColumnHeader(String folderName) implements Cell {}

	record RowHeader(String text) implements Cell {}

	record ImagePath(Path path) implements Cell {}

	record Placeholder(String reason) implements Cell {}

	Corner CORNER = new Corner();

	default boolean isData()
	{
		return this instanceof ImagePath || this instanceof Placeholder;
	}
}
