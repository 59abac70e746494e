package com.gridcompare;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Immutable comparison grid. Built only by {@link GridBuilder}; a reload replaces the whole grid.
 * Safe to read from the event thread and the export worker at the same time.
 */
public final class Grid
{
	static final String BASE_ROW_LABEL = "Base Images";

	private final Path baseFolder;
	private final Path variantsRoot;
	private final List<String> folderNames;
	private final List<List<Cell>> rows;
	private final String baseResolution;

	Grid(Path baseFolder, Path variantsRoot, List<String> folderNames, List<List<Cell>> rows,
		 String baseResolution)
	{
		this.baseFolder = baseFolder;
		this.variantsRoot = variantsRoot;
		this.folderNames = List.copyOf(folderNames);
		List<List<Cell>> frozen = new ArrayList<>(rows.size());
		for (List<Cell> row : rows)
		{
			if (row.size() != folderNames.size() + 1)
			{
				throw new IllegalArgumentException("Row length " + row.size()
						+ " does not match column count " + (folderNames.size() + 1));
			}
			frozen.add(List.copyOf(row));
		}
		this.rows = List.copyOf(frozen);
		this.baseResolution = baseResolution;
	}

	public Path baseFolder()
	{
		return baseFolder;
	}

	public Path variantsRoot()
	{
		return variantsRoot;
	}

	public List<String> folderNames()
	{
		return folderNames;
	}

	public String baseResolution()
	{
		return baseResolution;
	}

	public int rowCount()
	{
		return rows.size();
	}

	public int colCount()
	{
		return folderNames.size() + 1;
	}

	public int rowLength(int row)
	{
		if (row < 0 || row >= rows.size()) return 0;
		return rows.get(row).size();
	}

	public int totalCells()
	{
		return rowCount() * colCount();
	}

	public boolean contains(int row, int col)
	{
		return row >= 0 && row < rows.size() && col >= 0 && col < rows.get(row).size();
	}

	public Cell cell(int row, int col)
	{
		return rows.get(row).get(col);
	}

	public List<Cell> row(int row)
	{
		return rows.get(row);
	}

	public String rowLabel(int row)
	{
		if (row <= 0 || row >= rows.size()) return "";
		return rows.get(row).get(0) instanceof Cell.RowHeader header ? header.text() : "";
	}

	public String columnLabel(int col)
	{
		if (col <= 0 || col > folderNames.size()) return "";
		return folderNames.get(col - 1);
	}
}
