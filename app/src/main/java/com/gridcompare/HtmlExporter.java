package com.gridcompare;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Writes the grid as a static web page: {@code index.html} plus one thumbnail per readable image
 * under {@code images/}. Thumbnails are attached through {@code data-src} and loaded by the page
 * only while their cell is on screen.
 */
public class HtmlExporter
{
	private static final Logger logger = LoggerFactory.getLogger(HtmlExporter.class);

	static final String INDEX_FILE = "index.html";
	static final String IMAGES_DIR = "images";
	private static final String TEMPLATE = "gallery.html";
	private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

	private HtmlExporter() {}

	static int totalWork(Grid grid)
	{
		int images = 0;
		for (int row = 0; row < grid.rowCount(); row++)
		{
			for (Cell cell : grid.row(row))
			{
				if (cell instanceof Cell.ImagePath) images++;
			}
		}
		return grid.totalCells() + images;
	}

	static int filenameWidth(int cellSize, ViewerSettings.ExportSettings export)
	{
		return Math.max(export.columnMinWidth(), Math.min(export.columnMaxWidth(), cellSize));
	}

	public static Path export(Grid grid, int cellSize, ViewerSettings settings, ImageDecoder decoder,
							  Path outputDir, ProgressListener listener) throws IOException
	{
		Path imagesDir = outputDir.resolve(IMAGES_DIR);
		Files.createDirectories(imagesDir);

		ThumbnailWriter thumbnails = ThumbnailWriter.create(settings.export().thumbnailQuality());
		int target = Math.max(1, cellSize - 2 * settings.cellPadding());
		int total = totalWork(grid);
		int processed = 0;
		int imageCounter = 0;

		List<String> cells = new ArrayList<>();
		for (int row = 0; row < grid.rowCount(); row++)
		{
			String rowName = grid.rowLabel(row);
			for (int col = 0; col < grid.rowLength(row); col++)
			{
				processed++;
				report(listener, processed, total);

				Cell cell = grid.cell(row, col);
				String columnName = grid.columnLabel(col);
				if (cell instanceof Cell.Corner)
				{
					cells.add(div("cell header header-row", "", ""));
				}
				else if (cell instanceof Cell.ColumnHeader header)
				{
					cells.add(div("cell header header-row", "Column: " + header.folderName(),
							escape(header.folderName())));
				}
				else if (cell instanceof Cell.RowHeader header)
				{
					cells.add(div("cell filename header filename-column", "Filename: " + header.text(),
							escape(header.text())));
				}
				else if (cell instanceof Cell.Placeholder placeholder)
				{
					String title = "Missing Image\nColumn: " + columnName + "\nRow: " + rowName
							+ "\n" + placeholder.reason();
					cells.add(div("cell placeholder", title, ""));
				}
				else
				{
					Path source = ((Cell.ImagePath) cell).path();
					String title = "Column: " + columnName + "\nRow: " + rowName;
					try
					{
						BufferedImage scaled = ThumbnailWriter.scaleToFit(decoder.decode(source), target);
						String fileName = thumbnails.write(scaled, imagesDir, "img_" + imageCounter);
						imageCounter++;
						cells.add(div("cell", title, "<div class=\"image-container\" data-src=\""
								+ IMAGES_DIR + "/" + fileName + "\"></div>"));
					}
					catch (IOException | RuntimeException e)
					{
						logger.warn("Error processing image {}: {}", source, e.getMessage());
						cells.add(div("cell placeholder", "Error loading image\n" + title, PngExporter.IMAGE_ERROR));
					}
					// Counted whether or not the re-encode worked, so the bar still ends at 100%
					processed++;
					report(listener, processed, total);
				}
			}
		}

		String baseName = grid.baseFolder().getFileName() != null
				? grid.baseFolder().getFileName().toString()
				: grid.baseFolder().toString();
		String page = fill(loadTemplate(), Map.of(
				"base_folder", escape(baseName),
				"timestamp", LocalDateTime.now().format(TIMESTAMP),
				"rows", Integer.toString(grid.rowCount()),
				"cols", Integer.toString(grid.colCount()),
				"cell_size", Integer.toString(cellSize),
				"filename_width", Integer.toString(filenameWidth(cellSize, settings.export())),
				"num_cols", Integer.toString(grid.colCount() - 1),
				"grid_content", String.join("\n", cells)));

		Path index = outputDir.resolve(INDEX_FILE);
		Files.writeString(index, page, StandardCharsets.UTF_8);
		logger.info("Gallery exported to {} ({} thumbnails as {})", index, imageCounter, thumbnails.getFormat());
		return index;
	}

	private static void report(ProgressListener listener, int processed, int total)
	{
		if (listener != null) listener.onProgress(processed, total);
	}

	private static String div(String classes, String title, String content)
	{
		return "<div class=\"" + classes + "\" title=\"" + escape(title) + "\">" + content + "</div>";
	}

	static String escape(String text)
	{
		StringBuilder sb = new StringBuilder(text.length());
		for (int i = 0; i < text.length(); i++)
		{
			char c = text.charAt(i);
			switch (c)
			{
				case '&' -> sb.append("&amp;");
				case '<' -> sb.append("&lt;");
				case '>' -> sb.append("&gt;");
				case '"' -> sb.append("&quot;");
				case '\'' -> sb.append("&#39;");
				default -> sb.append(c);
			}
		}
		return sb.toString();
	}

	/** Single pass over the template, so substituted text is never itself expanded. */
	static String fill(String template, Map<String, String> values)
	{
		StringBuilder sb = new StringBuilder(template.length());
		int pos = 0;
		while (true)
		{
			int open = template.indexOf("{{", pos);
			int close = open < 0 ? -1 : template.indexOf("}}", open + 2);
			if (close < 0)
			{
				sb.append(template, pos, template.length());
				return sb.toString();
			}
			String key = template.substring(open + 2, close);
			String value = values.get(key);
			sb.append(template, pos, open);
			sb.append(value != null ? value : template.substring(open, close + 2));
			pos = close + 2;
		}
	}

	private static String loadTemplate() throws IOException
	{
		try (InputStream in = HtmlExporter.class.getResourceAsStream(TEMPLATE))
		{
			if (in == null)
			{
				throw new IOException("Missing page template " + TEMPLATE);
			}
			return new String(in.readAllBytes(), StandardCharsets.UTF_8);
		}
	}
}
