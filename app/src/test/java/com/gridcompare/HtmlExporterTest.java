package com.gridcompare;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.Color;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class HtmlExporterTest
{
	private static final ViewerSettings SETTINGS = ViewerSettings.defaults();
	private static final Pattern DATA_SRC = Pattern.compile("data-src=\"images/(img_\\d+\\.\\w+)\"");

	@TempDir
	Path tempDir;

	private static List<String> dataSources(String html)
	{
		List<String> sources = new ArrayList<>();
		Matcher m = DATA_SRC.matcher(html);
		while (m.find()) sources.add(m.group(1));
		return sources;
	}

	private static long countFiles(Path dir) throws IOException
	{
		try (Stream<Path> files = Files.list(dir))
		{
			return files.count();
		}
	}

	@Test
	void writesIndexAndOneThumbnailPerImage() throws IOException
	{
		Grid grid = ImageFixtures.smallGrid(tempDir.resolve("src"));
		Path out = tempDir.resolve("gallery");

		Path index = HtmlExporter.export(grid, 64, SETTINGS, ImageDecoder.imageIo(), out, null);

		assertEquals(out.resolve("index.html"), index);
		String html = Files.readString(index);
		List<String> sources = dataSources(html);
		assertEquals(5, sources.size());
		assertEquals(5, countFiles(out.resolve("images")));
		for (int i = 0; i < sources.size(); i++)
		{
			assertTrue(sources.get(i).startsWith("img_" + i + "."), sources.get(i));
			assertTrue(Files.isRegularFile(out.resolve("images").resolve(sources.get(i))));
		}
	}

	@Test
	void pageCarriesLayoutAndGridInfo() throws IOException
	{
		Grid grid = ImageFixtures.smallGrid(tempDir.resolve("src"));
		String html = Files.readString(HtmlExporter.export(grid, 64, SETTINGS, ImageDecoder.imageIo(),
				tempDir.resolve("gallery"), null));

		assertTrue(html.contains("grid-template-columns: 128px repeat(2, 64px)"));
		assertTrue(html.contains("Base folder: base"));
		assertTrue(html.contains("Grid size: 4 rows"));
		assertTrue(html.contains("IntersectionObserver"));
		assertFalse(html.contains("{{"));
	}

	@Test
	void cellsCarryTooltips() throws IOException
	{
		Grid grid = ImageFixtures.smallGrid(tempDir.resolve("src"));
		String html = Files.readString(HtmlExporter.export(grid, 64, SETTINGS, ImageDecoder.imageIo(),
				tempDir.resolve("gallery"), null));

		assertTrue(html.contains("title=\"Column: a\""));
		assertTrue(html.contains("title=\"Filename: x.png\""));
		assertTrue(html.contains("title=\"Column: a\nRow: x.png\""));
		assertTrue(html.contains("title=\"Missing Image\nColumn: b\nRow: x.png\nMissing\""));
	}

	@Test
	void progressCountsCellsAndReencodes() throws IOException
	{
		Grid grid = ImageFixtures.smallGrid(tempDir.resolve("src"));
		List<int[]> progress = new ArrayList<>();

		HtmlExporter.export(grid, 64, SETTINGS, ImageDecoder.imageIo(), tempDir.resolve("gallery"),
				(current, total) -> progress.add(new int[]{current, total}));

		int expectedTotal = grid.totalCells() + 5;
		assertEquals(expectedTotal, HtmlExporter.totalWork(grid));
		assertEquals(expectedTotal, progress.size());
		assertEquals(expectedTotal, progress.get(progress.size() - 1)[0]);
		for (int[] step : progress) assertEquals(expectedTotal, step[1]);
	}

	@Test
	void unreadableImageBecomesErrorCell() throws IOException
	{
		Grid grid = ImageFixtures.smallGrid(tempDir.resolve("src"));
		Path out = tempDir.resolve("gallery");
		ImageDecoder failing = path -> {
			if (path.getFileName().toString().equals("x.png")) throw new IOException("corrupt");
			return ImageFixtures.solid(10, 10, Color.BLUE);
		};
		List<int[]> progress = new ArrayList<>();

		String html = Files.readString(HtmlExporter.export(grid, 64, SETTINGS, failing, out,
				(current, total) -> progress.add(new int[]{current, total})));

		assertTrue(html.contains("Error loading image"));
		assertTrue(html.contains(">Image Error</div>"));
		assertEquals(4, dataSources(html).size());
		assertEquals(4, countFiles(out.resolve("images")));
		assertEquals(HtmlExporter.totalWork(grid), progress.get(progress.size() - 1)[0]);
	}

	@Test
	void filenameColumnWidthIsClamped()
	{
		ViewerSettings.ExportSettings export = SETTINGS.export();
		assertEquals(128, HtmlExporter.filenameWidth(40, export));
		assertEquals(200, HtmlExporter.filenameWidth(200, export));
		assertEquals(256, HtmlExporter.filenameWidth(700, export));
	}

	@Test
	void escapesMarkup()
	{
		assertEquals("a &lt;b&gt; &amp; &quot;c&quot; &#39;d&#39;", HtmlExporter.escape("a <b> & \"c\" 'd'"));
	}

	@Test
	void fillDoesNotExpandSubstitutedText()
	{
		String filled = HtmlExporter.fill("{{a}}|{{b}}|{{unknown}}", Map.of("a", "{{b}}", "b", "B"));
		assertEquals("{{b}}|B|{{unknown}}", filled);
	}
}
