package com.gridcompare;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.Color;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GridBuilderTest
{
	@TempDir
	Path tempDir;

	// --- File name handling ---

	@Test
	void recognisesSupportedExtensionsCaseInsensitively()
	{
		assertTrue(GridBuilder.isSupportedImage("a.png"));
		assertTrue(GridBuilder.isSupportedImage("photo.JPG"));
		assertTrue(GridBuilder.isSupportedImage("scan.tiff"));
		assertTrue(GridBuilder.isSupportedImage("x.webp"));
		assertFalse(GridBuilder.isSupportedImage("notes.txt"));
		assertFalse(GridBuilder.isSupportedImage(".png"));
		assertFalse(GridBuilder.isSupportedImage("png"));
	}

	@Test
	void stemDropsOnlyTheLastExtension()
	{
		assertEquals("a", GridBuilder.stem("a.png"));
		assertEquals("archive.tar", GridBuilder.stem("archive.tar.png"));
		assertEquals("plain", GridBuilder.stem("plain"));
	}

	@Test
	void listImagesIsSortedAndSkipsOtherFiles() throws IOException
	{
		ImageFixtures.writePng(tempDir, "b.png", 2, 2, Color.RED);
		ImageFixtures.writePng(tempDir, "A.png", 2, 2, Color.RED);
		ImageFixtures.writePng(tempDir, "c.png", 2, 2, Color.RED);
		Files.writeString(tempDir.resolve("readme.txt"), "x");
		Files.createDirectories(tempDir.resolve("d.png"));

		assertEquals(List.of("A.png", "b.png", "c.png"), GridBuilder.listImages(tempDir));
	}

	// --- Grid shape ---

	@Test
	void buildsHeaderBaseAndVariantRows() throws IOException
	{
		Grid grid = ImageFixtures.smallGrid(tempDir);

		assertEquals(List.of("a", "b"), grid.folderNames());
		assertEquals(4, grid.rowCount());
		assertEquals(3, grid.colCount());

		assertEquals(Cell.CORNER, grid.cell(0, 0));
		assertEquals(new Cell.ColumnHeader("a"), grid.cell(0, 1));
		assertEquals(new Cell.ColumnHeader("b"), grid.cell(0, 2));

		assertEquals(new Cell.RowHeader(Grid.BASE_ROW_LABEL), grid.cell(1, 0));
		assertInstanceOf(Cell.ImagePath.class, grid.cell(1, 1));
		assertTrue(((Cell.ImagePath) grid.cell(1, 1)).path().isAbsolute());

		assertEquals("x.png", grid.rowLabel(2));
		assertEquals("y.png", grid.rowLabel(3));
	}

	@Test
	void everyRowHasOneCellPerColumn() throws IOException
	{
		Grid grid = ImageFixtures.smallGrid(tempDir);
		for (int row = 0; row < grid.rowCount(); row++)
		{
			assertEquals(grid.colCount(), grid.rowLength(row), "row " + row);
		}
		assertEquals(12, grid.totalCells());
	}

	@Test
	void missingVariantBecomesPlaceholder() throws IOException
	{
		Grid grid = ImageFixtures.smallGrid(tempDir);

		// x.png exists under variants/a only
		assertInstanceOf(Cell.ImagePath.class, grid.cell(2, 1));
		assertEquals(new Cell.Placeholder(GridBuilder.MISSING_FILE), grid.cell(2, 2));
		assertInstanceOf(Cell.ImagePath.class, grid.cell(3, 2));
	}

	@Test
	void missingVariantFolderFillsItsColumnWithPlaceholders() throws IOException
	{
		Path base = tempDir.resolve("base");
		Path variants = tempDir.resolve("variants");
		ImageFixtures.writePng(base, "a.png", 4, 4, Color.RED);
		ImageFixtures.writePng(base, "b.png", 4, 4, Color.RED);
		ImageFixtures.writePng(variants.resolve("a"), "v.png", 4, 4, Color.RED);

		Grid grid = GridBuilder.build(base, variants);

		assertEquals(3, grid.rowCount());
		assertEquals(new Cell.Placeholder(GridBuilder.MISSING_FOLDER), grid.cell(2, 2));
	}

	@Test
	void variantRowsMergeFoldersCaseInsensitivelyAndStably() throws IOException
	{
		Path base = tempDir.resolve("base");
		Path variants = tempDir.resolve("variants");
		ImageFixtures.writePng(base, "a.png", 4, 4, Color.RED);
		ImageFixtures.writePng(base, "b.png", 4, 4, Color.RED);
		ImageFixtures.writePng(variants.resolve("a"), "Zeta.png", 4, 4, Color.BLUE);
		ImageFixtures.writePng(variants.resolve("a"), "beta.png", 4, 4, Color.BLUE);
		ImageFixtures.writePng(variants.resolve("b"), "Alpha.png", 4, 4, Color.GREEN);
		ImageFixtures.writePng(variants.resolve("b"), "gamma.png", 4, 4, Color.GREEN);

		Grid first = GridBuilder.build(base, variants);
		Grid second = GridBuilder.build(base, variants);

		assertEquals(6, first.rowCount());
		assertEquals(List.of("Alpha.png", "beta.png", "gamma.png", "Zeta.png"),
				List.of(first.rowLabel(2), first.rowLabel(3), first.rowLabel(4), first.rowLabel(5)));
		assertEquals(new Cell.Placeholder(GridBuilder.MISSING_FILE), first.cell(2, 1));
		assertInstanceOf(Cell.ImagePath.class, first.cell(5, 1));

		assertEquals(first.rowCount(), second.rowCount());
		for (int row = 0; row < first.rowCount(); row++)
		{
			assertEquals(first.row(row), second.row(row));
		}
	}

	@Test
	void noVariantsGivesHeaderAndBaseRowOnly() throws IOException
	{
		Path base = tempDir.resolve("base");
		ImageFixtures.writePng(base, "only.png", 4, 4, Color.RED);
		Files.createDirectories(tempDir.resolve("variants"));

		Grid grid = GridBuilder.build(base, tempDir.resolve("variants"));

		assertEquals(2, grid.rowCount());
		assertEquals(2, grid.colCount());
	}

	@Test
	void emptyBaseFolderIsRejected() throws IOException
	{
		Path base = Files.createDirectories(tempDir.resolve("base"));
		Files.writeString(base.resolve("notes.txt"), "nothing to see");

		EmptyBaseFolderException ex = assertThrows(EmptyBaseFolderException.class,
				() -> GridBuilder.build(base, tempDir));
		assertEquals(base, ex.getFolder());
	}

	@Test
	void missingBaseFolderIsAnIoError()
	{
		assertThrows(IOException.class, () -> GridBuilder.build(tempDir.resolve("absent"), tempDir));
	}

	// --- Dimensions ---

	@Test
	void baseResolutionComesFromFirstImage() throws IOException
	{
		Grid grid = ImageFixtures.smallGrid(tempDir);
		assertEquals("40×30", grid.baseResolution());
	}

	@Test
	void baseResolutionUnknownWithoutReadableImages() throws IOException
	{
		Path base = Files.createDirectories(tempDir.resolve("base"));
		Files.writeString(base.resolve("broken.png"), "not a png");
		assertEquals("Unknown", GridBuilder.baseResolution(base));
	}

	@Test
	void maxImageDimensionTakesLargestEdge() throws IOException
	{
		ImageFixtures.writePng(tempDir, "wide.png", 300, 20, Color.RED);
		ImageFixtures.writePng(tempDir, "tall.png", 20, 120, Color.RED);
		assertEquals(300, GridBuilder.maxImageDimension(tempDir, 256));
	}

	@Test
	void maxImageDimensionFallsBackWhenNothingReadable() throws IOException
	{
		Files.writeString(tempDir.resolve("broken.png"), "not a png");
		assertEquals(256, GridBuilder.maxImageDimension(tempDir, 256));
	}
}
