package com.gridcompare;

import com.formdev.flatlaf.themes.FlatMacDarkLaf;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.swing.JFileChooser;
import javax.swing.SwingUtilities;
import java.io.File;
import java.io.IOException;
import java.lang.reflect.InvocationTargetException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicReference;

public class GridCompareApp
{
	private static final Logger logger = LoggerFactory.getLogger(GridCompareApp.class);

	public static void main(String[] args)
	{
		FlatMacDarkLaf.setup();

		ViewerSettings settings;
		Path base;
		Path variants;
		Grid grid;
		try
		{
			settings = ViewerSettings.load();
			base = args.length > 0 ? Path.of(args[0]) : chooseFolder("Select Base Images Folder");
			variants = args.length > 1 ? Path.of(args[1]) : chooseFolder("Select Folder Containing Subfolders");
			requireDirectory(base, "Base folder");
			requireDirectory(variants, "Variants folder");
			grid = GridBuilder.build(base, variants);
		}
		catch (EmptyBaseFolderException e)
		{
			fail("No images found in base folder " + e.getFolder());
			return;
		}
		catch (IOException | IllegalArgumentException e)
		{
			fail(e.getMessage());
			return;
		}

		int baseCellSize = GridBuilder.maxImageDimension(base, settings.viewport().defaultCellSize());
		logger.info("Starting with {}x{} grid, base cell size {}px", grid.rowCount(), grid.colCount(), baseCellSize);

		ImageDecoder decoder = ImageDecoder.imageIo();
		SwingUtilities.invokeLater(() -> {
			MainFrame frame = new MainFrame(grid, settings, decoder, baseCellSize);
			frame.setVisible(true);
		});
	}

	private static void requireDirectory(Path folder, String what) throws IOException
	{
		if (folder == null)
		{
			throw new IOException(what + " not selected");
		}
		if (!Files.isDirectory(folder))
		{
			throw new IOException(what + " is not a directory: " + folder);
		}
	}

	private static Path chooseFolder(String title) throws IOException
	{
		AtomicReference<File> selected = new AtomicReference<>();
		try
		{
			SwingUtilities.invokeAndWait(() -> {
				JFileChooser chooser = new JFileChooser();
				chooser.setDialogTitle(title);
				chooser.setFileSelectionMode(JFileChooser.DIRECTORIES_ONLY);
				if (chooser.showOpenDialog(null) == JFileChooser.APPROVE_OPTION)
				{
					selected.set(chooser.getSelectedFile());
				}
			});
		}
		catch (InterruptedException e)
		{
			Thread.currentThread().interrupt();
			throw new IOException("Interrupted while choosing a folder", e);
		}
		catch (InvocationTargetException e)
		{
			throw new IOException("Folder chooser failed", e.getCause());
		}
		File file = selected.get();
		return file != null ? file.toPath() : null;
	}

	private static void fail(String message)
	{
		logger.error(message);
		System.err.println(message);
		System.exit(1);
	}
}
