package com.gridcompare;

import org.apache.commons.imaging.Imaging;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.awt.Dimension;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Stream;

public class GridBuilder
{
	private static final Logger logger = LoggerFactory.getLogger(GridBuilder.class);

	static final Set<String> SUPPORTED_EXTENSIONS =
			Set.of(".png", ".jpg", ".jpeg", ".gif", ".bmp", ".tiff", ".webp");

	static final String MISSING_FILE = "Missing";
	static final String MISSING_FOLDER = "No folder";

	// Case-insensitive first, exact order breaks ties so "a.png" and "A.png" stay stable
	static final Comparator<String> NAME_ORDER =
			String.CASE_INSENSITIVE_ORDER.thenComparing(Comparator.naturalOrder());

	private GridBuilder() {}

	static boolean isSupportedImage(String name)
	{
		int dot = name.lastIndexOf('.');
		if (dot <= 0) return false;
		return SUPPORTED_EXTENSIONS.contains(name.substring(dot).toLowerCase(Locale.ROOT));
	}

	static String stem(String name)
	{
		int dot = name.lastIndexOf('.');
		return dot > 0 ? name.substring(0, dot) : name;
	}

	public static Grid build(Path baseFolder, Path variantsRoot) throws IOException
	{
		if (!Files.isDirectory(baseFolder))
		{
			throw new IOException("Not a directory: " + baseFolder);
		}

		List<String> baseImages = listImages(baseFolder);
		if (baseImages.isEmpty())
		{
			throw new EmptyBaseFolderException(baseFolder);
		}

		List<String> folderNames = new ArrayList<>();
		List<Path> folderPaths = new ArrayList<>();
		Set<String> variantNames = new TreeSet<>(NAME_ORDER);
		for (String baseImage : baseImages)
		{
			String folderName = stem(baseImage);
			Path folder = variantsRoot.resolve(folderName);
			folderNames.add(folderName);
			if (Files.isDirectory(folder))
			{
				folderPaths.add(folder);
				variantNames.addAll(listImages(folder));
			}
			else
			{
				logger.debug("No variant folder for {} at {}", baseImage, folder);
				folderPaths.add(null);
			}
		}

		List<List<Cell>> rows = new ArrayList<>(variantNames.size() + 2);

		List<Cell> header = new ArrayList<>();
		header.add(Cell.CORNER);
		for (String folderName : folderNames)
		{
			header.add(new Cell.ColumnHeader(folderName));
		}
		rows.add(header);

		List<Cell> baseRow = new ArrayList<>();
		baseRow.add(new Cell.RowHeader(Grid.BASE_ROW_LABEL));
		for (String baseImage : baseImages)
		{
			baseRow.add(new Cell.ImagePath(baseFolder.resolve(baseImage).toAbsolutePath()));
		}
		rows.add(baseRow);

		for (String filename : variantNames)
		{
			List<Cell> row = new ArrayList<>();
			row.add(new Cell.RowHeader(filename));
			for (Path folder : folderPaths)
			{
				if (folder == null)
				{
					row.add(new Cell.Placeholder(MISSING_FOLDER));
					continue;
				}
				Path candidate = folder.resolve(filename);
				if (Files.isRegularFile(candidate))
				{
					row.add(new Cell.ImagePath(candidate.toAbsolutePath()));
				}
				else
				{
					row.add(new Cell.Placeholder(MISSING_FILE));
				}
			}
			rows.add(row);
		}

		logger.info("Built grid from {}: {} rows x {} columns", baseFolder, rows.size(), folderNames.size() + 1);
		return new Grid(baseFolder, variantsRoot, folderNames, rows, baseResolution(baseFolder));
	}

	static List<String> listImages(Path folder) throws IOException
	{
		List<String> names = new ArrayList<>();
		try (Stream<Path> entries = Files.list(folder))
		{
			for (Iterator<Path> it = entries.iterator(); it.hasNext(); )
			{
				Path entry = it.next();
				String name = entry.getFileName().toString();
				if (Files.isRegularFile(entry) && isSupportedImage(name))
				{
					names.add(name);
				}
			}
		}
		names.sort(NAME_ORDER);
		return names;
	}

	/**
	 * Largest width or height among the supported images in {@code folder}, or {@code fallback}
	 * when nothing can be read.
	 */
	public static int maxImageDimension(Path folder, int fallback)
	{
		int max = 0;
		try
		{
			for (String name : listImages(folder))
			{
				Dimension size = readSize(folder.resolve(name).toFile());
				if (size == null)
				{
					logger.warn("Failed to read dimensions of {}", name);
					continue;
				}
				max = Math.max(max, Math.max(size.width, size.height));
			}
		}
		catch (IOException e)
		{
			logger.warn("Cannot list {}: {}", folder, e.getMessage());
		}
		return max > 0 ? max : fallback;
	}

	public static String baseResolution(Path folder)
	{
		try
		{
			for (String name : listImages(folder))
			{
				Dimension size = readSize(folder.resolve(name).toFile());
				if (size != null)
				{
					return size.width + "×" + size.height;
				}
			}
		}
		catch (IOException e)
		{
			logger.warn("Cannot list {}: {}", folder, e.getMessage());
		}
		return "Unknown";
	}

	/**
	 * Reads image dimensions from the header only. Commons Imaging covers most formats; ImageIO
	 * readers (including the WebP plugin) pick up the rest.
	 */
	static Dimension readSize(File file)
	{
		try
		{
			Dimension size = Imaging.getImageSize(file);
			if (size != null && size.width > 0 && size.height > 0) return size;
		}
		catch (IOException | RuntimeException e)
		{
			logger.debug("Commons Imaging could not size {}: {}", file.getName(), e.getMessage());
		}

		try (ImageInputStream iis = ImageIO.createImageInputStream(file))
		{
			if (iis == null) return null;
			Iterator<ImageReader> readers = ImageIO.getImageReaders(iis);
			if (!readers.hasNext()) return null;
			ImageReader reader = readers.next();
			try
			{
				reader.setInput(iis, true, true);
				return new Dimension(reader.getWidth(0), reader.getHeight(0));
			}
			finally
			{
				reader.dispose();
			}
		}
		catch (IOException e)
		{
			logger.debug("ImageIO could not size {}: {}", file.getName(), e.getMessage());
			return null;
		}
	}
}
