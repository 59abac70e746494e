package com.gridcompare;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Thrown when the base folder holds no supported image. There is nothing to compare against, so
 * startup cannot continue.
 */
public class EmptyBaseFolderException extends IOException
{
	private final Path folder;

	public EmptyBaseFolderException(Path folder)
	{
		super("No images found in base folder: " + folder);
		this.folder = folder;
	}

	public Path getFolder()
	{
		return folder;
	}
}
