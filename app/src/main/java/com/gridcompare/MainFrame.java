package com.gridcompare;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.swing.BorderFactory;
import javax.swing.JButton;
import javax.swing.JFrame;
import javax.swing.JLabel;
import javax.swing.JOptionPane;
import javax.swing.JPanel;
import javax.swing.JProgressBar;
import javax.swing.SwingWorker;
import javax.swing.Timer;
import java.awt.BorderLayout;
import java.awt.Dimension;
import java.awt.FlowLayout;
import java.nio.file.Path;
import java.util.Locale;

public class MainFrame extends JFrame
{
	private static final Logger logger = LoggerFactory.getLogger(MainFrame.class);

	private final GridViewPanel gridView;
	private final ExportPipeline pipeline;
	private final JLabel infoLabel;
	private final JLabel statusLabel;
	private final JButton htmlButton;
	private final JButton pngButton;
	private final JProgressBar progressBar;
	private final Timer frameTimer;
	private SwingWorker<Grid, Void> activeReload;

	public MainFrame(Grid grid, ViewerSettings settings, ImageDecoder decoder, int baseCellSize)
	{
		super("Grid Compare - " + folderName(grid.baseFolder()));
		setDefaultCloseOperation(JFrame.EXIT_ON_CLOSE);
		setMinimumSize(new Dimension(640, 480));

		gridView = new GridViewPanel(grid, settings, decoder, baseCellSize);
		pipeline = new ExportPipeline(settings, decoder);

		// --- Status bar ---
		JPanel statusBar = new JPanel(new BorderLayout(8, 0));
		statusBar.setBorder(BorderFactory.createEmptyBorder(4, 8, 4, 8));
		infoLabel = new JLabel();
		statusBar.add(infoLabel, BorderLayout.WEST);
		statusLabel = new JLabel();
		statusBar.add(statusLabel, BorderLayout.CENTER);

		JPanel actions = new JPanel(new FlowLayout(FlowLayout.RIGHT, 6, 0));
		progressBar = new JProgressBar(0, 100);
		progressBar.setStringPainted(true);
		progressBar.setString("");
		progressBar.setPreferredSize(new Dimension(260, progressBar.getPreferredSize().height));
		actions.add(progressBar);

		htmlButton = new JButton("Export HTML (H)");
		htmlButton.setFocusable(false);
		htmlButton.addActionListener(e -> exportHtml());
		actions.add(htmlButton);

		pngButton = new JButton("Export PNG (E)");
		pngButton.setFocusable(false);
		pngButton.addActionListener(e -> exportPng());
		actions.add(pngButton);
		statusBar.add(actions, BorderLayout.EAST);

		setLayout(new BorderLayout());
		add(gridView, BorderLayout.CENTER);
		add(statusBar, BorderLayout.SOUTH);

		gridView.bind("typed h", "exportHtml", this::exportHtml);
		gridView.bind("typed e", "exportPng", this::exportPng);
		gridView.bind("typed r", "reload", this::reload);

		frameTimer = new Timer(settings.input().frameIntervalMs(), e -> tick());
		frameTimer.start();

		pack();
		setLocationRelativeTo(null);
		updateInfo();
	}

	private static String folderName(Path folder)
	{
		Path name = folder.getFileName();
		return name != null ? name.toString() : folder.toString();
	}

	// --- Frame tick ---

	private void tick()
	{
		ExportResult result = pipeline.poll();
		if (result != null)
		{
			onExportFinished(result);
		}

		ExportJob job = pipeline.getCurrentJob();
		boolean busy = pipeline.isInProgress();
		htmlButton.setEnabled(!busy);
		pngButton.setEnabled(!busy);
		if (job != null)
		{
			progressBar.setValue((int) Math.round(job.getProgress() * 100));
			progressBar.setString(busy
					? job.getMessage() + " " + Math.round(job.getProgress() * 100) + "%"
					: job.getMessage());
		}
		updateInfo();
		gridView.repaint();
	}

	private void onExportFinished(ExportResult result)
	{
		if (result.succeeded())
		{
			logger.info("{} export finished: {}", result.kind(), result.output().toAbsolutePath());
			return;
		}
		progressBar.setValue(0);
		JOptionPane.showMessageDialog(this,
				result.kind() + " export failed. See the log for details.",
				"Export Error", JOptionPane.ERROR_MESSAGE);
	}

	private void updateInfo()
	{
		Grid grid = gridView.getGrid();
		ViewportController viewport = gridView.getViewport();
		infoLabel.setText(String.format(Locale.ROOT, "Base: %s | Zoom: %.2fx | Rows: %d | Columns: %d | Cells: %d",
				folderName(grid.baseFolder()), viewport.getZoomLevel(),
				grid.rowCount(), grid.colCount(), grid.totalCells()));
	}

	// --- Commands ---

	private void exportPng()
	{
		Path target = pipeline.startPng(gridView.getGrid(), gridView.getViewport().getCellSize(), null);
		if (target != null) logger.info("Starting PNG export to {}", target);
	}

	private void exportHtml()
	{
		Path target = pipeline.startHtml(gridView.getGrid(), gridView.getViewport().getCellSize(), null);
		if (target != null) logger.info("Starting HTML export to {}", target);
	}

	private void reload()
	{
		if (activeReload != null && !activeReload.isDone()) return;
		statusLabel.setText("Reloading...");
		Grid current = gridView.getGrid();
		activeReload = new SwingWorker<>()
		{
			@Override
			protected Grid doInBackground() throws Exception
			{
				return GridBuilder.build(current.baseFolder(), current.variantsRoot());
			}

			@Override
			protected void done()
			{
				try
				{
					gridView.setGrid(get());
					statusLabel.setText("Reloaded");
					updateInfo();
				}
				catch (Exception ex)
				{
					Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
					if (cause instanceof InterruptedException) Thread.currentThread().interrupt();
					logger.warn("Reload failed, keeping the previous grid: {}", cause.getMessage());
					statusLabel.setText("Reload failed: " + cause.getMessage());
				}
			}
		};
		activeReload.execute();
	}

	@Override
	public void dispose()
	{
		frameTimer.stop();
		super.dispose();
	}
}
