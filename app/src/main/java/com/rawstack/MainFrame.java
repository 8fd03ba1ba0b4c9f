package com.rawstack;

import javax.swing.BorderFactory;
import javax.swing.DefaultListModel;
import javax.swing.JButton;
import javax.swing.JCheckBox;
import javax.swing.JComboBox;
import javax.swing.JFileChooser;
import javax.swing.JFrame;
import javax.swing.JLabel;
import javax.swing.JList;
import javax.swing.JOptionPane;
import javax.swing.JPanel;
import javax.swing.JProgressBar;
import javax.swing.JScrollPane;
import javax.swing.JSeparator;
import javax.swing.JSpinner;
import javax.swing.SpinnerNumberModel;
import javax.swing.SwingUtilities;
import javax.swing.SwingWorker;
import javax.swing.UIManager;
import javax.swing.filechooser.FileNameExtensionFilter;
import java.awt.BorderLayout;
import java.awt.Dimension;
import java.awt.GridBagConstraints;
import java.awt.GridBagLayout;
import java.awt.Insets;
import java.awt.Toolkit;
import java.awt.image.BufferedImage;
import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

public class MainFrame extends JFrame
{

	private static final String[] RAW_EXTENSIONS =
			{"dng", "nef", "cr2", "arw", "orf", "rw2", "raf", "pef", "tif", "tiff", "png", "jpg", "jpeg"};

	private final PreviewPanel previewPanel = new PreviewPanel();
	private final DefaultListModel<String> fileListModel = new DefaultListModel<>();
	private final JComboBox<ReductionPolicy> policyCombo = new JComboBox<>(ReductionPolicy.values());
	private final JCheckBox skipUnreadableBox = new JCheckBox("Skip unreadable files");
	private final JSpinner threadsSpinner;
	private final JButton startButton = new JButton("Stack");
	private final JButton selectButton = new JButton("Select Files...");
	private final JProgressBar progressBar = new JProgressBar(0, 100);
	private final JLabel telemetryLabel = new JLabel(" ");
	private final JLabel statusLabel = new JLabel("Select raw files to stack");

	private final List<File> selectedFiles = new ArrayList<>();

	public MainFrame()
	{
		super("RawStack");
		setDefaultCloseOperation(JFrame.EXIT_ON_CLOSE);
		setMinimumSize(new Dimension(800, 600));

		int maxThreads = Math.max(1, Runtime.getRuntime().availableProcessors());
		threadsSpinner = new JSpinner(new SpinnerNumberModel(
				Math.min(StackerPreferences.getDecodeThreads(), maxThreads), 1, maxThreads, 1));
		policyCombo.setSelectedItem(StackerPreferences.getPolicy());
		skipUnreadableBox.setSelected(StackerPreferences.isSkipUnreadable());

		// --- Control panel (right sidebar) ---
		JPanel controlPanel = new JPanel(new GridBagLayout());
		controlPanel.setBorder(BorderFactory.createEmptyBorder(8, 8, 8, 8));
		GridBagConstraints gbc = new GridBagConstraints();
		gbc.insets = new Insets(4, 4, 4, 4);
		gbc.fill = GridBagConstraints.HORIZONTAL;
		gbc.gridx = 0;
		gbc.gridwidth = 2;
		int row = 0;

		gbc.gridwidth = 1;
		gbc.gridy = row;
		selectButton.addActionListener(e -> selectFiles());
		controlPanel.add(selectButton, gbc);
		gbc.gridx = 1;
		JButton clearButton = new JButton("Clear");
		clearButton.addActionListener(e -> setSelection(List.of()));
		controlPanel.add(clearButton, gbc);
		row++;

		gbc.gridx = 0;
		gbc.gridwidth = 2;
		gbc.gridy = row++;
		gbc.fill = GridBagConstraints.BOTH;
		gbc.weighty = 1.0;
		JScrollPane listScroll = new JScrollPane(new JList<>(fileListModel));
		listScroll.setPreferredSize(new Dimension(0, 200));
		controlPanel.add(listScroll, gbc);
		gbc.fill = GridBagConstraints.HORIZONTAL;
		gbc.weighty = 0;

		gbc.gridy = row++;
		controlPanel.add(new JSeparator(), gbc);

		gbc.gridwidth = 1;
		gbc.gridy = row;
		controlPanel.add(new JLabel("Method:"), gbc);
		gbc.gridx = 1;
		controlPanel.add(policyCombo, gbc);
		row++;

		gbc.gridx = 0;
		gbc.gridy = row;
		controlPanel.add(new JLabel("Decode threads:"), gbc);
		gbc.gridx = 1;
		controlPanel.add(threadsSpinner, gbc);
		row++;

		gbc.gridx = 0;
		gbc.gridwidth = 2;
		gbc.gridy = row++;
		controlPanel.add(skipUnreadableBox, gbc);

		gbc.gridy = row++;
		startButton.setEnabled(false);
		startButton.addActionListener(e -> startStacking());
		controlPanel.add(startButton, gbc);

		gbc.gridy = row++;
		progressBar.setStringPainted(true);
		progressBar.setString("");
		controlPanel.add(progressBar, gbc);

		gbc.gridy = row++;
		controlPanel.add(telemetryLabel, gbc);

		gbc.gridy = row;
		controlPanel.add(statusLabel, gbc);

		// --- Layout ---
		setLayout(new BorderLayout());
		add(previewPanel, BorderLayout.CENTER);

		JScrollPane controlScroll = new JScrollPane(controlPanel,
				JScrollPane.VERTICAL_SCROLLBAR_AS_NEEDED,
				JScrollPane.HORIZONTAL_SCROLLBAR_NEVER);
		controlScroll.setPreferredSize(new Dimension(320, 0));
		controlScroll.setBorder(BorderFactory.createMatteBorder(0, 1, 0, 0,
				UIManager.getColor("Separator.foreground")));
		add(controlScroll, BorderLayout.EAST);

		pack();
		setSize(1180, 800);
		setLocationRelativeTo(null);
	}

	private void selectFiles()
	{
		JFileChooser chooser = new JFileChooser();
		chooser.setDialogTitle("Select raw exposures");
		chooser.setMultiSelectionEnabled(true);
		chooser.setFileFilter(new FileNameExtensionFilter("Raw and image files", RAW_EXTENSIONS));
		File lastDirectory = StackerPreferences.getLastDirectory();
		if (lastDirectory != null && lastDirectory.isDirectory())
		{
			chooser.setCurrentDirectory(lastDirectory);
		}
		if (chooser.showOpenDialog(this) != JFileChooser.APPROVE_OPTION) return;

		File[] chosen = chooser.getSelectedFiles();
		if (chosen.length > 0 && chosen[0].getParentFile() != null)
		{
			StackerPreferences.setLastDirectory(chosen[0].getParentFile());
		}
		setSelection(Arrays.asList(chosen));
	}

	private void setSelection(List<File> files)
	{
		selectedFiles.clear();
		selectedFiles.addAll(files);
		fileListModel.clear();
		for (File f : files)
		{
			fileListModel.addElement(f.getName());
		}
		startButton.setEnabled(!files.isEmpty());
		statusLabel.setText(files.isEmpty() ? Stacker.NO_FILES_SELECTED : files.size() + " files selected");
	}

	private void startStacking()
	{
		ReductionPolicy policy = (ReductionPolicy) policyCombo.getSelectedItem();
		int threads = (Integer) threadsSpinner.getValue();
		boolean skip = skipUnreadableBox.isSelected();
		StackerPreferences.setPolicy(policy);
		StackerPreferences.setDecodeThreads(threads);
		StackerPreferences.setSkipUnreadable(skip);

		StackingConfig config = StackingConfig.defaults()
				.withDecodeThreads(threads)
				.withErrorPolicy(skip ? DecodeErrorPolicy.SKIP : DecodeErrorPolicy.ABORT);
		List<File> files = List.copyOf(selectedFiles);

		setControlsEnabled(false);
		progressBar.setValue(0);
		progressBar.setString("0%");
		previewPanel.setImage(null);

		new SwingWorker<Optional<StackResult>, Void>()
		{
			@Override
			protected Optional<StackResult> doInBackground() throws Exception
			{
				return new Stacker(config).stack(files, policy, new WindowSink());
			}

			@Override
			protected void done()
			{
				setControlsEnabled(true);
				try
				{
					Optional<StackResult> result = get();
					if (result.isEmpty()) return;
					Toolkit.getDefaultToolkit().beep();
					StackResult r = result.get();
					String skipped = r.skippedFrames() > 0 ? "\n" + r.skippedFrames() + " unreadable files were skipped." : "";
					JOptionPane.showMessageDialog(MainFrame.this,
							"Stacked " + r.stackedFrames() + " frames (" + r.totalExposure().formatSeconds()
									+ " s total exposure) to:\n" + r.output().getAbsolutePath() + skipped,
							"Finished", JOptionPane.INFORMATION_MESSAGE);
				}
				catch (Exception ex)
				{
					progressBar.setString("Failed");
					Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
					statusLabel.setText("Failed");
					JOptionPane.showMessageDialog(MainFrame.this,
							"Stacking failed: " + cause.getMessage(),
							"Stacking Error", JOptionPane.ERROR_MESSAGE);
				}
			}
		}.execute();
	}

	private void setControlsEnabled(boolean enabled)
	{
		startButton.setEnabled(enabled && !selectedFiles.isEmpty());
		selectButton.setEnabled(enabled);
		policyCombo.setEnabled(enabled);
		threadsSpinner.setEnabled(enabled);
		skipUnreadableBox.setEnabled(enabled);
	}

	// --- Session updates arrive on the consumer thread; hop to the EDT ---

	private class WindowSink implements ProgressSink
	{
		@Override
		public void onStatus(String message)
		{
			SwingUtilities.invokeLater(() -> statusLabel.setText(message));
		}

		@Override
		public void onProgress(int processed, int total)
		{
			int pct = ProgressSink.percent(processed, total);
			SwingUtilities.invokeLater(() -> {
				progressBar.setValue(pct);
				progressBar.setString(processed + " / " + total + " (" + pct + "%)");
			});
		}

		@Override
		public void onTelemetry(Telemetry t)
		{
			String cpu = t.cpuPercent() < 0 ? "n/a" : String.format("%.0f%%", t.cpuPercent());
			String text = String.format("CPU %s  RAM %.0f%%  Threads %d", cpu, t.memoryPercent(), t.threadCount());
			SwingUtilities.invokeLater(() -> telemetryLabel.setText(text));
		}

		@Override
		public void onPreview(BufferedImage preview)
		{
			SwingUtilities.invokeLater(() -> previewPanel.setImage(preview));
		}

		@Override
		public void onFrameSkipped(File file, DecodeException error)
		{
			SwingUtilities.invokeLater(() -> statusLabel.setText("Skipped " + file.getName()));
		}

		@Override
		public void onFinished(StackResult result)
		{
			SwingUtilities.invokeLater(() -> {
				progressBar.setValue(100);
				progressBar.setString("Finished");
				statusLabel.setText("Saved " + result.output().getName());
			});
		}
	}
}
