package com.snapbooth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import javax.swing.AbstractAction;
import javax.swing.BorderFactory;
import javax.swing.JButton;
import javax.swing.JComponent;
import javax.swing.JFrame;
import javax.swing.JLabel;
import javax.swing.JOptionPane;
import javax.swing.JPanel;
import javax.swing.KeyStroke;
import javax.swing.SwingConstants;
import javax.swing.SwingUtilities;
import javax.swing.SwingWorker;
import java.awt.BorderLayout;
import java.awt.Dimension;
import java.awt.FlowLayout;
import java.awt.Font;
import java.awt.GridLayout;
import java.awt.event.ActionEvent;
import java.awt.event.WindowAdapter;
import java.awt.event.WindowEvent;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Kiosk window. Observes the capture session and runs the artifact pipeline when it completes.
 */
public class BoothFrame extends JFrame
{
	private static final Logger logger = LoggerFactory.getLogger(BoothFrame.class);

	private static final String PRINT_PLACEHOLDER = "Your print appears here";

	private final BoothSettings settings;
	private final DirectoryShotStore store;
	private final CaptureSession session;
	private final ArtifactPipeline pipeline;

	private final JLabel statusLabel = new JLabel(CaptureSession.STATUS_READY, SwingConstants.CENTER);
	private final JLabel countdownLabel = new JLabel(" ", SwingConstants.CENTER);
	private final JLabel shotLabel = new JLabel(" ", SwingConstants.CENTER);
	private final JLabel artifactLabel = new JLabel(" ", SwingConstants.CENTER);
	private final PrintPreviewPanel previewPanel = new PrintPreviewPanel();
	private final JButton startButton = new JButton("Start");
	private final JButton shutterButton = new JButton("Shutter");
	private final JButton cancelButton = new JButton("Cancel");

	private SwingWorker<?, ?> activePipelineWorker;

	public BoothFrame(BoothSettings settings)
	{
		super("SnapBooth");
		this.settings = settings;
		this.store = new DirectoryShotStore(settings.storageDir());
		ExclusiveFrameSource camera = new ExclusiveFrameSource(new FolderFrameSource(settings.sourceDir().toFile()));
		this.session = new CaptureSession(camera, store, CuePlayer.systemBeep(), new EdtSessionListener());
		this.pipeline = ArtifactPipeline.fromSettings(settings);

		setDefaultCloseOperation(JFrame.DISPOSE_ON_CLOSE);
		setMinimumSize(new Dimension(900, 700));

		statusLabel.setFont(statusLabel.getFont().deriveFont(Font.BOLD, 36f));
		countdownLabel.setFont(countdownLabel.getFont().deriveFont(Font.BOLD, 96f));
		shotLabel.setFont(shotLabel.getFont().deriveFont(20f));

		JPanel header = new JPanel(new GridLayout(3, 1));
		header.setBorder(BorderFactory.createEmptyBorder(16, 16, 8, 16));
		header.add(statusLabel);
		header.add(countdownLabel);
		header.add(shotLabel);

		previewPanel.showMessage(PRINT_PLACEHOLDER);

		startButton.addActionListener(e -> startSession());
		shutterButton.addActionListener(e -> session.trigger());
		cancelButton.addActionListener(e -> session.cancel());

		JPanel buttons = new JPanel(new FlowLayout(FlowLayout.CENTER, 16, 8));
		buttons.add(startButton);
		buttons.add(shutterButton);
		buttons.add(cancelButton);

		JPanel footer = new JPanel(new BorderLayout());
		footer.add(buttons, BorderLayout.CENTER);
		footer.add(artifactLabel, BorderLayout.SOUTH);

		getContentPane().setLayout(new BorderLayout());
		getContentPane().add(header, BorderLayout.NORTH);
		getContentPane().add(previewPanel, BorderLayout.CENTER);
		getContentPane().add(footer, BorderLayout.SOUTH);

		// Physical shutter buttons usually present as a space bar
		getRootPane().getInputMap(JComponent.WHEN_IN_FOCUSED_WINDOW)
				.put(KeyStroke.getKeyStroke("SPACE"), "shutter");
		getRootPane().getActionMap().put("shutter", new AbstractAction()
		{
			@Override
			public void actionPerformed(ActionEvent e)
			{
				if (session.state() == SessionState.WAITING_FOR_TRIGGER)
				{
					session.trigger();
				}
				else if (session.state().acceptsNewSession())
				{
					startSession();
				}
			}
		});

		addWindowListener(new WindowAdapter()
		{
			@Override
			public void windowClosed(WindowEvent e)
			{
				if (activePipelineWorker != null)
				{
					activePipelineWorker.cancel(true);
				}
				session.close();
				pipeline.close();
			}
		});

		updateButtons(SessionState.IDLE);
		pack();
		setLocationRelativeTo(null);
	}

	private void startSession()
	{
		if (activePipelineWorker != null && !activePipelineWorker.isDone())
		{
			return;
		}
		try
		{
			store.beginSession();
			session.startSession(settings.session());
			previewPanel.showMessage(PRINT_PLACEHOLDER);
			artifactLabel.setText(" ");
			shotLabel.setText("0 / " + settings.session().targetShotCount());
		}
		catch (IOException | IllegalStateException ex)
		{
			logger.error("Could not start session", ex);
			JOptionPane.showMessageDialog(this, ex.getMessage(), "Cannot Start", JOptionPane.ERROR_MESSAGE);
		}
	}

	private void updateButtons(SessionState state)
	{
		boolean idle = state.acceptsNewSession();
		startButton.setEnabled(idle);
		cancelButton.setEnabled(!idle);
		shutterButton.setEnabled(state == SessionState.WAITING_FOR_TRIGGER);
	}

	private void processArtifacts(SessionResult result)
	{
		Path outputDir = store.sessionDir();
		statusLabel.setText("Processing...");
		previewPanel.showMessage("Developing your print...");
		startButton.setEnabled(false);

		record Rendered(ArtifactPipeline.ArtifactBundle bundle, BufferedImage preview) {}

		SwingWorker<Rendered, Void> worker = new SwingWorker<>()
		{
			@Override
			protected Rendered doInBackground() throws Exception
			{
				ArtifactPipeline.ArtifactBundle bundle = pipeline.process(result, outputDir);
				return new Rendered(bundle, ImageIO.read(bundle.composite().toFile()));
			}

			@Override
			protected void done()
			{
				startButton.setEnabled(true);
				if (isCancelled()) return;
				try
				{
					Rendered rendered = get();
					previewPanel.showPrint(rendered.preview());
					statusLabel.setText("Your print is ready!");
					if (rendered.bundle().complete())
					{
						artifactLabel.setText("Saved to " + outputDir);
					}
					else
					{
						artifactLabel.setText("Print saved. " + String.join("; ", rendered.bundle().failures()));
					}
				}
				catch (Exception ex)
				{
					Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
					logger.error("Artifact processing failed", cause);
					statusLabel.setText("Something went wrong - please retake");
					previewPanel.showMessage(PRINT_PLACEHOLDER);
					artifactLabel.setText("Error: " + cause.getMessage());
				}
			}
		};
		activePipelineWorker = worker;
		worker.execute();
	}

	/**
	 * Forwards session events to the EDT.
	 */
	private class EdtSessionListener implements SessionListener
	{
		@Override
		public void onStateChanged(SessionState state)
		{
			SwingUtilities.invokeLater(() -> {
				updateButtons(state);
				if (state != SessionState.COUNTDOWN && state != SessionState.BURST)
				{
					countdownLabel.setText(" ");
				}
			});
		}

		@Override
		public void onStatus(String status)
		{
			SwingUtilities.invokeLater(() -> statusLabel.setText(status));
		}

		@Override
		public void onCountdownTick(int secondsRemaining)
		{
			SwingUtilities.invokeLater(() -> countdownLabel.setText(String.valueOf(secondsRemaining)));
		}

		@Override
		public void onShotCaptured(RawShot shot, int targetShotCount)
		{
			SwingUtilities.invokeLater(() -> shotLabel.setText((shot.index() + 1) + " / " + targetShotCount));
		}

		@Override
		public void onBurstFrameCaptured(RawShot frame, int burstFrameCount)
		{
			SwingUtilities.invokeLater(() -> shotLabel.setText("Boomerang " + (frame.index() + 1) + " / " + burstFrameCount));
		}

		@Override
		public void onComplete(SessionResult result)
		{
			SwingUtilities.invokeLater(() -> processArtifacts(result));
		}

		@Override
		public void onAborted(SessionAbortedException error)
		{
			SwingUtilities.invokeLater(() -> {
				statusLabel.setText("Camera problem - please retake");
				artifactLabel.setText(error.getMessage());
			});
		}
	}
}
