package com.snapbooth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Consumer;

/**
 * Drives timed multi-shot capture: countdown, shutter, persist, then loop or halt.
 * <p>
 * All timing runs on the session executor, never on the caller's thread (unless the caller
 * supplies a same-thread executor). State changes are guarded by one lock; each session gets a
 * new generation number so a cancelled run can never write into its successor.
 */
public class CaptureSession implements AutoCloseable
{
	private static final Logger logger = LoggerFactory.getLogger(CaptureSession.class);

	static final String STATUS_READY = "Ready?";
	static final String STATUS_GET_READY = "Get Ready";
	static final String STATUS_CAPTURING = "Capturing";
	static final String STATUS_NEXT_POSE = "Next Pose";
	static final String STATUS_TAP_FOR_NEXT = "Tap for Next";
	static final String STATUS_BOOMERANG = "Boomerang!";
	static final String STATUS_MOVE_NOW = "Move Now!";
	static final String STATUS_DONE = "Done";

	static final long TICK_MILLIS = 1000;
	static final long RETRY_BACKOFF_MILLIS = 500;
	static final int BURST_COUNTDOWN_SECONDS = 3;

	private final ExclusiveFrameSource camera;
	private final ShotStore store;
	private final CuePlayer cues;
	private final SessionClock clock;
	private final Executor executor;
	private final ExecutorService ownedExecutor;
	private final SessionListener listener;

	private final Object lock = new Object();
	private SessionState state = SessionState.IDLE;
	private SessionConfig config;
	private long generation;
	private ExclusiveFrameSource.Lease lease;
	private Thread worker;
	private final List<RawShot> shots = new ArrayList<>();
	private final List<RawShot> burstFrames = new ArrayList<>();

	public CaptureSession(ExclusiveFrameSource camera, ShotStore store, CuePlayer cues, SessionListener listener)
	{
		this(camera, store, cues, SessionClock.system(), null, listener);
	}

	/**
	 * @param executor runs session work; {@code null} creates a private single-thread executor
	 */
	public CaptureSession(ExclusiveFrameSource camera, ShotStore store, CuePlayer cues, SessionClock clock,
						  Executor executor, SessionListener listener)
	{
		this.camera = camera;
		this.store = store;
		this.cues = cues;
		this.clock = clock;
		this.listener = listener != null ? listener : SessionListener.NONE;
		if (executor == null)
		{
			this.ownedExecutor = Executors.newSingleThreadExecutor(r -> {
				Thread t = new Thread(r, "capture-session");
				t.setDaemon(true);
				return t;
			});
			this.executor = ownedExecutor;
		}
		else
		{
			this.ownedExecutor = null;
			this.executor = executor;
		}
	}

	/**
	 * Starts a new session, discarding the photos of any previous one. AUTO sessions begin their
	 * first countdown immediately; MANUAL sessions wait for {@link #trigger()}.
	 *
	 * @throws IllegalStateException if a session is running or the camera is leased elsewhere
	 */
	public void startSession(SessionConfig sessionConfig)
	{
		long gen;
		SessionState initial = sessionConfig.mode() == CaptureMode.AUTO
				? SessionState.COUNTDOWN
				: SessionState.WAITING_FOR_TRIGGER;
		synchronized (lock)
		{
			if (!state.acceptsNewSession())
			{
				throw new IllegalStateException("Cannot start a session while in state " + state);
			}
			lease = camera.acquire("capture-session");
			config = sessionConfig;
			shots.clear();
			burstFrames.clear();
			gen = ++generation;
			state = initial;
		}

		logger.info("Session {} started: {} shot(s), {}s countdown, {} mode",
				gen, sessionConfig.targetShotCount(), sessionConfig.countdownSeconds(), sessionConfig.mode());
		fire(l -> l.onStateChanged(initial));

		if (sessionConfig.mode() == CaptureMode.AUTO)
		{
			executor.execute(() -> runAuto(gen));
		}
		else
		{
			fire(l -> l.onStatus(STATUS_READY));
		}
	}

	/**
	 * MANUAL mode shutter press. Runs one countdown and shot.
	 *
	 * @return {@code false} if the press was ignored: wrong mode, a shot already in progress, or
	 * no session waiting for a trigger
	 */
	public boolean trigger()
	{
		long gen;
		synchronized (lock)
		{
			if (config == null || config.mode() != CaptureMode.MANUAL || state != SessionState.WAITING_FOR_TRIGGER)
			{
				return false;
			}
			state = SessionState.COUNTDOWN;
			gen = generation;
		}
		fire(l -> l.onStateChanged(SessionState.COUNTDOWN));
		executor.execute(() -> runManualCycle(gen));
		return true;
	}

	/**
	 * Stops the running session and discards its photos. Nothing is reported through
	 * {@link SessionListener#onComplete(SessionResult)}.
	 *
	 * @return {@code false} if there was nothing to cancel
	 */
	public boolean cancel()
	{
		long cancelled;
		synchronized (lock)
		{
			if (state.acceptsNewSession())
			{
				return false;
			}
			cancelled = generation++;
			state = SessionState.IDLE;
			shots.clear();
			burstFrames.clear();
			releaseLease();
			if (worker != null && worker != Thread.currentThread())
			{
				worker.interrupt();
			}
		}
		logger.info("Session {} cancelled", cancelled);
		fire(l -> l.onStateChanged(SessionState.IDLE));
		return true;
	}

	public SessionState state()
	{
		synchronized (lock)
		{
			return state;
		}
	}

	public int shotCount()
	{
		synchronized (lock)
		{
			return shots.size();
		}
	}

	@Override
	public void close()
	{
		cancel();
		if (ownedExecutor != null)
		{
			ownedExecutor.shutdownNow();
		}
	}

	// --- Worker side ---

	private void runAuto(long gen)
	{
		bindWorker(gen);
		try
		{
			SessionConfig cfg = configFor(gen);
			while (true)
			{
				if (countShots(gen) > 0)
				{
					transition(gen, SessionState.POST_SHOT_PAUSE, STATUS_NEXT_POSE);
					pause(gen, cfg.interShotDelaySeconds() * 1000L);
				}
				captureOneShot(gen, cfg);
				if (countShots(gen) >= cfg.targetShotCount())
				{
					break;
				}
			}
			if (cfg.burstEnabled())
			{
				captureBurst(gen, cfg);
			}
			complete(gen);
		}
		catch (SessionCancelledSignal e)
		{
			logger.debug("Session {} worker stopped after cancellation", gen);
		}
		catch (SessionAbortedException e)
		{
			abort(gen, e);
		}
		catch (RuntimeException e)
		{
			abort(gen, new SessionAbortedException(pendingShotIndex(), "Capture failed unexpectedly: " + e, e));
		}
		finally
		{
			unbindWorker(gen);
		}
	}

	private void runManualCycle(long gen)
	{
		bindWorker(gen);
		try
		{
			SessionConfig cfg = configFor(gen);
			captureOneShot(gen, cfg);
			if (countShots(gen) >= cfg.targetShotCount())
			{
				complete(gen);
			}
			else
			{
				transition(gen, SessionState.WAITING_FOR_TRIGGER, STATUS_TAP_FOR_NEXT);
			}
		}
		catch (SessionCancelledSignal e)
		{
			logger.debug("Session {} worker stopped after cancellation", gen);
		}
		catch (SessionAbortedException e)
		{
			abort(gen, e);
		}
		catch (RuntimeException e)
		{
			abort(gen, new SessionAbortedException(pendingShotIndex(), "Capture failed unexpectedly: " + e, e));
		}
		finally
		{
			unbindWorker(gen);
		}
	}

	private void captureOneShot(long gen, SessionConfig cfg) throws SessionCancelledSignal, SessionAbortedException
	{
		transition(gen, SessionState.COUNTDOWN, STATUS_GET_READY);
		countdown(gen, cfg.countdownSeconds());

		transition(gen, SessionState.CAPTURING, STATUS_CAPTURING);
		int index = countShots(gen);
		BufferedImage frame = shutter(gen, index);
		Path path;
		try
		{
			path = store.saveShot(frame, index);
		}
		catch (IOException e)
		{
			throw new SessionAbortedException(index, "Could not save shot " + (index + 1), e);
		}
		finally
		{
			frame.flush();
		}

		RawShot shot = new RawShot(index, path);
		synchronized (lock)
		{
			if (gen != generation)
			{
				throw new SessionCancelledSignal();
			}
			shots.add(shot);
		}
		logger.info("Session {} captured shot {}/{}: {}", gen, index + 1, cfg.targetShotCount(), path);
		fire(l -> l.onShotCaptured(shot, cfg.targetShotCount()));
	}

	/**
	 * Requests a frame, retrying a transient failure once after a short backoff.
	 */
	private BufferedImage shutter(long gen, int index) throws SessionCancelledSignal, SessionAbortedException
	{
		try
		{
			return requestFrame(gen);
		}
		catch (FrameSourceException first)
		{
			if (!first.isTransient())
			{
				throw new SessionAbortedException(index, "Camera failed: " + first.getMessage(), first);
			}
			logger.warn("Shot {} failed ({}), retrying in {} ms", index + 1, first.getMessage(), RETRY_BACKOFF_MILLIS);
			transition(gen, SessionState.RETRY_OR_ABORT, null);
			pause(gen, RETRY_BACKOFF_MILLIS);
			transition(gen, SessionState.CAPTURING, null);
			try
			{
				return requestFrame(gen);
			}
			catch (FrameSourceException second)
			{
				second.addSuppressed(first);
				throw new SessionAbortedException(index, "Camera unavailable: " + second.getMessage(), second);
			}
		}
	}

	private void captureBurst(long gen, SessionConfig cfg) throws SessionCancelledSignal
	{
		transition(gen, SessionState.BURST, STATUS_BOOMERANG);
		countdown(gen, BURST_COUNTDOWN_SECONDS);
		fire(l -> l.onStatus(STATUS_MOVE_NOW));

		for (int i = 0; i < cfg.burstFrameCount(); i++)
		{
			checkActive(gen);
			try
			{
				BufferedImage frame = requestFrame(gen);
				int index = countBurst(gen);
				Path path;
				try
				{
					path = store.saveBurstFrame(frame, index);
				}
				finally
				{
					frame.flush();
				}
				RawShot burstFrame = new RawShot(index, path);
				synchronized (lock)
				{
					if (gen != generation)
					{
						throw new SessionCancelledSignal();
					}
					burstFrames.add(burstFrame);
				}
				fire(l -> l.onBurstFrameCaptured(burstFrame, cfg.burstFrameCount()));
			}
			catch (FrameSourceException | IOException e)
			{
				logger.warn("Skipping burst frame {}: {}", i + 1, e.getMessage());
			}
			if (i < cfg.burstFrameCount() - 1)
			{
				pause(gen, cfg.burstIntervalMillis());
			}
		}
	}

	private void countdown(long gen, int seconds) throws SessionCancelledSignal
	{
		for (int remaining = seconds; remaining >= 1; remaining--)
		{
			checkActive(gen);
			int tick = remaining;
			fire(l -> l.onCountdownTick(tick));
			playTick();
			pause(gen, TICK_MILLIS);
		}
	}

	private void playTick()
	{
		try
		{
			cues.tick();
		}
		catch (RuntimeException e)
		{
			logger.debug("Countdown cue failed: {}", e.toString());
		}
	}

	private BufferedImage requestFrame(long gen) throws FrameSourceException, SessionCancelledSignal
	{
		ExclusiveFrameSource.Lease current;
		synchronized (lock)
		{
			if (gen != generation || lease == null)
			{
				throw new SessionCancelledSignal();
			}
			current = lease;
		}
		return current.requestFrame();
	}

	private void pause(long gen, long millis) throws SessionCancelledSignal
	{
		if (millis > 0)
		{
			try
			{
				clock.sleep(millis);
			}
			catch (InterruptedException e)
			{
				if (isActive(gen))
				{
					// Interrupted by someone other than cancel(), e.g. executor shutdown
					cancel();
				}
				throw new SessionCancelledSignal();
			}
		}
		checkActive(gen);
	}

	private void complete(long gen)
	{
		SessionResult result;
		synchronized (lock)
		{
			if (gen != generation)
			{
				return;
			}
			state = SessionState.COMPLETE;
			result = new SessionResult(shots, burstFrames);
			releaseLease();
		}
		logger.info("Session {} complete: {} photo(s), {} burst frame(s)",
				gen, result.photos().size(), result.burstFrames().size());
		fire(l -> l.onStateChanged(SessionState.COMPLETE));
		fire(l -> l.onStatus(STATUS_DONE));
		fire(l -> l.onComplete(result));
	}

	private void abort(long gen, SessionAbortedException error)
	{
		synchronized (lock)
		{
			if (gen != generation)
			{
				return;
			}
			generation++;
			state = SessionState.IDLE;
			shots.clear();
			burstFrames.clear();
			releaseLease();
		}
		logger.error("Session {} aborted at shot {}", gen, error.shotIndex() + 1, error);
		fire(l -> l.onStateChanged(SessionState.IDLE));
		fire(l -> l.onAborted(error));
	}

	private void transition(long gen, SessionState next, String status) throws SessionCancelledSignal
	{
		synchronized (lock)
		{
			if (gen != generation)
			{
				throw new SessionCancelledSignal();
			}
			state = next;
		}
		fire(l -> l.onStateChanged(next));
		if (status != null)
		{
			fire(l -> l.onStatus(status));
		}
	}

	private void checkActive(long gen) throws SessionCancelledSignal
	{
		if (!isActive(gen))
		{
			throw new SessionCancelledSignal();
		}
	}

	private boolean isActive(long gen)
	{
		synchronized (lock)
		{
			return gen == generation;
		}
	}

	private SessionConfig configFor(long gen) throws SessionCancelledSignal
	{
		synchronized (lock)
		{
			if (gen != generation)
			{
				throw new SessionCancelledSignal();
			}
			return config;
		}
	}

	private int countShots(long gen) throws SessionCancelledSignal
	{
		synchronized (lock)
		{
			if (gen != generation)
			{
				throw new SessionCancelledSignal();
			}
			return shots.size();
		}
	}

	private int countBurst(long gen) throws SessionCancelledSignal
	{
		synchronized (lock)
		{
			if (gen != generation)
			{
				throw new SessionCancelledSignal();
			}
			return burstFrames.size();
		}
	}

	/** Index of the shot in progress; used when a failure has no shot context of its own. */
	private int pendingShotIndex()
	{
		synchronized (lock)
		{
			return shots.size();
		}
	}

	private void bindWorker(long gen)
	{
		synchronized (lock)
		{
			if (gen == generation)
			{
				worker = Thread.currentThread();
			}
		}
	}

	private void unbindWorker(long gen)
	{
		boolean stale;
		synchronized (lock)
		{
			if (worker == Thread.currentThread())
			{
				worker = null;
			}
			stale = gen != generation;
		}
		if (stale)
		{
			// Clear an interrupt left over from cancel() so it cannot leak into the next task
			Thread.interrupted();
		}
	}

	private void releaseLease()
	{
		if (lease != null)
		{
			lease.close();
			lease = null;
		}
	}

	private void fire(Consumer<SessionListener> event)
	{
		try
		{
			event.accept(listener);
		}
		catch (RuntimeException e)
		{
			logger.warn("Session listener threw", e);
		}
	}

	/** Unwinds a worker whose session was cancelled or superseded. */
	private static final class SessionCancelledSignal extends Exception
	{
		SessionCancelledSignal()
		{
			super(null, null, false, false);
		}
	}
}
