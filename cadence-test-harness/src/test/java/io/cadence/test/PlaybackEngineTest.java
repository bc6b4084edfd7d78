package io.cadence.test;

import io.cadence.api.*;
import io.cadence.core.*;
import org.junit.jupiter.api.*;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.*;

class PlaybackEngineTest {

    private static final long NOW = 1_700_000_000_000L;

    private FakeAudioEngine audio;
    private ManualFrameScheduler frames;
    private PlaybackEngine engine;
    private List<TransportEvent> events;

    @BeforeEach
    void setUp() {
        audio = new FakeAudioEngine();
        frames = new ManualFrameScheduler();
        engine = new PlaybackEngine(audio, configBuilder().build());
        events = new CopyOnWriteArrayList<>();
        engine.subscribe(events::add);
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    private PlaybackEngineConfig.Builder configBuilder() {
        return PlaybackEngineConfig.builder()
            .frameScheduler(frames)
            .clock(Clock.fixed(Instant.ofEpochMilli(NOW), ZoneOffset.UTC))
            .smoothJumpSettle(Duration.ZERO)
            .scrubRelease(Duration.ZERO);
    }

    private static boolean await(CompletableFuture<Boolean> future) throws Exception {
        return future.get(2, TimeUnit.SECONDS);
    }

    private List<StateChangeReason> reasons() {
        List<StateChangeReason> reasons = new ArrayList<>();
        for (TransportEvent e : events) {
            if (e instanceof TransportEvent.StateChanged changed) {
                reasons.add(changed.reason());
            }
        }
        return reasons;
    }

    private List<Double> positionUpdates() {
        List<Double> positions = new ArrayList<>();
        for (TransportEvent e : events) {
            if (e instanceof TransportEvent.PositionUpdate update) {
                positions.add(update.position());
            }
        }
        return positions;
    }

    // -- Initial state and subscription ---------------------------------------

    @Test
    void initialStateIsStoppedAtZeroWithDefaultLoop() {
        TransportState s = engine.getState();
        assertThat(s.playbackState()).isEqualTo(PlaybackState.STOPPED);
        assertThat(s.isPlaying()).isFalse();
        assertThat(s.currentPosition()).isEqualTo(0.0);
        assertThat(s.bpm()).isEqualTo(TransportConstants.DEFAULT_BPM);
        assertThat(s.loopEnabled()).isTrue();
        assertThat(s.loopStart()).isEqualTo(0.0);
        assertThat(s.loopEnd()).isEqualTo(64.0);
        assertThat(engine.isTracking()).isFalse();
    }

    @Test
    void subscribeReplaysCurrentStateToNewSubscriberOnly() {
        assertThat(reasons()).containsExactly(StateChangeReason.SUBSCRIPTION);

        List<TransportEvent> second = new ArrayList<>();
        engine.subscribe(second::add);

        assertThat(events).hasSize(1);
        assertThat(second).hasSize(1);
        TransportEvent.StateChanged replay = (TransportEvent.StateChanged) second.get(0);
        assertThat(replay.reason()).isEqualTo(StateChangeReason.SUBSCRIPTION);
        assertThat(replay.state()).isEqualTo(engine.getState());
        assertThat(replay.timestampMs()).isEqualTo(NOW);
    }

    @Test
    void typedSubscriptionReceivesOnlyThatTypeAndNoReplay() throws Exception {
        List<TransportEvent> positions = new ArrayList<>();
        engine.subscribe(TransportEventType.POSITION_UPDATE, positions::add);
        assertThat(positions).isEmpty();

        await(engine.play(8));

        assertThat(positions).isNotEmpty();
        assertThat(positions).allMatch(e -> e.type() == TransportEventType.POSITION_UPDATE);
    }

    @Test
    void unsubscribeStopsDelivery() throws Exception {
        List<TransportEvent> received = new ArrayList<>();
        Subscription subscription = engine.subscribe(received::add);
        int before = received.size();
        subscription.unsubscribe();

        await(engine.play(4));

        assertThat(received).hasSize(before);
    }

    @Test
    void throwingSubscriberDoesNotBlockOthers() throws Exception {
        engine.subscribe(e -> { throw new IllegalStateException("listener bug"); });
        List<TransportEvent> after = new ArrayList<>();
        engine.subscribe(after::add);

        assertThat(await(engine.play(0))).isTrue();

        assertThat(reasons()).contains(StateChangeReason.PLAY_COMMAND);
        assertThat(after).anyMatch(e -> e instanceof TransportEvent.StateChanged sc
            && sc.reason() == StateChangeReason.PLAY_COMMAND);
    }

    // -- Play / pause / toggle ------------------------------------------------

    @Test
    void playFromPositionRelocatesThenStarts() throws Exception {
        assertThat(await(engine.play(8))).isTrue();

        assertThat(audio.calls()).containsExactly("jumpToStep(8.0)", "play(8.0)");
        assertThat(engine.getState().playbackState()).isEqualTo(PlaybackState.PLAYING);
        assertThat(engine.currentPosition()).isEqualTo(8.0);
        assertThat(engine.isTracking()).isTrue();
        assertThat(reasons()).endsWith(StateChangeReason.PLAY_COMMAND);
        assertThat(positionUpdates()).containsExactly(8.0);
    }

    @Test
    void playClampsNegativeStartPosition() throws Exception {
        await(engine.play(-12));
        assertThat(engine.currentPosition()).isEqualTo(0.0);
        assertThat(audio.calls()).containsExactly("jumpToStep(0.0)", "play(0.0)");
    }

    @Test
    void playWhilePlayingReturnsFalseWithoutEngineCall() throws Exception {
        await(engine.play(0));
        audio.clearCalls();

        assertThat(await(engine.play(16))).isFalse();
        assertThat(audio.calls()).isEmpty();
        assertThat(engine.currentPosition()).isEqualTo(0.0);
    }

    @Test
    void pauseWhenNotPlayingReturnsFalse() throws Exception {
        assertThat(await(engine.pause())).isFalse();
        assertThat(audio.calls()).isEmpty();
    }

    @Test
    void playPauseToggleResumesAtPausedPosition() throws Exception {
        await(engine.play(8));
        audio.setStep(12);
        frames.frame();

        assertThat(await(engine.pause())).isTrue();
        double sampled = engine.currentPosition();
        assertThat(sampled).isEqualTo(12.0);
        assertThat(engine.getState().playbackState()).isEqualTo(PlaybackState.PAUSED);
        assertThat(engine.isTracking()).isFalse();

        assertThat(await(engine.togglePlayPause())).isTrue();
        assertThat(engine.getState().playbackState()).isEqualTo(PlaybackState.PLAYING);
        assertThat(engine.currentPosition()).isEqualTo(sampled);
        assertThat(audio.calls()).endsWith("play(12.0)");
    }

    @Test
    void toggleWhilePlayingPauses() throws Exception {
        await(engine.play(0));
        assertThat(await(engine.togglePlayPause())).isTrue();
        assertThat(engine.getState().playbackState()).isEqualTo(PlaybackState.PAUSED);
    }

    @Test
    void toggleFromStoppedPlaysFromCurrentPosition() throws Exception {
        await(engine.jumpToPosition(12, JumpOptions.immediate()));
        audio.clearCalls();

        assertThat(await(engine.togglePlayPause())).isTrue();

        assertThat(audio.calls()).containsExactly("jumpToStep(12.0)", "play(12.0)");
        assertThat(engine.currentPosition()).isEqualTo(12.0);
    }

    @Test
    void rapidDoublePlayProducesOneTransition() throws Exception {
        audio.hold();
        CompletableFuture<Boolean> first = engine.play();
        CompletableFuture<Boolean> second = engine.play();

        assertThat(first).isNotDone();
        assertThat(second).isNotDone();
        assertThat(audio.calls()).containsExactly("play(0.0)");

        audio.releaseAll();

        assertThat(await(first)).isTrue();
        assertThat(await(second)).isFalse();
        assertThat(reasons()).containsOnlyOnce(StateChangeReason.PLAY_COMMAND);
        assertThat(audio.calls()).containsExactly("play(0.0)");
    }

    // -- Stop -----------------------------------------------------------------

    @Test
    void stopRehomesToLoopStartWhenLooping() throws Exception {
        await(engine.setLoopRange(16, 64));
        await(engine.play(20));

        assertThat(await(engine.stop())).isTrue();

        assertThat(engine.currentPosition()).isEqualTo(16.0);
        assertThat(engine.getState().playbackState()).isEqualTo(PlaybackState.STOPPED);
        assertThat(engine.getState().lastStopTime()).isEqualTo(NOW);
        assertThat(engine.isTracking()).isFalse();
        TransportEvent last = events.get(events.size() - 1);
        TransportEvent beforeLast = events.get(events.size() - 2);
        assertThat(beforeLast).isInstanceOf(TransportEvent.StateChanged.class);
        assertThat(((TransportEvent.StateChanged) beforeLast).reason())
            .isEqualTo(StateChangeReason.STOP_COMMAND);
        assertThat(last).isEqualTo(new TransportEvent.PositionUpdate(16.0, NOW));
    }

    @Test
    void stopRehomesToZeroWhenLoopDisabled() throws Exception {
        await(engine.setLoopRange(16, 64));
        await(engine.setLoopEnabled(false));
        await(engine.play(20));

        await(engine.stop());

        assertThat(engine.currentPosition()).isEqualTo(0.0);
    }

    @Test
    void stopTwiceLeavesIdenticalState() throws Exception {
        await(engine.play(24));
        await(engine.stop());
        TransportState once = engine.getState();

        assertThat(await(engine.stop())).isTrue();

        assertThat(engine.getState()).isEqualTo(once);
    }

    // -- Failure semantics ----------------------------------------------------

    @Test
    void failedPlayLeavesStateUnchanged() throws Exception {
        TransportState before = engine.getState();
        audio.failNext("play");

        assertThat(await(engine.play(8))).isFalse();

        assertThat(engine.getState()).isEqualTo(before);
        assertThat(engine.isTracking()).isFalse();
        assertThat(reasons()).doesNotContain(StateChangeReason.PLAY_COMMAND);
    }

    @Test
    void synchronousEngineThrowIsTreatedAsFailure() throws Exception {
        await(engine.play(0));
        audio.throwNext("pause");

        assertThat(await(engine.pause())).isFalse();

        assertThat(engine.getState().playbackState()).isEqualTo(PlaybackState.PLAYING);
        assertThat(engine.isTracking()).isTrue();
    }

    @Test
    void failedStopKeepsPlaying() throws Exception {
        await(engine.play(8));
        TransportState before = engine.getState();
        audio.failNext("stop");

        assertThat(await(engine.stop())).isFalse();
        assertThat(engine.getState()).isEqualTo(before);
    }

    @Test
    void stalledEngineCallTimesOutAndFreesTheChain() throws Exception {
        PlaybackEngine bounded = new PlaybackEngine(audio,
            configBuilder().commandTimeout(Duration.ofMillis(50)).build());
        assertThat(bounded.config().commandTimeout()).isEqualTo(Duration.ofMillis(50));
        await(bounded.play(0));
        audio.stallNext("pause");

        CompletableFuture<Boolean> pause = bounded.pause();
        CompletableFuture<Boolean> stop = bounded.stop();

        assertThat(await(pause)).isFalse();
        assertThat(await(stop)).isTrue();
        assertThat(bounded.getState().playbackState()).isEqualTo(PlaybackState.STOPPED);
        assertThat(audio.calls()).endsWith("pause()", "stop()");
        bounded.close();
    }

    @Test
    void commandTimeoutMustBePositive() {
        assertThatThrownBy(() -> PlaybackEngineConfig.builder().commandTimeout(Duration.ZERO))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PlaybackEngineConfig.builder().commandTimeout(Duration.ofMillis(-1)))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(PlaybackEngineConfig.DEFAULTS.commandTimeout())
            .isEqualTo(Duration.ofMillis(TransportConstants.COMMAND_TIMEOUT_MS));
    }

    @Test
    void failedSetBpmKeepsTempo() throws Exception {
        audio.failNext("setBpm");
        assertThat(await(engine.setBpm(90))).isFalse();
        assertThat(engine.getState().bpm()).isEqualTo(TransportConstants.DEFAULT_BPM);
    }

    // -- Settings -------------------------------------------------------------

    @Test
    void setBpmClampsToSupportedRange() throws Exception {
        await(engine.play(8));

        await(engine.setBpm(500));
        assertThat(engine.getState().bpm()).isEqualTo(300.0);
        await(engine.setBpm(10));
        assertThat(engine.getState().bpm()).isEqualTo(60.0);

        assertThat(audio.calls()).contains("setBpm(300.0)", "setBpm(60.0)");
        assertThat(engine.currentPosition()).isEqualTo(8.0);
        assertThat(reasons()).containsSubsequence(
            StateChangeReason.BPM_CHANGE, StateChangeReason.BPM_CHANGE);
    }

    @Test
    void setLoopRangeRepairsInvertedRange() throws Exception {
        assertThat(await(engine.setLoopRange(10, 5))).isTrue();

        assertThat(engine.getState().loopStart()).isEqualTo(10.0);
        assertThat(engine.getState().loopEnd()).isEqualTo(11.0);
        assertThat(audio.calls()).containsExactly("setLoopPoints(10.0,11.0)");
        assertThat(reasons()).endsWith(StateChangeReason.LOOP_CHANGE);
    }

    @Test
    void setLoopRangeClampsNegativeStart() throws Exception {
        await(engine.setLoopRange(-5, 0.5));
        assertThat(engine.getState().loopStart()).isEqualTo(0.0);
        assertThat(engine.getState().loopEnd()).isEqualTo(1.0);
    }

    @Test
    void setLoopEnabledDoesNotMovePosition() throws Exception {
        await(engine.jumpToPosition(30, JumpOptions.immediate()));

        assertThat(await(engine.setLoopEnabled(false))).isTrue();

        assertThat(engine.getState().loopEnabled()).isFalse();
        assertThat(engine.currentPosition()).isEqualTo(30.0);
    }

    // -- Ghost playhead -------------------------------------------------------

    @Test
    void ghostPositionNeverTouchesCommittedPosition() throws Exception {
        await(engine.play(8));

        engine.setGhostPosition(40);
        assertThat(engine.getState().ghostPosition()).hasValue(40.0);
        assertThat(engine.currentPosition()).isEqualTo(8.0);
        assertThat(engine.displayPosition()).isEqualTo(8.0);

        engine.clearGhostPosition();
        assertThat(engine.getState().ghostPosition()).isEmpty();

        List<TransportEvent> ghosts = events.stream()
            .filter(e -> e.type() == TransportEventType.GHOST_POSITION_CHANGE)
            .toList();
        assertThat(ghosts).hasSize(2);
        assertThat(((TransportEvent.GhostPositionChanged) ghosts.get(0)).position()).hasValue(40.0);
        assertThat(((TransportEvent.GhostPositionChanged) ghosts.get(1)).position()).isEmpty();
    }

    // -- Position tracking ----------------------------------------------------

    @Test
    void trackingPublishesOnlyRealMoves() throws Exception {
        await(engine.play(0));
        events.clear();

        frames.frame();
        assertThat(positionUpdates()).isEmpty();

        audio.setStep(4);
        frames.frame();
        assertThat(positionUpdates()).containsExactly(4.0);
        assertThat(engine.getState().lastUpdateTime()).isEqualTo(NOW);
    }

    @Test
    void trackingIgnoresJitterBelowEpsilon() throws Exception {
        PlaybackEngine coarse = new PlaybackEngine(audio,
            configBuilder().positionEpsilon(0.5).build());
        List<Double> updates = new ArrayList<>();
        coarse.subscribe(TransportEventType.POSITION_UPDATE,
            e -> updates.add(((TransportEvent.PositionUpdate) e).position()));
        await(coarse.play(0));
        updates.clear();

        audio.setStep(0.25);
        frames.frame();
        assertThat(updates).isEmpty();
        assertThat(coarse.currentPosition()).isEqualTo(0.0);

        audio.setStep(1.0);
        frames.frame();
        assertThat(updates).containsExactly(1.0);
        coarse.close();
    }

    @Test
    void trackerEndsItselfWhileScrubbingAndResumesAfter() throws Exception {
        await(engine.play(0));
        engine.beginScrub();

        assertThat(engine.getState().isUserScrubbing()).isTrue();
        assertThat(reasons()).endsWith(StateChangeReason.SCRUB_START);
        assertThat(engine.isTracking()).isTrue();

        audio.setStep(8);
        frames.frame();
        assertThat(engine.isTracking()).isFalse();
        assertThat(frames.liveTaskCount()).isZero();
        assertThat(engine.currentPosition()).isEqualTo(0.0);

        engine.endScrub();
        assertThat(reasons()).endsWith(StateChangeReason.SCRUB_END);
        assertThat(engine.isTracking()).isTrue();

        frames.frame();
        assertThat(engine.currentPosition()).isEqualTo(8.0);
    }

    @Test
    void trackingSurvivesScrubTogglesRacingTheFrameThread() throws Exception {
        await(engine.play(0));
        AtomicBoolean running = new AtomicBoolean(true);
        Thread frameThread = new Thread(() -> {
            while (running.get()) {
                frames.frame();
            }
        }, "test-frames");
        frameThread.start();
        try {
            for (int i = 0; i < 2000; i++) {
                engine.beginScrub();
                engine.endScrub();
            }
        } finally {
            running.set(false);
            frameThread.join(TimeUnit.SECONDS.toMillis(5));
        }

        assertThat(frameThread.isAlive()).isFalse();
        assertThat(engine.getState().isPlaying()).isTrue();
        assertThat(engine.getState().isUserScrubbing()).isFalse();
        assertThat(engine.isTracking()).isTrue();
        assertThat(frames.liveTaskCount()).isEqualTo(1);

        audio.setStep(12);
        frames.frame();
        assertThat(engine.currentPosition()).isEqualTo(12.0);
    }

    @Test
    void pauseCancelsTheFrameTask() throws Exception {
        await(engine.play(0));
        assertThat(frames.liveTaskCount()).isEqualTo(1);

        await(engine.pause());

        assertThat(frames.liveTaskCount()).isZero();
    }

    @Test
    void transportReadFailureSkipsFrameButKeepsTracking() throws Exception {
        await(engine.play(0));
        audio.breakTransport(true);
        audio.setStep(4);

        assertThatCode(() -> frames.frame()).doesNotThrowAnyException();
        assertThat(engine.isTracking()).isTrue();
        assertThat(engine.currentPosition()).isEqualTo(0.0);

        audio.breakTransport(false);
        frames.frame();
        assertThat(engine.currentPosition()).isEqualTo(4.0);
    }

    // -- Jump -----------------------------------------------------------------

    @Test
    void jumpWhileStoppedRelocatesDirectly() throws Exception {
        assertThat(await(engine.jumpToPosition(20))).isTrue();

        assertThat(audio.calls()).containsExactly("jumpToStep(20.0)");
        assertThat(engine.currentPosition()).isEqualTo(20.0);
        assertThat(engine.getState().playbackState()).isEqualTo(PlaybackState.STOPPED);
    }

    @Test
    void jumpBracketsItselfWithScrubEvents() throws Exception {
        await(engine.jumpToPosition(20));

        assertThat(reasons()).containsExactly(
            StateChangeReason.SUBSCRIPTION, StateChangeReason.SCRUB_START, StateChangeReason.SCRUB_END);
        assertThat(positionUpdates()).containsExactly(20.0);
        assertThat(engine.getState().isUserScrubbing()).isFalse();
    }

    @Test
    void jumpClampsNegativePosition() throws Exception {
        await(engine.jumpToPosition(-3, JumpOptions.immediate()));
        assertThat(engine.currentPosition()).isEqualTo(0.0);
        assertThat(audio.calls()).containsExactly("jumpToStep(0.0)");
    }

    @Test
    void smoothJumpWhilePlayingPausesThenRestarts() throws Exception {
        await(engine.play(0));
        audio.clearCalls();

        assertThat(await(engine.jumpToPosition(32))).isTrue();

        assertThat(audio.calls()).containsExactly("pause()", "play(32.0)");
        assertThat(engine.currentPosition()).isEqualTo(32.0);
        assertThat(engine.getState().playbackState()).isEqualTo(PlaybackState.PLAYING);
    }

    @Test
    void smoothJumpWaitsForSettleDelay() throws Exception {
        PlaybackEngine settling = new PlaybackEngine(audio,
            configBuilder().smoothJumpSettle(Duration.ofMillis(30)).build());
        await(settling.play(0));
        audio.clearCalls();

        assertThat(await(settling.jumpToPosition(48))).isTrue();

        assertThat(audio.calls()).containsExactly("pause()", "play(48.0)");
        assertThat(settling.currentPosition()).isEqualTo(48.0);
        settling.close();
    }

    @Test
    void smoothJumpThatCannotRestartResumesAtPreviousPosition() throws Exception {
        await(engine.play(4));
        audio.clearCalls();
        audio.failNext("play");

        assertThat(await(engine.jumpToPosition(32))).isFalse();

        assertThat(audio.calls()).containsExactly("pause()", "play(32.0)", "play(4.0)");
        assertThat(engine.currentPosition()).isEqualTo(4.0);
        assertThat(engine.getState().playbackState()).isEqualTo(PlaybackState.PLAYING);
        assertThat(engine.isTracking()).isTrue();
    }

    @Test
    void immediateJumpWhilePlayingRelocatesInPlace() throws Exception {
        await(engine.play(0));
        audio.clearCalls();
        assertThat(JumpOptions.DEFAULTS.withSmooth(false)).isEqualTo(JumpOptions.immediate());

        assertThat(await(engine.jumpToPosition(32, JumpOptions.DEFAULTS.withSmooth(false)))).isTrue();

        assertThat(audio.calls()).containsExactly("jumpToStep(32.0)");
        assertThat(engine.getState().playbackState()).isEqualTo(PlaybackState.PLAYING);
        assertThat(engine.isTracking()).isTrue();
    }

    @Test
    void autoPlayJumpStartsPlaybackFromStopped() throws Exception {
        assertThat(await(engine.jumpToPosition(20, JumpOptions.DEFAULTS.withAutoPlay(true)))).isTrue();

        assertThat(engine.getState().playbackState()).isEqualTo(PlaybackState.PLAYING);
        assertThat(engine.currentPosition()).isEqualTo(20.0);
        assertThat(audio.calls()).endsWith("play(20.0)");
    }

    @Test
    void autoPlayIsIgnoredWhenPaused() throws Exception {
        await(engine.play(0));
        await(engine.pause());

        await(engine.jumpToPosition(20, JumpOptions.DEFAULTS.withAutoPlay(true)));

        assertThat(engine.getState().playbackState()).isEqualTo(PlaybackState.PAUSED);
    }

    @Test
    void failedJumpRollsBackOptimisticPosition() throws Exception {
        await(engine.jumpToPosition(12, JumpOptions.immediate()));
        events.clear();
        audio.failNext("jumpToStep");

        assertThat(await(engine.jumpToPosition(40))).isFalse();

        assertThat(engine.currentPosition()).isEqualTo(12.0);
        assertThat(positionUpdates()).containsExactly(40.0, 12.0);
        assertThat(engine.getState().isUserScrubbing()).isFalse();
    }

    @Test
    void jumpDuringUserScrubLeavesScrubOpen() throws Exception {
        engine.beginScrub();

        await(engine.jumpToPosition(10));

        assertThat(engine.getState().isUserScrubbing()).isTrue();
        assertThat(reasons()).containsOnlyOnce(StateChangeReason.SCRUB_START);
        assertThat(reasons()).doesNotContain(StateChangeReason.SCRUB_END);
    }

    @Test
    void scrubFlagIsReleasedAfterDelay() throws Exception {
        PlaybackEngine delayed = new PlaybackEngine(audio,
            configBuilder().scrubRelease(Duration.ofMillis(40)).build());

        await(delayed.jumpToPosition(10));
        assertThat(delayed.getState().isUserScrubbing()).isTrue();

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
        while (delayed.getState().isUserScrubbing() && System.nanoTime() < deadline) {
            Thread.sleep(5);
        }
        assertThat(delayed.getState().isUserScrubbing()).isFalse();
        delayed.close();
    }

    @Test
    void secondJumpQueuesBehindPendingJump() throws Exception {
        audio.hold();
        CompletableFuture<Boolean> first = engine.jumpToPosition(10, JumpOptions.immediate());
        CompletableFuture<Boolean> second = engine.jumpToPosition(20, JumpOptions.immediate());

        assertThat(audio.calls()).containsExactly("jumpToStep(10.0)");

        audio.releaseAll();

        assertThat(await(first)).isTrue();
        assertThat(await(second)).isTrue();
        assertThat(audio.calls()).containsExactly("jumpToStep(10.0)", "jumpToStep(20.0)");
        assertThat(engine.currentPosition()).isEqualTo(20.0);
    }

    // -- Lifecycle ------------------------------------------------------------

    @Test
    void closeDropsSubscribersAndRejectsCommands() throws Exception {
        await(engine.play(0));

        engine.close();

        assertThat(engine.isClosed()).isTrue();
        assertThat(engine.isTracking()).isFalse();
        assertThat(engine.subscriberCount()).isZero();
        assertThat(await(engine.stop())).isFalse();
        assertThat(await(engine.setBpm(120))).isFalse();
    }

    @Test
    void defaultEngineTracksOnItsOwnFrameThread() throws Exception {
        try (PlaybackEngine standalone = new PlaybackEngine(audio)) {
            assertThat(await(standalone.play(0))).isTrue();
            audio.setStep(16);

            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
            while (standalone.currentPosition() != 16.0 && System.nanoTime() < deadline) {
                Thread.sleep(5);
            }
            assertThat(standalone.currentPosition()).isEqualTo(16.0);
        }
    }

    @Test
    void nullCollaboratorsAreRejected() {
        assertThatThrownBy(() -> new PlaybackEngine(null))
            .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> new PlaybackEngine(audio, null))
            .isInstanceOf(NullPointerException.class);
    }
}
