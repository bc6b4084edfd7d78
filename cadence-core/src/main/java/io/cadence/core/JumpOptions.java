package io.cadence.core;

/**
 * Options for PlaybackEngine.jumpToPosition.
 *
 * @param smooth   while playing, pause the audio engine, wait the settle delay,
 *                 then restart at the target instead of relocating in place
 * @param autoPlay start playback from the target if the transport was stopped
 */
public record JumpOptions(boolean smooth, boolean autoPlay) {

    /** smooth = true, autoPlay = false. */
    public static final JumpOptions DEFAULTS = new JumpOptions(true, false);

    /** Relocates in place even while playing. */
    public static JumpOptions immediate() {
        return new JumpOptions(false, false);
    }

    public JumpOptions withAutoPlay(boolean play) {
        return new JumpOptions(smooth, play);
    }

    public JumpOptions withSmooth(boolean isSmooth) {
        return new JumpOptions(isSmooth, autoPlay);
    }
}
