package io.github.jakubt4.skychart.sky;

/**
 * Thrown when the sky is used before {@link Sky#load()} completed.
 */
public class SkyNotReadyException extends IllegalStateException {

    public SkyNotReadyException(final Sky.State state) {
        super("Sky is not loaded (state " + state + "), call load() before rendering");
    }
}
