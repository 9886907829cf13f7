package com.largomodo.dotshop.core;

/**
 * Base class of every failure raised by the modulation pipeline.
 * <p>
 * RuntimeException enables fail-fast validation without catch blocks at every call site.
 * Each instance optionally carries the context a caller needs for an actionable message:
 * the screen profile id, the frame ordinal and the pipeline stage. Available context is
 * appended to the message as {@code [profile=..., frame=..., stage=...]}.
 */
public class ModulationException extends RuntimeException {

    /**
     * Marker for "no frame" in {@link #getFrameOrdinal()}.
     */
    public static final long NO_FRAME = -1;

    private final String profileId;
    private final long frameOrdinal;
    private final String stage;

    public ModulationException(String message) {
        this(message, null, NO_FRAME, null, null);
    }

    public ModulationException(String message, Throwable cause) {
        this(message, null, NO_FRAME, null, cause);
    }

    /**
     * Constructs exception with full pipeline context.
     *
     * @param message      Details about the failure
     * @param profileId    Screen profile id, or null when not known
     * @param frameOrdinal Ordinal of the affected frame, or {@link #NO_FRAME}
     * @param stage        Pipeline stage name (e.g. "quantize", "pack"), or null
     * @param cause        Underlying cause, or null
     */
    public ModulationException(String message, String profileId, long frameOrdinal, String stage, Throwable cause) {
        super(withContext(message, profileId, frameOrdinal, stage), cause);
        this.profileId = profileId;
        this.frameOrdinal = frameOrdinal;
        this.stage = stage;
    }

    private static String withContext(String message, String profileId, long frameOrdinal, String stage) {
        StringBuilder context = new StringBuilder();
        if (profileId != null) {
            context.append("profile=").append(profileId);
        }
        if (frameOrdinal != NO_FRAME) {
            if (context.length() > 0) context.append(", ");
            context.append("frame=").append(frameOrdinal);
        }
        if (stage != null) {
            if (context.length() > 0) context.append(", ");
            context.append("stage=").append(stage);
        }
        return context.length() == 0 ? message : message + " [" + context + "]";
    }

    public String getProfileId() {
        return profileId;
    }

    public long getFrameOrdinal() {
        return frameOrdinal;
    }

    public String getStage() {
        return stage;
    }
}
