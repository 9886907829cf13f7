package com.largomodo.dotshop.sequence;

import com.largomodo.dotshop.core.EncodedFrame;
import com.largomodo.dotshop.core.FrameProcessingException;
import com.largomodo.dotshop.core.ModulationException;
import com.largomodo.dotshop.core.PackedBuffer;
import com.largomodo.dotshop.core.PixelGrid;
import com.largomodo.dotshop.core.ScreenProfile;
import com.largomodo.dotshop.core.SourceFrame;
import com.largomodo.dotshop.pack.BitPacker;
import com.largomodo.dotshop.quantize.Quantizer;
import com.largomodo.dotshop.transform.TransformPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.Objects;

/**
 * Runs one frame through quantize, pack and transform.
 * <p>
 * Holds only immutable collaborators, so a single instance serves every worker thread. Domain
 * failures propagate unchanged; anything else is wrapped in a {@link FrameProcessingException}
 * naming the frame and stage.
 */
public class FrameEncoder {

    static final String MDC_FRAME = "frame";

    private static final Logger log = LoggerFactory.getLogger(FrameEncoder.class);

    private final Quantizer quantizer;
    private final BitPacker packer;
    private final TransformPipeline transforms;

    public FrameEncoder(Quantizer quantizer, BitPacker packer, TransformPipeline transforms) {
        this.quantizer = Objects.requireNonNull(quantizer, "quantizer must not be null");
        this.packer = Objects.requireNonNull(packer, "packer must not be null");
        this.transforms = Objects.requireNonNull(transforms, "transforms must not be null");
    }

    /**
     * Configuration-time checks: fails before any frame is read if the profile cannot be served.
     */
    public void validate(ScreenProfile profile) {
        quantizer.validate(profile);
    }

    public EncodedFrame encode(SourceFrame frame, ScreenProfile profile) {
        MDC.put(MDC_FRAME, Long.toString(frame.ordinal()));
        String stage = "quantize";
        try {
            PixelGrid grid = quantizer.quantize(frame.image(), profile);

            stage = "pack";
            PackedBuffer packed = packer.pack(grid, profile);

            stage = "transform";
            PackedBuffer result = packed;
            if (!transforms.isEmpty()) {
                result = PackedBuffer.copyOf(transforms.apply(packed.toByteArray()));
            }

            log.debug("Encoded frame {} ({} ms): {} bytes packed, {} bytes after transforms",
                    frame.ordinal(), frame.durationMs(), packed.length(), result.length());
            return new EncodedFrame(frame.ordinal(), frame.durationMs(), result,
                    packed.length(), transforms.sizePreserving());
        } catch (ModulationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new FrameProcessingException("Frame processing failed: " + e.getMessage(),
                    profile.id(), frame.ordinal(), stage, e);
        } finally {
            MDC.remove(MDC_FRAME);
        }
    }
}
