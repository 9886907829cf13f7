package com.largomodo.dotshop.emit;

import com.largomodo.dotshop.core.EncodedFrame;
import com.largomodo.dotshop.core.PackedBuffer;
import com.largomodo.dotshop.core.ScreenProfile;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Shared layout of every emitter: header comment, preamble, one array per frame, then the
 * frame table for animations.
 * <p>
 * Subclasses supply the language syntax. Byte values are always written as lowercase two-digit
 * hex literals ({@code 0x00}..{@code 0xff}), which all supported languages accept unchanged.
 */
public abstract class AbstractSourceEmitter implements FormatEmitter {

    protected static final String INDENT = "    ";

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    @Override
    public EmissionResult emit(List<EncodedFrame> frames, ScreenProfile profile, EmissionRequest request) {
        if (frames.isEmpty()) {
            throw new IllegalArgumentException("Nothing to emit for profile " + profile.id() + ": no frames");
        }
        String symbol = request.symbolName();
        boolean animated = frames.size() > 1;
        boolean sizePreserving = frames.stream().allMatch(EncodedFrame::sizePreserving);

        StringBuilder out = new StringBuilder();
        out.append(comment(splitLines(headerLines(frames, profile, sizePreserving))));
        out.append(preamble(profile, symbol, frames.size()));

        List<String> names = new ArrayList<>(frames.size());
        List<Integer> sizes = new ArrayList<>(frames.size());
        for (EncodedFrame frame : frames) {
            String name = animated ? symbol + "_frame_" + frame.ordinal() : symbol;
            names.add(name);
            sizes.add(frame.buffer().length());
            out.append('\n');
            out.append(renderBuffer(name, frame.buffer(), request));
        }

        if (animated) {
            List<Long> durations = frames.stream().map(EncodedFrame::durationMs).toList();
            out.append('\n');
            out.append(frameTable(symbol, names, durations, sizePreserving ? null : sizes));
        } else if (!sizePreserving) {
            out.append('\n');
            out.append(lengthConstant(symbol, sizes.get(0)));
        }
        return new EmissionResult(targetId(), out.toString(), sizes);
    }

    @Override
    public String renderBuffer(String name, PackedBuffer buffer, EmissionRequest request) {
        StringBuilder out = new StringBuilder();
        out.append(arrayStart(name, buffer.length())).append('\n');
        appendWrapped(out, buffer, request);
        out.append(arrayEnd()).append('\n');
        return out.toString();
    }

    /**
     * Writes the byte literals, separated by ", ", each line starting with {@link #INDENT} and
     * ending with a trailing comma. A line breaks before it would exceed the wrap width or the
     * chunk size; a single literal always fits on its own line.
     */
    private static void appendWrapped(StringBuilder out, PackedBuffer buffer, EmissionRequest request) {
        int lineChars = 0;
        int lineValues = 0;
        for (int i = 0; i < buffer.length(); i++) {
            // "0xNN," is 5 characters, plus a separating space when not first on the line
            int needed = lineValues == 0 ? INDENT.length() + 5 : 6;
            if (lineValues > 0 && (lineValues == request.chunkSize() || lineChars + needed > request.lineWrapWidth())) {
                out.append('\n');
                lineChars = 0;
                lineValues = 0;
                needed = INDENT.length() + 5;
            }
            if (lineValues == 0) {
                out.append(INDENT);
            } else {
                out.append(' ');
            }
            int value = buffer.get(i);
            out.append('0').append('x').append(HEX[value >>> 4]).append(HEX[value & 0xF]).append(',');
            lineChars += needed;
            lineValues++;
        }
        if (lineValues > 0) {
            out.append('\n');
        }
    }

    protected List<String> headerLines(List<EncodedFrame> frames, ScreenProfile profile, boolean sizePreserving) {
        List<String> lines = new ArrayList<>();
        lines.add("Generated by DotShop");
        lines.add("profile: " + profile.id() + " (" + profile.displayName() + ")");
        lines.add(String.format(Locale.ROOT, "resolution: %dx%d, color mode: %s, screen type: %s",
                profile.width(), profile.height(), profile.colorMode(), profile.screenType()));
        lines.add(String.format(Locale.ROOT, "scan: %s, bit order: %s, alignment: %d",
                profile.scanDirection(), profile.bitOrder(), profile.alignment()));
        lines.add("frames: " + frames.size() + (sizePreserving ? "" : " (transformed, lengths vary)"));
        if (!profile.description().isEmpty()) {
            lines.add(profile.description());
        }
        return lines;
    }

    /**
     * Breaks header lines at embedded line terminators so each physical line gets its own
     * comment prefix. Profile names and descriptions come from user JSON and may span lines.
     */
    private static List<String> splitLines(List<String> lines) {
        List<String> physical = new ArrayList<>(lines.size());
        for (String line : lines) {
            physical.addAll(List.of(line.split("\\R", -1)));
        }
        return physical;
    }

    protected static String constantName(String symbol, String suffix) {
        return symbol.toUpperCase(Locale.ROOT) + "_" + suffix;
    }

    protected abstract String comment(List<String> lines);

    /**
     * Includes, imports and dimension constants placed between header and arrays.
     */
    protected abstract String preamble(ScreenProfile profile, String symbol, int frameCount);

    protected abstract String arrayStart(String name, int length);

    protected abstract String arrayEnd();

    /**
     * Frame list, durations and, when {@code lengths} is non-null, per-frame byte lengths.
     */
    protected abstract String frameTable(String symbol, List<String> names, List<Long> durations, List<Integer> lengths);

    /**
     * Byte length of a single transformed buffer whose size is not fixed by the profile.
     */
    protected abstract String lengthConstant(String symbol, int length);

    protected static String join(List<?> values) {
        StringBuilder joined = new StringBuilder();
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
                joined.append(", ");
            }
            joined.append(values.get(i));
        }
        return joined.toString();
    }
}
