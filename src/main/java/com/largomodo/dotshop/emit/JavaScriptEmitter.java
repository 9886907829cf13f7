package com.largomodo.dotshop.emit;

import com.largomodo.dotshop.core.ScreenProfile;

import java.util.List;

/**
 * ES module exporting one {@code Uint8Array} per frame.
 */
public class JavaScriptEmitter extends AbstractSourceEmitter {

    public static final String ID = "javascript";

    @Override
    public String targetId() {
        return ID;
    }

    @Override
    protected String comment(List<String> lines) {
        StringBuilder out = new StringBuilder();
        for (String line : lines) {
            out.append("// ").append(line).append('\n');
        }
        return out.toString();
    }

    @Override
    protected String preamble(ScreenProfile profile, String symbol, int frameCount) {
        return "\n"
                + "export const " + constantName(symbol, "WIDTH") + " = " + profile.width() + ";\n"
                + "export const " + constantName(symbol, "HEIGHT") + " = " + profile.height() + ";\n"
                + "export const " + constantName(symbol, "FRAME_COUNT") + " = " + frameCount + ";\n";
    }

    @Override
    protected String arrayStart(String name, int length) {
        return "export const " + name + " = new Uint8Array([";
    }

    @Override
    protected String arrayEnd() {
        return "]);";
    }

    @Override
    protected String frameTable(String symbol, List<String> names, List<Long> durations, List<Integer> lengths) {
        StringBuilder out = new StringBuilder();
        out.append("export const ").append(symbol).append("_frames = [").append(join(names)).append("];\n");
        out.append("export const ").append(symbol).append("_durations_ms = [").append(join(durations)).append("];\n");
        if (lengths != null) {
            out.append("export const ").append(symbol).append("_lengths = [").append(join(lengths)).append("];\n");
        }
        return out.toString();
    }

    @Override
    protected String lengthConstant(String symbol, int length) {
        return "export const " + constantName(symbol, "LENGTH") + " = " + length + ";\n";
    }
}
