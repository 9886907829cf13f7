package com.largomodo.dotshop.emit;

import com.largomodo.dotshop.core.ScreenProfile;

import java.util.List;

/**
 * Python module with one {@code bytes} literal per frame (MicroPython compatible).
 */
public class PythonEmitter extends AbstractSourceEmitter {

    public static final String ID = "python";

    @Override
    public String targetId() {
        return ID;
    }

    @Override
    protected String comment(List<String> lines) {
        StringBuilder out = new StringBuilder();
        for (String line : lines) {
            out.append("# ").append(line).append('\n');
        }
        return out.toString();
    }

    @Override
    protected String preamble(ScreenProfile profile, String symbol, int frameCount) {
        return "\n"
                + constantName(symbol, "WIDTH") + " = " + profile.width() + "\n"
                + constantName(symbol, "HEIGHT") + " = " + profile.height() + "\n"
                + constantName(symbol, "FRAME_COUNT") + " = " + frameCount + "\n";
    }

    @Override
    protected String arrayStart(String name, int length) {
        return name + " = bytes([";
    }

    @Override
    protected String arrayEnd() {
        return "])";
    }

    @Override
    protected String frameTable(String symbol, List<String> names, List<Long> durations, List<Integer> lengths) {
        StringBuilder out = new StringBuilder();
        out.append(symbol).append("_frames = [").append(join(names)).append("]\n");
        out.append(symbol).append("_durations_ms = [").append(join(durations)).append("]\n");
        if (lengths != null) {
            out.append(symbol).append("_lengths = [").append(join(lengths)).append("]\n");
        }
        return out.toString();
    }

    @Override
    protected String lengthConstant(String symbol, int length) {
        return constantName(symbol, "LENGTH") + " = " + length + "\n";
    }
}
