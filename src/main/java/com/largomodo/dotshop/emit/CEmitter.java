package com.largomodo.dotshop.emit;

import com.largomodo.dotshop.core.ScreenProfile;

import java.util.List;

/**
 * C99 header: {@code const uint8_t} arrays with {@code #define} dimension constants.
 */
public class CEmitter extends AbstractSourceEmitter {

    public static final String ID = "c";

    @Override
    public String targetId() {
        return ID;
    }

    @Override
    protected String comment(List<String> lines) {
        StringBuilder out = new StringBuilder("/*\n");
        for (String line : lines) {
            out.append(" * ").append(line.replace("*/", "* /")).append('\n');
        }
        return out.append(" */\n").toString();
    }

    @Override
    protected String preamble(ScreenProfile profile, String symbol, int frameCount) {
        StringBuilder out = new StringBuilder();
        for (String include : includes()) {
            out.append("#include <").append(include).append(">\n");
        }
        out.append('\n');
        out.append("#define ").append(constantName(symbol, "WIDTH")).append(' ').append(profile.width()).append('\n');
        out.append("#define ").append(constantName(symbol, "HEIGHT")).append(' ').append(profile.height()).append('\n');
        out.append("#define ").append(constantName(symbol, "FRAME_COUNT")).append(' ').append(frameCount).append('\n');
        return out.toString();
    }

    protected List<String> includes() {
        return List.of("stdint.h");
    }

    /**
     * Storage qualifier placed after the declarator, empty for plain C.
     */
    protected String storage() {
        return "";
    }

    @Override
    protected String arrayStart(String name, int length) {
        return "const uint8_t " + name + "[" + length + "]" + storage() + " = {";
    }

    @Override
    protected String arrayEnd() {
        return "};";
    }

    @Override
    protected String frameTable(String symbol, List<String> names, List<Long> durations, List<Integer> lengths) {
        int count = names.size();
        StringBuilder out = new StringBuilder();
        out.append("const uint8_t *const ").append(symbol).append("_frames[").append(count).append(']')
                .append(storage()).append(" = {").append(join(names)).append("};\n");
        out.append("const uint32_t ").append(symbol).append("_durations_ms[").append(count).append(']')
                .append(storage()).append(" = {").append(join(durations)).append("};\n");
        if (lengths != null) {
            out.append("const uint32_t ").append(symbol).append("_lengths[").append(count).append(']')
                    .append(storage()).append(" = {").append(join(lengths)).append("};\n");
        }
        return out.toString();
    }

    @Override
    protected String lengthConstant(String symbol, int length) {
        return "#define " + constantName(symbol, "LENGTH") + " " + length + "\n";
    }
}
