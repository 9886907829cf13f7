package com.largomodo.dotshop.core;

import java.util.Locale;

/**
 * Order in which a packer visits the pixels of a grid.
 * <p>
 * Every scan cuts the grid into <em>lines</em>. Byte alignment pads each line separately, so the
 * line geometry fixes the packed buffer size together with color mode and alignment:
 * <ul>
 *   <li>Row scans: one line per row, {@code width} pixels long</li>
 *   <li>Column scans: one line per column, {@code height} pixels long</li>
 *   <li>Page scans (SSD1306 and friends): one line per 8-row page, walked column by column in
 *       8-pixel vertical strips, so each line is {@code width * 8} pixels long</li>
 * </ul>
 * Reversed variants walk pixels within a row right-to-left, or within a column / strip
 * bottom-to-top.
 */
public enum ScanDirection {
    ROW_MAJOR("row-major"),
    ROW_MAJOR_REVERSED("row-major-reversed"),
    COLUMN_MAJOR("column-major"),
    COLUMN_MAJOR_REVERSED("column-major-reversed"),
    PAGE("page"),
    PAGE_REVERSED("page-reversed");

    /**
     * Rows per page for page scans.
     */
    public static final int PAGE_HEIGHT = 8;

    private final String id;

    ScanDirection(String id) {
        this.id = id;
    }

    public static ScanDirection fromId(String id) {
        if (id == null) {
            throw new IllegalArgumentException("Scan direction cannot be null");
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (ScanDirection direction : values()) {
            if (direction.id.equals(normalized)) {
                return direction;
            }
        }
        throw new IllegalArgumentException("Invalid scan direction: " + id +
                ". Supported: row-major, row-major-reversed, column-major, column-major-reversed, page, page-reversed");
    }

    public String getId() {
        return id;
    }

    public boolean isPaged() {
        return this == PAGE || this == PAGE_REVERSED;
    }

    public int lineCount(int width, int height) {
        return switch (this) {
            case ROW_MAJOR, ROW_MAJOR_REVERSED -> height;
            case COLUMN_MAJOR, COLUMN_MAJOR_REVERSED -> width;
            case PAGE, PAGE_REVERSED -> height / PAGE_HEIGHT;
        };
    }

    public int lineLength(int width, int height) {
        return switch (this) {
            case ROW_MAJOR, ROW_MAJOR_REVERSED -> width;
            case COLUMN_MAJOR, COLUMN_MAJOR_REVERSED -> height;
            case PAGE, PAGE_REVERSED -> width * PAGE_HEIGHT;
        };
    }

    /**
     * Maps a scan position to the row-major index ({@code y * width + x}) of the pixel it visits.
     *
     * @param line     0-based line number, below {@link #lineCount(int, int)}
     * @param position 0-based position within the line, below {@link #lineLength(int, int)}
     */
    public int pixelIndex(int line, int position, int width, int height) {
        return switch (this) {
            case ROW_MAJOR -> line * width + position;
            case ROW_MAJOR_REVERSED -> line * width + (width - 1 - position);
            case COLUMN_MAJOR -> position * width + line;
            case COLUMN_MAJOR_REVERSED -> (height - 1 - position) * width + line;
            case PAGE -> (line * PAGE_HEIGHT + position % PAGE_HEIGHT) * width + position / PAGE_HEIGHT;
            case PAGE_REVERSED ->
                    (line * PAGE_HEIGHT + (PAGE_HEIGHT - 1 - position % PAGE_HEIGHT)) * width + position / PAGE_HEIGHT;
        };
    }

    @Override
    public String toString() {
        return id;
    }
}
