package com.largomodo.dotshop.quantize;

import com.largomodo.dotshop.core.SourceImage;

/**
 * Nearest-neighbour resampling onto the target resolution.
 * <p>
 * Destination pixel {@code (x, y)} copies source pixel
 * {@code (floor((x + 0.5) * srcW / dstW), floor((y + 0.5) * srcH / dstH))}, the sample whose
 * area contains the destination pixel centre. Deterministic and exact for integer scale
 * factors; no filtering, so hard pixel edges survive.
 */
public class Resampler {

    public SourceImage resize(SourceImage source, int targetWidth, int targetHeight) {
        if (source.width() == targetWidth && source.height() == targetHeight) {
            return source;
        }
        int[] src = source.argb();
        int[] dst = new int[targetWidth * targetHeight];
        int[] columns = new int[targetWidth];
        for (int x = 0; x < targetWidth; x++) {
            columns[x] = (int) (((2L * x + 1) * source.width()) / (2L * targetWidth));
        }
        for (int y = 0; y < targetHeight; y++) {
            int sy = (int) (((2L * y + 1) * source.height()) / (2L * targetHeight));
            int srcRow = sy * source.width();
            int dstRow = y * targetWidth;
            for (int x = 0; x < targetWidth; x++) {
                dst[dstRow + x] = src[srcRow + columns[x]];
            }
        }
        return new SourceImage(targetWidth, targetHeight, dst);
    }
}
