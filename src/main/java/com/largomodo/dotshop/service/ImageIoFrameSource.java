package com.largomodo.dotshop.service;

import com.largomodo.dotshop.core.FrameDecodeGapException;
import com.largomodo.dotshop.core.SourceFrame;
import com.largomodo.dotshop.core.SourceImage;
import com.largomodo.dotshop.sequence.FrameSource;
import com.largomodo.dotshop.sequence.FrameSourceFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.NodeList;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.metadata.IIOMetadataNode;
import javax.imageio.stream.ImageInputStream;
import java.awt.AlphaComposite;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Frame source decoding still images and animated GIFs with {@code javax.imageio}.
 * <p>
 * Still images (PNG, BMP, JPEG, single-frame GIF) yield one frame of duration 0. Animated GIF
 * frames are composited onto a logical-screen canvas honoring the disposal method, and carry
 * their delay in milliseconds. Delays of 0 or 10 ms are played as 100 ms, like browsers do.
 * <p>
 * A frame the reader cannot decode raises {@link FrameDecodeGapException}; the source moves on
 * to the next frame.
 */
public class ImageIoFrameSource implements FrameSource {

    static final long DEFAULT_GIF_DELAY_MS = 100;

    private static final Logger log = LoggerFactory.getLogger(ImageIoFrameSource.class);

    private final Path path;
    private final ImageInputStream input;
    private final ImageReader reader;
    private final int frameCount;

    private BufferedImage canvas;
    private BufferedImage restoreCanvas;
    private int nextIndex;
    private boolean closed;

    private ImageIoFrameSource(Path path, ImageInputStream input, ImageReader reader, int frameCount) {
        this.path = path;
        this.input = input;
        this.reader = reader;
        this.frameCount = frameCount;
    }

    /**
     * Opens the file and selects a reader by content, not extension.
     *
     * @throws IOException if the file is unreadable or no reader supports its format
     */
    public static ImageIoFrameSource open(Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new IOException("Input file does not exist: " + path);
        }
        ImageInputStream input = ImageIO.createImageInputStream(path.toFile());
        if (input == null) {
            throw new IOException("Cannot open image stream: " + path);
        }
        try {
            Iterator<ImageReader> readers = ImageIO.getImageReaders(input);
            if (!readers.hasNext()) {
                throw new IOException("Unsupported image format: " + path);
            }
            ImageReader reader = readers.next();
            reader.setInput(input, false, false);
            int count = reader.getNumImages(true);
            log.debug("Opened {} ({}, {} frames)", path.getFileName(), reader.getFormatName(), count);
            return new ImageIoFrameSource(path, input, reader, count);
        } catch (IOException | RuntimeException e) {
            input.close();
            throw e;
        }
    }

    /**
     * @return restartable factory re-opening the file on every call
     */
    public static FrameSourceFactory factory(Path path) {
        return () -> open(path);
    }

    public int getFrameCount() {
        return frameCount;
    }

    @Override
    public OptionalLong frameCount() {
        return OptionalLong.of(frameCount);
    }

    @Override
    public Optional<SourceFrame> next() throws IOException {
        if (nextIndex >= frameCount) {
            return Optional.empty();
        }
        int index = nextIndex++;
        BufferedImage raw;
        IIOMetadataNode gif;
        try {
            raw = reader.read(index);
            gif = gifMetadata(reader.getImageMetadata(index));
        } catch (IOException | RuntimeException e) {
            throw new FrameDecodeGapException("Cannot decode frame " + index + " of " + path.getFileName()
                    + ": " + e.getMessage(), index, e);
        }

        if (gif == null || frameCount == 1) {
            return Optional.of(new SourceFrame(toSourceImage(raw), 0, index));
        }
        return Optional.of(new SourceFrame(toSourceImage(composite(raw, gif)), delayMs(gif), index));
    }

    private static IIOMetadataNode gifMetadata(IIOMetadata metadata) {
        if (metadata == null || !"javax_imageio_gif_image_1.0".equals(metadata.getNativeMetadataFormatName())) {
            return null;
        }
        return (IIOMetadataNode) metadata.getAsTree(metadata.getNativeMetadataFormatName());
    }

    private BufferedImage composite(BufferedImage raw, IIOMetadataNode gif) throws IOException {
        if (canvas == null) {
            canvas = newCanvas();
        }
        IIOMetadataNode descriptor = child(gif, "ImageDescriptor");
        int x = intAttribute(descriptor, "imageLeftPosition", 0);
        int y = intAttribute(descriptor, "imageTopPosition", 0);
        String disposal = stringAttribute(child(gif, "GraphicControlExtension"), "disposalMethod", "none");

        if ("restoreToPrevious".equalsIgnoreCase(disposal)) {
            restoreCanvas = copy(canvas);
        }
        Graphics2D g = canvas.createGraphics();
        try {
            g.setComposite(AlphaComposite.SrcOver);
            g.drawImage(raw, x, y, null);
        } finally {
            g.dispose();
        }
        BufferedImage frame = copy(canvas);

        // Disposal applies after this frame is shown
        if ("restoreToBackgroundColor".equalsIgnoreCase(disposal)) {
            Graphics2D clear = canvas.createGraphics();
            try {
                clear.setComposite(AlphaComposite.Clear);
                clear.fillRect(x, y, raw.getWidth(), raw.getHeight());
            } finally {
                clear.dispose();
            }
        } else if ("restoreToPrevious".equalsIgnoreCase(disposal) && restoreCanvas != null) {
            canvas = restoreCanvas;
            restoreCanvas = null;
        }
        return frame;
    }

    /**
     * Sized to the GIF logical screen, falling back to the first frame's size.
     */
    private BufferedImage newCanvas() throws IOException {
        int width = reader.getWidth(0);
        int height = reader.getHeight(0);
        IIOMetadata stream = reader.getStreamMetadata();
        if (stream != null && "javax_imageio_gif_stream_1.0".equals(stream.getNativeMetadataFormatName())) {
            IIOMetadataNode root = (IIOMetadataNode) stream.getAsTree(stream.getNativeMetadataFormatName());
            IIOMetadataNode screen = child(root, "LogicalScreenDescriptor");
            width = Math.max(width, intAttribute(screen, "logicalScreenWidth", width));
            height = Math.max(height, intAttribute(screen, "logicalScreenHeight", height));
        }
        return new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
    }

    private static long delayMs(IIOMetadataNode gif) {
        int centiseconds = intAttribute(child(gif, "GraphicControlExtension"), "delayTime", 0);
        return centiseconds <= 1 ? DEFAULT_GIF_DELAY_MS : centiseconds * 10L;
    }

    private static IIOMetadataNode child(IIOMetadataNode root, String name) {
        NodeList nodes = root.getElementsByTagName(name);
        return nodes.getLength() > 0 ? (IIOMetadataNode) nodes.item(0) : null;
    }

    private static String stringAttribute(IIOMetadataNode node, String name, String fallback) {
        if (node == null) {
            return fallback;
        }
        String value = node.getAttribute(name);
        return value == null || value.isEmpty() ? fallback : value;
    }

    private static int intAttribute(IIOMetadataNode node, String name, int fallback) {
        String value = stringAttribute(node, name, null);
        return value == null ? fallback : Integer.parseInt(value);
    }

    private static BufferedImage copy(BufferedImage image) {
        BufferedImage copy = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = copy.createGraphics();
        try {
            g.drawImage(image, 0, 0, null);
        } finally {
            g.dispose();
        }
        return copy;
    }

    static SourceImage toSourceImage(BufferedImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        int[] argb = image.getRGB(0, 0, width, height, null, 0, width);
        return new SourceImage(width, height, argb);
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        reader.dispose();
        input.close();
    }
}
