package com.izapolsky.imagedownloader;

import com.google.common.collect.ImmutableMap;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;

import javax.imageio.ImageIO;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.Locale;
import java.util.Map;

/**
 * Encodes images with ImageIO, format picked from destination extension.
 * Content is written to a temporary file next to the destination first and moved in place once complete,
 * so a partially written file never looks like a finished download.
 */
public class ImageSinkImpl implements ImageSink {

    public static final String PART_SUFFIX = ".part";

    private static final Map<String, String> FORMATS = ImmutableMap.<String, String>builder()
            .put("jpg", "jpeg")
            .put("jpeg", "jpeg")
            .put("png", "png")
            .put("gif", "gif")
            .put("bmp", "bmp")
            .put("wbmp", "wbmp")
            .build();

    @Override
    public StoreResult store(BufferedImage image, File destination) {
        String format = formatFor(destination);
        if (format == null) {
            return StoreResult.failure(String.format("No image format for extension of %1$s", destination.getName()), null);
        }

        BufferedImage toWrite = needsOpaque(format) ? withoutAlpha(image) : image;
        File part = null;
        try {
            //unique per write, duplicate urls may be stored by several workers at once
            part = Files.createTempFile(destination.getAbsoluteFile().getParentFile().toPath(), destination.getName() + ".",
                    PART_SUFFIX).toFile();
            if (!ImageIO.write(toWrite, format, part)) {
                FileUtils.deleteQuietly(part);
                return StoreResult.failure(String.format("No %1$s writer accepts image for %2$s", format, destination), null);
            }
            Files.move(part.toPath(), destination.toPath(), StandardCopyOption.REPLACE_EXISTING);
            return StoreResult.ok();
        } catch (IOException e) {
            FileUtils.deleteQuietly(part);
            return StoreResult.failure(String.format("Failed writing to %1$s", destination.getAbsolutePath()), e);
        }
    }

    /**
     * ImageIO format name for file extension
     *
     * @param destination
     * @return format or null when extension is unknown
     */
    protected static String formatFor(File destination) {
        return FORMATS.get(FilenameUtils.getExtension(destination.getName()).toLowerCase(Locale.ROOT));
    }

    private static boolean needsOpaque(String format) {
        return "jpeg".equals(format) || "bmp".equals(format);
    }

    private static BufferedImage withoutAlpha(BufferedImage image) {
        if (!image.getColorModel().hasAlpha()) {
            return image;
        }
        BufferedImage rgb = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        try {
            g.drawImage(image, 0, 0, null);
        } finally {
            g.dispose();
        }
        return rgb;
    }
}
