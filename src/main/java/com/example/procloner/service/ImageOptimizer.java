package com.example.procloner.service;

import com.example.procloner.model.AssetType;
import com.example.procloner.model.DiscoveredAsset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Records image dimensions and writes a downscaled {@code <name>_optimized.<ext>} sibling for
 * images wider than {@value #MAX_WIDTH} pixels. Formats ImageIO cannot decode are skipped.
 * The sibling's path is claimed in the session's path table, so it never overwrites another
 * asset's file.
 */
@Component
public class ImageOptimizer {

    private static final Logger log = LoggerFactory.getLogger(ImageOptimizer.class);

    static final int MAX_WIDTH = 1920;
    static final String VARIANT = "optimized";

    /**
     * @return the optimised sibling's relative path, or {@code null} when none was written
     */
    public String optimize(Path outputRoot, DiscoveredAsset asset, PathMapper mapper) throws IOException {
        if (!asset.isDownloaded() || asset.getType() != AssetType.IMAGE) return null;
        String localPath = asset.getLocalPath();
        String ext = MediaTypes.extensionOf(localPath);
        String format = "jpeg".equals(ext) ? "jpg" : ext;
        if (!("jpg".equals(format) || "png".equals(format) || "gif".equals(format) || "bmp".equals(format))) {
            return null;
        }
        Path source = outputRoot.resolve(localPath);
        BufferedImage image = ImageIO.read(source.toFile());
        if (image == null) return null;
        asset.getMetadata().put("width", image.getWidth());
        asset.getMetadata().put("height", image.getHeight());
        if (image.getWidth() <= MAX_WIDTH) return null;

        int height = Math.max(1, (int) Math.round(image.getHeight() * (MAX_WIDTH / (double) image.getWidth())));
        int imageType = "png".equals(format) || "gif".equals(format) ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;
        BufferedImage scaled = new BufferedImage(MAX_WIDTH, height, imageType);
        Graphics2D g = scaled.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.drawImage(image, 0, 0, MAX_WIDTH, height, null);
        } finally {
            g.dispose();
        }
        String optimizedPath = mapper.assignVariant(asset.getUrl(), VARIANT, optimizedName(localPath));
        Path target = outputRoot.resolve(optimizedPath);
        Files.createDirectories(target.getParent());
        if (!ImageIO.write(scaled, format.toLowerCase(Locale.ROOT), target.toFile())) {
            log.debug("[POST] no ImageIO writer for {}", format);
            return null;
        }
        asset.getMetadata().put("optimizedPath", optimizedPath);
        asset.getMetadata().put("optimizedWidth", MAX_WIDTH);
        asset.getMetadata().put("optimizedHeight", height);
        return optimizedPath;
    }

    static String optimizedName(String localPath) {
        int slash = localPath.lastIndexOf('/');
        int dot = localPath.lastIndexOf('.');
        if (dot > slash + 1) {
            return localPath.substring(0, dot) + "_optimized" + localPath.substring(dot);
        }
        return localPath + "_optimized";
    }
}
