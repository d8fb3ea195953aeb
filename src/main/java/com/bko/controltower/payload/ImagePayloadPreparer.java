package com.bko.controltower.payload;

import com.bko.controltower.config.ControlTowerProperties;
import com.bko.controltower.config.ControlTowerProperties.PayloadConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;

/**
 * Shrinks an uploaded image until it fits the payload budget. Quality is lowered first, then the
 * bounding dimension; the search is greedy and stops at the dimension floor, returning the last
 * candidate if nothing fits.
 */
@Service
@Slf4j
public class ImagePayloadPreparer {

    static final String JPEG_MIME_TYPE = "image/jpeg";

    private final ControlTowerProperties properties;

    public ImagePayloadPreparer(ControlTowerProperties properties) {
        this.properties = properties;
    }

    public PreparedImage prepare(byte[] raw) {
        return prepare(raw, properties.getPayload().getMaxBytes());
    }

    public PreparedImage prepare(byte[] raw, int maxBytes) {
        if (raw == null || raw.length == 0) {
            throw new ImagePayloadException("Image is empty.");
        }
        PayloadConfig config = properties.getPayload();
        BufferedImage source = toRgb(decode(raw));

        int dimension = config.getMaxDimension();
        int quality = config.getInitialQuality();
        int attempts = 0;
        BufferedImage resized = null;
        int resizedFor = -1;
        PreparedImage candidate = null;
        while (dimension >= config.getMinDimension()) {
            if (resizedFor != dimension) {
                resized = fitWithin(source, dimension);
                resizedFor = dimension;
            }
            byte[] encoded = encodeJpeg(resized, quality);
            attempts++;
            candidate = new PreparedImage(encoded, JPEG_MIME_TYPE, resized.getWidth(), resized.getHeight(),
                    quality, raw.length, encoded.length <= maxBytes);
            if (candidate.withinBudget()) {
                break;
            }
            if (quality > config.getMinQuality()) {
                quality = Math.max(config.getMinQuality(), quality - config.getQualityStep());
            } else {
                dimension = shrink(dimension, config.getShrinkFactor());
                quality = config.getInitialQuality();
            }
        }
        if (candidate == null) {
            resized = fitWithin(source, config.getMinDimension());
            byte[] encoded = encodeJpeg(resized, config.getMinQuality());
            candidate = new PreparedImage(encoded, JPEG_MIME_TYPE, resized.getWidth(), resized.getHeight(),
                    config.getMinQuality(), raw.length, encoded.length <= maxBytes);
        }
        if (candidate.withinBudget()) {
            log.info("Image compression: {} KB -> {} KB ({}x{}, quality {}, {} attempts).",
                    raw.length / 1024, candidate.size() / 1024, candidate.width(), candidate.height(),
                    candidate.quality(), attempts);
        } else {
            log.warn("Image still {} KB over a {} KB budget after {} attempts; sending smallest candidate.",
                    (candidate.size() - maxBytes) / 1024, maxBytes / 1024, attempts);
        }
        return candidate;
    }

    static int shrink(int dimension, double factor) {
        int next = (int) (dimension * factor);
        return Math.min(next, dimension - 1);
    }

    private BufferedImage decode(byte[] raw) {
        BufferedImage image;
        try {
            image = ImageIO.read(new ByteArrayInputStream(raw));
        } catch (IOException | RuntimeException ex) {
            throw new ImagePayloadException("Image could not be decoded: " + ex.getMessage(), ex);
        }
        if (image == null) {
            throw new ImagePayloadException("Unsupported or malformed image data.");
        }
        return image;
    }

    private BufferedImage toRgb(BufferedImage image) {
        if (image.getType() == BufferedImage.TYPE_INT_RGB) {
            return image;
        }
        BufferedImage rgb = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = rgb.createGraphics();
        try {
            graphics.setColor(Color.WHITE);
            graphics.fillRect(0, 0, image.getWidth(), image.getHeight());
            graphics.drawImage(image, 0, 0, null);
        } finally {
            graphics.dispose();
        }
        return rgb;
    }

    private BufferedImage fitWithin(BufferedImage image, int maxDimension) {
        int width = image.getWidth();
        int height = image.getHeight();
        int longest = Math.max(width, height);
        if (longest <= maxDimension) {
            return image;
        }
        double scale = (double) maxDimension / longest;
        int targetWidth = Math.max(1, (int) Math.round(width * scale));
        int targetHeight = Math.max(1, (int) Math.round(height * scale));
        BufferedImage scaled = new BufferedImage(targetWidth, targetHeight, BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = scaled.createGraphics();
        try {
            graphics.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
            graphics.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            graphics.drawImage(image, 0, 0, targetWidth, targetHeight, null);
        } finally {
            graphics.dispose();
        }
        return scaled;
    }

    private byte[] encodeJpeg(BufferedImage image, int quality) {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
        if (!writers.hasNext()) {
            throw new ImagePayloadException("No JPEG encoder available.");
        }
        ImageWriter writer = writers.next();
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        try (ImageOutputStream stream = ImageIO.createImageOutputStream(output)) {
            ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(quality / 100f);
            writer.setOutput(stream);
            writer.write(null, new IIOImage(image, null, null), param);
        } catch (IOException ex) {
            throw new ImagePayloadException("Image could not be encoded: " + ex.getMessage(), ex);
        } finally {
            writer.dispose();
        }
        return output.toByteArray();
    }
}
