package com.example.hoopstats_backend.util;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Base64;

public final class ImageCodec {
    private ImageCodec() {
    }

    public static byte[] toJpeg(BufferedImage image) {
        try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            if (!ImageIO.write(image, "jpg", out)) {
                throw new IOException("No JPEG writer available");
            }
            return out.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException("JPEG encoding failed", e);
        }
    }

    public static String toBase64Jpeg(BufferedImage image) {
        return Base64.getEncoder().encodeToString(toJpeg(image));
    }
}
