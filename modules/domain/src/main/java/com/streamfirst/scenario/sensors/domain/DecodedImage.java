package com.streamfirst.scenario.sensors.domain;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Value;

import java.awt.image.BufferedImage;
import java.util.Arrays;

/**
 * Decoded camera frame as a grid of packed ARGB pixels, row-major.
 */
@Value
public class DecodedImage implements SensorData {

    int width;
    int height;
    @Getter(AccessLevel.NONE)
    int[] argb;

    public DecodedImage(int width, int height, int[] argb) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Image dimensions must be positive: " + width + "x" + height);
        }
        if (argb == null || argb.length != width * height) {
            throw new IllegalArgumentException("Pixel buffer does not match " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.argb = Arrays.copyOf(argb, argb.length);
    }

    public static DecodedImage fromBufferedImage(BufferedImage image) {
        int w = image.getWidth();
        int h = image.getHeight();
        return new DecodedImage(w, h, image.getRGB(0, 0, w, h, null, 0, w));
    }

    @Override
    public ChannelKind kind() {
        return ChannelKind.CAMERA;
    }

    /**
     * Gets the packed ARGB value at column {@code x}, row {@code y}.
     */
    public int pixel(int x, int y) {
        if (x < 0 || x >= width || y < 0 || y >= height) {
            throw new IndexOutOfBoundsException("Pixel (" + x + ", " + y + ") outside " + width + "x" + height);
        }
        return argb[y * width + x];
    }

    /**
     * Copy of the whole pixel grid, row-major.
     */
    public int[] pixels() {
        return Arrays.copyOf(argb, argb.length);
    }

    public BufferedImage toBufferedImage() {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        image.setRGB(0, 0, width, height, argb, 0, width);
        return image;
    }

    @Override
    public String toString() {
        return "DecodedImage{" + width + "x" + height + '}';
    }
}
