package com.streamfirst.scenario.sensors.domain;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Value;

import java.util.Arrays;
import java.util.List;

/**
 * Decoded lidar sweep. Points are stored field-major: {@code points[f][i]} is field {@code f}
 * of point {@code i}, with fields named by {@link #getFieldNames()} (at least x, y, z).
 */
@Value
public class DecodedPointCloud implements SensorData {

    private static final int OCCUPIED = 0xFFFFFFFF;
    private static final int EMPTY = 0xFF000000;

    List<String> fieldNames;
    @Getter(AccessLevel.NONE)
    float[][] points;

    public DecodedPointCloud(List<String> fieldNames, float[][] points) {
        if (fieldNames == null || points == null || fieldNames.size() != points.length) {
            throw new IllegalArgumentException("Each field needs exactly one value column");
        }
        for (String axis : List.of("x", "y", "z")) {
            if (!fieldNames.contains(axis)) {
                throw new IllegalArgumentException("Point cloud is missing field '" + axis + "'");
            }
        }
        int count = points.length == 0 ? 0 : points[0].length;
        float[][] copy = new float[points.length][];
        for (int f = 0; f < points.length; f++) {
            if (points[f].length != count) {
                throw new IllegalArgumentException("Field '" + fieldNames.get(f) + "' has "
                        + points[f].length + " values, expected " + count);
            }
            copy[f] = Arrays.copyOf(points[f], count);
        }
        this.fieldNames = List.copyOf(fieldNames);
        this.points = copy;
    }

    @Override
    public ChannelKind kind() {
        return ChannelKind.LIDAR;
    }

    public int size() {
        return points[0].length;
    }

    /**
     * Copy of the point array, field-major.
     */
    public float[][] points() {
        float[][] copy = new float[points.length][];
        for (int f = 0; f < points.length; f++) {
            copy[f] = Arrays.copyOf(points[f], points[f].length);
        }
        return copy;
    }

    /**
     * Copy of one field column.
     *
     * @throws IllegalArgumentException if the cloud has no such field
     */
    public float[] field(String name) {
        int index = fieldNames.indexOf(name);
        if (index < 0) {
            throw new IllegalArgumentException("Point cloud has no field '" + name + "', fields are " + fieldNames);
        }
        return Arrays.copyOf(points[index], points[index].length);
    }

    public float[] x() {
        return field("x");
    }

    public float[] y() {
        return field("y");
    }

    public float[] z() {
        return field("z");
    }

    /**
     * Bird's-eye projection onto the ground plane: {@code [0]} holds x, {@code [1]} holds y.
     */
    public float[][] project() {
        return new float[][] {x(), y()};
    }

    /**
     * Renders a top-down occupancy image centred on the vehicle, forward (+x) pointing up and
     * left (+y) pointing left. Points farther than {@code rangeMeters} on either axis and points
     * with a non-finite x or y are dropped.
     * The output depends only on the points, so equal clouds render to equal images.
     *
     * @param sizePx edge length of the square output image
     * @param rangeMeters half-width of the rendered area
     */
    public DecodedImage render(int sizePx, double rangeMeters) {
        if (sizePx <= 0 || !(rangeMeters > 0)) {
            throw new IllegalArgumentException("Render size and range must be positive");
        }
        int[] raster = new int[sizePx * sizePx];
        Arrays.fill(raster, EMPTY);
        float[] xs = points[fieldNames.indexOf("x")];
        float[] ys = points[fieldNames.indexOf("y")];
        double scale = sizePx / (2 * rangeMeters);
        for (int i = 0; i < xs.length; i++) {
            if (!Float.isFinite(xs[i]) || !Float.isFinite(ys[i])) {
                continue;
            }
            int row = (int) Math.floor((rangeMeters - xs[i]) * scale);
            int col = (int) Math.floor((rangeMeters - ys[i]) * scale);
            if (row >= 0 && row < sizePx && col >= 0 && col < sizePx) {
                raster[row * sizePx + col] = OCCUPIED;
            }
        }
        return new DecodedImage(sizePx, sizePx, raster);
    }

    @Override
    public String toString() {
        return "DecodedPointCloud{points=" + size() + ", fields=" + fieldNames + '}';
    }
}
