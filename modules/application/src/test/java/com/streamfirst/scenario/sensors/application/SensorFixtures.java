package com.streamfirst.scenario.sensors.application;

import com.streamfirst.scenario.sensors.adapters.InMemoryLogRecordIndex;
import com.streamfirst.scenario.sensors.adapters.InMemoryRemoteBlobStore;
import com.streamfirst.scenario.sensors.domain.CameraChannel;
import com.streamfirst.scenario.sensors.domain.LidarChannel;
import com.streamfirst.scenario.sensors.domain.LogReference;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Payload encoders and a small recorded log for tests.
 */
public final class SensorFixtures {

    public static final LogReference LOG = new LogReference("2021.07.16.20.45.29_veh-35_01095_01486");

    /** First record timestamp; records follow every 50 ms (20 Hz). */
    public static final long FIRST_TIMESTAMP_US = 1_000_000L;
    public static final long RECORD_INTERVAL_US = 50_000L;

    private SensorFixtures() {
    }

    public static String token(int index) {
        return String.format(Locale.ROOT, "tok%04d", index);
    }

    public static long timestamp(int index) {
        return FIRST_TIMESTAMP_US + index * RECORD_INTERVAL_US;
    }

    public static String lidarKey(int index) {
        return "sensor_blobs/" + LOG + "/MERGED_PC/" + token(index) + ".pcd";
    }

    public static String cameraKey(CameraChannel camera, int index) {
        return "sensor_blobs/" + LOG + "/" + camera + "/" + token(index) + ".png";
    }

    /**
     * Registers {@code records} instants with a lidar sweep and the given cameras at each one.
     * Payloads are stored in the remote store and are distinct per record.
     */
    public static InMemoryLogRecordIndex recordedLog(int records,
                                                     InMemoryRemoteBlobStore remote,
                                                     CameraChannel... cameras) {
        InMemoryLogRecordIndex index = new InMemoryLogRecordIndex(LOG);
        for (int i = 0; i < records; i++) {
            index.addRecord(token(i), timestamp(i));
            index.addRef(token(i), LidarChannel.MERGED_PC, lidarKey(i));
            remote.put(lidarKey(i), pcdBinary(new float[][] {
                    {i, i + 1f}, {0f, -1f}, {0.5f, 0.5f}, {10f * i, 20f}
            }));
            for (CameraChannel camera : cameras) {
                index.addRef(token(i), camera, cameraKey(camera, i));
                remote.put(cameraKey(camera, i), png(4, 3, 0xFF000000 | (i * 16) | (camera.ordinal() << 8)));
            }
        }
        return index;
    }

    /**
     * Encodes a solid-colour PNG.
     */
    public static byte[] png(int width, int height, int argb) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                image.setRGB(x, y, argb);
            }
        }
        return encode(image, "png");
    }

    /**
     * Encodes a solid-colour JPEG, the format recorded logs use for camera frames.
     */
    public static byte[] jpeg(int width, int height, int rgb) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                image.setRGB(x, y, rgb);
            }
        }
        return encode(image, "jpg");
    }

    /**
     * Encodes a binary PCD with float fields x, y, z, intensity given field-major.
     */
    public static byte[] pcdBinary(float[][] xyzi) {
        int points = xyzi[0].length;
        String header = "# .PCD v0.7 - Point Cloud Data file format\n"
                + "VERSION 0.7\n"
                + "FIELDS x y z intensity\n"
                + "SIZE 4 4 4 4\n"
                + "TYPE F F F F\n"
                + "COUNT 1 1 1 1\n"
                + "WIDTH " + points + "\n"
                + "HEIGHT 1\n"
                + "VIEWPOINT 0 0 0 1 0 0 0\n"
                + "POINTS " + points + "\n"
                + "DATA binary\n";
        byte[] head = header.getBytes(StandardCharsets.US_ASCII);
        ByteBuffer buffer = ByteBuffer.allocate(head.length + points * 16).order(ByteOrder.LITTLE_ENDIAN);
        buffer.put(head);
        for (int p = 0; p < points; p++) {
            for (int f = 0; f < 4; f++) {
                buffer.putFloat(xyzi[f][p]);
            }
        }
        return buffer.array();
    }

    private static byte[] encode(BufferedImage image, String format) {
        try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            if (!ImageIO.write(image, format, out)) {
                throw new IllegalStateException("No ImageIO writer for " + format);
            }
            return out.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
