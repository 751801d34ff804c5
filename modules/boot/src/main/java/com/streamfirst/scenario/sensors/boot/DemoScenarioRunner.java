package com.streamfirst.scenario.sensors.boot;

import com.streamfirst.scenario.sensors.adapters.InMemoryLogRecordIndex;
import com.streamfirst.scenario.sensors.adapters.InMemoryRemoteBlobStore;
import com.streamfirst.scenario.sensors.application.ScenarioSensorAccessor;
import com.streamfirst.scenario.sensors.application.ScenarioSensorAccessorFactory;
import com.streamfirst.scenario.sensors.domain.BlobKey;
import com.streamfirst.scenario.sensors.domain.CameraChannel;
import com.streamfirst.scenario.sensors.domain.DecodedImage;
import com.streamfirst.scenario.sensors.domain.LidarChannel;
import com.streamfirst.scenario.sensors.domain.LogReference;
import com.streamfirst.scenario.sensors.domain.ScenarioSelection;
import com.streamfirst.scenario.sensors.domain.ScenarioWindow;
import com.streamfirst.scenario.sensors.domain.SensorBundle;
import com.streamfirst.scenario.sensors.domain.SensorChannel;
import com.streamfirst.scenario.sensors.domain.Token;
import com.streamfirst.scenario.sensors.ports.LocalBlobStorePort;
import com.streamfirst.scenario.sensors.ports.RemoteBlobStorePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.function.BiConsumer;

/**
 * Seeds a synthetic 20 Hz log and walks one scenario of it, logging what each iteration holds.
 * Payloads go to the in-memory remote tier when one is configured so that the run shows
 * fetch-through; otherwise they are placed in the local tier directly.
 */
@Slf4j
public class DemoScenarioRunner implements CommandLineRunner {

    static final LogReference DEMO_LOG = new LogReference("demo-log");
    static final long START_US = 1_700_000_000_000_000L;
    private static final long INTERVAL_US = 50_000L;
    private static final int RING_POINTS = 32;

    private final ScenarioSensorAccessorFactory accessorFactory;
    private final LocalBlobStorePort localBlobStore;
    private final RemoteBlobStorePort remoteBlobStore;
    private final SensorAccessProperties.Demo demo;

    public DemoScenarioRunner(ScenarioSensorAccessorFactory accessorFactory,
                              LocalBlobStorePort localBlobStore,
                              RemoteBlobStorePort remoteBlobStore,
                              SensorAccessProperties.Demo demo) {
        this.accessorFactory = accessorFactory;
        this.localBlobStore = localBlobStore;
        this.remoteBlobStore = remoteBlobStore;
        this.demo = demo;
    }

    @Override
    public void run(String... args) {
        log.info("--- Starting scenario sensor demo ---");
        InMemoryLogRecordIndex index = seed();
        log.info("Seeded {} records into log {}", index.getRecordCount(), DEMO_LOG);

        ScenarioWindow window = new ScenarioWindow(START_US, 0, demo.getDurationSeconds(), demo.getSubsampleRatio());
        ScenarioSensorAccessor accessor = accessorFactory.open(DEMO_LOG, index,
                ScenarioSelection.overWindow(Token.of(token(0)), window));
        log.info("Scenario {} has {} iterations", window, accessor.getNumberOfIterations());

        Set<SensorChannel> channels = Set.of(LidarChannel.MERGED_PC, CameraChannel.CAM_F0);
        for (SensorBundle bundle : accessor.getPastSensors(window, channels)) {
            int points = bundle.pointcloud(LidarChannel.MERGED_PC).map(cloud -> cloud.size()).orElse(0);
            long occupied = bundle.pointcloud(LidarChannel.MERGED_PC)
                    .map(cloud -> occupiedPixels(cloud.render(64, 10.0)))
                    .orElse(0L);
            log.info("{}: {} lidar points ({} occupied BEV pixels), cameras {}",
                    bundle.getToken().token(), points, occupied, bundle.getImages().keySet());
        }
        log.info("Cache stats after demo: {}", accessorFactory.getCache().stats());
        log.info("--- Scenario sensor demo finished ---");
    }

    InMemoryLogRecordIndex seed() {
        BiConsumer<String, byte[]> sink = remoteBlobStore instanceof InMemoryRemoteBlobStore memory
                ? memory::put
                : (key, bytes) -> localBlobStore.put(BlobKey.of(key), bytes);

        InMemoryLogRecordIndex index = new InMemoryLogRecordIndex(DEMO_LOG);
        for (int i = 0; i < demo.getRecords(); i++) {
            String token = token(i);
            index.addRecord(token, START_US + i * INTERVAL_US);

            String lidarKey = "sensor_blobs/" + DEMO_LOG + "/MERGED_PC/" + token + ".pcd";
            sink.accept(lidarKey, ringSweep(2.0 + 0.1 * i));
            index.addRef(token, LidarChannel.MERGED_PC, lidarKey);

            String cameraKey = "sensor_blobs/" + DEMO_LOG + "/CAM_F0/" + token + ".png";
            sink.accept(cameraKey, frame(i));
            index.addRef(token, CameraChannel.CAM_F0, cameraKey);
        }
        return index;
    }

    static String token(int index) {
        return String.format(Locale.ROOT, "demo%04d", index);
    }

    private static byte[] ringSweep(double radius) {
        StringBuilder pcd = new StringBuilder()
                .append("VERSION 0.7\nFIELDS x y z intensity\nSIZE 4 4 4 4\nTYPE F F F F\nCOUNT 1 1 1 1\n")
                .append("WIDTH ").append(RING_POINTS).append("\nHEIGHT 1\nPOINTS ").append(RING_POINTS)
                .append("\nDATA ascii\n");
        for (int p = 0; p < RING_POINTS; p++) {
            double angle = 2 * Math.PI * p / RING_POINTS;
            pcd.append(String.format(Locale.ROOT, "%.3f %.3f 0.0 %d%n",
                    radius * Math.cos(angle), radius * Math.sin(angle), p));
        }
        return pcd.toString().getBytes(StandardCharsets.US_ASCII);
    }

    private static byte[] frame(int index) {
        BufferedImage image = new BufferedImage(64, 48, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < image.getHeight(); y++) {
            for (int x = 0; x < image.getWidth(); x++) {
                image.setRGB(x, y, ((x * 4) << 16) | ((y * 5) << 8) | (index * 6 & 0xFF));
            }
        }
        try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            ImageIO.write(image, "png", out);
            return out.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static long occupiedPixels(DecodedImage bev) {
        return Arrays.stream(bev.pixels()).filter(pixel -> pixel != 0xFF000000).count();
    }
}
