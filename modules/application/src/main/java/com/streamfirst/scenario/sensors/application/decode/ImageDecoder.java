package com.streamfirst.scenario.sensors.application.decode;

import com.streamfirst.scenario.sensors.domain.ChannelKind;
import com.streamfirst.scenario.sensors.domain.DecodedImage;
import com.streamfirst.scenario.sensors.domain.exception.DecodeException;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import javax.imageio.stream.MemoryCacheImageInputStream;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Decodes camera frames in any format an installed ImageIO reader understands (JPEG for
 * recorded logs, PNG in tests). Reader warnings such as a premature end of a JPEG stream
 * fail the decode instead of yielding a partially filled frame.
 */
public class ImageDecoder implements PayloadDecoder<DecodedImage> {

    @Override
    public ChannelKind kind() {
        return ChannelKind.CAMERA;
    }

    @Override
    public DecodedImage decode(byte[] data) {
        if (data == null || data.length == 0) {
            throw new DecodeException(ChannelKind.CAMERA, 0, "empty payload");
        }

        try (ImageInputStream input = new MemoryCacheImageInputStream(new ByteArrayInputStream(data))) {
            Iterator<ImageReader> readers = ImageIO.getImageReaders(input);
            if (!readers.hasNext()) {
                throw new DecodeException(ChannelKind.CAMERA, data.length, "unrecognized image format");
            }

            ImageReader reader = readers.next();
            List<String> warnings = new ArrayList<>();
            try {
                reader.setInput(input, true, true);
                reader.addIIOReadWarningListener((source, warning) -> warnings.add(warning));
                BufferedImage image = reader.read(0);
                if (!warnings.isEmpty()) {
                    throw new DecodeException(ChannelKind.CAMERA, data.length, "incomplete image: " + warnings.get(0));
                }
                return DecodedImage.fromBufferedImage(image);
            } finally {
                reader.dispose();
            }
        } catch (IOException | RuntimeException e) {
            if (e instanceof DecodeException decodeException) {
                throw decodeException;
            }
            throw new DecodeException(ChannelKind.CAMERA, data.length, e.getMessage(), e);
        }
    }
}
