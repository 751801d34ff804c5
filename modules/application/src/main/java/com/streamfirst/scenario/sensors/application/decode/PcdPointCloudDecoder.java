package com.streamfirst.scenario.sensors.application.decode;

import com.streamfirst.scenario.sensors.domain.ChannelKind;
import com.streamfirst.scenario.sensors.domain.DecodedPointCloud;
import com.streamfirst.scenario.sensors.domain.exception.DecodeException;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Decodes lidar sweeps stored as PCD (Point Cloud Data) files.
 *
 * <p>Supports {@code DATA ascii} and little-endian {@code DATA binary} bodies with scalar fields
 * ({@code COUNT 1}) of type {@code F} (4 or 8 bytes), {@code I} or {@code U} (1, 2, 4 or 8 bytes).
 * {@code binary_compressed} bodies are rejected.
 */
public class PcdPointCloudDecoder implements PayloadDecoder<DecodedPointCloud> {

    private static final int MAX_HEADER_BYTES = 4096;

    @Override
    public ChannelKind kind() {
        return ChannelKind.LIDAR;
    }

    @Override
    public DecodedPointCloud decode(byte[] data) {
        if (data == null || data.length == 0) {
            throw new DecodeException(ChannelKind.LIDAR, 0, "empty payload");
        }
        try {
            Header header = readHeader(data);
            float[][] points = switch (header.encoding) {
                case "ascii" -> readAscii(data, header);
                case "binary" -> readBinary(data, header);
                default -> throw failure(data, "unsupported DATA encoding '" + header.encoding + "'");
            };
            for (String axis : List.of("x", "y", "z")) {
                if (!header.fields.contains(axis)) {
                    throw failure(data, "missing field '" + axis + "'");
                }
            }
            return new DecodedPointCloud(header.fields, points);
        } catch (NumberFormatException e) {
            throw new DecodeException(ChannelKind.LIDAR, data.length, "malformed number: " + e.getMessage(), e);
        }
    }

    private Header readHeader(byte[] data) {
        Map<String, String[]> entries = new HashMap<>();
        int offset = 0;
        while (true) {
            int end = indexOf(data, (byte) '\n', offset);
            if (end < 0 || end > MAX_HEADER_BYTES) {
                throw failure(data, "header is not terminated by a DATA line");
            }
            String line = new String(data, offset, end - offset, StandardCharsets.US_ASCII).trim();
            offset = end + 1;
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            String[] tokens = line.split("\\s+");
            String keyword = tokens[0].toUpperCase(Locale.ROOT);
            entries.put(keyword, Arrays.copyOfRange(tokens, 1, tokens.length));
            if (keyword.equals("DATA")) {
                break;
            }
        }

        String[] fields = require(data, entries, "FIELDS");
        String[] sizes = require(data, entries, "SIZE");
        String[] types = require(data, entries, "TYPE");
        String[] encoding = require(data, entries, "DATA");
        if (sizes.length != fields.length || types.length != fields.length) {
            throw failure(data, "FIELDS, SIZE and TYPE declare different field counts");
        }
        String[] counts = entries.get("COUNT");
        if (counts != null) {
            for (String count : counts) {
                if (Integer.parseInt(count) != 1) {
                    throw failure(data, "multi-valued fields (COUNT " + count + ") are not supported");
                }
            }
        }

        int pointCount;
        if (entries.containsKey("POINTS")) {
            pointCount = Integer.parseInt(require(data, entries, "POINTS")[0]);
        } else {
            int width = Integer.parseInt(require(data, entries, "WIDTH")[0]);
            int height = Integer.parseInt(require(data, entries, "HEIGHT")[0]);
            try {
                pointCount = Math.multiplyExact(width, height);
            } catch (ArithmeticException e) {
                throw failure(data, "WIDTH " + width + " x HEIGHT " + height + " overflows the point count");
            }
        }
        if (pointCount < 0) {
            throw failure(data, "negative point count " + pointCount);
        }

        int[] fieldSizes = new int[fields.length];
        char[] fieldTypes = new char[fields.length];
        for (int f = 0; f < fields.length; f++) {
            fieldSizes[f] = Integer.parseInt(sizes[f]);
            fieldTypes[f] = Character.toUpperCase(types[f].charAt(0));
            if (!isSupported(fieldTypes[f], fieldSizes[f])) {
                throw failure(data, "unsupported field " + fields[f] + " of TYPE " + types[f] + " SIZE " + sizes[f]);
            }
        }
        return new Header(List.of(fields), fieldSizes, fieldTypes, pointCount,
                encoding[0].toLowerCase(Locale.ROOT), offset);
    }

    private float[][] readAscii(byte[] data, Header header) {
        int fieldCount = header.fields.size();
        // Every point row takes at least one byte
        int available = data.length - header.bodyOffset;
        if (header.pointCount > available) {
            throw failure(data, "truncated body: " + header.pointCount + " points declared in "
                    + available + " bytes");
        }
        float[][] points = new float[fieldCount][header.pointCount];
        String body = new String(data, header.bodyOffset, data.length - header.bodyOffset, StandardCharsets.US_ASCII);
        int point = 0;
        for (String line : body.split("\\r?\\n")) {
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            if (point == header.pointCount) {
                throw failure(data, "more point rows than the declared " + header.pointCount);
            }
            String[] values = trimmed.split("\\s+");
            if (values.length != fieldCount) {
                throw failure(data, "point " + point + " has " + values.length + " values, expected " + fieldCount);
            }
            for (int f = 0; f < fieldCount; f++) {
                points[f][point] = parseAscii(values[f]);
            }
            point++;
        }
        if (point != header.pointCount) {
            throw failure(data, "truncated body: " + point + " of " + header.pointCount + " points");
        }
        return points;
    }

    private float[][] readBinary(byte[] data, Header header) {
        int fieldCount = header.fields.size();
        int recordSize = Arrays.stream(header.sizes).sum();
        long expected = (long) recordSize * header.pointCount;
        long available = data.length - header.bodyOffset;
        if (available < expected) {
            throw failure(data, "truncated body: " + available + " of " + expected + " bytes");
        }

        ByteBuffer body = ByteBuffer.wrap(data, header.bodyOffset, (int) expected).order(ByteOrder.LITTLE_ENDIAN);
        float[][] points = new float[fieldCount][header.pointCount];
        for (int p = 0; p < header.pointCount; p++) {
            for (int f = 0; f < fieldCount; f++) {
                points[f][p] = readValue(body, header.types[f], header.sizes[f]);
            }
        }
        return points;
    }

    /**
     * PCL writes non-finite values as {@code nan}, {@code inf} and {@code -inf}.
     */
    private static float parseAscii(String value) {
        if (value.equalsIgnoreCase("nan")) {
            return Float.NaN;
        }
        if (value.equalsIgnoreCase("inf") || value.equalsIgnoreCase("+inf")) {
            return Float.POSITIVE_INFINITY;
        }
        if (value.equalsIgnoreCase("-inf")) {
            return Float.NEGATIVE_INFINITY;
        }
        return Float.parseFloat(value);
    }

    private static float readValue(ByteBuffer body, char type, int size) {
        return switch (type) {
            case 'F' -> size == 4 ? body.getFloat() : (float) body.getDouble();
            case 'I' -> switch (size) {
                case 1 -> body.get();
                case 2 -> body.getShort();
                case 4 -> body.getInt();
                default -> body.getLong();
            };
            default -> switch (size) {
                case 1 -> Byte.toUnsignedInt(body.get());
                case 2 -> Short.toUnsignedInt(body.getShort());
                case 4 -> Integer.toUnsignedLong(body.getInt());
                default -> body.getLong();
            };
        };
    }

    private static boolean isSupported(char type, int size) {
        return switch (type) {
            case 'F' -> size == 4 || size == 8;
            case 'I', 'U' -> size == 1 || size == 2 || size == 4 || size == 8;
            default -> false;
        };
    }

    private static String[] require(byte[] data, Map<String, String[]> entries, String keyword) {
        String[] values = entries.get(keyword);
        if (values == null || values.length == 0) {
            throw failure(data, "header has no " + keyword + " line");
        }
        return values;
    }

    private static int indexOf(byte[] data, byte value, int from) {
        for (int i = from; i < data.length; i++) {
            if (data[i] == value) {
                return i;
            }
        }
        return -1;
    }

    private static DecodeException failure(byte[] data, String reason) {
        return new DecodeException(ChannelKind.LIDAR, data.length, reason);
    }

    private record Header(List<String> fields, int[] sizes, char[] types, int pointCount,
                          String encoding, int bodyOffset) {
    }
}
