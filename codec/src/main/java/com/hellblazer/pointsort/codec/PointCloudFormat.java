/*
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.pointsort.codec;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Locale;
import javax.vecmath.Vector3d;

/**
 * File format definitions and utilities for point cloud files.
 *
 * <p><b>File Layout:</b>
 * <pre>
 * [Header: 160 bytes]
 *   magic(4) + version(4) + flags(4) + reserved(4) + pointCount(8) +
 *   scale(3 * 8) + offset(3 * 8) + bounds(6 * 8) + systemIdentifier(32) + reserved(8)
 * [Points: pointCount * 24 bytes, GZIP deflated when FLAG_COMPRESSED is set]
 *   x(4) + y(4) + z(4) + intensity(2) + classification(1) + returnNumber(1) + gpsTime(8)
 * </pre>
 *
 * <p>All values are little-endian. The header itself is never compressed, so the point count can be rewritten in
 * place once the final count is known.
 *
 * @author hal.hildebrand
 */
public class PointCloudFormat {

    // Magic number: "PCB1" in ASCII (little-endian)
    public static final int MAGIC_NUMBER = 0x31424350;

    public static final int VERSION_1       = 1;
    public static final int CURRENT_VERSION = VERSION_1;

    public static final int FLAG_COMPRESSED = 0x1;

    public static final int HEADER_SIZE            = 160;
    public static final int POINT_SIZE             = 24;
    public static final int SYSTEM_IDENTIFIER_SIZE = 32;

    // Offset of pointCount within the header
    public static final int POINT_COUNT_OFFSET = 16;

    public static final String PLAIN_EXTENSION      = "pcb";
    public static final String COMPRESSED_EXTENSION = "pcz";

    private PointCloudFormat() {
    }

    /**
     * Output compression is chosen by file extension: {@code .pcz} is compressed, anything else is not.
     */
    public static boolean isCompressedPath(Path path) {
        var name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith("." + COMPRESSED_EXTENSION);
    }

    /**
     * Check if a file starts with a readable point cloud header
     */
    public static boolean isValidFile(Path path) {
        if (!Files.isRegularFile(path)) {
            return false;
        }
        try (var channel = FileChannel.open(path, StandardOpenOption.READ)) {
            readHeader(channel);
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    /**
     * Read and validate the header at the channel's current position
     */
    public static PointCloudHeader readHeader(FileChannel channel) throws IOException {
        var buffer = ByteBuffer.allocate(HEADER_SIZE).order(ByteOrder.LITTLE_ENDIAN);
        while (buffer.hasRemaining()) {
            if (channel.read(buffer) < 0) {
                throw new PointCloudFormatException(
                "Truncated header: " + buffer.position() + " of " + HEADER_SIZE + " bytes");
            }
        }
        buffer.flip();
        return decodeHeader(buffer);
    }

    public static PointCloudHeader decodeHeader(ByteBuffer buffer) throws PointCloudFormatException {
        int magic = buffer.getInt();
        if (magic != MAGIC_NUMBER) {
            throw new PointCloudFormatException("Invalid point cloud file: bad magic number 0x" + Integer.toHexString(magic));
        }
        int version = buffer.getInt();
        if (version < VERSION_1 || version > CURRENT_VERSION) {
            throw new PointCloudFormatException("Unsupported point cloud version: " + version);
        }
        int flags = buffer.getInt();
        buffer.getInt(); // reserved
        long pointCount = buffer.getLong();
        if (pointCount < 0) {
            throw new PointCloudFormatException("Negative point count: " + pointCount);
        }
        var scale = new Vector3d(buffer.getDouble(), buffer.getDouble(), buffer.getDouble());
        var offset = new Vector3d(buffer.getDouble(), buffer.getDouble(), buffer.getDouble());
        var bounds = new Bounds(buffer.getDouble(), buffer.getDouble(), buffer.getDouble(), buffer.getDouble(),
                                buffer.getDouble(), buffer.getDouble());
        var identifier = new byte[SYSTEM_IDENTIFIER_SIZE];
        buffer.get(identifier);
        buffer.getLong(); // reserved

        int length = 0;
        while (length < identifier.length && identifier[length] != 0) {
            length++;
        }
        try {
            return new PointCloudHeader(version, (flags & FLAG_COMPRESSED) != 0, pointCount, scale, offset, bounds,
                                        new String(identifier, 0, length, StandardCharsets.US_ASCII));
        } catch (IllegalArgumentException e) {
            throw new PointCloudFormatException("Invalid header: " + e.getMessage());
        }
    }

    public static ByteBuffer encodeHeader(PointCloudHeader header) {
        var buffer = ByteBuffer.allocate(HEADER_SIZE).order(ByteOrder.LITTLE_ENDIAN);
        var scale = header.scale();
        var offset = header.offset();
        var bounds = header.bounds();

        buffer.putInt(MAGIC_NUMBER);
        buffer.putInt(header.version());
        buffer.putInt(header.compressed() ? FLAG_COMPRESSED : 0);
        buffer.putInt(0); // reserved
        buffer.putLong(header.pointCount());
        buffer.putDouble(scale.x).putDouble(scale.y).putDouble(scale.z);
        buffer.putDouble(offset.x).putDouble(offset.y).putDouble(offset.z);
        buffer.putDouble(bounds.minX()).putDouble(bounds.minY()).putDouble(bounds.minZ());
        buffer.putDouble(bounds.maxX()).putDouble(bounds.maxY()).putDouble(bounds.maxZ());
        var identifier = new byte[SYSTEM_IDENTIFIER_SIZE];
        var bytes = header.systemIdentifier().getBytes(StandardCharsets.US_ASCII);
        System.arraycopy(bytes, 0, identifier, 0, Math.min(bytes.length, identifier.length));
        buffer.put(identifier);
        buffer.putLong(0); // reserved

        buffer.flip();
        return buffer;
    }

    public static void encodePoint(PointRecord point, PointCloudHeader header, ByteBuffer buffer) {
        var scale = header.scale();
        var offset = header.offset();
        buffer.putInt(quantize(point.x(), scale.x, offset.x));
        buffer.putInt(quantize(point.y(), scale.y, offset.y));
        buffer.putInt(quantize(point.z(), scale.z, offset.z));
        buffer.putShort((short) point.intensity());
        buffer.put((byte) point.classification());
        buffer.put((byte) point.returnNumber());
        buffer.putDouble(point.gpsTime());
    }

    public static PointRecord decodePoint(ByteBuffer buffer, PointCloudHeader header) {
        var scale = header.scale();
        var offset = header.offset();
        double x = buffer.getInt() * scale.x + offset.x;
        double y = buffer.getInt() * scale.y + offset.y;
        double z = buffer.getInt() * scale.z + offset.z;
        int intensity = Short.toUnsignedInt(buffer.getShort());
        int classification = Byte.toUnsignedInt(buffer.get());
        int returnNumber = Byte.toUnsignedInt(buffer.get());
        double gpsTime = buffer.getDouble();
        return new PointRecord(x, y, z, intensity, classification, returnNumber, gpsTime);
    }

    static int quantize(double value, double scale, double offset) {
        long raw = Math.round((value - offset) / scale);
        if (raw < Integer.MIN_VALUE || raw > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(
            "Coordinate " + value + " not representable with scale " + scale + " and offset " + offset);
        }
        return (int) raw;
    }
}
