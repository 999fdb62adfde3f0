package com.faceattendance.service;

import com.faceattendance.exception.AttendanceException;
import com.faceattendance.exception.ErrorCode;

import javax.imageio.ImageIO;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Base64;

/**
 * Decoding and sanity checks for images received from clients.
 */
public final class ImagePayloads {

    private ImagePayloads() {}

    /**
     * Decodes a browser data URL ({@code data:image/jpeg;base64,...}) or a bare
     * base64 string and checks that the bytes are a readable image.
     *
     * @throws AttendanceException {@code DECODE_ERROR}
     */
    public static byte[] fromDataUrl(String dataUrl) {
        if (dataUrl == null || dataUrl.isBlank()) {
            throw AttendanceException.decodeError("No image data received");
        }
        int comma = dataUrl.indexOf(',');
        String base64 = comma >= 0 ? dataUrl.substring(comma + 1) : dataUrl;
        byte[] bytes;
        try {
            bytes = Base64.getMimeDecoder().decode(base64.trim());
        } catch (IllegalArgumentException e) {
            throw new AttendanceException(ErrorCode.DECODE_ERROR,
                    "Failed to decode image", e);
        }
        return requireImage(bytes);
    }

    /**
     * @return {@code bytes}, once verified to decode as an image
     * @throws AttendanceException {@code DECODE_ERROR}
     */
    public static byte[] requireImage(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw AttendanceException.decodeError("Image is empty");
        }
        try {
            if (ImageIO.read(new ByteArrayInputStream(bytes)) == null) {
                throw AttendanceException.decodeError("Failed to decode image");
            }
        } catch (IOException e) {
            throw new AttendanceException(ErrorCode.DECODE_ERROR,
                    "Failed to decode image", e);
        }
        return bytes;
    }
}
