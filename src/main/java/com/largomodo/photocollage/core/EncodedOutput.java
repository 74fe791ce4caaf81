package com.largomodo.photocollage.core;

import java.util.Arrays;
import java.util.Objects;

/**
 * Encoded bytes for one output format, or the reason encoding failed.
 * Exactly one of {@code data} and {@code error} is non-null.
 * <p>
 * The byte array is copied on the way in and on the way out, and equality compares its content.
 *
 * @param format output format
 * @param data   encoded file content, null on failure
 * @param error  encoding failure, null on success
 */
public record EncodedOutput(OutputFormat format, byte[] data, Exception error) {

    public EncodedOutput {
        Objects.requireNonNull(format, "format");
        if ((data == null) == (error == null)) {
            throw new IllegalArgumentException("Exactly one of data and error must be set for " + format);
        }
        data = data == null ? null : data.clone();
    }

    public static EncodedOutput success(OutputFormat format, byte[] data) {
        return new EncodedOutput(format, data, null);
    }

    public static EncodedOutput failure(OutputFormat format, Exception error) {
        return new EncodedOutput(format, null, error);
    }

    @Override
    public byte[] data() {
        return data == null ? null : data.clone();
    }

    public boolean succeeded() {
        return data != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EncodedOutput)) {
            return false;
        }
        EncodedOutput other = (EncodedOutput) o;
        return format == other.format
                && Arrays.equals(data, other.data)
                && Objects.equals(error, other.error);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(format, error) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "EncodedOutput[format=" + format
                + (data != null ? ", bytes=" + data.length : ", error=" + error) + "]";
    }
}
