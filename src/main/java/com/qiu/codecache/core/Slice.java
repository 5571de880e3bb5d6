package com.qiu.codecache.core;

import java.util.Arrays;
import java.util.Objects;

/**
 * 不可变字节切片，作为缓存键使用
 *
 * <p>相等性和哈希值都基于内容。{@link #wrap(byte[])} 不拷贝数组，调用方需保证之后不再修改；
 * 需要长期持有时使用 {@link #copy()}。
 */
public final class Slice implements Comparable<Slice> {
    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private final byte[] data;
    private final int offset;
    private final int length;

    private Slice(byte[] data, int offset, int length) {
        Objects.requireNonNull(data, "Data cannot be null");
        if (offset < 0 || length < 0 || offset + length > data.length) {
            throw new IllegalArgumentException("Invalid offset or length");
        }
        this.data = data;
        this.offset = offset;
        this.length = length;
    }

    public static Slice wrap(byte[] data) {
        return new Slice(data, 0, data.length);
    }

    public static Slice wrap(byte[] data, int offset, int length) {
        return new Slice(data, offset, length);
    }

    public static Slice copyOf(byte[] data) {
        return new Slice(Arrays.copyOf(data, data.length), 0, data.length);
    }

    /**
     * 返回拥有独立底层数组的副本
     */
    public Slice copy() {
        return new Slice(Arrays.copyOfRange(data, offset, offset + length), 0, length);
    }

    /**
     * 返回内容的拷贝
     */
    public byte[] getData() {
        return Arrays.copyOfRange(data, offset, offset + length);
    }

    public byte byteAt(int index) {
        if (index < 0 || index >= length) {
            throw new IndexOutOfBoundsException("Index: " + index + ", Length: " + length);
        }
        return data[offset + index];
    }

    public int size() {
        return length;
    }

    public boolean isEmpty() {
        return length == 0;
    }

    @Override
    public int compareTo(Slice other) {
        if (this == other) return 0;

        int minLength = Math.min(this.length, other.length);
        for (int i = 0; i < minLength; i++) {
            int cmp = Integer.compare(this.data[this.offset + i] & 0xFF, other.data[other.offset + i] & 0xFF);
            if (cmp != 0) return cmp;
        }

        return Integer.compare(this.length, other.length);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        Slice other = (Slice) obj;
        return Arrays.equals(data, offset, offset + length,
                other.data, other.offset, other.offset + other.length);
    }

    @Override
    public int hashCode() {
        int result = 1;
        for (int i = 0; i < length; i++) {
            result = 31 * result + data[offset + i];
        }
        return result;
    }

    /**
     * 十六进制形式，过长时截断
     */
    public String toHexString(int maxBytes) {
        int shown = Math.min(length, maxBytes);
        StringBuilder sb = new StringBuilder(shown * 2 + 3);
        for (int i = 0; i < shown; i++) {
            int b = data[offset + i] & 0xFF;
            sb.append(HEX[b >>> 4]).append(HEX[b & 0x0F]);
        }
        if (shown < length) {
            sb.append("...");
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "Slice{size=" + length + ", hex=" + toHexString(16) + "}";
    }
}
