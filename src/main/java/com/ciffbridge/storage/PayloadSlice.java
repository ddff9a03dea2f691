package com.ciffbridge.storage;

import com.ciffbridge.error.InvalidFormatException;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * 外部字节区间（通常是映射文件）上的词典只读视图，不物化任何元素。
 * 
 * 构造时校验头部与偏移表落在缓冲区内；读取元素时再校验该元素的偏移，
 * 损坏的缓冲区只会得到 {@link InvalidFormatException}，不会越界读取。
 */
public final class PayloadSlice implements Iterable<ByteBuffer> {
    private final ByteBuffer buffer;
    private final long length;
    private final long payloadsOffset;

    private PayloadSlice(ByteBuffer buffer, long length, long payloadsOffset) {
        this.buffer = buffer;
        this.length = length;
        this.payloadsOffset = payloadsOffset;
    }

    /**
     * 包装缓冲区剩余字节。
     *
     * @param bytes 词典字节
     * @return 词典视图
     * @throws InvalidFormatException 头部或偏移表不完整时抛出
     */
    public static PayloadSlice wrap(ByteBuffer bytes) {
        ByteBuffer view = bytes.slice();
        if (view.limit() < Long.BYTES) {
            throw new InvalidFormatException("词典缺少长度头部: bytes=" + view.limit());
        }
        long length = SequenceCodec.readLongLE(view, 0);
        // 偏移表共 L+1 项，payload 区从 (L+2)*8 开始
        long maxEntries = view.limit() / Long.BYTES;
        if (length < 0 || length > maxEntries - 2) {
            throw new InvalidFormatException("词典长度与字节数不符: length=" + length + ", bytes=" + view.limit());
        }
        return new PayloadSlice(view, length, (length + 2) * Long.BYTES);
    }

    /**
     * 只读映射词典文件。
     *
     * @param file 词典文件
     * @return 词典视图
     * @throws IOException 映射失败时抛出
     */
    public static PayloadSlice open(Path file) throws IOException {
        return wrap(SequenceCodec.map(file));
    }

    /**
     * 元素个数。
     */
    public long size() {
        return length;
    }

    public boolean isEmpty() {
        return length == 0;
    }

    /**
     * 安全读取第 index 个元素，越界返回空。
     *
     * @param index 元素下标
     * @return 元素字节的只读视图或空
     * @throws InvalidFormatException 该元素的偏移损坏时抛出
     */
    public Optional<ByteBuffer> get(long index) {
        if (index < 0 || index >= length) {
            return Optional.empty();
        }
        long offsetPosition = (index + 1) * Long.BYTES;
        long start = SequenceCodec.readLongLE(buffer, offsetPosition);
        long end = SequenceCodec.readLongLE(buffer, offsetPosition + Long.BYTES);
        long payloadBytes = buffer.limit() - payloadsOffset;
        if (start < 0 || end < start || end > payloadBytes) {
            throw new InvalidFormatException(
                "词典元素偏移损坏: index=" + index + ", start=" + start + ", end=" + end + ", payloadBytes=" + payloadBytes);
        }
        ByteBuffer payload = buffer.duplicate();
        payload.limit((int) (payloadsOffset + end));
        payload.position((int) (payloadsOffset + start));
        return Optional.of(payload.slice().asReadOnlyBuffer());
    }

    /**
     * 断言式读取第 index 个元素。
     *
     * @throws IndexOutOfBoundsException 下标越界时抛出
     */
    public ByteBuffer at(long index) {
        return get(index).orElseThrow(
            () -> new IndexOutOfBoundsException("index out of bounds: " + index + ", size=" + length));
    }

    /**
     * 以 UTF-8 解码第 index 个元素。
     */
    public Optional<String> getString(long index) {
        return get(index).map(PayloadSlice::decode);
    }

    /**
     * 复制第 index 个元素的字节。
     */
    public byte[] bytesAt(long index) {
        ByteBuffer payload = at(index);
        byte[] bytes = new byte[payload.remaining()];
        payload.get(bytes);
        return bytes;
    }

    @Override
    public Iterator<ByteBuffer> iterator() {
        return new Iterator<>() {
            private long index;

            @Override
            public boolean hasNext() {
                return index < length;
            }

            @Override
            public ByteBuffer next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return at(index++);
            }
        };
    }

    /**
     * 按 UTF-8 解码的全部元素。
     */
    public Stream<String> strings() {
        return StreamSupport.stream(spliterator(), false).map(PayloadSlice::decode);
    }

    private static String decode(ByteBuffer payload) {
        return StandardCharsets.UTF_8.decode(payload.duplicate()).toString();
    }
}
