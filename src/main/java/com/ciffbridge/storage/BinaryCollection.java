package com.ciffbridge.storage;

import com.ciffbridge.error.InvalidFormatException;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * 二进制集合的前向惰性解码器
 * 
 * 二进制集合是若干序列的拼接，每条序列以4字节小端长度开头，后接对应数量的4字节元素。
 * 解码严格前向、不可回退：每次 {@link #next()} 恰好消费 4 + 4*len 字节。
 * 需要再次遍历时必须重新创建实例。
 */
public final class BinaryCollection implements Iterator<BinarySequence> {
    private final ByteBuffer buffer;
    private int position;

    private BinaryCollection(ByteBuffer buffer) {
        this.buffer = buffer;
        this.position = 0;
    }

    /**
     * 基于缓冲区剩余字节创建集合视图，不复制数据。
     *
     * @param bytes 字节缓冲区
     * @return 集合迭代器
     * @throws InvalidFormatException 字节数不是4的倍数时抛出
     */
    public static BinaryCollection of(ByteBuffer bytes) {
        ByteBuffer view = bytes.slice();
        if (view.remaining() % SequenceCodec.ELEMENT_BYTES != 0) {
            throw new InvalidFormatException(
                "The byte-length of the collection is not divisible by the element size (4)");
        }
        return new BinaryCollection(view);
    }

    public static BinaryCollection of(byte[] bytes) {
        return of(ByteBuffer.wrap(bytes));
    }

    /**
     * 只读映射文件并创建集合视图。
     *
     * @param file 二进制集合文件
     * @return 集合迭代器
     * @throws IOException 映射失败时抛出
     */
    public static BinaryCollection open(Path file) throws IOException {
        return of(SequenceCodec.map(file));
    }

    /**
     * 下一条序列在底层缓冲区中的起始字节位置。
     */
    public int position() {
        return position;
    }

    @Override
    public boolean hasNext() {
        return position < buffer.limit();
    }

    /**
     * 解码下一条序列。
     *
     * @return 序列视图
     * @throws InvalidFormatException 剩余字节不足以满足声明长度时抛出
     * @throws NoSuchElementException 已无剩余字节时抛出
     */
    @Override
    public BinarySequence next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        int remaining = buffer.limit() - position;
        if (remaining < SequenceCodec.ELEMENT_BYTES) {
            throw new InvalidFormatException("剩余字节不足以读取序列长度: position=" + position);
        }
        long length = Integer.toUnsignedLong(SequenceCodec.readIntLE(buffer, position));
        long elementBytes = length * SequenceCodec.ELEMENT_BYTES;
        if (elementBytes > remaining - SequenceCodec.ELEMENT_BYTES) {
            throw new InvalidFormatException(
                "序列声明长度超出剩余字节: position=" + position + ", length=" + length + ", remaining=" + remaining);
        }
        BinarySequence sequence = new BinarySequence(buffer, position + SequenceCodec.ELEMENT_BYTES, (int) length);
        position += SequenceCodec.ELEMENT_BYTES + (int) elementBytes;
        return sequence;
    }

    /**
     * 解码剩余全部序列为数组列表，主要用于测试与小型集合。
     *
     * @return 每条序列的元素数组
     */
    public List<int[]> readAll() {
        List<int[]> sequences = new ArrayList<>();
        while (hasNext()) {
            sequences.add(next().toArray());
        }
        return sequences;
    }
}
