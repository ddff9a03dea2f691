package com.ciffbridge.storage;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Optional;

/**
 * 支持按序号随机读取的二进制集合。
 * 
 * 构造时线性扫描一遍记录每条序列的起始偏移，之后按偏移表 O(1) 重新解析单条序列。
 */
public final class RandomAccessCollection {
    private final ByteBuffer buffer;
    private final int[] offsets;

    /**
     * 扫描缓冲区并建立偏移表。
     *
     * @param bytes 二进制集合字节
     * @throws com.ciffbridge.error.InvalidFormatException 格式非法时抛出
     */
    public RandomAccessCollection(ByteBuffer bytes) {
        this.buffer = bytes.slice();
        BinaryCollection collection = BinaryCollection.of(buffer);
        int[] collected = new int[16];
        int count = 0;
        while (collection.hasNext()) {
            if (count == collected.length) {
                collected = Arrays.copyOf(collected, count * 2);
            }
            collected[count++] = collection.position();
            collection.next();
        }
        this.offsets = Arrays.copyOf(collected, count);
    }

    /**
     * 只读映射文件并建立偏移表。
     *
     * @param file 二进制集合文件
     * @return 随机访问集合
     * @throws IOException 映射失败时抛出
     */
    public static RandomAccessCollection open(Path file) throws IOException {
        return new RandomAccessCollection(SequenceCodec.map(file));
    }

    /**
     * 返回序列条数。
     */
    public int size() {
        return offsets.length;
    }

    /**
     * 返回第 index 条序列的起始字节偏移。
     *
     * @throws IndexOutOfBoundsException 下标越界时抛出
     */
    public int offset(int index) {
        if (index < 0 || index >= offsets.length) {
            throw new IndexOutOfBoundsException("index out of bounds: " + index + ", size=" + offsets.length);
        }
        return offsets[index];
    }

    /**
     * 安全读取第 index 条序列，越界返回空。
     *
     * @param index 序列序号
     * @return 序列视图或空
     */
    public Optional<BinarySequence> get(int index) {
        if (index < 0 || index >= offsets.length) {
            return Optional.empty();
        }
        int offset = offsets[index];
        int length = SequenceCodec.readIntLE(buffer, offset);
        return Optional.of(new BinarySequence(buffer, offset + SequenceCodec.ELEMENT_BYTES, length));
    }

    /**
     * 断言式读取第 index 条序列。
     *
     * @param index 序列序号
     * @return 序列视图
     * @throws IndexOutOfBoundsException 下标越界时抛出
     */
    public BinarySequence at(int index) {
        return get(index).orElseThrow(
            () -> new IndexOutOfBoundsException("index out of bounds: " + index + ", size=" + offsets.length));
    }
}
