package com.ciffbridge.storage;

import com.ciffbridge.error.InvalidFormatException;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.util.NoSuchElementException;
import java.util.OptionalInt;
import java.util.PrimitiveIterator;

/**
 * 二进制集合中的单条序列视图，不复制底层字节。
 * 
 * 元素为无符号32位整数，以 Java int 承载；需要数值语义时使用 {@link Integer#toUnsignedLong(int)}。
 */
public final class BinarySequence {
    private final ByteBuffer buffer;
    private final int elementsOffset;
    private final int length;

    /**
     * @param buffer 底层缓冲区
     * @param elementsOffset 第一个元素的绝对字节位置（不含长度前缀）
     * @param length 声明的元素个数
     */
    BinarySequence(ByteBuffer buffer, int elementsOffset, int length) {
        this.buffer = buffer;
        this.elementsOffset = elementsOffset;
        this.length = length;
    }

    /**
     * 将不含长度前缀的字节包装为序列，长度取字节数除以4。
     *
     * @param elementBytes 元素字节
     * @return 序列视图
     * @throws IllegalArgumentException 字节数不是4的倍数时抛出
     */
    public static BinarySequence wrap(ByteBuffer elementBytes) {
        int remaining = elementBytes.remaining();
        if (remaining % SequenceCodec.ELEMENT_BYTES != 0) {
            throw new IllegalArgumentException("序列字节数必须是4的倍数: " + remaining);
        }
        ByteBuffer view = elementBytes.slice();
        return new BinarySequence(view, 0, remaining / SequenceCodec.ELEMENT_BYTES);
    }

    /**
     * 返回元素个数。
     *
     * @return 元素个数
     */
    public int length() {
        return length;
    }

    public boolean isEmpty() {
        return length == 0;
    }

    /**
     * 返回元素与长度前缀一共占用的字节数。
     */
    public long byteSize() {
        return SequenceCodec.ELEMENT_BYTES * (Integer.toUnsignedLong(length) + 1);
    }

    /**
     * 安全读取元素：下标越界或底层字节不足时返回空，不抛异常。
     *
     * @param index 元素下标
     * @return 元素值或空
     */
    public OptionalInt get(int index) {
        if (index < 0 || Integer.toUnsignedLong(index) >= Integer.toUnsignedLong(length)) {
            return OptionalInt.empty();
        }
        long position = elementsOffset + (long) index * SequenceCodec.ELEMENT_BYTES;
        if (position + SequenceCodec.ELEMENT_BYTES > buffer.limit()) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(SequenceCodec.readIntLE(buffer, position));
    }

    /**
     * 断言式读取元素。
     *
     * @param index 元素下标
     * @return 元素值
     * @throws IndexOutOfBoundsException 下标越界时抛出
     */
    public int at(int index) {
        OptionalInt value = get(index);
        if (value.isEmpty()) {
            throw new IndexOutOfBoundsException("index out of bounds: " + index + ", length=" + length);
        }
        return value.getAsInt();
    }

    /**
     * 遍历全部元素。
     */
    public PrimitiveIterator.OfInt iterator() {
        return new PrimitiveIterator.OfInt() {
            private int index;

            @Override
            public boolean hasNext() {
                return get(index).isPresent();
            }

            @Override
            public int nextInt() {
                OptionalInt value = get(index);
                if (value.isEmpty()) {
                    throw new NoSuchElementException();
                }
                index++;
                return value.getAsInt();
            }
        };
    }

    /**
     * 复制全部元素为数组。
     */
    public int[] toArray() {
        int[] values = new int[length];
        for (int index = 0; index < length; index++) {
            values[index] = at(index);
        }
        return values;
    }

    /**
     * 按无符号语义求和。
     */
    public long sum() {
        long total = 0;
        PrimitiveIterator.OfInt values = iterator();
        while (values.hasNext()) {
            total += Integer.toUnsignedLong(values.nextInt());
        }
        return total;
    }

    /**
     * 原样写出长度前缀与元素字节。
     *
     * @param out 输出流
     * @throws IOException 写入失败时抛出
     */
    public void writeTo(OutputStream out) throws IOException {
        long end = elementsOffset + Integer.toUnsignedLong(length) * SequenceCodec.ELEMENT_BYTES;
        if (end > buffer.limit()) {
            throw new InvalidFormatException("序列声明长度超出底层字节: length=" + Integer.toUnsignedString(length));
        }
        SequenceCodec.writeIntLE(out, length);
        ByteBuffer elements = buffer.duplicate();
        elements.limit((int) end);
        elements.position(elementsOffset);
        byte[] chunk = new byte[8 * 1024];
        while (elements.hasRemaining()) {
            int chunkSize = Math.min(chunk.length, elements.remaining());
            elements.get(chunk, 0, chunkSize);
            out.write(chunk, 0, chunkSize);
        }
    }
}
