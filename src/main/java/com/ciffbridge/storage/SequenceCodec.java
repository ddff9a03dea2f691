package com.ciffbridge.storage;

import com.ciffbridge.error.InvalidFormatException;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.MappedByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.PrimitiveIterator;

/**
 * 小端定长整数与二进制集合序列的编解码工具
 * 
 * 序列格式：4字节小端长度 n，随后 n 个4字节小端无符号整数。
 * 所有读取都基于显式的字节拼装并做边界检查，不依赖缓冲区自身的字节序设置。
 */
public final class SequenceCodec {
    
    /** 单个元素（u32）的字节数 */
    public static final int ELEMENT_BYTES = Integer.BYTES;
    
    private SequenceCodec() {
        // 工具类，禁止实例化
    }
    
    /**
     * 写出一条完整序列
     * 
     * @param out 输出流
     * @param values 序列元素（按无符号32位解释）
     * @throws IOException IO异常
     */
    public static void writeSequence(OutputStream out, int[] values) throws IOException {
        if (values == null) {
            throw new IllegalArgumentException("序列不能为null");
        }
        writeIntLE(out, values.length);
        for (int value : values) {
            writeIntLE(out, value);
        }
    }
    
    /**
     * 写出长度已知、元素来自迭代器的序列
     * 
     * @param out 输出流
     * @param length 声明的长度
     * @param values 元素迭代器，必须恰好产生 length 个元素
     * @throws IOException IO异常
     * @throws IllegalArgumentException 迭代器元素个数与声明长度不一致
     */
    public static void writeSequence(OutputStream out, int length, PrimitiveIterator.OfInt values) throws IOException {
        writeIntLE(out, length);
        long written = 0;
        while (values.hasNext()) {
            if (written == Integer.toUnsignedLong(length)) {
                throw new IllegalArgumentException("序列元素多于声明长度: " + Integer.toUnsignedString(length));
            }
            writeIntLE(out, values.nextInt());
            written++;
        }
        if (written != Integer.toUnsignedLong(length)) {
            throw new IllegalArgumentException(
                "序列元素少于声明长度: declared=" + Integer.toUnsignedString(length) + ", actual=" + written);
        }
    }
    
    /**
     * 写出4字节小端整数
     */
    public static void writeIntLE(OutputStream out, int value) throws IOException {
        out.write(value & 0xFF);
        out.write((value >>> 8) & 0xFF);
        out.write((value >>> 16) & 0xFF);
        out.write((value >>> 24) & 0xFF);
    }
    
    /**
     * 写出8字节小端整数
     */
    public static void writeLongLE(OutputStream out, long value) throws IOException {
        for (int shift = 0; shift < Long.SIZE; shift += Byte.SIZE) {
            out.write((int) ((value >>> shift) & 0xFF));
        }
    }
    
    /**
     * 在绝对位置读取4字节小端整数
     * 
     * @param buffer 字节缓冲区（读取不改变其 position）
     * @param position 绝对字节位置
     * @return 解码值
     * @throws InvalidFormatException 越界时抛出
     */
    public static int readIntLE(ByteBuffer buffer, long position) {
        if (position < 0 || position + Integer.BYTES > buffer.limit()) {
            throw new InvalidFormatException("读取u32越界: position=" + position + ", limit=" + buffer.limit());
        }
        int base = (int) position;
        return (buffer.get(base) & 0xFF)
            | ((buffer.get(base + 1) & 0xFF) << 8)
            | ((buffer.get(base + 2) & 0xFF) << 16)
            | ((buffer.get(base + 3) & 0xFF) << 24);
    }
    
    /**
     * 在绝对位置读取8字节小端整数
     * 
     * @param buffer 字节缓冲区（读取不改变其 position）
     * @param position 绝对字节位置
     * @return 解码值
     * @throws InvalidFormatException 越界时抛出
     */
    public static long readLongLE(ByteBuffer buffer, long position) {
        if (position < 0 || position + Long.BYTES > buffer.limit()) {
            throw new InvalidFormatException("读取u64越界: position=" + position + ", limit=" + buffer.limit());
        }
        int base = (int) position;
        long result = 0;
        for (int index = Long.BYTES - 1; index >= 0; index--) {
            result = (result << 8) | (buffer.get(base + index) & 0xFFL);
        }
        return result;
    }
    
    /**
     * 只读映射整个文件。映射在通道关闭后依然有效。
     * 
     * @param file 文件路径
     * @return 只读映射缓冲区
     * @throws IOException 打开或映射失败时抛出
     */
    public static MappedByteBuffer map(Path file) throws IOException {
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ)) {
            long size = channel.size();
            if (size > Integer.MAX_VALUE) {
                throw new IOException("文件超过单次映射上限(2GB): " + file + ", size=" + size);
            }
            return channel.map(FileChannel.MapMode.READ_ONLY, 0, size);
        } catch (IOException exception) {
            throw new IOException("映射文件失败: " + file, exception);
        }
    }
}
