package com.ciffbridge.storage;

import com.ciffbridge.config.Constants;

import java.io.BufferedOutputStream;
import java.io.ByteArrayOutputStream;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 变长字节串向量（词典）的内存构建版本
 * 
 * 布局：8字节元素个数 L，随后 L+1 个8字节累计偏移（首个为0），最后是全部元素字节首尾相接。
 * 所有整数均为小端。第 i 个元素占据 payload 区的 [offsets[i], offsets[i+1])。
 */
public final class PayloadVector {
    private final byte[] data;

    private PayloadVector(byte[] data) {
        this.data = data;
    }

    /**
     * 按 UTF-8 编码字符串构建向量。
     *
     * @param items 有序字符串
     * @return 构建好的向量
     */
    public static PayloadVector fromStrings(Iterable<String> items) {
        List<byte[]> payloads = new ArrayList<>();
        for (String item : items) {
            if (item == null) {
                throw new IllegalArgumentException("元素不能为null");
            }
            payloads.add(item.getBytes(StandardCharsets.UTF_8));
        }
        return fromBytes(payloads);
    }

    /**
     * 按原始字节串构建向量。
     *
     * @param items 有序字节串
     * @return 构建好的向量
     */
    public static PayloadVector fromBytes(Iterable<byte[]> items) {
        ByteArrayOutputStream offsets = new ByteArrayOutputStream();
        ByteArrayOutputStream payloads = new ByteArrayOutputStream();
        long length = 0;
        long offset = 0;
        try {
            SequenceCodec.writeLongLE(offsets, offset);
            for (byte[] item : items) {
                if (item == null) {
                    throw new IllegalArgumentException("元素不能为null");
                }
                payloads.write(item);
                offset += item.length;
                length++;
                SequenceCodec.writeLongLE(offsets, offset);
            }
            ByteArrayOutputStream data = new ByteArrayOutputStream(
                Long.BYTES + offsets.size() + payloads.size());
            SequenceCodec.writeLongLE(data, length);
            offsets.writeTo(data);
            payloads.writeTo(data);
            return new PayloadVector(data.toByteArray());
        } catch (IOException exception) {
            // 内存流不会产生 IO 异常
            throw new IllegalStateException("构建 PayloadVector 失败", exception);
        }
    }

    /**
     * 将文本文件逐行构建为词典文件。
     *
     * @param input 文本文件，每行一个元素
     * @param output 词典输出文件
     * @throws IOException 读写失败时抛出
     */
    public static void buildLexicon(Path input, Path output) throws IOException {
        List<String> lines = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(input, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lines.add(line);
            }
        } catch (IOException exception) {
            throw new IOException("读取词典源文件失败: " + input, exception);
        }
        PayloadVector vector = fromStrings(lines);
        try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(output), Constants.WRITE_BUFFER_SIZE)) {
            vector.write(out);
        } catch (IOException exception) {
            throw new IOException("写入词典文件失败: " + output, exception);
        }
    }

    /**
     * 写出完整字节布局。
     *
     * @param out 输出流
     * @throws IOException 写入失败时抛出
     */
    public void write(OutputStream out) throws IOException {
        out.write(data);
        out.flush();
    }

    /**
     * 以只读视图访问元素。
     */
    public PayloadSlice asSlice() {
        return PayloadSlice.wrap(ByteBuffer.wrap(data).asReadOnlyBuffer());
    }

    public long size() {
        return asSlice().size();
    }

    /**
     * 编码后的字节数。
     */
    public int byteSize() {
        return data.length;
    }
}
