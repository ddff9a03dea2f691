package com.ciffbridge.ciff;

import com.ciffbridge.ciff.proto.DocRecord;
import com.ciffbridge.ciff.proto.Header;
import com.ciffbridge.ciff.proto.PostingsList;
import com.ciffbridge.config.Constants;
import com.google.protobuf.MessageLite;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * CIFF 消息流写入器，每条消息以 varint 长度前缀分隔。
 */
public final class CiffWriter implements AutoCloseable {
    private final OutputStream outputStream;
    private final Path file;
    private boolean closed;

    /**
     * 创建（或截断）CIFF 输出文件。
     *
     * @param file 输出文件
     * @throws IOException 创建失败时抛出
     */
    public CiffWriter(Path file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("CIFF 输出文件不能为空");
        }
        try {
            this.outputStream = new BufferedOutputStream(Files.newOutputStream(file), Constants.WRITE_BUFFER_SIZE);
        } catch (IOException exception) {
            throw new IOException("Unable to create " + file, exception);
        }
        this.file = file;
    }

    public void writeHeader(Header header) throws IOException {
        writeMessage(header);
    }

    public void writePostingsList(PostingsList postingsList) throws IOException {
        writeMessage(postingsList);
    }

    public void writeDocRecord(DocRecord docRecord) throws IOException {
        writeMessage(docRecord);
    }

    private void writeMessage(MessageLite message) throws IOException {
        ensureOpen();
        try {
            message.writeDelimitedTo(outputStream);
        } catch (IOException exception) {
            throw new IOException("写入 CIFF 消息失败: file=" + file, exception);
        }
    }

    /**
     * 刷新并关闭输出流。
     *
     * @throws IOException 关闭失败时抛出
     */
    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        try {
            outputStream.flush();
        } catch (IOException exception) {
            throw new IOException("关闭 CIFF 写入器失败: file=" + file, exception);
        } finally {
            outputStream.close();
            closed = true;
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("CiffWriter 已关闭");
        }
    }
}
