package com.ciffbridge.ciff;

import com.ciffbridge.ciff.proto.DocRecord;
import com.ciffbridge.ciff.proto.Header;
import com.ciffbridge.ciff.proto.PostingsList;
import com.google.protobuf.Parser;

import java.io.BufferedInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * CIFF 消息流读取器，按 Header → PostingsList* → DocRecord* 的顺序逐条读取长度前缀消息。
 */
public final class CiffReader implements AutoCloseable {
    private final InputStream inputStream;
    private final Path file;
    private long messagesRead;
    private boolean closed;

    /**
     * 打开 CIFF 文件。
     *
     * @param file CIFF 文件
     * @throws IOException 打开失败时抛出
     */
    public CiffReader(Path file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("CIFF 文件不能为空");
        }
        try {
            this.inputStream = new BufferedInputStream(Files.newInputStream(file));
        } catch (IOException exception) {
            throw new IOException("Unable to open " + file, exception);
        }
        this.file = file;
    }

    public Header readHeader() throws IOException {
        return readMessage(Header.parser(), "Header");
    }

    public PostingsList readPostingsList() throws IOException {
        return readMessage(PostingsList.parser(), "PostingsList");
    }

    public DocRecord readDocRecord() throws IOException {
        return readMessage(DocRecord.parser(), "DocRecord");
    }

    /**
     * 已读取的消息条数（含头部）。
     */
    public long getMessagesRead() {
        return messagesRead;
    }

    /**
     * 读取一条长度前缀消息，流提前结束视为错误。
     */
    private <T> T readMessage(Parser<T> parser, String kind) throws IOException {
        ensureOpen();
        T message;
        try {
            message = parser.parseDelimitedFrom(inputStream);
        } catch (IOException exception) {
            throw new IOException("读取 CIFF " + kind + " 失败: file=" + file + ", message=" + messagesRead, exception);
        }
        if (message == null) {
            throw new EOFException("CIFF 流意外结束，期望 " + kind + ": file=" + file + ", message=" + messagesRead);
        }
        messagesRead++;
        return message;
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        inputStream.close();
        closed = true;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("CiffReader 已关闭");
        }
    }
}
