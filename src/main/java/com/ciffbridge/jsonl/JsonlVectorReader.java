package com.ciffbridge.jsonl;

import com.ciffbridge.error.JsonlParseException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 逐行读取 {"id": ..., "vector": {...}} 形式的 JSONL 文件，空行跳过，多余字段忽略。
 */
public final class JsonlVectorReader implements AutoCloseable {
    private static final String ID_FIELD = "id";
    private static final String VECTOR_FIELD = "vector";

    private final ObjectMapper objectMapper;
    private final BufferedReader reader;
    private final Path file;
    private long lineNumber;
    private boolean closed;

    public JsonlVectorReader(Path file) throws IOException {
        this(file, new ObjectMapper());
    }

    public JsonlVectorReader(Path file, ObjectMapper objectMapper) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("JSONL 文件不能为空");
        }
        try {
            this.reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
        } catch (IOException exception) {
            throw new IOException("Unable to open " + file, exception);
        }
        this.file = file;
        this.objectMapper = objectMapper;
    }

    /**
     * 读取下一个文档。
     *
     * @return 文档，文件结束时返回 null
     * @throws IOException 读取失败时抛出
     * @throws JsonlParseException 当前行不是合法的文档对象时抛出
     */
    public JsonlDocument next() throws IOException {
        ensureOpen();
        String line;
        do {
            try {
                line = reader.readLine();
            } catch (IOException exception) {
                throw new IOException("读取 JSONL 失败: file=" + file + ", line=" + (lineNumber + 1), exception);
            }
            if (line == null) {
                return null;
            }
            lineNumber++;
        } while (line.isBlank());
        return parse(line, lineNumber);
    }

    /**
     * 已读取的物理行数（含空行）。
     */
    public long getLineNumber() {
        return lineNumber;
    }

    JsonlDocument parse(String line, long currentLine) {
        JsonNode root;
        try {
            root = objectMapper.readTree(line);
        } catch (JsonProcessingException exception) {
            throw new JsonlParseException("JSON 格式错误: " + exception.getOriginalMessage(), currentLine, line, exception);
        }
        if (root == null || !root.isObject()) {
            throw new JsonlParseException("每行必须是 JSON 对象", currentLine, line);
        }
        String id = parseId(root.get(ID_FIELD), currentLine, line);
        Map<String, Double> vector = parseVector(root.get(VECTOR_FIELD), currentLine, line);
        return new JsonlDocument(id, vector, currentLine, line);
    }

    private static String parseId(JsonNode idNode, long currentLine, String line) {
        if (idNode == null) {
            throw new JsonlParseException("缺少 id 字段", currentLine, line);
        }
        if (idNode.isTextual()) {
            return idNode.textValue();
        }
        if (idNode.isIntegralNumber()) {
            return idNode.bigIntegerValue().toString();
        }
        throw new JsonlParseException("id 必须是字符串或整数，实际为 " + idNode.getNodeType(), currentLine, line);
    }

    private static Map<String, Double> parseVector(JsonNode vectorNode, long currentLine, String line) {
        if (vectorNode == null || !vectorNode.isObject()) {
            throw new JsonlParseException("缺少 vector 对象", currentLine, line);
        }
        Map<String, Double> vector = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = vectorNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isNumber()) {
                throw new JsonlParseException("词项分数必须是数值: term=" + field.getKey(), currentLine, line);
            }
            if (!isWellFormed(field.getKey())) {
                throw new JsonlParseException("词项包含未配对的代理字符", currentLine, line);
            }
            vector.put(field.getKey(), field.getValue().doubleValue());
        }
        return vector;
    }

    /**
     * 未配对的代理字符编码为 UTF-8 时都会变成 '?'，不同词项会因此撞到同一个键上。
     */
    static boolean isWellFormed(String term) {
        for (int i = 0; i < term.length(); i++) {
            char current = term.charAt(i);
            if (Character.isHighSurrogate(current)) {
                if (i + 1 >= term.length() || !Character.isLowSurrogate(term.charAt(i + 1))) {
                    return false;
                }
                i++;
            } else if (Character.isLowSurrogate(current)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        reader.close();
        closed = true;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("JsonlVectorReader 已关闭");
        }
    }
}
