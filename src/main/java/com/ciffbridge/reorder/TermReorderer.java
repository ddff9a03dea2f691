package com.ciffbridge.reorder;

import com.ciffbridge.config.Constants;
import com.ciffbridge.config.PisaPaths;
import com.ciffbridge.convert.ProgressListener;
import com.ciffbridge.error.InvalidFormatException;
import com.ciffbridge.storage.RandomAccessCollection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * 词项重排器，把 .docs/.freqs/.terms 改写为词项字典序。
 *
 * 二进制文件先移到临时文件，经 {@link RandomAccessCollection} 映射后按新顺序流式写回原路径；
 * 失败时删除半成品并把临时文件移回原处。
 */
public final class TermReorderer {
    private static final Logger logger = LoggerFactory.getLogger(TermReorderer.class);
    private static final String STAGE = "词项重排";

    private final ProgressListener progress;

    public TermReorderer() {
        this(ProgressListener.NONE);
    }

    public TermReorderer(ProgressListener progress) {
        this.progress = progress == null ? ProgressListener.NONE : progress;
    }

    /**
     * 检查词项文件是否已按字典序排列（允许相等的相邻词项）。
     *
     * @param termsFile 词项文件
     * @return 已排序返回 true
     * @throws IOException 读取失败时抛出
     */
    public static boolean isSorted(Path termsFile) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(termsFile, StandardCharsets.UTF_8)) {
            String previous = null;
            String line;
            while ((line = reader.readLine()) != null) {
                if (previous != null && TermOrder.compare(previous, line) > 0) {
                    return false;
                }
                previous = line;
            }
            return true;
        } catch (IOException exception) {
            throw new IOException("读取词项文件失败: " + termsFile, exception);
        }
    }

    /**
     * 计算排序置换：结果第 k 位是排序后第 k 个词项的原始序号，相等词项保持原相对顺序。
     *
     * @param terms 原始词项
     * @return 置换数组
     */
    public static int[] sortingPermutation(List<String> terms) {
        byte[][] keys = new byte[terms.size()][];
        List<Integer> order = new ArrayList<>(terms.size());
        for (int index = 0; index < keys.length; index++) {
            keys[index] = terms.get(index).getBytes(StandardCharsets.UTF_8);
            order.add(index);
        }
        // List.sort 为稳定排序
        order.sort((left, right) -> TermOrder.compareBytes(keys[left], keys[right]));
        return order.stream().mapToInt(Integer::intValue).toArray();
    }

    /**
     * 按词项字典序重排整个 PISA 集合。
     *
     * @param paths PISA 文件组
     * @throws IOException 读写失败时抛出
     * @throws InvalidFormatException 序列条数与词项数不一致时抛出
     */
    public void reorder(PisaPaths paths) throws IOException {
        List<String> terms = readTerms(paths.terms());
        int[] permutation = sortingPermutation(terms);
        logger.info("按字典序重排 {} 个词项: {}", terms.size(), paths.basename());
        requireSequenceCount(paths.docs(), terms.size() + 1L);
        requireSequenceCount(paths.freqs(), terms.size());

        progress.onStart(STAGE, terms.size() * 2L);
        permuteCollection(paths.docs(), permutation, 1, 0L);
        permuteCollection(paths.freqs(), permutation, 0, terms.size());
        writeTerms(paths.terms(), terms, permutation);
        progress.onFinish(STAGE, terms.size() * 2L);
    }

    /**
     * 在改动任何文件之前校验序列条数，避免只重排了其中一个文件。
     */
    private static void requireSequenceCount(Path file, long expected) throws IOException {
        int actual = RandomAccessCollection.open(file).size();
        if (actual != expected) {
            throw new InvalidFormatException("序列条数与词项数不一致: file=" + file
                    + ", sequences=" + actual + ", expected=" + expected);
        }
    }

    /**
     * 按置换改写一个二进制集合文件。
     *
     * @param file 目标文件
     * @param permutation 置换数组
     * @param leadingSequences 保持原位的前导序列条数（.docs 为1，存放文档总数）
     * @param progressBase 进度计数起点
     * @throws IOException 读写失败时抛出
     */
    void permuteCollection(Path file, int[] permutation, int leadingSequences, long progressBase) throws IOException {
        Path movedAside = file.resolveSibling(file.getFileName().toString() + Constants.TEMP_SUFFIX);
        Files.move(file, movedAside, StandardCopyOption.REPLACE_EXISTING);
        try {
            RandomAccessCollection source = RandomAccessCollection.open(movedAside);
            int expected = permutation.length + leadingSequences;
            if (source.size() != expected) {
                throw new InvalidFormatException(
                    "序列条数与词项数不一致: file=" + file + ", sequences=" + source.size() + ", expected=" + expected);
            }
            try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(file), Constants.WRITE_BUFFER_SIZE)) {
                for (int index = 0; index < leadingSequences; index++) {
                    source.at(index).writeTo(out);
                }
                for (int position = 0; position < permutation.length; position++) {
                    source.at(permutation[position] + leadingSequences).writeTo(out);
                    progress.onAdvance(STAGE, progressBase + position + 1);
                }
            }
        } catch (IOException | RuntimeException exception) {
            restore(movedAside, file, exception);
            throw exception;
        }
        Files.delete(movedAside);
    }

    private static void restore(Path movedAside, Path file, Exception failure) {
        try {
            Files.deleteIfExists(file);
            Files.move(movedAside, file, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException restoreFailure) {
            failure.addSuppressed(restoreFailure);
        }
    }

    private static List<String> readTerms(Path termsFile) throws IOException {
        try {
            return Files.readAllLines(termsFile, StandardCharsets.UTF_8);
        } catch (IOException exception) {
            throw new IOException("读取词项文件失败: " + termsFile, exception);
        }
    }

    private static void writeTerms(Path termsFile, List<String> terms, int[] permutation) throws IOException {
        Path staging = termsFile.resolveSibling(termsFile.getFileName().toString() + Constants.TEMP_SUFFIX);
        try (BufferedWriter writer = Files.newBufferedWriter(staging, StandardCharsets.UTF_8)) {
            for (int originalIndex : permutation) {
                writer.write(terms.get(originalIndex));
                writer.write('\n');
            }
        } catch (IOException exception) {
            Files.deleteIfExists(staging);
            throw new IOException("写入词项文件失败: " + termsFile, exception);
        }
        Files.move(staging, termsFile, StandardCopyOption.REPLACE_EXISTING);
    }
}
