package com.ciffbridge;

import com.ciffbridge.config.CiffToPisaOptions;
import com.ciffbridge.ciff.CiffWriter;
import com.ciffbridge.convert.CiffToPisaConverter;
import com.ciffbridge.convert.ConversionSummary;
import com.ciffbridge.convert.PostingsTranslator;
import com.ciffbridge.convert.ProgressListener;
import com.ciffbridge.storage.BinaryCollection;
import com.ciffbridge.storage.RandomAccessCollection;
import com.ciffbridge.storage.SequenceCodec;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Random;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * 二进制集合解码与 CIFF → PISA 转换基准测试
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms2g", "-Xmx2g"})
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class CollectionBenchmark {

    @State(Scope.Thread)
    public static class CollectionState {
        ByteBuffer bytes;
        RandomAccessCollection randomAccess;
        int[] lookups;

        @Setup
        public void setup() throws IOException {
            Random random = new Random(7);
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            // 10万条序列，长度 0..63
            for (int i = 0; i < 100_000; i++) {
                int[] sequence = new int[random.nextInt(64)];
                int value = 0;
                for (int j = 0; j < sequence.length; j++) {
                    value += 1 + random.nextInt(16);
                    sequence[j] = value;
                }
                SequenceCodec.writeSequence(out, sequence);
            }
            bytes = ByteBuffer.wrap(out.toByteArray());
            randomAccess = new RandomAccessCollection(bytes);
            lookups = new int[1024];
            for (int i = 0; i < lookups.length; i++) {
                lookups[i] = random.nextInt(randomAccess.size());
            }
        }
    }

    @Benchmark
    public long sequentialDecode(CollectionState state) {
        BinaryCollection collection = BinaryCollection.of(state.bytes);
        long total = 0;
        while (collection.hasNext()) {
            total += collection.next().sum();
        }
        return total;
    }

    @Benchmark
    public long randomAccess(CollectionState state) {
        long total = 0;
        for (int index : state.lookups) {
            total += state.randomAccess.at(index).length();
        }
        return total;
    }

    @State(Scope.Benchmark)
    public static class ConversionState {
        Path tempDir;
        Path ciff;

        @Setup
        public void setup() throws IOException {
            tempDir = Files.createTempDirectory("benchmark");
            ciff = tempDir.resolve("bench.ciff");
            int documents = 10_000;
            int terms = 5_000;
            Random random = new Random(11);
            long[] lengths = new long[documents];
            try (CiffWriter writer = new CiffWriter(ciff)) {
                writer.writeHeader(PostingsTranslator.buildHeader(documents, terms, 0, "benchmark"));
                for (int t = 0; t < terms; t++) {
                    int df = 1 + random.nextInt(200);
                    int[] docIds = random.ints(0, documents).distinct().limit(df).sorted().toArray();
                    int[] freqs = new int[docIds.length];
                    for (int i = 0; i < docIds.length; i++) {
                        freqs[i] = 1 + random.nextInt(5);
                        lengths[docIds[i]] += freqs[i];
                    }
                    writer.writePostingsList(PostingsTranslator.toPostingsList(String.format("t%06d", t), docIds, freqs));
                }
                for (int d = 0; d < documents; d++) {
                    writer.writeDocRecord(PostingsTranslator.toDocRecord(d, "doc" + d, (int) lengths[d]));
                }
            }
        }

        @TearDown
        public void tearDown() throws IOException {
            if (!Files.exists(tempDir)) return;
            try (Stream<Path> paths = Files.walk(tempDir)) {
                paths.sorted(Comparator.reverseOrder()).forEach(p -> p.toFile().delete());
            }
        }
    }

    @Benchmark
    @BenchmarkMode(Mode.AverageTime)
    @OutputTimeUnit(TimeUnit.MILLISECONDS)
    public ConversionSummary ciffToPisa(ConversionState state) throws IOException {
        return new CiffToPisaConverter(ProgressListener.NONE)
            .convert(new CiffToPisaOptions(state.ciff, state.tempDir.resolve("out"), false));
    }

    public static void main(String[] args) throws Exception {
        Options opt = new OptionsBuilder()
            .include(CollectionBenchmark.class.getSimpleName())
            .forks(1)
            .build();
        new Runner(opt).run();
    }
}
