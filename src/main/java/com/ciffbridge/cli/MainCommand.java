package com.ciffbridge.cli;

import com.ciffbridge.config.CiffToJsonlOptions;
import com.ciffbridge.config.CiffToPisaOptions;
import com.ciffbridge.config.Constants;
import com.ciffbridge.config.JsonlToCiffOptions;
import com.ciffbridge.config.PisaPaths;
import com.ciffbridge.config.PisaToCiffOptions;
import com.ciffbridge.convert.CiffToJsonlConverter;
import com.ciffbridge.convert.CiffToPisaConverter;
import com.ciffbridge.convert.ConversionSummary;
import com.ciffbridge.convert.PisaToCiffConverter;
import com.ciffbridge.jsonl.JsonlToCiffConverter;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(
    name = "ciffbridge",
    description = "🔁 CIFF 与 PISA 非压缩倒排索引格式互转工具",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.CiffToPisaSubcommand.class,
        MainCommand.PisaToCiffSubcommand.class,
        MainCommand.JsonlToCiffSubcommand.class,
        MainCommand.CiffToJsonlSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        System.out.println("🔁 CIFF 与 PISA 非压缩倒排索引格式互转工具");
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    private static void printSummary(ConversionSummary summary, long elapsed) {
        System.out.println("📊 统计:");
        System.out.println("   文档数: " + summary.documents());
        System.out.println("   词项数: " + summary.postingsLists());
        System.out.println("   词项总数: " + summary.totalTerms());
        if (summary.reordered()) {
            System.out.println("   词项已按字典序重排");
        }
        System.out.println("   用时: " + elapsed + "ms");
    }

    @Command(name = "ciff2pisa", description = "📥 将 CIFF 文件转换为 PISA 二进制集合")
    static class CiffToPisaSubcommand implements Callable<Integer> {

        @Option(names = {"-c", "--ciff-file"}, description = "CIFF 输入文件", required = true)
        private Path ciffFile;

        @Option(names = {"-o", "--output"}, description = "PISA 输出前缀", required = true)
        private Path output;

        @Option(names = {"--no-lexicons"}, description = "不生成 .termlex/.doclex 词典")
        private boolean skipLexicons;

        @Override
        public Integer call() {
            System.out.println("🚀 开始转换 CIFF → PISA...");
            System.out.println("📄 输入: " + ciffFile);
            System.out.println("📁 输出前缀: " + output);
            try {
                long start = System.currentTimeMillis();
                ConversionSummary summary = new CiffToPisaConverter()
                    .convert(new CiffToPisaOptions(ciffFile, output, !skipLexicons));
                System.out.println("✅ 转换完成！");
                printSummary(summary, System.currentTimeMillis() - start);
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 转换失败: " + exception.getMessage());
                exception.printStackTrace();
                return 1;
            }
        }
    }

    @Command(name = "pisa2ciff", description = "📤 将 PISA 二进制集合转换为 CIFF 文件")
    static class PisaToCiffSubcommand implements Callable<Integer> {

        @Option(names = {"-c", "--collection"}, description = "二进制集合前缀（.docs/.freqs/.sizes）", required = true)
        private Path collection;

        @Option(names = {"-t", "--terms"}, description = "词项文件，默认 <collection>" + Constants.TERMS_SUFFIX)
        private Path terms;

        @Option(names = {"-d", "--documents"}, description = "文档ID文件，默认 <collection>" + Constants.DOCUMENTS_SUFFIX)
        private Path documents;

        @Option(names = {"-o", "--output"}, description = "CIFF 输出文件", required = true)
        private Path output;

        @Option(names = {"--description"}, description = "写入头部的描述", defaultValue = "")
        private String description;

        @Override
        public Integer call() {
            PisaToCiffOptions defaults = PisaToCiffOptions.forBasename(collection, output, description);
            PisaToCiffOptions options = new PisaToCiffOptions(
                collection,
                terms != null ? terms : defaults.termsPath(),
                documents != null ? documents : defaults.titlesPath(),
                output,
                description
            );
            System.out.println("🚀 开始转换 PISA → CIFF...");
            System.out.println("📁 集合: " + new PisaPaths(collection).docs());
            System.out.println("📄 输出: " + output);
            try {
                long start = System.currentTimeMillis();
                ConversionSummary summary = new PisaToCiffConverter().convert(options);
                System.out.println("✅ 转换完成！");
                printSummary(summary, System.currentTimeMillis() - start);
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 转换失败: " + exception.getMessage());
                exception.printStackTrace();
                return 1;
            }
        }
    }

    @Command(name = "jsonl2ciff", description = "📥 将 JSONL 文档向量转换为 CIFF 文件")
    static class JsonlToCiffSubcommand implements Callable<Integer> {

        @Option(names = {"-i", "--input"}, description = "JSONL 输入文件", required = true)
        private Path input;

        @Option(names = {"-o", "--output"}, description = "CIFF 输出文件", required = true)
        private Path output;

        @Option(names = {"-q", "--quantize"}, description = "将分数线性量化为整数词频")
        private boolean quantize;

        @Option(names = {"--bits"}, description = "量化位数 (1-16)", defaultValue = "8")
        private int bits;

        @Option(names = {"--description"}, description = "写入头部的描述", defaultValue = "")
        private String description;

        @Override
        public Integer call() {
            System.out.println("🚀 开始转换 JSONL → CIFF...");
            System.out.println("📄 输入: " + input);
            if (quantize) {
                System.out.println("🔧 量化位数: " + bits);
            }
            try {
                long start = System.currentTimeMillis();
                ConversionSummary summary = new JsonlToCiffConverter()
                    .convert(new JsonlToCiffOptions(input, output, quantize, bits, description));
                System.out.println("✅ 转换完成！");
                printSummary(summary, System.currentTimeMillis() - start);
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 转换失败: " + exception.getMessage());
                exception.printStackTrace();
                return 1;
            }
        }
    }

    @Command(name = "ciff2jsonl", description = "📤 将 CIFF 文件转换为 JSONL 文档向量")
    static class CiffToJsonlSubcommand implements Callable<Integer> {

        @Option(names = {"-i", "--input"}, description = "CIFF 输入文件", required = true)
        private Path input;

        @Option(names = {"-o", "--output"}, description = "JSONL 输出文件", required = true)
        private Path output;

        @Override
        public Integer call() {
            System.out.println("🚀 开始转换 CIFF → JSONL...");
            System.out.println("📄 输入: " + input);
            try {
                long start = System.currentTimeMillis();
                ConversionSummary summary = new CiffToJsonlConverter().convert(new CiffToJsonlOptions(input, output));
                System.out.println("✅ 转换完成！");
                printSummary(summary, System.currentTimeMillis() - start);
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 转换失败: " + exception.getMessage());
                exception.printStackTrace();
                return 1;
            }
        }
    }
}
