package com.ciffbridge.config;

import java.nio.file.Path;

/**
 * PISA 文件组路径，由公共前缀加后缀组成。
 *
 * @param basename 公共前缀（不含后缀）
 */
public record PisaPaths(Path basename) {

    public PisaPaths {
        if (basename == null) {
            throw new IllegalArgumentException("basename 不能为空");
        }
    }

    /**
     * 在前缀文件名后直接拼接后缀，而不是替换扩展名。
     */
    public static Path withSuffix(Path basename, String suffix) {
        return basename.resolveSibling(basename.getFileName().toString() + suffix);
    }

    public Path docs() {
        return withSuffix(basename, Constants.DOCS_SUFFIX);
    }

    public Path freqs() {
        return withSuffix(basename, Constants.FREQS_SUFFIX);
    }

    public Path sizes() {
        return withSuffix(basename, Constants.SIZES_SUFFIX);
    }

    public Path terms() {
        return withSuffix(basename, Constants.TERMS_SUFFIX);
    }

    public Path documents() {
        return withSuffix(basename, Constants.DOCUMENTS_SUFFIX);
    }

    public Path termLexicon() {
        return withSuffix(basename, Constants.TERMLEX_SUFFIX);
    }

    public Path docLexicon() {
        return withSuffix(basename, Constants.DOCLEX_SUFFIX);
    }
}
