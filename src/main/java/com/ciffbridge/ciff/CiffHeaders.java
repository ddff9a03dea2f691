package com.ciffbridge.ciff;

import com.ciffbridge.ciff.proto.Header;

/**
 * CIFF 头部的展示工具。
 */
public final class CiffHeaders {
    private CiffHeaders() {
    }

    /**
     * 生成多行可读的头部描述。
     *
     * @param header CIFF 头部
     * @return 描述文本
     */
    public static String describe(Header header) {
        String separator = System.lineSeparator();
        return "----- CIFF HEADER -----" + separator
            + "Version: " + header.getVersion() + separator
            + "No. Postings Lists: " + header.getNumPostingsLists() + separator
            + "Total Postings Lists: " + header.getTotalPostingsLists() + separator
            + "No. Documents: " + header.getNumDocs() + separator
            + "Total Documents: " + header.getTotalDocs() + separator
            + "Total Terms in Collection: " + header.getTotalTermsInCollection() + separator
            + "Average Document Length: " + header.getAverageDoclength() + separator
            + "Description: " + header.getDescription() + separator
            + "-----------------------";
    }
}
