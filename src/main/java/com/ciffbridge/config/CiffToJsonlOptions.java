package com.ciffbridge.config;

import com.ciffbridge.error.MissingFieldException;

import java.nio.file.Path;

public record CiffToJsonlOptions(Path input, Path output) {

    public CiffToJsonlOptions validate() {
        if (input == null) {
            throw new MissingFieldException("input");
        }
        if (output == null) {
            throw new MissingFieldException("output");
        }
        return this;
    }
}
