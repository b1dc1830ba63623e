package com.pulselang.cli;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 源码文件读取
 */
final class SourceFiles {

    private SourceFiles() {}

    /**
     * @throws IOException 文件不存在或不可读，消息可直接展示给用户
     */
    static String read(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("文件不存在 - " + path);
        }
        if (!Files.isReadable(path)) {
            throw new IOException("无法读取文件 - " + path);
        }
        return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
    }
}
