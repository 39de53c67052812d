package com.pricegate.adapter.out.persistence;

import io.vertx.core.Future;
import io.vertx.core.file.FileSystem;

import java.nio.file.Path;

final class FileSupport {

    private FileSupport() {
    }

    static Future<Void> ensureParent(FileSystem fileSystem, String path) {
        Path parent = Path.of(path).toAbsolutePath().getParent();
        if (parent == null) {
            return Future.succeededFuture();
        }
        return fileSystem.mkdirs(parent.toString());
    }
}
