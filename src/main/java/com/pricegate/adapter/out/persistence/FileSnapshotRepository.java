package com.pricegate.adapter.out.persistence;

import com.pricegate.application.port.out.SnapshotRepository;
import io.vertx.core.Future;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.file.FileSystem;
import io.vertx.core.file.OpenOptions;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * JSON file holding the last-known-good value.
 * Written once when absent, never refreshed afterwards.
 */
@Slf4j
public class FileSnapshotRepository<T> implements SnapshotRepository<T> {

    private final FileSystem fileSystem;
    private final String path;
    private final Class<T> type;

    public FileSnapshotRepository(FileSystem fileSystem, String path, Class<T> type) {
        this.fileSystem = fileSystem;
        this.path = path;
        this.type = type;
    }

    @Override
    public Future<Optional<T>> load() {
        return fileSystem.exists(path).compose(exists -> {
            if (!exists) {
                log.debug("No snapshot at {}", path);
                return Future.succeededFuture(Optional.<T>empty());
            }
            return fileSystem.readFile(path).map(this::decode);
        });
    }

    @Override
    public Future<Boolean> saveIfAbsent(T value) {
        return fileSystem.exists(path).compose(exists -> {
            if (exists) {
                return Future.succeededFuture(false);
            }
            Buffer content = JsonObject.mapFrom(value).toBuffer();
            // createNew fails if another write got there first
            return FileSupport.ensureParent(fileSystem, path)
                    .compose(v -> fileSystem.open(path, new OpenOptions().setWrite(true).setCreateNew(true)))
                    .compose(file -> file.write(content).compose(v -> file.close()))
                    .map(v -> {
                        log.info("Snapshot written to {}", path);
                        return true;
                    });
        });
    }

    @Override
    public Future<Boolean> exists() {
        return fileSystem.exists(path);
    }

    private Optional<T> decode(Buffer content) {
        try {
            return Optional.of(new JsonObject(content).mapTo(type));
        } catch (DecodeException | IllegalArgumentException e) {
            log.warn("Ignoring unreadable snapshot {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }
}
