package com.pricegate.adapter.out.persistence;

import com.pricegate.application.port.out.RequestCounterRepository;
import com.pricegate.domain.model.RequestCounter;
import io.vertx.core.Future;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.file.FileSystem;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * File implementation of RequestCounterRepository.
 * The whole {@code {count, month, year}} document is rewritten on every save.
 */
@Slf4j
@RequiredArgsConstructor
public class FileRequestCounterRepository implements RequestCounterRepository {

    private final FileSystem fileSystem;
    private final String path;

    @Override
    public Future<Optional<RequestCounter>> load() {
        return fileSystem.exists(path).compose(exists -> {
            if (!exists) {
                return Future.succeededFuture(Optional.<RequestCounter>empty());
            }
            return fileSystem.readFile(path).map(this::decode);
        });
    }

    @Override
    public Future<Void> save(RequestCounter counter) {
        JsonObject json = new JsonObject()
                .put("count", counter.count())
                .put("month", counter.month())
                .put("year", counter.year());
        return FileSupport.ensureParent(fileSystem, path)
                .compose(v -> fileSystem.writeFile(path, json.toBuffer()))
                .onSuccess(v -> log.debug("Saved request counter {}/{}: {}", counter.month(), counter.year(), counter.count()))
                .onFailure(error -> log.error("Failed to save request counter to {}: {}", path, error.getMessage()));
    }

    private Optional<RequestCounter> decode(Buffer content) {
        try {
            JsonObject json = new JsonObject(content);
            Integer count = json.getInteger("count");
            Integer month = json.getInteger("month");
            Integer year = json.getInteger("year");
            if (count == null || month == null || year == null) {
                log.warn("Request counter {} is incomplete, starting over", path);
                return Optional.empty();
            }
            return Optional.of(new RequestCounter(count, month, year));
        } catch (DecodeException | ClassCastException e) {
            log.warn("Request counter {} is unreadable, starting over: {}", path, e.getMessage());
            return Optional.empty();
        }
    }
}
