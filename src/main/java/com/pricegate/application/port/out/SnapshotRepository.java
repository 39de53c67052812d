package com.pricegate.application.port.out;

import io.vertx.core.Future;

import java.util.Optional;

/**
 * Output port for the durable last-known-good value
 */
public interface SnapshotRepository<T> {

    Future<Optional<T>> load();

    /**
     * Write the snapshot only when none exists yet
     * @return Future with true if this call wrote it
     */
    Future<Boolean> saveIfAbsent(T value);

    Future<Boolean> exists();
}
