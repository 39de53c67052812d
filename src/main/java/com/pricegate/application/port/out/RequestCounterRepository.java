package com.pricegate.application.port.out;

import com.pricegate.domain.model.RequestCounter;
import io.vertx.core.Future;

import java.util.Optional;

/**
 * Output port for the monthly request counter of a quota-limited provider
 */
public interface RequestCounterRepository {

    Future<Optional<RequestCounter>> load();

    Future<Void> save(RequestCounter counter);
}
