package io.keydigger.core.dispatch;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.keydigger.api.keys.KeyStore;
import io.keydigger.core.pattern.PatternSpecException;
import io.keydigger.core.resolve.WorkUnit;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/// Routes work units to payloads by label.
///
/// Payloads are registered against regular expressions which must match the whole label. The
/// first registration that matches wins. Units whose label matches no registration are skipped.
///
/// ```java
/// WorkUnitDispatcher<double[]> dispatcher = new WorkUnitDispatcher<double[]>()
///     .register("i_.*", ionProfile)
///     .register("e_.*", electronProfile);
/// List<DispatchResult<double[]>> results = dispatcher.dispatch(units, store, executor);
/// ```
/// @param <R> the result type of the payloads
public class WorkUnitDispatcher<R> {
    private static final Logger logger = LogManager.getLogger(WorkUnitDispatcher.class);

    private final List<Route<R>> routes = new ArrayList<>();

    /// @param labelRegex an expression matching whole labels
    /// @param payload the payload for matching units
    /// @return this dispatcher
    /// @throws PatternSpecException if the expression is invalid
    public WorkUnitDispatcher<R> register(String labelRegex, WorkUnitPayload<R> payload) {
        Objects.requireNonNull(payload, "payload");
        try {
            routes.add(new Route<>(Pattern.compile(labelRegex), payload));
        } catch (PatternSyntaxException e) {
            throw new PatternSpecException("invalid label pattern '" + labelRegex + "': " + e.getDescription(), e);
        }
        return this;
    }

    /// @param unit a work unit
    /// @return the payload registered for its label, if any
    public Optional<WorkUnitPayload<R>> payloadFor(WorkUnit unit) {
        for (Route<R> route : routes) {
            if (route.labelPattern.matcher(unit.label()).matches()) {
                return Optional.of(route.payload);
            }
        }
        return Optional.empty();
    }

    /// Run the payloads on the calling thread.
    /// @param units resolved work units
    /// @param store the store the units were resolved from
    /// @return one result per routed unit, in unit order
    public List<DispatchResult<R>> dispatch(List<WorkUnit> units, KeyStore store) {
        List<DispatchResult<R>> results = new ArrayList<>();
        for (WorkUnit unit : units) {
            Optional<WorkUnitPayload<R>> payload = route(unit);
            payload.ifPresent(p -> results.add(new DispatchResult<>(unit, p.apply(unit, store))));
        }
        return results;
    }

    /// Run the payloads on an executor and wait for all of them.
    ///
    /// If a payload fails, its exception is rethrown after every payload has finished.
    /// @param units resolved work units
    /// @param store the store the units were resolved from
    /// @param executor where payloads run; it is not shut down
    /// @return one result per routed unit, in unit order
    public List<DispatchResult<R>> dispatch(List<WorkUnit> units, KeyStore store, ExecutorService executor) {
        List<CompletableFuture<DispatchResult<R>>> futures = new ArrayList<>();
        for (WorkUnit unit : units) {
            route(unit).ifPresent(payload -> futures.add(CompletableFuture.supplyAsync(
                () -> new DispatchResult<>(unit, payload.apply(unit, store)), executor)));
        }
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            logger.error("Payload failed: {}", cause.getMessage(), cause);
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw e;
        }
        List<DispatchResult<R>> results = new ArrayList<>(futures.size());
        for (CompletableFuture<DispatchResult<R>> future : futures) {
            results.add(future.join());
        }
        return results;
    }

    private Optional<WorkUnitPayload<R>> route(WorkUnit unit) {
        Optional<WorkUnitPayload<R>> payload = payloadFor(unit);
        if (payload.isEmpty()) {
            logger.debug("No payload for label '{}' of {}", unit.label(), unit.primaryKey());
        }
        return payload;
    }

    private record Route<R>(Pattern labelPattern, WorkUnitPayload<R> payload) {
    }
}
