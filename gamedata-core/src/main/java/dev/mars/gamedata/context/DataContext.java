/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.gamedata.context;

import dev.mars.gamedata.GameDataException;
import dev.mars.gamedata.config.GameDataConfig;
import dev.mars.gamedata.localization.LocalizationContext;
import dev.mars.gamedata.repository.Repository;
import dev.mars.gamedata.repository.TableRepository;
import dev.mars.gamedata.serialization.DataSerializerFactory;
import dev.mars.gamedata.storage.FileStorageProvider;
import dev.mars.gamedata.storage.StorageProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * A named set of repositories loaded and saved together through one storage
 * provider.
 * <p>
 * Subclasses declare their repositories as fields and register each one in
 * their constructor:
 * <pre>{@code
 * public final class ShopContext extends DataContext {
 *     private final TableRepository<String, ShopItemData> shopItems;
 *
 *     public ShopContext(StorageProvider provider, DataSerializerFactory factory, GameDataConfig config) {
 *         super("ShopContext", provider, factory, config);
 *         shopItems = register(new TableRepository<>(ShopItemData.SCHEMA, "ShopItems.csv"));
 *     }
 * }
 * }</pre>
 *
 * <h2>Loading</h2>
 * {@link #loadAll()} starts every repository load at once, plus the
 * localization overlay when enabled. The first failure wins: it is wrapped
 * in a {@link ContextLoadException}, every other load is asked to stop at
 * its next checkpoint, and the context ends in {@link ContextState#FAILED}.
 * The returned future settles only after every load has stopped, so nothing
 * is installed behind the caller's back.
 *
 * <h2>Isolation</h2>
 * A context owns its provider and closes it. Contexts share nothing except
 * the serializer factory, which is immutable, so several contexts with
 * different base paths can load concurrently.
 */
public abstract class DataContext implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(DataContext.class);

    private final String name;
    private final StorageProvider provider;
    private final DataSerializerFactory serializerFactory;
    private final GameDataConfig config;
    private final LocalizationContext localization;

    private final Map<String, Repository> repositories = new LinkedHashMap<>();
    private volatile boolean frozen;
    private final AtomicReference<ContextState> state = new AtomicReference<>(ContextState.NOT_LOADED);
    private final AtomicBoolean closed = new AtomicBoolean();

    /**
     * Creates a context over the file system at the configured base path,
     * named after the configured context name.
     */
    protected DataContext(GameDataConfig config) {
        this(config.contextName(), new FileStorageProvider(config), DataSerializerFactory.createDefault(), config);
    }

    protected DataContext(String name, StorageProvider provider, DataSerializerFactory serializerFactory,
                          GameDataConfig config) {
        this.name = Objects.requireNonNull(name, "name");
        this.provider = Objects.requireNonNull(provider, "provider");
        this.serializerFactory = Objects.requireNonNull(serializerFactory, "serializerFactory");
        this.config = Objects.requireNonNull(config, "config");
        this.localization = config.enableLocalization() ? new LocalizationContext(config) : null;
    }

    /**
     * Adds a repository to this context. Call from the subclass constructor.
     *
     * @return the repository, for assignment to a field
     * @throws IllegalStateException    if the context has started loading or saving
     * @throws IllegalArgumentException if another repository has the same name
     */
    protected final synchronized <T extends Repository> T register(T repository) {
        Objects.requireNonNull(repository, "repository");
        if (frozen) {
            throw new IllegalStateException("Context '" + name + "' is frozen; cannot register "
                    + repository.name());
        }
        if (repositories.containsKey(repository.name())) {
            throw new IllegalArgumentException("Context '" + name + "' already has a repository named "
                    + repository.name());
        }
        repositories.put(repository.name(), repository);
        return repository;
    }

    // ========== Lifecycle ==========

    /**
     * Loads every repository concurrently.
     *
     * @return a future that completes when all are loaded, or fails with a
     *         {@link ContextLoadException} naming the first repository that failed
     */
    public CompletableFuture<Void> loadAll() {
        freeze();
        ContextState previous = state.getAndUpdate(s -> s == ContextState.LOADING ? s : ContextState.LOADING);
        if (previous == ContextState.LOADING) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("Context '" + name + "' is already loading"));
        }

        long start = System.nanoTime();
        AtomicBoolean abort = new AtomicBoolean();
        AtomicReference<ContextLoadException> firstFailure = new AtomicReference<>();
        List<CompletableFuture<Void>> loads = new ArrayList<>();

        for (Repository repository : repositories.values()) {
            loads.add(track(repository.name(), repository.path(), abort, firstFailure,
                    () -> repository.load(provider, serializerFactory, abort::get)));
        }
        if (localization != null) {
            loads.add(track("localization", localization.keyPath(), abort, firstFailure,
                    () -> localization.load(provider, serializerFactory, abort::get)));
        }

        return CompletableFuture.allOf(loads.toArray(new CompletableFuture[0]))
                .handle((v, e) -> {
                    ContextLoadException failure = firstFailure.get();
                    if (failure != null) {
                        state.set(ContextState.FAILED);
                        throw failure;
                    }
                    state.set(ContextState.LOADED);
                    LOG.info("Context '{}' loaded {} repositories in {} ms", name, loads.size(),
                            (System.nanoTime() - start) / 1_000_000);
                    return null;
                });
    }

    private CompletableFuture<Void> track(String repositoryName, String path, AtomicBoolean abort,
                                          AtomicReference<ContextLoadException> firstFailure,
                                          Supplier<CompletableFuture<Void>> load) {
        CompletableFuture<Void> started;
        try {
            started = load.get();
        } catch (RuntimeException e) {
            started = CompletableFuture.failedFuture(e);
        }
        return started.whenComplete((v, e) -> {
            if (e == null) {
                logDetail("Context '{}' loaded {} from {}", name, repositoryName, path);
                return;
            }
            Throwable cause = unwrap(e);
            if (abort.compareAndSet(false, true)) {
                firstFailure.set(new ContextLoadException(name, repositoryName, path, cause));
                LOG.error("Context '{}' failed to load {} from {}: {}", name, repositoryName, path,
                        cause.getMessage(), cause);
            } else {
                LOG.debug("Context '{}' stopped loading {}: {}", name, repositoryName, cause.getMessage());
            }
        });
    }

    /**
     * Saves every repository concurrently, and the localization tables when
     * enabled.
     * <p>
     * Every save runs to completion: a file already being rewritten is never
     * cut short because a sibling failed. When several fail, the one reported
     * is the first in registration order, with the localization tables last.
     * Saving is refused while a load is running or after a failed
     * {@link #loadAll()}, since a half-loaded context would write stale or
     * empty tables over good files.
     *
     * @return a future failing with the first save failure, annotated with the repository,
     *         or with {@link IllegalStateException} if the context is loading or failed
     */
    public CompletableFuture<Void> saveAll() {
        freeze();
        ContextState current = state.get();
        if (current == ContextState.LOADING || current == ContextState.FAILED) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("Context '" + name + "' cannot save while " + current));
        }
        List<CompletableFuture<GameDataException>> saves = new ArrayList<>();
        for (Repository repository : repositories.values()) {
            saves.add(annotateSave(repository.name(), repository.path(),
                    () -> repository.save(provider, serializerFactory)));
        }
        if (localization != null) {
            saves.add(annotateSave("localization", localization.keyPath(),
                    () -> localization.save(provider, serializerFactory)));
        }
        return CompletableFuture.allOf(saves.toArray(new CompletableFuture[0]))
                .thenRun(() -> {
                    GameDataException firstFailure = null;
                    int failed = 0;
                    for (CompletableFuture<GameDataException> save : saves) {
                        GameDataException failure = save.join();
                        if (failure != null) {
                            failed++;
                            if (firstFailure == null) {
                                firstFailure = failure;
                            }
                        }
                    }
                    if (firstFailure != null) {
                        LOG.warn("Context '{}' failed to save {} of {} repositories", name, failed, saves.size());
                        throw firstFailure;
                    }
                    LOG.info("Context '{}' saved {} repositories", name, saves.size());
                });
    }

    /**
     * Runs one save and settles normally either way: with {@code null} on
     * success, or with the failure annotated with the repository.
     */
    private CompletableFuture<GameDataException> annotateSave(String repositoryName, String path,
                                                              Supplier<CompletableFuture<Void>> save) {
        CompletableFuture<Void> started;
        try {
            started = save.get();
        } catch (RuntimeException e) {
            started = CompletableFuture.failedFuture(e);
        }
        return started.handle((v, e) -> {
            if (e != null) {
                Throwable cause = unwrap(e);
                LOG.error("Context '{}' failed to save {} to {}: {}", name, repositoryName, path,
                        cause.getMessage(), cause);
                return new GameDataException("Context '" + name + "' failed to save " + repositoryName
                        + " to " + path, cause);
            }
            logDetail("Context '{}' saved {} to {}", name, repositoryName, path);
            return null;
        });
    }

    /**
     * Reloads one repository. The context state is left as it is; on failure
     * the repository keeps its previous records.
     *
     * @throws IllegalArgumentException if no repository has that name
     */
    public CompletableFuture<Void> reload(String repositoryName) {
        Repository repository = repositories.get(repositoryName);
        if (repository == null) {
            throw new IllegalArgumentException("Context '" + name + "' has no repository named " + repositoryName);
        }
        freeze();
        return repository.load(provider, serializerFactory).handle((v, e) -> {
            if (e != null) {
                throw new ContextLoadException(name, repository.name(), repository.path(), unwrap(e));
            }
            logDetail("Context '{}' reloaded {} from {}", name, repository.name(), repository.path());
            return null;
        });
    }

    /**
     * Closes the storage provider. Idempotent.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            provider.close();
            LOG.info("Context '{}' closed", name);
        }
    }

    // ========== State and lookup ==========

    public ContextState state() {
        return state.get();
    }

    public boolean isLoaded() {
        return state.get() == ContextState.LOADED;
    }

    /**
     * @throws IllegalStateException unless the last {@link #loadAll()} succeeded
     */
    public void requireLoaded() {
        ContextState current = state.get();
        if (current != ContextState.LOADED) {
            throw new IllegalStateException("Context '" + name + "' is not loaded (state " + current + ")");
        }
    }

    public String name() {
        return name;
    }

    public GameDataConfig config() {
        return config;
    }

    public StorageProvider provider() {
        return provider;
    }

    public DataSerializerFactory serializerFactory() {
        return serializerFactory;
    }

    /** Registered repositories, in registration order. */
    public Collection<Repository> repositories() {
        return Collections.unmodifiableCollection(repositories.values());
    }

    public Optional<Repository> repository(String repositoryName) {
        return Optional.ofNullable(repositories.get(repositoryName));
    }

    /**
     * Finds the table repository whose records are of a type. Used to
     * resolve references between tables.
     *
     * @throws IllegalArgumentException if no registered table holds that record type
     */
    @SuppressWarnings("unchecked")
    public <K, R> TableRepository<K, R> table(Class<R> recordType) {
        Objects.requireNonNull(recordType, "recordType");
        for (Repository repository : repositories.values()) {
            if (repository instanceof TableRepository
                    && ((TableRepository<?, ?>) repository).schema().recordType() == recordType) {
                return (TableRepository<K, R>) repository;
            }
        }
        throw new IllegalArgumentException("Context '" + name + "' has no table of "
                + recordType.getSimpleName());
    }

    /** The localization overlay, present when localization is enabled in the config. */
    public Optional<LocalizationContext> localization() {
        return Optional.ofNullable(localization);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + ", " + state.get() + ", " + repositories.keySet() + "]";
    }

    // ========== Helpers ==========

    private synchronized void freeze() {
        frozen = true;
    }

    private void logDetail(String format, Object... args) {
        if (config.debugLogging()) {
            LOG.info(format, args);
        } else {
            LOG.debug(format, args);
        }
    }

    private static Throwable unwrap(Throwable e) {
        Throwable t = e;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
