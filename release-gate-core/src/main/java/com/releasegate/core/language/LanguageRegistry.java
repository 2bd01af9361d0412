package com.releasegate.core.language;

import com.releasegate.core.language.impl.cpp.CppLanguageHandler;
import com.releasegate.core.language.impl.go.GoLanguageHandler;
import com.releasegate.core.language.impl.java.JavaLanguageHandler;
import com.releasegate.core.language.impl.javascript.JavaScriptLanguageHandler;
import com.releasegate.core.language.impl.python.PythonLanguageHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps language labels to {@link LanguageHandler} instances.
 *
 * <p>Registries are plain values: construct one, register handlers, pass it to the
 * {@link com.releasegate.core.analysis.CodeAnalyzer}. Lookups are case-insensitive.
 * Registering a label twice replaces the earlier handler. An unknown label is not an
 * error; {@link #get(String)} returns empty and the caller falls back to generic analysis.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * LanguageRegistry registry = LanguageRegistry.withDefaults();
 * registry.register("Kotlin", new KotlinLanguageHandler());
 *
 * registry.get("Python").ifPresent(handler -> handler.analyze(file));
 * }</pre>
 */
public class LanguageRegistry {

    private static final Logger log = LoggerFactory.getLogger(LanguageRegistry.class);

    private final Map<String, Registration> handlers = new ConcurrentHashMap<>();

    /**
     * Creates a registry with the built-in handlers.
     *
     * @return registry for Python, Java, JavaScript/TypeScript, C/C++ and Go
     */
    public static LanguageRegistry withDefaults() {
        LanguageRegistry registry = new LanguageRegistry();
        registry.registerAll(new PythonLanguageHandler());
        registry.registerAll(new JavaLanguageHandler());
        registry.registerAll(new JavaScriptLanguageHandler());
        registry.registerAll(new CppLanguageHandler());
        registry.registerAll(new GoLanguageHandler());
        log.info("Registered {} language labels", registry.handlers.size());
        return registry;
    }

    /**
     * Creates a registry from handlers discovered via {@link ServiceLoader}.
     *
     * @return registry with every discovered handler registered under its labels
     */
    public static LanguageRegistry discover() {
        LanguageRegistry registry = new LanguageRegistry();
        ServiceLoader.load(LanguageHandler.class).forEach(registry::registerAll);
        log.info("Discovered handlers for {} language labels", registry.handlers.size());
        return registry;
    }

    /**
     * Registers a handler for a language label, replacing any previous handler.
     *
     * @param language language label
     * @param handler handler
     */
    public void register(String language, LanguageHandler handler) {
        Objects.requireNonNull(language, "language must not be null");
        Objects.requireNonNull(handler, "handler must not be null");
        Registration previous = handlers.put(key(language), new Registration(language, handler));
        if (previous != null && previous.handler() != handler) {
            log.debug("Replaced handler for {}: {} -> {}", language, previous.handler().getId(), handler.getId());
        } else {
            log.debug("Registered handler for {}", language);
        }
    }

    /**
     * Registers a handler under every label it supports.
     *
     * @param handler handler
     */
    public void registerAll(LanguageHandler handler) {
        handler.getLanguages().forEach(language -> register(language, handler));
    }

    /**
     * Removes the handler for a label, so files of that language use fallback analysis.
     *
     * @param language language label
     */
    public void unregister(String language) {
        if (handlers.remove(key(language)) != null) {
            log.debug("Unregistered handler for {}", language);
        }
    }

    /**
     * Looks up the handler for a language label.
     *
     * @param language language label
     * @return handler, or empty when none is registered
     */
    public Optional<LanguageHandler> get(String language) {
        if (language == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(handlers.get(key(language))).map(Registration::handler);
    }

    /**
     * Returns registered language labels, sorted.
     *
     * @return supported language labels
     */
    public List<String> supportedLanguages() {
        List<String> languages = new ArrayList<>();
        handlers.values().forEach(registration -> languages.add(registration.language()));
        languages.sort(Comparator.naturalOrder());
        return languages;
    }

    /**
     * Returns distinct registered handlers, sorted by ID.
     *
     * @return handlers
     */
    public Collection<LanguageHandler> handlers() {
        return handlers.values().stream()
            .map(Registration::handler)
            .distinct()
            .sorted(Comparator.comparing(LanguageHandler::getId))
            .toList();
    }

    private static String key(String language) {
        return language.trim().toLowerCase(Locale.ROOT);
    }

    private record Registration(String language, LanguageHandler handler) {}
}
