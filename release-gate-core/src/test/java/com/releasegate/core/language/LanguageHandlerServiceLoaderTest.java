package com.releasegate.core.language;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.ServiceLoader;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration test validating SPI registration for {@link LanguageHandler} implementations.
 *
 * <p>Catches typos in {@code META-INF/services}, missing classes, constructor failures and
 * duplicate handler IDs before they surface at runtime.
 */
class LanguageHandlerServiceLoaderTest {

    private static final int EXPECTED_HANDLER_COUNT = 5;

    @Test
    void serviceLoader_discoversAllRegisteredHandlers() {
        List<LanguageHandler> handlers = ServiceLoader.load(LanguageHandler.class).stream()
            .map(ServiceLoader.Provider::get)
            .toList();

        assertThat(handlers)
            .as("ServiceLoader should discover all %d registered handlers", EXPECTED_HANDLER_COUNT)
            .hasSize(EXPECTED_HANDLER_COUNT);
        assertThat(handlers).extracting(LanguageHandler::getId).doesNotHaveDuplicates();
    }

    @Test
    void serviceLoader_handlersDeclareLanguagesAndNames() {
        ServiceLoader.load(LanguageHandler.class).forEach(handler -> {
            assertThat(handler.getLanguages()).as(handler.getId()).isNotEmpty();
            assertThat(handler.getDisplayName()).as(handler.getId()).isNotBlank();
        });
    }
}
