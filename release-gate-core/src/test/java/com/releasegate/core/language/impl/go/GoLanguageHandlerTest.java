package com.releasegate.core.language.impl.go;

import com.releasegate.core.language.LanguageHandler;
import com.releasegate.core.language.LanguageHandlerTestBase;
import com.releasegate.core.model.ComponentKind;
import com.releasegate.core.model.StructuralFacts;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Functional tests for {@link GoLanguageHandler}.
 */
class GoLanguageHandlerTest extends LanguageHandlerTestBase {

    private final GoLanguageHandler handler = new GoLanguageHandler();

    @Override
    protected LanguageHandler handler() {
        return handler;
    }

    @Override
    protected String language() {
        return "Go";
    }

    private static final String SERVER = """
        package main

        import "fmt"

        import (
        	"net/http"
        	log "github.com/sirupsen/logrus"
        	// "ignored"
        )

        type Server struct {
        	addr string
        }

        func (s *Server) Start() error {
        	if s.addr == "" {
        		return fmt.Errorf("no addr")
        	}
        	for i := 0; i < 3; i++ {
        		select {
        		default:
        		}
        	}
        	return nil
        }

        func main() {
        	switch {
        	}
        }
        """;

    @Test
    void analyze_server_extractsStructsMethodsAndFunctions() {
        StructuralFacts facts = analyze("cmd/server/main.go", SERVER);

        assertThat(names(facts.components())).containsExactly("Server", "Start", "main");
        assertThat(kinds(facts.components()))
            .containsExactly(ComponentKind.STRUCT, ComponentKind.METHOD, ComponentKind.FUNCTION);
    }

    @Test
    void analyze_server_extractsSingleAndGroupedImports() {
        assertThat(analyze("cmd/server/main.go", SERVER).dependencies())
            .containsExactly("fmt", "net/http", "github.com/sirupsen/logrus");
    }

    @Test
    void analyze_server_countsIfForSelectAndSwitch() {
        assertThat(analyze("cmd/server/main.go", SERVER).complexity()).isEqualTo(5.0);
    }

    @Test
    void analyze_genericFunction_isRecognized() {
        String content = """
            package util

            func Map[T any, U any](items []T, f func(T) U) []U {
            	return nil
            }
            """;

        assertThat(names(analyze("util/map.go", content).components())).containsExactly("Map");
    }
}
