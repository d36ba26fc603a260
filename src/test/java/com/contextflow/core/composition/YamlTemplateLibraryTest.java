package com.contextflow.core.composition;

import com.contextflow.core.model.WorkflowPhase;
import com.contextflow.core.model.WorkflowTemplate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class YamlTemplateLibraryTest {

    @Test
    @DisplayName("Loads the bundled templates from the classpath")
    void bundledTemplates() {
        var library = new YamlTemplateLibrary("classpath:templates/");

        assertEquals(3, library.templates().size());
        WorkflowTemplate bugFix = library.find("bug-fix").orElseThrow();
        assertEquals("bug_fix", bugFix.category());
        assertEquals(0.9, bugFix.successRate(), 1e-9);
        assertEquals(List.of("debugging", "implementation", "verification", "release"),
                bugFix.phases().stream().map(WorkflowPhase::context).toList());
        assertEquals(2, bugFix.phases().get(3).retryCount());
    }

    @Test
    @DisplayName("Optional contexts are exposed as template parameters")
    void parameters() {
        var library = new YamlTemplateLibrary("classpath:templates/");
        WorkflowTemplate docs = library.find("documentation").orElseThrow();
        assertEquals(List.of("research", "verification"), docs.parameters().get("optional_contexts"));
    }

    @Test
    @DisplayName("Missing location yields an empty library")
    void missingLocation(@TempDir Path dir) {
        assertTrue(new YamlTemplateLibrary(dir.resolve("absent").toString()).isEmpty());
        assertTrue(new YamlTemplateLibrary("").isEmpty());
    }

    @Test
    @DisplayName("Broken files are skipped and keyword contexts are canonicalized")
    void directoryLoading(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve("good.yml"), """
                name: hotfix
                category: bug_fix
                phases:
                  - id: patch
                    context: "@code"
                    timeout: 120
                    condition: approved
                  - id: ship
                    context: "@git"
                """);
        Files.writeString(dir.resolve("broken.yaml"), "name: [unterminated");
        Files.writeString(dir.resolve("nameless.yaml"), "category: general\n");

        var library = new YamlTemplateLibrary(dir.toString());

        assertEquals(1, library.templates().size());
        WorkflowTemplate hotfix = library.templates().get(0);
        assertEquals("implementation", hotfix.phases().get(0).context());
        assertEquals(120, hotfix.phases().get(0).timeoutSeconds());
        assertEquals(300, hotfix.phases().get(1).timeoutSeconds());
        assertFalse(hotfix.phases().get(0).condition().test(Map.of()));
        assertTrue(hotfix.phases().get(0).condition().test(Map.of("approved", true)));
        assertNull(hotfix.phases().get(1).condition());
    }

    @Test
    @DisplayName("Nested parameters keep their types and a non-mapping parameters entry is ignored")
    void parameterTypes(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve("a-release.yaml"), """
                name: release-train
                category: release
                parameters:
                  optional_contexts: [documentation]
                  max_parallel: 2
                  gates:
                    smoke: true
                phases:
                  - id: ship
                    context: release
                """);
        Files.writeString(dir.resolve("b-odd.yaml"), """
                name: odd-parameters
                parameters: just a string
                phases:
                  - id: build
                    context: implementation
                """);

        var library = new YamlTemplateLibrary(dir.toString());

        Map<String, Object> parameters = library.find("release-train").orElseThrow().parameters();
        assertEquals(List.of("documentation"), parameters.get("optional_contexts"));
        assertEquals(2, parameters.get("max_parallel"));
        assertEquals(Map.of("smoke", true), parameters.get("gates"));
        WorkflowTemplate odd = library.find("odd-parameters").orElseThrow();
        assertTrue(odd.parameters().isEmpty());
        assertEquals(1, odd.phases().size());
    }
}
