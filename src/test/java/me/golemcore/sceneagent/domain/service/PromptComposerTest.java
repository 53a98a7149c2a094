package me.golemcore.sceneagent.domain.service;

import me.golemcore.sceneagent.domain.model.LintDiagnostic;
import me.golemcore.sceneagent.domain.model.ModelHistoryEntry;
import me.golemcore.sceneagent.domain.model.SceneObjectRecord;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PromptComposerTest {

    private static final String MODEL_URL = "https://cdn.example.com/dragon.glb";
    private static final LintDiagnostic UNUSED = LintDiagnostic.builder()
            .ruleId("no-unused-vars").message("'light' is assigned but never used").line(12).column(9).severity(1)
            .build();
    private static final ModelHistoryEntry DRAGON = ModelHistoryEntry.builder()
            .modelUrl(MODEL_URL).prompt("a fierce green dragon with wings").timestamp(
                    Instant.parse("2026-01-01T00:00:00Z"))
            .build();
    private static final SceneObjectRecord CUBE = SceneObjectRecord.builder()
            .type("Mesh").name("cube").position(List.of(1.0, 0.0, -2.0)).build();

    private final PromptComposer composer = new PromptComposer();

    @Test
    void shouldFormatDiagnostic() {
        assertEquals("- Line 12:9 - 'light' is assigned but never used (no-unused-vars)",
                PromptComposer.formatDiagnostic(UNUSED));
        assertEquals("- Line 1:1 - oops (Unknown rule)", PromptComposer.formatDiagnostic(
                LintDiagnostic.builder().message("oops").line(1).column(1).build()));
    }

    @Test
    void shouldFormatSceneObjectWithDefaults() {
        SceneObjectRecord bare = SceneObjectRecord.builder().type("Group").build();

        assertEquals("- Object[2]: type=Group, name=Unnamed, position=(0, 0, 0), rotation=(0, 0, 0), "
                + "scale=(1, 1, 1)", PromptComposer.formatSceneObject(2, bare));
    }

    @Test
    void shouldOmitEmptySections() {
        String prompt = composer.systemPrompt(List.of(), "", List.of(), List.of(), "");

        assertTrue(prompt.contains("# Tool Set"));
        assertFalse(prompt.contains("# Current code issues"));
        assertFalse(prompt.contains("# Historical Context"));
        assertFalse(prompt.contains("# Recently Generated 3D Models"));
        assertFalse(prompt.contains("# Current Scene State"));
        assertFalse(prompt.contains("# Scene History Record"));
    }

    @Test
    void shouldIncludeAllContextSections() {
        String prompt = composer.systemPrompt(List.of(UNUSED), "- Last analysis: dark", List.of(DRAGON),
                List.of(CUBE), "Scene history [1]");

        assertTrue(prompt.contains("# Current code issues\n- Line 12:9"));
        assertTrue(prompt.contains("# Historical Context\n- Last analysis: dark"));
        assertTrue(prompt.contains("- [1] 2026-01-01T00:00:00Z: " + MODEL_URL
                + " (Requirement: a fierce green dragon...)"));
        assertTrue(prompt.contains("- Object[1]: type=Mesh, name=cube, position=(1.0, 0.0, -2.0)"));
        assertTrue(prompt.contains("# Scene History Record\nScene history [1]"));
    }

    @Test
    void shouldBuildUserPrompt() {
        String prompt = composer.userPrompt("add a dragon", List.of(DRAGON), List.of(CUBE),
                "The scene is too dark", "function setup() {}");

        assertTrue(prompt.startsWith("add a dragon"));
        assertTrue(prompt.contains("1. a fierce green dragon with w...: " + MODEL_URL));
        assertTrue(prompt.contains("1. cube (Mesh) @ [1.0, 0.0, -2.0]"));
        assertTrue(prompt.contains("\n\nThe scene is too dark"));
        assertTrue(prompt.endsWith("Current code:\n```javascript\nfunction setup() {}\n```"));
    }

    @Test
    void shouldBuildCodeFixInstruction() {
        String prompt = composer.codeFixInstruction("add a dragon", "function setup() {}", "too dark",
                List.of(UNUSED), MODEL_URL);

        assertTrue(prompt.contains("Screenshot analysis result:\ntoo dark"));
        assertTrue(prompt.contains("Fix these code issues:\n- Line 12:9"));
        assertTrue(prompt.contains("// MODEL_URL: " + MODEL_URL));
        assertTrue(prompt.endsWith("Current code:\nfunction setup() {}"));
    }

    @Test
    void shouldKeepBareInstructionWithoutContext() {
        assertEquals("add a cube", composer.codeFixInstruction("add a cube", null, null, List.of(), null));
    }
}
