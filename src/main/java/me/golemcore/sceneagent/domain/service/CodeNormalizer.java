package me.golemcore.sceneagent.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.sceneagent.domain.model.AssetUrls;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pure functions that turn free-form model output into a runnable scene
 * script and find asset URLs inside scripts.
 *
 * <p>
 * The contract every returned script satisfies is a top-level
 * {@code function setup(scene, camera, renderer, THREE, OrbitControls)}.
 * {@link #cleanCode(String)} is idempotent: cleaning its own output returns it
 * unchanged.
 */
public final class CodeNormalizer {

    public static final String SETUP_SIGNATURE = "function setup(scene, camera, renderer, THREE, OrbitControls)";
    public static final String MODEL_URL_MARKER = "// MODEL_URL:";

    private static final Pattern SCRIPT_BLOCK = Pattern.compile("<script[^>]*>([\\s\\S]*?)</script>",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern FENCED_BLOCK = Pattern.compile("```([\\s\\S]*?)```");
    private static final Pattern FENCE_LANGUAGE = Pattern.compile("^(?:js|javascript|typescript|ts|jsx)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern MARKER_URL = Pattern.compile("//\\s*MODEL_URL:\\s*(\\S+)");
    private static final Pattern QUOTED_ASSET_URL = Pattern.compile(
            "['\"`](https?://[^'\"`\\s]+?\\.(?:glb|gltf|obj|fbx|usdz|stl)(?:\\?[^'\"`\\s]*)?)['\"`]",
            Pattern.CASE_INSENSITIVE);

    private static final List<String> CODE_INDICATORS = List.of(
            "function", "var ", "let ", "const ", "THREE.", "scene.add", "position.", "rotation.", "scale.",
            "new THREE.", "camera.", "renderer.", "mesh.", "material.", "geometry.", "light.",
            "addEventListener", ".position", ".rotation", ".scale", "Math.", "return ",
            "if(", "if (", "for(", "for (", "while(", "while (", "import ", "export ");

    private static final String FALLBACK_SKELETON = SETUP_SIGNATURE + " {\n"
            + "  // Unable to extract valid code from the model response\n"
            + "  console.warn(\"Unable to extract valid code from the model response\");\n"
            + "  return scene;\n"
            + "}";

    private CodeNormalizer() {
    }

    /**
     * Extracts a well-formed {@code setup} script from raw model output.
     *
     * <ol>
     * <li>HTML documents are reduced to their first script body.</li>
     * <li>Markdown fences are stripped; of several fenced blocks the largest
     * wins.</li>
     * <li>Text without any code indicator is replaced by a skeleton carrying a
     * diagnostic comment.</li>
     * <li>Code that does not define {@code setup} is wrapped into it.</li>
     * </ol>
     */
    public static String cleanCode(String raw) {
        if (raw == null || raw.isBlank()) {
            return FALLBACK_SKELETON;
        }
        String code = raw;

        if (code.contains("<!DOCTYPE html>") || code.contains("<html>")) {
            Matcher script = SCRIPT_BLOCK.matcher(code);
            if (script.find() && !script.group(1).isBlank()) {
                code = script.group(1);
            }
        }

        if (code.contains("```")) {
            code = stripFences(code);
        }
        code = code.trim();

        if (!looksLikeCode(code)) {
            return FALLBACK_SKELETON;
        }

        if (!code.contains("function setup")) {
            code = SETUP_SIGNATURE + " {\n"
                    + "  /* Generated code */\n"
                    + code + "\n"
                    + "  return scene.children.find(child => child instanceof THREE.Mesh) || scene;\n"
                    + "}";
        }
        return code;
    }

    /**
     * True if the text contains at least one recognizable code token.
     */
    public static boolean looksLikeCode(String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        for (String indicator : CODE_INDICATORS) {
            if (text.contains(indicator)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Finds asset URLs in a script. The {@code // MODEL_URL:} marker is
     * authoritative for the primary URL; quoted URLs with a model file
     * extension follow in first-seen order, without duplicates.
     */
    public static AssetUrls extractAssetUrls(String code) {
        if (code == null || code.isEmpty()) {
            return AssetUrls.empty();
        }
        Set<String> urls = new LinkedHashSet<>();
        String primary = null;

        Matcher marker = MARKER_URL.matcher(code);
        if (marker.find()) {
            primary = marker.group(1);
            urls.add(primary);
        }

        Matcher quoted = QUOTED_ASSET_URL.matcher(code);
        while (quoted.find()) {
            String url = quoted.group(1);
            if (primary == null) {
                primary = url;
            }
            urls.add(url);
        }
        return new AssetUrls(primary, List.copyOf(urls));
    }

    /**
     * Makes sure the script names {@code url} through the marker comment,
     * inserting it right after the {@code setup} signature when missing.
     */
    public static String embedAssetUrl(String code, String url) {
        if (url == null || url.isBlank()) {
            return code;
        }
        String clean = cleanCode(code);
        Matcher marker = MARKER_URL.matcher(clean);
        while (marker.find()) {
            if (url.equals(marker.group(1))) {
                return clean;
            }
        }
        int signature = clean.indexOf("function setup");
        int brace = signature >= 0 ? clean.indexOf('{', signature) : -1;
        if (brace < 0) {
            return MODEL_URL_MARKER + " " + url + "\n" + clean;
        }
        return clean.substring(0, brace + 1) + "\n  " + MODEL_URL_MARKER + " " + url + clean.substring(brace + 1);
    }

    public static String markerComment(String url) {
        return MODEL_URL_MARKER + " " + url;
    }

    private static String stripFences(String text) {
        Matcher matcher = FENCED_BLOCK.matcher(text);
        String largest = null;
        while (matcher.find()) {
            String body = dropLanguageTag(matcher.group(1));
            if (largest == null || body.trim().length() > largest.trim().length()) {
                largest = body;
            }
        }
        if (largest != null) {
            return largest;
        }
        return dropLanguageTag(text.replace("```", ""));
    }

    private static String dropLanguageTag(String body) {
        String trimmed = body.stripLeading();
        Matcher language = FENCE_LANGUAGE.matcher(trimmed);
        if (language.find()) {
            return trimmed.substring(language.end());
        }
        return body;
    }
}
