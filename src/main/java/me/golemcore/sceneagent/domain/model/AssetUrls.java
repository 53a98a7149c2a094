package me.golemcore.sceneagent.domain.model;

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

import java.util.List;

/**
 * Asset URLs found in a piece of generated code.
 *
 * @param primaryUrl
 *            the authoritative URL (marker comment first), or null
 * @param urls
 *            all distinct URLs in first-seen order
 */
public record AssetUrls(String primaryUrl, List<String> urls) {

    public static AssetUrls empty() {
        return new AssetUrls(null, List.of());
    }

    public boolean isEmpty() {
        return urls == null || urls.isEmpty();
    }
}
