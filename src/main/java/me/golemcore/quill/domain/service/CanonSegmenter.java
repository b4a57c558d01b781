package me.golemcore.quill.domain.service;

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

import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;

/**
 * Splits story files into canon chunks on blank lines and joins them back.
 */
@Service
public class CanonSegmenter {

    private static final String SEPARATOR = "\n\n";

    public List<String> segment(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String normalized = text.replace("\r\n", "\n");
        return Arrays.stream(normalized.split("\\n\\s*\\n"))
                .map(String::strip)
                .filter(chunk -> !chunk.isEmpty())
                .toList();
    }

    public String join(List<String> chunks) {
        if (chunks == null || chunks.isEmpty()) {
            return "";
        }
        return String.join(SEPARATOR, chunks);
    }
}
