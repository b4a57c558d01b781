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

import me.golemcore.quill.domain.model.ParsedResponse;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Separates narrative prose from {@code <think>...</think>} reasoning blocks in
 * raw model output.
 */
@Service
public class ResponseParser {

    private static final Pattern THINK_PATTERN = Pattern.compile("<think>(.*?)</think>",
            Pattern.DOTALL | Pattern.CASE_INSENSITIVE);

    public ParsedResponse parse(String raw) {
        if (raw == null) {
            return new ParsedResponse("", "");
        }

        List<String> narrativeParts = new ArrayList<>();
        List<String> thinkingParts = new ArrayList<>();
        int lastEnd = 0;
        Matcher matcher = THINK_PATTERN.matcher(raw);
        while (matcher.find()) {
            narrativeParts.add(raw.substring(lastEnd, matcher.start()).strip());
            thinkingParts.add(matcher.group(1).strip());
            lastEnd = matcher.end();
        }
        if (thinkingParts.isEmpty()) {
            return new ParsedResponse(raw.strip(), "");
        }
        narrativeParts.add(raw.substring(lastEnd).strip());

        return new ParsedResponse(joinNonEmpty(narrativeParts), joinNonEmpty(thinkingParts));
    }

    private String joinNonEmpty(List<String> parts) {
        return String.join("\n", parts.stream().filter(part -> !part.isEmpty()).toList()).strip();
    }
}
