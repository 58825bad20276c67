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

package me.golemcore.research.domain.model;

/**
 * Size bound for text handed to the model. Truncated text ends with
 * {@link #MARKER}; truncating already-truncated text is a no-op.
 */
public final class TextTruncator {

    public static final String MARKER = "... [truncated]";

    private TextTruncator() {
    }

    public static boolean needsTruncation(String text, int maxChars) {
        return text != null && text.length() > maxChars && !isTruncated(text, maxChars);
    }

    public static String truncate(String text, int maxChars) {
        if (!needsTruncation(text, maxChars)) {
            return text;
        }
        return text.substring(0, Math.max(0, maxChars)) + MARKER;
    }

    private static boolean isTruncated(String text, int maxChars) {
        return text.endsWith(MARKER) && text.length() - MARKER.length() <= maxChars;
    }
}
