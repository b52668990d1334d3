package me.fablestack.mechanics.domain.service;

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

import me.fablestack.mechanics.domain.exception.MechanicsValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Strips inline control tags such as {@code <<SPEAKER:Mara>>} from a stream of
 * narration chunks.
 *
 * <p>
 * Text is released as soon as it cannot be part of a tag. When the buffer ends
 * inside an unclosed tag, or with a partial opening delimiter, that tail is
 * held until the next chunk decides it. The maximum tag length counts both
 * delimiters; an opener whose tag would exceed it, or that is followed by
 * another opener before closing, is released verbatim so a stray delimiter
 * cannot stall the stream.
 *
 * <p>
 * One instance per turn; not thread-safe.
 */
public class NarrationTagFilter {

    private static final String SPEAKER_PREFIX = "SPEAKER:";

    private final String tagOpen;
    private final String tagClose;
    private final int maxTagLength;

    private final StringBuilder buffer = new StringBuilder();
    private final StringBuilder released = new StringBuilder();
    private final List<String> tags = new ArrayList<>();

    public NarrationTagFilter(String tagOpen, String tagClose, int maxTagLength) {
        if (tagOpen == null || tagOpen.isEmpty() || tagClose == null || tagClose.isEmpty()) {
            throw new MechanicsValidationException("Tag delimiters must not be empty");
        }
        this.tagOpen = tagOpen;
        this.tagClose = tagClose;
        this.maxTagLength = Math.max(tagOpen.length() + tagClose.length(), maxTagLength);
    }

    /**
     * Feeds one chunk and returns the text that is safe to emit now, possibly
     * empty.
     */
    public String accept(String chunk) {
        if (chunk != null) {
            buffer.append(chunk);
        }
        return drain();
    }

    /**
     * Ends the stream: complete tags are still stripped, anything left over is
     * released as-is.
     */
    public String finish() {
        StringBuilder out = new StringBuilder(drain());
        out.append(buffer);
        released.append(buffer);
        buffer.setLength(0);
        return out.toString();
    }

    public String getText() {
        return released.toString();
    }

    public List<String> getTags() {
        return Collections.unmodifiableList(tags);
    }

    /**
     * Names from {@code SPEAKER:} tags, in order of appearance.
     */
    public List<String> getSpeakers() {
        return tags.stream()
                .filter(tag -> tag.regionMatches(true, 0, SPEAKER_PREFIX, 0, SPEAKER_PREFIX.length()))
                .map(tag -> tag.substring(SPEAKER_PREFIX.length()).trim())
                .filter(name -> !name.isEmpty())
                .distinct()
                .toList();
    }

    private String drain() {
        StringBuilder out = new StringBuilder();
        while (buffer.length() > 0) {
            int open = buffer.indexOf(tagOpen);
            if (open < 0) {
                int hold = partialOpenLength();
                out.append(buffer, 0, buffer.length() - hold);
                buffer.delete(0, buffer.length() - hold);
                break;
            }

            out.append(buffer, 0, open);
            buffer.delete(0, open);

            int close = buffer.indexOf(tagClose, tagOpen.length());
            int next = buffer.indexOf(tagOpen, tagOpen.length());
            boolean closedInTime = close >= 0 && close + tagClose.length() <= maxTagLength;
            if (closedInTime && (next < 0 || close < next)) {
                tags.add(buffer.substring(tagOpen.length(), close).trim());
                buffer.delete(0, close + tagClose.length());
                continue;
            }
            if (close < 0 && buffer.length() <= maxTagLength) {
                break;
            }

            // not a tag: give up on this delimiter and rescan after it
            int releaseUpTo = next > 0 ? next : buffer.length() - partialOpenLength(tagOpen.length());
            out.append(buffer, 0, releaseUpTo);
            buffer.delete(0, releaseUpTo);
            if (next < 0) {
                break;
            }
        }
        released.append(out);
        return out.toString();
    }

    private int partialOpenLength() {
        return partialOpenLength(0);
    }

    /**
     * Length of the longest proper prefix of the opening delimiter the buffer
     * ends with, not reaching before {@code from}.
     */
    private int partialOpenLength(int from) {
        int max = Math.min(tagOpen.length() - 1, buffer.length() - from);
        for (int length = max; length > 0; length--) {
            if (buffer.lastIndexOf(tagOpen.substring(0, length)) == buffer.length() - length) {
                return length;
            }
        }
        return 0;
    }
}
