package com.purchasingpower.forge.chunking;

import com.purchasingpower.forge.model.chunk.SectionSpan;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits markdown at {@code #} to {@code ###} headers, keeping the header stack as a breadcrumb.
 */
@Slf4j
@Component
public class MarkdownSectionSplitter {

    static final String INTRODUCTION = "Introduction";

    private static final Pattern HEADER = Pattern.compile("^(#{1,3})\\s+(.+)$", Pattern.MULTILINE);

    public List<SectionSpan> split(String markdown, String sourceId) {
        List<HeaderMark> headers = new ArrayList<>();
        Matcher matcher = HEADER.matcher(markdown);
        while (matcher.find()) {
            headers.add(new HeaderMark(matcher.start(), matcher.group(1).length(), matcher.group(2).strip()));
        }

        List<SectionSpan> spans = new ArrayList<>();
        if (headers.isEmpty()) {
            String text = markdown.strip();
            if (!text.isEmpty()) {
                spans.add(span(text, List.of(INTRODUCTION), 0, sourceId));
            }
            return spans;
        }

        String preamble = markdown.substring(0, headers.get(0).start()).strip();
        if (!preamble.isEmpty()) {
            spans.add(span(preamble, List.of(INTRODUCTION), 0, sourceId));
        }

        Deque<HeaderMark> stack = new ArrayDeque<>();
        for (int i = 0; i < headers.size(); i++) {
            HeaderMark header = headers.get(i);
            int end = i + 1 < headers.size() ? headers.get(i + 1).start() : markdown.length();
            String text = markdown.substring(header.start(), end).strip();

            while (!stack.isEmpty() && stack.peekLast().level() >= header.level()) {
                stack.removeLast();
            }
            stack.addLast(header);

            List<String> path = new ArrayList<>();
            for (Iterator<HeaderMark> it = stack.iterator(); it.hasNext(); ) {
                path.add(it.next().title());
            }
            spans.add(span(text, List.copyOf(path), header.level(), sourceId));
        }

        log.debug("Split {} into {} header-based spans", sourceId, spans.size());
        return spans;
    }

    static String contextHeader(String sourceId, List<String> headerPath) {
        return "[Source: " + sourceId + " > " + String.join(" > ", headerPath) + "]";
    }

    private static SectionSpan span(String text, List<String> path, int level, String sourceId) {
        return SectionSpan.builder()
                .text(text)
                .headerPath(path)
                .level(level)
                .contextHeader(contextHeader(sourceId, path))
                .build();
    }

    private record HeaderMark(int start, int level, String title) {
    }
}
