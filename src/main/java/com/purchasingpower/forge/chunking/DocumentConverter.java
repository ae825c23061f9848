package com.purchasingpower.forge.chunking;

import com.purchasingpower.forge.exception.DocumentConversionException;
import com.purchasingpower.forge.model.CallContext;
import com.purchasingpower.forge.model.ServiceType;
import com.purchasingpower.forge.util.ExternalCallLogger;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xwpf.usermodel.IBodyElement;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFStyle;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Converts uploaded documents to markdown.
 *
 * <p>Markdown and plain text pass through. DOCX is read with Apache POI: heading styles become
 * {@code #} to {@code ###}, numbered or bulleted paragraphs become list items and tables become
 * pipe tables. Each failure is raised as {@link DocumentConversionException} for that one document.
 */
@Slf4j
@Component
public class DocumentConverter {

    public String convert(String sourceId, byte[] raw, DocumentFormat format) {
        if (format == null) {
            throw new DocumentConversionException(sourceId, "Unsupported file type: " + sourceId, true);
        }
        return switch (format) {
            case MARKDOWN, TEXT -> new String(raw, StandardCharsets.UTF_8);
            case DOCX -> convertDocx(sourceId, raw);
        };
    }

    private String convertDocx(String sourceId, byte[] raw) {
        CallContext ctx = ExternalCallLogger.startCall(ServiceType.DOCUMENT, "ConvertDocx", log);
        ctx.logRequest("Converting DOCX to markdown", "source", sourceId, "bytes", raw.length);

        try (XWPFDocument document = new XWPFDocument(new ByteArrayInputStream(raw))) {
            List<String> blocks = new ArrayList<>();
            for (IBodyElement element : document.getBodyElements()) {
                if (element instanceof XWPFParagraph paragraph) {
                    String block = paragraphToMarkdown(document, paragraph);
                    if (!block.isBlank()) {
                        blocks.add(block);
                    }
                } else if (element instanceof XWPFTable table) {
                    blocks.add(tableToMarkdown(table));
                }
            }
            String markdown = joinBlocks(blocks);
            ctx.logResponse("Converted", "blocks", blocks.size(), "chars", markdown.length());
            return markdown;
        } catch (IOException | RuntimeException e) {
            ctx.logError("Failed to convert '" + sourceId + "'", e);
            throw new DocumentConversionException(sourceId, "Failed to convert '" + sourceId + "': " + e.getMessage(), e);
        }
    }

    private String paragraphToMarkdown(XWPFDocument document, XWPFParagraph paragraph) {
        String text = paragraph.getText() == null ? "" : paragraph.getText().trim();
        if (text.isEmpty()) {
            return "";
        }
        int headingLevel = headingLevel(document, paragraph.getStyle());
        if (headingLevel > 0) {
            return "#".repeat(headingLevel) + " " + text;
        }
        if (paragraph.getNumID() != null) {
            return "- " + text;
        }
        return text;
    }

    /**
     * Heading 1 to 3 and Title map to markdown levels; anything deeper is flattened to level 3.
     */
    private int headingLevel(XWPFDocument document, String styleId) {
        if (styleId == null) {
            return 0;
        }
        String name = styleId;
        if (document.getStyles() != null) {
            XWPFStyle style = document.getStyles().getStyle(styleId);
            if (style != null && style.getName() != null) {
                name = style.getName();
            }
        }
        String normalized = name.toLowerCase(Locale.ROOT).replace(" ", "");
        if (normalized.equals("title")) {
            return 1;
        }
        if (normalized.startsWith("heading")) {
            String digits = normalized.substring("heading".length());
            try {
                return Math.min(3, Math.max(1, Integer.parseInt(digits)));
            } catch (NumberFormatException e) {
                return 0;
            }
        }
        return 0;
    }

    private String tableToMarkdown(XWPFTable table) {
        StringBuilder sb = new StringBuilder();
        List<XWPFTableRow> rows = table.getRows();
        for (int r = 0; r < rows.size(); r++) {
            List<XWPFTableCell> cells = rows.get(r).getTableCells();
            sb.append('|');
            for (XWPFTableCell cell : cells) {
                sb.append(' ').append(cell.getText().replace('\n', ' ').replace("|", "\\|").trim()).append(" |");
            }
            sb.append('\n');
            if (r == 0) {
                sb.append('|').append(" --- |".repeat(cells.size())).append('\n');
            }
        }
        return sb.toString().trim();
    }

    /**
     * Consecutive list items stay on adjacent lines; everything else is separated by a blank line.
     */
    private String joinBlocks(List<String> blocks) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < blocks.size(); i++) {
            if (i > 0) {
                boolean listRun = blocks.get(i).startsWith("- ") && blocks.get(i - 1).startsWith("- ");
                sb.append(listRun ? "\n" : "\n\n");
            }
            sb.append(blocks.get(i));
        }
        return sb.toString();
    }
}
