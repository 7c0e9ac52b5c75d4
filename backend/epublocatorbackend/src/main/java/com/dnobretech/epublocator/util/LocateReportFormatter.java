package com.dnobretech.epublocator.util;

import com.dnobretech.epublocator.dto.LocateResult;
import com.dnobretech.epublocator.dto.StructuralAddress;
import org.springframework.stereotype.Component;

/**
 * Relatório texto de um resultado, no layout da ferramenta de linha de comando:
 * "Spine index" é posição-do-spine-no-OPF / índice-no-spine.
 */
@Component
public class LocateReportFormatter {

    public static final String NOT_FOUND = "Query not found.";

    public String format(LocateResult result) {
        if (!result.found()) return NOT_FOUND + "\n";
        StructuralAddress a = result.address();
        StringBuilder sb = new StringBuilder();
        sb.append("Matching file: ").append(a.matchedFile()).append('\n');
        sb.append("Spine index: ").append(result.spineXmlPosition().ordinal()).append('/').append(a.spineIndex()).append('\n');
        sb.append("File index: ").append(a.indexPathText()).append('\n');
        sb.append("Element path: ").append(a.elementPathText()).append('\n');
        sb.append("Match start: ").append(a.matchStart()).append('\n');
        sb.append("Match end: ").append(a.matchEnd()).append('\n');
        return sb.toString();
    }
}
