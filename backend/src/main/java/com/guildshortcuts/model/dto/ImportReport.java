package com.guildshortcuts.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Outcome of a CSV import. {@code errors} holds at most the first ten row
 * failures; {@code moreErrors} counts the ones left out.
 */
@Data
@Builder
@AllArgsConstructor
public class ImportReport {
    private int imported;
    private int skipped;
    private boolean headerDetected;
    private List<String> errors;
    private int moreErrors;

    public String getSummary() {
        StringBuilder sb = new StringBuilder()
                .append("Imported ").append(imported).append(" shortcuts, skipped ").append(skipped).append('.');
        if (errors != null && !errors.isEmpty()) {
            sb.append('\n').append(String.join("\n", errors));
            if (moreErrors > 0) {
                sb.append("\n+").append(moreErrors).append(" more");
            }
        }
        return sb.toString();
    }
}
