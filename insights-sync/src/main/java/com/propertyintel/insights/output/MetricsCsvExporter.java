package com.propertyintel.insights.output;

import com.opencsv.CSVWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Writes exported metric rows as CSV with a header row.
 *
 * Columns are the base headers followed by any other row keys in first-seen
 * order, so an empty export still gets a header line.
 */
@Component
@Slf4j
public class MetricsCsvExporter {

    public void write(List<String> baseHeaders, List<Map<String, Object>> rows, Writer out) {
        List<String> headers = headers(baseHeaders, rows);
        try (CSVWriter writer = new CSVWriter(
                out,
                CSVWriter.DEFAULT_SEPARATOR,
                CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                CSVWriter.DEFAULT_LINE_END)) {

            writer.writeNext(headers.toArray(new String[0]));
            for (Map<String, Object> row : rows) {
                writer.writeNext(toRow(headers, row));
            }
            log.debug("Exported {} rows as CSV", rows.size());

        } catch (IOException e) {
            log.error("CSV export failed: {}", e.getMessage(), e);
            throw new UncheckedIOException("CSV export failed", e);
        }
    }

    private List<String> headers(List<String> baseHeaders, List<Map<String, Object>> rows) {
        Set<String> headers = new LinkedHashSet<>(baseHeaders);
        rows.forEach(r -> headers.addAll(r.keySet()));
        return new ArrayList<>(headers);
    }

    private String[] toRow(List<String> headers, Map<String, Object> row) {
        String[] values = new String[headers.size()];
        for (int i = 0; i < headers.size(); i++) {
            values[i] = str(row.get(headers.get(i)));
        }
        return values;
    }

    private String str(Object val) {
        return val == null ? "" : val.toString();
    }
}
