package com.demo.churn.service.batch;

import com.demo.churn.model.CustomerRecord;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads a customer CSV (header row with the record field names, {@code ;} or {@code ,}
 * separated) into records through {@link CustomerRowMapper}. A row with more cells than the
 * header is kept and flagged, so the validator reports it against the right row.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CsvCustomerReader {

    private final CustomerRowMapper rows;

    // rows are read as plain arrays, so a row longer or shorter than the header never fails the file
    private final CsvMapper mapper = CsvMapper.builder()
            .enable(CsvParser.Feature.WRAP_AS_ARRAY)
            .enable(CsvParser.Feature.TRIM_SPACES)
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .build();

    public List<CustomerRecord> read(InputStream in) throws IOException {
        String text = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        if (text.startsWith("\uFEFF")) text = text.substring(1);
        if (text.isBlank()) return List.of();

        char separator = detectSeparator(text);
        CsvSchema schema = CsvSchema.emptySchema().withColumnSeparator(separator);
        List<CustomerRecord> out = new ArrayList<>();
        try (MappingIterator<String[]> it = mapper.readerFor(String[].class).with(schema).readValues(text)) {
            if (!it.hasNext()) return List.of();
            String[] header = it.next();
            for (int i = 0; i < header.length; i++) header[i] = header[i].trim().toLowerCase(Locale.ROOT);
            while (it.hasNext()) {
                out.add(toRecord(header, it.next(), separator));
            }
        }
        log.debug("Read {} customer rows (separator '{}')", out.size(), separator);
        return out;
    }

    static char detectSeparator(String text) {
        int eol = text.indexOf('\n');
        String header = eol < 0 ? text : text.substring(0, eol);
        long semicolons = header.chars().filter(c -> c == ';').count();
        long commas = header.chars().filter(c -> c == ',').count();
        return semicolons >= commas && semicolons > 0 ? ';' : ',';
    }

    private CustomerRecord toRecord(String[] header, String[] cells, char separator) {
        Map<String, String> row = new HashMap<>();
        for (int i = 0; i < Math.min(header.length, cells.length); i++) row.put(header[i], cells[i]);
        // decimal comma is common in ';' separated files
        CustomerRecord record = rows.fromCells(row, separator == ';');
        if (cells.length > header.length) {
            return record.toBuilder()
                    .unparsed(CustomerRowMapper.ROW_FIELD, cells.length + " cells for " + header.length + " columns")
                    .build();
        }
        return record;
    }
}
