package com.flagship.transaction_ledger.config;

import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Jackson configuration for CSV reading and writing.
 *
 * Key features:
 * - whitespace around headers and values is trimmed
 * - blank lines are skipped
 */
@Configuration
public class CsvConfig {

    @Bean
    public CsvMapper csvMapper() {
        return CsvMapper.builder()
                .enable(CsvParser.Feature.TRIM_SPACES)
                .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
                .build();
    }
}
