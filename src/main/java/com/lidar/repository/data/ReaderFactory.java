package com.lidar.repository.data;

import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Picks the seed reader for a source type
 */
@Component
public class ReaderFactory {

    private final List<SeedRecordReader> readers;

    public ReaderFactory(List<SeedRecordReader> readers) {
        this.readers = readers;
    }

    /**
     * @throws IllegalArgumentException if no reader supports the type
     */
    public SeedRecordReader getReader(SeedSource.SeedSourceType type) {
        return readers.stream()
                .filter(reader -> reader.supports(type))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                    "No reader found for seed source type: " + type));
    }

    public boolean isSupported(SeedSource.SeedSourceType type) {
        return readers.stream().anyMatch(reader -> reader.supports(type));
    }
}
