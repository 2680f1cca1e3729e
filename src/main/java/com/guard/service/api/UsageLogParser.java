package com.guard.service.api;

import com.guard.model.UsageIndex;

import java.nio.file.Path;

public interface UsageLogParser {

    /**
     * Reads a usage log and folds its entries into per-endpoint call counts.
     *
     * @param logFile The log file to read.
     * @return The usage index built from the file.
     * @throws com.guard.exception.LogParseException if the file cannot be read or is malformed.
     */
    UsageIndex parse(Path logFile);
}
