package com.orgchart.resolution.bulk;

import java.io.InputStream;
import java.io.Reader;

/**
 * Reads a snapshot of entity records from an external format.
 * Invalid records are skipped and reported; reading never throws for bad data.
 */
public interface EntityRecordImporter {

    /**
     * Imports records from an input stream.
     *
     * @param input    the input stream, read as UTF-8
     * @param callback optional progress callback
     * @return the import result
     */
    ImportResult importRecords(InputStream input, ProgressCallback callback);

    /**
     * Imports records from a reader.
     *
     * @param reader   the reader to read from
     * @param callback optional progress callback
     * @return the import result
     */
    ImportResult importRecords(Reader reader, ProgressCallback callback);

    /**
     * Returns the format supported by this importer (e.g. "json").
     */
    String getFormat();
}
