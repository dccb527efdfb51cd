package com.quoteflow.source;

import java.io.IOException;

/**
 * Turns a document handle into its text and structured line items. Text and table extraction
 * from PDFs happens upstream of this interface.
 */
public interface SourceTextProvider {
    SourceDocument load(String documentHandle) throws IOException;
}
