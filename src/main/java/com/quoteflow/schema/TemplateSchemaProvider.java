package com.quoteflow.schema;

import java.io.IOException;

public interface TemplateSchemaProvider {
    FieldSchema schemaFor(String variant) throws IOException;
}
