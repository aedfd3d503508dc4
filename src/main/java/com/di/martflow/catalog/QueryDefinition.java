package com.di.martflow.catalog;

/**
 * One named statement of the catalog.
 *
 * @param name          unique identifier from the marker line
 * @param statementText block text exactly as it appears in the document, line terminators included
 * @param sourceOrder   0-based position in the document
 * @param lineNumber    1-based line of the marker
 */
public record QueryDefinition(String name, String statementText, int sourceOrder, int lineNumber) {

    public boolean isBlank() {
        return statementText == null || statementText.isBlank();
    }
}
