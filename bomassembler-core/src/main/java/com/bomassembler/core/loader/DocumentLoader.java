package com.bomassembler.core.loader;

import com.bomassembler.core.model.Document;

import java.nio.file.Path;

/**
 * Reads a document from its file representation.
 */
public interface DocumentLoader {

    /**
     * Loads a document.
     *
     * @param path document file
     * @return parsed document
     * @throws BomLoadException if the file is missing, unreadable or malformed
     */
    Document load(Path path);
}
