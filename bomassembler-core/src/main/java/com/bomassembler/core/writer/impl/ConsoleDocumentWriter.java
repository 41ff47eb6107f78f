package com.bomassembler.core.writer.impl;

import com.bomassembler.core.json.BomJson;
import com.bomassembler.core.model.Document;
import com.bomassembler.core.writer.BomWriteException;
import com.bomassembler.core.writer.Destination;
import com.bomassembler.core.writer.DocumentWriter;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Objects;

/**
 * Writer that prints the document to standard output (or another stream supplied by the caller).
 *
 * <p>The stream is flushed but never closed.
 */
public class ConsoleDocumentWriter implements DocumentWriter {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleDocumentWriter.class);

    private final OutputStream out;

    public ConsoleDocumentWriter() {
        this(System.out);
    }

    public ConsoleDocumentWriter(OutputStream out) {
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public long write(Document document, Destination destination) {
        byte[] content;
        try {
            content = BomJson.encode(document);
        } catch (JsonProcessingException e) {
            throw new BomWriteException("Failed to encode document " + document.name(), e);
        }

        try {
            out.write(content);
            out.flush();
            logger.debug("Wrote document {} to stdout ({} bytes)", document.name(), content.length);
            return content.length;
        } catch (IOException e) {
            throw new BomWriteException("Failed to write document to stdout", e);
        }
    }
}
