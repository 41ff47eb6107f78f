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
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Writer that stores the document in a file, creating or truncating it.
 *
 * <p>Parent directories are created when missing.
 */
public class FileDocumentWriter implements DocumentWriter {

    private static final Logger logger = LoggerFactory.getLogger(FileDocumentWriter.class);

    @Override
    public String getId() {
        return "file";
    }

    @Override
    public long write(Document document, Destination destination) {
        if (destination.isStandardOutput()) {
            throw new IllegalStateException("File writer needs a file destination");
        }
        Path target = destination.file();

        byte[] content;
        try {
            content = BomJson.encode(document);
        } catch (JsonProcessingException e) {
            throw new BomWriteException("Failed to encode document " + document.name(), e);
        }

        try {
            Path parentDir = target.toAbsolutePath().getParent();
            if (parentDir != null) {
                Files.createDirectories(parentDir);
            }
            Files.write(target, content,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
            logger.info("Wrote document: {} ({} bytes)", target, content.length);
            return content.length;
        } catch (IOException e) {
            throw new BomWriteException("Failed to write file: " + target, e);
        }
    }
}
