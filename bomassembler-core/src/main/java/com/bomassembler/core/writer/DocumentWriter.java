package com.bomassembler.core.writer;

import com.bomassembler.core.model.Document;
import com.bomassembler.core.writer.impl.ConsoleDocumentWriter;
import com.bomassembler.core.writer.impl.FileDocumentWriter;

/**
 * Writes a finished document to its destination as one formatted JSON blob.
 *
 * <p>Implementations encode the whole document first and then issue a single write, so nothing is
 * written when encoding fails.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * Destination destination = Destination.fromFileName(config.output().file());
 * DocumentWriter.forDestination(destination).write(document, destination);
 * }</pre>
 */
public interface DocumentWriter {

    /**
     * Returns unique identifier for this writer (e.g. {@code file}, {@code console}).
     *
     * @return writer identifier
     */
    String getId();

    /**
     * Writes the document.
     *
     * @param document finished document
     * @param destination target destination
     * @return number of bytes written
     * @throws BomWriteException if encoding or writing fails
     */
    long write(Document document, Destination destination);

    /**
     * Picks the writer for a destination.
     *
     * @param destination target destination
     * @return console writer for standard output, file writer otherwise
     */
    static DocumentWriter forDestination(Destination destination) {
        return destination.isStandardOutput() ? new ConsoleDocumentWriter() : new FileDocumentWriter();
    }
}
