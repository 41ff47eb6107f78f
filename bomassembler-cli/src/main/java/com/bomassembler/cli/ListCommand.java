package com.bomassembler.cli;

import com.bomassembler.BomAssemblerCLI;
import com.bomassembler.core.edit.SubjectKind;
import com.bomassembler.core.edit.field.FieldHandler;
import com.bomassembler.core.edit.field.FieldHandlers;
import com.bomassembler.core.model.PrimaryPurpose;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.time.Clock;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Command to list editable fields, primary purposes or edit subjects.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Editable fields in application order
 * bomassembler list fields
 *
 * # Accepted --primary-purpose values
 * bomassembler list purposes
 *
 * # Accepted --subject values
 * bomassembler list subjects
 * }</pre>
 */
@Command(
    name = "list",
    description = "List editable fields, primary purposes or edit subjects",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(
        index = "0",
        description = "Type to list: fields, purposes, or subjects"
    )
    private String type;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        int exitCode = switch (type.toLowerCase(Locale.ROOT)) {
            case "fields", "field" -> listFields(out);
            case "purposes", "purpose" -> listPurposes(out);
            case "subjects", "subject" -> listSubjects(out);
            default -> {
                log.error("Unknown type: {}. Use: fields, purposes, or subjects", type);
                yield 1;
            }
        };
        out.flush();
        return exitCode;
    }

    private int listFields(PrintWriter out) {
        out.println("Editable Fields (in application order):");
        out.println();
        for (FieldHandler handler : FieldHandlers.defaults(BomAssemblerCLI.TOOL, Clock.systemUTC())) {
            out.printf("  • %-18s %s%n", handler.name(), handler.scope().name().toLowerCase(Locale.ROOT));
        }
        return 0;
    }

    private int listPurposes(PrintWriter out) {
        out.println("Primary Purposes:");
        out.println();
        for (PrimaryPurpose purpose : PrimaryPurpose.values()) {
            out.println("  • " + purpose.token());
        }
        return 0;
    }

    private int listSubjects(PrintWriter out) {
        out.println("Edit Subjects:");
        out.println();
        for (SubjectKind kind : SubjectKind.values()) {
            out.println("  • " + kind.id());
        }
        return 0;
    }
}
