package com.bomassembler.core.edit.field;

import com.bomassembler.core.config.ToolIdentity;

import java.time.Clock;
import java.util.List;

/**
 * The ordered field table.
 */
public final class FieldHandlers {

    private FieldHandlers() {
        // Utility class
    }

    /**
     * Creates the standard handlers in application order.
     *
     * @param tool identity of the running tool, stamped by the {@code tools} field
     * @param clock clock read by the {@code timestamp} field
     * @return ordered, immutable handler list
     */
    public static List<FieldHandler> defaults(ToolIdentity tool, Clock clock) {
        return List.of(
            ComponentTextField.forName(),
            ComponentTextField.forVersion(),
            new SupplierField(),
            new AuthorsField(),
            ExternalReferenceField.purl(),
            ExternalReferenceField.cpe(),
            new LicensesField(),
            new HashesField(),
            new ToolsField(tool),
            ComponentTextField.forCopyright(),
            new LifecycleField(),
            new DescriptionField(),
            ComponentTextField.forRepository(),
            new PrimaryPurposeField(),
            new TimestampField(clock)
        );
    }
}
