package com.bomassembler.core.edit.field;

import com.bomassembler.core.config.ToolIdentity;
import com.bomassembler.core.edit.EditPolicy;
import com.bomassembler.core.edit.EditRequest;
import com.bomassembler.core.edit.EditSubject;
import com.bomassembler.core.edit.FieldOutcome;
import com.bomassembler.core.model.Creator;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Tool creators of the document.
 *
 * <p>The running tool always stamps itself: stale entries carrying its name are removed and one
 * current entry is added last. Configured tools are added unless a creator with the same display
 * string already exists. A configured tool carrying this tool's name replaces the default
 * self-entry.
 */
public class ToolsField extends AbstractFieldHandler {

    private final ToolIdentity tool;

    public ToolsField(ToolIdentity tool) {
        super("tools", FieldScope.ALWAYS);
        this.tool = Objects.requireNonNull(tool, "tool must not be null");
    }

    @Override
    protected boolean isConfigured(EditRequest request) {
        return true;
    }

    @Override
    protected FieldOutcome update(EditSubject subject, EditPolicy policy, EditRequest request) {
        List<Creator> configured = request.tools().stream()
            .map(EditRequest.ToolRef::display)
            .map(Creator::tool)
            .toList();

        Optional<Creator> explicitSelf = configured.stream().filter(tool::isSelf).findFirst();
        Creator self = explicitSelf.orElseGet(tool::creator);

        subject.updateCreationInfo(info -> {
            List<Creator> creators = new ArrayList<>();
            if (info.creators() != null) {
                info.creators().stream().filter(c -> !tool.isSelf(c)).forEach(creators::add);
            }
            // Every policy deduplicates tools by display string.
            configured.stream()
                .filter(c -> !tool.isSelf(c))
                .forEach(c -> addIfAbsent(creators, c));
            creators.add(self);
            return info.withCreators(creators);
        });

        log.debug("Stamped tool creator {}", self.spdxValue());
        return FieldOutcome.APPLIED;
    }

    private static void addIfAbsent(List<Creator> creators, Creator candidate) {
        boolean present = creators.stream().anyMatch(c -> c.name().equals(candidate.name()));
        if (!present) {
            creators.add(candidate);
        }
    }
}
