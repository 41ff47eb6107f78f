package com.bomassembler.core.config;

import com.bomassembler.core.model.Creator;
import com.bomassembler.core.model.CreatorType;

import java.util.Objects;

/**
 * Identity of the running tool, stamped into every document it writes.
 *
 * @param name tool name, also the prefix used to recognize earlier self-entries
 * @param version tool version
 */
public record ToolIdentity(String name, String version) {

    public ToolIdentity {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(version, "version must not be null");
    }

    /**
     * Returns the display string {@code name-version}.
     *
     * @return display string
     */
    public String displayName() {
        return name + "-" + version;
    }

    /**
     * Returns this tool as a Tool-typed creator.
     *
     * @return creator entry
     */
    public Creator creator() {
        return Creator.tool(displayName());
    }

    /**
     * Checks whether a creator is a (possibly stale) entry written by this tool.
     *
     * @param creator creator to check
     * @return true for Tool creators whose display starts with the tool name
     */
    public boolean isSelf(Creator creator) {
        return creator.type() == CreatorType.TOOL && creator.name().startsWith(name);
    }
}
