package com.bomassembler.core.merge;

import com.bomassembler.core.model.Component;

/**
 * Produces an independent deep copy of a component, sharing no mutable state with the source.
 */
@FunctionalInterface
public interface ComponentCopier {

    /**
     * Copies a component.
     *
     * @param component source component
     * @return deep copy
     * @throws ComponentCopyException if the component cannot be copied
     */
    Component copy(Component component) throws ComponentCopyException;
}
