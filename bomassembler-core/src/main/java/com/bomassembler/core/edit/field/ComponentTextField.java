package com.bomassembler.core.edit.field;

import com.bomassembler.core.edit.EditPolicy;
import com.bomassembler.core.edit.EditRequest;
import com.bomassembler.core.edit.EditSubject;
import com.bomassembler.core.edit.FieldOutcome;
import com.bomassembler.core.model.Component;
import com.bomassembler.core.util.Strings;

import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * A plain text attribute of a component (name, version, copyright, repository).
 */
public class ComponentTextField extends AbstractFieldHandler {

    private final Function<EditRequest, String> configured;
    private final Function<Component, String> getter;
    private final BiFunction<Component, String, Component> setter;

    public ComponentTextField(String name,
                              Function<EditRequest, String> configured,
                              Function<Component, String> getter,
                              BiFunction<Component, String, Component> setter) {
        super(name, FieldScope.COMPONENT);
        this.configured = configured;
        this.getter = getter;
        this.setter = setter;
    }

    public static ComponentTextField forName() {
        return new ComponentTextField("name", EditRequest::name, Component::name, Component::withName);
    }

    public static ComponentTextField forVersion() {
        return new ComponentTextField("version", EditRequest::version, Component::version, Component::withVersion);
    }

    public static ComponentTextField forCopyright() {
        return new ComponentTextField("copyright", EditRequest::copyright, Component::copyright,
            Component::withCopyright);
    }

    public static ComponentTextField forRepository() {
        return new ComponentTextField("repository", EditRequest::repository, Component::downloadLocation,
            Component::withDownloadLocation);
    }

    @Override
    protected boolean isConfigured(EditRequest request) {
        return !Strings.isEmpty(configured.apply(request));
    }

    @Override
    protected FieldOutcome update(EditSubject subject, EditPolicy policy, EditRequest request) {
        String value = configured.apply(request);
        subject.updateComponent(c -> setter.apply(c, policy.scalar(getter.apply(c), value)));
        return FieldOutcome.APPLIED;
    }
}
