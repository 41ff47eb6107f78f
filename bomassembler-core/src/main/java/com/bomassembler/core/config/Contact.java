package com.bomassembler.core.config;

import com.bomassembler.core.util.Strings;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A named party with an optional contact value (supplier, author).
 *
 * @param name party name
 * @param email contact e-mail or URL
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Contact(
    @JsonProperty("name") String name,
    @JsonProperty("email") String email
) {
    /**
     * Returns true when neither name nor e-mail is set.
     *
     * @return whether the contact is blank
     */
    public boolean blank() {
        return Strings.isBlank(name) && Strings.isBlank(email);
    }

    public String display() {
        return Strings.display(name, email);
    }
}
