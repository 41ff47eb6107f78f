package com.bomassembler.core.edit;

import com.bomassembler.core.config.Contact;
import com.bomassembler.core.config.HashSpec;
import com.bomassembler.core.util.Strings;

import java.util.ArrayList;
import java.util.List;

/**
 * Configured field values for an edit. A null scalar or an empty list means the field is not
 * configured and will be skipped.
 *
 * @param name component name
 * @param version component version
 * @param supplier component supplier
 * @param authors document authors
 * @param purl package URL
 * @param cpe CPE 2.3 identifier
 * @param licenses license ids or expressions, joined with {@code OR}
 * @param hashes component checksums
 * @param tools additional tool creators
 * @param copyright component copyright text
 * @param lifecycles lifecycle stage names
 * @param description document comment or component description
 * @param repository component download/repository location
 * @param primaryPurpose component primary purpose name
 */
public record EditRequest(
    String name,
    String version,
    Contact supplier,
    List<Contact> authors,
    String purl,
    String cpe,
    List<String> licenses,
    List<HashSpec> hashes,
    List<ToolRef> tools,
    String copyright,
    List<String> lifecycles,
    String description,
    String repository,
    String primaryPurpose
) {
    public EditRequest {
        authors = authors == null ? List.of() : List.copyOf(authors);
        licenses = licenses == null ? List.of() : List.copyOf(licenses);
        hashes = hashes == null ? List.of() : List.copyOf(hashes);
        tools = tools == null ? List.of() : List.copyOf(tools);
        lifecycles = lifecycles == null ? List.of() : List.copyOf(lifecycles);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * An externally configured tool creator.
     *
     * @param name tool name
     * @param version tool version
     */
    public record ToolRef(String name, String version) {

        /**
         * Returns the creator display string {@code name-version}, or just the name when no
         * version is given.
         *
         * @return display string
         */
        public String display() {
            if (Strings.isBlank(version)) {
                return name;
            }
            return name + "-" + version;
        }
    }

    /**
     * Builder for {@link EditRequest}.
     */
    public static final class Builder {
        private String name;
        private String version;
        private Contact supplier;
        private final List<Contact> authors = new ArrayList<>();
        private String purl;
        private String cpe;
        private final List<String> licenses = new ArrayList<>();
        private final List<HashSpec> hashes = new ArrayList<>();
        private final List<ToolRef> tools = new ArrayList<>();
        private String copyright;
        private final List<String> lifecycles = new ArrayList<>();
        private String description;
        private String repository;
        private String primaryPurpose;

        private Builder() {
        }

        public Builder name(String value) {
            this.name = value;
            return this;
        }

        public Builder version(String value) {
            this.version = value;
            return this;
        }

        public Builder supplier(String supplierName, String contact) {
            this.supplier = new Contact(supplierName, contact);
            return this;
        }

        public Builder author(String authorName, String email) {
            this.authors.add(new Contact(authorName, email));
            return this;
        }

        public Builder purl(String value) {
            this.purl = value;
            return this;
        }

        public Builder cpe(String value) {
            this.cpe = value;
            return this;
        }

        public Builder license(String value) {
            this.licenses.add(value);
            return this;
        }

        public Builder hash(String algorithm, String value) {
            this.hashes.add(new HashSpec(algorithm, value));
            return this;
        }

        public Builder tool(String toolName, String toolVersion) {
            this.tools.add(new ToolRef(toolName, toolVersion));
            return this;
        }

        public Builder copyright(String value) {
            this.copyright = value;
            return this;
        }

        public Builder lifecycle(String value) {
            this.lifecycles.add(value);
            return this;
        }

        public Builder description(String value) {
            this.description = value;
            return this;
        }

        public Builder repository(String value) {
            this.repository = value;
            return this;
        }

        public Builder primaryPurpose(String value) {
            this.primaryPurpose = value;
            return this;
        }

        public EditRequest build() {
            return new EditRequest(name, version, supplier, authors, purl, cpe, licenses, hashes,
                tools, copyright, lifecycles, description, repository, primaryPurpose);
        }
    }
}
