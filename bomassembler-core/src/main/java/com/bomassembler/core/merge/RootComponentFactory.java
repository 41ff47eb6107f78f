package com.bomassembler.core.merge;

import com.bomassembler.core.config.AssemblyConfig.App;
import com.bomassembler.core.config.AssemblyConfig.LicenseSpec;
import com.bomassembler.core.config.HashSpec;
import com.bomassembler.core.model.Component;
import com.bomassembler.core.model.ExternalReference;
import com.bomassembler.core.model.PrimaryPurpose;
import com.bomassembler.core.model.Supplier;
import com.bomassembler.core.util.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the synthesized root component of a merged document from application metadata.
 */
public class RootComponentFactory {

    private static final Logger log = LoggerFactory.getLogger(RootComponentFactory.class);

    /** Sentinel for values no claim is made about. */
    public static final String NOASSERTION = "NOASSERTION";

    /**
     * Creates the root component.
     *
     * @param app application metadata
     * @param id identifier of the root component
     * @return root component
     */
    public Component create(App app, String id) {
        Supplier supplier = app.supplier() != null && !app.supplier().blank()
            ? Supplier.organization(app.supplier().display())
            : Supplier.NOASSERTION;

        String[] licenses = licenses(app.license());

        String copyright = Strings.isEmpty(app.copyright()) ? NOASSERTION : app.copyright();

        return new Component(
            id,
            app.name(),
            app.version(),
            supplier,
            NOASSERTION,
            false,
            HashSpec.toChecksums(app.checksums()),
            licenses[0],
            licenses[1],
            copyright,
            app.description(),
            externalReferences(app),
            primaryPurpose(app.primaryPurpose())
        );
    }

    /**
     * Resolves concluded and declared license. An expression wins over an id, but a bare
     * expression without an id is not asserted at all.
     *
     * @return {@code [concluded, declared]}
     */
    private static String[] licenses(LicenseSpec license) {
        if (license == null) {
            return new String[] {null, null};
        }
        boolean hasId = !Strings.isEmpty(license.id());
        boolean hasExpression = !Strings.isEmpty(license.expression());
        if (hasExpression && !hasId) {
            return new String[] {NOASSERTION, NOASSERTION};
        }
        String value = hasExpression ? license.expression() : license.id();
        return new String[] {value, value};
    }

    private static List<ExternalReference> externalReferences(App app) {
        List<ExternalReference> refs = new ArrayList<>();
        if (!Strings.isEmpty(app.purl())) {
            refs.add(ExternalReference.purl(app.purl()));
        }
        if (!Strings.isEmpty(app.cpe())) {
            refs.add(ExternalReference.cpe(app.cpe()));
        }
        return refs;
    }

    private static PrimaryPurpose primaryPurpose(String value) {
        if (Strings.isEmpty(value)) {
            return null;
        }
        return PrimaryPurpose.lookup(value).orElseGet(() -> {
            log.warn("Unknown primary purpose '{}' for root component; leaving it unset", value);
            return null;
        });
    }
}
