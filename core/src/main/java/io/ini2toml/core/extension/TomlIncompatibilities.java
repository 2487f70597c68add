package io.ini2toml.core.extension;

import io.ini2toml.core.engine.TranslatorBuilder;
import io.ini2toml.core.model.IrNode;
import io.ini2toml.core.spi.Extension;
import io.ini2toml.core.spi.IntermediateProcessor;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Warns about sections whose tools are known not to read TOML. The check runs first in the
 * intermediate chain of the affected profiles and never changes the document.
 */
public final class TomlIncompatibilities implements Extension {

    private static final Logger LOG = LoggerFactory.getLogger(TomlIncompatibilities.class);

    private static final List<String> FLAKE8_SECTIONS = List.of("flake8", "flake8-rst", "flake8:local-plugins");

    static final Map<String, List<String>> KNOWN_INCOMPATIBILITIES = knownIncompatibilities();

    @Override
    public void activate(TranslatorBuilder translator) {
        KNOWN_INCOMPATIBILITIES.forEach((profile, sections) -> translator
                .profile(profile)
                .prependIntermediate("report-incompatible-sections", new IncompatibleSectionReport(profile, sections)));
    }

    private static Map<String, List<String>> knownIncompatibilities() {
        Map<String, List<String>> known = new LinkedHashMap<>();
        known.put("setup.cfg", concat(FLAKE8_SECTIONS, List.of("devpi:upload")));
        known.put(".flake8", FLAKE8_SECTIONS);
        return Collections.unmodifiableMap(known);
    }

    private static List<String> concat(List<String> a, List<String> b) {
        return Stream.concat(a.stream(), b.stream()).toList();
    }

    /** Logs a warning listing the problematic sections present in the document. */
    static final class IncompatibleSectionReport implements IntermediateProcessor {

        private final String profile;
        private final List<String> sections;

        IncompatibleSectionReport(String profile, List<String> sections) {
            this.profile = profile;
            this.sections = List.copyOf(sections);
        }

        @Override
        public IrNode apply(IrNode document) {
            List<String> present = sections.stream().filter(document::containsKey).toList();
            if (!present.isEmpty()) {
                LOG.warn(
                        "Sections {} ('{}') may be problematic: the relevant tools might not support TOML, "
                                + "or no extension handles this kind of configuration. "
                                + "Review the generated output and remove these sections if necessary.",
                        present.stream().map(s -> "'" + s + "'").collect(Collectors.joining(", ")),
                        profile);
            }
            return document;
        }
    }
}
