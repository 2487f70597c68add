package io.ini2toml.core.extension;

import io.ini2toml.core.engine.Translator;
import io.ini2toml.core.engine.TranslatorBuilder;
import io.ini2toml.core.error.StructuralException;
import io.ini2toml.core.model.IrNode;
import io.ini2toml.core.model.Scalar;
import io.ini2toml.core.model.StructuralValue;
import io.ini2toml.core.spi.Extension;
import io.ini2toml.core.transform.Transformations;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Profile {@code best_effort}: guesses option value conversion from the string format.
 *
 * <ul>
 * <li>single-line values become scalars (numbers, booleans or strings) with their inline
 * comment;</li>
 * <li>multi-line values containing {@code =} become tables, other multi-line values
 * become lists, one group per line; their items stay strings;</li>
 * <li>section names containing {@code .}, {@code :} or {@code \} are split into nested
 * tables, e.g. {@code [flake8:local-plugins]} becomes {@code [flake8.local-plugins]}.</li>
 * </ul>
 */
public final class BestEffort implements Extension {

    private static final Logger LOG = LoggerFactory.getLogger(BestEffort.class);

    static final Pattern SECTION_SPLITTER = Pattern.compile("\\.|:|\\\\");
    static final String KEY_SEP = "=";

    @Override
    public void activate(TranslatorBuilder translator) {
        translator
                .profile(Translator.DEFAULT_PROFILE)
                .description("Guess option value conversion based on the string format")
                .helpText("Converts every option by shape and splits dotted section names into nested tables.")
                .appendIntermediate("best-effort", this::processValues);
    }

    /** Converts the options of every section, then nests sections with compound names. */
    public IrNode processValues(IrNode document) {
        for (String name : document.keys()) {
            if (!(document.get(name) instanceof IrNode section)) {
                continue;
            }
            for (String key : section.keys()) {
                applyBestEffort(section, key);
            }
            if (SECTION_SPLITTER.matcher(name).find()) {
                nest(document, name, section);
            }
        }
        return document;
    }

    void applyBestEffort(IrNode section, String key) {
        if (!(section.get(key) instanceof Scalar scalar) || !scalar.isString()) {
            return;
        }
        String value = scalar.asString();
        if (value.lines().count() > 1) {
            if (value.contains(KEY_SEP)) {
                Transformations.applyTo(section, key, Transformations::splitKvPairs);
            } else {
                Transformations.applyTo(section, key, Transformations::splitList);
            }
        } else {
            Transformations.applyTo(section, key, Transformations::splitScalar);
        }
    }

    /**
     * Moves {@code section} from {@code name} to the nested path obtained by splitting the
     * name. A new top-level parent takes the section's position in the document.
     */
    private static void nest(IrNode document, String name, IrNode section) {
        List<String> path = Arrays.asList(SECTION_SPLITTER.split(name, -1));
        int position = document.indexOf(name);
        document.remove(name);

        IrNode parent = document;
        for (int i = 0; i < path.size() - 1; i++) {
            String key = path.get(i);
            StructuralValue existing = parent.find(key).orElse(null);
            if (existing == null) {
                IrNode created = new IrNode();
                if (parent == document) {
                    parent.insert(Math.min(position, parent.size()), key, created);
                } else {
                    parent.append(key, created);
                }
                parent = created;
            } else if (existing instanceof IrNode node) {
                parent = node;
            } else {
                throw new StructuralException(
                        "Cannot nest section '" + name + "': '" + key + "' already holds a non-table value");
            }
        }
        String last = path.get(path.size() - 1);
        if (parent.containsKey(last)) {
            throw new StructuralException(
                    "Cannot nest section '" + name + "': '" + String.join(".", path) + "' already exists");
        }
        if (parent == document) {
            parent.insert(Math.min(position, parent.size()), last, section);
        } else {
            parent.append(last, section);
        }
        LOG.debug("section.nested name={} path={}", name, path);
    }
}
