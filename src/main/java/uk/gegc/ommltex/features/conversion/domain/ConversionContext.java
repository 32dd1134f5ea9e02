package uk.gegc.ommltex.features.conversion.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable state of one conversion request: LaTeX packages the output needs and
 * warnings about degraded elements. Not shared between requests.
 */
public class ConversionContext {

    private final Map<String, String> packages = new LinkedHashMap<>();
    private final List<String> warnings = new ArrayList<>();

    /**
     * Marks a package as required. Registering the same package again keeps the first options.
     */
    public void requirePackage(String name) {
        requirePackage(name, null);
    }

    public void requirePackage(String name, String options) {
        packages.putIfAbsent(name, options);
    }

    public void addWarning(String message) {
        warnings.add(message);
    }

    public Set<String> getRequiredPackages() {
        return Collections.unmodifiableSet(packages.keySet());
    }

    /**
     * @return one usepackage line per required package, in registration order
     */
    public List<String> usePackageLines() {
        return packages.entrySet().stream()
                .map(entry -> entry.getValue() == null || entry.getValue().isBlank()
                        ? "\\usepackage{" + entry.getKey() + "}"
                        : "\\usepackage[" + entry.getValue() + "]{" + entry.getKey() + "}")
                .toList();
    }

    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
