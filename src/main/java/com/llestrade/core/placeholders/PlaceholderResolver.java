package com.llestrade.core.placeholders;

import com.llestrade.core.errors.FatalConfigurationException;
import com.llestrade.core.model.Project;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Merges system values, project values and per-run overrides into one {@link PlaceholderMap}.
 * <p>
 * Precedence, lowest first: system defaults, project editable values, dynamic per-run values.
 * System keys are reserved; any attempt to redefine one fails the run.
 */
@Component
public class PlaceholderResolver {

    public PlaceholderMap resolve(Project project, Map<String, String> dynamicOverrides) {
        return resolve(project, SystemPlaceholders.Context.forProject(project.name()), dynamicOverrides);
    }

    public PlaceholderMap resolve(Project project, SystemPlaceholders.Context context,
                                  Map<String, String> dynamicOverrides) {
        Map<String, PlaceholderEntry> entries = new LinkedHashMap<>();
        SystemPlaceholders.values(context).forEach((key, value) ->
                entries.put(key, new PlaceholderEntry(key, value, PlaceholderScope.SYSTEM)));

        overlay(entries, project.placeholderValues(), "Project");
        if (dynamicOverrides != null) {
            overlay(entries, dynamicOverrides, "Run");
        }
        return new PlaceholderMap(entries);
    }

    /**
     * Reports which placeholders are missing. A key counts as missing when its value is absent
     * or blank. Required keys are always checked; other keys only when a template uses them.
     *
     * @param map              resolved placeholders
     * @param templateUsedKeys keys referenced by the prompt templates
     * @param requirements     declared keys, mapped to {@code true} when required
     */
    public PlaceholderValidation validate(PlaceholderMap map, Set<String> templateUsedKeys,
                                          Map<String, Boolean> requirements) {
        Set<String> missingRequired = new TreeSet<>();
        Set<String> missingOptional = new TreeSet<>();
        Set<String> required = new TreeSet<>();
        if (requirements != null) {
            requirements.forEach((key, isRequired) -> {
                if (Boolean.TRUE.equals(isRequired)) {
                    required.add(key);
                }
            });
        }
        for (String key : required) {
            if (isMissing(map, key)) {
                missingRequired.add(key);
            }
        }
        for (String key : templateUsedKeys) {
            if (required.contains(key) || SystemPlaceholders.RUNTIME_KEYS.contains(key)) {
                continue;
            }
            if (isMissing(map, key)) {
                missingOptional.add(key);
            }
        }
        return new PlaceholderValidation(new TreeSet<>(missingRequired), new TreeSet<>(missingOptional));
    }

    private static boolean isMissing(PlaceholderMap map, String key) {
        return map.entry(key).map(PlaceholderEntry::isBlank).orElse(true);
    }

    private static void overlay(Map<String, PlaceholderEntry> entries, Map<String, String> values, String origin) {
        values.forEach((key, value) -> {
            if (SystemPlaceholders.isReserved(key)) {
                throw new FatalConfigurationException(
                        origin + " placeholder '" + key + "' collides with a reserved system placeholder");
            }
            entries.put(key, new PlaceholderEntry(key, value == null ? "" : value, PlaceholderScope.EDITABLE));
        });
    }
}
