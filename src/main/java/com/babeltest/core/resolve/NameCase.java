package com.babeltest.core.resolve;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Case conversions used to map language-neutral target names onto Java members.
 */
public final class NameCase {

    private NameCase() {}

    /** {@code get_by_id} becomes {@code getById}. */
    public static String snakeToCamel(String name) {
        if (name.indexOf('_') < 0) {
            return name;
        }
        var sb = new StringBuilder(name.length());
        boolean upper = false;
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c == '_') {
                upper = sb.length() > 0;
            } else if (upper) {
                sb.append(Character.toUpperCase(c));
                upper = false;
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /** {@code UserService} becomes {@code userService}. */
    public static String lowerCamel(String name) {
        if (name.isEmpty() || Character.isLowerCase(name.charAt(0))) {
            return name;
        }
        int upperRun = 0;
        while (upperRun < name.length() && Character.isUpperCase(name.charAt(upperRun))) {
            upperRun++;
        }
        // "HTTPClient" -> "httpClient", "URL" -> "url"
        int cut = upperRun > 1 && upperRun < name.length() ? upperRun - 1 : upperRun;
        return name.substring(0, cut).toLowerCase(Locale.ROOT) + name.substring(cut);
    }

    /** {@code payment} becomes {@code Payment}. */
    public static String capitalize(String name) {
        String camel = snakeToCamel(name);
        if (camel.isEmpty()) {
            return camel;
        }
        return Character.toUpperCase(camel.charAt(0)) + camel.substring(1);
    }

    /**
     * Candidate Java member names for a target segment, most literal first.
     */
    public static List<String> variants(String name) {
        Set<String> names = new LinkedHashSet<>();
        names.add(name);
        names.add(snakeToCamel(name));
        return List.copyOf(names);
    }
}
