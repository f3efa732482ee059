package com.trucksafe.elp.service;

import com.trucksafe.elp.config.ElpAggregatorProperties;
import com.trucksafe.elp.model.ViolationRow;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Decides whether a violation row is an English Language Proficiency citation,
 * 49 CFR 391.11(b)(2), and whether it put the driver out of service.
 *
 * The section has been recorded as 11(b)(2), 11B2, 11B2-S, 11B2-Q, 11B2-Z and
 * more over the years. After case-folding and dropping everything that is not
 * a letter or digit, all of these read "11B2" optionally followed by letters.
 * "11B20" or "11B3" are different sections.
 */
@Component
public class ViolationClassifier {

    private static final Set<String> TRUTHY = Set.of("true", "t", "y", "yes", "1");
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^A-Z0-9]");

    private final String part;
    private final Pattern sectionPattern;
    private final boolean matchDescriptionKeywords;

    @Autowired
    public ViolationClassifier(ElpAggregatorProperties properties) {
        this(properties.getClassification().getPart(),
                properties.getClassification().getSection(),
                properties.getClassification().isMatchDescriptionKeywords());
    }

    ViolationClassifier(String part, String section, boolean matchDescriptionKeywords) {
        this.part = canonical(part);
        this.sectionPattern = Pattern.compile(Pattern.quote(canonical(section)) + "[A-Z]*");
        this.matchDescriptionKeywords = matchDescriptionKeywords;
    }

    public boolean isTargetCategory(ViolationRow row) {
        if (row == null) return false;

        String rowPart = canonical(row.getPartNumber());
        String rowSection = canonical(row.getSection());
        if (!rowPart.isEmpty() && rowPart.equals(part) && sectionPattern.matcher(rowSection).matches()) {
            return true;
        }
        return matchDescriptionKeywords && mentionsLanguage(row.getDescription());
    }

    public boolean isOutOfService(ViolationRow row) {
        if (row == null || row.getRawOosIndicator() == null) return false;
        return TRUTHY.contains(row.getRawOosIndicator().trim().toLowerCase(Locale.ROOT));
    }

    private static boolean mentionsLanguage(String description) {
        if (description == null) return false;
        String lower = description.toLowerCase(Locale.ROOT);
        return lower.contains("english") || lower.contains("language");
    }

    /** Upper case, letters and digits only; "" for null. */
    static String canonical(String text) {
        if (text == null) return "";
        return NON_ALPHANUMERIC.matcher(text.toUpperCase(Locale.ROOT)).replaceAll("");
    }
}
