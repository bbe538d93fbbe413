package com.citationconstellation;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads compiled {@code .bbl} bibliographies, where each reference is a rendered
 * {@code \bibitem} rather than separate fields.
 */
public final class BblParser {

    // \bibitem[optional label]{key} followed by everything up to the next \bibitem
    private static final Pattern BIBITEM = Pattern.compile(
            "\\\\bibitem(?:\\[[^\\]]*\\])?\\{([^}]+)\\}(.*?)(?=\\\\bibitem|\\z)",
            Pattern.DOTALL
    );

    private static final Pattern COMMAND = Pattern.compile("\\\\[a-zA-Z]+");
    private static final Pattern BRACES = Pattern.compile("[{}]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private BblParser() {
    }

    public static List<BibEntry> parseItems(String content) {
        List<BibEntry> items = new ArrayList<>();
        if (content == null || content.isEmpty()) {
            return items;
        }

        Matcher m = BIBITEM.matcher(content);
        while (m.find()) {
            String key = m.group(1).trim();
            if (key.isEmpty()) {
                continue;
            }
            items.add(BibEntry.ofItem(key, normalize(m.group(2))));
        }
        return items;
    }

    /**
     * Command names become spaces (so {@code \doi{10.1/x}} keeps "10.1/x"), braces are dropped,
     * whitespace collapses and the result is lower-cased.
     */
    static String normalize(String itemText) {
        String text = COMMAND.matcher(itemText).replaceAll(" ");
        text = BRACES.matcher(text).replaceAll("");
        text = WHITESPACE.matcher(text).replaceAll(" ").trim();
        return text.toLowerCase(Locale.ROOT);
    }
}
