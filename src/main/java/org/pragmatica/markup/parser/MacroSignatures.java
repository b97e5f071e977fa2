package org.pragmatica.markup.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Argument signatures of known macros, so their argument groups attach as children at parse time.
 *
 * <p>A signature is a string of argument specifiers:
 * <ul>
 *   <li>{@code s} - optional star</li>
 *   <li>{@code o} - optional {@code [...]} argument</li>
 *   <li>{@code m} - mandatory {@code {...}} argument</li>
 *   <li>{@code v} - mandatory {@code {...}} argument taken verbatim (URLs)</li>
 * </ul>
 * Macros missing from the table take no arguments; any group after them stays a sibling.
 */
public final class MacroSignatures {
    public static final MacroSignatures DEFAULT = defaults();

    private final Map<String, String> signatures;

    private MacroSignatures(Map<String, String> signatures) {
        this.signatures = signatures;
    }

    public static MacroSignatures empty() {
        return new MacroSignatures(Map.of());
    }

    public static MacroSignatures of(Map<String, String> signatures) {
        signatures.values().forEach(MacroSignatures::requireValid);
        return new MacroSignatures(Map.copyOf(signatures));
    }

    public Optional<String> signature(String macro) {
        return Optional.ofNullable(signatures.get(macro));
    }

    public MacroSignatures with(String macro, String signature) {
        requireValid(signature);
        var copy = new LinkedHashMap<>(signatures);
        copy.put(macro, signature);
        return new MacroSignatures(Collections.unmodifiableMap(copy));
    }

    public MacroSignatures without(String macro) {
        var copy = new LinkedHashMap<>(signatures);
        copy.remove(macro);
        return new MacroSignatures(Collections.unmodifiableMap(copy));
    }

    private static void requireValid(String signature) {
        for (int i = 0; i < signature.length(); i++) {
            if ("somv".indexOf(signature.charAt(i)) < 0) {
                throw new IllegalArgumentException("Unknown argument specifier '" + signature.charAt(i) + "' in " + signature);
            }
        }
    }

    private static MacroSignatures defaults() {
        var map = new LinkedHashMap<String, String>();
        for (var sectioning : new String[]{"part", "chapter", "section", "subsection", "subsubsection",
                                           "paragraph", "subparagraph"}) {
            map.put(sectioning, "som");
        }
        for (var styling : new String[]{"emph", "textit", "textbf", "texttt", "textsc", "textsf", "textrm",
                                        "textsl", "textup", "underline", "mbox", "text", "passthrough"}) {
            map.put(styling, "m");
        }
        for (var reference : new String[]{"label", "ref", "eqref", "pageref", "autoref", "cref", "Cref",
                                          "input", "include", "bibliography", "bibliographystyle"}) {
            map.put(reference, "m");
        }
        for (var citation : new String[]{"cite", "citep", "citet", "textcite", "parencite", "autocite",
                                         "citeauthor", "citeyear", "nocite"}) {
            map.put(citation, "soom");
        }
        map.put("caption", "om");
        map.put("footnote", "om");
        map.put("href", "vm");
        map.put("url", "v");
        map.put("includegraphics", "som");
        map.put("usepackage", "om");
        map.put("documentclass", "om");
        map.put("title", "om");
        map.put("author", "m");
        map.put("date", "m");
        map.put("frac", "mm");
        map.put("sqrt", "om");
        map.put("textcolor", "omm");
        map.put("hspace", "sm");
        map.put("vspace", "sm");
        map.put("item", "o");
        return new MacroSignatures(Collections.unmodifiableMap(map));
    }
}
