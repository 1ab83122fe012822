package com.vidnyan.dokita.domain.finding;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Catalogue of stable check codes.
 * A code is "gated" when configuration may switch it off; ungated codes report
 * structural problems that are always surfaced.
 */
public enum CheckCode {
    // Source patterns
    CODE001("CODE001", true),
    CODE002("CODE002", true),
    CODE003("CODE003", true),
    CODE004("CODE004", true),
    IO001("IO001", true),

    // Manifest metadata
    MD001("MD001", true),
    MD002("MD002", true),
    MD003("MD003", true),
    MD004("MD004", true),
    MD005("MD005", false),

    // Dependencies
    DP001("DP001", true),
    DP002("DP002", true),
    DP003("DP003", true),
    API001("API001", true),

    // Edition
    ED001("ED001", true),
    ED002("ED002", true),

    // Project layout
    STRUCT001("STRUCT001", false),
    STRUCT002("STRUCT002", true),
    STRUCT003("STRUCT003", true),
    LINT001("LINT001", true),

    // Security audit
    SEC001("SEC001", true),
    AUD001("AUD001", true),
    AUD002("AUD002", true),
    AUD003("AUD003", true),
    AUD004("AUD004", true),
    AUD005("AUD005", true),

    // Configuration
    CFG001("CFG001", false);

    private static final Map<String, CheckCode> BY_CODE = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(CheckCode::code, Function.identity()));

    private final String code;
    private final boolean gated;

    CheckCode(String code, boolean gated) {
        this.code = code;
        this.gated = gated;
    }

    public String code() {
        return code;
    }

    public boolean isGated() {
        return gated;
    }

    /**
     * Codes outside the catalogue (e.g. from custom rule files) are always gated.
     */
    public static boolean isGated(String code) {
        CheckCode known = BY_CODE.get(code);
        return known == null || known.gated;
    }
}
