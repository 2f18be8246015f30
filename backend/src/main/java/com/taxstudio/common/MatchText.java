package com.taxstudio.common;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Normalisation helpers shared by the matching strategies: tokens, email/web domains, IBANs.
 */
public final class MatchText {

    /** Receipt/invoice keywords (English and German). */
    public static final List<String> RECEIPT_KEYWORDS = List.of(
            "invoice", "rechnung", "receipt", "beleg", "quittung", "faktura", "bill");

    private static final Pattern NON_ALNUM = Pattern.compile("[^a-z0-9]+");
    private static final Pattern EMAIL_DOMAIN = Pattern.compile("@([a-z0-9.-]+\\.[a-z]{2,})");
    private static final Pattern BANK_PREFIX = Pattern.compile(
            "^(pp\\*|sq\\*|paypal\\s*\\*|ec\\s+|sepa\\s+|lastschrift\\s+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern LEGAL_SUFFIX = Pattern.compile(
            "\\s+(gmbh|ag|inc|llc|ltd|bv|nv|ug|marketplace|lastschrift|gutschrift)\\b.*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern TRAILING_NUMBERS = Pattern.compile("\\s+\\d{4,}.*$");

    private MatchText() {
    }

    /** Lowercase alphanumeric tokens of at least 3 characters, in order, without duplicates. */
    public static List<String> tokens(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        Set<String> out = new LinkedHashSet<>();
        for (String t : NON_ALNUM.split(text.toLowerCase(Locale.ROOT))) {
            if (t.length() >= 3) {
                out.add(t);
            }
        }
        return new ArrayList<>(out);
    }

    public static boolean containsAny(String haystack, Collection<String> needles) {
        if (haystack == null || haystack.isEmpty() || needles == null) {
            return false;
        }
        String h = haystack.toLowerCase(Locale.ROOT);
        return needles.stream().anyMatch(n -> n != null && !n.isEmpty() && h.contains(n.toLowerCase(Locale.ROOT)));
    }

    public static boolean hasReceiptKeyword(String... texts) {
        return Arrays.stream(texts).anyMatch(t -> containsAny(t, RECEIPT_KEYWORDS));
    }

    /** Domain part of an email address, lowercase; null when none. */
    public static String emailDomain(String email) {
        if (email == null) {
            return null;
        }
        Matcher m = EMAIL_DOMAIN.matcher(email.toLowerCase(Locale.ROOT));
        return m.find() ? m.group(1) : null;
    }

    /** Host of a website URL or bare domain without scheme, path and leading "www."; null when blank. */
    public static String websiteHost(String website) {
        if (website == null || website.isBlank()) {
            return null;
        }
        String host = website.trim().toLowerCase(Locale.ROOT).replaceFirst("^[a-z]+://", "");
        int slash = host.indexOf('/');
        if (slash >= 0) {
            host = host.substring(0, slash);
        }
        int colon = host.indexOf(':');
        if (colon >= 0) {
            host = host.substring(0, colon);
        }
        if (host.startsWith("www.")) {
            host = host.substring(4);
        }
        return host.isEmpty() ? null : host;
    }

    /** True when {@code domain} equals one of {@code knownDomains} or is a subdomain of one. */
    public static boolean domainMatches(String domain, Collection<String> knownDomains) {
        if (domain == null || knownDomains == null) {
            return false;
        }
        String d = domain.toLowerCase(Locale.ROOT);
        for (String known : knownDomains) {
            if (known == null || known.isBlank()) {
                continue;
            }
            String k = known.toLowerCase(Locale.ROOT);
            if (d.equals(k) || d.endsWith("." + k)) {
                return true;
            }
        }
        return false;
    }

    /** IBAN without whitespace, uppercase; null when blank. */
    public static String normalizeIban(String iban) {
        if (iban == null) {
            return null;
        }
        String n = iban.replaceAll("\\s+", "").toUpperCase(Locale.ROOT);
        return n.isEmpty() ? null : n;
    }

    /** VAT id without whitespace, dots or dashes, uppercase; null when blank. */
    public static String normalizeVatId(String vatId) {
        if (vatId == null) {
            return null;
        }
        String n = vatId.replaceAll("[\\s.-]+", "").toUpperCase(Locale.ROOT);
        return n.isEmpty() ? null : n;
    }

    /**
     * Strips payment-processor prefixes, legal-form suffixes and trailing reference numbers from a bank
     * statement line to get at the merchant name.
     */
    public static String cleanMerchantName(String text) {
        if (text == null) {
            return "";
        }
        String s = BANK_PREFIX.matcher(text.trim()).replaceFirst("");
        s = s.replaceAll("\\.(com|de|at|ch|eu|net|org|io)(/.*)?$", "");
        s = LEGAL_SUFFIX.matcher(s).replaceFirst("");
        s = TRAILING_NUMBERS.matcher(s).replaceFirst("");
        s = s.replaceAll("([a-zA-Z]{3,})\\d{6,}", "$1");
        return s.replaceAll("\\s+", " ").trim();
    }
}
