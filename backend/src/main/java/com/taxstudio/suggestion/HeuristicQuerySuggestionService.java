package com.taxstudio.suggestion;

import com.taxstudio.common.MatchText;
import com.taxstudio.domain.Partner;
import com.taxstudio.domain.Transaction;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Local query generator used when no suggestion service is configured. Ranking, highest first:
 * invoice/reference numbers, partner and counterparty names, aliases, sender domains, IBANs and VAT id,
 * then generic "name rechnung"/"name invoice" fallbacks. Equal scores keep insertion order.
 */
public class HeuristicQuerySuggestionService implements QuerySuggestionService {

    private static final Pattern PREFIXED_NUMBER = Pattern.compile(
            "\\b(inv|re|rg|rech|invoice|rechnung|bill|order|bestellung)[-_]?\\s*#?\\s*(\\d{3,}[-_.\\d]*)",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern YEAR_PREFIXED_NUMBER = Pattern.compile("\\b(20\\d{2})[-/_](\\d{4,})\\b");
    private static final Pattern LONG_NUMBER = Pattern.compile("\\b(\\d{7,})\\b");

    @Override
    public List<String> suggestQueries(Transaction transaction, Partner partner, int maxQueries) {
        Suggestions suggestions = new Suggestions();

        for (String text : new String[]{transaction.getDescription(), transaction.getName(), transaction.getReference()}) {
            for (String number : invoiceNumbers(text)) {
                suggestions.add(number, 100);
            }
        }

        if (partner != null && partner.getName() != null) {
            String cleaned = MatchText.cleanMerchantName(partner.getName());
            suggestions.add(cleaned, 90);
            String first = firstWord(cleaned);
            if (!first.equalsIgnoreCase(cleaned)) {
                suggestions.add(first, 88);
            }
        }
        if (transaction.getPartner() != null) {
            String cleaned = MatchText.cleanMerchantName(transaction.getPartner());
            suggestions.add(cleaned, 85);
            String first = firstWord(cleaned);
            if (first.length() >= 3) {
                suggestions.add(first, 83);
            }
        }
        if (partner != null) {
            for (String alias : partner.getAliases()) {
                if (alias != null && !alias.contains("*")) {
                    suggestions.add(MatchText.cleanMerchantName(alias), 80);
                }
            }
            for (String domain : partner.getEmailDomains()) {
                suggestions.add("from:" + domain, 78);
            }
            String host = MatchText.websiteHost(partner.getWebsite());
            if (host != null) {
                suggestions.add("from:" + host, 75);
            }
            for (String iban : partner.getIbans()) {
                String normalized = MatchText.normalizeIban(iban);
                if (normalized != null) {
                    suggestions.add(normalized, 70);
                }
            }
            if (partner.getVatId() != null) {
                suggestions.add(partner.getVatId(), 68);
            }
        }

        String baseName = partner != null && partner.getName() != null
                ? MatchText.cleanMerchantName(partner.getName())
                : transaction.getPartner() != null ? MatchText.cleanMerchantName(transaction.getPartner()) : null;
        if (baseName != null && !baseName.isEmpty()) {
            suggestions.add(baseName + " rechnung", 55);
            suggestions.add(baseName + " invoice", 52);
        }
        if (transaction.getName() != null && !transaction.getName().equals(transaction.getPartner())) {
            String cleaned = MatchText.cleanMerchantName(transaction.getName());
            String first = firstWord(cleaned);
            if (first.length() >= 3) {
                suggestions.add(first, 50);
            }
            suggestions.add(cleaned, 45);
        }
        return suggestions.top(maxQueries);
    }

    static List<String> invoiceNumbers(String text) {
        List<String> out = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return out;
        }
        Matcher m = PREFIXED_NUMBER.matcher(text);
        while (m.find()) {
            addNumber(out, m.group().replaceAll("[\\s#]+", " ").trim());
        }
        m = YEAR_PREFIXED_NUMBER.matcher(text);
        while (m.find()) {
            addNumber(out, m.group(1) + "-" + m.group(2));
        }
        m = LONG_NUMBER.matcher(text);
        while (m.find()) {
            addNumber(out, m.group(1));
        }
        return out;
    }

    private static void addNumber(List<String> out, String raw) {
        String cleaned = raw.replaceAll("^[-_#\\s]+|[-_#\\s]+$", "");
        if (cleaned.length() >= 4 && out.stream().noneMatch(cleaned::equalsIgnoreCase)) {
            out.add(cleaned);
        }
    }

    private static String firstWord(String cleaned) {
        for (String w : cleaned.split("\\s+")) {
            if (w.length() >= 2) {
                return w;
            }
        }
        return "";
    }

    /** Normalised query to best score; insertion order breaks ties. */
    private static final class Suggestions {

        private final Map<String, Integer> scores = new LinkedHashMap<>();

        void add(String query, int score) {
            if (query == null) {
                return;
            }
            String normalized = query.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
            if (normalized.length() < 2) {
                return;
            }
            scores.merge(normalized, score, Math::max);
        }

        List<String> top(int max) {
            List<String> ordered = new ArrayList<>(scores.keySet());
            // stable sort keeps insertion order for equal scores
            ordered.sort(Comparator.comparing((String q) -> scores.get(q), Comparator.reverseOrder()));
            return new ArrayList<>(ordered.subList(0, Math.min(max, ordered.size())));
        }
    }
}
